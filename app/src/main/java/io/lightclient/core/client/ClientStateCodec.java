package io.lightclient.core.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lightclient.core.consensus.TrustLevel;
import io.lightclient.core.protocol.Hex;
import io.lightclient.core.protocol.LightBlockCodec;
import io.lightclient.core.protocol.MerkleRoot;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static io.lightclient.core.protocol.LightBlockCodec.field;
import static io.lightclient.core.protocol.LightBlockCodec.hex;
import static io.lightclient.core.protocol.LightBlockCodec.longValue;
import static io.lightclient.core.protocol.LightBlockCodec.text;

/** JSON encoding of client and consensus states, layered on {@link LightBlockCodec}. */
public final class ClientStateCodec {
    private final LightBlockCodec blocks;
    private final ObjectMapper mapper;

    public ClientStateCodec(LightBlockCodec blocks) {
        if (blocks == null) throw new IllegalArgumentException("light block codec required");
        this.blocks = blocks;
        this.mapper = blocks.mapper();
    }

    public String clientStateToJson(ClientState state) {
        return write(encodeClientState(state));
    }

    public ClientState clientStateFromJson(String json) {
        try {
            return decodeClientState(mapper.readTree(json));
        } catch (JsonProcessingException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed client state json", ex);
        }
    }

    public byte[] consensusStateToBytes(ConsensusState state) {
        return write(encodeConsensusState(state)).getBytes(StandardCharsets.UTF_8);
    }

    public ConsensusState consensusStateFromBytes(byte[] bytes) {
        try {
            return decodeConsensusState(mapper.readTree(bytes));
        } catch (java.io.IOException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed consensus state json", ex);
        }
    }

    public ObjectNode encodeClientState(ClientState state) {
        ObjectNode node = mapper.createObjectNode();
        node.put("chainId", state.chainId());
        node.put("trustLevel", state.trustLevel().toString());
        node.put("trustingPeriod", state.trustingPeriod().toString());
        node.put("unbondingPeriod", state.unbondingPeriod().toString());
        node.put("maxClockDrift", state.maxClockDrift().toString());
        node.put("frozen", state.frozen());
        node.set("latestHeader", blocks.encodeHeader(state.latestHeader()));
        return node;
    }

    public ClientState decodeClientState(JsonNode node) {
        JsonNode frozen = field(node, "frozen");
        if (!frozen.isBoolean()) throw new IllegalArgumentException("field frozen must be a boolean");
        return new ClientState(
                text(node, "chainId"),
                TrustLevel.parse(text(node, "trustLevel")),
                Duration.parse(text(node, "trustingPeriod")),
                Duration.parse(text(node, "unbondingPeriod")),
                Duration.parse(text(node, "maxClockDrift")),
                blocks.decodeHeader(field(node, "latestHeader")),
                frozen.asBoolean());
    }

    public ObjectNode encodeConsensusState(ConsensusState state) {
        ObjectNode node = mapper.createObjectNode();
        node.put("height", state.height());
        node.put("timestamp", state.timestamp().toString());
        node.put("root", state.root().hex());
        node.put("nextValidatorsHash", Hex.encode(state.nextValidatorsHash()));
        return node;
    }

    public ConsensusState decodeConsensusState(JsonNode node) {
        return new ConsensusState(
                longValue(node, "height"),
                Instant.parse(text(node, "timestamp")),
                MerkleRoot.of(hex(node, "root")),
                hex(node, "nextValidatorsHash"));
    }

    private String write(JsonNode node) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON encoding failed", e);
        }
    }
}
