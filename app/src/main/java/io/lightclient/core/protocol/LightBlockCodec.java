package io.lightclient.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of signed headers, validator sets, update headers and light blocks.
 * Byte strings are lowercase hex, instants ISO-8601, public keys hex X.509 plus the JCA
 * algorithm name. Decoding rebuilds values through their constructors, so every
 * invariant is checked again.
 */
public final class LightBlockCodec {
    private final ObjectMapper mapper;

    public LightBlockCodec() {
        this(new ObjectMapper());
    }

    public LightBlockCodec(ObjectMapper mapper) {
        if (mapper == null) throw new IllegalArgumentException("mapper required");
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    // -------------------- string boundary --------------------

    public String headerToJson(Header header) {
        return write(encodeHeader(header));
    }

    public Header headerFromJson(String json) {
        try {
            return decodeHeader(mapper.readTree(json));
        } catch (JsonProcessingException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed header json", ex);
        }
    }

    public String lightBlockToJson(LightBlock block) {
        return write(encodeLightBlock(block));
    }

    public LightBlock lightBlockFromJson(String json) {
        try {
            return decodeLightBlock(mapper.readTree(json));
        } catch (JsonProcessingException | RuntimeException ex) {
            throw new IllegalArgumentException("Malformed light block json", ex);
        }
    }

    // -------------------- tree encoding --------------------

    public ObjectNode encodeHeader(Header header) {
        ObjectNode node = mapper.createObjectNode();
        node.set("signedHeader", encodeSignedHeader(header.signedHeader()));
        node.set("validatorSet", encodeValidatorSet(header.validatorSet()));
        node.set("nextValidatorSet", encodeValidatorSet(header.nextValidatorSet()));
        return node;
    }

    public Header decodeHeader(JsonNode node) {
        return new Header(
                decodeSignedHeader(field(node, "signedHeader")),
                decodeValidatorSet(field(node, "validatorSet")),
                decodeValidatorSet(field(node, "nextValidatorSet")));
    }

    public ObjectNode encodeLightBlock(LightBlock block) {
        ObjectNode node = mapper.createObjectNode();
        node.set("signedHeader", encodeSignedHeader(block.signedHeader()));
        node.set("validatorSet", encodeValidatorSet(block.validatorSet()));
        return node;
    }

    public LightBlock decodeLightBlock(JsonNode node) {
        return new LightBlock(
                decodeSignedHeader(field(node, "signedHeader")),
                decodeValidatorSet(field(node, "validatorSet")));
    }

    public ObjectNode encodeSignedHeader(SignedHeader signed) {
        ObjectNode node = mapper.createObjectNode();
        node.set("header", encodeBlockHeader(signed.header()));
        node.set("commit", encodeCommit(signed.commit()));
        return node;
    }

    public SignedHeader decodeSignedHeader(JsonNode node) {
        return new SignedHeader(decodeBlockHeader(field(node, "header")), decodeCommit(field(node, "commit")));
    }

    public ObjectNode encodeValidatorSet(ValidatorSet set) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode arr = node.putArray("validators");
        for (Validator v : set.validators()) {
            ObjectNode vn = arr.addObject();
            vn.put("address", v.address());
            vn.put("keyAlgorithm", v.publicKey().getAlgorithm());
            vn.put("publicKey", Hex.encode(v.publicKey().getEncoded()));
            vn.put("votingPower", v.votingPower());
        }
        return node;
    }

    public ValidatorSet decodeValidatorSet(JsonNode node) {
        JsonNode arr = field(node, "validators");
        if (!arr.isArray()) throw new IllegalArgumentException("validators must be an array");
        List<Validator> validators = new ArrayList<>(arr.size());
        for (JsonNode vn : arr) {
            PublicKey key = decodePublicKey(text(vn, "keyAlgorithm"), Hex.decode(text(vn, "publicKey")));
            validators.add(new Validator(text(vn, "address"), key, longValue(vn, "votingPower")));
        }
        return new ValidatorSet(validators);
    }

    private ObjectNode encodeBlockHeader(BlockHeader h) {
        ObjectNode node = mapper.createObjectNode();
        node.put("versionBlock", h.versionBlock());
        node.put("versionApp", h.versionApp());
        node.put("chainId", h.chainId());
        node.put("height", h.height());
        node.put("time", h.time().toString());
        node.set("lastBlockId", encodeBlockId(h.lastBlockId()));
        node.put("lastCommitHash", Hex.encode(h.lastCommitHash()));
        node.put("dataHash", Hex.encode(h.dataHash()));
        node.put("validatorsHash", Hex.encode(h.validatorsHash()));
        node.put("nextValidatorsHash", Hex.encode(h.nextValidatorsHash()));
        node.put("consensusHash", Hex.encode(h.consensusHash()));
        node.put("appHash", Hex.encode(h.appHash()));
        node.put("lastResultsHash", Hex.encode(h.lastResultsHash()));
        node.put("evidenceHash", Hex.encode(h.evidenceHash()));
        node.put("proposerAddress", h.proposerAddress());
        return node;
    }

    private BlockHeader decodeBlockHeader(JsonNode node) {
        return BlockHeader.builder()
                .version(longValue(node, "versionBlock"), longValue(node, "versionApp"))
                .chainId(text(node, "chainId"))
                .height(longValue(node, "height"))
                .time(Instant.parse(text(node, "time")))
                .lastBlockId(decodeBlockId(field(node, "lastBlockId")))
                .lastCommitHash(hex(node, "lastCommitHash"))
                .dataHash(hex(node, "dataHash"))
                .validatorsHash(hex(node, "validatorsHash"))
                .nextValidatorsHash(hex(node, "nextValidatorsHash"))
                .consensusHash(hex(node, "consensusHash"))
                .appHash(hex(node, "appHash"))
                .lastResultsHash(hex(node, "lastResultsHash"))
                .evidenceHash(hex(node, "evidenceHash"))
                .proposerAddress(text(node, "proposerAddress"))
                .build();
    }

    private ObjectNode encodeCommit(Commit commit) {
        ObjectNode node = mapper.createObjectNode();
        node.put("height", commit.height());
        node.put("round", commit.round());
        node.set("blockId", encodeBlockId(commit.blockId()));
        ArrayNode sigs = node.putArray("signatures");
        for (CommitSig sig : commit.signatures()) {
            ObjectNode sn = sigs.addObject();
            sn.put("flag", sig.flag().name());
            if (!sig.isAbsent()) {
                sn.put("validatorAddress", sig.validatorAddress());
                sn.put("timestamp", sig.timestamp().toString());
                sn.put("signature", Hex.encode(sig.signature()));
            }
        }
        return node;
    }

    private Commit decodeCommit(JsonNode node) {
        JsonNode sigs = field(node, "signatures");
        if (!sigs.isArray()) throw new IllegalArgumentException("signatures must be an array");
        List<CommitSig> out = new ArrayList<>(sigs.size());
        for (JsonNode sn : sigs) {
            BlockIdFlag flag = BlockIdFlag.valueOf(text(sn, "flag"));
            if (flag == BlockIdFlag.ABSENT) {
                out.add(CommitSig.absent());
            } else {
                out.add(new CommitSig(flag,
                        text(sn, "validatorAddress"),
                        Instant.parse(text(sn, "timestamp")),
                        hex(sn, "signature")));
            }
        }
        return new Commit(longValue(node, "height"), (int) longValue(node, "round"),
                decodeBlockId(field(node, "blockId")), out);
    }

    private ObjectNode encodeBlockId(BlockId id) {
        ObjectNode node = mapper.createObjectNode();
        node.put("hash", Hex.encode(id.hash()));
        node.put("partsTotal", id.partsTotal());
        node.put("partsHash", Hex.encode(id.partsHash()));
        return node;
    }

    private BlockId decodeBlockId(JsonNode node) {
        return new BlockId(hex(node, "hash"), (int) longValue(node, "partsTotal"), hex(node, "partsHash"));
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON encoding failed", e);
        }
    }

    static PublicKey decodePublicKey(String algorithm, byte[] encoded) {
        try {
            return KeyFactory.getInstance(algorithm).generatePublic(new X509EncodedKeySpec(encoded));
        } catch (Exception e) {
            throw new IllegalArgumentException("Bad " + algorithm + " public key", e);
        }
    }

    // -------------------- field helpers --------------------

    public static JsonNode field(JsonNode node, String name) {
        JsonNode v = node == null ? null : node.get(name);
        if (v == null || v.isNull()) throw new IllegalArgumentException("missing field: " + name);
        return v;
    }

    public static String text(JsonNode node, String name) {
        JsonNode v = field(node, name);
        if (!v.isTextual()) throw new IllegalArgumentException("field " + name + " must be a string");
        return v.asText();
    }

    public static long longValue(JsonNode node, String name) {
        JsonNode v = field(node, name);
        if (!v.canConvertToLong() || !v.isIntegralNumber()) {
            throw new IllegalArgumentException("field " + name + " must be an integer");
        }
        return v.asLong();
    }

    public static byte[] hex(JsonNode node, String name) {
        return Hex.decode(text(node, name));
    }
}
