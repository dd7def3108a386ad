package io.lightclient.core.p2p;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/** Frame exchanged between {@link HeaderClient} and {@link HeaderServer}. */
public record HeaderMessage(String type, long requestId, long height, JsonNode lightBlock, String error) {
    public static final String GET_LIGHT_BLOCK = "get_light_block";
    public static final String LIGHT_BLOCK = "light_block";
    public static final String NOT_FOUND = "not_found";
    public static final String ERROR = "error";

    public HeaderMessage {
        Objects.requireNonNull(type, "type");
    }

    public static HeaderMessage request(long requestId, long height) {
        return new HeaderMessage(GET_LIGHT_BLOCK, requestId, height, null, null);
    }

    public static HeaderMessage found(long requestId, long height, JsonNode lightBlock) {
        return new HeaderMessage(LIGHT_BLOCK, requestId, height, lightBlock, null);
    }

    public static HeaderMessage notFound(long requestId, long height) {
        return new HeaderMessage(NOT_FOUND, requestId, height, null, null);
    }

    public static HeaderMessage error(long requestId, long height, String error) {
        return new HeaderMessage(ERROR, requestId, height, null, error);
    }
}
