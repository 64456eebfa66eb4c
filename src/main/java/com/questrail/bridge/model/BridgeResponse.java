package com.questrail.bridge.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;
import java.util.Optional;

/**
 * BridgeResponse
 * -----------------------------------------------------------------------------
 * A response line {@code {"id":..,"result":..,"error":..}} correlated to an
 * earlier request by {@link #id()}.
 *
 * <p>When {@link #error()} is present the response is a failure and
 * {@link #result()} carries no meaning. Otherwise the result is the payload,
 * {@link NullNode} when the service sent none.</p>
 */
public record BridgeResponse(
        long id,
        JsonNode result,
        String error
) implements BridgeInboundMessage
{
    public BridgeResponse {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative: " + id);
        }
        result = Objects.requireNonNullElse(result, NullNode.getInstance());
    }

    public static BridgeResponse success(long id, JsonNode result) {
        return new BridgeResponse(id, result, null);
    }

    public static BridgeResponse failure(long id, String error) {
        return new BridgeResponse(id, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isError() {
        return error != null;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
