package com.questrail.bridge.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * BridgeRequest
 * -----------------------------------------------------------------------------
 * An outbound request line: {@code {"id":..,"method":..,"params":..}}.
 *
 * <p>Created once per call by the transport facade and serialized exactly once.
 * The id is the correlation key the bridge service echoes back in its
 * response.</p>
 */
@JsonPropertyOrder({ "id", "method", "params" })
public record BridgeRequest(
        long id,
        String method,
        JsonNode params
) {
    public BridgeRequest {
        if (id < 1) {
            throw new IllegalArgumentException("id must be positive: " + id);
        }
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");
    }
}
