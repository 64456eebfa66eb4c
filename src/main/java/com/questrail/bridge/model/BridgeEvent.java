package com.questrail.bridge.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * BridgeEvent
 * -----------------------------------------------------------------------------
 * An out-of-band event line {@code {"event":..,"data":..}}. Events carry no id
 * and are never correlated to a request.
 */
public record BridgeEvent(
        String event,
        JsonNode data
) implements BridgeInboundMessage
{
    /** Emitted once by the bridge service when it is ready to accept requests. */
    public static final String READY = "ready";

    /** Incremental provider output, forwarded to the UI. */
    public static final String MESSAGE = "message";

    public BridgeEvent {
        Objects.requireNonNull(event, "event");
        data = Objects.requireNonNullElse(data, NullNode.getInstance());
    }

    public boolean isReady() {
        return READY.equals(event);
    }

    public boolean isMessage() {
        return MESSAGE.equals(event);
    }
}
