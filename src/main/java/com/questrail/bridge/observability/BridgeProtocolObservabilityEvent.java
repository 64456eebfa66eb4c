package com.questrail.bridge.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing input from the bridge service that was dropped rather
 * than delivered to a caller.
 */
public record BridgeProtocolObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        /** A response arrived for an id nobody is waiting on. */
        UNMATCHED_RESPONSE,
        /** A well-formed event with a name the transport does not handle. */
        UNRECOGNIZED_EVENT,
        /** A line that is neither a response nor an event. */
        UNKNOWN_MESSAGE
    }

    public BridgeProtocolObservabilityEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        detail = Objects.requireNonNullElse(detail, "");
    }

    public static BridgeProtocolObservabilityEvent of(Kind kind, String detail) {
        return new BridgeProtocolObservabilityEvent(Instant.now(), kind, detail);
    }
}
