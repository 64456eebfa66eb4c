package com.questrail.bridge.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a lifecycle change of the bridge process or its streams.
 */
public record BridgeTransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        PROCESS_STARTED,
        READY,
        READY_TIMEOUT,
        STDOUT_CLOSED,
        STDERR_CLOSED,
        SHUTDOWN
    }

    public BridgeTransportObservabilityEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        detail = Objects.requireNonNullElse(detail, "");
    }

    public static BridgeTransportObservabilityEvent of(Kind kind, String detail) {
        return new BridgeTransportObservabilityEvent(Instant.now(), kind, detail);
    }
}
