package com.questrail.bridge.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the bridge transport.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
