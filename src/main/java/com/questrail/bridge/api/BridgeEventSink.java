package com.questrail.bridge.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * BridgeEventSink
 * -----------------------------------------------------------------------------
 * Receives events the bridge forwards to the UI layer.
 *
 * <p>Called on the stdout reader thread. Implementations must not block for
 * long; a slow sink delays every response behind it. Exceptions thrown by the
 * sink are reported and otherwise ignored.</p>
 */
@FunctionalInterface
public interface BridgeEventSink
{
    /** Sink that discards everything. */
    BridgeEventSink DISCARD = (channel, payload) -> {};

    /**
     * @param channel the UI channel name (e.g. {@code message-stream})
     * @param payload the event payload, forwarded verbatim
     */
    void emit(String channel, JsonNode payload);
}
