package com.questrail.bridge.observability;

/**
 * Main interface for receiving bridge transport observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on the caller's thread, the stdout reader thread or the
 * stderr relay thread. Implementations must be thread-safe.</p>
 */
public interface BridgeObservabilitySink {
    /**
     * Called when the bridge process or one of its streams changes state.
     * @param event the transport event
     */
    void onTransportEvent(BridgeTransportObservabilityEvent event);

    /**
     * Called when input from the bridge service is dropped (unmatched,
     * unrecognized or malformed).
     * @param event the protocol event
     */
    void onProtocolEvent(BridgeProtocolObservabilityEvent event);

    /**
     * Called with each non-empty line the bridge service writes to stderr,
     * verbatim.
     * @param line the diagnostic line
     */
    void onStderrLine(String line);

    /**
     * Called when an error occurs in the transport.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
