package com.questrail.bridge.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(BridgeTransportObservabilityEvent event) {}

    @Override
    public void onProtocolEvent(BridgeProtocolObservabilityEvent event) {}

    @Override
    public void onStderrLine(String line) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
