package com.questrail.bridge.model;

/**
 * Structured form of a single line emitted by the bridge service on stdout.
 *
 * <p>The bridge service only ever emits two shapes: correlated
 * {@link BridgeResponse responses} and uncorrelated {@link BridgeEvent events}.
 * Lines that fit neither shape never become a {@code BridgeInboundMessage}; they
 * are dropped by the decoder.</p>
 */
public sealed interface BridgeInboundMessage
        permits BridgeResponse, BridgeEvent
{
}
