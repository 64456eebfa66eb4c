package com.questrail.bridge.codec;

import com.questrail.bridge.model.BridgeInboundMessage;

import java.util.Optional;

/**
 * BridgeMessageDecoder
 * -----------------------------------------------------------------------------
 * Line-level decoder for messages emitted by the bridge service.
 *
 * <p>The decoder is invoked with exactly one complete line (without its line
 * terminator). It classifies the line structurally:</p>
 * <ol>
 *   <li>as a {@link com.questrail.bridge.model.BridgeResponse} if it has the
 *       response shape; otherwise</li>
 *   <li>as a {@link com.questrail.bridge.model.BridgeEvent} if it has the event
 *       shape; otherwise</li>
 *   <li>not at all.</li>
 * </ol>
 *
 * <p>The response shape always wins. A line that fails the response shape must
 * never be misread as an event unless it independently has the event shape.</p>
 *
 * <p>The decoder is <strong>not</strong> responsible for routing, correlation
 * or logging. Malformed input is reported as {@link Optional#empty()}.</p>
 */
public interface BridgeMessageDecoder
{
    /**
     * @param line one line read from the bridge service's stdout
     * @return the classified message, or {@link Optional#empty()} if the line
     *         matches neither shape
     */
    Optional<BridgeInboundMessage> decode(String line);
}
