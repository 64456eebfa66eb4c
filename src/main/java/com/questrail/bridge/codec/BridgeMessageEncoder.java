package com.questrail.bridge.codec;

import com.questrail.bridge.model.BridgeRequest;

/**
 * BridgeMessageEncoder
 * -----------------------------------------------------------------------------
 * Serializes an outbound {@link BridgeRequest} into exactly one line of text.
 *
 * <p>The returned string never contains a line terminator; the transport
 * appends one when writing. Implementations must escape any newline that occurs
 * inside string values so that one request is always one line.</p>
 */
public interface BridgeMessageEncoder
{
    /**
     * @param request the request to serialize
     * @return a single line, without terminator
     * @throws BridgeEncodeException if the request cannot be serialized
     */
    String encode(BridgeRequest request);
}
