package com.questrail.bridge.codec;

/**
 * Indicates that an outbound request could not be serialized to a line.
 */
public final class BridgeEncodeException extends RuntimeException
{
    public BridgeEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
