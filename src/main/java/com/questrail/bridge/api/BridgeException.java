package com.questrail.bridge.api;

/**
 * Base type for every failure a caller of the bridge can observe.
 *
 * <p>Failures carry a human-readable message only; there are no error codes.
 * The concrete subtype tells the caller which part of the channel failed.</p>
 */
public class BridgeException extends RuntimeException
{
    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
