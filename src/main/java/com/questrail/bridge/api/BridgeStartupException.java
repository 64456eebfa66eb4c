package com.questrail.bridge.api;

/**
 * The bridge service could not be located or started.
 *
 * <p>Raised while the transport is being constructed: the service script was
 * not found, the process failed to spawn, or one of its standard streams was
 * unavailable. A transport whose construction failed is never usable.</p>
 */
public final class BridgeStartupException extends BridgeException
{
    public BridgeStartupException(String message) {
        super(message);
    }

    public BridgeStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
