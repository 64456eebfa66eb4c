package com.questrail.bridge.api;

/**
 * A request was attempted while the bridge process is dead or not yet ready.
 *
 * <p>No request id was consumed and nothing was written to the process.</p>
 */
public final class BridgeNotRunningException extends BridgeException
{
    public static final String MESSAGE = "Bridge process is not running. Please restart the application.";

    public BridgeNotRunningException() {
        super(MESSAGE);
    }
}
