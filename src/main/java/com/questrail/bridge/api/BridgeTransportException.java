package com.questrail.bridge.api;

/**
 * Writing a request to the bridge process failed.
 *
 * <p>Treated as equivalent to process death. The pending entry for the request
 * has already been removed when this is raised.</p>
 */
public final class BridgeTransportException extends BridgeException
{
    public BridgeTransportException(String message) {
        super(message);
    }

    public BridgeTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public static BridgeTransportException closedUnexpectedly(Throwable cause) {
        return new BridgeTransportException(message(cause.getMessage()), cause);
    }

    public static BridgeTransportException closedUnexpectedly(String reason) {
        return new BridgeTransportException(message(reason));
    }

    private static String message(String reason) {
        return "Bridge process closed unexpectedly: " + reason
                + ". Please check the bridge service logs and restart the application.";
    }
}
