package com.questrail.bridge.api;

/**
 * The bridge service answered a request with an {@code error}.
 *
 * <p>{@link #getMessage()} is exactly the error string sent by the service.</p>
 */
public final class BridgeRemoteException extends BridgeException
{
    private final long requestId;

    public BridgeRemoteException(long requestId, String remoteError) {
        super(remoteError);
        this.requestId = requestId;
    }

    public long requestId() {
        return requestId;
    }
}
