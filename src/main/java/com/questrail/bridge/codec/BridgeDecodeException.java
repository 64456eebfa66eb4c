package com.questrail.bridge.codec;

/**
 * Indicates that a line read from the bridge service does not have the shape
 * being decoded.
 *
 * This typically reflects:
 * <ul>
 *   <li>A line that is not a JSON object</li>
 *   <li>A missing or mistyped mandatory field</li>
 *   <li>Trailing content after the JSON value</li>
 * </ul>
 *
 * It never escapes the codec layer; decoders translate it into
 * "this line is not of that shape".
 */
public final class BridgeDecodeException extends RuntimeException
{
    public BridgeDecodeException(String message) {
        super(message);
    }

    public BridgeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
