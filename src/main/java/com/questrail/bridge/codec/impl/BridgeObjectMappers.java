package com.questrail.bridge.codec.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Factory for the {@link ObjectMapper} configuration shared by the wire codec.
 */
public final class BridgeObjectMappers
{
    private BridgeObjectMappers() {}

    /**
     * Compact output; trailing tokens after a top-level value are rejected on
     * input so that {@code {"id":1} junk} is not accepted as a message.
     */
    public static ObjectMapper create()
    {
        return new ObjectMapper()
                .disable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }
}
