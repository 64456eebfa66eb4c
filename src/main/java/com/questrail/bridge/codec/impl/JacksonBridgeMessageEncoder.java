package com.questrail.bridge.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.bridge.codec.BridgeEncodeException;
import com.questrail.bridge.codec.BridgeMessageEncoder;
import com.questrail.bridge.model.BridgeRequest;

import java.util.Objects;

/**
 * JacksonBridgeMessageEncoder
 * -----------------------------------------------------------------------------
 * {@link BridgeMessageEncoder} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>The mapper must not be configured for pretty printing; compact output is
 * what guarantees one request per line (Jackson escapes control characters
 * inside string values).</p>
 */
public final class JacksonBridgeMessageEncoder implements BridgeMessageEncoder
{
    private final ObjectMapper mapper;

    public JacksonBridgeMessageEncoder()
    {
        this(BridgeObjectMappers.create());
    }

    public JacksonBridgeMessageEncoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String encode(BridgeRequest request)
    {
        Objects.requireNonNull(request, "request");
        try {
            return mapper.writeValueAsString(request);
        }
        catch (JsonProcessingException e) {
            throw new BridgeEncodeException("Failed to encode request " + request.id()
                    + " (" + request.method() + ")", e);
        }
    }
}
