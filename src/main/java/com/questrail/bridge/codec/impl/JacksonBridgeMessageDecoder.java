package com.questrail.bridge.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.bridge.codec.BridgeDecodeException;
import com.questrail.bridge.codec.BridgeMessageDecoder;
import com.questrail.bridge.model.BridgeEvent;
import com.questrail.bridge.model.BridgeInboundMessage;
import com.questrail.bridge.model.BridgeResponse;

import java.util.Objects;
import java.util.Optional;

/**
 * JacksonBridgeMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link BridgeMessageDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Parse the line as a single JSON value (trailing content rejected)</li>
 *   <li>Require a JSON object</li>
 *   <li>Attempt the response shape</li>
 *   <li>On failure, attempt the event shape</li>
 * </ol>
 *
 * <p><strong>Response shape</strong>: {@code id} is a non-negative integer that
 * fits in 64 bits; {@code error}, when present and not {@code null}, is a
 * string; {@code result} is optional and may be any value.</p>
 *
 * <p><strong>Event shape</strong>: {@code event} is a string and {@code data} is
 * present (any value, {@code null} included).</p>
 *
 * <p>Fields outside these shapes are ignored.</p>
 */
public final class JacksonBridgeMessageDecoder implements BridgeMessageDecoder
{
    private final ObjectMapper mapper;

    public JacksonBridgeMessageDecoder()
    {
        this(BridgeObjectMappers.create());
    }

    public JacksonBridgeMessageDecoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Optional<BridgeInboundMessage> decode(String line)
    {
        Objects.requireNonNull(line, "line");

        final JsonNode root;
        try {
            root = parseObject(line);
        }
        catch (BridgeDecodeException e) {
            return Optional.empty();
        }

        try {
            return Optional.of(decodeResponse(root));
        }
        catch (BridgeDecodeException notAResponse) {
            // fall through to the event shape
        }

        try {
            return Optional.of(decodeEvent(root));
        }
        catch (BridgeDecodeException notAnEvent) {
            return Optional.empty();
        }
    }

    private JsonNode parseObject(String line)
    {
        final JsonNode root;
        try {
            root = mapper.readTree(line);
        }
        catch (JsonProcessingException e) {
            throw new BridgeDecodeException("Not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new BridgeDecodeException("Not a JSON object");
        }
        return root;
    }

    static BridgeResponse decodeResponse(JsonNode root)
    {
        JsonNode id = root.get("id");
        if (id == null || !id.isIntegralNumber() || !id.canConvertToLong() || id.asLong() < 0) {
            throw new BridgeDecodeException("Response requires a non-negative integer id");
        }

        JsonNode error = root.get("error");
        String errorText = null;
        if (error != null && !error.isNull()) {
            if (!error.isTextual()) {
                throw new BridgeDecodeException("Response error must be a string");
            }
            errorText = error.textValue();
        }

        return new BridgeResponse(id.asLong(), root.get("result"), errorText);
    }

    static BridgeEvent decodeEvent(JsonNode root)
    {
        JsonNode event = root.get("event");
        if (event == null || !event.isTextual()) {
            throw new BridgeDecodeException("Event requires a string event name");
        }
        if (!root.has("data")) {
            throw new BridgeDecodeException("Event requires a data field");
        }
        return new BridgeEvent(event.textValue(), root.get("data"));
    }
}
