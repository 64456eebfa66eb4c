package com.questrail.bridge.commands;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.questrail.bridge.codec.impl.BridgeObjectMappers;

/**
 * Mapper for {@link ProviderEvent#parse}. Providers add fields freely, so
 * unknown properties are ignored. Text fields must be JSON strings: numbers
 * and booleans are not coerced.
 */
final class ProviderEventReader
{
    static final ObjectMapper MAPPER = create();

    private ProviderEventReader() {
    }

    private static ObjectMapper create()
    {
        ObjectMapper mapper = BridgeObjectMappers.create()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return mapper;
    }
}
