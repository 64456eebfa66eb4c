package com.questrail.bridge.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.model.BridgeRequest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JacksonBridgeMessageEncoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link JacksonBridgeMessageEncoder}.
 */
final class JacksonBridgeMessageEncoderTest
{
    private final JacksonBridgeMessageEncoder encoder = new JacksonBridgeMessageEncoder();

    @Test
    void encodesListProvidersExactly()
    {
        BridgeRequest request = new BridgeRequest(1, "listProviders", JsonNodeFactory.instance.objectNode());

        assertEquals("{\"id\":1,\"method\":\"listProviders\",\"params\":{}}", encoder.encode(request));
    }

    @Test
    void encodedRequestIsASingleLine() throws Exception
    {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("profile", "work");
        params.put("message", "first line\nsecond line\r\n\tend");

        String line = encoder.encode(new BridgeRequest(12, "sendMessage", params));

        assertFalse(line.contains("\n"));
        assertFalse(line.contains("\r"));

        JsonNode parsed = new ObjectMapper().readTree(line);
        assertEquals(12, parsed.get("id").asLong());
        assertEquals("sendMessage", parsed.get("method").asText());
        assertEquals("first line\nsecond line\r\n\tend", parsed.get("params").get("message").asText());
    }

    @Test
    void keepsFieldOrderIdMethodParams()
    {
        String line = encoder.encode(new BridgeRequest(3, "stop", JsonNodeFactory.instance.objectNode().put("profile", "p")));

        assertTrue(line.indexOf("\"id\"") < line.indexOf("\"method\""));
        assertTrue(line.indexOf("\"method\"") < line.indexOf("\"params\""));
    }

    @Test
    void requestRejectsNonPositiveIds()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new BridgeRequest(0, "stop", JsonNodeFactory.instance.objectNode()));
    }
}
