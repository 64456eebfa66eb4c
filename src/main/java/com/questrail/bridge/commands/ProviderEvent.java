package com.questrail.bridge.commands;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * ProviderEvent
 * -----------------------------------------------------------------------------
 * Typed view of the payloads a provider session streams on the message
 * channel. Payloads are objects tagged by {@code type}:
 *
 * <pre>
 *   {"type":"text","content":"..."}
 *   {"type":"file","path":"...","contents":"..."}
 *   {"type":"shell","command":"..."}
 *   {"type":"ask","reason":"...","action":"..."}
 *   {"type":"progress","message":"..."}
 *   {"type":"error","message":"...","recoverable":true}
 *   {"type":"done"}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ProviderEvent.TextEvent.class, name = "text"),
        @JsonSubTypes.Type(value = ProviderEvent.FileEvent.class, name = "file"),
        @JsonSubTypes.Type(value = ProviderEvent.ShellEvent.class, name = "shell"),
        @JsonSubTypes.Type(value = ProviderEvent.AskEvent.class, name = "ask"),
        @JsonSubTypes.Type(value = ProviderEvent.ProgressEvent.class, name = "progress"),
        @JsonSubTypes.Type(value = ProviderEvent.ErrorEvent.class, name = "error"),
        @JsonSubTypes.Type(value = ProviderEvent.DoneEvent.class, name = "done")
})
public sealed interface ProviderEvent
        permits ProviderEvent.TextEvent,
                ProviderEvent.FileEvent,
                ProviderEvent.ShellEvent,
                ProviderEvent.AskEvent,
                ProviderEvent.ProgressEvent,
                ProviderEvent.ErrorEvent,
                ProviderEvent.DoneEvent
{
    /**
     * Decodes a message payload.
     *
     * @return empty if the payload is not an object, has no known
     *         {@code type}, or lacks a required field
     */
    static Optional<ProviderEvent> parse(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(ProviderEventReader.MAPPER.treeToValue(payload, ProviderEvent.class));
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Assistant output. */
    record TextEvent(String content) implements ProviderEvent {
        public TextEvent {
            Objects.requireNonNull(content, "content");
        }
    }

    /** A file the provider wrote. */
    record FileEvent(String path, String contents) implements ProviderEvent {
        public FileEvent {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(contents, "contents");
        }
    }

    /** A shell command the provider ran. */
    record ShellEvent(String command) implements ProviderEvent {
        public ShellEvent {
            Objects.requireNonNull(command, "command");
        }
    }

    /** The provider asks the user to approve {@code action}. */
    record AskEvent(String reason, String action) implements ProviderEvent {
        public AskEvent {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(action, "action");
        }
    }

    record ProgressEvent(String message) implements ProviderEvent {
        public ProgressEvent {
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * @param recoverable {@code null} when the provider did not say
     */
    record ErrorEvent(String message, Boolean recoverable) implements ProviderEvent {
        public ErrorEvent {
            Objects.requireNonNull(message, "message");
        }
    }

    record DoneEvent() implements ProviderEvent {
    }
}
