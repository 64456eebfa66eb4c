package com.questrail.bridge.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * BridgeRuntimeConfig
 * -----------------------------------------------------------------------------
 * Where to find the bridge service, how to start it and how long to wait for
 * it.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>interpreterCommand</b>: the command the service script is appended
 *       to. {@code node}, or {@code node.exe} on Windows.</li>
 *   <li><b>serviceRelativePath</b>: path of the script below a resource or
 *       project directory, {@code dist/bridge/provider-bridge.js}.</li>
 *   <li><b>resourceDirectory</b>: packaged resource directory checked first,
 *       if any.</li>
 *   <li><b>searchStart</b> / <b>maxSearchDepth</b>: the upward search for
 *       development builds; the start directory counts as the first level.</li>
 *   <li><b>workingDirectory</b>: the service's working directory, the user's
 *       home directory by default.</li>
 *   <li><b>readyTimeout</b>: how long startup waits for the {@code ready}
 *       event before continuing anyway.</li>
 *   <li><b>messageChannel</b>: UI channel that {@code message} events are
 *       forwarded on.</li>
 *   <li><b>registerShutdownHook</b>: kill the service when the JVM exits.</li>
 * </ul>
 */
public record BridgeRuntimeConfig(
        List<String> interpreterCommand,
        Path serviceRelativePath,
        Optional<Path> resourceDirectory,
        Path searchStart,
        int maxSearchDepth,
        Path workingDirectory,
        Duration readyTimeout,
        String messageChannel,
        boolean registerShutdownHook
) {
    public static final String DEFAULT_SERVICE_PATH = "dist/bridge/provider-bridge.js";
    public static final int DEFAULT_MAX_SEARCH_DEPTH = 5;
    public static final Duration DEFAULT_READY_TIMEOUT = Duration.ofSeconds(5);
    public static final String DEFAULT_MESSAGE_CHANNEL = "message-stream";

    /**
     * Canonical constructor with validation.
     */
    public BridgeRuntimeConfig {
        Objects.requireNonNull(interpreterCommand, "interpreterCommand");
        Objects.requireNonNull(serviceRelativePath, "serviceRelativePath");
        Objects.requireNonNull(resourceDirectory, "resourceDirectory");
        Objects.requireNonNull(searchStart, "searchStart");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(readyTimeout, "readyTimeout");
        Objects.requireNonNull(messageChannel, "messageChannel");

        interpreterCommand = List.copyOf(interpreterCommand);
        if (interpreterCommand.isEmpty()) {
            throw new IllegalArgumentException("interpreterCommand must not be empty");
        }
        if (serviceRelativePath.isAbsolute()) {
            throw new IllegalArgumentException("serviceRelativePath must be relative: " + serviceRelativePath);
        }
        if (maxSearchDepth < 1) {
            throw new IllegalArgumentException("maxSearchDepth must be at least 1");
        }
        if (readyTimeout.isNegative()) {
            throw new IllegalArgumentException("readyTimeout must be non-negative");
        }
        if (messageChannel.isBlank()) {
            throw new IllegalArgumentException("messageChannel must not be blank");
        }
    }

    /**
     * Defaults for the current machine: {@code node} on the {@code PATH},
     * search from {@code user.dir}, run in {@code user.home}.
     */
    public static BridgeRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static String defaultInterpreter(String osName) {
        return osName.toLowerCase(Locale.ROOT).startsWith("windows") ? "node.exe" : "node";
    }

    public static final class Builder {
        private List<String> interpreterCommand = List.of(defaultInterpreter(System.getProperty("os.name", "")));
        private Path serviceRelativePath = Path.of(DEFAULT_SERVICE_PATH);
        private Optional<Path> resourceDirectory = Optional.empty();
        private Path searchStart = Path.of(System.getProperty("user.dir"));
        private int maxSearchDepth = DEFAULT_MAX_SEARCH_DEPTH;
        private Path workingDirectory = Path.of(System.getProperty("user.home"));
        private Duration readyTimeout = DEFAULT_READY_TIMEOUT;
        private String messageChannel = DEFAULT_MESSAGE_CHANNEL;
        private boolean registerShutdownHook = true;

        public Builder withInterpreterCommand(List<String> command) {
            this.interpreterCommand = command;
            return this;
        }

        public Builder withServiceRelativePath(Path path) {
            this.serviceRelativePath = path;
            return this;
        }

        public Builder withResourceDirectory(Path directory) {
            this.resourceDirectory = Optional.ofNullable(directory);
            return this;
        }

        public Builder withSearchStart(Path start) {
            this.searchStart = start;
            return this;
        }

        public Builder withMaxSearchDepth(int depth) {
            this.maxSearchDepth = depth;
            return this;
        }

        public Builder withWorkingDirectory(Path directory) {
            this.workingDirectory = directory;
            return this;
        }

        public Builder withReadyTimeout(Duration timeout) {
            this.readyTimeout = timeout;
            return this;
        }

        public Builder withMessageChannel(String channel) {
            this.messageChannel = channel;
            return this;
        }

        public Builder withRegisterShutdownHook(boolean register) {
            this.registerShutdownHook = register;
            return this;
        }

        public BridgeRuntimeConfig build() {
            return new BridgeRuntimeConfig(
                    interpreterCommand,
                    serviceRelativePath,
                    resourceDirectory,
                    searchStart,
                    maxSearchDepth,
                    workingDirectory,
                    readyTimeout,
                    messageChannel,
                    registerShutdownHook
            );
        }
    }
}
