package com.questrail.bridge.transport.process;

import com.questrail.bridge.api.BridgeStartupException;
import com.questrail.bridge.transport.BridgeProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * BridgeProcessLauncher
 * -----------------------------------------------------------------------------
 * Spawns the bridge service: {@code <interpreter...> <script>} with stdin,
 * stdout and stderr as pipes.
 *
 * <p>The working directory is the user's home directory, so the service finds
 * user-level tool configuration regardless of where the application is
 * installed.</p>
 *
 * <p>On Windows the JDK creates child processes with {@code CREATE_NO_WINDOW},
 * so no console window appears for the service.</p>
 */
public final class BridgeProcessLauncher
{
    private static final Logger log = LoggerFactory.getLogger(BridgeProcessLauncher.class);

    private final List<String> interpreterCommand;
    private final Path workingDirectory;

    public BridgeProcessLauncher(List<String> interpreterCommand, Path workingDirectory)
    {
        Objects.requireNonNull(interpreterCommand, "interpreterCommand");
        if (interpreterCommand.isEmpty()) {
            throw new IllegalArgumentException("interpreterCommand must not be empty");
        }
        this.interpreterCommand = List.copyOf(interpreterCommand);
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    /**
     * Builds (without starting) the process description for a service script.
     */
    public ProcessBuilder processBuilder(Path script)
    {
        Objects.requireNonNull(script, "script");

        List<String> command = new ArrayList<>(interpreterCommand);
        command.add(script.toString());

        return new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.PIPE);
    }

    /**
     * @throws BridgeStartupException if the process cannot be spawned
     */
    public BridgeProcess launch(Path script)
    {
        ProcessBuilder builder = processBuilder(script);
        log.info("Starting bridge service {} in {}", builder.command(), workingDirectory);

        final Process process;
        try {
            process = builder.start();
        }
        catch (IOException | SecurityException e) {
            throw new BridgeStartupException("Failed to spawn bridge service: " + e.getMessage(), e);
        }

        if (process.getOutputStream() == null || process.getInputStream() == null || process.getErrorStream() == null) {
            process.destroyForcibly();
            throw new BridgeStartupException("Failed to get standard streams of bridge service");
        }
        return new SpawnedBridgeProcess(process);
    }
}
