package com.questrail.bridge.runtime;

import com.questrail.bridge.api.BridgeStartupException;
import com.questrail.bridge.api.ProviderBridge;
import com.questrail.bridge.config.BridgeRuntimeConfig;
import com.questrail.bridge.observability.BridgeTransportObservabilityEvent;
import com.questrail.bridge.observability.RecordingObservabilitySink;
import com.questrail.bridge.transport.FakeBridgeProcess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BridgeRuntimeTest
 * -----------------------------------------------------------------------------
 * Lifecycle of {@link BridgeRuntime} with an in-memory process: startup
 * ordering, the soft ready timeout and once-only teardown.
 */
@Timeout(30)
class BridgeRuntimeTest {

    @TempDir
    Path project;

    private final FakeBridgeProcess process = new FakeBridgeProcess();
    private final RecordingObservabilitySink observability = new RecordingObservabilitySink();
    private final List<Path> spawnedScripts = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        Path script = project.resolve(BridgeRuntimeConfig.DEFAULT_SERVICE_PATH);
        Files.createDirectories(script.getParent());
        Files.writeString(script, "// bridge");
    }

    @Test
    void startSpawnsLocatedScriptAndWaitsForReady() {
        process.emitReady();

        try (BridgeRuntime runtime = runtime(Duration.ofSeconds(5))) {
            ProviderBridge bridge = runtime.start();

            assertTrue(bridge.isAlive());
            assertSame(bridge, runtime.client());
            assertTrue(runtime.isRunning());
            assertEquals(List.of(project.resolve(BridgeRuntimeConfig.DEFAULT_SERVICE_PATH).toAbsolutePath().normalize()),
                    spawnedScripts);
            assertTrue(observability.hasTransportEvent(BridgeTransportObservabilityEvent.Kind.PROCESS_STARTED));
            assertTrue(observability.hasTransportEvent(BridgeTransportObservabilityEvent.Kind.READY));
        }
    }

    @Test
    void readyTimeoutStillReturnsTheBridge() throws Exception {
        try (BridgeRuntime runtime = runtime(Duration.ofMillis(100))) {
            ProviderBridge bridge = runtime.start();

            assertFalse(bridge.isAlive());
            assertTrue(observability.hasTransportEvent(BridgeTransportObservabilityEvent.Kind.READY_TIMEOUT));

            process.emitReady();
            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (!bridge.isAlive() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertTrue(bridge.isAlive());
        }
    }

    @Test
    void missingScriptFailsStartupWithoutSpawning() throws IOException {
        Files.delete(project.resolve(BridgeRuntimeConfig.DEFAULT_SERVICE_PATH));

        BridgeRuntime runtime = runtime(Duration.ofSeconds(5));

        BridgeStartupException e = assertThrows(BridgeStartupException.class, runtime::start);
        assertTrue(e.getMessage().startsWith("Could not find bridge service"));
        assertTrue(spawnedScripts.isEmpty());
        assertThrows(IllegalStateException.class, runtime::client);
    }

    @Test
    void stopKillsTheProcessOnce() {
        process.emitReady();
        BridgeRuntime runtime = runtime(Duration.ofSeconds(5));
        ProviderBridge bridge = runtime.start();

        runtime.stop();
        runtime.stop();
        runtime.close();
        bridge.shutdown();

        assertEquals(1, process.destroyCount());
        assertFalse(bridge.isAlive());
        assertFalse(runtime.isRunning());
    }

    @Test
    void startTwiceIsRejected() {
        process.emitReady();
        try (BridgeRuntime runtime = runtime(Duration.ofSeconds(5))) {
            runtime.start();
            assertThrows(IllegalStateException.class, runtime::start);
        }
    }

    @Test
    void startAfterStopIsRejected() {
        BridgeRuntime runtime = runtime(Duration.ofSeconds(5));
        runtime.stop();

        assertThrows(IllegalStateException.class, runtime::start);
    }

    @Test
    void shutdownHookIsDeregisteredOnStop() {
        process.emitReady();
        BridgeRuntime runtime = BridgeRuntime.builder()
                .withConfig(BridgeRuntimeConfig.builder()
                        .withSearchStart(project)
                        .withRegisterShutdownHook(true)
                        .build())
                .withObservabilitySink(observability)
                .withProcessFactory(this::spawn)
                .build();

        runtime.start();
        assertDoesNotThrow(runtime::stop);
        assertEquals(1, process.destroyCount());
    }

    private BridgeRuntime runtime(Duration readyTimeout) {
        return BridgeRuntime.builder()
                .withConfig(BridgeRuntimeConfig.builder()
                        .withSearchStart(project)
                        .withReadyTimeout(readyTimeout)
                        .withRegisterShutdownHook(false)
                        .build())
                .withObservabilitySink(observability)
                .withProcessFactory(this::spawn)
                .build();
    }

    private FakeBridgeProcess spawn(Path script) {
        spawnedScripts.add(script);
        return process;
    }
}
