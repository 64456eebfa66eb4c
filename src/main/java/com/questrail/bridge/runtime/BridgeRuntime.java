package com.questrail.bridge.runtime;

import com.questrail.bridge.api.BridgeEventSink;
import com.questrail.bridge.api.BridgeStartupException;
import com.questrail.bridge.api.ProviderBridge;
import com.questrail.bridge.client.BridgeClient;
import com.questrail.bridge.codec.impl.JacksonBridgeMessageDecoder;
import com.questrail.bridge.codec.impl.JacksonBridgeMessageEncoder;
import com.questrail.bridge.config.BridgeRuntimeConfig;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.BridgeTransportObservabilityEvent;
import com.questrail.bridge.observability.Slf4jBridgeObservabilitySink;
import com.questrail.bridge.transport.BridgeProcess;
import com.questrail.bridge.transport.process.BridgeProcessLauncher;
import com.questrail.bridge.transport.process.BridgeServiceLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * BridgeRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the bridge service.
 *
 * <h2>Startup</h2>
 * <ol>
 *   <li>Locate the service script ({@link BridgeServiceLocator}).</li>
 *   <li>Spawn it ({@link BridgeProcessLauncher}).</li>
 *   <li>Start the stdout reader and stderr relay ({@link BridgeClient}).</li>
 *   <li>Wait up to {@code readyTimeout} for the {@code ready} event. A timeout
 *       is logged and startup continues.</li>
 * </ol>
 * Failures in steps 1 and 2 are fatal and surface as
 * {@link BridgeStartupException} from {@link #start()}.
 *
 * <h2>Teardown</h2>
 * {@link #stop()} (or {@link #close()}) kills the service. If configured, a
 * JVM shutdown hook does the same on exit and is deregistered by an explicit
 * stop. The service is torn down exactly once either way.
 */
public final class BridgeRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BridgeRuntime.class);

    private final BridgeRuntimeConfig config;
    private final BridgeEventSink eventSink;
    private final BridgeObservabilitySink observabilitySink;
    private final Function<Path, BridgeProcess> processFactory;

    private BridgeClient client;
    private Thread shutdownHook;
    private boolean stopped;

    private BridgeRuntime(BridgeRuntimeConfig config,
                          BridgeEventSink eventSink,
                          BridgeObservabilitySink observabilitySink,
                          Function<Path, BridgeProcess> processFactory) {
        this.config = config;
        this.eventSink = eventSink;
        this.observabilitySink = observabilitySink;
        this.processFactory = processFactory;
    }

    /**
     * Locates and spawns the service and waits for readiness.
     *
     * @return the transport, usable even if readiness timed out
     * @throws BridgeStartupException if the service cannot be found or started
     * @throws IllegalStateException if already started or stopped
     */
    public synchronized ProviderBridge start() {
        if (stopped) {
            throw new IllegalStateException("Bridge runtime already stopped");
        }
        if (client != null) {
            throw new IllegalStateException("Bridge runtime already started");
        }

        BridgeServiceLocator locator = new BridgeServiceLocator(
                config.resourceDirectory(),
                config.serviceRelativePath(),
                config.searchStart(),
                config.maxSearchDepth());
        Path script = locator.locate();

        BridgeProcess process = processFactory.apply(script);
        observabilitySink.onTransportEvent(BridgeTransportObservabilityEvent.of(
                BridgeTransportObservabilityEvent.Kind.PROCESS_STARTED, process.describe() + " " + script));

        BridgeClient started = new BridgeClient(
                process,
                new JacksonBridgeMessageEncoder(),
                new JacksonBridgeMessageDecoder(),
                eventSink,
                observabilitySink,
                config.messageChannel());
        started.start();
        this.client = started;

        if (config.registerShutdownHook()) {
            shutdownHook = new Thread(started::shutdown, "bridge-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        }

        if (started.awaitReady(config.readyTimeout())) {
            log.info("Bridge service ready");
        }
        return started;
    }

    /**
     * @throws IllegalStateException if {@link #start()} has not succeeded
     */
    public synchronized ProviderBridge client() {
        if (client == null) {
            throw new IllegalStateException("Bridge runtime not started");
        }
        return client;
    }

    public synchronized boolean isRunning() {
        return client != null && !stopped;
    }

    /**
     * Kills the service. Idempotent.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;

        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // JVM is already exiting; the hook performs the teardown.
                log.debug("Shutdown in progress, leaving teardown to the hook");
                return;
            }
            shutdownHook = null;
        }
        if (client != null) {
            client.shutdown();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeRuntimeConfig config = BridgeRuntimeConfig.defaults();
        private BridgeEventSink eventSink = BridgeEventSink.DISCARD;
        private BridgeObservabilitySink observabilitySink = new Slf4jBridgeObservabilitySink();
        private Function<Path, BridgeProcess> processFactory;

        public Builder withConfig(BridgeRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withEventSink(BridgeEventSink sink) {
            this.eventSink = sink;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces process spawning, e.g. with an in-memory process in tests.
         * By default the configured interpreter is launched.
         */
        public Builder withProcessFactory(Function<Path, BridgeProcess> factory) {
            this.processFactory = factory;
            return this;
        }

        public BridgeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(eventSink, "eventSink");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            Function<Path, BridgeProcess> factory = processFactory;
            if (factory == null) {
                BridgeProcessLauncher launcher =
                        new BridgeProcessLauncher(config.interpreterCommand(), config.workingDirectory());
                factory = launcher::launch;
            }
            return new BridgeRuntime(config, eventSink, observabilitySink, factory);
        }
    }
}
