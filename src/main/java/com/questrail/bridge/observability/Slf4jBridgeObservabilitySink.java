package com.questrail.bridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 *
 * <p>Lines from the service's stderr go to a dedicated logger,
 * {@value #STDERR_LOGGER}, so they can be routed or silenced separately.</p>
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    public static final String STDERR_LOGGER = "com.questrail.bridge.stderr";

    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);
    private static final Logger stderrLog = LoggerFactory.getLogger(STDERR_LOGGER);

    @Override
    public void onTransportEvent(BridgeTransportObservabilityEvent event) {
        switch (event.kind()) {
            case READY_TIMEOUT -> log.warn("Bridge service did not announce readiness: {}", event.detail());
            case STDOUT_CLOSED, STDERR_CLOSED -> log.info("Bridge {}: {}", event.kind(), event.detail());
            default -> log.info("Bridge Transport Event: {} {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onProtocolEvent(BridgeProtocolObservabilityEvent event) {
        switch (event.kind()) {
            case UNMATCHED_RESPONSE -> log.warn("No pending request for response: {}", event.detail());
            case UNRECOGNIZED_EVENT -> log.warn("Unrecognized bridge event: {}", event.detail());
            case UNKNOWN_MESSAGE -> log.warn("Unknown message format from bridge: {}", event.detail());
        }
    }

    @Override
    public void onStderrLine(String line) {
        stderrLog.info("{}", line);
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Bridge Error: {}", event.message(), event.cause());
    }
}
