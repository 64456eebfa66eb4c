package com.questrail.bridge.client;

import com.questrail.bridge.api.BridgeEventSink;
import com.questrail.bridge.codec.BridgeMessageDecoder;
import com.questrail.bridge.model.BridgeEvent;
import com.questrail.bridge.model.BridgeInboundMessage;
import com.questrail.bridge.model.BridgeResponse;
import com.questrail.bridge.observability.BridgeErrorEvent;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.BridgeProtocolObservabilityEvent;
import com.questrail.bridge.observability.BridgeTransportObservabilityEvent;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * StdoutDemultiplexer
 * =============================================================================
 * Background loop that reads the bridge service's stdout one line at a time
 * and routes each line.
 *
 * <h2>Inbound path (decode-before-route)</h2>
 * <pre>
 *   stdout line
 *        → BridgeMessageDecoder
 *            → BridgeResponse → PendingRequests.complete(...)
 *            → BridgeEvent    → "ready"   → ReadinessGate.markReady()
 *                             → "message" → BridgeEventSink.emit(channel, data)
 *                             → other     → logged as unrecognized
 *            → neither        → logged as unknown
 * </pre>
 *
 * <h2>Termination</h2>
 * Bad input never ends the loop. EOF or a read error does; the
 * {@code onClosed} callback then runs exactly once, which is how the client
 * learns that the process is gone.
 */
final class StdoutDemultiplexer implements Runnable
{
    private static final int MAX_LOGGED_LINE = 200;

    private final InputStream stdout;
    private final BridgeMessageDecoder decoder;
    private final PendingRequests pending;
    private final ReadinessGate readiness;
    private final BridgeEventSink eventSink;
    private final String messageChannel;
    private final BridgeObservabilitySink observability;
    private final Runnable onClosed;

    StdoutDemultiplexer(InputStream stdout,
                        BridgeMessageDecoder decoder,
                        PendingRequests pending,
                        ReadinessGate readiness,
                        BridgeEventSink eventSink,
                        String messageChannel,
                        BridgeObservabilitySink observability,
                        Runnable onClosed)
    {
        this.stdout = Objects.requireNonNull(stdout, "stdout");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.pending = Objects.requireNonNull(pending, "pending");
        this.readiness = Objects.requireNonNull(readiness, "readiness");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.messageChannel = Objects.requireNonNull(messageChannel, "messageChannel");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.onClosed = Objects.requireNonNull(onClosed, "onClosed");
    }

    @Override
    public void run()
    {
        String reason = "EOF";
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stdout, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    route(line);
                }
                catch (RuntimeException e) {
                    observability.onError(new BridgeErrorEvent(Instant.now(),
                            "Error handling bridge message: " + abbreviate(line), e));
                }
            }
        }
        catch (IOException e) {
            reason = "read error: " + e.getMessage();
        }
        finally {
            onClosed.run();
        }
        observability.onTransportEvent(BridgeTransportObservabilityEvent.of(
                BridgeTransportObservabilityEvent.Kind.STDOUT_CLOSED, reason));
    }

    /**
     * Classifies and routes one non-blank line.
     */
    void route(String line)
    {
        Optional<BridgeInboundMessage> decoded = decoder.decode(line);
        if (decoded.isEmpty()) {
            observability.onProtocolEvent(BridgeProtocolObservabilityEvent.of(
                    BridgeProtocolObservabilityEvent.Kind.UNKNOWN_MESSAGE, abbreviate(line)));
            return;
        }

        BridgeInboundMessage message = decoded.get();
        if (message instanceof BridgeResponse response) {
            if (!pending.complete(response)) {
                observability.onProtocolEvent(BridgeProtocolObservabilityEvent.of(
                        BridgeProtocolObservabilityEvent.Kind.UNMATCHED_RESPONSE, "id=" + response.id()));
            }
        }
        else if (message instanceof BridgeEvent event) {
            dispatch(event);
        }
    }

    private void dispatch(BridgeEvent event)
    {
        if (event.isReady()) {
            // Reported before the gate opens, so awaitReady callers see it.
            // Only this thread opens the gate.
            if (!readiness.isReady()) {
                observability.onTransportEvent(BridgeTransportObservabilityEvent.of(
                        BridgeTransportObservabilityEvent.Kind.READY, event.data().toString()));
                readiness.markReady();
            }
        }
        else if (event.isMessage()) {
            try {
                eventSink.emit(messageChannel, event.data());
            }
            catch (RuntimeException e) {
                observability.onError(new BridgeErrorEvent(Instant.now(),
                        "Failed to emit " + messageChannel + " event", e));
            }
        }
        else {
            observability.onProtocolEvent(BridgeProtocolObservabilityEvent.of(
                    BridgeProtocolObservabilityEvent.Kind.UNRECOGNIZED_EVENT, event.event()));
        }
    }

    private static String abbreviate(String line)
    {
        return line.length() > MAX_LOGGED_LINE ? line.substring(0, MAX_LOGGED_LINE) + "..." : line;
    }
}
