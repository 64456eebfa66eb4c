package com.questrail.bridge.client;

import com.questrail.bridge.observability.BridgeErrorEvent;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.BridgeTransportObservabilityEvent;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * StderrRelay
 * -----------------------------------------------------------------------------
 * Forwards each non-empty line of the bridge service's stderr to the
 * observability sink, verbatim.
 *
 * <p>No parsing, no correlation. Ends on EOF or a read error; neither affects
 * pending requests or readiness.</p>
 */
final class StderrRelay implements Runnable
{
    private final InputStream stderr;
    private final BridgeObservabilitySink observability;

    StderrRelay(InputStream stderr, BridgeObservabilitySink observability)
    {
        this.stderr = Objects.requireNonNull(stderr, "stderr");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    @Override
    public void run()
    {
        String reason = "EOF";
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    relay(line);
                }
            }
        }
        catch (IOException e) {
            reason = "read error: " + e.getMessage();
        }
        observability.onTransportEvent(BridgeTransportObservabilityEvent.of(
                BridgeTransportObservabilityEvent.Kind.STDERR_CLOSED, reason));
    }

    private void relay(String line)
    {
        try {
            observability.onStderrLine(line);
        }
        catch (RuntimeException e) {
            observability.onError(new BridgeErrorEvent(Instant.now(), "Failed to relay bridge stderr line", e));
        }
    }
}
