package com.questrail.bridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.questrail.bridge.api.BridgeEventSink;
import com.questrail.bridge.api.BridgeException;
import com.questrail.bridge.api.BridgeNotRunningException;
import com.questrail.bridge.api.BridgeTransportException;
import com.questrail.bridge.codec.BridgeEncodeException;
import com.questrail.bridge.codec.BridgeMessageDecoder;
import com.questrail.bridge.codec.BridgeMessageEncoder;
import com.questrail.bridge.core.AbstractProviderBridge;
import com.questrail.bridge.model.BridgeRequest;
import com.questrail.bridge.observability.BridgeErrorEvent;
import com.questrail.bridge.observability.BridgeObservabilitySink;
import com.questrail.bridge.observability.BridgeTransportObservabilityEvent;
import com.questrail.bridge.transport.BridgeProcess;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * BridgeClient
 * =============================================================================
 * {@link com.questrail.bridge.api.ProviderBridge} over a running
 * {@link BridgeProcess}: requests go out on stdin as one JSON line each,
 * responses and events come back on stdout.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>Callers of {@link #sendRequest(String, JsonNode)}, any number,
 *       concurrently. Writes are serialized so lines never interleave.</li>
 *   <li>{@code bridge-stdout-reader}: the {@link StdoutDemultiplexer}.</li>
 *   <li>{@code bridge-stderr-relay}: the {@link StderrRelay}.</li>
 * </ul>
 * Both background threads are daemons and end when their stream ends.
 *
 * <h2>Liveness</h2>
 * Alive means: the process handle is present, the stdin writer is present
 * (cleared when stdout reaches EOF) and the service has announced readiness.
 * Requests attempted while not alive fail immediately without consuming an id.
 *
 * <h2>Pending requests on process death</h2>
 * Requests already written when the process dies are not failed by the
 * client. Callers that need a bound must apply their own timeout, e.g.
 * {@link CompletableFuture#orTimeout}.
 */
public final class BridgeClient extends AbstractProviderBridge
{
    private final BridgeMessageEncoder encoder;
    private final BridgeMessageDecoder decoder;
    private final BridgeEventSink eventSink;
    private final BridgeObservabilitySink observability;
    private final String messageChannel;

    private final PendingRequests pending = new PendingRequests();
    private final ReadinessGate readiness = new ReadinessGate();
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicBoolean started = new AtomicBoolean(false);

    private final Object processLock = new Object();
    private final Object writeLock = new Object();

    // process is written under processLock. stdin is only ever cleared, and
    // never under writeLock: a blocked write holds it.
    private volatile BridgeProcess process;
    private volatile OutputStream stdin;

    public BridgeClient(BridgeProcess process,
                        BridgeMessageEncoder encoder,
                        BridgeMessageDecoder decoder,
                        BridgeEventSink eventSink,
                        BridgeObservabilitySink observability,
                        String messageChannel)
    {
        this.process = Objects.requireNonNull(process, "process");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.messageChannel = Objects.requireNonNull(messageChannel, "messageChannel");
        this.stdin = Objects.requireNonNull(process.stdin(), "process.stdin");
    }

    /**
     * Starts the stdout reader and stderr relay threads. Subsequent calls are
     * ignored.
     */
    public void start()
    {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        BridgeProcess p = process;
        if (p == null) {
            throw new IllegalStateException("Bridge client already shut down");
        }

        StdoutDemultiplexer demux = new StdoutDemultiplexer(
                p.stdout(), decoder, pending, readiness, eventSink, messageChannel, observability,
                this::onStdoutClosed);
        Thread reader = new Thread(demux, "bridge-stdout-reader");
        reader.setDaemon(true);
        reader.start();

        Thread relay = new Thread(new StderrRelay(p.stderr(), observability), "bridge-stderr-relay");
        relay.setDaemon(true);
        relay.start();
    }

    /**
     * Waits for the service's {@code ready} event.
     *
     * <p>A timeout is not fatal: it is reported and the client stays usable,
     * becoming alive if the event arrives later.</p>
     *
     * @return whether the service is ready
     */
    public boolean awaitReady(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        boolean ready;
        try {
            ready = readiness.await(timeout);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ready = readiness.isReady();
        }
        if (!ready) {
            observability.onTransportEvent(BridgeTransportObservabilityEvent.of(
                    BridgeTransportObservabilityEvent.Kind.READY_TIMEOUT,
                    "no ready event within " + timeout.toMillis() + " ms, continuing anyway (some features may not work)"));
        }
        return ready;
    }

    @Override
    public CompletableFuture<JsonNode> sendRequest(String method, JsonNode params)
    {
        Objects.requireNonNull(method, "method");
        JsonNode body = Objects.requireNonNullElse(params, NullNode.getInstance());

        if (!isAlive()) {
            return CompletableFuture.failedFuture(new BridgeNotRunningException());
        }

        long id = nextId.getAndIncrement();
        byte[] line;
        try {
            line = (encoder.encode(new BridgeRequest(id, method, body)) + "\n").getBytes(StandardCharsets.UTF_8);
        }
        catch (BridgeEncodeException e) {
            return CompletableFuture.failedFuture(new BridgeException(e.getMessage(), e));
        }

        CompletableFuture<JsonNode> response = pending.register(id);
        synchronized (writeLock) {
            OutputStream out = stdin;
            if (out == null) {
                pending.remove(id);
                return CompletableFuture.failedFuture(BridgeTransportException.closedUnexpectedly("stdin closed"));
            }
            try {
                // Whole line in a single write.
                out.write(line);
                out.flush();
            }
            catch (IOException e) {
                pending.remove(id);
                observability.onError(new BridgeErrorEvent(Instant.now(),
                        "Failed to write request " + id + " (" + method + ")", e));
                return CompletableFuture.failedFuture(BridgeTransportException.closedUnexpectedly(e));
            }
        }
        return response;
    }

    @Override
    public boolean isAlive()
    {
        return process != null && stdin != null && readiness.isReady();
    }

    /**
     * Kills the process and waits for it to exit. Safe to call any number of
     * times from any thread; only the first call does anything, and concurrent
     * callers return after the process is gone.
     */
    @Override
    public void shutdown()
    {
        synchronized (processLock) {
            BridgeProcess p = process;
            if (p == null) {
                return;
            }
            process = null;
            // Kill before touching stdin: a writer may hold writeLock on a full pipe.
            p.destroyAndWait();
            stdin = null;
            observability.onTransportEvent(BridgeTransportObservabilityEvent.of(
                    BridgeTransportObservabilityEvent.Kind.SHUTDOWN, p.describe()));
        }
    }

    /** Number of requests written and not yet answered. */
    public int pendingRequestCount()
    {
        return pending.size();
    }

    public boolean isReady()
    {
        return readiness.isReady();
    }

    private void onStdoutClosed()
    {
        stdin = null;
    }
}
