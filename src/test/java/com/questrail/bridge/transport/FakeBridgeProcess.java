package com.questrail.bridge.transport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * FakeBridgeProcess
 * -----------------------------------------------------------------------------
 * Test-only {@link BridgeProcess} implementation.
 *
 * <p>Plays the bridge service in memory. It carries no protocol knowledge: it
 * records the lines written to its stdin and lets tests feed lines to its
 * stdout and stderr. Destroying it ends both output streams, as a real process
 * exit would.</p>
 */
public final class FakeBridgeProcess implements BridgeProcess {

    private final ChunkQueueInputStream stdout = new ChunkQueueInputStream();
    private final ChunkQueueInputStream stderr = new ChunkQueueInputStream();
    private final LineRecordingOutputStream stdin = new LineRecordingOutputStream();
    private final AtomicInteger destroyCount = new AtomicInteger();
    private final CountDownLatch destroyed = new CountDownLatch(1);
    private final CountDownLatch writeBlocked = new CountDownLatch(1);

    private volatile boolean failWrites;
    private volatile boolean blockWrites;
    private volatile Consumer<String> requestListener = line -> {};

    @Override
    public OutputStream stdin() {
        return stdin;
    }

    @Override
    public InputStream stdout() {
        return stdout;
    }

    @Override
    public InputStream stderr() {
        return stderr;
    }

    @Override
    public String describe() {
        return "fake";
    }

    @Override
    public void destroyAndWait() {
        if (destroyCount.getAndIncrement() == 0) {
            destroyed.countDown();
            stdout.end();
            stderr.end();
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void emitStdout(String line) {
        stdout.push((line + "\n").getBytes(StandardCharsets.UTF_8));
    }

    public void emitReady() {
        emitStdout("{\"event\":\"ready\",\"data\":{}}");
    }

    public void closeStdout() {
        stdout.end();
    }

    public void emitStderr(String line) {
        stderr.push((line + "\n").getBytes(StandardCharsets.UTF_8));
    }

    public void closeStderr() {
        stderr.end();
    }

    /** Makes every subsequent write to stdin fail with an {@link IOException}. */
    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    /**
     * Makes every subsequent write to stdin block, as on a full pipe nobody
     * drains, until {@link #destroyAndWait()} is called. The blocked write
     * then fails with an {@link IOException}.
     */
    public void blockWritesUntilDestroyed() {
        this.blockWrites = true;
    }

    /** Waits until a write is blocked by {@link #blockWritesUntilDestroyed()}. */
    public boolean awaitBlockedWrite(Duration timeout) throws InterruptedException {
        return writeBlocked.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Called with each complete line written to stdin, on the writing thread.
     */
    public void onRequestLine(Consumer<String> listener) {
        this.requestListener = listener;
    }

    /** Takes the oldest written line, or {@code null} if none arrives in time. */
    public String nextWrittenLine(Duration timeout) throws InterruptedException {
        return stdin.lines.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Lines written and not yet taken by {@link #nextWrittenLine}. */
    public List<String> writtenLines() {
        return new ArrayList<>(stdin.lines);
    }

    public int destroyCount() {
        return destroyCount.get();
    }

    private final class LineRecordingOutputStream extends OutputStream {
        private final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
        private final ByteArrayOutputStream partial = new ByteArrayOutputStream();

        @Override
        public synchronized void write(int b) throws IOException {
            if (failWrites) {
                throw new IOException("Broken pipe");
            }
            if (blockWrites) {
                writeBlocked.countDown();
                try {
                    destroyed.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new IOException("Stream closed");
            }
            if (b == '\n') {
                String line = partial.toString(StandardCharsets.UTF_8);
                partial.reset();
                lines.add(line);
                requestListener.accept(line);
            } else {
                partial.write(b);
            }
        }

        @Override
        public synchronized void write(byte[] bytes, int offset, int length) throws IOException {
            for (int i = offset; i < offset + length; i++) {
                write(bytes[i]);
            }
        }
    }
}
