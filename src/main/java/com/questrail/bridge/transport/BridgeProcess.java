package com.questrail.bridge.transport;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * BridgeProcess
 * -----------------------------------------------------------------------------
 * Minimal port for a child process whose three standard streams are pipes.
 *
 * <p>The client owns the streams once it has been handed a
 * {@code BridgeProcess}: it writes request lines to {@link #stdin()}, runs one
 * reader over {@link #stdout()} and one over {@link #stderr()}.</p>
 */
public interface BridgeProcess
{
    /** The child's standard input. */
    OutputStream stdin();

    /** The child's standard output. */
    InputStream stdout();

    /** The child's standard error. */
    InputStream stderr();

    /**
     * Short human-readable identity for diagnostics (e.g. {@code pid 4242}).
     */
    String describe();

    /**
     * Forcibly terminate the process and wait for it to exit.
     *
     * <p>Must be safe to call on a process that has already exited. If the
     * calling thread is interrupted while waiting, the interrupt flag is
     * restored and the method returns.</p>
     */
    void destroyAndWait();
}
