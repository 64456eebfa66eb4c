package com.questrail.bridge.transport.process;

import com.questrail.bridge.transport.BridgeProcess;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * SpawnedBridgeProcess
 * =============================================================================
 * {@link BridgeProcess} backed by a {@link java.lang.Process} started with all
 * three standard streams redirected to pipes.
 *
 * <h2>Containment rule</h2>
 * {@link Process} does not escape this package; the client only sees the
 * {@link BridgeProcess} port.
 */
public final class SpawnedBridgeProcess implements BridgeProcess
{
    private final Process process;

    SpawnedBridgeProcess(Process process)
    {
        this.process = Objects.requireNonNull(process, "process");
    }

    @Override
    public OutputStream stdin()
    {
        return process.getOutputStream();
    }

    @Override
    public InputStream stdout()
    {
        return process.getInputStream();
    }

    @Override
    public InputStream stderr()
    {
        return process.getErrorStream();
    }

    @Override
    public String describe()
    {
        return "pid " + process.pid();
    }

    @Override
    public void destroyAndWait()
    {
        process.destroyForcibly();
        try {
            // destroyForcibly() is asynchronous on some platforms.
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.waitFor();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isAlive()
    {
        return process.isAlive();
    }
}
