package com.questrail.bridge.client;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * ReadinessGate
 * -----------------------------------------------------------------------------
 * One-shot, monotonic readiness flag: false until the bridge service's first
 * {@code ready} event, true forever after.
 *
 * <p>Waiting is event-driven rather than polled; the observable behavior is the
 * same as checking the flag at a short interval.</p>
 */
public final class ReadinessGate
{
    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * @return {@code true} if this call performed the false→true transition
     */
    public synchronized boolean markReady()
    {
        if (latch.getCount() == 0) {
            return false;
        }
        latch.countDown();
        return true;
    }

    public boolean isReady()
    {
        return latch.getCount() == 0;
    }

    /**
     * Blocks until ready or until the timeout elapses.
     *
     * @return whether the gate is open
     */
    public boolean await(Duration timeout) throws InterruptedException
    {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
