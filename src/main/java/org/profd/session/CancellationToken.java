package org.profd.session;

import java.util.concurrent.TimeUnit;

/**
 * Cooperative stop signal shared between the session controller and a running session.
 * <p>
 * {@link #sleep(long)} is the only suspension point inside a session loop. It paces the loop
 * and doubles as the cancellation check: a call to {@link #requestStop()} wakes a sleeping
 * thread immediately instead of letting it finish the interval.
 * <p>
 * The token is reset by the controller before each session is launched and is never shared
 * across sessions that overlap in time.
 */
public final class CancellationToken {

    private final Object monitor = new Object();
    private boolean stopped = false;

    /**
     * Blocks for up to {@code seconds}, returning early once a stop has been requested.
     * A non-positive duration returns immediately without touching the monitor.
     *
     * @param seconds The maximum number of seconds to sleep.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public void sleep(final long seconds) throws InterruptedException {
        if (seconds <= 0) {
            return;
        }
        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
        synchronized (monitor) {
            while (!stopped) {
                final long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    return;
                }
                TimeUnit.NANOSECONDS.timedWait(monitor, remainingNanos);
            }
        }
    }

    /**
     * Returns whether a stop has been requested. Never blocks beyond the monitor hand-off.
     *
     * @return {@code true} once {@link #requestStop()} has been called since the last reset.
     */
    public boolean shouldStop() {
        synchronized (monitor) {
            return stopped;
        }
    }

    /**
     * Requests the session to stop and wakes any thread sleeping on this token. Idempotent.
     */
    public void requestStop() {
        synchronized (monitor) {
            stopped = true;
            monitor.notifyAll();
        }
    }

    /**
     * Clears the stop flag. Must only be called while no session is using this token.
     */
    public void reset() {
        synchronized (monitor) {
            stopped = false;
        }
    }
}
