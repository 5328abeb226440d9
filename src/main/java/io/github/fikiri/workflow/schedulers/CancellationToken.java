package io.github.fikiri.workflow.schedulers;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative stop signal for one run of the scheduler loop. A new token is created on every start.
 */
final class CancellationToken {
    private final CountDownLatch stop = new CountDownLatch(1);
    private volatile String reason = "";

    boolean isStopRequested() {
        return stop.getCount() == 0;
    }

    String reason() {
        return reason;
    }

    void requestStop(String reason) {
        this.reason = reason;
        stop.countDown();
    }

    /**
     * Waits up to {@code timeout} or until stop is requested.
     *
     * @return {@code true} if stop was requested
     */
    boolean await(Duration timeout) throws InterruptedException {
        return stop.await(Math.max(1, timeout.toNanos()), TimeUnit.NANOSECONDS);
    }
}
