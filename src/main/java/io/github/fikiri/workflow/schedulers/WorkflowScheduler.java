package io.github.fikiri.workflow.schedulers;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.fikiri.workflow.ObjectsUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * WorkflowScheduler
 * - Fixed-delay scheduling of periodic background work.
 * - One dedicated thread ticks every {@code tickPeriod} and runs every enabled job whose nextRun has passed.
 * - Jobs run one at a time, synchronously, on that thread.
 * - nextRun = start of the attempt + interval, whether the attempt succeeded or failed.
 * - A failing job is logged and retried after its interval; it is never disabled or removed.
 * - Faults in the loop itself are logged and the loop backs off instead of dying.
 * - Events: start/complete/error.
 */
@ThreadSafe
public final class WorkflowScheduler implements WorkflowSchedulerInterface {
    private final static Logger logger = LoggerFactory.getLogger(WorkflowScheduler.class);

    private final JobRegistry registry;
    private final Clock clock;
    private final Duration tickPeriod;
    private final Duration errorBackoff;
    private final Duration stopTimeout;
    private final String threadName;
    private final List<JobEventListener> listeners;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    // Held for a whole due-pass, so a loop left over from a timed-out stop never overlaps a new one.
    private final Object executionLock = new Object();

    @GuardedBy("lifecycleLock")
    private Thread loopThread = null;
    @GuardedBy("lifecycleLock")
    private CancellationToken loopToken = null;

    private WorkflowScheduler(JobRegistry registry, Clock clock, Duration tickPeriod, Duration errorBackoff,
                              Duration stopTimeout, String threadName, List<JobEventListener> listeners) {
        this.registry = registry;
        this.clock = clock;
        this.tickPeriod = tickPeriod;
        this.errorBackoff = errorBackoff;
        this.stopTimeout = stopTimeout;
        this.threadName = threadName;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    public static final class Builder {
        private Clock clock = Clock.systemDefaultZone();
        private Duration tickPeriod = Duration.ofSeconds(1);
        private int errorBackoffMultiplier = 5;
        private Duration stopTimeout = Duration.ofSeconds(5);
        private boolean resetScheduleOnEnable = false;
        private String threadName = "workflow-scheduler";
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        /**
         * Source of "now" for registration and due checks.
         */
        public Builder clock(Clock clock) {
            this.clock = ObjectsUtils.requireNonNull(clock, new IllegalArgumentException("clock must be NotNull"));
            return this;
        }

        /**
         * Delay between two scans of the registry.
         */
        public Builder tickPeriod(Duration tickPeriod) {
            this.tickPeriod = ObjectsUtils.requireNonNull(tickPeriod, new IllegalArgumentException("tickPeriod must be NotNull"));
            return this;
        }

        /**
         * After a loop-internal fault the loop waits {@code tickPeriod * multiplier}.
         */
        public Builder errorBackoffMultiplier(int multiplier) {
            this.errorBackoffMultiplier = multiplier;
            return this;
        }

        /**
         * How long {@link #stop()} and {@link #close()} wait for the loop thread.
         */
        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = ObjectsUtils.requireNonNull(stopTimeout, new IllegalArgumentException("stopTimeout must be NotNull"));
            return this;
        }

        /**
         * Recompute nextRun from "now" when a disabled job is enabled again.
         */
        public Builder resetScheduleOnEnable(boolean reset) {
            this.resetScheduleOnEnable = reset;
            return this;
        }

        public Builder threadName(String threadName) {
            this.threadName = ObjectsUtils.requireNonNull(threadName, new IllegalArgumentException("threadName must be NotNull"));
            return this;
        }

        public Builder addListener(JobEventListener l) {
            listeners.add(ObjectsUtils.requireNonNull(l, new IllegalArgumentException("listener must be NotNull")));
            return this;
        }

        public WorkflowScheduler build() {
            ObjectsUtils.requireTrue(!tickPeriod.isZero() && !tickPeriod.isNegative(),
                    new IllegalArgumentException("tickPeriod must be positive: " + tickPeriod));
            ObjectsUtils.requireTrue(errorBackoffMultiplier >= 1,
                    new IllegalArgumentException("errorBackoffMultiplier must be >= 1: " + errorBackoffMultiplier));
            ObjectsUtils.requireTrue(!stopTimeout.isNegative(),
                    new IllegalArgumentException("stopTimeout must not be negative: " + stopTimeout));
            return new WorkflowScheduler(
                    new JobRegistry(clock, resetScheduleOnEnable),
                    clock,
                    tickPeriod,
                    tickPeriod.multipliedBy(errorBackoffMultiplier),
                    stopTimeout,
                    threadName,
                    listeners
            );
        }
    }

    // ======== Public API ========

    @Override
    public void addListener(@NotNull JobEventListener l) {
        listeners.add(ObjectsUtils.requireNonNull(l, new IllegalArgumentException("listener must be NotNull")));
    }

    @Override
    public void removeListener(@NotNull JobEventListener l) {
        listeners.remove(l);
    }

    /**
     * Register a job. It first becomes due one interval from now.
     */
    @Override
    public @NotNull UUID addJob(@NotNull String name, @NotNull String jobType, @NotNull JobCallback callback,
                                @NotNull Duration interval, @Nullable Map<String, Object> metadata) {
        return registry.add(name, jobType, callback, interval, metadata);
    }

    @Override
    public boolean removeJob(@NotNull UUID jobId) {
        return registry.remove(jobId);
    }

    @Override
    public boolean enableJob(@NotNull UUID jobId) {
        return registry.enable(jobId);
    }

    @Override
    public boolean disableJob(@NotNull UUID jobId) {
        return registry.disable(jobId);
    }

    @Override
    public @NotNull Optional<JobInfo> query(@NotNull UUID jobId) {
        return registry.query(jobId);
    }

    @Override
    public @NotNull List<JobInfo> listJobs() {
        return registry.list();
    }

    /**
     * Start the loop thread. Calling it on a running scheduler does nothing.
     *
     * @return {@code true} once the scheduler is running
     */
    @Override
    public boolean start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                logger.warn("Scheduler is already running");
                return true;
            }
            if (loopThread != null && loopThread.isAlive()) {
                logger.warn("Previous scheduler thread {} is still finishing its tick", loopThread.getName());
            }
            CancellationToken token = new CancellationToken();
            Thread thread = new Thread(() -> loop(token), threadName);
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((th, ex) ->
                    logger.error("Uncaught in {}", th.getName(), ex));
            loopToken = token;
            loopThread = thread;
            running.set(true);
            thread.start();
        }
        logger.info("Workflow scheduler started (tick={})", tickPeriod);
        return true;
    }

    @Override
    public boolean stop() {
        return stop(stopTimeout);
    }

    /**
     * Ask the loop to stop and wait up to {@code timeout} for its thread to end. A running job is not
     * interrupted.
     *
     * @return {@code false} if the thread is still alive after {@code timeout}; it stops on its next check
     */
    @Override
    public boolean stop(@NotNull Duration timeout) {
        Thread thread;
        synchronized (lifecycleLock) {
            if (!running.get()) {
                logger.warn("Scheduler is not running");
                return true;
            }
            running.set(false);
            loopToken.requestStop("Stop requested");
            thread = loopThread;
        }

        if (thread == Thread.currentThread()) {
            // stop() from inside a job: the loop exits once the job returns
            logger.info("Workflow scheduler stop requested from its own thread");
            return true;
        }
        try {
            thread.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for scheduler thread {} to stop", thread.getName());
            return false;
        }
        if (thread.isAlive()) {
            logger.warn("Scheduler thread {} did not stop within {}", thread.getName(), timeout);
            return false;
        }
        logger.info("Workflow scheduler stopped");
        return true;
    }

    @Override
    public @NotNull Clock clock() {
        return clock;
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public @NotNull SchedulerStatus status() {
        boolean alive;
        synchronized (lifecycleLock) {
            alive = loopThread != null && loopThread.isAlive();
        }
        return registry.status(running.get(), alive);
    }

    @Override
    public void close() {
        stop();
    }

    // ======== Internals ========

    private void loop(CancellationToken token) {
        logger.debug("Scheduler loop started");
        while (!token.isStopRequested()) {
            long tickStart = System.nanoTime();
            try {
                Instant tickedAt = runTick(token);
                if (idleUntilNextTick(token, tickStart, tickedAt)) break;
            } catch (InterruptedException ie) {
                // not a stop signal: only the token stops the loop
                logger.debug("Scheduler thread interrupted while idle");
            } catch (Throwable t) {
                logger.error("Error in scheduler loop, backing off {}", errorBackoff, t);
                try {
                    if (token.await(errorBackoff)) break;
                } catch (InterruptedException ie) {
                    logger.debug("Scheduler thread interrupted during back-off");
                }
            }
        }
        logger.debug("Scheduler loop finished: {}", token.reason());
    }

    /**
     * Waits until one {@code tickPeriod} has passed since the tick started, on the monotonic timer and
     * on the scheduler clock, so the next tick never observes a time earlier than {@code tickedAt + tickPeriod}.
     *
     * @return {@code true} if stop was requested while waiting
     */
    private boolean idleUntilNextTick(CancellationToken token, long tickStart, Instant tickedAt) throws InterruptedException {
        Duration pause = tickPeriod.minusNanos(System.nanoTime() - tickStart);
        if (!pause.isZero() && !pause.isNegative() && token.await(pause)) return true;

        // the wall clock may lag the monotonic timer by a fraction of a millisecond
        Duration lag = Duration.between(clock.instant(), tickedAt.plus(tickPeriod));
        return !lag.isZero() && !lag.isNegative() && lag.compareTo(tickPeriod) <= 0 && token.await(lag);
    }

    /**
     * One pass over the registry with a token that is never stopped.
     */
    void runTick() {
        runTick(new CancellationToken());
    }

    /**
     * @return the instant the tick captured as "now"
     */
    private Instant runTick(CancellationToken token) {
        synchronized (executionLock) {
            Instant now = clock.instant();
            for (JobRecord rec : registry.dueJobs(now)) {
                if (token.isStopRequested()) break;
                execute(rec, now);
            }
            return now;
        }
    }

    private void execute(JobRecord rec, Instant now) {
        if (!registry.beginRun(rec, now)) {
            logger.debug("Skipping job '{}' id={}: removed or disabled during the scan", rec.name, rec.id);
            return;
        }
        logger.debug("Executing job '{}' ({}) id={}", rec.name, rec.jobType, rec.id);
        fire(l -> l.onStart(rec.id));

        Throwable failure = null;
        try {
            rec.callback.run(rec.metadata);
        } catch (Throwable ex) {
            if (ex instanceof InterruptedException) Thread.currentThread().interrupt();
            failure = ex;
        } finally {
            registry.finishRun(rec, failure);
        }

        if (failure == null) {
            logger.debug("Completed job '{}' id={}", rec.name, rec.id);
            fire(l -> l.onComplete(rec.id));
        } else {
            Throwable error = failure;
            logger.error("Job execution failed: '{}' id={}", rec.name, rec.id, error);
            fire(l -> l.onError(rec.id, error));
        }
    }

    private void fire(Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (Throwable t) {
                logger.warn("Job event listener {} failed", l, t);
            }
        }
    }
}
