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

/**
 * In-memory set of scheduled jobs.
 * <p>
 * All mutation and enumeration happens under a single lock, so registry calls made from any thread
 * cannot race with the scheduler's scan. Job callbacks are never invoked while the lock is held.
 * <p>
 * The registry does no timing of its own: it only answers which jobs are due at a given instant
 * and records the outcome of each attempt.
 */
@ThreadSafe
public final class JobRegistry {
    private final static Logger logger = LoggerFactory.getLogger(JobRegistry.class);

    private final Object lock = new Object();
    private final Clock clock;
    private final boolean resetScheduleOnEnable;

    @GuardedBy("lock")
    private final Map<UUID, JobRecord> jobs = new LinkedHashMap<>();

    /**
     * @param clock                 source of the registration time
     * @param resetScheduleOnEnable if {@code true}, enabling a disabled job sets {@code nextRun = now + interval}
     *                              instead of keeping the schedule it had when it was disabled
     */
    public JobRegistry(@NotNull Clock clock, boolean resetScheduleOnEnable) {
        this.clock = ObjectsUtils.requireNonNull(clock, new IllegalArgumentException("clock must be NotNull"));
        this.resetScheduleOnEnable = resetScheduleOnEnable;
    }

    public JobRegistry(@NotNull Clock clock) {
        this(clock, false);
    }

    /**
     * Registers an enabled job that first becomes due one {@code interval} from now.
     *
     * @return the id of the new job
     * @throws IllegalArgumentException if {@code interval} is not positive or a required argument is null
     */
    public @NotNull UUID add(@NotNull String name, @NotNull String jobType, @NotNull JobCallback callback,
                             @NotNull Duration interval, @Nullable Map<String, Object> metadata) {
        ObjectsUtils.requireNonNull(name, new IllegalArgumentException("name must be NotNull"));
        ObjectsUtils.requireNonNull(jobType, new IllegalArgumentException("jobType must be NotNull"));
        ObjectsUtils.requireNonNull(callback, new IllegalArgumentException("callback must be NotNull"));
        ObjectsUtils.requireNonNull(interval, new IllegalArgumentException("interval must be NotNull"));
        ObjectsUtils.requireTrue(!interval.isZero() && !interval.isNegative(),
                new IllegalArgumentException("interval must be positive: " + interval));

        Map<String, Object> params = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        UUID id = UUID.randomUUID();
        JobRecord rec = new JobRecord(id, name, jobType, callback, interval, params, clock.instant().plus(interval));
        synchronized (lock) {
            jobs.put(id, rec);
        }
        logger.info("Added job '{}' ({}) id={} interval={}", name, jobType, id, interval);
        return id;
    }

    /**
     * @return {@code true} if the job existed and was removed
     */
    public boolean remove(@NotNull UUID jobId) {
        JobRecord rec;
        synchronized (lock) {
            rec = jobs.remove(jobId);
            if (rec == null) return false;
            rec.removed = true;
        }
        logger.info("Removed job '{}' id={}", rec.name, jobId);
        return true;
    }

    /**
     * Marks the job eligible for execution. Keeps its {@code nextRun} unless the registry was built with
     * {@code resetScheduleOnEnable}.
     *
     * @return {@code true} if the job exists
     */
    public boolean enable(@NotNull UUID jobId) {
        String name;
        synchronized (lock) {
            JobRecord rec = jobs.get(jobId);
            if (rec == null) return false;
            if (!rec.enabled && resetScheduleOnEnable) {
                rec.nextRun = clock.instant().plus(rec.interval);
            }
            rec.enabled = true;
            name = rec.name;
        }
        logger.info("Enabled job '{}' id={}", name, jobId);
        return true;
    }

    /**
     * @return {@code true} if the job exists
     */
    public boolean disable(@NotNull UUID jobId) {
        String name;
        synchronized (lock) {
            JobRecord rec = jobs.get(jobId);
            if (rec == null) return false;
            rec.enabled = false;
            name = rec.name;
        }
        logger.info("Disabled job '{}' id={}", name, jobId);
        return true;
    }

    public @NotNull Optional<JobInfo> query(@NotNull UUID jobId) {
        synchronized (lock) {
            JobRecord rec = jobs.get(jobId);
            return rec == null ? Optional.empty() : Optional.of(rec.snapshot());
        }
    }

    /**
     * @return snapshots of all jobs in registration order
     */
    public @NotNull List<JobInfo> list() {
        synchronized (lock) {
            List<JobInfo> out = new ArrayList<>(jobs.size());
            for (JobRecord rec : jobs.values()) out.add(rec.snapshot());
            return out;
        }
    }

    public int size() {
        synchronized (lock) {
            return jobs.size();
        }
    }

    public int enabledCount() {
        synchronized (lock) {
            int n = 0;
            for (JobRecord rec : jobs.values()) {
                if (rec.enabled) n++;
            }
            return n;
        }
    }

    // ======== Scheduler loop primitives ========

    SchedulerStatus status(boolean running, boolean schedulerThreadAlive) {
        synchronized (lock) {
            int enabled = 0;
            for (JobRecord rec : jobs.values()) {
                if (rec.enabled) enabled++;
            }
            return new SchedulerStatus(running, jobs.size(), enabled, schedulerThreadAlive);
        }
    }

    /**
     * Enabled jobs whose {@code nextRun} is at or before {@code now}, in registration order.
     */
    List<JobRecord> dueJobs(Instant now) {
        synchronized (lock) {
            List<JobRecord> due = new ArrayList<>();
            for (JobRecord rec : jobs.values()) {
                if (rec.enabled && !rec.nextRun.isAfter(now)) due.add(rec);
            }
            return due;
        }
    }

    /**
     * Records the start of an attempt. Fails if the job was removed or disabled after the due scan.
     */
    boolean beginRun(JobRecord rec, Instant now) {
        synchronized (lock) {
            if (rec.removed || !rec.enabled) return false;
            rec.lastRun = now;
            rec.state = JobState.RUNNING;
            return true;
        }
    }

    /**
     * Records the end of an attempt: {@code nextRun} advances by one interval from the attempt's start.
     */
    void finishRun(JobRecord rec, @Nullable Throwable error) {
        synchronized (lock) {
            rec.nextRun = rec.lastRun.plus(rec.interval);
            rec.runCount++;
            if (error == null) {
                rec.state = JobState.COMPLETED;
            } else {
                rec.state = JobState.FAILED;
                rec.lastError = String.valueOf(error);
            }
        }
    }
}
