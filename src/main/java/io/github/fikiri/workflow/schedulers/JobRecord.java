package io.github.fikiri.workflow.schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Mutable job entry owned by {@link JobRegistry}. Every non-final field is guarded by the registry lock.
 */
final class JobRecord {
    final UUID id;
    final String name;
    final String jobType;
    final JobCallback callback;
    final Duration interval;
    final Map<String, Object> metadata;

    boolean enabled = true;
    boolean removed = false;
    JobState state = JobState.SCHEDULED;
    Instant lastRun = null;
    Instant nextRun;
    String lastError = null;
    long runCount = 0;

    JobRecord(UUID id, String name, String jobType, JobCallback callback, Duration interval,
              Map<String, Object> metadata, Instant nextRun) {
        this.id = id;
        this.name = name;
        this.jobType = jobType;
        this.callback = callback;
        this.interval = interval;
        this.metadata = metadata;
        this.nextRun = nextRun;
    }

    JobInfo snapshot() {
        return new JobInfo(id, name, jobType, interval, enabled, state, lastRun, nextRun, lastError, runCount, metadata);
    }
}
