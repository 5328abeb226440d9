package io.github.fikiri.workflow.schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Point-in-time view of a registered job (read-only).
 */
public final class JobInfo {
    public final UUID id;
    public final String name;
    public final String jobType;
    public final Duration interval;
    public final boolean enabled;
    public final JobState state;
    public final Instant lastRun;
    public final Instant nextRun;
    public final String lastError;
    public final long runCount;
    public final Map<String, Object> metadata;

    JobInfo(UUID id, String name, String jobType, Duration interval, boolean enabled, JobState state,
            Instant lastRun, Instant nextRun, String lastError, long runCount, Map<String, Object> metadata) {
        this.id = id;
        this.name = name;
        this.jobType = jobType;
        this.interval = interval;
        this.enabled = enabled;
        this.state = state;
        this.lastRun = lastRun;
        this.nextRun = nextRun;
        this.lastError = lastError;
        this.runCount = runCount;
        this.metadata = metadata;
    }

    @Override
    public String toString() {
        return "JobInfo{id=" + id + ", name='" + name + "', type='" + jobType + "', interval=" + interval +
                ", enabled=" + enabled + ", state=" + state + ", lastRun=" + lastRun + ", nextRun=" + nextRun +
                ", runCount=" + runCount +
                (lastError != null ? ", lastError='" + lastError + '\'' : "") + '}';
    }
}
