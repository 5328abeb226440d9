package io.github.fikiri.workflow.schedulers;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowSchedulerInterface extends AutoCloseable {
    void addListener(@NotNull JobEventListener l);

    void removeListener(@NotNull JobEventListener l);

    @NotNull UUID addJob(@NotNull String name, @NotNull String jobType, @NotNull JobCallback callback,
                         @NotNull Duration interval, @Nullable Map<String, Object> metadata);

    boolean removeJob(@NotNull UUID jobId);

    boolean enableJob(@NotNull UUID jobId);

    boolean disableJob(@NotNull UUID jobId);

    @NotNull Optional<JobInfo> query(@NotNull UUID jobId);

    @NotNull List<JobInfo> listJobs();

    boolean start();

    boolean stop();

    boolean stop(@NotNull Duration timeout);

    /**
     * Clock used for registration times and due checks.
     */
    @NotNull Clock clock();

    boolean isRunning();

    @NotNull SchedulerStatus status();

    @Override
    void close();
}
