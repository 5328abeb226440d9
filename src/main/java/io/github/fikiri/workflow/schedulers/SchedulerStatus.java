package io.github.fikiri.workflow.schedulers;

/**
 * Scheduler status snapshot.
 */
public final class SchedulerStatus {
    public final boolean running;
    public final int totalJobs;
    public final int enabledJobs;
    public final int disabledJobs;
    public final boolean schedulerThreadAlive;

    SchedulerStatus(boolean running, int totalJobs, int enabledJobs, boolean schedulerThreadAlive) {
        this.running = running;
        this.totalJobs = totalJobs;
        this.enabledJobs = enabledJobs;
        this.disabledJobs = totalJobs - enabledJobs;
        this.schedulerThreadAlive = schedulerThreadAlive;
    }

    @Override
    public String toString() {
        return "SchedulerStatus{running=" + running + ", totalJobs=" + totalJobs + ", enabledJobs=" + enabledJobs +
                ", disabledJobs=" + disabledJobs + ", schedulerThreadAlive=" + schedulerThreadAlive + '}';
    }
}
