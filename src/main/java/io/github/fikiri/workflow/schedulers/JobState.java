package io.github.fikiri.workflow.schedulers;

/**
 * Outcome of the most recent execution attempt of a job.
 */
public enum JobState {SCHEDULED, RUNNING, COMPLETED, FAILED}
