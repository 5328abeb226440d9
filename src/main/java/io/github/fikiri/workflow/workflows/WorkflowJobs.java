package io.github.fikiri.workflow.workflows;

import io.github.fikiri.workflow.ObjectsUtils;
import io.github.fikiri.workflow.schedulers.JobCallback;
import io.github.fikiri.workflow.schedulers.WorkflowSchedulerInterface;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Builders for the recurring business workflows.
 * <p>
 * Each method only turns its arguments into an interval and a metadata map and registers the
 * caller's job body through {@link WorkflowSchedulerInterface#addJob}. The body receives the
 * metadata keys listed on each method.
 */
public final class WorkflowJobs {
    public static final String EMAIL_PROCESSING = "email_processing";
    public static final String CRM_FOLLOWUPS = "crm_followups";
    public static final String LEAD_INGESTION = "lead_ingestion";
    public static final String BUSINESS_HOURS = "business_hours";

    private final WorkflowSchedulerInterface scheduler;
    private final Clock clock;

    public WorkflowJobs(@NotNull WorkflowSchedulerInterface scheduler, @NotNull Clock clock) {
        this.scheduler = ObjectsUtils.requireNonNull(scheduler, new IllegalArgumentException("scheduler must be NotNull"));
        this.clock = ObjectsUtils.requireNonNull(clock, new IllegalArgumentException("clock must be NotNull"));
    }

    /**
     * Business hours are evaluated against the scheduler's own clock.
     */
    public WorkflowJobs(@NotNull WorkflowSchedulerInterface scheduler) {
        this(scheduler, ObjectsUtils.requireNonNull(scheduler,
                new IllegalArgumentException("scheduler must be NotNull")).clock());
    }

    /**
     * Metadata: {@code query}, {@code max_emails}, {@code auto_reply}.
     */
    public @NotNull UUID scheduleEmailProcessing(@NotNull String query, long intervalMinutes, int maxEmails,
                                                 boolean autoReply, @NotNull JobCallback body) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("query", query);
        metadata.put("max_emails", maxEmails);
        metadata.put("auto_reply", autoReply);
        return scheduler.addJob("Email Processing - " + query, EMAIL_PROCESSING, body,
                interval(intervalMinutes, ChronoUnit.MINUTES), metadata);
    }

    /**
     * Unread mail every 30 minutes, at most 10 messages, no auto-reply.
     */
    public @NotNull UUID scheduleEmailProcessing(@NotNull JobCallback body) {
        return scheduleEmailProcessing("is:unread", 30, 10, false, body);
    }

    /**
     * Metadata: {@code stage_filter} (null for all stages), {@code send}.
     */
    public @NotNull UUID scheduleCrmFollowups(@Nullable String stageFilter, long intervalHours, boolean send,
                                              @NotNull JobCallback body) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("stage_filter", stageFilter);
        metadata.put("send", send);
        return scheduler.addJob("CRM Follow-ups - " + (stageFilter != null ? stageFilter : "all"), CRM_FOLLOWUPS, body,
                interval(intervalHours, ChronoUnit.HOURS), metadata);
    }

    /**
     * All stages, daily, dry run.
     */
    public @NotNull UUID scheduleCrmFollowups(@NotNull JobCallback body) {
        return scheduleCrmFollowups(null, 24, false, body);
    }

    /**
     * Metadata: {@code source}.
     */
    public @NotNull UUID scheduleLeadIngestion(@NotNull String source, long intervalMinutes, @NotNull JobCallback body) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", source);
        return scheduler.addJob("Lead Ingestion - " + source, LEAD_INGESTION, body,
                interval(intervalMinutes, ChronoUnit.MINUTES), metadata);
    }

    public @NotNull UUID scheduleLeadIngestion(@NotNull JobCallback body) {
        return scheduleLeadIngestion("webhook", 15, body);
    }

    /**
     * Hourly job that only calls {@code body} between 9:00 and 18:59 local time.
     * Metadata: {@code workflow_type}.
     */
    public @NotNull UUID scheduleBusinessHoursWorkflow(@NotNull String workflowType, @NotNull JobCallback body) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("workflow_type", workflowType);
        return scheduler.addJob("Business Hours - " + workflowType, BUSINESS_HOURS, new BusinessHoursGate(clock, body),
                Duration.ofHours(1), metadata);
    }

    public @NotNull UUID scheduleBusinessHoursWorkflow(@NotNull JobCallback body) {
        return scheduleBusinessHoursWorkflow(EMAIL_PROCESSING, body);
    }

    private static Duration interval(long amount, ChronoUnit unit) {
        ObjectsUtils.requireTrue(amount > 0,
                new IllegalArgumentException("interval must be positive: " + amount + " " + unit));
        try {
            return Duration.of(amount, unit);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("interval out of range: " + amount + " " + unit, e);
        }
    }
}
