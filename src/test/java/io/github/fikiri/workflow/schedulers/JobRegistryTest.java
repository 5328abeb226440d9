package io.github.fikiri.workflow.schedulers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class JobRegistryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    MutableClock clock;
    JobRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = new JobRegistry(clock);
    }

    @Test
    void add_schedulesFirstRunOneIntervalAfterRegistration() {
        UUID id = registry.add("Sweep", "crm_followups", md -> {}, Duration.ofSeconds(30), null);

        JobInfo info = registry.query(id).orElseThrow();
        assertEquals("Sweep", info.name);
        assertEquals("crm_followups", info.jobType);
        assertTrue(info.enabled);
        assertEquals(JobState.SCHEDULED, info.state);
        assertNull(info.lastRun);
        assertEquals(T0.plusSeconds(30), info.nextRun);
        assertTrue(info.metadata.isEmpty());
    }

    @Test
    void add_rejectsNonPositiveInterval_andLeavesRegistryUnchanged() {
        registry.add("ok", "t", md -> {}, Duration.ofSeconds(1), null);

        assertThrows(IllegalArgumentException.class,
                () -> registry.add("zero", "t", md -> {}, Duration.ZERO, null));
        assertThrows(IllegalArgumentException.class,
                () -> registry.add("negative", "t", md -> {}, Duration.ofSeconds(-5), null));
        assertThrows(IllegalArgumentException.class,
                () -> registry.add("null", "t", md -> {}, null, null));

        assertEquals(1, registry.size());
    }

    @Test
    void add_rejectsMissingCallback() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.add("no body", "t", null, Duration.ofSeconds(1), null));
        assertEquals(0, registry.size());
    }

    @Test
    void add_assignsDistinctIds() {
        Set<UUID> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(registry.add("same name", "t", md -> {}, Duration.ofSeconds(1), null));
        }
        assertEquals(100, ids.size());
    }

    @Test
    void metadata_isCopiedAndUnmodifiable() {
        Map<String, Object> md = new HashMap<>();
        md.put("source", "webhook");
        md.put("stage_filter", null);
        UUID id = registry.add("Leads", "lead_ingestion", m -> {}, Duration.ofMinutes(15), md);
        md.put("source", "changed");

        JobInfo info = registry.query(id).orElseThrow();
        assertEquals("webhook", info.metadata.get("source"));
        assertTrue(info.metadata.containsKey("stage_filter"));
        assertThrows(UnsupportedOperationException.class, () -> info.metadata.put("x", 1));
    }

    @Test
    void remove_reportsWhetherJobExisted() {
        UUID id = registry.add("a", "t", md -> {}, Duration.ofSeconds(1), null);

        assertTrue(registry.remove(id));
        assertFalse(registry.remove(id));
        assertFalse(registry.remove(UUID.randomUUID()));
        assertTrue(registry.query(id).isEmpty());
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void enableDisable_unknownIdReturnsFalse() {
        assertFalse(registry.enable(UUID.randomUUID()));
        assertFalse(registry.disable(UUID.randomUUID()));
    }

    @Test
    void disableAndEnable_keepNextRun() {
        UUID id = registry.add("a", "t", md -> {}, Duration.ofSeconds(10), null);

        assertTrue(registry.disable(id));
        assertFalse(registry.query(id).orElseThrow().enabled);
        clock.advance(Duration.ofMinutes(5));
        assertTrue(registry.enable(id));

        JobInfo info = registry.query(id).orElseThrow();
        assertTrue(info.enabled);
        assertEquals(T0.plusSeconds(10), info.nextRun);
    }

    @Test
    void enable_withResetPolicy_recomputesNextRunFromNow() {
        registry = new JobRegistry(clock, true);
        UUID id = registry.add("a", "t", md -> {}, Duration.ofSeconds(10), null);
        registry.disable(id);
        clock.advance(Duration.ofMinutes(5));

        registry.enable(id);

        assertEquals(T0.plus(Duration.ofMinutes(5)).plusSeconds(10), registry.query(id).orElseThrow().nextRun);
    }

    @Test
    void enable_withResetPolicy_onEnabledJob_keepsNextRun() {
        registry = new JobRegistry(clock, true);
        UUID id = registry.add("a", "t", md -> {}, Duration.ofSeconds(10), null);
        clock.advance(Duration.ofSeconds(3));

        registry.enable(id);

        assertEquals(T0.plusSeconds(10), registry.query(id).orElseThrow().nextRun);
    }

    @Test
    void list_returnsSnapshotsInRegistrationOrder() {
        UUID first = registry.add("first", "t", md -> {}, Duration.ofSeconds(1), null);
        UUID second = registry.add("second", "t", md -> {}, Duration.ofSeconds(1), null);

        List<JobInfo> before = registry.list();
        registry.disable(first);
        registry.remove(second);

        assertEquals(2, before.size());
        assertEquals(first, before.get(0).id);
        assertEquals(second, before.get(1).id);
        assertTrue(before.get(0).enabled, "snapshot must not follow later changes");
        assertEquals(1, registry.list().size());
    }

    @Test
    void counts_trackEnabledAndDisabledJobs() {
        UUID a = registry.add("a", "t", md -> {}, Duration.ofSeconds(1), null);
        registry.add("b", "t", md -> {}, Duration.ofSeconds(1), null);
        registry.disable(a);

        assertEquals(2, registry.size());
        assertEquals(1, registry.enabledCount());
        SchedulerStatus status = registry.status(false, false);
        assertEquals(2, status.totalJobs);
        assertEquals(1, status.enabledJobs);
        assertEquals(1, status.disabledJobs);
    }

    @Test
    void dueJobs_containsOnlyEnabledJobsAtOrPastNextRun() {
        UUID fast = registry.add("fast", "t", md -> {}, Duration.ofSeconds(1), null);
        registry.add("slow", "t", md -> {}, Duration.ofSeconds(10), null);
        UUID off = registry.add("off", "t", md -> {}, Duration.ofSeconds(1), null);
        registry.disable(off);

        assertTrue(registry.dueJobs(T0).isEmpty());

        List<JobRecord> due = registry.dueJobs(T0.plusSeconds(1));
        assertEquals(1, due.size());
        assertEquals(fast, due.get(0).id);
    }

    @Test
    void finishRun_anchorsNextRunToAttemptStart_forSuccessAndFailure() {
        registry.add("a", "t", md -> {}, Duration.ofSeconds(5), null);
        Instant start = T0.plusSeconds(7);
        JobRecord rec = registry.dueJobs(start).get(0);

        assertTrue(registry.beginRun(rec, start));
        registry.finishRun(rec, null);
        assertEquals(start.plusSeconds(5), rec.nextRun);
        assertEquals(JobState.COMPLETED, rec.state);

        Instant second = start.plusSeconds(5);
        assertTrue(registry.beginRun(rec, second));
        registry.finishRun(rec, new IllegalStateException("smtp down"));
        assertEquals(second.plusSeconds(5), rec.nextRun);
        assertEquals(JobState.FAILED, rec.state);
        assertTrue(rec.lastError.contains("smtp down"));
        assertEquals(2, rec.runCount);
        assertTrue(rec.enabled);
    }

    @Test
    void beginRun_refusesRemovedOrDisabledJob() {
        UUID a = registry.add("a", "t", md -> {}, Duration.ofSeconds(1), null);
        UUID b = registry.add("b", "t", md -> {}, Duration.ofSeconds(1), null);
        List<JobRecord> due = registry.dueJobs(T0.plusSeconds(1));

        registry.remove(a);
        registry.disable(b);

        assertFalse(registry.beginRun(due.get(0), T0.plusSeconds(1)));
        assertFalse(registry.beginRun(due.get(1), T0.plusSeconds(1)));
    }
}
