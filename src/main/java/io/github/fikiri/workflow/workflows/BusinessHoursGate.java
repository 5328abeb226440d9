package io.github.fikiri.workflow.workflows;

import io.github.fikiri.workflow.ObjectsUtils;
import io.github.fikiri.workflow.schedulers.JobCallback;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalTime;
import java.util.Map;

/**
 * Runs the wrapped job only while the local hour of {@code clock} is within
 * {@code [startHour, endHour]}, both inclusive. Outside that window a tick is a no-op.
 */
public final class BusinessHoursGate implements JobCallback {
    private final static Logger logger = LoggerFactory.getLogger(BusinessHoursGate.class);

    public static final int DEFAULT_START_HOUR = 9;
    public static final int DEFAULT_END_HOUR = 18;

    private final Clock clock;
    private final int startHour;
    private final int endHour;
    private final JobCallback delegate;

    public BusinessHoursGate(@NotNull Clock clock, int startHour, int endHour, @NotNull JobCallback delegate) {
        ObjectsUtils.requireTrue(startHour >= 0 && startHour <= 23 && endHour >= 0 && endHour <= 23,
                new IllegalArgumentException("hours must be within 0..23: " + startHour + ".." + endHour));
        ObjectsUtils.requireTrue(startHour <= endHour,
                new IllegalArgumentException("startHour must not be after endHour: " + startHour + ".." + endHour));
        this.clock = ObjectsUtils.requireNonNull(clock, new IllegalArgumentException("clock must be NotNull"));
        this.delegate = ObjectsUtils.requireNonNull(delegate, new IllegalArgumentException("delegate must be NotNull"));
        this.startHour = startHour;
        this.endHour = endHour;
    }

    public BusinessHoursGate(@NotNull Clock clock, @NotNull JobCallback delegate) {
        this(clock, DEFAULT_START_HOUR, DEFAULT_END_HOUR, delegate);
    }

    public boolean isOpen() {
        int hour = LocalTime.now(clock).getHour();
        return hour >= startHour && hour <= endHour;
    }

    @Override
    public void run(Map<String, Object> metadata) throws Exception {
        if (!isOpen()) {
            logger.debug("Outside business hours {}..{}, skipping {}", startHour, endHour, metadata);
            return;
        }
        delegate.run(metadata);
    }
}
