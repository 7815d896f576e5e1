package io.hivebus.transport.topology;

import java.time.Duration;
import java.util.Objects;

/**
 * Maps a queue category to the lifetime options of the queues declared for it.
 * <p>
 * Point-to-point and load-balanced queues never expire. Control and broadcast queues auto-delete
 * and drop messages after {@link #CONTROL_TIME_TO_LIVE}; plain event queues use the configured
 * event time-to-live. Configured overrides are applied last and win on every field they set.
 */
public final class TopologyPolicy {

    public static final Duration CONTROL_TIME_TO_LIVE = Duration.ofSeconds(5);
    public static final Duration DEFAULT_EVENT_TIME_TO_LIVE = Duration.ofSeconds(5);

    private final long eventTimeToLiveMs;
    private final QueueOverrides overrides;

    public TopologyPolicy(Duration eventTimeToLive, QueueOverrides overrides) {
        Objects.requireNonNull(eventTimeToLive, "eventTimeToLive");
        if (eventTimeToLive.isNegative() || eventTimeToLive.isZero()) {
            throw new IllegalArgumentException("eventTimeToLive must be positive");
        }
        this.eventTimeToLiveMs = eventTimeToLive.toMillis();
        this.overrides = overrides != null ? overrides : QueueOverrides.NONE;
    }

    public static TopologyPolicy defaults() {
        return new TopologyPolicy(DEFAULT_EVENT_TIME_TO_LIVE, QueueOverrides.NONE);
    }

    public QueueOptions optionsFor(QueueCategory category) {
        return baseOptions(category).merge(overrides);
    }

    private QueueOptions baseOptions(QueueCategory category) {
        Objects.requireNonNull(category, "category");
        return switch (category) {
            case REQUEST, RESPONSE, REQUEST_LB, EVENT_LB -> QueueOptions.permanent();
            case DISCOVER, INFO, DISCONNECT, HEARTBEAT, PING, PONG, UNKNOWN ->
                QueueOptions.expiring(CONTROL_TIME_TO_LIVE.toMillis());
            case EVENT -> QueueOptions.expiring(eventTimeToLiveMs);
        };
    }
}
