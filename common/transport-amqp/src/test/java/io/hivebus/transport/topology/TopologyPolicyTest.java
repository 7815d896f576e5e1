package io.hivebus.transport.topology;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TopologyPolicyTest {

    private static final Set<QueueCategory> PERMANENT = EnumSet.of(
        QueueCategory.REQUEST, QueueCategory.RESPONSE, QueueCategory.REQUEST_LB, QueueCategory.EVENT_LB);

    private final TopologyPolicy policy = TopologyPolicy.defaults();

    @Test
    void onlyPointToPointAndBalancedQueuesNeverExpire() {
        for (QueueCategory category : QueueCategory.values()) {
            QueueOptions options = policy.optionsFor(category);
            if (PERMANENT.contains(category)) {
                assertThat(options.expires()).as(category.name()).isFalse();
                assertThat(options.autoDelete()).as(category.name()).isFalse();
                assertThat(options.declareArguments()).as(category.name()).isEmpty();
            } else {
                assertThat(options.autoDelete()).as(category.name()).isTrue();
                assertThat(options.messageTtl()).as(category.name()).isPositive();
            }
        }
    }

    @Test
    void controlQueuesExpireAfterFiveSeconds() {
        QueueOptions heartbeat = policy.optionsFor(QueueCategory.HEARTBEAT);

        assertThat(heartbeat.messageTtl()).isEqualTo(5000L);
        assertThat(heartbeat.declareArguments()).containsEntry("x-message-ttl", 5000L);
    }

    @Test
    void eventTimeToLiveIsConfigurable() {
        TopologyPolicy custom = new TopologyPolicy(Duration.ofSeconds(30), QueueOverrides.NONE);

        assertThat(custom.optionsFor(QueueCategory.EVENT).messageTtl()).isEqualTo(30_000L);
        assertThat(custom.optionsFor(QueueCategory.INFO).messageTtl()).isEqualTo(5000L);
        assertThat(custom.optionsFor(QueueCategory.EVENT_LB).expires()).isFalse();
    }

    @Test
    void overridesWinOverCategoryDefaults() {
        QueueOverrides overrides = new QueueOverrides(false, null, null, 1000L, Map.of("x-max-length", 100));
        TopologyPolicy custom = new TopologyPolicy(Duration.ofSeconds(5), overrides);

        QueueOptions response = custom.optionsFor(QueueCategory.RESPONSE);
        assertThat(response.durable()).isFalse();
        assertThat(response.autoDelete()).isFalse();
        assertThat(response.messageTtl()).isEqualTo(1000L);
        assertThat(response.declareArguments())
            .containsEntry("x-max-length", 100)
            .containsEntry("x-message-ttl", 1000L);

        QueueOptions ping = custom.optionsFor(QueueCategory.PING);
        assertThat(ping.autoDelete()).isTrue();
        assertThat(ping.messageTtl()).isEqualTo(1000L);
    }

    @Test
    void rejectsNonPositiveEventTimeToLive() {
        assertThatThrownBy(() -> new TopologyPolicy(Duration.ZERO, QueueOverrides.NONE))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
