package com.streamfirst.shush.adapters;

import com.streamfirst.shush.domain.Expiration;
import com.streamfirst.shush.domain.SilenceFilter;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Subject;
import com.streamfirst.shush.domain.Target;
import com.streamfirst.shush.ports.ConflictException;
import com.streamfirst.shush.ports.RegistryUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySilenceRegistryAdapterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Target WEB = Target.of(Subject.client("web-01"), "disk");
    private static final Target DB = Target.allChecks(Subject.subscription("db"));

    private final InMemorySilenceRegistryAdapter registry =
            new InMemorySilenceRegistryAdapter(Clock.fixed(NOW, ZoneOffset.UTC));

    private static SilenceRecord record(Target target, String ttl, String reason, Instant createdAt) {
        return SilenceRecord.build(target, Expiration.parse(ttl, false), reason, "ops", createdAt);
    }

    @Test
    void createIsIdempotentForSameIntent() {
        registry.create(record(WEB, "10m", "maintenance", NOW), false);
        registry.create(record(WEB, "10m", "maintenance", NOW), false);

        assertThat(registry.createCount()).isEqualTo(1);
        assertThat(registry.all()).hasSize(1);
    }

    @Test
    void differentIntentConflictsUnlessReplacing() {
        registry.create(record(WEB, "10m", "maintenance", NOW), false);

        assertThatThrownBy(() -> registry.create(record(WEB, "1h", "maintenance", NOW), false))
                .isInstanceOf(ConflictException.class);

        registry.create(record(WEB, "1h", "maintenance", NOW), true);
        assertThat(registry.get(WEB).flatMap(SilenceRecord::ttl)).contains(Duration.ofHours(1));
    }

    @Test
    void expiredRecordsAreInvisibleAndReplaceable() {
        registry.put(record(WEB, "10m", "old", NOW.minus(Duration.ofHours(1))));

        assertThat(registry.list(SilenceFilter.all())).isEmpty();

        registry.create(record(WEB, "10m", "new", NOW), false);
        assertThat(registry.get(WEB).flatMap(SilenceRecord::getReason)).contains("new");
    }

    @Test
    void deleteIsIdempotent() {
        registry.put(record(DB, "10m", null, NOW));

        registry.delete(DB);
        registry.delete(DB);

        assertThat(registry.deleteCount()).isEqualTo(1);
        assertThat(registry.get(DB)).isEmpty();
    }

    @Test
    void listAppliesFilter() {
        registry.put(record(WEB, "10m", null, NOW));
        registry.put(record(DB, "10m", null, NOW));

        assertThat(registry.list(SilenceFilter.of("^db$", null)))
                .extracting(SilenceRecord::getTarget)
                .containsExactly(DB);
    }

    @Test
    void injectedFaultsFireInOrderThenClear() {
        registry.failNext(WEB, new RegistryUnavailableException("first"));

        assertThatThrownBy(() -> registry.delete(WEB)).hasMessage("first");
        registry.delete(WEB);
        assertThat(registry.callCount()).isEqualTo(2);
    }
}
