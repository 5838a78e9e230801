package com.streamfirst.shush.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpirationTest {

    @Test
    void parsesCompoundDurations() {
        assertThat(Expiration.parse("1h30m", false).ttl()).contains(Duration.ofMinutes(90));
        assertThat(Expiration.parse("1d2h", false).ttl()).contains(Duration.ofHours(26));
        assertThat(Expiration.parse("45s", false).ttl()).contains(Duration.ofSeconds(45));
    }

    @Test
    void bareNumberIsSeconds() {
        assertThat(Expiration.parse("3600", false).ttl()).contains(Duration.ofHours(1));
    }

    @Test
    void noneIsIndefinite() {
        Expiration expiration = Expiration.parse("NONE", true);

        assertThat(expiration.isIndefinite()).isTrue();
        assertThat(expiration.ttl()).isEmpty();
        assertThat(expiration.expireOnResolve()).isTrue();
        assertThat(expiration).hasToString("not expire until resolution");
    }

    @Test
    void blankFallsBackToTwoHours() {
        assertThat(Expiration.parse(" ", false).ttl()).contains(Expiration.DEFAULT_TTL);
        assertThat(Expiration.parse(null, false)).isEqualTo(Expiration.defaultExpiration(false));
    }

    @Test
    void zeroTtlFailsValidation() {
        Expiration zero = Expiration.parse("0", false);

        assertThatThrownBy(zero::validate)
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("positive");
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> Expiration.parse("soon", false)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Expiration.parse("1w", false)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Expiration.parse("-5m", false)).isInstanceOf(ValidationException.class);
    }

    @Test
    void describesTimedExpiration() {
        assertThat(Expiration.parse("10m", true)).hasToString("expire in 600 seconds or on resolution");
    }
}
