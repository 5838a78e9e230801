package com.streamfirst.shush.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SilenceFilterTest {

    @Test
    void emptyFilterMatchesEverything() {
        assertThat(SilenceFilter.all().matches(Target.allChecks(Subject.ALL))).isTrue();
        assertThat(SilenceFilter.of(null, "").matches(Target.of(Subject.client("a"), "disk"))).isTrue();
    }

    @Test
    void regexesSearchWithinSubscriptionAndCheck() {
        SilenceFilter filter = SilenceFilter.of("web", "^disk");

        assertThat(filter.matches(Target.of(Subject.client("web-1"), "disk_usage"))).isTrue();
        assertThat(filter.matches(Target.of(Subject.subscription("webservers"), "disk"))).isTrue();
        assertThat(filter.matches(Target.of(Subject.client("db-1"), "disk"))).isFalse();
        assertThat(filter.matches(Target.of(Subject.client("web-1"), "root_disk"))).isFalse();
    }

    @Test
    void allClientsHaveAnEmptySubscription() {
        assertThat(SilenceFilter.of("web", null).matches(Target.of(Subject.ALL, "disk"))).isFalse();
    }

    @Test
    void invalidRegexIsRejected() {
        assertThatThrownBy(() -> SilenceFilter.of("web(", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("web(");
    }
}
