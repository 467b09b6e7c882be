package io.herald.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TimezonesTest {

    @Test
    void shouldPreferConfiguredZoneThenTzThenUtc() {
        assertThat(Timezones.resolveExecutionZone("Europe/Paris", "Asia/Tokyo")).isEqualTo(ZoneId.of("Europe/Paris"));
        assertThat(Timezones.resolveExecutionZone("", "Asia/Tokyo")).isEqualTo(ZoneId.of("Asia/Tokyo"));
        assertThat(Timezones.resolveExecutionZone(null, null)).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void shouldFallBackToUtcWhenExecutionZoneCannotBeLoaded() {
        assertThat(Timezones.resolveExecutionZone("Nowhere/Land", null)).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void shouldRejectInvalidOwnerZone() {
        assertThatThrownBy(() -> Timezones.resolve("Nowhere/Land"))
            .isInstanceOf(ScheduleSpecException.class)
            .hasMessageContaining("Invalid timezone 'Nowhere/Land'");
        assertThatThrownBy(() -> Timezones.resolve(" "))
            .isInstanceOf(ScheduleSpecException.class);
    }
}
