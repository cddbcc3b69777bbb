package com.z254.vigil.warden.gateway;

import com.z254.vigil.warden.config.WardenProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BusinessHoursWindow}.
 */
class BusinessHoursWindowTest {

    private static BusinessHoursWindow window(boolean enabled, String zone) {
        WardenProperties.BusinessHours config = new WardenProperties.BusinessHours();
        config.setEnabled(enabled);
        config.setZone(zone);
        return new BusinessHoursWindow(config);
    }

    @Test
    @DisplayName("should never restrict when disabled")
    void disabled() {
        assertThat(window(false, "UTC").isRestricted(Instant.parse("2026-03-02T10:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("should restrict weekday office hours only")
    void weekdays() {
        BusinessHoursWindow window = window(true, "UTC");

        assertThat(window.isRestricted(Instant.parse("2026-03-02T09:00:00Z"))).isTrue();
        assertThat(window.isRestricted(Instant.parse("2026-03-02T17:59:59Z"))).isTrue();
        assertThat(window.isRestricted(Instant.parse("2026-03-02T18:00:00Z"))).isFalse();
        assertThat(window.isRestricted(Instant.parse("2026-03-02T08:59:59Z"))).isFalse();
        // Saturday
        assertThat(window.isRestricted(Instant.parse("2026-03-07T11:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("should evaluate hours in the configured zone")
    void zone() {
        BusinessHoursWindow window = window(true, "America/New_York");

        // 13:00 UTC is 08:00 in New York (EST)
        assertThat(window.isRestricted(Instant.parse("2026-03-02T13:00:00Z"))).isFalse();
        assertThat(window.isRestricted(Instant.parse("2026-03-02T15:00:00Z"))).isTrue();
    }
}
