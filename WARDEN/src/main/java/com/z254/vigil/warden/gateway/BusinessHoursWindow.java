package com.z254.vigil.warden.gateway;

import com.z254.vigil.warden.config.WardenProperties;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Business-hours restriction, evaluated in the configured zone.
 */
public class BusinessHoursWindow {

    private final WardenProperties.BusinessHours config;
    private final ZoneId zone;

    public BusinessHoursWindow(WardenProperties.BusinessHours config) {
        this.config = config;
        this.zone = ZoneId.of(config.getZone());
    }

    /**
     * True when the restriction is configured and {@code instant} falls inside business hours.
     */
    public boolean isRestricted(Instant instant) {
        if (!config.isEnabled()) {
            return false;
        }
        ZonedDateTime time = instant.atZone(zone);
        int hour = time.getHour();
        return config.getDays().contains(time.getDayOfWeek())
                && hour >= config.getStartHour()
                && hour < config.getEndHour();
    }
}
