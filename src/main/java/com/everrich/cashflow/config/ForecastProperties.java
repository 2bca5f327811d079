package com.everrich.cashflow.config;

import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Forecast settings, bound from {@code app.forecast.*} in application.properties.
 */
@ConfigurationProperties(prefix = "app.forecast")
public class ForecastProperties {

    /**
     * Forecast length when the caller does not ask for one.
     * Default: 90
     */
    private int defaultDays = 90;

    /**
     * Upper bound for a requested forecast length.
     * Default: 3660 (about ten years)
     */
    private int maxDays = 3660;

    /**
     * Look-ahead for the upcoming transactions list when none (or an invalid value) is given.
     * Default: 30
     */
    private int upcomingDefaultDays = 30;

    /**
     * Zone used to decide which calendar day "today" is. Blank means the system default.
     */
    private String zoneId = "";

    public int getDefaultDays() {
        return defaultDays;
    }

    public void setDefaultDays(int defaultDays) {
        this.defaultDays = defaultDays;
    }

    public int getMaxDays() {
        return maxDays;
    }

    public void setMaxDays(int maxDays) {
        this.maxDays = maxDays;
    }

    public int getUpcomingDefaultDays() {
        return upcomingDefaultDays;
    }

    public void setUpcomingDefaultDays(int upcomingDefaultDays) {
        this.upcomingDefaultDays = upcomingDefaultDays;
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }

    public ZoneId resolveZone() {
        return zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId.trim());
    }
}
