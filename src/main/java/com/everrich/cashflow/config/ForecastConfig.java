package com.everrich.cashflow.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the forecast settings and supplies the clock "today" is read from. Only the service
 * layer asks for the current date; the forecast engine always receives explicit dates.
 */
@Configuration
@EnableConfigurationProperties(ForecastProperties.class)
public class ForecastConfig {

    private static final Logger log = LoggerFactory.getLogger(ForecastConfig.class);

    @Bean
    public Clock clock(ForecastProperties forecastProperties) {
        Clock clock = Clock.system(forecastProperties.resolveZone());
        log.info("ForecastConfig successfully wired with zone: {}, default days: {}, max days: {}",
                clock.getZone(), forecastProperties.getDefaultDays(), forecastProperties.getMaxDays());
        return clock;
    }
}
