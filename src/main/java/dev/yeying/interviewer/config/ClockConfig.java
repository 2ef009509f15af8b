package dev.yeying.interviewer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock used for node timestamps and generated fork names.
 * {@code app.clock.zone} selects the zone fork names are rendered in; the JVM default otherwise.
 */
@Configuration(proxyBeanMethods = false)
public class ClockConfig {

    @Value("${app.clock.zone:#{null}}")
    private String zone;

    @Bean
    public Clock clock() {
        return zone == null || zone.isBlank() ? Clock.systemDefaultZone() : Clock.system(ZoneId.of(zone));
    }
}
