package com.gt.quranquest.conf;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

// Single time source for practice, mastery and lesson timestamps
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${quranquest.timezone:UTC}") String timezone) {
        String configuredZone = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
