package com.gt.chamlang.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    // Calendar days for streaks and "due today" are counted in this zone.
    @Bean
    public Clock getStatsClock(@Value("${chamlang.stats.zoneId:}") String zoneId) {
        if (zoneId == null || zoneId.isBlank()) {
            return Clock.systemDefaultZone();
        }

        log.info("Using zone {} for practice statistics", zoneId);
        return Clock.system(ZoneId.of(zoneId));
    }
}
