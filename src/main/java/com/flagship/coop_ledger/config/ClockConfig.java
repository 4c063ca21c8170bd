package com.flagship.coop_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Business-day clock. "Today" for day begin, day end and reopen is the
 * calendar date in the cooperative's zone, not the server's.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock businessClock(@Value("${coop-ledger.business-zone:UTC}") String businessZone) {
        return Clock.system(ZoneId.of(businessZone));
    }
}
