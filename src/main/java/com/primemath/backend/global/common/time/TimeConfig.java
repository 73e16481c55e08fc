package com.primemath.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public CenterTime centerTime(Clock clock, @Value("${app.time.center-zone:Asia/Seoul}") String centerZone) {
        return new CenterTime(clock, ZoneId.of(centerZone));
    }
}
