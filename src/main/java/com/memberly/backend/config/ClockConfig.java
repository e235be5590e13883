package com.memberly.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** 測試可用 @TestConfiguration + @Primary 換成 Clock.fixed(...) */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
