package com.nestegg.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(SandboxProperties sandboxProperties) {
        return Clock.system(sandboxProperties.zoneId());
    }
}
