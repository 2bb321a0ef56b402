package com.agile.Buro.Config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        // same zone Hibernate uses for @CreationTimestamp and @UpdateTimestamp
        return Clock.systemDefaultZone();
    }
}
