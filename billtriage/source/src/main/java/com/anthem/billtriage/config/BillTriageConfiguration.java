package com.anthem.billtriage.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(BillTriageProperties.class)
public class BillTriageConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
