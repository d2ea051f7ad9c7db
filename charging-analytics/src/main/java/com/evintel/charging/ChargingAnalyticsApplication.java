package com.evintel.charging;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class ChargingAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChargingAnalyticsApplication.class, args);
    }

    /** All cycle dates and timestamps are UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
