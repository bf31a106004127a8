package dev.careeriq.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class ClockConfig {

    /**
     * Reference "today" for open-ended durations such as "2021 - Present".
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
