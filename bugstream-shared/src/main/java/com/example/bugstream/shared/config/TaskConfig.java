package com.example.bugstream.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class TaskConfig {

    /**
     * Single worker shared by the delivery and liveness loops, so no two ticks ever overlap.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler streamScheduler() {
        return Schedulers.newSingle("bugstream-loop");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
