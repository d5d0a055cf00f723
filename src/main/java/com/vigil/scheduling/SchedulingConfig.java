package com.vigil.scheduling;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Time sources of the engine, exposed as beans so tests can swap them for virtual ones
 */
@Configuration
public class SchedulingConfig {
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean(destroyMethod = "dispose")
    public Scheduler refreshScheduler() {
        return Schedulers.newParallel("vigil-refresh", 2);
    }
}
