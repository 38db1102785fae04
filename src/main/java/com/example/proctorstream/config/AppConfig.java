package com.example.proctorstream.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Timer scheduler for screenshot timeouts and dashboard pushes. Tests swap in a virtual one.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler timerScheduler() {
        return Schedulers.newParallel("proctor-timer", 2, true);
    }
}
