package com.example.slotnotifier.config;

import com.example.slotnotifier.service.executor.JobRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Wires the clock every time computation goes through and the job registry
 * that owns the worker pool.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock(SlotNotifierProperties properties) {
        var zone = ZoneId.of(properties.getTimeZone());
        log.info("Scheduling in time zone {}", zone);
        return Clock.system(zone);
    }

    @Bean(initMethod = "init", destroyMethod = "shutdown")
    public JobRegistry jobRegistry(SlotNotifierProperties properties) {
        return new JobRegistry(properties.getWorkerPoolSize(), Duration.ofSeconds(properties.getShutdownWaitSeconds()));
    }
}
