package ch.minigolf.minigolfbackend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Configuration for task scheduling and time.
 *
 * <p>Provides:
 * <ul>
 *   <li>a {@link TaskScheduler} for @Scheduled methods (e.g. RoomCleanupService) and the STOMP broker heartbeat</li>
 *   <li>a UTC {@link Clock} used for room timestamps, replaceable in tests</li>
 * </ul>
 */
@Configuration
public class SchedulingConfig {

    /**
     * Creates a task scheduler with a small thread pool.
     *
     * <p>Thread name prefix "minigolf-scheduler-" for easier debugging.
     *
     * @return configured task scheduler
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("minigolf-scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
