package com.chambua.standings.config;

import com.chambua.standings.queue.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class StandingsExecutorConfig {

    @Bean(name = "standingsCalculationExecutor")
    public ThreadPoolTaskExecutor standingsCalculationExecutor(StandingsProperties properties) {
        int workers = Math.max(1, properties.getWorker().getPoolSize());
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(workers);
        exec.setMaxPoolSize(workers);
        // the worker pool never hands over more claims than it has threads
        exec.setQueueCapacity(workers);
        exec.setThreadNamePrefix("ChambuaStandings-");
        exec.setWaitForTasksToCompleteOnShutdown(true);
        exec.setAwaitTerminationSeconds(10);
        exec.initialize();
        return exec;
    }

    @Bean
    public RetryPolicy calculationRetryPolicy(StandingsProperties properties) {
        StandingsProperties.Queue q = properties.getQueue();
        return RetryPolicy.withRandomJitter(q.getMaxAttempts(), Duration.ofMillis(q.getBaseDelayMs()),
                Duration.ofMillis(q.getMaxDelayMs()), q.getJitterRatio());
    }

    @Bean
    public Clock standingsClock() {
        return Clock.systemUTC();
    }
}
