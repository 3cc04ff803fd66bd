package com.quick.codebattles.codebattles;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class GameConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomSource randomSource() {
        return RandomSource.threadLocal();
    }

    @Bean
    public ThreadPoolTaskExecutor gradingExecutor(@Value("${codebattles.sandbox.workers:4}") int workers,
                                                  @Value("${codebattles.sandbox.queue-capacity:64}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("grading-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
