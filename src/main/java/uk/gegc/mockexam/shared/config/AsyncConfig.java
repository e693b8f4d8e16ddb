package uk.gegc.mockexam.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for per-subject generation.
 * The pool size caps concurrent in-flight LLM calls.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.generation.max-workers:3}")
    private int maxWorkers;

    @Value("${async.generation.queue-capacity:50}")
    private int queueCapacity;

    @Value("${async.generation.await-termination-seconds:30}")
    private int awaitTerminationSeconds;

    @Bean(name = "generationTaskExecutor")
    public ThreadPoolTaskExecutor generationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // fixed size: core == max
        executor.setCorePoolSize(maxWorkers);
        executor.setMaxPoolSize(maxWorkers);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("subject-gen-");

        // Rejection policy - caller runs the task if queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.initialize();

        log.info("Generation executor configured - Workers: {}, Queue: {}", maxWorkers, queueCapacity);

        return executor;
    }
}
