package uk.gegc.aiready.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for file extraction during batch conversion.
 * Sized for CPU-bound parsing and OCR; when the queue is full the submitting thread runs the task itself.
 */
@Configuration
@Slf4j
public class ConversionExecutorConfig {

    @Value("${app.conversion.core-pool-size:2}")
    private int corePoolSize;

    @Value("${app.conversion.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${app.conversion.queue-capacity:50}")
    private int queueCapacity;

    @Value("${app.conversion.keep-alive-seconds:60}")
    private int keepAliveSeconds;

    @Bean(name = "conversionTaskExecutor")
    public Executor conversionTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setKeepAliveSeconds(keepAliveSeconds);
        executor.setThreadNamePrefix("convert-");

        // Caller runs the task if the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Conversion Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                corePoolSize, maxPoolSize, queueCapacity, keepAliveSeconds);

        return executor;
    }
}
