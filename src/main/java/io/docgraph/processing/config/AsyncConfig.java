package io.docgraph.processing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    @Bean(name = "analysisExecutor")
    public Executor analysisExecutor(ProcessingConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // One in-flight document per worker thread
        executor.setCorePoolSize(config.performance().threadPoolSize());
        executor.setMaxPoolSize(config.performance().threadPoolSize());
        executor.setQueueCapacity(config.performance().queueCapacity());

        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();

        return executor;
    }
}
