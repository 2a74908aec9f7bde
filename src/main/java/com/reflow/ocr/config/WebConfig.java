package com.reflow.ocr.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Streaming responses (event streams, archive downloads) run on their own pool so a
 * long-lived subscriber never takes a recognition thread.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${app.events.max-streams:64}")
    private int maxStreams;

    @Bean(name = "streamingTaskExecutor")
    public AsyncTaskExecutor streamingTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(maxStreams);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("stream-");
        return executor;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(streamingTaskExecutor());
    }
}
