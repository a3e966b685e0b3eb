package com.textlens.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String PERSISTENCE_EXECUTOR = "persistenceExecutor";

    // Result log writes; a full queue drops the write instead of slowing the request.
    @Bean(name = PERSISTENCE_EXECUTOR)
    public Executor persistenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("result-log-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Result log queue full, dropping write"));
        executor.initialize();
        return executor;
    }
}
