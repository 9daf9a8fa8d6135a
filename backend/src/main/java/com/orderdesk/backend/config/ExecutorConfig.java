package com.orderdesk.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExecutorConfig {

    // Runs the page fetch and the total count of a paginated query side by side
    @Bean(name = "queryExecutor", destroyMethod = "shutdown")
    public ExecutorService queryExecutor() {
        return Executors.newCachedThreadPool();
    }
}
