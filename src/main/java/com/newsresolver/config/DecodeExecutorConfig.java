package com.newsresolver.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DecodeExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService decodeExecutor(@Value("${resolver.max-concurrency:5}") int maxConcurrency) {
        return Executors.newFixedThreadPool(Math.max(1, maxConcurrency));
    }
}
