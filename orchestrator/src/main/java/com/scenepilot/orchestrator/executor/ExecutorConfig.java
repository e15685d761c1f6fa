package com.scenepilot.orchestrator.executor;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExecutorConfig {

    /**
     * Fixed pool for adapter calls, asset downloads and export assembly. A fixed
     * size keeps the number of blocking network calls bounded.
     */
    @Bean(name = "taskWorkers", destroyMethod = "shutdown")
    public ExecutorService taskWorkers(ExecutorProperties props) {
        return Executors.newFixedThreadPool(props.workerThreads(), new CustomizableThreadFactory("task-worker-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
