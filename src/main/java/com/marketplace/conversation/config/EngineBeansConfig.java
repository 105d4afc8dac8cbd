package com.marketplace.conversation.config;

import com.marketplace.conversation.engine.GatePolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class EngineBeansConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fails startup when the regime settings are inconsistent.
     */
    @Bean
    public GatePolicy gatePolicy(RegimeConfig regimeConfig) {
        return GatePolicy.from(regimeConfig);
    }

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor(EngineConfig engineConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(engineConfig.getWorkerThreads());
        executor.setMaxPoolSize(engineConfig.getWorkerThreads());
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("analysis-");
        executor.initialize();
        return executor;
    }

    /**
     * Runs the periodic sweeps and the pending-action deadline timers.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler(Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setClock(clock);
        scheduler.setThreadNamePrefix("engine-scheduler-");
        return scheduler;
    }
}
