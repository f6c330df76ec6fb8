package com.automate.ScanOps.Config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AsyncConfig {

    @Bean(name = "runExecutor")
    public ThreadPoolTaskExecutor runExecutor(ExecutorProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getConcurrency());
        ex.setMaxPoolSize(props.getConcurrency());
        ex.setQueueCapacity(props.getQueueCapacity());
        ex.setThreadNamePrefix("run-worker-");
        ex.initialize();
        return ex;
    }

    // one session at a time, steps strictly sequential
    @Bean(name = "smartScanExecutor")
    public ThreadPoolTaskExecutor smartScanExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(1);
        ex.setMaxPoolSize(1);
        ex.setQueueCapacity(10);
        ex.setThreadNamePrefix("smart-scan-");
        ex.initialize();
        return ex;
    }

    @Bean(name = "streamScheduler")
    public TaskScheduler streamScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("stream-cleanup-");
        scheduler.initialize();
        return scheduler;
    }
}
