package com.yourapp.pods.deadline_engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@EnableScheduling
@EnableAsync
public class SchedulingConfig {

    // The schedulers read time from here; nothing below them does
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("deadlineEvaluationExecutor")
    public ThreadPoolTaskExecutor deadlineEvaluationExecutor(DeadlineProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getParallelism());
        ex.setMaxPoolSize(props.getParallelism());
        ex.setQueueCapacity(Integer.MAX_VALUE);
        ex.setThreadNamePrefix("deadline-eval-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.setAwaitTerminationSeconds(30);
        ex.initialize();
        return ex;
    }

    @Bean("notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(2);
        ex.setMaxPoolSize(4);
        ex.setQueueCapacity(1000);
        ex.setThreadNamePrefix("notify-");
        ex.initialize();
        return ex;
    }

    @Bean
    public RestTemplate pushRestTemplate() {
        return new RestTemplate();
    }
}
