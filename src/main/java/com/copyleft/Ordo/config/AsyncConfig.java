package com.copyleft.Ordo.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    // 구독 연결 하나당 릴레이 스레드 하나
    @Bean(name = "relayExecutor")
    public Executor relayExecutor() {

        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("Room-Relay-");
        executor.setDaemon(true);

        return executor;
    }
}
