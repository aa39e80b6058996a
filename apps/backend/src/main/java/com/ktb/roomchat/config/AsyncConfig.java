package com.ktb.roomchat.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * 방 브로드캐스트 fan-out 용 풀.
     * 큐가 가득 차면 호출 스레드가 직접 전송한다 (전송을 버리지 않음).
     */
    @Bean("broadcastExecutor")
    public Executor broadcastExecutor(
            @Value("${chat.broadcast.pool.core-size:8}") int coreSize,
            @Value("${chat.broadcast.pool.max-size:64}") int maxSize,
            @Value("${chat.broadcast.pool.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("broadcast-");
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
