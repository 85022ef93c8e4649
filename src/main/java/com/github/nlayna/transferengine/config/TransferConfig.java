package com.github.nlayna.transferengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.nlayna.transferengine.service.BandwidthThrottle;
import com.github.nlayna.transferengine.service.JsonFileTaskStore;
import com.github.nlayna.transferengine.service.RateLimiter;
import com.github.nlayna.transferengine.service.TaskStore;
import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class TransferConfig {

    private final TransferProperties transferProperties;

    @Bean(name = "transferExecutor")
    public Executor transferExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(transferProperties.getMaxConcurrentTasks());
        executor.setMaxPoolSize(transferProperties.getMaxConcurrentTasks());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("transfer-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "tickScheduler")
    public ThreadPoolTaskScheduler tickScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("transfer-tick-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public OkHttpClient transferHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(transferProperties.getConnectTimeout())
                .readTimeout(transferProperties.getReadTimeout())
                .callTimeout(transferProperties.getCallTimeout())
                .followRedirects(true)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public RateLimiter rateLimiter() {
        TransferProperties.RateLimit rateLimit = transferProperties.getRateLimit();
        return new RateLimiter(rateLimit.getMaxConcurrent(), rateLimit.getMinDelay());
    }

    @Bean
    public BandwidthThrottle bandwidthThrottle() {
        TransferProperties.Bandwidth bandwidth = transferProperties.getBandwidth();
        return new BandwidthThrottle(bandwidth.getBytesPerSecond(), bandwidth.getBurstSize());
    }

    @Bean
    public TaskStore taskStore(ObjectMapper objectMapper) {
        return new JsonFileTaskStore(Path.of(transferProperties.getStoreDir()), objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
