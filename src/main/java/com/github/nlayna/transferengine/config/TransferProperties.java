package com.github.nlayna.transferengine.config;

import com.github.nlayna.transferengine.model.NetworkClass;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "transfer")
public class TransferProperties {
    private int maxConcurrentTasks = 3;
    private int maxRetries = 5;
    private Duration tickInterval = Duration.ofSeconds(5);
    private Duration backoffBase = Duration.ofSeconds(1);
    private Duration backoffMax = Duration.ofSeconds(64);
    private int chunkSize = 1024 * 1024;
    private int bufferSize = 64 * 1024;
    private Duration connectTimeout = Duration.ofSeconds(15);
    private Duration readTimeout = Duration.ofSeconds(60);
    /** Zero disables the whole-call timeout. */
    private Duration callTimeout = Duration.ZERO;
    private String storeDir = "data/tasks";
    private boolean deletePartialOnCancel = true;
    private NetworkClass initialNetwork = NetworkClass.UNMETERED;
    private RateLimit rateLimit = new RateLimit();
    private Bandwidth bandwidth = new Bandwidth();

    @Data
    public static class RateLimit {
        private int maxConcurrent = 3;
        private Duration minDelay = Duration.ofMillis(150);
    }

    @Data
    public static class Bandwidth {
        /** Non-positive means unlimited. */
        private long bytesPerSecond = 0;
        /** Defaults to twice the rate when unset. */
        private Long burstSize;
    }
}
