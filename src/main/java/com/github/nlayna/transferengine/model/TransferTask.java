package com.github.nlayna.transferengine.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One queued or in-progress file download.
 * <p>
 * The scheduler owns the status and scheduling fields. While the task is
 * {@link TransferStatus#ACTIVE} the executor owns {@code bytesTransferred},
 * {@code totalSize} and {@code etag}.
 */
@Data
@NoArgsConstructor
public class TransferTask {
    private String id;
    private String url;
    private String destinationPath;
    private volatile Long totalSize;
    private volatile String etag;
    private volatile long bytesTransferred;
    private volatile TransferStatus status = TransferStatus.QUEUED;

    private volatile TransferPriority priority = TransferPriority.NORMAL;
    private volatile Instant notBefore;
    private volatile NetworkRequirement networkRequirement = NetworkRequirement.ANY;
    private volatile PauseReason pauseReason;

    private volatile int retryCount;
    private volatile Instant lastRetryAt;
    private volatile int maxRetries;
    private volatile boolean rangeRestarted;

    private volatile FailureCategory failureCategory;
    private volatile Integer httpStatus;
    private volatile String errorMessage;

    private Instant createdAt;
    private volatile Instant updatedAt;
    private volatile Instant startedAt;
    private volatile Instant completedAt;

    public TransferTask(String id, String url, String destinationPath, Instant createdAt) {
        this.id = id;
        this.url = url;
        this.destinationPath = destinationPath;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public double getProgressPercent() {
        Long total = totalSize;
        if (total == null || total <= 0) {
            return 0.0;
        }
        return Math.min(100.0, bytesTransferred * 100.0 / total);
    }

    /**
     * Time from which the task may be scheduled, used as the secondary sort key.
     */
    public Instant scheduledTime() {
        return notBefore != null ? notBefore : createdAt;
    }

    public void clearFailure() {
        failureCategory = null;
        httpStatus = null;
        errorMessage = null;
    }

    public void resetProgress() {
        bytesTransferred = 0;
        totalSize = null;
        etag = null;
    }
}
