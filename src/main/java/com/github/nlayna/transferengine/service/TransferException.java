package com.github.nlayna.transferengine.service;

import com.github.nlayna.transferengine.model.FailureCategory;
import lombok.Getter;

import java.time.Duration;

/**
 * Failure of a single transfer attempt, classified for the scheduler's retry policy.
 */
@Getter
public class TransferException extends Exception {

    private final FailureCategory category;
    private final Integer httpStatus;
    private final Duration retryAfter;

    public TransferException(FailureCategory category, String message) {
        this(category, message, null, null, null);
    }

    public TransferException(FailureCategory category, String message, Throwable cause) {
        this(category, message, null, null, cause);
    }

    public TransferException(FailureCategory category, String message, Integer httpStatus,
                             Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.httpStatus = httpStatus;
        this.retryAfter = retryAfter;
    }

    public static TransferException httpError(int status, String message, Duration retryAfter) {
        return new TransferException(FailureCategory.HTTP_ERROR, message, status, retryAfter, null);
    }

    /**
     * Network failures, 5xx and 429 are transient. Everything else is final.
     */
    public boolean isRetryable() {
        return switch (category) {
            case NETWORK -> true;
            case HTTP_ERROR -> httpStatus != null && (httpStatus >= 500 || httpStatus == 429);
            default -> false;
        };
    }
}
