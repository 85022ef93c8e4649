package com.github.nlayna.transferengine.model;

public enum FailureCategory {
    /** Connection reset, timeout, DNS failure. */
    NETWORK,
    /** Unexpected HTTP status, see the task's httpStatus. */
    HTTP_ERROR,
    /** Disk full, permission denied and similar local failures. */
    LOCAL_IO,
    /** Server rejected the resume offset. */
    RANGE_NOT_SATISFIABLE,
    CANCELLED,
    EXHAUSTED_RETRIES
}
