package com.github.nlayna.transferengine.model;

public enum TransferOutcome {
    COMPLETED,
    PAUSED,
    CANCELLED
}
