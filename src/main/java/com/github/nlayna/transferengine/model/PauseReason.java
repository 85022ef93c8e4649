package com.github.nlayna.transferengine.model;

public enum PauseReason {
    USER,
    NETWORK
}
