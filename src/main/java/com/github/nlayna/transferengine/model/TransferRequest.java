package com.github.nlayna.transferengine.model;

import lombok.Data;

import java.time.Instant;

@Data
public class TransferRequest {
    private String id;
    private String url;
    private String destinationPath;
    private TransferPriority priority;
    private Instant notBefore;
    private NetworkRequirement networkRequirement;
    private Integer maxRetries;
}
