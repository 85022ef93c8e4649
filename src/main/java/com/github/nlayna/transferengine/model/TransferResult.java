package com.github.nlayna.transferengine.model;

public record TransferResult(TransferOutcome outcome, long bytesTransferred, Long totalSize) {
}
