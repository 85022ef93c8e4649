package com.github.nlayna.transferengine.model;

import java.time.Duration;

/**
 * Progress tuple published to observers.
 *
 * @param speed smoothed bytes per second
 * @param eta   remaining time, {@code null} when the size is unknown or the speed is zero
 */
public record TransferProgress(String taskId,
                               TransferStatus status,
                               long bytesTransferred,
                               Long totalSize,
                               double speed,
                               Duration eta) {

    public static TransferProgress of(TransferTask task) {
        return new TransferProgress(task.getId(), task.getStatus(), task.getBytesTransferred(),
                task.getTotalSize(), 0.0, null);
    }

    public String getFormattedSpeed() {
        if (speed <= 0) {
            return "N/A";
        }
        if (speed < 1024) {
            return String.format("%.0f B/s", speed);
        }
        if (speed < 1024 * 1024) {
            return String.format("%.1f KB/s", speed / 1024.0);
        }
        return String.format("%.2f MB/s", speed / (1024.0 * 1024.0));
    }
}
