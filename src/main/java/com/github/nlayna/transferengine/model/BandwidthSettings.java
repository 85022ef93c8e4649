package com.github.nlayna.transferengine.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Runtime bandwidth settings. A non-positive rate means unlimited.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BandwidthSettings {
    private long bytesPerSecond;
    private Long burstSize;
    private Boolean paused;
}
