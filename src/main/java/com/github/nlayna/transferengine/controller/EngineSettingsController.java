package com.github.nlayna.transferengine.controller;

import com.github.nlayna.transferengine.model.BandwidthSettings;
import com.github.nlayna.transferengine.model.ConcurrencyUpdate;
import com.github.nlayna.transferengine.model.NetworkUpdate;
import com.github.nlayna.transferengine.service.BandwidthThrottle;
import com.github.nlayna.transferengine.service.DownloadScheduler;
import com.github.nlayna.transferengine.service.RateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime inputs of the engine (network class, bandwidth limit, concurrency ceiling)
 * and its observable state.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class EngineSettingsController {

    private final DownloadScheduler downloadScheduler;
    private final BandwidthThrottle bandwidthThrottle;
    private final RateLimiter rateLimiter;

    @GetMapping("/engine")
    public Map<String, Object> getEngineState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("scheduler", downloadScheduler.getState());
        state.put("requestLimiter", rateLimiter.getStats());
        return state;
    }

    @PutMapping("/engine/concurrency")
    public ResponseEntity<?> setConcurrency(@RequestBody ConcurrencyUpdate update) {
        if (update.getMaxConcurrentTasks() == null) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "maxConcurrentTasks is required"));
        }
        downloadScheduler.setMaxConcurrentTasks(update.getMaxConcurrentTasks());
        return ResponseEntity.ok(downloadScheduler.getState());
    }

    @GetMapping("/network")
    public Map<String, String> getNetwork() {
        return Map.of("networkClass", downloadScheduler.getNetworkClass().name());
    }

    @PutMapping("/network")
    public ResponseEntity<Map<String, String>> setNetwork(@RequestBody NetworkUpdate update) {
        if (update.getNetworkClass() == null) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "networkClass is required"));
        }
        downloadScheduler.onNetworkChanged(update.getNetworkClass());
        return ResponseEntity.ok(Map.of("networkClass", update.getNetworkClass().name()));
    }

    @GetMapping("/bandwidth")
    public BandwidthSettings getBandwidth() {
        BandwidthThrottle.Stats stats = bandwidthThrottle.getStats();
        return new BandwidthSettings(stats.bytesPerSecond(), stats.burstSize(), stats.paused());
    }

    @PutMapping("/bandwidth")
    public ResponseEntity<?> setBandwidth(@RequestBody BandwidthSettings settings) {
        if (settings.getBurstSize() != null && settings.getBurstSize() <= 0) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "burstSize must be positive"));
        }
        bandwidthThrottle.setLimit(settings.getBytesPerSecond(), settings.getBurstSize());
        if (Boolean.TRUE.equals(settings.getPaused())) {
            bandwidthThrottle.pause();
        } else if (Boolean.FALSE.equals(settings.getPaused())) {
            bandwidthThrottle.resume();
        }
        return ResponseEntity.ok(getBandwidth());
    }
}
