package com.github.nlayna.transferengine.controller;

import com.github.nlayna.transferengine.model.PriorityUpdate;
import com.github.nlayna.transferengine.model.TransferProgress;
import com.github.nlayna.transferengine.model.TransferRequest;
import com.github.nlayna.transferengine.model.TransferStatus;
import com.github.nlayna.transferengine.model.TransferTask;
import com.github.nlayna.transferengine.service.DownloadScheduler;
import com.github.nlayna.transferengine.service.TransferEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/transfers")
@RequiredArgsConstructor
public class TransferController {

    private final DownloadScheduler downloadScheduler;
    private final TransferEventPublisher eventPublisher;

    @PostMapping
    public ResponseEntity<Map<String, String>> enqueue(@RequestBody TransferRequest request) {
        if (request.getUrl() == null || request.getUrl().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "url is required"));
        }
        if (request.getDestinationPath() == null || request.getDestinationPath().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "destinationPath is required"));
        }
        if (request.getMaxRetries() != null && request.getMaxRetries() < 0) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "maxRetries must not be negative"));
        }

        String taskId = downloadScheduler.enqueue(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("taskId", taskId));
    }

    @GetMapping
    public List<TransferTask> listTasks(@RequestParam(required = false) TransferStatus status) {
        return downloadScheduler.listTasks(status);
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TransferTask> getTask(@PathVariable String taskId) {
        return downloadScheduler.getTask(taskId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{taskId}/progress")
    public ResponseEntity<TransferProgress> getProgress(@PathVariable String taskId) {
        return downloadScheduler.getProgress(taskId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{taskId}/pause")
    public ResponseEntity<Void> pause(@PathVariable String taskId) {
        downloadScheduler.pause(taskId);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{taskId}/resume")
    public ResponseEntity<Void> resume(@PathVariable String taskId) {
        downloadScheduler.resume(taskId);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{taskId}/retry")
    public ResponseEntity<Void> retry(@PathVariable String taskId) {
        downloadScheduler.retry(taskId);
        return ResponseEntity.accepted().build();
    }

    @PutMapping("/{taskId}/priority")
    public ResponseEntity<Map<String, String>> setPriority(@PathVariable String taskId,
                                                           @RequestBody PriorityUpdate update) {
        if (update.getPriority() == null) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "priority is required"));
        }
        downloadScheduler.setPriority(taskId, update.getPriority());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> cancel(@PathVariable String taskId) {
        downloadScheduler.remove(taskId);
        return ResponseEntity.accepted().build();
    }

    @DeleteMapping("/{taskId}/record")
    public ResponseEntity<Void> purge(@PathVariable String taskId) {
        downloadScheduler.purge(taskId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/pause-all")
    public Map<String, Integer> pauseAll() {
        return Map.of("affected", downloadScheduler.pauseAll());
    }

    @PostMapping("/resume-all")
    public Map<String, Integer> resumeAll() {
        return Map.of("affected", downloadScheduler.resumeAll());
    }

    @DeleteMapping("/finished")
    public Map<String, Integer> purgeFinished() {
        return Map.of("purged", downloadScheduler.purgeFinished());
    }

    @GetMapping("/events")
    public SseEmitter events() {
        SseEmitter emitter = new SseEmitter(0L);
        TransferEventPublisher.Subscription subscription = eventPublisher.subscribe(progress -> {
            try {
                emitter.send(SseEmitter.event().name("progress").data(progress));
            } catch (IOException e) {
                log.debug("Progress stream closed: {}", e.getMessage());
                emitter.completeWithError(e);
            }
        });
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());
        return emitter;
    }
}
