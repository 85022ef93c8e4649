package com.github.nlayna.transferengine.service;

import com.github.nlayna.transferengine.config.TransferProperties;
import com.github.nlayna.transferengine.model.FailureCategory;
import com.github.nlayna.transferengine.model.NetworkClass;
import com.github.nlayna.transferengine.model.NetworkRequirement;
import com.github.nlayna.transferengine.model.PauseReason;
import com.github.nlayna.transferengine.model.SchedulerState;
import com.github.nlayna.transferengine.model.TransferOutcome;
import com.github.nlayna.transferengine.model.TransferPriority;
import com.github.nlayna.transferengine.model.TransferProgress;
import com.github.nlayna.transferengine.model.TransferRequest;
import com.github.nlayna.transferengine.model.TransferResult;
import com.github.nlayna.transferengine.model.TransferStatus;
import com.github.nlayna.transferengine.model.TransferTask;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Single source of truth for what should be downloading right now.
 * <p>
 * Tasks move through {@code QUEUED -> ACTIVE <-> PAUSED -> COMPLETED | FAILED | CANCELLED}.
 * A periodic tick starts eligible queued tasks, highest priority first, until the
 * concurrency ceiling is reached. Failed attempts are retried with exponential backoff.
 */
@Slf4j
@Service
public class DownloadScheduler implements SmartLifecycle {

    private final TaskStore taskStore;
    private final ResumableTransferExecutor transferExecutor;
    private final Executor workerExecutor;
    private final TaskScheduler tickScheduler;
    private final TransferEventPublisher eventPublisher;
    private final TransferProperties transferProperties;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, TransferTask> tasks = new LinkedHashMap<>();
    private final TaskQueue queue = new TaskQueue();
    private final Map<String, TransferControl> active = new HashMap<>();
    private final ConcurrentMap<String, TransferProgress> latestProgress = new ConcurrentHashMap<>();

    private volatile NetworkClass networkClass;
    private volatile int maxConcurrentTasks;
    private volatile boolean running;
    private ScheduledFuture<?> tickFuture;

    public DownloadScheduler(TaskStore taskStore,
                             ResumableTransferExecutor transferExecutor,
                             @Qualifier("transferExecutor") Executor workerExecutor,
                             @Qualifier("tickScheduler") TaskScheduler tickScheduler,
                             TransferEventPublisher eventPublisher,
                             TransferProperties transferProperties,
                             Clock clock) {
        this.taskStore = taskStore;
        this.transferExecutor = transferExecutor;
        this.workerExecutor = workerExecutor;
        this.tickScheduler = tickScheduler;
        this.eventPublisher = eventPublisher;
        this.transferProperties = transferProperties;
        this.clock = clock;
        this.networkClass = transferProperties.getInitialNetwork();
        this.maxConcurrentTasks = transferProperties.getMaxConcurrentTasks();
    }

    @Override
    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            recover();
            running = true;
            tickFuture = tickScheduler.scheduleAtFixedRate(this::tick, transferProperties.getTickInterval());
        }
        log.info("Download scheduler started: maxConcurrent={}, network={}, tickInterval={}",
                maxConcurrentTasks, networkClass, transferProperties.getTickInterval());
        tick();
    }

    /**
     * Stops scheduling and asks running transfers to stop at their next chunk boundary.
     * Stopped transfers are left queued so the next start resumes them.
     */
    @Override
    public void stop() {
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            if (tickFuture != null) {
                tickFuture.cancel(false);
                tickFuture = null;
            }
            active.values().forEach(TransferControl::requestPause);
        }
        log.info("Download scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Adds a task, or updates the task with the same id in place.
     *
     * @return the task id
     */
    public String enqueue(TransferRequest request) {
        validate(request);
        String id = request.getId() != null ? request.getId() : UUID.randomUUID().toString();
        TransferTask task;
        synchronized (lock) {
            TransferTask existing = tasks.get(id);
            if (existing == null) {
                task = newTask(id, request);
                taskStore.save(task);
                tasks.put(id, task);
                queue.offer(task);
                log.info("Task {} enqueued: url={}, priority={}, network={}",
                        id, task.getUrl(), task.getPriority(), task.getNetworkRequirement());
            } else {
                task = existing;
                updateInPlace(existing, request);
            }
        }
        publishState(task);
        tick();
        return id;
    }

    /**
     * Cancels the task. A running transfer stops at its next chunk boundary.
     */
    public void remove(String taskId) {
        TransferTask task;
        synchronized (lock) {
            task = require(taskId);
            switch (task.getStatus()) {
                case ACTIVE -> {
                    active.get(taskId).requestCancel();
                    log.info("Cancellation requested for active task {}", taskId);
                    return;
                }
                case QUEUED, PAUSED, FAILED -> {
                    queue.remove(taskId);
                    markCancelled(task);
                    taskStore.save(task);
                }
                default -> {
                    log.info("Task {} already {}, nothing to cancel", taskId, task.getStatus());
                    return;
                }
            }
        }
        publishState(task);
    }

    public void pause(String taskId) {
        TransferTask task;
        synchronized (lock) {
            task = require(taskId);
            if (!pauseLocked(task, PauseReason.USER)) {
                return;
            }
        }
        publishState(task);
    }

    public void resume(String taskId) {
        TransferTask task;
        synchronized (lock) {
            task = require(taskId);
            if (!resumeLocked(task)) {
                return;
            }
        }
        publishState(task);
        tick();
    }

    /**
     * Pauses every active and queued task.
     *
     * @return the number of tasks affected
     */
    public int pauseAll() {
        List<TransferTask> paused = new ArrayList<>();
        int affected = 0;
        synchronized (lock) {
            for (TransferTask task : List.copyOf(tasks.values())) {
                TransferStatus status = task.getStatus();
                if (status == TransferStatus.ACTIVE || status == TransferStatus.QUEUED) {
                    affected++;
                    if (pauseLocked(task, PauseReason.USER)) {
                        paused.add(task);
                    }
                }
            }
        }
        paused.forEach(this::publishState);
        log.info("Paused {} tasks", affected);
        return affected;
    }

    public int resumeAll() {
        List<TransferTask> resumed = new ArrayList<>();
        synchronized (lock) {
            for (TransferTask task : List.copyOf(tasks.values())) {
                if (task.getStatus() == TransferStatus.PAUSED && resumeLocked(task)) {
                    resumed.add(task);
                }
            }
        }
        resumed.forEach(this::publishState);
        log.info("Resumed {} tasks", resumed.size());
        tick();
        return resumed.size();
    }

    /**
     * Changes the priority tier. An active transfer is not interrupted.
     */
    public void setPriority(String taskId, TransferPriority priority) {
        Objects.requireNonNull(priority, "priority");
        synchronized (lock) {
            TransferTask task = require(taskId);
            task.setPriority(priority);
            task.setUpdatedAt(clock.instant());
            if (queue.contains(taskId)) {
                queue.offer(task);
            }
            taskStore.save(task);
        }
        log.info("Task {} priority set to {}", taskId, priority);
        tick();
    }

    /**
     * Re-queues a terminally failed task with a fresh retry budget.
     */
    public void retry(String taskId) {
        TransferTask task;
        synchronized (lock) {
            task = require(taskId);
            if (task.getStatus() != TransferStatus.FAILED) {
                throw new IllegalStateException("Only failed tasks can be retried, task " + taskId
                        + " is " + task.getStatus());
            }
            resetRetryState(task);
            task.setStatus(TransferStatus.QUEUED);
            task.setUpdatedAt(clock.instant());
            queue.offer(task);
            taskStore.save(task);
        }
        log.info("Task {} re-queued by manual retry", taskId);
        publishState(task);
        tick();
    }

    /**
     * Deletes the record of a completed, failed or cancelled task.
     */
    public void purge(String taskId) {
        synchronized (lock) {
            TransferTask task = require(taskId);
            if (!task.getStatus().isTerminal()) {
                throw new IllegalStateException("Task " + taskId + " is " + task.getStatus() + " and cannot be purged");
            }
            tasks.remove(taskId);
            latestProgress.remove(taskId);
            taskStore.delete(taskId);
        }
        log.info("Task {} purged", taskId);
    }

    /**
     * Deletes the records of all completed and cancelled tasks. Failed tasks stay visible.
     *
     * @return the number of records deleted
     */
    public int purgeFinished() {
        int purged = 0;
        synchronized (lock) {
            for (TransferTask task : List.copyOf(tasks.values())) {
                if (task.getStatus() == TransferStatus.COMPLETED || task.getStatus() == TransferStatus.CANCELLED) {
                    tasks.remove(task.getId());
                    latestProgress.remove(task.getId());
                    taskStore.delete(task.getId());
                    purged++;
                }
            }
        }
        log.info("Purged {} finished tasks", purged);
        return purged;
    }

    /**
     * Input from the connectivity monitor. Active tasks whose network requirement is no longer
     * met are paused and resume by themselves once it is met again.
     */
    public void onNetworkChanged(NetworkClass newNetworkClass) {
        Objects.requireNonNull(newNetworkClass, "networkClass");
        int stopping = 0;
        synchronized (lock) {
            NetworkClass previous = networkClass;
            networkClass = newNetworkClass;
            log.info("Network changed: {} -> {}", previous, newNetworkClass);
            for (TransferTask task : List.copyOf(tasks.values())) {
                if (task.getStatus() == TransferStatus.ACTIVE
                        && !task.getNetworkRequirement().isSatisfiedBy(newNetworkClass)) {
                    pauseLocked(task, PauseReason.NETWORK);
                    stopping++;
                }
            }
        }
        if (stopping > 0) {
            log.info("Pausing {} active tasks not allowed on {}", stopping, newNetworkClass);
        }
        tick();
    }

    /**
     * Starts eligible queued tasks until the concurrency ceiling is reached. Never blocks on transfers.
     */
    public void tick() {
        List<TransferTask> launches = new ArrayList<>();
        synchronized (lock) {
            if (!running) {
                return;
            }
            Instant now = clock.instant();
            requeueNetworkPaused(now);
            int slots = maxConcurrentTasks - active.size();
            for (String taskId : queue.snapshot()) {
                if (slots <= 0) {
                    break;
                }
                TransferTask task = tasks.get(taskId);
                if (task == null) {
                    queue.remove(taskId);
                    continue;
                }
                if (!isEligible(task, now)) {
                    continue;
                }
                Instant previousStart = task.getStartedAt();
                task.setStatus(TransferStatus.ACTIVE);
                task.setPauseReason(null);
                task.setStartedAt(now);
                task.setUpdatedAt(now);
                try {
                    taskStore.save(task);
                } catch (RuntimeException e) {
                    task.setStatus(TransferStatus.QUEUED);
                    task.setStartedAt(previousStart);
                    log.error("Could not record start of task {}, leaving it queued", taskId, e);
                    break;
                }
                queue.remove(taskId);
                active.put(taskId, new TransferControl());
                launches.add(task);
                slots--;
            }
        }
        for (TransferTask task : launches) {
            launch(task);
        }
    }

    public Optional<TransferTask> getTask(String taskId) {
        synchronized (lock) {
            return Optional.ofNullable(tasks.get(taskId));
        }
    }

    /**
     * @param status filter, or {@code null} for all tasks
     */
    public List<TransferTask> listTasks(TransferStatus status) {
        synchronized (lock) {
            return tasks.values().stream()
                    .filter(t -> status == null || t.getStatus() == status)
                    .sorted(Comparator.comparing(TransferTask::getCreatedAt))
                    .toList();
        }
    }

    public Optional<TransferProgress> getProgress(String taskId) {
        TransferProgress progress = latestProgress.get(taskId);
        if (progress != null) {
            return Optional.of(progress);
        }
        return getTask(taskId).map(TransferProgress::of);
    }

    /**
     * Task ids waiting to start, in scheduling order.
     */
    public List<String> getQueueOrder() {
        synchronized (lock) {
            return queue.snapshot();
        }
    }

    public int getActiveCount() {
        synchronized (lock) {
            return active.size();
        }
    }

    /**
     * Snapshot of the queue and worker occupancy.
     */
    public SchedulerState getState() {
        synchronized (lock) {
            return new SchedulerState(queue.size(), active.size(), maxConcurrentTasks, networkClass,
                    networkClass != NetworkClass.OFFLINE);
        }
    }

    public NetworkClass getNetworkClass() {
        return networkClass;
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public void setMaxConcurrentTasks(int maxConcurrentTasks) {
        if (maxConcurrentTasks <= 0) {
            throw new IllegalArgumentException("maxConcurrentTasks must be positive, got: " + maxConcurrentTasks);
        }
        this.maxConcurrentTasks = maxConcurrentTasks;
        log.info("Concurrency ceiling set to {}", maxConcurrentTasks);
        tick();
    }

    Duration backoffFor(int retryCount) {
        Duration base = transferProperties.getBackoffBase();
        Duration max = transferProperties.getBackoffMax();
        int exponent = Math.min(Math.max(retryCount, 0), 30);
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    /**
     * Loads persisted tasks. Tasks left active by a crash are queued again, resuming from
     * their recorded offset when the partial file survived and restarting otherwise.
     */
    void recover() {
        for (TransferTask task : taskStore.findByStatus(TransferStatus.COMPLETED, TransferStatus.FAILED,
                TransferStatus.CANCELLED)) {
            tasks.putIfAbsent(task.getId(), task);
        }
        int requeued = 0;
        for (TransferTask task : taskStore.findByStatus(TransferStatus.ACTIVE, TransferStatus.QUEUED,
                TransferStatus.PAUSED)) {
            if (tasks.putIfAbsent(task.getId(), task) != null) {
                // enqueued before start
                continue;
            }
            switch (task.getStatus()) {
                case ACTIVE -> {
                    boolean resumable = task.getBytesTransferred() > 0
                            && Files.exists(ResumableTransferExecutor.partialFileOf(task));
                    if (!resumable) {
                        task.resetProgress();
                    }
                    task.setStatus(TransferStatus.QUEUED);
                    task.setUpdatedAt(clock.instant());
                    taskStore.save(task);
                    queue.offer(task);
                    requeued++;
                    log.info("Recovered interrupted task {} ({})", task.getId(),
                            resumable ? "resuming at " + task.getBytesTransferred() : "restarting");
                }
                case QUEUED -> queue.offer(task);
                default -> {
                }
            }
        }
        log.info("Loaded {} tasks, {} queued, {} recovered from an interrupted run",
                tasks.size(), queue.size(), requeued);
    }

    private void launch(TransferTask task) {
        publishState(task);
        try {
            workerExecutor.execute(() -> runTransfer(task));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected task {}, leaving it queued", task.getId());
            synchronized (lock) {
                active.remove(task.getId());
                task.setStatus(TransferStatus.QUEUED);
                queue.offer(task);
                taskStore.save(task);
            }
        }
    }

    private void runTransfer(TransferTask task) {
        TransferControl control;
        synchronized (lock) {
            control = active.get(task.getId());
        }
        if (control == null) {
            return;
        }
        log.info("Starting transfer {} ({} -> {})", task.getId(), task.getUrl(), task.getDestinationPath());
        try {
            TransferResult result = transferExecutor.transfer(task, control, this::onProgress);
            onFinished(task, control, result);
        } catch (TransferException e) {
            onFailed(task, control, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error in transfer {}", task.getId(), e);
            onFailed(task, control, new TransferException(FailureCategory.LOCAL_IO,
                    "Unexpected error: " + e.getMessage(), e));
        }
        tick();
    }

    private void onProgress(TransferProgress progress) {
        latestProgress.put(progress.taskId(), progress);
        eventPublisher.publish(progress);
    }

    private void onFinished(TransferTask task, TransferControl control, TransferResult result) {
        synchronized (lock) {
            active.remove(task.getId());
            Instant now = clock.instant();
            if (result.outcome() == TransferOutcome.COMPLETED) {
                task.setStatus(TransferStatus.COMPLETED);
                task.setCompletedAt(now);
                task.setPauseReason(null);
                task.clearFailure();
                log.info("Task {} completed: {} bytes", task.getId(), result.bytesTransferred());
            } else {
                applyStop(task, control);
            }
            task.setUpdatedAt(now);
            taskStore.save(task);
        }
        publishState(task);
    }

    private void onFailed(TransferTask task, TransferControl control, TransferException e) {
        synchronized (lock) {
            active.remove(task.getId());
            Instant now = clock.instant();
            task.setUpdatedAt(now);
            if (control.isStopRequested() || !running) {
                log.info("Task {} stopped with error while stopping: {}", task.getId(), e.getMessage());
                applyStop(task, control);
            } else {
                task.setFailureCategory(e.getCategory());
                task.setHttpStatus(e.getHttpStatus());
                task.setErrorMessage(e.getMessage());
                if (e.getCategory() == FailureCategory.RANGE_NOT_SATISFIABLE) {
                    handleRangeNotSatisfiable(task, e, now);
                } else if (e.isRetryable()) {
                    scheduleRetry(task, e, now);
                } else {
                    task.setStatus(TransferStatus.FAILED);
                    task.setCompletedAt(now);
                    log.error("Task {} failed permanently: {} {}", task.getId(), e.getCategory(), e.getMessage());
                }
            }
            taskStore.save(task);
        }
        publishState(task);
    }

    private void applyStop(TransferTask task, TransferControl control) {
        if (control.current() == TransferControl.Signal.CANCEL) {
            markCancelled(task);
        } else if (!running) {
            task.setStatus(TransferStatus.QUEUED);
            queue.offer(task);
        } else {
            task.setStatus(TransferStatus.PAUSED);
            if (task.getPauseReason() == null) {
                task.setPauseReason(PauseReason.USER);
            }
            log.info("Task {} paused at {} bytes ({})", task.getId(), task.getBytesTransferred(), task.getPauseReason());
        }
    }

    private void handleRangeNotSatisfiable(TransferTask task, TransferException e, Instant now) {
        transferExecutor.discardPartial(task);
        task.resetProgress();
        if (!task.isRangeRestarted()) {
            task.setRangeRestarted(true);
            task.setStatus(TransferStatus.QUEUED);
            queue.offer(task);
            log.warn("Task {} offset rejected by server, restarting from zero", task.getId());
        } else {
            scheduleRetry(task, e, now);
        }
    }

    private void scheduleRetry(TransferTask task, TransferException e, Instant now) {
        int retryCount = task.getRetryCount() + 1;
        task.setRetryCount(retryCount);
        task.setLastRetryAt(now);
        if (retryCount >= task.getMaxRetries()) {
            task.setStatus(TransferStatus.FAILED);
            task.setCompletedAt(now);
            task.setFailureCategory(FailureCategory.EXHAUSTED_RETRIES);
            task.setErrorMessage("Gave up after " + retryCount + " attempts, last error "
                    + e.getCategory() + ": " + e.getMessage());
            log.error("Task {} failed after {} attempts: {}", task.getId(), retryCount, e.getMessage());
            return;
        }
        Duration delay = backoffFor(retryCount);
        if (e.getRetryAfter() != null && e.getRetryAfter().compareTo(delay) > 0) {
            delay = e.getRetryAfter();
        }
        task.setNotBefore(now.plus(delay));
        task.setStatus(TransferStatus.QUEUED);
        queue.offer(task);
        log.warn("Task {} attempt {} failed ({}: {}), retrying in {}s",
                task.getId(), retryCount, e.getCategory(), e.getMessage(), delay.toSeconds());
    }

    private boolean pauseLocked(TransferTask task, PauseReason reason) {
        switch (task.getStatus()) {
            case ACTIVE -> {
                applyPauseReason(task, reason);
                active.get(task.getId()).requestPause();
                log.info("Pause requested for active task {} ({})", task.getId(), reason);
                // state is published once the transfer has stopped
                return false;
            }
            case QUEUED -> {
                queue.remove(task.getId());
                task.setStatus(TransferStatus.PAUSED);
                task.setPauseReason(reason);
                task.setUpdatedAt(clock.instant());
                taskStore.save(task);
                log.info("Task {} paused before starting", task.getId());
                return true;
            }
            case PAUSED -> {
                applyPauseReason(task, reason);
                taskStore.save(task);
                return false;
            }
            default -> throw new IllegalStateException("Cannot pause task " + task.getId()
                    + " in status " + task.getStatus());
        }
    }

    private boolean resumeLocked(TransferTask task) {
        switch (task.getStatus()) {
            case PAUSED -> {
                task.setStatus(TransferStatus.QUEUED);
                task.setPauseReason(null);
                task.setUpdatedAt(clock.instant());
                queue.offer(task);
                taskStore.save(task);
                log.info("Task {} resumed at {} bytes", task.getId(), task.getBytesTransferred());
                return true;
            }
            case ACTIVE -> {
                if (task.getPauseReason() == null) {
                    return false;
                }
                if (task.getNetworkRequirement().isSatisfiedBy(networkClass)) {
                    // withdraw a pause the transfer has not reached yet
                    active.get(task.getId()).clearPause();
                    task.setPauseReason(null);
                } else {
                    // still stops, then waits for a suitable network
                    task.setPauseReason(PauseReason.NETWORK);
                }
                return false;
            }
            case QUEUED -> {
                return false;
            }
            default -> throw new IllegalStateException("Cannot resume task " + task.getId()
                    + " in status " + task.getStatus());
        }
    }

    /**
     * A user pause is never downgraded to a network pause, which would resume by itself.
     */
    private static void applyPauseReason(TransferTask task, PauseReason reason) {
        if (task.getPauseReason() != PauseReason.USER) {
            task.setPauseReason(reason);
        }
    }

    private void requeueNetworkPaused(Instant now) {
        for (TransferTask task : tasks.values()) {
            if (task.getStatus() == TransferStatus.PAUSED
                    && task.getPauseReason() == PauseReason.NETWORK
                    && task.getNetworkRequirement().isSatisfiedBy(networkClass)) {
                task.setStatus(TransferStatus.QUEUED);
                task.setPauseReason(null);
                task.setUpdatedAt(now);
                queue.offer(task);
                taskStore.save(task);
                log.info("Task {} resumed after network change to {}", task.getId(), networkClass);
            }
        }
    }

    private boolean isEligible(TransferTask task, Instant now) {
        if (task.getNotBefore() != null && now.isBefore(task.getNotBefore())) {
            return false;
        }
        if (task.getRetryCount() > 0 && task.getLastRetryAt() != null
                && now.isBefore(task.getLastRetryAt().plus(backoffFor(task.getRetryCount())))) {
            return false;
        }
        return task.getNetworkRequirement().isSatisfiedBy(networkClass);
    }

    private void markCancelled(TransferTask task) {
        task.setStatus(TransferStatus.CANCELLED);
        task.setPauseReason(null);
        task.setCompletedAt(clock.instant());
        task.setUpdatedAt(clock.instant());
        if (transferProperties.isDeletePartialOnCancel()) {
            transferExecutor.discardPartial(task);
            task.resetProgress();
        }
        log.info("Task {} cancelled", task.getId());
    }

    private TransferTask newTask(String id, TransferRequest request) {
        TransferTask task = new TransferTask(id, request.getUrl(), request.getDestinationPath(), clock.instant());
        task.setPriority(request.getPriority() != null ? request.getPriority() : TransferPriority.NORMAL);
        task.setNotBefore(request.getNotBefore());
        task.setNetworkRequirement(request.getNetworkRequirement() != null
                ? request.getNetworkRequirement()
                : NetworkRequirement.ANY);
        task.setMaxRetries(request.getMaxRetries() != null ? request.getMaxRetries() : transferProperties.getMaxRetries());
        task.setStatus(TransferStatus.QUEUED);
        return task;
    }

    private void updateInPlace(TransferTask task, TransferRequest request) {
        applySchedulingFields(task, request);
        TransferStatus status = task.getStatus();
        if (status == TransferStatus.ACTIVE) {
            log.info("Task {} is active, updated its scheduling fields only", task.getId());
        } else {
            boolean sourceChanged = !task.getUrl().equals(request.getUrl())
                    || !task.getDestinationPath().equals(request.getDestinationPath());
            if (sourceChanged || status == TransferStatus.COMPLETED) {
                transferExecutor.discardPartial(task);
                task.resetProgress();
            }
            task.setUrl(request.getUrl());
            task.setDestinationPath(request.getDestinationPath());
            if (status.isTerminal()) {
                resetRetryState(task);
                task.setCompletedAt(null);
                task.setStatus(TransferStatus.QUEUED);
            }
            if (task.getStatus() == TransferStatus.QUEUED) {
                queue.offer(task);
            }
            log.info("Task {} updated in place ({})", task.getId(), task.getStatus());
        }
        task.setUpdatedAt(clock.instant());
        taskStore.save(task);
    }

    private void applySchedulingFields(TransferTask task, TransferRequest request) {
        if (request.getPriority() != null) {
            task.setPriority(request.getPriority());
        }
        if (request.getNotBefore() != null) {
            task.setNotBefore(request.getNotBefore());
        }
        if (request.getNetworkRequirement() != null) {
            task.setNetworkRequirement(request.getNetworkRequirement());
        }
        if (request.getMaxRetries() != null) {
            task.setMaxRetries(request.getMaxRetries());
        }
    }

    private void resetRetryState(TransferTask task) {
        task.setRetryCount(0);
        task.setLastRetryAt(null);
        task.setNotBefore(null);
        task.setRangeRestarted(false);
        task.clearFailure();
    }

    private void validate(TransferRequest request) {
        if (request.getUrl() == null || request.getUrl().isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (HttpUrl.parse(request.getUrl()) == null) {
            throw new IllegalArgumentException("url must be an http or https URL");
        }
        if (request.getDestinationPath() == null || request.getDestinationPath().isBlank()) {
            throw new IllegalArgumentException("destinationPath is required");
        }
        if (request.getId() != null && !JsonFileTaskStore.isValidId(request.getId())) {
            throw new IllegalArgumentException("id may only contain letters, digits, '.', '_' and '-'");
        }
        if (request.getMaxRetries() != null && request.getMaxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
    }

    private TransferTask require(String taskId) {
        TransferTask task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    private void publishState(TransferTask task) {
        TransferProgress progress = TransferProgress.of(task);
        latestProgress.put(task.getId(), progress);
        eventPublisher.publish(progress);
    }
}
