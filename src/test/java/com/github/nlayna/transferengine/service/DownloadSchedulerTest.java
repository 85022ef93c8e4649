package com.github.nlayna.transferengine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DownloadSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    @Mock
    private ResumableTransferExecutor transferExecutor;

    @Mock
    private TaskScheduler tickScheduler;

    private TransferProperties properties;
    private JsonFileTaskStore taskStore;
    private ManualExecutor workers;
    private MutableClock clock;
    private TransferEventPublisher eventPublisher;
    private DownloadScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new TransferProperties();
        properties.setMaxConcurrentTasks(1);
        taskStore = new JsonFileTaskStore(tempDir.resolve("store"), new ObjectMapper());
        workers = new ManualExecutor();
        clock = new MutableClock(T0);
        eventPublisher = new TransferEventPublisher();
        scheduler = createScheduler();
    }

    @Test
    void start_schedulesPeriodicTick() {
        scheduler.start();

        assertThat(scheduler.isRunning()).isTrue();
        verify(tickScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(5)));
    }

    @Test
    void tick_ceilingOne_startsTasksInPriorityOrder() throws Exception {
        scheduler.enqueue(request("low", TransferPriority.LOW));
        scheduler.enqueue(request("normal", TransferPriority.NORMAL));
        scheduler.enqueue(request("high", TransferPriority.HIGH));
        when(transferExecutor.transfer(any(), any(), any())).thenReturn(completed());

        scheduler.start();

        assertThat(statusOf("high")).isEqualTo(TransferStatus.ACTIVE);
        assertThat(scheduler.getQueueOrder()).containsExactly("normal", "low");

        workers.runNext();
        assertThat(statusOf("high")).isEqualTo(TransferStatus.COMPLETED);
        assertThat(statusOf("normal")).isEqualTo(TransferStatus.ACTIVE);
        assertThat(statusOf("low")).isEqualTo(TransferStatus.QUEUED);

        workers.runAll();

        ArgumentCaptor<TransferTask> started = ArgumentCaptor.forClass(TransferTask.class);
        verify(transferExecutor, times(3)).transfer(started.capture(), any(), any());
        assertThat(started.getAllValues()).extracting(TransferTask::getId).containsExactly("high", "normal", "low");
    }

    @Test
    void remove_queuedHighPriorityTask_letsNormalTaskStartNext() throws Exception {
        scheduler.start();
        scheduler.enqueue(request("blocker", TransferPriority.NORMAL));
        scheduler.enqueue(request("normal", TransferPriority.NORMAL));
        scheduler.enqueue(request("high", TransferPriority.HIGH));
        assertThat(scheduler.getQueueOrder()).containsExactly("high", "normal");

        scheduler.remove("high");

        assertThat(statusOf("high")).isEqualTo(TransferStatus.CANCELLED);
        verify(transferExecutor).discardPartial(argThat(t -> t.getId().equals("high")));

        when(transferExecutor.transfer(any(), any(), any())).thenReturn(completed());
        workers.runNext();

        assertThat(statusOf("blocker")).isEqualTo(TransferStatus.COMPLETED);
        assertThat(statusOf("normal")).isEqualTo(TransferStatus.ACTIVE);
    }

    @Test
    void tick_activeTaskIsNeverPreemptedByHigherPriority() {
        scheduler.start();
        scheduler.enqueue(request("running", TransferPriority.LOW));

        scheduler.enqueue(request("urgent", TransferPriority.HIGH));

        assertThat(statusOf("running")).isEqualTo(TransferStatus.ACTIVE);
        assertThat(statusOf("urgent")).isEqualTo(TransferStatus.QUEUED);
        assertThat(scheduler.getActiveCount()).isEqualTo(1);
    }

    @Test
    void networkFailures_exhaustRetryBudget_endFailed() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any()))
                .thenThrow(new TransferException(FailureCategory.NETWORK, "Connection reset"));
        TransferRequest request = request("flaky", TransferPriority.NORMAL);
        request.setMaxRetries(5);
        scheduler.enqueue(request);

        for (int attempt = 1; attempt <= 5; attempt++) {
            workers.runNext();
            if (attempt < 5) {
                TransferTask task = taskOf("flaky");
                assertThat(task.getStatus()).isEqualTo(TransferStatus.QUEUED);
                assertThat(task.getRetryCount()).isEqualTo(attempt);
                clock.advance(Duration.ofMinutes(2));
                scheduler.tick();
            }
        }

        TransferTask task = taskOf("flaky");
        assertThat(task.getStatus()).isEqualTo(TransferStatus.FAILED);
        assertThat(task.getFailureCategory()).isEqualTo(FailureCategory.EXHAUSTED_RETRIES);
        assertThat(task.getRetryCount()).isEqualTo(5);
        assertThat(task.getErrorMessage()).contains("Connection reset");
        verify(transferExecutor, times(5)).transfer(any(), any(), any());
        assertThat(taskStore.findById("flaky").orElseThrow().getStatus()).isEqualTo(TransferStatus.FAILED);
    }

    @Test
    void retryableFailure_waitsForBackoffBeforeRestarting() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any()))
                .thenThrow(TransferException.httpError(503, "HTTP 503 Service Unavailable", null));
        scheduler.enqueue(request("busy", TransferPriority.NORMAL));

        workers.runNext();

        TransferTask task = taskOf("busy");
        assertThat(task.getStatus()).isEqualTo(TransferStatus.QUEUED);
        assertThat(task.getNotBefore()).isEqualTo(T0.plusSeconds(2));
        assertThat(task.getHttpStatus()).isEqualTo(503);

        clock.advance(Duration.ofSeconds(1));
        scheduler.tick();
        assertThat(workers.pendingCount()).isZero();

        clock.advance(Duration.ofSeconds(1));
        scheduler.tick();
        assertThat(statusOf("busy")).isEqualTo(TransferStatus.ACTIVE);
    }

    @Test
    void tooManyRequests_honorsRetryAfterWhenLongerThanBackoff() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any()))
                .thenThrow(TransferException.httpError(429, "HTTP 429 Too Many Requests", Duration.ofSeconds(120)));
        scheduler.enqueue(request("limited", TransferPriority.NORMAL));

        workers.runNext();

        TransferTask task = taskOf("limited");
        assertThat(task.getStatus()).isEqualTo(TransferStatus.QUEUED);
        assertThat(task.getRetryCount()).isEqualTo(1);
        assertThat(task.getNotBefore()).isEqualTo(T0.plusSeconds(120));
    }

    @Test
    void clientError_failsWithoutRetry() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any()))
                .thenThrow(TransferException.httpError(404, "HTTP 404 Not Found", null));
        scheduler.enqueue(request("missing", TransferPriority.NORMAL));

        workers.runNext();

        TransferTask task = taskOf("missing");
        assertThat(task.getStatus()).isEqualTo(TransferStatus.FAILED);
        assertThat(task.getFailureCategory()).isEqualTo(FailureCategory.HTTP_ERROR);
        assertThat(task.getHttpStatus()).isEqualTo(404);
        assertThat(task.getRetryCount()).isZero();
    }

    @Test
    void localIoFailure_failsWithoutRetry() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any()))
                .thenThrow(new TransferException(FailureCategory.LOCAL_IO, "Disk full"));
        scheduler.enqueue(request("disk", TransferPriority.NORMAL));

        workers.runNext();

        assertThat(statusOf("disk")).isEqualTo(TransferStatus.FAILED);
        assertThat(taskOf("disk").getFailureCategory()).isEqualTo(FailureCategory.LOCAL_IO);
    }

    @Test
    void unexpectedRuntimeError_isTreatedAsLocalFailure() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any())).thenThrow(new IllegalStateException("bug"));
        scheduler.enqueue(request("buggy", TransferPriority.NORMAL));

        workers.runNext();

        assertThat(statusOf("buggy")).isEqualTo(TransferStatus.FAILED);
        assertThat(taskOf("buggy").getFailureCategory()).isEqualTo(FailureCategory.LOCAL_IO);
    }

    @Test
    void rangeNotSatisfiable_firstTimeRestartsFromZeroWithoutUsingRetryBudget() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any()))
                .thenThrow(new TransferException(FailureCategory.RANGE_NOT_SATISFIABLE, "Range not satisfiable"))
                .thenReturn(completed());
        scheduler.enqueue(request("stale", TransferPriority.NORMAL));
        taskOf("stale").setBytesTransferred(4096);

        workers.runNext();

        TransferTask task = taskOf("stale");
        assertThat(task.getRetryCount()).isZero();
        assertThat(task.isRangeRestarted()).isTrue();
        assertThat(task.getBytesTransferred()).isZero();
        assertThat(task.getStatus()).isEqualTo(TransferStatus.ACTIVE);
        verify(transferExecutor).discardPartial(task);

        workers.runNext();
        assertThat(statusOf("stale")).isEqualTo(TransferStatus.COMPLETED);
    }

    @Test
    void rangeNotSatisfiable_secondTimeCountsAsRetry() throws Exception {
        scheduler.start();
        TransferException rangeError = new TransferException(FailureCategory.RANGE_NOT_SATISFIABLE, "Range not satisfiable");
        when(transferExecutor.transfer(any(), any(), any())).thenThrow(rangeError, rangeError);
        scheduler.enqueue(request("stale", TransferPriority.NORMAL));

        workers.runNext();
        workers.runNext();

        TransferTask task = taskOf("stale");
        assertThat(task.getStatus()).isEqualTo(TransferStatus.QUEUED);
        assertThat(task.getRetryCount()).isEqualTo(1);
        assertThat(task.getBytesTransferred()).isZero();
    }

    @Test
    void backoffFor_doublesAndCaps() {
        assertThat(scheduler.backoffFor(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(scheduler.backoffFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(scheduler.backoffFor(3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(scheduler.backoffFor(6)).isEqualTo(Duration.ofSeconds(64));
        assertThat(scheduler.backoffFor(40)).isEqualTo(Duration.ofSeconds(64));
    }

    @Test
    void tick_notBeforeInFuture_keepsTaskQueued() {
        scheduler.start();
        TransferRequest request = request("later", TransferPriority.HIGH);
        request.setNotBefore(T0.plus(Duration.ofMinutes(10)));
        scheduler.enqueue(request);
        scheduler.enqueue(request("now", TransferPriority.LOW));

        assertThat(statusOf("later")).isEqualTo(TransferStatus.QUEUED);
        assertThat(statusOf("now")).isEqualTo(TransferStatus.ACTIVE);
    }

    @Test
    void onNetworkChanged_pausesAndAutoResumesTasksByRequirement() throws Exception {
        properties.setInitialNetwork(NetworkClass.METERED);
        scheduler = createScheduler();
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any())).thenAnswer(inv -> {
            TransferControl control = inv.getArgument(1);
            return control.isStopRequested() ? paused() : completed();
        });
        TransferRequest request = request("wifi", TransferPriority.NORMAL);
        request.setNetworkRequirement(NetworkRequirement.UNMETERED_ONLY);
        scheduler.enqueue(request);
        assertThat(statusOf("wifi")).isEqualTo(TransferStatus.QUEUED);

        scheduler.onNetworkChanged(NetworkClass.UNMETERED);
        assertThat(statusOf("wifi")).isEqualTo(TransferStatus.ACTIVE);

        scheduler.onNetworkChanged(NetworkClass.METERED);
        workers.runNext();
        assertThat(statusOf("wifi")).isEqualTo(TransferStatus.PAUSED);
        assertThat(taskOf("wifi").getPauseReason()).isEqualTo(PauseReason.NETWORK);

        scheduler.onNetworkChanged(NetworkClass.UNMETERED);
        assertThat(statusOf("wifi")).isEqualTo(TransferStatus.ACTIVE);

        workers.runNext();
        assertThat(statusOf("wifi")).isEqualTo(TransferStatus.COMPLETED);
    }

    @Test
    void tick_offline_startsNothing() {
        properties.setInitialNetwork(NetworkClass.OFFLINE);
        scheduler = createScheduler();
        scheduler.start();

        scheduler.enqueue(request("any", TransferPriority.NORMAL));

        assertThat(statusOf("any")).isEqualTo(TransferStatus.QUEUED);
        assertThat(workers.pendingCount()).isZero();
    }

    @Test
    void userPause_isNotUndoneByNetworkChange() throws Exception {
        scheduler.start();
        scheduler.enqueue(request("blocker", TransferPriority.NORMAL));
        scheduler.enqueue(request("held", TransferPriority.NORMAL));
        scheduler.pause("held");

        scheduler.onNetworkChanged(NetworkClass.LOCAL);
        when(transferExecutor.transfer(any(), any(), any())).thenReturn(completed());
        workers.runAll();

        assertThat(statusOf("held")).isEqualTo(TransferStatus.PAUSED);
        assertThat(taskOf("held").getPauseReason()).isEqualTo(PauseReason.USER);
    }

    @Test
    void pause_queuedTask_holdsItUntilResumed() throws Exception {
        scheduler.start();
        scheduler.enqueue(request("blocker", TransferPriority.NORMAL));
        scheduler.enqueue(request("waiting", TransferPriority.NORMAL));

        scheduler.pause("waiting");
        assertThat(statusOf("waiting")).isEqualTo(TransferStatus.PAUSED);
        assertThat(scheduler.getQueueOrder()).isEmpty();

        when(transferExecutor.transfer(any(), any(), any())).thenReturn(completed());
        workers.runNext();
        assertThat(statusOf("waiting")).isEqualTo(TransferStatus.PAUSED);
        assertThat(workers.pendingCount()).isZero();

        scheduler.resume("waiting");
        assertThat(statusOf("waiting")).isEqualTo(TransferStatus.ACTIVE);
    }

    @Test
    void pause_activeTask_stopsAtChunkBoundaryAndResumes() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any())).thenAnswer(inv -> {
            TransferTask task = inv.getArgument(0);
            TransferControl control = inv.getArgument(1);
            if (control.isStopRequested()) {
                task.setBytesTransferred(1024 * 1024);
                return paused();
            }
            return completed();
        });
        scheduler.enqueue(request("big", TransferPriority.NORMAL));

        scheduler.pause("big");
        assertThat(statusOf("big")).isEqualTo(TransferStatus.ACTIVE);
        workers.runNext();

        TransferTask task = taskOf("big");
        assertThat(task.getStatus()).isEqualTo(TransferStatus.PAUSED);
        assertThat(task.getPauseReason()).isEqualTo(PauseReason.USER);
        assertThat(taskStore.findById("big").orElseThrow().getBytesTransferred()).isEqualTo(1024 * 1024);

        scheduler.resume("big");
        assertThat(statusOf("big")).isEqualTo(TransferStatus.ACTIVE);
        workers.runNext();
        assertThat(statusOf("big")).isEqualTo(TransferStatus.COMPLETED);
    }

    @Test
    void pauseAll_thenResumeAll_restoresQueue() throws Exception {
        scheduler.start();
        scheduler.enqueue(request("a", TransferPriority.NORMAL));
        scheduler.enqueue(request("b", TransferPriority.NORMAL));
        scheduler.enqueue(request("c", TransferPriority.NORMAL));
        when(transferExecutor.transfer(any(), any(), any())).thenAnswer(inv -> {
            TransferControl control = inv.getArgument(1);
            return control.isStopRequested() ? paused() : completed();
        });

        assertThat(scheduler.pauseAll()).isEqualTo(3);
        workers.runNext();
        assertThat(scheduler.listTasks(TransferStatus.PAUSED)).hasSize(3);

        assertThat(scheduler.resumeAll()).isEqualTo(3);
        assertThat(statusOf("a")).isEqualTo(TransferStatus.ACTIVE);
        assertThat(scheduler.getQueueOrder()).containsExactly("b", "c");
    }

    @Test
    void remove_activeTask_cancelsAndDiscardsPartial() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any())).thenAnswer(inv -> {
            TransferControl control = inv.getArgument(1);
            return control.current() == TransferControl.Signal.CANCEL
                    ? new TransferResult(TransferOutcome.CANCELLED, 512, 1024L)
                    : completed();
        });
        scheduler.enqueue(request("doomed", TransferPriority.NORMAL));

        scheduler.remove("doomed");
        workers.runNext();

        assertThat(statusOf("doomed")).isEqualTo(TransferStatus.CANCELLED);
        verify(transferExecutor).discardPartial(argThat(t -> t.getId().equals("doomed")));
    }

    @Test
    void remove_keepPartialPolicy_leavesPartialFile() {
        properties.setDeletePartialOnCancel(false);
        scheduler = createScheduler();
        scheduler.start();
        scheduler.enqueue(request("blocker", TransferPriority.NORMAL));
        scheduler.enqueue(request("kept", TransferPriority.NORMAL));

        scheduler.remove("kept");

        assertThat(statusOf("kept")).isEqualTo(TransferStatus.CANCELLED);
        verify(transferExecutor, never()).discardPartial(any());
    }

    @Test
    void stopRequestedButTransferFailed_honorsTheStop() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any()))
                .thenThrow(new TransferException(FailureCategory.NETWORK, "Socket closed"));
        scheduler.enqueue(request("racy", TransferPriority.NORMAL));

        scheduler.pause("racy");
        workers.runNext();

        assertThat(statusOf("racy")).isEqualTo(TransferStatus.PAUSED);
        assertThat(taskOf("racy").getRetryCount()).isZero();
    }

    @Test
    void setPriority_repositionsQueuedTask() {
        scheduler.start();
        scheduler.enqueue(request("blocker", TransferPriority.NORMAL));
        scheduler.enqueue(request("first", TransferPriority.NORMAL));
        scheduler.enqueue(request("second", TransferPriority.NORMAL));

        scheduler.setPriority("second", TransferPriority.HIGH);

        assertThat(scheduler.getQueueOrder()).containsExactly("second", "first");
        assertThat(statusOf("blocker")).isEqualTo(TransferStatus.ACTIVE);
        assertThat(taskStore.findById("second").orElseThrow().getPriority()).isEqualTo(TransferPriority.HIGH);
    }

    @Test
    void setPriority_unknownTask_throwsNotFound() {
        assertThatThrownBy(() -> scheduler.setPriority("ghost", TransferPriority.HIGH))
                .isInstanceOf(TaskNotFoundException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void enqueue_duplicateId_updatesTaskInPlace() {
        scheduler.start();
        scheduler.enqueue(request("blocker", TransferPriority.NORMAL));
        scheduler.enqueue(request("dup", TransferPriority.LOW));

        String id = scheduler.enqueue(request("dup", TransferPriority.HIGH));

        assertThat(id).isEqualTo("dup");
        assertThat(scheduler.listTasks(null)).hasSize(2);
        assertThat(taskOf("dup").getPriority()).isEqualTo(TransferPriority.HIGH);
        assertThat(scheduler.getQueueOrder()).containsExactly("dup");
    }

    @Test
    void enqueue_duplicateOfActiveTask_updatesSchedulingFieldsOnly() {
        scheduler.start();
        scheduler.enqueue(request("live", TransferPriority.NORMAL));
        TransferRequest update = request("live", TransferPriority.HIGH);
        update.setUrl("https://mirror.example.com/live");

        scheduler.enqueue(update);

        TransferTask task = taskOf("live");
        assertThat(task.getStatus()).isEqualTo(TransferStatus.ACTIVE);
        assertThat(task.getPriority()).isEqualTo(TransferPriority.HIGH);
        assertThat(task.getUrl()).isEqualTo("https://example.com/files/live");
    }

    @Test
    void enqueue_duplicateOfFailedTask_requeuesWithFreshRetryBudget() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any()))
                .thenThrow(TransferException.httpError(404, "HTTP 404 Not Found", null));
        scheduler.enqueue(request("again", TransferPriority.NORMAL));
        workers.runNext();
        assertThat(statusOf("again")).isEqualTo(TransferStatus.FAILED);

        scheduler.enqueue(request("again", TransferPriority.NORMAL));

        TransferTask task = taskOf("again");
        assertThat(task.getStatus()).isEqualTo(TransferStatus.ACTIVE);
        assertThat(task.getRetryCount()).isZero();
        assertThat(task.getFailureCategory()).isNull();
    }

    @Test
    void enqueue_invalidRequest_throwsException() {
        TransferRequest noUrl = request("x", TransferPriority.NORMAL);
        noUrl.setUrl(" ");
        TransferRequest ftp = request("y", TransferPriority.NORMAL);
        ftp.setUrl("ftp://example.com/file");
        TransferRequest badId = request("../etc", TransferPriority.NORMAL);

        assertThatThrownBy(() -> scheduler.enqueue(noUrl))
                .isInstanceOf(IllegalArgumentException.class).hasMessage("url is required");
        assertThatThrownBy(() -> scheduler.enqueue(ftp))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("http or https");
        assertThatThrownBy(() -> scheduler.enqueue(badId))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("id may only contain");
    }

    @Test
    void enqueue_withoutId_generatesOneAndUsesDefaults() {
        TransferRequest request = request(null, null);

        String id = scheduler.enqueue(request);

        TransferTask task = taskOf(id);
        assertThat(task.getPriority()).isEqualTo(TransferPriority.NORMAL);
        assertThat(task.getNetworkRequirement()).isEqualTo(NetworkRequirement.ANY);
        assertThat(task.getMaxRetries()).isEqualTo(5);
        assertThat(taskStore.findById(id)).isPresent();
    }

    @Test
    void retry_failedTask_requeuesIt() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any()))
                .thenThrow(TransferException.httpError(403, "HTTP 403 Forbidden", null))
                .thenReturn(completed());
        scheduler.enqueue(request("denied", TransferPriority.NORMAL));
        workers.runNext();

        scheduler.retry("denied");
        assertThat(statusOf("denied")).isEqualTo(TransferStatus.ACTIVE);
        assertThatThrownBy(() -> scheduler.retry("denied")).isInstanceOf(IllegalStateException.class);

        workers.runNext();
        assertThat(statusOf("denied")).isEqualTo(TransferStatus.COMPLETED);
    }

    @Test
    void purge_onlyRemovesTerminalTasks() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any())).thenReturn(completed());
        scheduler.enqueue(request("done", TransferPriority.NORMAL));
        scheduler.enqueue(request("waiting", TransferPriority.NORMAL));
        assertThatThrownBy(() -> scheduler.purge("done")).isInstanceOf(IllegalStateException.class);

        workers.runNext();
        scheduler.purge("done");

        assertThat(scheduler.getTask("done")).isEmpty();
        assertThat(taskStore.findById("done")).isEmpty();
        assertThat(scheduler.getTask("waiting")).isPresent();
    }

    @Test
    void purgeFinished_removesCompletedAndCancelledOnly() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any()))
                .thenReturn(completed())
                .thenThrow(TransferException.httpError(410, "HTTP 410 Gone", null));
        scheduler.enqueue(request("ok", TransferPriority.NORMAL));
        scheduler.enqueue(request("gone", TransferPriority.NORMAL));
        scheduler.enqueue(request("dropped", TransferPriority.NORMAL));
        scheduler.remove("dropped");
        workers.runAll();

        assertThat(scheduler.purgeFinished()).isEqualTo(2);
        assertThat(scheduler.listTasks(null)).extracting(TransferTask::getId).containsExactly("gone");
    }

    @Test
    void start_recoversInterruptedTasks() throws Exception {
        TransferTask interrupted = storedTask("interrupted", TransferStatus.ACTIVE, T0);
        interrupted.setBytesTransferred(4096);
        interrupted.setTotalSize(10_000L);
        taskStore.save(interrupted);
        Files.write(ResumableTransferExecutor.partialFileOf(interrupted), new byte[4096]);

        TransferTask lost = storedTask("lost", TransferStatus.ACTIVE, T0.plusSeconds(1));
        lost.setBytesTransferred(2048);
        taskStore.save(lost);

        taskStore.save(storedTask("finished", TransferStatus.COMPLETED, T0.plusSeconds(2)));

        scheduler.start();

        TransferTask resumed = taskOf("interrupted");
        assertThat(resumed.getStatus()).isEqualTo(TransferStatus.ACTIVE);
        assertThat(resumed.getBytesTransferred()).isEqualTo(4096);
        TransferTask restarted = taskOf("lost");
        assertThat(restarted.getStatus()).isEqualTo(TransferStatus.QUEUED);
        assertThat(restarted.getBytesTransferred()).isZero();
        assertThat(statusOf("finished")).isEqualTo(TransferStatus.COMPLETED);
    }

    @Test
    void stop_requeuesStoppedTransfersForNextStart() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any())).thenAnswer(inv -> {
            TransferControl control = inv.getArgument(1);
            return control.isStopRequested() ? paused() : completed();
        });
        scheduler.enqueue(request("inflight", TransferPriority.NORMAL));

        scheduler.stop();
        workers.runNext();

        assertThat(scheduler.isRunning()).isFalse();
        assertThat(statusOf("inflight")).isEqualTo(TransferStatus.QUEUED);
        assertThat(workers.pendingCount()).isZero();

        scheduler.start();
        assertThat(statusOf("inflight")).isEqualTo(TransferStatus.ACTIVE);
    }

    @Test
    void statusChanges_arePublishedToSubscribers() throws Exception {
        List<TransferProgress> events = new CopyOnWriteArrayList<>();
        eventPublisher.subscribe(events::add);
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any())).thenReturn(completed());

        scheduler.enqueue(request("watched", TransferPriority.NORMAL));
        workers.runNext();

        assertThat(events).extracting(TransferProgress::status)
                .containsSubsequence(TransferStatus.QUEUED, TransferStatus.ACTIVE, TransferStatus.COMPLETED);
        assertThat(scheduler.getProgress("watched")).hasValueSatisfying(
                p -> assertThat(p.status()).isEqualTo(TransferStatus.COMPLETED));
    }

    @Test
    void setMaxConcurrentTasks_raisingCeilingStartsMoreTasks() {
        scheduler.start();
        scheduler.enqueue(request("a", TransferPriority.NORMAL));
        scheduler.enqueue(request("b", TransferPriority.NORMAL));
        scheduler.enqueue(request("c", TransferPriority.NORMAL));

        scheduler.setMaxConcurrentTasks(3);

        assertThat(scheduler.getActiveCount()).isEqualTo(3);
        assertThatThrownBy(() -> scheduler.setMaxConcurrentTasks(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tick_failedSaveOnStart_leavesTaskQueuedWithoutHoldingASlot() throws Exception {
        FailingOnceTaskStore store = new FailingOnceTaskStore(taskStore);
        scheduler = new DownloadScheduler(store, transferExecutor, workers, tickScheduler, eventPublisher,
                properties, clock);
        scheduler.start();
        store.failNextSaveWhen(t -> t.getStatus() == TransferStatus.ACTIVE);

        scheduler.enqueue(request("a", TransferPriority.NORMAL));

        assertThat(statusOf("a")).isEqualTo(TransferStatus.QUEUED);
        assertThat(scheduler.getActiveCount()).isZero();
        assertThat(scheduler.getQueueOrder()).containsExactly("a");
        assertThat(workers.pendingCount()).isZero();
        assertThat(taskStore.findById("a").orElseThrow().getStatus()).isEqualTo(TransferStatus.QUEUED);

        scheduler.tick();
        assertThat(statusOf("a")).isEqualTo(TransferStatus.ACTIVE);
        assertThat(workers.pendingCount()).isEqualTo(1);

        when(transferExecutor.transfer(any(), any(), any())).thenReturn(completed());
        workers.runNext();
        assertThat(statusOf("a")).isEqualTo(TransferStatus.COMPLETED);
    }

    @Test
    void enqueue_failedSave_leavesNothingBehind() {
        FailingOnceTaskStore store = new FailingOnceTaskStore(taskStore);
        scheduler = new DownloadScheduler(store, transferExecutor, workers, tickScheduler, eventPublisher,
                properties, clock);
        scheduler.start();
        store.failNextSaveWhen(t -> true);

        assertThatThrownBy(() -> scheduler.enqueue(request("lost", TransferPriority.NORMAL)))
                .isInstanceOf(UncheckedIOException.class);

        assertThat(scheduler.getTask("lost")).isEmpty();
        assertThat(scheduler.getQueueOrder()).isEmpty();
        assertThat(scheduler.getActiveCount()).isZero();

        scheduler.enqueue(request("lost", TransferPriority.NORMAL));
        assertThat(statusOf("lost")).isEqualTo(TransferStatus.ACTIVE);
    }

    @Test
    void resume_doesNotWithdrawPendingNetworkPause() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any())).thenAnswer(inv -> {
            TransferControl control = inv.getArgument(1);
            return control.isStopRequested() ? paused() : completed();
        });
        TransferRequest request = request("wifi", TransferPriority.NORMAL);
        request.setNetworkRequirement(NetworkRequirement.UNMETERED_ONLY);
        scheduler.enqueue(request);
        assertThat(statusOf("wifi")).isEqualTo(TransferStatus.ACTIVE);

        scheduler.onNetworkChanged(NetworkClass.METERED);
        scheduler.resume("wifi");
        assertThat(taskOf("wifi").getPauseReason()).isEqualTo(PauseReason.NETWORK);

        workers.runNext();
        assertThat(statusOf("wifi")).isEqualTo(TransferStatus.PAUSED);
        assertThat(taskOf("wifi").getPauseReason()).isEqualTo(PauseReason.NETWORK);

        scheduler.onNetworkChanged(NetworkClass.UNMETERED);
        assertThat(statusOf("wifi")).isEqualTo(TransferStatus.ACTIVE);
    }

    @Test
    void pendingUserPause_isNotTurnedIntoNetworkPause() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any())).thenAnswer(inv -> {
            TransferControl control = inv.getArgument(1);
            return control.isStopRequested() ? paused() : completed();
        });
        TransferRequest request = request("wifi", TransferPriority.NORMAL);
        request.setNetworkRequirement(NetworkRequirement.UNMETERED_ONLY);
        scheduler.enqueue(request);

        scheduler.pause("wifi");
        scheduler.onNetworkChanged(NetworkClass.METERED);
        workers.runNext();
        assertThat(statusOf("wifi")).isEqualTo(TransferStatus.PAUSED);
        assertThat(taskOf("wifi").getPauseReason()).isEqualTo(PauseReason.USER);

        scheduler.onNetworkChanged(NetworkClass.UNMETERED);
        assertThat(statusOf("wifi")).isEqualTo(TransferStatus.PAUSED);
        assertThat(workers.pendingCount()).isZero();
    }

    @Test
    void resume_withdrawsPendingUserPauseWhenNetworkAllows() throws Exception {
        scheduler.start();
        when(transferExecutor.transfer(any(), any(), any())).thenAnswer(inv -> {
            TransferControl control = inv.getArgument(1);
            return control.isStopRequested() ? paused() : completed();
        });
        scheduler.enqueue(request("quick", TransferPriority.NORMAL));

        scheduler.pause("quick");
        scheduler.resume("quick");
        assertThat(taskOf("quick").getPauseReason()).isNull();

        workers.runNext();
        assertThat(statusOf("quick")).isEqualTo(TransferStatus.COMPLETED);
    }

    @Test
    void getState_reportsQueueAndNetwork() {
        scheduler.start();
        scheduler.enqueue(request("a", TransferPriority.NORMAL));
        scheduler.enqueue(request("b", TransferPriority.NORMAL));

        SchedulerState state = scheduler.getState();
        assertThat(state.activeTasks()).isEqualTo(1);
        assertThat(state.queuedTasks()).isEqualTo(1);
        assertThat(state.maxConcurrentTasks()).isEqualTo(1);
        assertThat(state.networkUsable()).isTrue();
        assertThat(state.hasCapacity()).isFalse();

        scheduler.onNetworkChanged(NetworkClass.OFFLINE);
        assertThat(scheduler.getState().networkUsable()).isFalse();
    }

    private DownloadScheduler createScheduler() {
        return new DownloadScheduler(taskStore, transferExecutor, workers, tickScheduler, eventPublisher,
                properties, clock);
    }

    private TransferRequest request(String id, TransferPriority priority) {
        String name = id != null ? id : "generated";
        TransferRequest request = new TransferRequest();
        request.setId(id);
        request.setUrl("https://example.com/files/" + name);
        request.setDestinationPath(tempDir.resolve(name + ".bin").toString());
        request.setPriority(priority);
        return request;
    }

    private TransferTask storedTask(String id, TransferStatus status, Instant createdAt) {
        TransferTask task = new TransferTask(id, "https://example.com/files/" + id,
                tempDir.resolve(id + ".bin").toString(), createdAt);
        task.setStatus(status);
        task.setMaxRetries(5);
        return task;
    }

    private TransferTask taskOf(String id) {
        return scheduler.getTask(id).orElseThrow();
    }

    private TransferStatus statusOf(String id) {
        return taskOf(id).getStatus();
    }

    private static TransferResult completed() {
        return new TransferResult(TransferOutcome.COMPLETED, 1024, 1024L);
    }

    private static TransferResult paused() {
        return new TransferResult(TransferOutcome.PAUSED, 512, 1024L);
    }

    /**
     * Delegates to a real store, failing the next save that matches a condition.
     */
    private static final class FailingOnceTaskStore implements TaskStore {

        private final TaskStore delegate;
        private Predicate<TransferTask> failWhen;

        FailingOnceTaskStore(TaskStore delegate) {
            this.delegate = delegate;
        }

        void failNextSaveWhen(Predicate<TransferTask> condition) {
            this.failWhen = condition;
        }

        @Override
        public void save(TransferTask task) {
            if (failWhen != null && failWhen.test(task)) {
                failWhen = null;
                throw new UncheckedIOException(new IOException("No space left on device"));
            }
            delegate.save(task);
        }

        @Override
        public Optional<TransferTask> findById(String id) {
            return delegate.findById(id);
        }

        @Override
        public List<TransferTask> findAll() {
            return delegate.findAll();
        }

        @Override
        public List<TransferTask> findByStatus(TransferStatus... statuses) {
            return delegate.findByStatus(statuses);
        }

        @Override
        public boolean delete(String id) {
            return delegate.delete(id);
        }
    }
}
