package com.github.nlayna.transferengine.service;

import com.github.nlayna.transferengine.config.TransferProperties;
import com.github.nlayna.transferengine.model.FailureCategory;
import com.github.nlayna.transferengine.model.TransferOutcome;
import com.github.nlayna.transferengine.model.TransferProgress;
import com.github.nlayna.transferengine.model.TransferResult;
import com.github.nlayna.transferengine.model.TransferStatus;
import com.github.nlayna.transferengine.model.TransferTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves the bytes of exactly one task from its URL to its destination.
 * <p>
 * Data is written to a {@code .part} sibling of the destination and renamed only once the
 * transfer is complete. Every chunk is forced to disk before its offset is persisted, so a
 * restart resumes from the last persisted offset with a {@code Range} request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumableTransferExecutor {

    static final String PARTIAL_SUFFIX = ".part";
    private static final double SPEED_SMOOTHING = 0.3;
    private static final Pattern CONTENT_RANGE = Pattern.compile("bytes (\\d+)-(\\d+)/(\\d+|\\*)");
    private static final Pattern UNSATISFIED_RANGE = Pattern.compile("bytes \\*/(\\d+)");
    private static final Pattern DELTA_SECONDS = Pattern.compile("\\d+");

    private final OkHttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final BandwidthThrottle bandwidthThrottle;
    private final TaskStore taskStore;
    private final TransferProperties transferProperties;

    public static Path partialFileOf(TransferTask task) {
        Path destination = Path.of(task.getDestinationPath());
        return destination.resolveSibling(destination.getFileName() + PARTIAL_SUFFIX);
    }

    /**
     * Runs one attempt of the transfer. Holds a rate limiter permit for the whole attempt.
     *
     * @return the outcome; {@link TransferOutcome#PAUSED} and {@link TransferOutcome#CANCELLED}
     * are returned when the control asked the transfer to stop
     * @throws TransferException when the attempt failed
     */
    public TransferResult transfer(TransferTask task, TransferControl control,
                                   Consumer<TransferProgress> progressListener) throws TransferException {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferException(FailureCategory.NETWORK, "Interrupted while waiting for a permit", e);
        }
        try {
            return doTransfer(task, control, progressListener);
        } finally {
            rateLimiter.release();
        }
    }

    /**
     * Deletes the partial file of a task, if any.
     */
    public void discardPartial(TransferTask task) {
        Path partial = partialFileOf(task);
        try {
            if (Files.deleteIfExists(partial)) {
                log.info("Deleted partial file {}", partial);
            }
        } catch (IOException e) {
            log.warn("Failed to delete partial file {}: {}", partial, e.getMessage());
        }
    }

    private TransferResult doTransfer(TransferTask task, TransferControl control,
                                      Consumer<TransferProgress> progressListener) throws TransferException {
        Path destination = Path.of(task.getDestinationPath());
        Path partial = partialFileOf(task);
        long offset = prepareOffset(task, partial);

        if (control.isStopRequested()) {
            return stopped(task, control);
        }

        Request request = buildRequest(task, offset);
        log.info("Requesting {} from offset {}", task.getUrl(), offset);

        Response response;
        try {
            response = httpClient.newCall(request).execute();
        } catch (IOException e) {
            throw new TransferException(FailureCategory.NETWORK, "Request failed: " + describe(e), e);
        }

        try (response) {
            int code = response.code();
            Long total;
            if (code == 206) {
                total = parsePartialContent(task, response, offset);
            } else if (code == 200) {
                if (offset > 0) {
                    log.info("Server ignored range for task {}, restarting from zero", task.getId());
                    truncate(partial, 0);
                    task.resetProgress();
                    offset = 0;
                }
                long length = response.body() != null ? response.body().contentLength() : -1;
                total = length >= 0 ? length : null;
            } else if (code == 416) {
                return handleUnsatisfiedRange(task, response, offset, partial, destination, progressListener);
            } else {
                throw TransferException.httpError(code, "HTTP " + code + " " + response.message(),
                        parseRetryAfter(response.header("Retry-After")));
            }

            String etag = response.header("ETag");
            if (etag != null) {
                task.setEtag(etag);
            }
            task.setTotalSize(total);

            ResponseBody body = response.body();
            if (body == null) {
                throw new TransferException(FailureCategory.NETWORK, "Response body is null");
            }
            CopyState state = copyBody(task, body, partial, offset, control, progressListener);
            if (state.stoppedEarly()) {
                return stopped(task, control);
            }
            return complete(task, partial, destination, state.written(), progressListener);
        }
    }

    private CopyState copyBody(TransferTask task, ResponseBody body, Path partial, long offset,
                               TransferControl control, Consumer<TransferProgress> progressListener) throws TransferException {
        int chunkSize = transferProperties.getChunkSize();
        byte[] buffer = new byte[Math.min(transferProperties.getBufferSize(), chunkSize)];
        SpeedMeter speed = new SpeedMeter(offset);
        Long total = task.getTotalSize();

        FileChannel out = openPartial(partial, offset);
        long written = offset;
        long lastCheckpoint = offset;
        try (InputStream in = new ThrottledInputStream(body.byteStream(), bandwidthThrottle)) {
            while (true) {
                int read;
                try {
                    read = in.read(buffer);
                } catch (IOException e) {
                    if (written > lastCheckpoint) {
                        checkpointQuietly(task, out, written);
                    }
                    throw new TransferException(FailureCategory.NETWORK, "Read failed: " + describe(e), e);
                }
                if (read == -1) {
                    break;
                }
                if (total != null && written + read > total) {
                    throw new TransferException(FailureCategory.NETWORK,
                            "Server sent more than the announced " + total + " bytes");
                }
                write(out, buffer, read, partial);
                written += read;

                if (written - lastCheckpoint >= chunkSize) {
                    checkpoint(task, out, written, partial);
                    lastCheckpoint = written;
                    publish(task, speed.sample(written), progressListener);
                    if (control.isStopRequested()) {
                        return new CopyState(written, true);
                    }
                }
            }
            if (written > lastCheckpoint || lastCheckpoint == offset) {
                checkpoint(task, out, written, partial);
                publish(task, speed.sample(written), progressListener);
            }
            return new CopyState(written, false);
        } catch (IOException e) {
            // closing the response stream
            throw new TransferException(FailureCategory.NETWORK, "Read failed: " + describe(e), e);
        } finally {
            closeQuietly(out, partial);
        }
    }

    private TransferResult complete(TransferTask task, Path partial, Path destination, long written,
                                    Consumer<TransferProgress> progressListener) throws TransferException {
        Long total = task.getTotalSize();
        if (total == null) {
            task.setTotalSize(written);
        } else if (written != total) {
            throw new TransferException(FailureCategory.NETWORK,
                    "Incomplete transfer: received " + written + " of " + total + " bytes");
        }
        moveIntoPlace(partial, destination);
        log.info("Transfer {} complete: {} bytes -> {}", task.getId(), written, destination);
        publish(task, 0.0, progressListener);
        return new TransferResult(TransferOutcome.COMPLETED, written, task.getTotalSize());
    }

    private TransferResult handleUnsatisfiedRange(TransferTask task, Response response, long offset, Path partial,
                                                  Path destination, Consumer<TransferProgress> progressListener)
            throws TransferException {
        String contentRange = response.header("Content-Range");
        if (offset > 0 && contentRange != null) {
            Matcher matcher = UNSATISFIED_RANGE.matcher(contentRange.trim());
            if (matcher.matches() && Long.parseLong(matcher.group(1)) == offset) {
                log.info("Task {} already holds all {} bytes", task.getId(), offset);
                task.setTotalSize(offset);
                return complete(task, partial, destination, offset, progressListener);
            }
        }
        throw new TransferException(FailureCategory.RANGE_NOT_SATISFIABLE,
                "Range not satisfiable from offset " + offset, 416, null, null);
    }

    private Long parsePartialContent(TransferTask task, Response response, long offset) throws TransferException {
        String contentRange = response.header("Content-Range");
        if (contentRange == null) {
            throw new TransferException(FailureCategory.RANGE_NOT_SATISFIABLE,
                    "Server returned 206 without Content-Range");
        }
        Matcher matcher = CONTENT_RANGE.matcher(contentRange.trim());
        if (!matcher.matches()) {
            throw new TransferException(FailureCategory.RANGE_NOT_SATISFIABLE,
                    "Invalid Content-Range header: " + contentRange);
        }
        long start = Long.parseLong(matcher.group(1));
        if (start != offset) {
            throw new TransferException(FailureCategory.RANGE_NOT_SATISFIABLE,
                    "Server resumed at " + start + " instead of " + offset);
        }
        Long total = "*".equals(matcher.group(3)) ? null : Long.parseLong(matcher.group(3));
        Long known = task.getTotalSize();
        if (total != null && known != null && !total.equals(known)) {
            throw new TransferException(FailureCategory.RANGE_NOT_SATISFIABLE,
                    "Remote size changed from " + known + " to " + total);
        }
        return total != null ? total : known;
    }

    private long prepareOffset(TransferTask task, Path partial) throws TransferException {
        try {
            Path parent = partial.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            long onDisk = Files.exists(partial) ? Files.size(partial) : 0;
            long offset = Math.min(Math.max(task.getBytesTransferred(), 0), onDisk);
            if (onDisk > offset) {
                truncate(partial, offset);
            }
            if (offset != task.getBytesTransferred()) {
                log.info("Task {} recorded {} bytes but {} are on disk, resuming at {}",
                        task.getId(), task.getBytesTransferred(), onDisk, offset);
                task.setBytesTransferred(offset);
            }
            if (offset == 0) {
                task.setEtag(null);
            }
            return offset;
        } catch (IOException e) {
            throw new TransferException(FailureCategory.LOCAL_IO, "Cannot prepare " + partial + ": " + describe(e), e);
        }
    }

    private Request buildRequest(TransferTask task, long offset) throws TransferException {
        Request.Builder builder;
        try {
            builder = new Request.Builder().url(task.getUrl()).get();
        } catch (IllegalArgumentException e) {
            throw new TransferException(FailureCategory.HTTP_ERROR, "Invalid URL: " + task.getUrl(), e);
        }
        if (offset > 0) {
            builder.header("Range", "bytes=" + offset + "-");
            if (task.getEtag() != null) {
                builder.header("If-Range", task.getEtag());
            }
        }
        if (task.getPriority() != null && task.getPriority().useReducedPriorityHeader()) {
            builder.header("X-Accept-Reduced-Priority", "1");
        }
        return builder.build();
    }

    private FileChannel openPartial(Path partial, long offset) throws TransferException {
        try {
            FileChannel channel = FileChannel.open(partial, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            channel.position(offset);
            return channel;
        } catch (IOException e) {
            throw new TransferException(FailureCategory.LOCAL_IO, "Cannot open " + partial + ": " + describe(e), e);
        }
    }

    private void write(FileChannel out, byte[] buffer, int length, Path partial) throws TransferException {
        try {
            ByteBuffer data = ByteBuffer.wrap(buffer, 0, length);
            while (data.hasRemaining()) {
                out.write(data);
            }
        } catch (IOException e) {
            throw new TransferException(FailureCategory.LOCAL_IO, "Write to " + partial + " failed: " + describe(e), e);
        }
    }

    private void checkpoint(TransferTask task, FileChannel out, long written, Path partial) throws TransferException {
        try {
            out.force(false);
        } catch (IOException e) {
            throw new TransferException(FailureCategory.LOCAL_IO, "Flush of " + partial + " failed: " + describe(e), e);
        }
        task.setBytesTransferred(written);
        taskStore.save(task);
        log.debug("Task {} checkpointed at {} bytes", task.getId(), written);
    }

    private void checkpointQuietly(TransferTask task, FileChannel out, long written) {
        try {
            out.force(false);
            task.setBytesTransferred(written);
            taskStore.save(task);
        } catch (IOException e) {
            log.warn("Could not save progress of task {} after a read failure: {}", task.getId(), e.getMessage());
        }
    }

    private void moveIntoPlace(Path partial, Path destination) throws TransferException {
        try {
            try {
                Files.move(partial, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new TransferException(FailureCategory.LOCAL_IO,
                    "Cannot move " + partial + " to " + destination + ": " + describe(e), e);
        }
    }

    private void truncate(Path partial, long size) throws TransferException {
        if (!Files.exists(partial)) {
            return;
        }
        try (FileChannel channel = FileChannel.open(partial, StandardOpenOption.WRITE)) {
            channel.truncate(size);
        } catch (IOException e) {
            throw new TransferException(FailureCategory.LOCAL_IO, "Cannot truncate " + partial + ": " + describe(e), e);
        }
    }

    private void closeQuietly(FileChannel out, Path partial) {
        try {
            out.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", partial, e.getMessage());
        }
    }

    private TransferResult stopped(TransferTask task, TransferControl control) {
        TransferOutcome outcome = control.current() == TransferControl.Signal.CANCEL
                ? TransferOutcome.CANCELLED
                : TransferOutcome.PAUSED;
        log.info("Transfer {} stopped at {} bytes: {}", task.getId(), task.getBytesTransferred(), outcome);
        return new TransferResult(outcome, task.getBytesTransferred(), task.getTotalSize());
    }

    private void publish(TransferTask task, double speed, Consumer<TransferProgress> progressListener) {
        if (progressListener == null) {
            return;
        }
        Duration eta = null;
        Long total = task.getTotalSize();
        if (total != null && speed > 0) {
            long remaining = Math.max(0, total - task.getBytesTransferred());
            eta = Duration.ofMillis((long) (remaining * 1000.0 / speed));
        } else if (total != null && task.getBytesTransferred() >= total) {
            eta = Duration.ZERO;
        }
        progressListener.accept(new TransferProgress(task.getId(), TransferStatus.ACTIVE,
                task.getBytesTransferred(), total, speed, eta));
    }

    static Duration parseRetryAfter(String value) {
        return parseRetryAfter(value, Instant.now());
    }

    /**
     * Accepts both forms of the header: delta-seconds and an HTTP-date.
     */
    static Duration parseRetryAfter(String value, Instant now) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (DELTA_SECONDS.matcher(trimmed).matches()) {
            try {
                long seconds = Long.parseLong(trimmed);
                return seconds > 0 ? Duration.ofSeconds(seconds) : null;
            } catch (NumberFormatException e) {
                log.debug("Retry-After out of range: {}", trimmed);
                return null;
            }
        }
        try {
            Instant retryAt = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration delay = Duration.between(now, retryAt);
            return delay.isNegative() || delay.isZero() ? null : delay;
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable Retry-After: {}", trimmed);
            return null;
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Exponential moving average of the transfer speed over recent chunks.
     */
    static final class SpeedMeter {

        private long lastBytes;
        private long lastNanos;
        private double speed = -1;

        SpeedMeter(long startBytes) {
            this.lastBytes = startBytes;
            this.lastNanos = System.nanoTime();
        }

        double sample(long bytes) {
            long now = System.nanoTime();
            long elapsed = now - lastNanos;
            if (elapsed > 0) {
                double instant = (bytes - lastBytes) * 1_000_000_000.0 / elapsed;
                speed = speed < 0 ? instant : SPEED_SMOOTHING * instant + (1 - SPEED_SMOOTHING) * speed;
            }
            lastBytes = bytes;
            lastNanos = now;
            return Math.max(speed, 0.0);
        }
    }

    private record CopyState(long written, boolean stoppedEarly) {
    }
}
