package com.github.nlayna.transferengine.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.nlayna.transferengine.model.TransferStatus;
import com.github.nlayna.transferengine.model.TransferTask;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Stores one JSON document per task under a directory. Each document is written to a
 * temporary file and moved into place, so a crash never leaves a half-written record.
 */
@Slf4j
public class JsonFileTaskStore implements TaskStore {

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9._-]+");
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final ConcurrentMap<String, Object> taskLocks = new ConcurrentHashMap<>();

    public JsonFileTaskStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create task store directory: " + directory, e);
        }
        log.info("Task store initialized at {}", directory.toAbsolutePath());
    }

    public static boolean isValidId(String id) {
        return id != null && VALID_ID.matcher(id).matches() && !id.startsWith(".");
    }

    @Override
    public void save(TransferTask task) {
        String id = task.getId();
        Path target = fileOf(id);
        Path temp = target.resolveSibling(id + EXTENSION + ".tmp");
        synchronized (lockOf(id)) {
            try {
                objectMapper.writeValue(temp.toFile(), task);
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to persist task " + id, e);
            }
        }
    }

    @Override
    public Optional<TransferTask> findById(String id) {
        if (!isValidId(id)) {
            return Optional.empty();
        }
        synchronized (lockOf(id)) {
            return read(fileOf(id));
        }
    }

    @Override
    public List<TransferTask> findAll() {
        List<TransferTask> tasks = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String id = name.substring(0, name.length() - EXTENSION.length());
                synchronized (lockOf(id)) {
                    read(file).ifPresent(tasks::add);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list task store " + directory, e);
        }
        tasks.sort(Comparator.comparing(TransferTask::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return tasks;
    }

    @Override
    public List<TransferTask> findByStatus(TransferStatus... statuses) {
        Set<TransferStatus> wanted = statuses.length == 0
                ? EnumSet.allOf(TransferStatus.class)
                : EnumSet.copyOf(Arrays.asList(statuses));
        return findAll().stream()
                .filter(t -> wanted.contains(t.getStatus()))
                .toList();
    }

    @Override
    public boolean delete(String id) {
        if (!isValidId(id)) {
            return false;
        }
        synchronized (lockOf(id)) {
            try {
                return Files.deleteIfExists(fileOf(id));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete task " + id, e);
            }
        }
    }

    private Optional<TransferTask> read(Path file) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), TransferTask.class));
        } catch (IOException e) {
            log.warn("Skipping unreadable task record {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Path fileOf(String id) {
        if (!isValidId(id)) {
            throw new IllegalArgumentException("Invalid task id: " + id);
        }
        return directory.resolve(id + EXTENSION);
    }

    private Object lockOf(String id) {
        return taskLocks.computeIfAbsent(id, k -> new Object());
    }
}
