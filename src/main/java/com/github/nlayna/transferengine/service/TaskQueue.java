package com.github.nlayna.transferengine.service;

import com.github.nlayna.transferengine.model.TransferTask;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Queued task ids ordered by priority tier, then scheduled time, then creation time, then
 * insertion order. Indexed by id so a single task can be repositioned in O(log n).
 * Not thread safe; the scheduler guards it.
 */
class TaskQueue {

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> -e.weight())
            .thenComparing(Entry::scheduledTime)
            .thenComparing(Entry::createdAt)
            .thenComparingLong(Entry::sequence);

    private final TreeSet<Entry> ordered = new TreeSet<>(ORDER);
    private final Map<String, Entry> index = new HashMap<>();
    private long nextSequence;

    /**
     * Inserts the task, or repositions it if already queued. A repositioned task keeps its
     * place among tasks with an identical sort key.
     */
    void offer(TransferTask task) {
        Entry previous = index.remove(task.getId());
        long sequence;
        if (previous != null) {
            ordered.remove(previous);
            sequence = previous.sequence();
        } else {
            sequence = nextSequence++;
        }
        Instant createdAt = task.getCreatedAt() != null ? task.getCreatedAt() : Instant.EPOCH;
        Instant scheduled = task.scheduledTime() != null ? task.scheduledTime() : createdAt;
        Entry entry = new Entry(task.getId(), task.getPriority().getWeight(), scheduled, createdAt, sequence);
        ordered.add(entry);
        index.put(task.getId(), entry);
    }

    boolean remove(String taskId) {
        Entry entry = index.remove(taskId);
        if (entry == null) {
            return false;
        }
        ordered.remove(entry);
        return true;
    }

    boolean contains(String taskId) {
        return index.containsKey(taskId);
    }

    /**
     * Task ids in scheduling order.
     */
    List<String> snapshot() {
        List<String> ids = new ArrayList<>(ordered.size());
        for (Entry entry : ordered) {
            ids.add(entry.taskId());
        }
        return ids;
    }

    int size() {
        return index.size();
    }

    private record Entry(String taskId, int weight, Instant scheduledTime, Instant createdAt, long sequence) {
    }
}
