package com.github.nlayna.transferengine.service;

import com.github.nlayna.transferengine.model.TransferProgress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans progress tuples out to subscribers. Listeners run on the publishing thread and must not block.
 */
@Slf4j
@Component
public class TransferEventPublisher {

    private final CopyOnWriteArrayList<Consumer<TransferProgress>> listeners = new CopyOnWriteArrayList<>();

    public Subscription subscribe(Consumer<TransferProgress> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(TransferProgress progress) {
        for (Consumer<TransferProgress> listener : listeners) {
            try {
                listener.accept(progress);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for task {}: {}", progress.taskId(), e.getMessage());
            }
        }
    }

    public int getSubscriberCount() {
        return listeners.size();
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
