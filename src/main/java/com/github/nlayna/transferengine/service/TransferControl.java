package com.github.nlayna.transferengine.service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop signal for one running transfer, checked between chunks.
 */
public class TransferControl {

    public enum Signal {
        NONE,
        PAUSE,
        CANCEL
    }

    private final AtomicReference<Signal> signal = new AtomicReference<>(Signal.NONE);

    public void requestPause() {
        signal.compareAndSet(Signal.NONE, Signal.PAUSE);
    }

    public void requestCancel() {
        signal.set(Signal.CANCEL);
    }

    /**
     * Withdraws a pause request that the transfer has not acted on yet.
     */
    public void clearPause() {
        signal.compareAndSet(Signal.PAUSE, Signal.NONE);
    }

    public Signal current() {
        return signal.get();
    }

    public boolean isStopRequested() {
        return signal.get() != Signal.NONE;
    }
}
