package com.example.cusplitter.application.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for one dispatch batch. Workers check it before every send; a send
 * already talking to the transport is never interrupted.
 */
public final class DispatchCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
