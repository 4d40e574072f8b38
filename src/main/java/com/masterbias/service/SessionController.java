package com.masterbias.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared between the driver and the engine. Once cancelled it stays
 * cancelled; the engine looks at it between groups.
 */
public class SessionController {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean threadCancelled() {
        return cancelled.get();
    }

    public boolean threadRunning() {
        return !cancelled.get();
    }
}
