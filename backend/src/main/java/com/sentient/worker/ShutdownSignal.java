package com.sentient.worker;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag checked by the worker loop between units of work.
 */
public class ShutdownSignal {

    private final AtomicBoolean triggered = new AtomicBoolean(false);

    public void trigger() {
        triggered.set(true);
    }

    public boolean isTriggered() {
        return triggered.get();
    }
}
