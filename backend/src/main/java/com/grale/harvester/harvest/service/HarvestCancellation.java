package com.grale.harvester.harvest.service;

import java.util.concurrent.atomic.AtomicBoolean;

public class HarvestCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static HarvestCancellation none() {
        return new HarvestCancellation();
    }

    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
