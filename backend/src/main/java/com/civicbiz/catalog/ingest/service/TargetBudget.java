package com.civicbiz.catalog.ingest.service;

import java.util.concurrent.atomic.AtomicInteger;

/** Run-wide cap on accepted records, shared by every state worker. */
public final class TargetBudget {
    private final Integer limit;
    private final AtomicInteger reserved = new AtomicInteger();

    private TargetBudget(Integer limit) {
        this.limit = limit;
    }

    public static TargetBudget unlimited() {
        return new TargetBudget(null);
    }

    public static TargetBudget capped(int limit) {
        return new TargetBudget(Math.max(0, limit));
    }

    public boolean tryReserve() {
        if (limit == null) {
            reserved.incrementAndGet();
            return true;
        }
        while (true) {
            int current = reserved.get();
            if (current >= limit) {
                return false;
            }
            if (reserved.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void release() {
        reserved.updateAndGet(current -> Math.max(0, current - 1));
    }

    public boolean isExhausted() {
        return limit != null && reserved.get() >= limit;
    }

    public int reserved() {
        return reserved.get();
    }

    public Integer limit() {
        return limit;
    }
}
