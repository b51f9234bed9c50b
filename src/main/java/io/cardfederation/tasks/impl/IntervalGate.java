package io.cardfederation.tasks.impl;

import java.time.Duration;
import java.time.Instant;

/**
 * Remembers when a task last ran and tells whether the configured interval has passed.
 */
class IntervalGate {

    private Instant lastRun;

    synchronized boolean isDue(Instant now, Duration interval) {
        return lastRun == null || !now.isBefore(lastRun.plus(interval));
    }

    synchronized void markRun(Instant now) {
        lastRun = now;
    }
}
