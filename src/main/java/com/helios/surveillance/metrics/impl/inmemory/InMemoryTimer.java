package com.helios.surveillance.metrics.impl.inmemory;

import com.helios.surveillance.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link Timer} for testing.
 * Stores all recorded durations for assertions and percentile calculations.
 */
final class InMemoryTimer implements Timer {

    private final String key;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String key) {
        this.key = key;
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        long startNanos = System.nanoTime();
        try {
            return callable.call();
        } finally {
            recordings.add(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    @Override
    public Duration percentile(double percentile) {
        if (recordings.isEmpty()) {
            return Duration.ZERO;
        }
        double p = Math.max(0.0, Math.min(1.0, percentile));
        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);

        double index = (sorted.size() - 1) * p;
        int lowerIndex = (int) Math.floor(index);
        int upperIndex = (int) Math.ceil(index);
        if (lowerIndex == upperIndex) {
            return sorted.get(lowerIndex);
        }

        Duration lower = sorted.get(lowerIndex);
        Duration upper = sorted.get(upperIndex);
        double fraction = index - lowerIndex;
        return Duration.ofNanos(lower.toNanos() + (long) ((upper.toNanos() - lower.toNanos()) * fraction));
    }

    @Override
    public long count() {
        return recordings.size();
    }

    List<Duration> getRecordings() {
        return Collections.unmodifiableList(new ArrayList<>(recordings));
    }

    @Override
    public String toString() {
        return String.format("InMemoryTimer{key='%s', count=%d, p99=%s}", key, count(), percentile(0.99));
    }
}
