package com.helios.surveillance.metrics.impl.inmemory;


import com.helios.surveillance.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

final class InMemoryCounter implements Counter {
    private final LongAdder value = new LongAdder();
    private final String key;

    InMemoryCounter(String key) {
        this.key = key;
    }

    @Override
    public void increment() {
        increment(1);
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
        }
        value.add(amount);
    }

    @Override
    public long count() {
        return value.sum();
    }

    @Override
    public String toString() {
        return String.format("InMemoryCounter{key='%s', value=%d}", key, count());
    }
}
