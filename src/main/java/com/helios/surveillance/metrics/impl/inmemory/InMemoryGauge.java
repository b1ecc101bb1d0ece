package com.helios.surveillance.metrics.impl.inmemory;


import com.helios.surveillance.metrics.Gauge;

import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link Gauge} for testing.
 * Thread-safe implementation using AtomicReference.
 */
final class InMemoryGauge implements Gauge {

    private final String key;
    private final AtomicReference<Double> value;

    InMemoryGauge(String key) {
        this.key = key;
        this.value = new AtomicReference<>(0.0);
    }

    @Override
    public void set(double newValue) {
        value.set(newValue);
    }

    @Override
    public double value() {
        return value.get();
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{key='%s', value=%.2f}", key, value());
    }
}
