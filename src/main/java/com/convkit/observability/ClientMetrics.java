package com.convkit.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class ClientMetrics {

    private final MeterRegistry registry;

    public ClientMetrics() {
        this(new SimpleMeterRegistry());
    }

    public ClientMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter calls(String operation) {
        return Counter.builder("convkit.client.calls")
                .tag("operation", operation)
                .register(registry);
    }

    public Timer latency(String operation) {
        return Timer.builder("convkit.client.latency")
                .tag("operation", operation)
                .register(registry);
    }

    public Counter errors(String operation, String kind) {
        return Counter.builder("convkit.client.errors")
                .tag("operation", operation)
                .tag("kind", kind)
                .register(registry);
    }

    /** Records one finished call; {@code error} is null on success. */
    public void record(String operation, Duration elapsed, Throwable error) {
        calls(operation).increment();
        latency(operation).record(elapsed);
        if (error != null) errors(operation, error.getClass().getSimpleName()).increment();
    }
}
