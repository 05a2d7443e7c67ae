package com.medusa.util;

import com.medusa.network.protocol.CommandType;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics collector for Medusa.
 * Tracks command throughput, latency, keyspace hits and connection statistics.
 */
public class MetricsCollector {

    private final MeterRegistry registry;

    // Counters
    private final Map<CommandType, Counter> commandCounters;
    private final Counter keyspaceHits;
    private final Counter keyspaceMisses;
    private final Counter errors;
    private final Counter rejectedConnections;

    // Timers
    private final Timer commandLatency;

    // Gauges
    private final LongAdder activeConnections;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.commandCounters = new EnumMap<>(CommandType.class);
        for (CommandType type : CommandType.values()) {
            commandCounters.put(type, Counter.builder("medusa.commands")
                .tag("command", type.name().toLowerCase(Locale.ROOT))
                .description("Commands processed")
                .register(registry));
        }

        this.keyspaceHits = Counter.builder("medusa.keyspace")
            .tag("result", "hit")
            .description("GET lookups that found a value")
            .register(registry);

        this.keyspaceMisses = Counter.builder("medusa.keyspace")
            .tag("result", "miss")
            .description("GET lookups that found nothing")
            .register(registry);

        this.errors = Counter.builder("medusa.errors")
            .description("Commands answered with an error")
            .register(registry);

        this.rejectedConnections = Counter.builder("medusa.connections.rejected")
            .description("Connections refused because the limit was reached")
            .register(registry);

        this.commandLatency = Timer.builder("medusa.latency")
            .description("Command processing latency")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);

        this.activeConnections = new LongAdder();
        Gauge.builder("medusa.connections", activeConnections, LongAdder::sum)
            .description("Active connections")
            .register(registry);
    }

    // Command recording

    public void recordCommand(CommandType type, long durationNanos) {
        commandCounters.get(type).increment();
        commandLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordLookup(boolean hit) {
        if (hit) {
            keyspaceHits.increment();
        } else {
            keyspaceMisses.increment();
        }
    }

    public void recordError() {
        errors.increment();
    }

    // Connection tracking

    public void connectionOpened() {
        activeConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    public void connectionRejected() {
        rejectedConnections.increment();
    }

    // Getters for metrics values

    public long getCommandCount(CommandType type) {
        return (long) commandCounters.get(type).count();
    }

    public long getTotalCommands() {
        long total = 0;
        for (Counter counter : commandCounters.values()) {
            total += (long) counter.count();
        }
        return total;
    }

    public long getTotalErrors() {
        return (long) errors.count();
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public long getRejectedConnections() {
        return (long) rejectedConnections.count();
    }

    public double getHitRate() {
        double hits = keyspaceHits.count();
        double misses = keyspaceMisses.count();
        double total = hits + misses;
        return total > 0 ? hits / total : 0.0;
    }

    public double getMeanLatencyMs() {
        return commandLatency.mean(TimeUnit.MILLISECONDS);
    }

    /**
     * Get the underlying registry.
     *
     * @return the MeterRegistry
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "Medusa Metrics Summary%n" +
            "======================%n" +
            "Commands: %d%n" +
            "Keyspace: hits=%d, misses=%d, hitRate=%.2f%%%n" +
            "Errors: %d%n" +
            "Connections: %d active, %d rejected%n" +
            "Latency (mean): %.3fms",
            getTotalCommands(),
            (long) keyspaceHits.count(), (long) keyspaceMisses.count(), getHitRate() * 100,
            getTotalErrors(),
            getActiveConnections(), getRejectedConnections(),
            getMeanLatencyMs()
        );
    }
}
