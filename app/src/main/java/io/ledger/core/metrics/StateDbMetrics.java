package io.ledger.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public final class StateDbMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter savepointsRecorded = Counter.builder("statedb.savepoints.recorded")
            .description("Savepoints made durable")
            .register(registry);
    private static final Counter fenceFailures = Counter.builder("statedb.fence.failures")
            .description("Full-commit barriers that failed")
            .register(registry);
    private static final Timer applyTime = Timer.builder("statedb.apply.time")
            .description("Duration of applyUpdates including both barriers")
            .register(registry);

    private StateDbMetrics() {}

    public static void recordApply(Runnable applyLogic) {
        applyTime.record(applyLogic);
    }

    /** {@code kind} is "json" or "binary". */
    public static void incrementDocsWritten(String kind) {
        Counter.builder("statedb.docs.written")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public static void incrementSavepoints() {
        savepointsRecorded.increment();
    }

    public static void incrementFenceFailures() {
        fenceFailures.increment();
    }

    /** {@code type} is "range" or "query". */
    public static void recordResultSize(String type, int size) {
        DistributionSummary.builder("statedb.results.size")
                .baseUnit("documents")
                .tag("type", type)
                .register(registry)
                .record(size);
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                m.getId().getTags().forEach(t -> sb.append(',').append(t.getKey()).append('=').append(t.getValue()));
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
