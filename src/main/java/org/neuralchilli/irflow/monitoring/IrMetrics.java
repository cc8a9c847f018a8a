package org.neuralchilli.irflow.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters fed by the event stream and by operation timers.
 */
@ApplicationScoped
public class IrMetrics {

    private static final Logger log = LoggerFactory.getLogger(IrMetrics.class);

    private final Map<IrEventType, LongAdder> eventCounts = new EnumMap<>(IrEventType.class);
    private final Map<IrEventType, LongAdder> eventImpact = new EnumMap<>(IrEventType.class);

    private final Map<String, TimingStats> timingStats = new ConcurrentHashMap<>();

    public IrMetrics() {
        for (IrEventType type : IrEventType.values()) {
            eventCounts.put(type, new LongAdder());
            eventImpact.put(type, new LongAdder());
        }
    }

    public void record(IrEvent event) {
        eventCounts.get(event.type()).increment();
        eventImpact.get(event.type()).add(event.impact());
    }

    public long count(IrEventType type) {
        return eventCounts.get(type).sum();
    }

    /**
     * Sum of the impact reported by all events of a type, e.g. total nodes removed by dead code elimination.
     */
    public long totalImpact(IrEventType type) {
        return eventImpact.get(type).sum();
    }

    /**
     * Percentage of compilations that succeeded.
     */
    public double compilationSuccessRate() {
        long compiled = count(IrEventType.WORKFLOW_COMPILED);
        long failed = count(IrEventType.COMPILATION_ERROR);
        long total = compiled + failed;
        return total > 0 ? (compiled * 100.0) / total : 0.0;
    }

    /**
     * Start timing an operation.
     */
    public Timer startTimer(String operation) {
        return new Timer(operation, Instant.now());
    }

    public class Timer {
        private final String operation;
        private final Instant start;

        private Timer(String operation, Instant start) {
            this.operation = operation;
            this.start = start;
        }

        public void stop() {
            recordTiming(operation, Duration.between(start, Instant.now()));
        }
    }

    private void recordTiming(String operation, Duration duration) {
        timingStats.computeIfAbsent(operation, key -> new TimingStats()).record(duration);
    }

    public TimingStats timingStats(String operation) {
        return timingStats.get(operation);
    }

    public void logSummary() {
        log.info("IR metrics: compiled={}, compilationErrors={}, optimized={}, generated={}, successRate={}%",
                count(IrEventType.WORKFLOW_COMPILED),
                count(IrEventType.COMPILATION_ERROR),
                count(IrEventType.PROGRAM_OPTIMIZED),
                count(IrEventType.CODE_GENERATED),
                String.format("%.1f", compilationSuccessRate()));

        timingStats.forEach((operation, stats) ->
                log.info("  {}: count={}, avg={}ms, max={}ms",
                        operation, stats.count(), stats.averageMillis(), stats.maxMillis()));
    }

    public void reset() {
        eventCounts.values().forEach(LongAdder::reset);
        eventImpact.values().forEach(LongAdder::reset);
        timingStats.clear();
    }

    /**
     * Timing statistics for one operation.
     */
    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong maxNanos = new AtomicLong();

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            maxNanos.accumulateAndGet(nanos, Math::max);
        }

        public long count() {
            return count.sum();
        }

        public double averageMillis() {
            long n = count.sum();
            return n > 0 ? totalNanos.sum() / (n * 1_000_000.0) : 0.0;
        }

        public double maxMillis() {
            return maxNanos.get() / 1_000_000.0;
        }
    }
}
