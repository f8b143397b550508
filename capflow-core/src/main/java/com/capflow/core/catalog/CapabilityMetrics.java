package com.capflow.core.catalog;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * 能力执行指标（进程内）
 * counter 每次执行 +1；histogram 记录执行耗时
 */
public class CapabilityMetrics {

    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, Histogram> histograms = new ConcurrentHashMap<>();

    public void increment(String name) {
        counters.computeIfAbsent(name, k -> new LongAdder()).increment();
    }

    public void record(String name, long value) {
        histograms.computeIfAbsent(name, k -> new Histogram()).record(value);
    }

    public long counter(String name) {
        LongAdder adder = counters.get(name);
        return adder != null ? adder.sum() : 0L;
    }

    public Optional<HistogramSnapshot> histogram(String name) {
        Histogram histogram = histograms.get(name);
        return histogram == null ? Optional.empty() : Optional.of(histogram.snapshot());
    }

    public void reset() {
        counters.clear();
        histograms.clear();
    }

    public record HistogramSnapshot(long count, long sum, long max) {
        public double mean() {
            return count == 0 ? 0.0 : (double) sum / count;
        }
    }

    private static final class Histogram {
        private final LongAdder count = new LongAdder();
        private final LongAdder sum = new LongAdder();
        private final LongAccumulator max = new LongAccumulator(Math::max, 0L);

        void record(long value) {
            count.increment();
            sum.add(value);
            max.accumulate(value);
        }

        HistogramSnapshot snapshot() {
            return new HistogramSnapshot(count.sum(), sum.sum(), max.get());
        }
    }
}
