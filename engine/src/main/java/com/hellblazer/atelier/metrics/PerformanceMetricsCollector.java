/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Atelier.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.atelier.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Sliding windows of performance samples keyed by "{type}-{culture}". Each window keeps the most recent samples,
 * dropping the oldest when full. Samples over budget are logged.
 *
 * @author hal.hildebrand
 */
public final class PerformanceMetricsCollector {
    public static final int DEFAULT_WINDOW = 100;

    private static final Logger log = LoggerFactory.getLogger(PerformanceMetricsCollector.class);

    private final Map<String, Deque<PerformanceSample>> windows = new HashMap<>();
    private final ReentrantReadWriteLock               lock    = new ReentrantReadWriteLock();
    private final int                                  window;
    private final PerformanceThresholds                thresholds;

    public PerformanceMetricsCollector() {
        this(DEFAULT_WINDOW, PerformanceThresholds.DEFAULT);
    }

    public PerformanceMetricsCollector(int window, PerformanceThresholds thresholds) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.window = window;
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds cannot be null");
    }

    public static String keyOf(String type, String culture) {
        return type + "-" + culture;
    }

    /**
     * Append a sample to its window
     *
     * @return the status of the sample against the thresholds
     */
    public PerformanceStatus record(String type, String culture, PerformanceSample sample) {
        Objects.requireNonNull(sample, "sample cannot be null");
        var key = keyOf(type, culture);
        lock.writeLock().lock();
        try {
            var samples = windows.computeIfAbsent(key, k -> new ArrayDeque<>(window));
            if (samples.size() == window) {
                samples.removeFirst();
            }
            samples.addLast(sample);
        } finally {
            lock.writeLock().unlock();
        }
        var status = thresholds.status(sample);
        switch (status) {
            case CRITICAL -> log.warn("{} over budget: {} ms, {} polygons, {} bytes", key, sample.generationTimeMs(),
                                      sample.polygonCount(), sample.memoryBytes());
            case WARNING -> log.warn("{} near budget: {} ms, {} polygons, {} bytes", key, sample.generationTimeMs(),
                                     sample.polygonCount(), sample.memoryBytes());
            default -> log.trace("{}: {} ms, {} polygons", key, sample.generationTimeMs(), sample.polygonCount());
        }
        return status;
    }

    /**
     * @return per key summaries, sorted by key
     */
    public Map<String, Summary> report() {
        lock.readLock().lock();
        try {
            var report = new TreeMap<String, Summary>();
            windows.forEach((key, samples) -> report.put(key, Summary.of(samples)));
            return report;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Summary across every window
     */
    public Summary overall() {
        lock.readLock().lock();
        try {
            return Summary.of(windows.values().stream().flatMap(Collection::stream).toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the window for a key, oldest first
     */
    public List<PerformanceSample> samples(String type, String culture) {
        lock.readLock().lock();
        try {
            var samples = windows.get(keyOf(type, culture));
            return samples == null ? List.of() : List.copyOf(samples);
        } finally {
            lock.readLock().unlock();
        }
    }

    public PerformanceThresholds thresholds() {
        return thresholds;
    }

    public int window() {
        return window;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            windows.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public record Summary(int count, double meanGenerationTime, double meanPolygonCount, double meanMemoryUsage,
                          double peakGenerationTime) {
        public static final Summary EMPTY = new Summary(0, 0, 0, 0, 0);

        static Summary of(Collection<PerformanceSample> samples) {
            if (samples.isEmpty()) {
                return EMPTY;
            }
            double time = 0;
            double polygons = 0;
            double memory = 0;
            double peak = 0;
            for (var sample : samples) {
                time += sample.generationTimeMs();
                polygons += sample.polygonCount();
                memory += sample.memoryBytes();
                peak = Math.max(peak, sample.generationTimeMs());
            }
            int n = samples.size();
            return new Summary(n, time / n, polygons / n, memory / n, peak);
        }

        public String format() {
            return String.format("%d samples, %.2f ms avg (%.2f ms peak), %.0f polygons avg, %.0f bytes avg", count,
                                 meanGenerationTime, peakGenerationTime, meanPolygonCount, meanMemoryUsage);
        }
    }
}
