package com.turbosentinel.core.source;

import com.turbosentinel.core.error.UpstreamDataException;
import com.turbosentinel.core.model.SensorSample;
import com.turbosentinel.core.model.SensorSeries;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SeriesRepository} backed by memory, for tests and embedding.
 *
 * <p>
 * Samples are de-duplicated by timestamp (last write wins) and kept in time
 * order. Thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemorySeriesRepository implements SeriesRepository {

    private final Map<String, Map<String, TreeMap<Instant, SensorSample>>> data = new ConcurrentHashMap<>();

    /**
     * @param unit   owning unit
     * @param sample sample to store
     */
    public void add(String unit, SensorSample sample) {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(sample, "sample must not be null");
        Map<String, TreeMap<Instant, SensorSample>> tags = data.computeIfAbsent(unit, u -> new ConcurrentHashMap<>());
        TreeMap<Instant, SensorSample> samples = tags.computeIfAbsent(sample.getTag(), t -> new TreeMap<>());
        synchronized (samples) {
            samples.put(sample.getTimestamp(), sample);
        }
    }

    public void addAll(String unit, SensorSeries series) {
        series.getSamples().forEach(s -> add(unit, s));
    }

    @Override
    public SensorSeries getSeries(String tag, String unit, Instant start, Instant end) {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(unit, "unit must not be null");
        if (end.isBefore(start)) {
            throw new UpstreamDataException("Invalid interval for tag '" + tag + "': " + start + " > " + end);
        }
        TreeMap<Instant, SensorSample> samples = data.getOrDefault(unit, Map.of()).get(tag);
        if (samples == null) {
            return SensorSeries.empty(tag, unit);
        }
        synchronized (samples) {
            return new SensorSeries(tag, unit, new ArrayList<>(samples.subMap(start, true, end, true).values()));
        }
    }

    @Override
    public List<String> getAllTags(String unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        return data.getOrDefault(unit, Map.of()).keySet().stream().sorted().toList();
    }
}
