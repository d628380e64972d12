/* (C)2026 */
package com.ammann.weighing.sensor;

import com.ammann.weighing.math.Statistics;
import com.ammann.weighing.model.TimestampedValue;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity circular buffer of timestamped values.
 *
 * <p>Once full, each push overwrites the oldest entry. Time-window queries are relative to
 * the newest timestamp in the buffer, not to the wall clock, so a buffer that stops receiving
 * data keeps reporting the same RMS.
 *
 * <p>Not thread-safe; owned by a single {@link OrientationEstimator}.
 */
public class RingWindow {

    private final double[] values;
    private final long[] timestamps;
    private int writeIndex;
    private int count;

    public RingWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.values = new double[capacity];
        this.timestamps = new long[capacity];
    }

    public void push(double value, long timestamp) {
        values[writeIndex] = value;
        timestamps[writeIndex] = timestamp;
        writeIndex = (writeIndex + 1) % values.length;
        if (count < values.length) {
            count++;
        }
    }

    /**
     * All buffered entries, oldest first.
     */
    public List<TimestampedValue> samples() {
        List<TimestampedValue> result = new ArrayList<>(count);
        int start = count < values.length ? 0 : writeIndex;
        for (int i = 0; i < count; i++) {
            int idx = (start + i) % values.length;
            result.add(new TimestampedValue(values[idx], timestamps[idx]));
        }
        return result;
    }

    /**
     * Values whose timestamp is at least {@code newest - durationMs}, oldest first.
     */
    public double[] valuesInWindow(long durationMs) {
        if (count == 0) {
            return new double[0];
        }
        long cutoff = newestTimestamp() - durationMs;
        List<TimestampedValue> samples = samples();
        return samples.stream()
                .filter(s -> s.timestamp() >= cutoff)
                .mapToDouble(TimestampedValue::value)
                .toArray();
    }

    /**
     * RMS of {@link #valuesInWindow(long)}; 0 for an empty buffer.
     */
    public double rmsInWindow(long durationMs) {
        return Statistics.rms(valuesInWindow(durationMs));
    }

    public void clear() {
        writeIndex = 0;
        count = 0;
    }

    public int capacity() {
        return values.length;
    }

    private long newestTimestamp() {
        return timestamps[lastIndex()];
    }

    private int lastIndex() {
        return (writeIndex - 1 + values.length) % values.length;
    }
}
