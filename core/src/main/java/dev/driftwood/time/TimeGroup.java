/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.time;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.driftwood.ConsistencyException;
import dev.driftwood.FormatException;
import dev.driftwood.metadata.DescriptorCodec;
import dev.driftwood.metadata.GroupDescriptor;
import dev.driftwood.reader.FileGroup;
import dev.driftwood.row.Row;

/**
 * Looks up column values by timestamp across a {@link FileGroup} whose rows are ordered by time.
 * <p>
 * Rows are located by binary search over their parsed timestamps. Between two rows a value is
 * interpolated linearly; before the first or after the last row it is extrapolated from a least
 * squares line through the {@value #EXTRAPOLATION_ROWS} outermost rows. Timestamps must be
 * non-decreasing across the whole group.
 * </p>
 *
 * <pre>{@code
 * GroupDescriptor descriptor = GroupDescriptor.builder(Path.of("logs"), "offset_.*\\.csv").build();
 * try (TimeGroup group = TimeGroup.open(descriptor, TimeLayout.ONE_COLUMN_STANDARD, false)) {
 *     BigDecimal offset = group.colAtTime(LocalDateTime.parse("2024-03-01T12:00:00"), "Offset");
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe.</p>
 */
public final class TimeGroup implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(TimeGroup.class.getName());

    /**
     * Number of rows at either end of the group used for extrapolation.
     */
    public static final int EXTRAPOLATION_ROWS = 10;

    private static final int MAX_CACHED_TIMES = 1 << 16;

    private final FileGroup group;
    private final TimeLayout layout;
    private final Map<Long, LocalDateTime> timeCache = new LinkedHashMap<>(1024, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<Long, LocalDateTime> eldest) {
            return size() > MAX_CACHED_TIMES;
        }
    };
    private final ExtrapolationCache extrapolations = new ExtrapolationCache(this::fitOutermostRows);

    private TimeGroup(FileGroup group, TimeLayout layout) {
        this.group = group;
        this.layout = layout;
    }

    /**
     * Opens the underlying file group and prepares time lookups over it.
     *
     * @param forceRebuild if true, every member rebuilds its offset cache
     * @throws FormatException if the group lacks a column the time layout reads
     */
    public static TimeGroup open(GroupDescriptor descriptor, TimeLayout layout, boolean forceRebuild) throws IOException {
        FileGroup group = FileGroup.open(descriptor, forceRebuild);
        try {
            checkLayoutColumns(group, layout);
        }
        catch (FormatException e) {
            try {
                group.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
        return new TimeGroup(group, layout);
    }

    // a group without members has no column names yet, it is checked once they are known
    private static void checkLayoutColumns(FileGroup group, TimeLayout layout) {
        List<String> columnNames = group.columnNames();
        if (!columnNames.isEmpty() && !columnNames.containsAll(layout.columns())) {
            throw new FormatException("Time layout " + layout + " needs columns " + layout.columns()
                    + " but the group in " + group.descriptor().parentPath() + " has " + columnNames);
        }
    }

    public static TimeGroup open(Path descriptorPath, TimeLayout layout, boolean forceRebuild) throws IOException {
        return open(DescriptorCodec.readGroupDescriptor(descriptorPath), layout, forceRebuild);
    }

    /**
     * Updates the underlying group, discarding cached timestamps and fits if any rows changed.
     *
     * @return true if the group changed
     * @throws FormatException if the group's column names became known and lack a column the time layout reads
     */
    public boolean update(boolean forceRebuild) throws IOException {
        boolean changed = group.update(forceRebuild);
        if (changed) {
            timeCache.clear();
            extrapolations.clear();
            checkLayoutColumns(group, layout);
        }
        return changed;
    }

    /**
     * Returns the timestamp of a global row.
     *
     * @throws IndexOutOfBoundsException if {@code row} is outside {@code [0, size())}
     * @throws FormatException if the row's timestamp cannot be parsed
     */
    public LocalDateTime timeOfRow(long row) throws IOException {
        LocalDateTime time = timeCache.get(row);
        if (time == null) {
            time = layout.parse(group.getRow(row));
            timeCache.put(row, time);
        }
        return time;
    }

    public LocalDateTime startTime() throws IOException {
        return timeOfRow(0);
    }

    public LocalDateTime endTime() throws IOException {
        return timeOfRow(size() - 1);
    }

    /**
     * Finds the rows bracketing {@code time}.
     *
     * @throws IndexOutOfBoundsException if the group is empty
     * @throws ConsistencyException if the search runs into timestamps that are out of order
     */
    public Bounds bounds(LocalDateTime time) throws IOException {
        long start = 0;
        long end = size() - 1;

        LocalDateTime startTime = timeOfRow(start);
        LocalDateTime endTime = timeOfRow(end);
        if (startTime.isAfter(endTime)) {
            throw new ConsistencyException("Timestamps are not ordered: first row at " + startTime
                    + " is after last row " + end + " at " + endTime);
        }

        if (time.isBefore(startTime)) {
            return Bounds.belowRange();
        }
        if (time.isAfter(endTime)) {
            return Bounds.aboveRange(end);
        }

        while (end - start > 1) {
            long middle = (start + end) >>> 1;
            LocalDateTime middleTime = timeOfRow(middle);
            if (middleTime.isBefore(startTime) || middleTime.isAfter(endTime)) {
                throw new ConsistencyException("Timestamps are not ordered: row " + middle + " at " + middleTime
                        + " lies outside rows " + start + " to " + end + " (" + startTime + " to " + endTime + ")");
            }
            if (middleTime.isBefore(time)) {
                start = middle;
                startTime = middleTime;
            }
            else {
                end = middle;
                endTime = middleTime;
            }
        }
        return new Bounds(start, end);
    }

    /**
     * Returns the row whose timestamp is closest to {@code time}; when two rows are equally
     * close the earlier one is returned.
     */
    public long closestIndex(LocalDateTime time) throws IOException {
        Bounds bounds = bounds(time);
        if (bounds.isBelowRange()) {
            return bounds.end();
        }
        if (bounds.isAboveRange()) {
            return bounds.start();
        }
        long toStart = LinearFit.elapsedMicros(timeOfRow(bounds.start()), time);
        long toEnd = LinearFit.elapsedMicros(time, timeOfRow(bounds.end()));
        return toEnd < toStart ? bounds.end() : bounds.start();
    }

    /**
     * Estimates the value of a numeric column at {@code time}.
     *
     * @throws IndexOutOfBoundsException if the group is empty
     * @throws FormatException if a value needed for the estimate is missing or not a number
     */
    public BigDecimal colAtTime(LocalDateTime time, String column) throws IOException {
        if (time.isBefore(startTime())) {
            return extrapolations.get(column, ExtrapolationCache.Side.BELOW_RANGE).valueAt(time);
        }
        if (time.isAfter(endTime())) {
            return extrapolations.get(column, ExtrapolationCache.Side.ABOVE_RANGE).valueAt(time);
        }

        Bounds bounds = bounds(time);
        BigDecimal startValue = group.getRow(bounds.start()).getDecimal(column);
        if (bounds.start() == bounds.end()) {
            return startValue;
        }
        LocalDateTime startTime = timeOfRow(bounds.start());
        long span = LinearFit.elapsedMicros(startTime, timeOfRow(bounds.end()));
        if (span == 0) {
            return startValue;
        }
        BigDecimal endValue = group.getRow(bounds.end()).getDecimal(column);
        BigDecimal elapsed = BigDecimal.valueOf(LinearFit.elapsedMicros(startTime, time));
        return startValue.add(endValue.subtract(startValue)
                .multiply(elapsed, LinearFit.PRECISION)
                .divide(BigDecimal.valueOf(span), LinearFit.PRECISION), LinearFit.PRECISION);
    }

    private LinearFit fitOutermostRows(String column, ExtrapolationCache.Side side) throws IOException {
        long size = size();
        long from = side == ExtrapolationCache.Side.BELOW_RANGE ? 0 : Math.max(0, size - EXTRAPOLATION_ROWS);
        long to = side == ExtrapolationCache.Side.BELOW_RANGE ? Math.min(size, EXTRAPOLATION_ROWS) : size;

        List<LocalDateTime> times = new ArrayList<>();
        List<BigDecimal> values = new ArrayList<>();
        for (long row = from; row < to; row++) {
            times.add(timeOfRow(row));
            values.add(group.getRow(row).getDecimal(column));
        }
        LocalDateTime reference = side == ExtrapolationCache.Side.BELOW_RANGE ? startTime() : endTime();
        LinearFit fit = LinearFit.fit(reference, times, values);

        LOG.log(System.Logger.Level.DEBUG, "Fitted ''{0}'' {1} rows {2} to {3}: intercept {4}, slope {5}/us",
                column, side, from, to - 1, fit.intercept(), fit.slope());
        return fit;
    }

    public Row getRow(long row) throws IOException {
        return group.getRow(row);
    }

    public long size() {
        return group.size();
    }

    @Override
    public void close() throws IOException {
        timeCache.clear();
        extrapolations.clear();
        group.close();
    }

    @Override
    public String toString() {
        return group + "\nTime layout: " + layout;
    }
}
