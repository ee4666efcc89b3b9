/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.time;

/**
 * The two rows bracketing a timestamp.
 * <p>
 * Inside the covered range {@code start + 1 == end}, or {@code start == end} for a single-row
 * group, and {@code time(start) <= t <= time(end)}. Before the first row {@code start} is
 * {@link #BELOW_RANGE} and {@code end} is 0; after the last row {@code start} is the last row
 * and {@code end} is {@link #ABOVE_RANGE}.
 * </p>
 *
 * @param start lower bracketing row, or {@link #BELOW_RANGE}
 * @param end upper bracketing row, or {@link #ABOVE_RANGE}
 */
public record Bounds(long start, long end) {

    public static final long BELOW_RANGE = -1;
    public static final long ABOVE_RANGE = -1;

    public static Bounds belowRange() {
        return new Bounds(BELOW_RANGE, 0);
    }

    public static Bounds aboveRange(long lastRow) {
        return new Bounds(lastRow, ABOVE_RANGE);
    }

    public boolean isBelowRange() {
        return start == BELOW_RANGE;
    }

    public boolean isAboveRange() {
        return end == ABOVE_RANGE;
    }

    public boolean isInRange() {
        return !isBelowRange() && !isAboveRange();
    }
}
