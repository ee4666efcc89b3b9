/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.time;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Ordinary least squares line through (elapsed microseconds, value) points.
 * <p>
 * Elapsed time is measured from {@code reference}, which keeps the intercept close to the
 * observed values instead of at the epoch.
 * </p>
 *
 * @param reference the time at which elapsed time is zero
 * @param intercept fitted value at {@code reference}
 * @param slope fitted change of value per microsecond
 */
public record LinearFit(LocalDateTime reference, BigDecimal intercept, BigDecimal slope) {

    static final MathContext PRECISION = MathContext.DECIMAL128;

    /**
     * Fits a line through the given points.
     * <p>
     * If all points share the same time, the line is flat at the mean value.
     * </p>
     *
     * @throws IllegalArgumentException if there are no points or the lists differ in length
     */
    public static LinearFit fit(LocalDateTime reference, List<LocalDateTime> times, List<BigDecimal> values) {
        int n = times.size();
        if (n == 0 || n != values.size()) {
            throw new IllegalArgumentException("Need the same, non-zero number of times and values, got "
                    + n + " and " + values.size());
        }

        BigDecimal count = BigDecimal.valueOf(n);
        BigDecimal[] x = new BigDecimal[n];
        BigDecimal sumX = BigDecimal.ZERO;
        BigDecimal sumY = BigDecimal.ZERO;
        for (int i = 0; i < n; i++) {
            x[i] = BigDecimal.valueOf(elapsedMicros(reference, times.get(i)));
            sumX = sumX.add(x[i]);
            sumY = sumY.add(values.get(i));
        }
        BigDecimal meanX = sumX.divide(count, PRECISION);
        BigDecimal meanY = sumY.divide(count, PRECISION);

        BigDecimal sxx = BigDecimal.ZERO;
        BigDecimal sxy = BigDecimal.ZERO;
        for (int i = 0; i < n; i++) {
            BigDecimal dx = x[i].subtract(meanX, PRECISION);
            BigDecimal dy = values.get(i).subtract(meanY, PRECISION);
            sxx = sxx.add(dx.multiply(dx, PRECISION), PRECISION);
            sxy = sxy.add(dx.multiply(dy, PRECISION), PRECISION);
        }

        if (sxx.signum() == 0) {
            return new LinearFit(reference, meanY, BigDecimal.ZERO);
        }
        BigDecimal slope = sxy.divide(sxx, PRECISION);
        BigDecimal intercept = meanY.subtract(slope.multiply(meanX, PRECISION), PRECISION);
        return new LinearFit(reference, intercept, slope);
    }

    /**
     * Evaluates the line at {@code time}.
     */
    public BigDecimal valueAt(LocalDateTime time) {
        BigDecimal elapsed = BigDecimal.valueOf(elapsedMicros(reference, time));
        return intercept.add(slope.multiply(elapsed, PRECISION), PRECISION);
    }

    static long elapsedMicros(LocalDateTime from, LocalDateTime to) {
        return ChronoUnit.MICROS.between(from, to);
    }
}
