/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.time;

import java.time.LocalDateTime;
import java.util.List;

import dev.driftwood.FormatException;
import dev.driftwood.row.Row;

/**
 * How the timestamp of a row is spread over its columns.
 */
public enum TimeLayout {

    /**
     * One {@code Time} column in {@link TimeFormat#STANDARD} format.
     */
    ONE_COLUMN_STANDARD(List.of("Time")) {
        @Override
        public LocalDateTime parse(Row row) {
            return TimeFormat.STANDARD.parse(value(row, "Time"));
        }
    },

    /**
     * A {@code Day} column as {@code yyMMdd} plus a {@code Time} column as {@code HHmmss.fffffffff},
     * with the year taken to be in the 21st century.
     */
    TWO_COLUMN_SHORT(List.of("Day", "Time")) {
        @Override
        public LocalDateTime parse(Row row) {
            return TimeFormat.ISO.parse("20" + value(row, "Day") + "T" + value(row, "Time"));
        }
    };

    private final List<String> columns;

    TimeLayout(List<String> columns) {
        this.columns = columns;
    }

    /**
     * Columns the timestamp is read from.
     */
    public List<String> columns() {
        return columns;
    }

    /**
     * Reads the timestamp of a row.
     *
     * @throws FormatException if a timestamp column is missing or cannot be parsed
     */
    public abstract LocalDateTime parse(Row row);

    private static String value(Row row, String column) {
        String value = row.get(column);
        if (value == null) {
            throw new FormatException("Row has no '" + column + "' column: " + row);
        }
        return value;
    }
}
