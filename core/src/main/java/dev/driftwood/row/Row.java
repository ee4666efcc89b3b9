/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.row;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dev.driftwood.FormatException;

/**
 * One data row: column values keyed by column name, in column order.
 * <p>
 * Columns without a corresponding token are absent; tokens beyond the last column are ignored.
 * </p>
 */
public final class Row {

    private final Map<String, String> values;

    private Row(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Zips tokens positionally with column names.
     *
     * @param tokens raw tokens of one line, in line order
     * @param columnNames ordered column names
     * @param collapseEmpty if true, tokens that are empty after trimming are dropped before zipping
     * @return the row; each value is the trimmed token
     */
    public static Row zip(List<String> tokens, List<String> columnNames, boolean collapseEmpty) {
        Map<String, String> values = new LinkedHashMap<>();
        int column = 0;
        for (String token : tokens) {
            if (column >= columnNames.size()) {
                break;
            }
            String value = token.strip();
            if (collapseEmpty && value.isEmpty()) {
                continue;
            }
            values.put(columnNames.get(column++), value);
        }
        return new Row(values);
    }

    /**
     * Returns the value of the given column, or null if this row has no value for it.
     */
    public String get(String column) {
        return values.get(column);
    }

    /**
     * Returns the value of the given column as a decimal number.
     *
     * @throws FormatException if the column is absent or its value is not a number
     */
    public BigDecimal getDecimal(String column) {
        String value = values.get(column);
        if (value == null) {
            throw new FormatException("Row has no value for column '" + column + "': " + values);
        }
        try {
            return new BigDecimal(value);
        }
        catch (NumberFormatException e) {
            throw new FormatException("Value '" + value + "' of column '" + column + "' is not a number", e);
        }
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    /**
     * Names of the columns present in this row, in column order.
     */
    public Set<String> columnNames() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns an unmodifiable, insertion-ordered view of this row.
     */
    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
