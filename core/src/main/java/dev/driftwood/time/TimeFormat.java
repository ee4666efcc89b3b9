/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.time;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;

import dev.driftwood.FormatException;

/**
 * Textual timestamp formats found in data files. Fractional seconds are optional and may
 * have up to nine digits.
 */
public enum TimeFormat {

    /**
     * {@code 2024-03-01 12:30:00.250}
     */
    STANDARD(new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)),

    /**
     * {@code 20240301T123000,250}; a period is accepted as decimal separator as well.
     */
    ISO(new DateTimeFormatterBuilder()
            .appendPattern("uuuuMMdd'T'HHmmss")
            .optionalStart()
            .appendLiteral(',')
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, false)
            .optionalEnd()
            .optionalStart()
            .appendLiteral('.')
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, false)
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)),

    /**
     * {@code 2024-03-01T12:30:00.250}
     */
    ISO_EXTENDED(new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT));

    private final DateTimeFormatter formatter;

    TimeFormat(DateTimeFormatter formatter) {
        this.formatter = formatter;
    }

    /**
     * Parses a timestamp in this format.
     *
     * @throws FormatException if {@code text} is not a valid timestamp in this format
     */
    public LocalDateTime parse(String text) {
        if (text == null) {
            throw new FormatException("Missing timestamp, expected " + name() + " format");
        }
        try {
            return LocalDateTime.parse(text.strip(), formatter);
        }
        catch (DateTimeParseException e) {
            throw new FormatException("Cannot parse '" + text + "' as " + name() + " timestamp", e);
        }
    }

    public String format(LocalDateTime time) {
        return formatter.format(time);
    }
}
