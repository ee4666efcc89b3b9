/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.metadata;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

/**
 * Durable description of one indexed data file: where the data, offset cache and descriptor
 * live, how lines are split, and the derived column names and row count.
 *
 * <p>Persisted as JSON next to the data file ({@code <data>.json} unless configured otherwise):</p>
 * <pre>{@code
 * {"dataFilePath":"data/run_01.csv","cacheFilePath":"data/run_01.csv.cache",
 *  "jsonFilePath":"data/run_01.csv.json","comment":"#","delimiter":",",
 *  "multi_delimiter":false,"header":true,"check_lines":false,
 *  "col_names":["Time","Value"],"col_names_from_header":true,"total_lines":1000,"cache_size":8000}
 * }</pre>
 *
 * @param dataPath the delimited text file
 * @param cachePath the binary offset cache, {@code <data>.cache} by default
 * @param descriptorPath where this descriptor is persisted, {@code <data>.json} by default
 * @param commentMarkers lines whose first non-blank character is one of these are skipped
 * @param delimiter the set of delimiter characters
 * @param collapseDelimiters if true, empty tokens produced by adjacent delimiters are dropped
 * @param header if true, the first accepted line holds the column names
 * @param checkColumns if true, every data line must have exactly one token per column
 * @param columnNames ordered column names, empty until known
 * @param columnNamesFromHeader true if the column names were read from the header line rather than configured
 * @param rowCount number of indexed data rows, -1 if never scanned
 * @param cacheSize size of the offset cache in bytes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileDescriptor(
        @JsonProperty("dataFilePath") @JsonSerialize(using = ToStringSerializer.class) @JsonDeserialize(using = PathDeserializer.class) Path dataPath,
        @JsonProperty("cacheFilePath") @JsonSerialize(using = ToStringSerializer.class) @JsonDeserialize(using = PathDeserializer.class) Path cachePath,
        @JsonProperty("jsonFilePath") @JsonSerialize(using = ToStringSerializer.class) @JsonDeserialize(using = PathDeserializer.class) Path descriptorPath,
        @JsonProperty("comment") String commentMarkers,
        @JsonProperty("delimiter") String delimiter,
        @JsonProperty("multi_delimiter") boolean collapseDelimiters,
        @JsonProperty("header") boolean header,
        @JsonProperty("check_lines") boolean checkColumns,
        @JsonProperty("col_names") List<String> columnNames,
        @JsonProperty("col_names_from_header") boolean columnNamesFromHeader,
        @JsonProperty("total_lines") long rowCount,
        @JsonProperty("cache_size") long cacheSize) {

    public static final String DEFAULT_COMMENT_MARKERS = "#";
    public static final String DEFAULT_DELIMITER = ",";
    public static final String CACHE_SUFFIX = ".cache";
    public static final String DESCRIPTOR_SUFFIX = ".json";

    public FileDescriptor {
        Objects.requireNonNull(dataPath, "dataPath");
        if (cachePath == null) {
            cachePath = siblingWithSuffix(dataPath, CACHE_SUFFIX);
        }
        if (descriptorPath == null) {
            descriptorPath = siblingWithSuffix(dataPath, DESCRIPTOR_SUFFIX);
        }
        if (commentMarkers == null) {
            commentMarkers = "";
        }
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty for " + dataPath);
        }
        columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
    }

    /**
     * Binds a persisted descriptor. Keys that are absent take the same defaults as {@link #builder(Path)}.
     */
    @JsonCreator
    static FileDescriptor fromJson(
            @JsonProperty("dataFilePath") @JsonDeserialize(using = PathDeserializer.class) Path dataPath,
            @JsonProperty("cacheFilePath") @JsonDeserialize(using = PathDeserializer.class) Path cachePath,
            @JsonProperty("jsonFilePath") @JsonDeserialize(using = PathDeserializer.class) Path descriptorPath,
            @JsonProperty("comment") String commentMarkers,
            @JsonProperty("delimiter") String delimiter,
            @JsonProperty("multi_delimiter") Boolean collapseDelimiters,
            @JsonProperty("header") Boolean header,
            @JsonProperty("check_lines") Boolean checkColumns,
            @JsonProperty("col_names") List<String> columnNames,
            @JsonProperty("col_names_from_header") Boolean columnNamesFromHeader,
            @JsonProperty("total_lines") Long rowCount,
            @JsonProperty("cache_size") Long cacheSize) {
        return new FileDescriptor(dataPath, cachePath, descriptorPath,
                commentMarkers != null ? commentMarkers : DEFAULT_COMMENT_MARKERS,
                delimiter != null ? delimiter : DEFAULT_DELIMITER,
                collapseDelimiters != null && collapseDelimiters,
                header == null || header,
                checkColumns != null && checkColumns,
                columnNames,
                columnNamesFromHeader != null && columnNamesFromHeader,
                rowCount != null ? rowCount : -1,
                cacheSize != null ? cacheSize : 0);
    }

    /**
     * Starts a descriptor for the given data file with the default settings: comment marker
     * {@code #}, delimiter {@code ,}, header line expected, no explicit column names.
     */
    public static Builder builder(Path dataPath) {
        return new Builder(dataPath);
    }

    public FileDescriptor withColumnNames(List<String> names, boolean fromHeader) {
        return new FileDescriptor(dataPath, cachePath, descriptorPath, commentMarkers, delimiter,
                collapseDelimiters, header, checkColumns, names, fromHeader, rowCount, cacheSize);
    }

    public FileDescriptor withRowCount(long rows, long cacheBytes) {
        return new FileDescriptor(dataPath, cachePath, descriptorPath, commentMarkers, delimiter,
                collapseDelimiters, header, checkColumns, columnNames, columnNamesFromHeader, rows, cacheBytes);
    }

    /**
     * Returns true if {@code c} starts a comment line.
     */
    public boolean isCommentMarker(char c) {
        return commentMarkers.indexOf(c) >= 0;
    }

    static Path siblingWithSuffix(Path path, String suffix) {
        return path.resolveSibling(path.getFileName().toString() + suffix);
    }

    @Override
    public String toString() {
        return "Metadata for data file '" + dataPath + "'\n"
                + "Offset cache stored at: '" + cachePath + "'\n"
                + "Descriptor stored at: '" + descriptorPath + "'\n"
                + "Comment marker(s): '" + commentMarkers + "'\n"
                + "Delimiter character(s): '" + delimiter + "'\n"
                + "Collapses adjacent delimiters: " + collapseDelimiters + "\n"
                + "Header expected: " + header + "\n"
                + "Column count checked: " + checkColumns + "\n"
                + "Column names: " + String.join(", ", columnNames) + (columnNamesFromHeader ? " (from header)" : "") + "\n"
                + "Rows: " + rowCount + "\n"
                + "Offset cache size: " + cacheSize + " bytes";
    }

    /**
     * Fluent construction of {@link FileDescriptor} instances.
     */
    public static final class Builder {

        private final Path dataPath;
        private Path cachePath;
        private Path descriptorPath;
        private String commentMarkers = DEFAULT_COMMENT_MARKERS;
        private String delimiter = DEFAULT_DELIMITER;
        private boolean collapseDelimiters;
        private boolean header = true;
        private boolean checkColumns;
        private List<String> columnNames = List.of();

        private Builder(Path dataPath) {
            this.dataPath = Objects.requireNonNull(dataPath, "dataPath");
        }

        public Builder cachePath(Path cachePath) {
            this.cachePath = cachePath;
            return this;
        }

        public Builder descriptorPath(Path descriptorPath) {
            this.descriptorPath = descriptorPath;
            return this;
        }

        public Builder commentMarkers(String commentMarkers) {
            this.commentMarkers = commentMarkers;
            return this;
        }

        public Builder delimiter(String delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder collapseDelimiters(boolean collapseDelimiters) {
            this.collapseDelimiters = collapseDelimiters;
            return this;
        }

        public Builder header(boolean header) {
            this.header = header;
            return this;
        }

        public Builder checkColumns(boolean checkColumns) {
            this.checkColumns = checkColumns;
            return this;
        }

        public Builder columnNames(List<String> columnNames) {
            this.columnNames = columnNames;
            return this;
        }

        public Builder columnNames(String... columnNames) {
            return columnNames(Arrays.asList(columnNames));
        }

        public FileDescriptor build() {
            return new FileDescriptor(dataPath, cachePath, descriptorPath, commentMarkers, delimiter,
                    collapseDelimiters, header, checkColumns, columnNames, false, -1, 0);
        }
    }
}
