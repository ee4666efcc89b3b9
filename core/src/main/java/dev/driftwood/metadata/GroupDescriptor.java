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
 * Durable description of a group of data files: the directory they are discovered in, the
 * regular expression their relative paths must match, the members found so far, and the line
 * splitting configuration shared by all members.
 *
 * @param parentPath directory that is searched recursively for members
 * @param filePattern regular expression matched against the full path of each file relative to {@code parentPath}
 * @param dataPaths member data files, in global row order
 * @param descriptorPath where this descriptor is persisted, {@code <parent>/group_metadata.json} by default
 * @param commentMarkers comment marker characters passed to every member
 * @param delimiter delimiter characters passed to every member
 * @param collapseDelimiters whether members drop empty tokens between adjacent delimiters
 * @param header whether members start with a header line
 * @param checkColumns whether members check the token count of every data line
 * @param columnNames column names shared by all members, empty until known
 * @param columnNamesFromHeader whether {@code columnNames} were read from the first member's header
 * @param rowCount total rows across all members, -1 if never scanned
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GroupDescriptor(
        @JsonProperty("parentPath") @JsonSerialize(using = ToStringSerializer.class) @JsonDeserialize(using = PathDeserializer.class) Path parentPath,
        @JsonProperty("dataTemplate") String filePattern,
        @JsonProperty("dataPaths") @JsonSerialize(contentUsing = ToStringSerializer.class) @JsonDeserialize(contentUsing = PathDeserializer.class) List<Path> dataPaths,
        @JsonProperty("jsonFilePath") @JsonSerialize(using = ToStringSerializer.class) @JsonDeserialize(using = PathDeserializer.class) Path descriptorPath,
        @JsonProperty("comment") String commentMarkers,
        @JsonProperty("delimiter") String delimiter,
        @JsonProperty("multi_delimiter") boolean collapseDelimiters,
        @JsonProperty("header") boolean header,
        @JsonProperty("check_lines") boolean checkColumns,
        @JsonProperty("colNames") List<String> columnNames,
        @JsonProperty("colNamesFromHeader") boolean columnNamesFromHeader,
        @JsonProperty("total_lines") long rowCount) {

    public static final String DEFAULT_DESCRIPTOR_NAME = "group_metadata.json";

    public GroupDescriptor {
        Objects.requireNonNull(parentPath, "parentPath");
        if (filePattern == null || filePattern.isEmpty()) {
            throw new IllegalArgumentException("File pattern must not be empty for group in " + parentPath);
        }
        dataPaths = dataPaths == null ? List.of() : List.copyOf(dataPaths);
        if (descriptorPath == null) {
            descriptorPath = parentPath.resolve(DEFAULT_DESCRIPTOR_NAME);
        }
        if (commentMarkers == null) {
            commentMarkers = "";
        }
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty for group in " + parentPath);
        }
        columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
    }

    /**
     * Binds a persisted group descriptor. Keys that are absent take the same defaults as
     * {@link #builder(Path, String)}.
     */
    @JsonCreator
    static GroupDescriptor fromJson(
            @JsonProperty("parentPath") @JsonDeserialize(using = PathDeserializer.class) Path parentPath,
            @JsonProperty("dataTemplate") String filePattern,
            @JsonProperty("dataPaths") @JsonDeserialize(contentUsing = PathDeserializer.class) List<Path> dataPaths,
            @JsonProperty("jsonFilePath") @JsonDeserialize(using = PathDeserializer.class) Path descriptorPath,
            @JsonProperty("comment") String commentMarkers,
            @JsonProperty("delimiter") String delimiter,
            @JsonProperty("multi_delimiter") Boolean collapseDelimiters,
            @JsonProperty("header") Boolean header,
            @JsonProperty("check_lines") Boolean checkColumns,
            @JsonProperty("colNames") List<String> columnNames,
            @JsonProperty("colNamesFromHeader") Boolean columnNamesFromHeader,
            @JsonProperty("total_lines") Long rowCount) {
        return new GroupDescriptor(parentPath, filePattern, dataPaths, descriptorPath,
                commentMarkers != null ? commentMarkers : FileDescriptor.DEFAULT_COMMENT_MARKERS,
                delimiter != null ? delimiter : FileDescriptor.DEFAULT_DELIMITER,
                collapseDelimiters != null && collapseDelimiters,
                header == null || header,
                checkColumns != null && checkColumns,
                columnNames,
                columnNamesFromHeader != null && columnNamesFromHeader,
                rowCount != null ? rowCount : -1);
    }

    /**
     * Starts a group descriptor with the default member settings: comment marker {@code #},
     * delimiter {@code ,}, header line expected, no explicit column names.
     *
     * @param parentPath directory searched recursively for members
     * @param filePattern regular expression for member paths relative to {@code parentPath}
     */
    public static Builder builder(Path parentPath, String filePattern) {
        return new Builder(parentPath, filePattern);
    }

    /**
     * Derives the configuration of a newly discovered member file. Column names are handed
     * down only when they were configured explicitly; otherwise each member reads its own
     * header so that it can be compared against the group.
     */
    public FileDescriptor memberDescriptor(Path dataPath) {
        return FileDescriptor.builder(dataPath)
                .commentMarkers(commentMarkers)
                .delimiter(delimiter)
                .collapseDelimiters(collapseDelimiters)
                .header(header)
                .checkColumns(checkColumns)
                .columnNames(columnNamesFromHeader ? List.of() : columnNames)
                .build();
    }

    public GroupDescriptor withMembers(List<Path> members, List<String> names, boolean namesFromHeader, long rows) {
        return new GroupDescriptor(parentPath, filePattern, members, descriptorPath, commentMarkers, delimiter,
                collapseDelimiters, header, checkColumns, names, namesFromHeader, rows);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("File pattern: ").append(filePattern).append('\n');
        sb.append("Files found: ").append(dataPaths.size()).append('\n');
        sb.append(parentPath).append('\n');
        for (Path dataPath : dataPaths) {
            if (dataPath.startsWith(parentPath)) {
                sb.append("$/").append(parentPath.relativize(dataPath)).append('\n');
            }
            else {
                sb.append(dataPath).append('\n');
            }
        }
        sb.append("Descriptor stored at: ").append(descriptorPath).append('\n');
        sb.append("Comment marker(s): ").append(commentMarkers).append('\n');
        sb.append("Delimiter character(s): ").append(delimiter).append('\n');
        sb.append("Collapses adjacent delimiters: ").append(collapseDelimiters).append('\n');
        sb.append("Header expected: ").append(header).append('\n');
        sb.append("Column names: ").append(String.join(" ", columnNames)).append('\n');
        sb.append("Rows: ").append(rowCount);
        return sb.toString();
    }

    /**
     * Fluent construction of {@link GroupDescriptor} instances.
     */
    public static final class Builder {

        private final Path parentPath;
        private final String filePattern;
        private Path descriptorPath;
        private String commentMarkers = FileDescriptor.DEFAULT_COMMENT_MARKERS;
        private String delimiter = FileDescriptor.DEFAULT_DELIMITER;
        private boolean collapseDelimiters;
        private boolean header = true;
        private boolean checkColumns;
        private List<String> columnNames = List.of();

        private Builder(Path parentPath, String filePattern) {
            this.parentPath = Objects.requireNonNull(parentPath, "parentPath");
            this.filePattern = filePattern;
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

        public GroupDescriptor build() {
            return new GroupDescriptor(parentPath, filePattern, List.of(), descriptorPath, commentMarkers,
                    delimiter, collapseDelimiters, header, checkColumns, columnNames, false, -1);
        }
    }
}
