/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import dev.driftwood.ConfigurationException;
import dev.driftwood.ConsistencyException;
import dev.driftwood.index.OffsetIndex;
import dev.driftwood.internal.reader.FileScanEvent;
import dev.driftwood.internal.reader.LineReader;
import dev.driftwood.internal.reader.LineScanner;
import dev.driftwood.internal.text.EscapedListTokenizer;
import dev.driftwood.metadata.DescriptorCodec;
import dev.driftwood.metadata.FileDescriptor;
import dev.driftwood.row.Row;

/**
 * Random access to the rows of one delimited text file.
 * <p>
 * The byte offset of every data line is kept in an {@link OffsetIndex}, so a row is read
 * with a single positioned read and the file is never loaded into memory. Blank lines and
 * lines starting with a comment marker are not rows. {@link #update(boolean)} indexes lines
 * appended since the previous scan, resuming at the last indexed line.
 * </p>
 *
 * <pre>{@code
 * FileDescriptor descriptor = FileDescriptor.builder(Path.of("data/run_01.csv")).build();
 * try (IndexedFile file = IndexedFile.open(descriptor)) {
 *     Row first = file.getRow(0);
 *     String value = first.get("Value");
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe.</p>
 */
public final class IndexedFile implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(IndexedFile.class.getName());

    private final FileChannel dataChannel;
    private final LineReader lineReader;
    private final OffsetIndex offsets;
    private final EscapedListTokenizer tokenizer;

    private FileDescriptor descriptor;
    private boolean closed;

    private IndexedFile(FileDescriptor descriptor, FileChannel dataChannel, OffsetIndex offsets) {
        this.descriptor = descriptor;
        this.dataChannel = dataChannel;
        this.lineReader = new LineReader(descriptor.dataPath(), dataChannel);
        this.offsets = offsets;
        this.tokenizer = new EscapedListTokenizer(descriptor.delimiter());
    }

    /**
     * Opens a data file, loading its offset cache and indexing any lines not yet cached.
     *
     * @throws ConfigurationException if the data file or offset cache cannot be opened
     */
    public static IndexedFile open(FileDescriptor descriptor) throws IOException {
        return open(descriptor, false);
    }

    /**
     * Opens a data file, loading its offset cache and indexing any lines not yet cached.
     *
     * @param forceRebuild if true, the offset cache is discarded and the whole file is scanned
     * @throws ConfigurationException if the data file or offset cache cannot be opened
     */
    public static IndexedFile open(FileDescriptor descriptor, boolean forceRebuild) throws IOException {
        IndexedFile file = openWithoutScan(descriptor);
        try {
            file.validateCache();
            file.update(forceRebuild);
            return file;
        }
        catch (Exception e) {
            try {
                file.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    /**
     * Opens a data file described by a previously persisted descriptor.
     *
     * @param descriptorPath path of the JSON descriptor
     * @param forceRebuild if true, the offset cache is discarded and the whole file is scanned
     */
    public static IndexedFile open(Path descriptorPath, boolean forceRebuild) throws IOException {
        return open(DescriptorCodec.readFileDescriptor(descriptorPath), forceRebuild);
    }

    private static IndexedFile openWithoutScan(FileDescriptor descriptor) throws IOException {
        Path dataPath = descriptor.dataPath();
        FileChannel channel;
        try {
            channel = FileChannel.open(dataPath, StandardOpenOption.READ);
        }
        catch (NoSuchFileException e) {
            throw new ConfigurationException("Data file does not exist", dataPath, e);
        }
        catch (AccessDeniedException e) {
            throw new ConfigurationException("Data file is not readable", dataPath, e);
        }
        catch (IOException e) {
            throw new ConfigurationException("Failed to open data file", dataPath, e);
        }

        try {
            return new IndexedFile(descriptor, channel, OffsetIndex.open(descriptor.cachePath()));
        }
        catch (Exception e) {
            try {
                channel.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    /**
     * Opens new handles on the same data and cache files, without rescanning.
     * <p>
     * The returned instance starts from the persisted offsets and this instance's descriptor.
     * Only one of the two should be updated, since both append to the same cache file.
     * </p>
     */
    public IndexedFile reopen() throws IOException {
        ensureOpen();
        return openWithoutScan(descriptor);
    }

    /**
     * Drops the cache if its last entry points past the end of the data file, which means
     * the data file was replaced or truncated since the cache was written.
     */
    private void validateCache() throws IOException {
        if (!offsets.isEmpty() && offsets.back() >= dataChannel.size()) {
            LOG.log(System.Logger.Level.WARNING,
                    "Offset cache ''{0}'' points past the end of ''{1}'' ({2} >= {3} bytes), rebuilding",
                    offsets.path(), descriptor.dataPath(), offsets.back(), dataChannel.size());
            offsets.clear();
        }
    }

    /**
     * Indexes lines appended to the data file since the last scan.
     *
     * @param forceRebuild if true, the offset index and any header-derived column names are
     *        discarded and the whole file is scanned again
     * @return true if data rows were added or the column names became known
     * @throws ConsistencyException if a forced rebuild reads different header column names,
     *         or column checking is enabled and a line has the wrong number of tokens
     */
    public boolean update(boolean forceRebuild) throws IOException {
        ensureOpen();

        List<String> previousNames = descriptor.columnNames();
        List<String> names = previousNames;
        boolean namesFromHeader = descriptor.columnNamesFromHeader();

        if (forceRebuild) {
            offsets.clear();
            if (namesFromHeader) {
                names = List.of();
            }
        }

        if (descriptor.header() && names.isEmpty() && !offsets.isEmpty()) {
            names = recoverHeaderNames();
            namesFromHeader = true;
        }

        boolean expectingHeader = descriptor.header() && offsets.isEmpty();
        long startOffset = offsets.isEmpty() ? 0 : offsets.back();

        FileScanEvent event = new FileScanEvent();
        event.begin();

        LineScanner scanner = new LineScanner(dataChannel, startOffset);
        if (offsets.isEmpty()) {
            scanner.skipByteOrderMark();
        }
        else {
            // the last indexed line is already known, continue after it
            scanner.next();
        }

        boolean headerFound = false;
        long rowsAdded = 0;
        while (scanner.next()) {
            String line = scanner.line().strip();
            if (line.isEmpty() || descriptor.isCommentMarker(line.charAt(0))) {
                continue;
            }

            if (expectingHeader) {
                expectingHeader = false;
                headerFound = true;
                if (names.isEmpty()) {
                    names = headerNames(line);
                    namesFromHeader = true;
                }
                continue;
            }

            if (descriptor.checkColumns()) {
                checkColumnCount(line, names, offsets.size());
            }
            offsets.append(scanner.lineStart());
            rowsAdded++;
        }

        event.path = descriptor.dataPath().toString();
        event.startOffset = startOffset;
        event.bytesScanned = scanner.bytesRead();
        event.rowsAdded = rowsAdded;
        event.headerFound = headerFound;
        event.commit();

        if (names.isEmpty() && forceRebuild) {
            names = previousNames;
        }
        else if (!previousNames.isEmpty() && !names.equals(previousNames)) {
            throw new ConsistencyException("Column names of " + descriptor.dataPath() + " changed from "
                    + previousNames + " to " + names);
        }

        FileDescriptor updated = descriptor
                .withColumnNames(names, namesFromHeader)
                .withRowCount(offsets.size(), offsets.byteSize());
        if (!updated.equals(descriptor) || !Files.exists(updated.descriptorPath())) {
            DescriptorCodec.write(updated);
        }
        descriptor = updated;

        LOG.log(System.Logger.Level.DEBUG, "Scanned ''{0}'' from offset {1}: {2} new rows, {3} total",
                descriptor.dataPath(), startOffset, rowsAdded, offsets.size());

        return rowsAdded > 0 || !names.equals(previousNames);
    }

    /**
     * Reads the column names from the first accepted line of the file.
     */
    private List<String> recoverHeaderNames() throws IOException {
        LineScanner scanner = new LineScanner(dataChannel, 0);
        scanner.skipByteOrderMark();
        while (scanner.next()) {
            String line = scanner.line().strip();
            if (!line.isEmpty() && !descriptor.isCommentMarker(line.charAt(0))) {
                LOG.log(System.Logger.Level.DEBUG, "Recovered header of ''{0}''", descriptor.dataPath());
                return headerNames(line);
            }
        }
        return List.of();
    }

    private List<String> headerNames(String line) {
        List<String> names = new ArrayList<>();
        for (String token : tokenizer.tokenize(line)) {
            String name = token.strip();
            if (descriptor.collapseDelimiters() && name.isEmpty()) {
                continue;
            }
            names.add(name);
        }
        return names;
    }

    private void checkColumnCount(String line, List<String> names, long row) {
        if (names.isEmpty()) {
            throw new ConsistencyException("Column names of " + descriptor.dataPath()
                    + " are unknown, cannot check the column count of row " + row);
        }
        int count = 0;
        for (String token : tokenizer.tokenize(line)) {
            if (!descriptor.collapseDelimiters() || !token.isBlank()) {
                count++;
            }
        }
        if (count != names.size()) {
            throw new ConsistencyException("Row " + row + " of " + descriptor.dataPath() + " has " + count
                    + " columns, expected " + names.size());
        }
    }

    /**
     * Reads the raw text of a row, without line terminator.
     *
     * @throws IndexOutOfBoundsException if {@code row} is outside {@code [0, size())}
     */
    public String getRawLine(long row) throws IOException {
        ensureOpen();
        long size = offsets.size();
        if (row < 0 || row >= size) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for " + descriptor.dataPath()
                    + " with " + size + " rows");
        }
        return lineReader.readLine(offsets.get(row));
    }

    /**
     * Reads a row and maps its values to the column names.
     *
     * @throws IndexOutOfBoundsException if {@code row} is outside {@code [0, size())}
     */
    public Row getRow(long row) throws IOException {
        return Row.zip(tokenizer.tokenize(getRawLine(row)), descriptor.columnNames(),
                descriptor.collapseDelimiters());
    }

    /**
     * Number of indexed data rows.
     */
    public long size() {
        ensureOpen();
        return offsets.size();
    }

    public List<String> columnNames() {
        return descriptor.columnNames();
    }

    public Path path() {
        return descriptor.dataPath();
    }

    public FileDescriptor descriptor() {
        return descriptor;
    }

    OffsetIndex offsetIndex() {
        return offsets;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Indexed file is closed: " + descriptor.dataPath());
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            offsets.close();
        }
        finally {
            dataChannel.close();
        }
    }

    @Override
    public String toString() {
        return descriptor + "\n" + offsets;
    }
}
