/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.index;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

import dev.driftwood.ConfigurationException;

/**
 * Persistent, append-only table of record start positions for one data file.
 * <p>
 * Each entry is a fixed-width, native-order 8 byte offset; entry {@code i} lives at
 * byte {@code i * 8} of the cache file. Offsets are strictly increasing in file order.
 * </p>
 * <p>
 * When the cache is opened, a sample of its entries is compared against the arithmetic
 * progression defined by the first two entries. If every sample matches, lookups are
 * computed as {@code first + row * spacing} without touching the cache file. Otherwise
 * looked-up entries are kept in a bounded in-memory cache.
 * </p>
 * <p>
 * Instances hold an open file channel and are not thread-safe.
 * </p>
 */
public final class OffsetIndex implements AutoCloseable {

    public static final int ENTRY_WIDTH = Long.BYTES;

    private static final String SPACING_SAMPLES_PROPERTY = "driftwood.offsetIndex.spacingSamples";
    private static final int DEFAULT_SPACING_SAMPLES = 100;
    private static final int MAX_CACHED_OFFSETS = 1 << 16;

    private static final System.Logger LOG = System.getLogger(OffsetIndex.class.getName());

    private final Path path;
    private final FileChannel channel;
    private final ByteBuffer entryBuffer = ByteBuffer.allocate(ENTRY_WIDTH).order(ByteOrder.nativeOrder());
    private final Map<Long, Long> offsetCache = new LinkedHashMap<>(256, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<Long, Long> eldest) {
            return size() > MAX_CACHED_OFFSETS;
        }
    };

    private long size;
    private long lastOffset = -1;

    private boolean equalSpaced;
    private long firstOffset;
    private long spacing;

    private boolean closed;

    private OffsetIndex(Path path, FileChannel channel) {
        this.path = path;
        this.channel = channel;
    }

    /**
     * Opens the offset cache at the given path, creating an empty one if it does not exist.
     *
     * @throws ConfigurationException if the cache file cannot be opened or created
     * @throws IOException if the existing entries cannot be read
     */
    public static OffsetIndex open(Path path) throws IOException {
        FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.READ,
                    StandardOpenOption.WRITE);
        }
        catch (IOException e) {
            throw new ConfigurationException("Failed to open offset cache", path, e);
        }

        OffsetIndex index = new OffsetIndex(path, channel);
        try {
            index.load();
            return index;
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

    private void load() throws IOException {
        long bytes = channel.size();
        long partial = bytes % ENTRY_WIDTH;
        if (partial != 0) {
            LOG.log(System.Logger.Level.WARNING, "Dropping {0} trailing bytes of partial entry in offset cache ''{1}''",
                    partial, path);
            channel.truncate(bytes - partial);
            bytes -= partial;
        }

        size = bytes / ENTRY_WIDTH;
        lastOffset = size > 0 ? readEntry(size - 1) : -1;
        detectEqualSpacing(spacingSamples());

        LOG.log(System.Logger.Level.DEBUG, "Opened offset cache ''{0}'' with {1} entries (equal spacing: {2})",
                path, size, equalSpaced);
    }

    private static int spacingSamples() {
        String configured = System.getProperty(SPACING_SAMPLES_PROPERTY);
        if (configured == null) {
            return DEFAULT_SPACING_SAMPLES;
        }
        try {
            return Math.max(1, Integer.parseInt(configured.trim()));
        }
        catch (NumberFormatException e) {
            LOG.log(System.Logger.Level.WARNING, "Ignoring invalid value ''{0}'' for {1}", configured,
                    SPACING_SAMPLES_PROPERTY);
            return DEFAULT_SPACING_SAMPLES;
        }
    }

    /**
     * Samples every {@code size / segments}-th entry (and the last one) against the progression
     * set by the first two entries.
     */
    private void detectEqualSpacing(int segments) throws IOException {
        equalSpaced = false;
        if (size < 2) {
            return;
        }

        long first = readEntry(0);
        long step = readEntry(1) - first;
        if (step <= 0) {
            return;
        }

        long segmentLength = Math.max(1, size / segments);
        for (long row = 0; row < size; row += segmentLength) {
            if (readEntry(row) - first != row * step) {
                return;
            }
        }
        if (lastOffset - first != (size - 1) * step) {
            return;
        }

        firstOffset = first;
        spacing = step;
        equalSpaced = true;
    }

    public Path path() {
        return path;
    }

    public long size() {
        ensureOpen();
        return size;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns true if lookups are served by the equal-spacing fast path.
     */
    public boolean isEqualSpaced() {
        ensureOpen();
        return equalSpaced;
    }

    /**
     * Returns the byte offset of the given row.
     *
     * @throws IndexOutOfBoundsException if {@code row} is outside {@code [0, size())}
     * @throws IllegalStateException if this index has been closed
     */
    public long get(long row) throws IOException {
        ensureOpen();
        if (row < 0 || row >= size) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for offset index of size " + size);
        }
        if (equalSpaced) {
            return firstOffset + row * spacing;
        }
        if (row == size - 1) {
            return lastOffset;
        }

        Long cached = offsetCache.get(row);
        if (cached != null) {
            return cached;
        }

        LOG.log(System.Logger.Level.TRACE, "Offset cache miss for row {0} in ''{1}''", row, path);
        long offset = readEntry(row);
        offsetCache.put(row, offset);
        return offset;
    }

    /**
     * Returns the byte offset of the last row.
     *
     * @throws IndexOutOfBoundsException if the index is empty
     */
    public long back() throws IOException {
        ensureOpen();
        if (size == 0) {
            throw new IndexOutOfBoundsException("Offset index is empty: " + path);
        }
        return lastOffset;
    }

    /**
     * Appends the offset of the next row at the end of the cache file.
     *
     * @throws IllegalArgumentException if {@code offset} is not greater than the last offset
     */
    public void append(long offset) throws IOException {
        ensureOpen();
        if (offset <= lastOffset) {
            throw new IllegalArgumentException("Offsets must be strictly increasing, but " + offset
                    + " follows " + lastOffset + " in " + path);
        }

        entryBuffer.clear();
        entryBuffer.putLong(offset);
        entryBuffer.flip();
        long position = size * ENTRY_WIDTH;
        while (entryBuffer.hasRemaining()) {
            position += channel.write(entryBuffer, position);
        }

        if (equalSpaced && offset != firstOffset + size * spacing) {
            LOG.log(System.Logger.Level.DEBUG, "Offset cache ''{0}'' no longer equally spaced at row {1}", path, size);
            equalSpaced = false;
        }
        size++;
        lastOffset = offset;
    }

    /**
     * Truncates the cache file and drops all in-memory state.
     */
    public void clear() throws IOException {
        ensureOpen();
        channel.truncate(0);
        offsetCache.clear();
        size = 0;
        lastOffset = -1;
        equalSpaced = false;
    }

    /**
     * Size of the cache file in bytes.
     */
    public long byteSize() {
        return size() * ENTRY_WIDTH;
    }

    private long readEntry(long row) throws IOException {
        entryBuffer.clear();
        long position = row * ENTRY_WIDTH;
        while (entryBuffer.hasRemaining()) {
            int read = channel.read(entryBuffer, position + entryBuffer.position());
            if (read < 0) {
                throw new EOFException("Unexpected end of offset cache " + path + " reading row " + row);
            }
        }
        entryBuffer.flip();
        return entryBuffer.getLong();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Offset index is closed: " + path);
        }
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            channel.close();
        }
    }

    @Override
    public String toString() {
        return "OffsetIndex[" + path + ", " + size + " entries" + (equalSpaced ? ", spacing " + spacing : "") + "]";
    }
}
