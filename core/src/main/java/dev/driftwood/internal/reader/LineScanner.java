/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.reader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Sequential, buffered reader of {@code \n}-terminated lines that reports the byte offset
 * at which every line starts.
 * <p>
 * Reads use absolute channel positions, so the channel's own position is never consulted
 * or modified. A final line without terminator is returned as well.
 * </p>
 */
public final class LineScanner {

    private static final int BUFFER_SIZE = 64 * 1024;
    private static final byte[] UTF8_BOM = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF };

    private final FileChannel channel;
    private final ByteBuffer buffer = ByteBuffer.allocate(BUFFER_SIZE);

    // file offset of buffer position 0
    private long bufferStart;
    private boolean endOfInput;

    private byte[] lineBytes = new byte[256];
    private int lineLength;
    private long lineStart;
    private long bytesRead;

    public LineScanner(FileChannel channel, long startOffset) {
        this.channel = channel;
        this.bufferStart = startOffset;
        buffer.limit(0);
    }

    /**
     * Skips a UTF-8 byte order mark if the scan is positioned at one.
     *
     * @return true if a byte order mark was skipped
     */
    public boolean skipByteOrderMark() throws IOException {
        if (!ensureAvailable(UTF8_BOM.length)) {
            return false;
        }
        int position = buffer.position();
        for (int i = 0; i < UTF8_BOM.length; i++) {
            if (buffer.get(position + i) != UTF8_BOM[i]) {
                return false;
            }
        }
        buffer.position(position + UTF8_BOM.length);
        return true;
    }

    /**
     * Advances to the next line.
     *
     * @return false once the end of the file has been reached
     */
    public boolean next() throws IOException {
        lineLength = 0;
        lineStart = currentOffset();
        boolean sawAnyByte = false;

        while (true) {
            if (!buffer.hasRemaining() && !fill()) {
                return sawAnyByte;
            }
            sawAnyByte = true;
            byte b = buffer.get();
            if (b == '\n') {
                return true;
            }
            appendToLine(b);
        }
    }

    /**
     * Byte offset at which the current line starts.
     */
    public long lineStart() {
        return lineStart;
    }

    /**
     * The current line, decoded as UTF-8, without its terminator.
     */
    public String line() {
        return new String(lineBytes, 0, lineLength, StandardCharsets.UTF_8);
    }

    /**
     * Byte offset just past everything consumed so far.
     */
    public long currentOffset() {
        return bufferStart + buffer.position();
    }

    /**
     * Total number of bytes read from the channel.
     */
    public long bytesRead() {
        return bytesRead;
    }

    private void appendToLine(byte b) {
        if (lineLength == lineBytes.length) {
            lineBytes = Arrays.copyOf(lineBytes, lineBytes.length * 2);
        }
        lineBytes[lineLength++] = b;
    }

    private boolean ensureAvailable(int count) throws IOException {
        while (buffer.remaining() < count) {
            if (!fill()) {
                return buffer.remaining() >= count;
            }
        }
        return true;
    }

    /**
     * Moves unread bytes to the front of the buffer and reads more.
     *
     * @return false if no more bytes could be read
     */
    private boolean fill() throws IOException {
        if (endOfInput) {
            return false;
        }
        bufferStart += buffer.position();
        buffer.compact();
        int read = channel.read(buffer, bufferStart + buffer.position());
        buffer.flip();
        if (read <= 0) {
            endOfInput = read < 0;
            return false;
        }
        bytesRead += read;
        return true;
    }
}
