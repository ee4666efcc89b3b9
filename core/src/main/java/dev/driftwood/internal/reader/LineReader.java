/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.reader;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads single lines at absolute byte offsets of a data file.
 * <p>
 * Every call performs its own positioned reads; no cursor state is carried between calls.
 * </p>
 */
public final class LineReader {

    private static final int CHUNK_SIZE = 512;

    private final Path path;
    private final FileChannel channel;
    private final ByteBuffer chunk = ByteBuffer.allocate(CHUNK_SIZE);

    public LineReader(Path path, FileChannel channel) {
        this.path = path;
        this.channel = channel;
    }

    /**
     * Reads the line starting at {@code offset}, without its {@code \n} terminator.
     *
     * @throws EOFException if {@code offset} is at or beyond the end of the file
     */
    public String readLine(long offset) throws IOException {
        byte[] line = new byte[CHUNK_SIZE];
        int length = 0;
        long position = offset;

        while (true) {
            chunk.clear();
            int read = channel.read(chunk, position);
            if (read < 0) {
                if (length == 0 && position == offset) {
                    throw new EOFException("No line at offset " + offset + " of " + path);
                }
                break;
            }
            chunk.flip();
            position += read;

            int newline = -1;
            for (int i = 0; i < chunk.limit(); i++) {
                if (chunk.get(i) == '\n') {
                    newline = i;
                    break;
                }
            }

            int take = newline >= 0 ? newline : chunk.limit();
            if (length + take > line.length) {
                line = Arrays.copyOf(line, Math.max(line.length * 2, length + take));
            }
            chunk.get(line, length, take);
            length += take;

            if (newline >= 0) {
                break;
            }
        }
        return new String(line, 0, length, StandardCharsets.UTF_8);
    }
}
