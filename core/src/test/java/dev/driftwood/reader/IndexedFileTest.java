/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.driftwood.ConfigurationException;
import dev.driftwood.ConsistencyException;
import dev.driftwood.index.OffsetIndex;
import dev.driftwood.internal.text.EscapedListTokenizer;
import dev.driftwood.metadata.DescriptorCodec;
import dev.driftwood.metadata.FileDescriptor;
import dev.driftwood.row.Row;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexedFileTest {

    @TempDir
    Path tempDir;

    private Path data;
    private List<String> dataLines;

    @BeforeEach
    void writeSampleFile() throws Exception {
        data = tempDir.resolve("offsets.csv");
        dataLines = new ArrayList<>();

        StringBuilder content = new StringBuilder();
        content.append("# clock offset log\n");
        content.append("Time,Offset,Status\n");
        for (int i = 0; i < 1000; i++) {
            if (i % 100 == 0) {
                content.append("# checkpoint ").append(i).append('\n');
                content.append('\n');
            }
            String line = String.format("2024-03-01 12:%02d:%02d,%d.%03d,ok", i / 60, i % 60, i, i);
            dataLines.add(line);
            content.append(line).append('\n');
        }
        Files.writeString(data, content.toString());
    }

    @Test
    void testIndexesThousandLineFile() throws Exception {
        FileDescriptor descriptor = FileDescriptor.builder(data).build();

        try (IndexedFile file = IndexedFile.open(descriptor)) {
            assertThat(file.size()).isEqualTo(1000);
            assertThat(file.columnNames()).containsExactly("Time", "Offset", "Status");

            Row first = file.getRow(0);
            assertThat(first.get("Time")).isEqualTo("2024-03-01 12:00:00");
            assertThat(first.get("Offset")).isEqualTo("0.000");
            assertThat(first.get("Status")).isEqualTo("ok");

            assertThat(file.getRawLine(999)).isEqualTo(dataLines.get(999));
            assertThat(file.getRawLine(500)).isEqualTo(dataLines.get(500));

            assertThat(file.update(false)).isFalse();
            assertThat(file.size()).isEqualTo(1000);
        }
    }

    @Test
    void testFirstUpdateReportsChange() throws Exception {
        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build())) {
            file.offsetIndex().clear();

            assertThat(file.update(false)).isTrue();
            assertThat(file.update(false)).isFalse();
        }
    }

    @Test
    void testOffsetsAddressLineStarts() throws Exception {
        byte[] bytes = Files.readAllBytes(data);

        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build())) {
            OffsetIndex offsets = file.offsetIndex();
            assertThat(offsets.size()).isEqualTo(file.size());
            for (long row = 0; row < offsets.size(); row++) {
                long offset = offsets.get(row);
                assertThat(offset == 0 || bytes[(int) offset - 1] == '\n').isTrue();
                String expected = dataLines.get((int) row);
                assertThat(new String(bytes, (int) offset, expected.length(), StandardCharsets.UTF_8)).isEqualTo(expected);
            }
        }
    }

    @Test
    void testRawLineTokensMatchRow() throws Exception {
        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build())) {
            EscapedListTokenizer tokenizer = new EscapedListTokenizer(",");
            for (long row : new long[]{ 0, 1, 99, 100, 999 }) {
                assertThat(new ArrayList<>(file.getRow(row).asMap().values()))
                        .isEqualTo(tokenizer.tokenize(file.getRawLine(row)));
            }
        }
    }

    @Test
    void testIncrementalUpdateKeepsExistingOffsets() throws Exception {
        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build())) {
            List<Long> before = new ArrayList<>();
            for (long row = 0; row < file.size(); row++) {
                before.add(file.offsetIndex().get(row));
            }

            Files.writeString(data, "# more\n\n2024-03-01 13:00:00,1000.0,ok\n2024-03-01 13:00:01,1001.0,late\n",
                    StandardOpenOption.APPEND);

            assertThat(file.update(false)).isTrue();
            assertThat(file.size()).isEqualTo(1002);
            for (int row = 0; row < before.size(); row++) {
                assertThat(file.offsetIndex().get(row)).isEqualTo(before.get(row));
            }
            assertThat(file.getRow(1001).get("Status")).isEqualTo("late");
            assertThat(file.update(false)).isFalse();
        }
    }

    @Test
    void testReopenResumesFromCache() throws Exception {
        FileDescriptor descriptor = FileDescriptor.builder(data).build();
        try (IndexedFile file = IndexedFile.open(descriptor)) {
            assertThat(file.size()).isEqualTo(1000);
        }
        assertThat(Files.size(descriptor.cachePath())).isEqualTo(1000L * OffsetIndex.ENTRY_WIDTH);

        try (IndexedFile file = IndexedFile.open(descriptor)) {
            assertThat(file.size()).isEqualTo(1000);
            assertThat(file.columnNames()).containsExactly("Time", "Offset", "Status");
            assertThat(file.update(false)).isFalse();
        }
    }

    @Test
    void testOpenFromPersistedDescriptor() throws Exception {
        FileDescriptor descriptor = FileDescriptor.builder(data).build();
        try (IndexedFile file = IndexedFile.open(descriptor)) {
            assertThat(file.descriptor().rowCount()).isEqualTo(1000);
        }

        FileDescriptor persisted = DescriptorCodec.readFileDescriptor(descriptor.descriptorPath());
        assertThat(persisted.rowCount()).isEqualTo(1000);
        assertThat(persisted.cacheSize()).isEqualTo(1000L * OffsetIndex.ENTRY_WIDTH);
        assertThat(persisted.columnNames()).containsExactly("Time", "Offset", "Status");
        assertThat(persisted.columnNamesFromHeader()).isTrue();

        try (IndexedFile file = IndexedFile.open(descriptor.descriptorPath(), false)) {
            assertThat(file.size()).isEqualTo(1000);
            assertThat(file.getRow(999).get("Offset")).isEqualTo("999.999");
        }
    }

    @Test
    void testForceRebuildProducesSameIndex() throws Exception {
        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build())) {
            long lastOffset = file.offsetIndex().back();

            assertThat(file.update(true)).isTrue();

            assertThat(file.size()).isEqualTo(1000);
            assertThat(file.offsetIndex().back()).isEqualTo(lastOffset);
            assertThat(file.columnNames()).containsExactly("Time", "Offset", "Status");
        }
    }

    @Test
    void testForceRebuildDetectsChangedHeader() throws Exception {
        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build())) {
            Files.writeString(data, "Time,Delay\n2024-03-01 12:00:00,1\n");

            assertThatThrownBy(() -> file.update(true))
                    .isInstanceOf(ConsistencyException.class)
                    .hasMessageContaining("Delay");
        }
    }

    @Test
    void testConfiguredColumnNamesWinOverHeader() throws Exception {
        FileDescriptor descriptor = FileDescriptor.builder(data)
                .columnNames("When", "Delta", "State")
                .build();

        try (IndexedFile file = IndexedFile.open(descriptor)) {
            assertThat(file.size()).isEqualTo(1000);
            assertThat(file.columnNames()).containsExactly("When", "Delta", "State");
            assertThat(file.getRow(0).get("Delta")).isEqualTo("0.000");
        }
    }

    @Test
    void testWithoutHeader() throws Exception {
        Path headerless = tempDir.resolve("headerless.txt");
        Files.writeString(headerless, "1 2\n\n3   4\n% note\n5 6");

        FileDescriptor descriptor = FileDescriptor.builder(headerless)
                .header(false)
                .commentMarkers("%")
                .delimiter(" ")
                .collapseDelimiters(true)
                .columnNames("x", "y")
                .build();

        try (IndexedFile file = IndexedFile.open(descriptor)) {
            assertThat(file.size()).isEqualTo(3);
            assertThat(file.getRow(1).asMap()).containsEntry("x", "3").containsEntry("y", "4");
            assertThat(file.getRawLine(2)).isEqualTo("5 6");
        }
    }

    @Test
    void testSkipsByteOrderMark() throws Exception {
        Path withBom = tempDir.resolve("bom.csv");
        byte[] content = "Name,Value\nalpha,1\r\n".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[content.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(content, 0, bytes, 3, content.length);
        Files.write(withBom, bytes);

        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(withBom).build())) {
            assertThat(file.columnNames()).containsExactly("Name", "Value");
            assertThat(file.getRow(0).get("Value")).isEqualTo("1");
            assertThat(file.getRawLine(0)).isEqualTo("alpha,1\r");
        }
    }

    @Test
    void testHeaderOnlyFile() throws Exception {
        Path empty = tempDir.resolve("empty.csv");
        Files.writeString(empty, "# nothing yet\nTime,Value\n");

        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(empty).build())) {
            assertThat(file.size()).isZero();
            assertThat(file.columnNames()).containsExactly("Time", "Value");
            assertThat(file.update(false)).isFalse();

            Files.writeString(empty, "2024-03-01 12:00:00,7\n", StandardOpenOption.APPEND);

            assertThat(file.update(false)).isTrue();
            assertThat(file.getRow(0).get("Value")).isEqualTo("7");
        }
    }

    @Test
    void testRecoversHeaderForExistingCache() throws Exception {
        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build())) {
            assertThat(file.size()).isEqualTo(1000);
        }
        Files.delete(tempDir.resolve("offsets.csv.json"));

        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build())) {
            assertThat(file.size()).isEqualTo(1000);
            assertThat(file.columnNames()).containsExactly("Time", "Offset", "Status");
            assertThat(file.getRow(0).get("Status")).isEqualTo("ok");
        }
    }

    @Test
    void testRebuildsCacheOfReplacedFile() throws Exception {
        FileDescriptor descriptor = FileDescriptor.builder(data).build();
        try (IndexedFile file = IndexedFile.open(descriptor)) {
            assertThat(file.size()).isEqualTo(1000);
        }
        Files.writeString(data, "Time,Offset,Status\n2024-03-02 00:00:00,5,ok\n");

        try (IndexedFile file = IndexedFile.open(descriptor)) {
            assertThat(file.size()).isEqualTo(1);
            assertThat(file.getRow(0).get("Offset")).isEqualTo("5");
        }
    }

    @Test
    void testChecksColumnCount() throws Exception {
        Path ragged = tempDir.resolve("ragged.csv");
        Files.writeString(ragged, "a,b\n1,2\n3\n");

        FileDescriptor descriptor = FileDescriptor.builder(ragged).checkColumns(true).build();

        assertThatThrownBy(() -> IndexedFile.open(descriptor))
                .isInstanceOf(ConsistencyException.class)
                .hasMessageContaining("Row 1")
                .hasMessageContaining("expected 2");
    }

    @Test
    void testRangeErrors() throws Exception {
        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build())) {
            assertThatThrownBy(() -> file.getRawLine(1000))
                    .isInstanceOf(IndexOutOfBoundsException.class)
                    .hasMessageContaining("1000");
            assertThatThrownBy(() -> file.getRow(-1))
                    .isInstanceOf(IndexOutOfBoundsException.class);
        }
    }

    @Test
    void testMissingDataFile() {
        FileDescriptor descriptor = FileDescriptor.builder(tempDir.resolve("absent.csv")).build();

        assertThatThrownBy(() -> IndexedFile.open(descriptor))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("absent.csv");
    }

    @Test
    void testReopenSharesIndex() throws Exception {
        try (IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build());
                IndexedFile copy = file.reopen()) {
            assertThat(copy.size()).isEqualTo(file.size());
            assertThat(copy.getRawLine(321)).isEqualTo(file.getRawLine(321));
            assertThat(copy.columnNames()).isEqualTo(file.columnNames());
        }
    }

    @Test
    void testClosedFileRejectsReads() throws Exception {
        IndexedFile file = IndexedFile.open(FileDescriptor.builder(data).build());
        file.close();

        assertThatThrownBy(() -> file.getRawLine(0))
                .isInstanceOf(IllegalStateException.class);
    }
}
