/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.metadata;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.driftwood.ConfigurationException;
import dev.driftwood.FormatException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DescriptorCodecTest {

    private static final Path DESCRIPTORS = Paths.get("src/test/resources/descriptors");

    @TempDir
    Path tempDir;

    @Test
    void testFileDescriptorDefaults() {
        Path data = tempDir.resolve("run_01.csv");

        FileDescriptor descriptor = FileDescriptor.builder(data).build();

        assertThat(descriptor.cachePath()).isEqualTo(tempDir.resolve("run_01.csv.cache"));
        assertThat(descriptor.descriptorPath()).isEqualTo(tempDir.resolve("run_01.csv.json"));
        assertThat(descriptor.commentMarkers()).isEqualTo("#");
        assertThat(descriptor.delimiter()).isEqualTo(",");
        assertThat(descriptor.header()).isTrue();
        assertThat(descriptor.collapseDelimiters()).isFalse();
        assertThat(descriptor.checkColumns()).isFalse();
        assertThat(descriptor.columnNames()).isEmpty();
        assertThat(descriptor.rowCount()).isEqualTo(-1);
    }

    @Test
    void testFileDescriptorRoundTrip() throws Exception {
        FileDescriptor descriptor = FileDescriptor.builder(tempDir.resolve("run_01.csv"))
                .commentMarkers("#;")
                .delimiter(" \t")
                .collapseDelimiters(true)
                .header(false)
                .columnNames("Time", "Value")
                .build()
                .withRowCount(1000, 8000);

        DescriptorCodec.write(descriptor);

        assertThat(descriptor.descriptorPath()).exists();
        assertThat(DescriptorCodec.readFileDescriptor(descriptor.descriptorPath())).isEqualTo(descriptor);
    }

    @Test
    void testFileDescriptorJsonKeys() {
        FileDescriptor descriptor = FileDescriptor.builder(Path.of("/data/run_01.csv"))
                .columnNames("Time", "Value")
                .build()
                .withRowCount(2, 16);

        String json = DescriptorCodec.toJson(descriptor);

        assertThat(json)
                .contains("\"dataFilePath\":\"/data/run_01.csv\"")
                .contains("\"cacheFilePath\":\"/data/run_01.csv.cache\"")
                .contains("\"jsonFilePath\":\"/data/run_01.csv.json\"")
                .contains("\"multi_delimiter\":false")
                .contains("\"col_names\":[\"Time\",\"Value\"]")
                .contains("\"total_lines\":2")
                .contains("\"cache_size\":16");
    }

    @Test
    void testReadsLegacyFileDescriptor() throws Exception {
        FileDescriptor descriptor = DescriptorCodec.readFileDescriptor(DESCRIPTORS.resolve("legacy_file_descriptor.json"));

        assertThat(descriptor.dataPath()).isEqualTo(Path.of("/data/clock/offsets_240301.csv"));
        assertThat(descriptor.commentMarkers()).isEqualTo("#%");
        assertThat(descriptor.delimiter()).isEqualTo(", ");
        assertThat(descriptor.collapseDelimiters()).isTrue();
        assertThat(descriptor.columnNames()).containsExactly("Time", "Offset", "Frequency");
        assertThat(descriptor.columnNamesFromHeader()).isFalse();
        assertThat(descriptor.rowCount()).isEqualTo(86400);
        assertThat(descriptor.cacheSize()).isEqualTo(691200);
        assertThat(descriptor.isCommentMarker('%')).isTrue();
        assertThat(descriptor.isCommentMarker('T')).isFalse();
    }

    @Test
    void testReadsLegacyGroupDescriptor() throws Exception {
        GroupDescriptor descriptor = DescriptorCodec.readGroupDescriptor(DESCRIPTORS.resolve("legacy_group_descriptor.json"));

        assertThat(descriptor.parentPath()).isEqualTo(Path.of("/data/clock"));
        assertThat(descriptor.filePattern()).isEqualTo("offsets_\\d{6}\\.csv");
        assertThat(descriptor.dataPaths()).containsExactly(
                Path.of("/data/clock/offsets_240301.csv"),
                Path.of("/data/clock/offsets_240302.csv"));
        assertThat(descriptor.columnNames()).containsExactly("Time", "Offset");
        assertThat(descriptor.rowCount()).isEqualTo(172800);
    }

    @Test
    void testGroupDescriptorRoundTrip() throws Exception {
        GroupDescriptor descriptor = GroupDescriptor.builder(tempDir, "run_.*\\.csv")
                .delimiter(";")
                .build()
                .withMembers(List.of(tempDir.resolve("run_01.csv"), tempDir.resolve("run_02.csv")),
                        List.of("Time", "Value"), true, 20);

        DescriptorCodec.write(descriptor);

        assertThat(descriptor.descriptorPath()).isEqualTo(tempDir.resolve(GroupDescriptor.DEFAULT_DESCRIPTOR_NAME));
        assertThat(DescriptorCodec.readGroupDescriptor(descriptor.descriptorPath())).isEqualTo(descriptor);
    }

    @Test
    void testMemberDescriptorInheritsSettings() {
        GroupDescriptor group = GroupDescriptor.builder(tempDir, ".*\\.csv")
                .commentMarkers("%")
                .delimiter(";")
                .checkColumns(true)
                .columnNames("Time", "Value")
                .build();

        FileDescriptor member = group.memberDescriptor(tempDir.resolve("a.csv"));

        assertThat(member.commentMarkers()).isEqualTo("%");
        assertThat(member.delimiter()).isEqualTo(";");
        assertThat(member.checkColumns()).isTrue();
        assertThat(member.columnNames()).containsExactly("Time", "Value");
        assertThat(member.cachePath()).isEqualTo(tempDir.resolve("a.csv.cache"));
    }

    @Test
    void testMemberDescriptorReadsOwnHeaderWhenNamesCameFromHeader() {
        GroupDescriptor group = GroupDescriptor.builder(tempDir, ".*\\.csv")
                .build()
                .withMembers(List.of(), List.of("Time", "Value"), true, 0);

        assertThat(group.memberDescriptor(tempDir.resolve("a.csv")).columnNames()).isEmpty();
    }

    @Test
    void testAbsentKeysTakeBuilderDefaults() throws Exception {
        Path json = tempDir.resolve("minimal.json");
        Files.writeString(json, "{\"dataFilePath\": \"x.csv\"}");

        FileDescriptor descriptor = DescriptorCodec.readFileDescriptor(json);

        assertThat(descriptor).isEqualTo(FileDescriptor.builder(Path.of("x.csv")).build());
        assertThat(descriptor.header()).isTrue();
        assertThat(descriptor.commentMarkers()).isEqualTo("#");
        assertThat(descriptor.delimiter()).isEqualTo(",");
        assertThat(descriptor.rowCount()).isEqualTo(-1);
    }

    @Test
    void testAbsentGroupKeysTakeBuilderDefaults() throws Exception {
        Path json = tempDir.resolve("minimal_group.json");
        Files.writeString(json, "{\"parentPath\": \"/data/clock\", \"dataTemplate\": \"offsets_.*\"}");

        GroupDescriptor descriptor = DescriptorCodec.readGroupDescriptor(json);

        assertThat(descriptor).isEqualTo(GroupDescriptor.builder(Path.of("/data/clock"), "offsets_.*").build());
        assertThat(descriptor.header()).isTrue();
        assertThat(descriptor.rowCount()).isEqualTo(-1);
    }

    @Test
    void testExplicitFalseHeaderIsKept() throws Exception {
        Path json = tempDir.resolve("no_header.json");
        Files.writeString(json, "{\"dataFilePath\": \"x.csv\", \"header\": false, \"comment\": \"\"}");

        FileDescriptor descriptor = DescriptorCodec.readFileDescriptor(json);

        assertThat(descriptor.header()).isFalse();
        assertThat(descriptor.commentMarkers()).isEmpty();
    }

    @Test
    void testMissingDescriptor() {
        assertThatThrownBy(() -> DescriptorCodec.readFileDescriptor(tempDir.resolve("absent.json")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("absent.json");
    }

    @Test
    void testMalformedDescriptor() throws Exception {
        Path notJson = tempDir.resolve("broken.json");
        Files.writeString(notJson, "{ \"dataFilePath\": ");

        assertThatThrownBy(() -> DescriptorCodec.readFileDescriptor(notJson))
                .isInstanceOf(FormatException.class);
        assertThatThrownBy(() -> DescriptorCodec.readFileDescriptor(DESCRIPTORS.resolve("malformed_descriptor.json")))
                .isInstanceOf(FormatException.class)
                .hasMessageContaining("malformed_descriptor.json");
    }

    @Test
    void testFailedWriteLeavesNoTemporaryFile() throws Exception {
        Path target = tempDir.resolve("run_01.csv.json");
        Files.createDirectory(target);
        Files.writeString(target.resolve("occupied"), "x");
        FileDescriptor descriptor = FileDescriptor.builder(tempDir.resolve("run_01.csv")).build();

        assertThatThrownBy(() -> DescriptorCodec.write(descriptor))
                .isInstanceOf(IOException.class);
        assertThat(tempDir.resolve("run_01.csv.json.tmp")).doesNotExist();
    }

    @Test
    void testRejectsEmptyDelimiter() {
        assertThatThrownBy(() -> FileDescriptor.builder(tempDir.resolve("a.csv")).delimiter("").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
