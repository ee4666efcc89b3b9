/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.metadata;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.driftwood.ConfigurationException;
import dev.driftwood.FormatException;

/**
 * Reads and writes {@link FileDescriptor} and {@link GroupDescriptor} JSON files.
 * <p>
 * Writes go to a temporary sibling that is then moved over the target, so a reader never
 * observes a half-written descriptor.
 * </p>
 */
public final class DescriptorCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_COMMENTS, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final System.Logger LOG = System.getLogger(DescriptorCodec.class.getName());

    private DescriptorCodec() {
    }

    public static FileDescriptor readFileDescriptor(Path path) throws IOException {
        return read(path, FileDescriptor.class);
    }

    public static GroupDescriptor readGroupDescriptor(Path path) throws IOException {
        return read(path, GroupDescriptor.class);
    }

    public static void write(FileDescriptor descriptor) throws IOException {
        write(descriptor.descriptorPath(), descriptor);
    }

    public static void write(GroupDescriptor descriptor) throws IOException {
        write(descriptor.descriptorPath(), descriptor);
    }

    /**
     * Serializes a descriptor to its JSON text.
     */
    public static String toJson(Object descriptor) {
        try {
            return MAPPER.writeValueAsString(descriptor);
        }
        catch (JsonProcessingException e) {
            throw new FormatException("Failed to serialize descriptor " + descriptor.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(Path path, Class<T> type) throws IOException {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        }
        catch (NoSuchFileException e) {
            throw new ConfigurationException("Descriptor does not exist", path, e);
        }
        catch (IOException e) {
            throw new ConfigurationException("Failed to read descriptor", path, e);
        }

        try {
            return MAPPER.readValue(content, type);
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            throw new FormatException("Malformed descriptor " + path + ": " + e.getMessage(), e);
        }
    }

    private static void write(Path path, Object descriptor) throws IOException {
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, descriptor);
            }
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            }
            catch (IOException deleteException) {
                e.addSuppressed(deleteException);
            }
            throw e;
        }
        LOG.log(System.Logger.Level.DEBUG, "Wrote descriptor ''{0}''", path);
    }
}
