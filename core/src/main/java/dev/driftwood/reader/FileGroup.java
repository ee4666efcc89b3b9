/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.reader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import dev.driftwood.ConfigurationException;
import dev.driftwood.ConsistencyException;
import dev.driftwood.FormatException;
import dev.driftwood.metadata.DescriptorCodec;
import dev.driftwood.metadata.GroupDescriptor;
import dev.driftwood.row.Row;

/**
 * Presents all files below a directory whose relative path matches a regular expression as
 * one logical sequence of rows.
 * <p>
 * Members are ordered by path; global row {@code n} lives in the member whose row range
 * contains {@code n}. All members must have the same column names. {@link #update(boolean)}
 * rediscovers the directory, so files created since the last update join the group and
 * growing files expose their new rows.
 * </p>
 * <p>
 * Instances are not thread-safe. An update that fails leaves the previous members and row
 * mapping in place.
 * </p>
 */
public final class FileGroup implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(FileGroup.class.getName());

    /**
     * Position of a global row within the group.
     *
     * @param fileIndex index of the member file in {@link #files()}
     * @param row row within that member
     */
    public record Location(int fileIndex, long row) {
    }

    private final Pattern filePattern;
    private final MemberFailurePolicy failurePolicy;
    private final List<IndexedFile> files = new ArrayList<>();
    private final List<MemberFailure> failures = new ArrayList<>();

    private GroupDescriptor descriptor;
    private long[] startRows = new long[0];
    private boolean closed;

    private FileGroup(GroupDescriptor descriptor, Pattern filePattern, MemberFailurePolicy failurePolicy) {
        this.descriptor = descriptor;
        this.filePattern = filePattern;
        this.failurePolicy = failurePolicy;
    }

    /**
     * Discovers and indexes the members of a group, using the failure policy configured by
     * the {@value MemberFailurePolicy#SYSTEM_PROPERTY} system property.
     *
     * @param forceRebuild if true, every member rebuilds its offset cache
     */
    public static FileGroup open(GroupDescriptor descriptor, boolean forceRebuild) throws IOException {
        return open(descriptor, forceRebuild, MemberFailurePolicy.fromSystemProperty());
    }

    /**
     * Discovers and indexes the members of a group.
     *
     * @param forceRebuild if true, every member rebuilds its offset cache
     * @param failurePolicy how members that cannot be opened are handled
     * @throws ConfigurationException if the parent directory cannot be listed or the file pattern is invalid
     * @throws ConsistencyException if the members do not share the same column names
     */
    public static FileGroup open(GroupDescriptor descriptor, boolean forceRebuild, MemberFailurePolicy failurePolicy)
            throws IOException {
        Pattern pattern;
        try {
            pattern = Pattern.compile(descriptor.filePattern());
        }
        catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid file pattern '" + descriptor.filePattern() + "' for group",
                    descriptor.parentPath(), e);
        }

        FileGroup group = new FileGroup(descriptor, pattern, failurePolicy);
        try {
            group.update(forceRebuild);
            return group;
        }
        catch (Exception e) {
            try {
                group.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    /**
     * Opens a group described by a previously persisted descriptor.
     */
    public static FileGroup open(Path descriptorPath, boolean forceRebuild) throws IOException {
        return open(DescriptorCodec.readGroupDescriptor(descriptorPath), forceRebuild);
    }

    /**
     * Rediscovers the member files and brings every member's index up to date.
     *
     * @param forceRebuild if true, every member rebuilds its offset cache
     * @return true if a member was added or removed, or any member found new rows
     * @throws ConsistencyException if the members do not share the same column names, in which case
     *         the group keeps its previous members and row mapping
     */
    public boolean update(boolean forceRebuild) throws IOException {
        ensureOpen();
        failures.clear();

        List<Path> discovered = discover();
        Set<Path> discoveredSet = new HashSet<>(discovered);
        boolean changed = false;

        Map<Path, IndexedFile> known = new HashMap<>();
        List<IndexedFile> dropped = new ArrayList<>();
        for (IndexedFile file : files) {
            if (discoveredSet.contains(file.path())) {
                known.put(file.path(), file);
            }
            else {
                LOG.log(System.Logger.Level.WARNING, "Member ''{0}'' no longer exists, removing it from the group",
                        file.path());
                dropped.add(file);
                changed = true;
            }
        }

        // members and row mapping are replaced only once every member passed the checks
        List<IndexedFile> opened = new ArrayList<>();
        List<IndexedFile> members = new ArrayList<>();
        GroupDescriptor updated;
        long[] starts;
        try {
            for (Path path : discovered) {
                IndexedFile existing = known.get(path);
                if (existing != null) {
                    try {
                        changed |= existing.update(forceRebuild);
                        members.add(existing);
                    }
                    catch (IOException | ConsistencyException | FormatException e) {
                        handleFailure(path, e);
                        dropped.add(existing);
                        changed = true;
                    }
                }
                else {
                    try {
                        IndexedFile file = IndexedFile.open(descriptor.memberDescriptor(path), forceRebuild);
                        opened.add(file);
                        members.add(file);
                        changed = true;
                    }
                    catch (IOException | ConsistencyException | FormatException e) {
                        handleFailure(path, e);
                    }
                }
            }

            List<String> names = descriptor.columnNames();
            boolean namesFromHeader = descriptor.columnNamesFromHeader();
            if (names.isEmpty() && !members.isEmpty()) {
                names = members.get(0).columnNames();
                namesFromHeader = true;
            }
            for (IndexedFile file : members) {
                if (!file.columnNames().equals(names)) {
                    throw new ConsistencyException("All files of a group must have the same column names, but "
                            + file.path() + " has " + file.columnNames() + " and the group has " + names);
                }
            }

            starts = new long[members.size()];
            long rows = 0;
            for (int i = 0; i < members.size(); i++) {
                starts[i] = rows;
                rows += members.get(i).size();
            }

            updated = descriptor.withMembers(
                    members.stream().map(IndexedFile::path).collect(Collectors.toList()), names, namesFromHeader, rows);
            if (!updated.equals(descriptor) || !Files.exists(updated.descriptorPath())) {
                DescriptorCodec.write(updated);
            }
        }
        catch (Exception e) {
            closeAll(opened, e);
            throw e;
        }

        files.clear();
        files.addAll(members);
        startRows = starts;
        descriptor = updated;
        closeAll(dropped, null);

        LOG.log(System.Logger.Level.DEBUG, "Updated group in ''{0}'': {1} files, {2} rows",
                descriptor.parentPath(), files.size(), descriptor.rowCount());

        return changed;
    }

    private static void closeAll(List<IndexedFile> toClose, Exception primary) throws IOException {
        IOException failure = null;
        for (IndexedFile file : toClose) {
            try {
                file.close();
            }
            catch (IOException e) {
                if (primary != null) {
                    primary.addSuppressed(e);
                }
                else if (failure == null) {
                    failure = e;
                }
                else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private List<Path> discover() throws IOException {
        Path parent = descriptor.parentPath();
        if (!Files.isDirectory(parent)) {
            throw new ConfigurationException("Group directory does not exist", parent);
        }
        try (Stream<Path> paths = Files.walk(parent)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> filePattern.matcher(relativeName(parent, path)).matches())
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList());
        }
        catch (NoSuchFileException | NotDirectoryException e) {
            throw new ConfigurationException("Group directory does not exist", parent, e);
        }
        catch (UncheckedIOException e) {
            throw new ConfigurationException("Failed to list group directory", parent, e.getCause());
        }
        catch (IOException e) {
            throw new ConfigurationException("Failed to list group directory", parent, e);
        }
    }

    private static String relativeName(Path parent, Path path) {
        String name = parent.relativize(path).toString();
        String separator = path.getFileSystem().getSeparator();
        return separator.equals("/") ? name : name.replace(separator, "/");
    }

    private void handleFailure(Path path, Exception e) throws IOException {
        if (failurePolicy == MemberFailurePolicy.FAIL_FAST) {
            if (e instanceof IOException) {
                throw (IOException) e;
            }
            throw (RuntimeException) e;
        }
        LOG.log(System.Logger.Level.WARNING, "Skipping member ''" + path + "''", e);
        failures.add(new MemberFailure(path, e));
    }

    /**
     * Maps a global row to a member file and the row within it.
     *
     * @throws IndexOutOfBoundsException if {@code row} is outside {@code [0, size())}
     */
    public Location getFileIndexAndRow(long row) {
        ensureOpen();
        long size = size();
        if (row < 0 || row >= size) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for group with " + size + " rows");
        }
        int fileIndex = 0;
        while (fileIndex < startRows.length - 1 && row >= startRows[fileIndex + 1]) {
            fileIndex++;
        }
        return new Location(fileIndex, row - startRows[fileIndex]);
    }

    public String getRawLine(long row) throws IOException {
        Location location = getFileIndexAndRow(row);
        return files.get(location.fileIndex()).getRawLine(location.row());
    }

    public Row getRow(long row) throws IOException {
        Location location = getFileIndexAndRow(row);
        return files.get(location.fileIndex()).getRow(location.row());
    }

    /**
     * Total number of rows across all members.
     */
    public long size() {
        ensureOpen();
        return descriptor.rowCount();
    }

    public List<String> columnNames() {
        return descriptor.columnNames();
    }

    /**
     * Member files in global row order.
     */
    public List<IndexedFile> files() {
        return List.copyOf(files);
    }

    /**
     * Members left out by the most recent update, empty unless the failure policy is
     * {@link MemberFailurePolicy#CONTINUE}.
     */
    public List<MemberFailure> failures() {
        return List.copyOf(failures);
    }

    public GroupDescriptor descriptor() {
        return descriptor;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("File group is closed: " + descriptor.parentPath());
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        List<IndexedFile> members = new ArrayList<>(files);
        files.clear();
        closeAll(members, null);
    }

    @Override
    public String toString() {
        return descriptor.toString();
    }
}
