/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.benchmarks;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.driftwood.metadata.FileDescriptor;
import dev.driftwood.reader.IndexedFile;

/**
 * Random row access on a single indexed file. With {@code fixedWidth} every line has the
 * same length, so offsets are computed instead of read from the cache file.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms512m", "-Xmx512m" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class RowLookupBenchmark {

    @Param({ "1000000" })
    private int rowCount;

    @Param({ "true", "false" })
    private boolean fixedWidth;

    private Path dataDir;
    private IndexedFile file;
    private SplittableRandom random;

    @Setup(Level.Trial)
    public void setup() throws IOException {
        dataDir = Files.createTempDirectory("driftwood-rows");
        Path data = dataDir.resolve("rows.csv");
        try (BufferedWriter writer = Files.newBufferedWriter(data)) {
            writer.write("Id,Offset,Status\n");
            for (int row = 0; row < rowCount; row++) {
                String offset = fixedWidth ? String.format("%012d", row * 7L) : Long.toString(row * 7L);
                writer.write(String.format("%09d,%s,ok\n", row, offset));
            }
        }

        file = IndexedFile.open(FileDescriptor.builder(data).build(), true);
        random = new SplittableRandom(42);
    }

    @TearDown(Level.Trial)
    public void tearDown() throws IOException {
        file.close();
        try (Stream<Path> paths = Files.walk(dataDir)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        }
    }

    @Benchmark
    public void rawLine(Blackhole blackhole) throws IOException {
        blackhole.consume(file.getRawLine(random.nextLong(rowCount)));
    }

    @Benchmark
    public void row(Blackhole blackhole) throws IOException {
        blackhole.consume(file.getRow(random.nextLong(rowCount)));
    }
}
