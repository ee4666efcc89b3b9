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
import java.time.LocalDateTime;
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

import dev.driftwood.metadata.GroupDescriptor;
import dev.driftwood.time.TimeFormat;
import dev.driftwood.time.TimeGroup;
import dev.driftwood.time.TimeLayout;

/**
 * Timestamp lookups over a group of one-second log files.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms512m", "-Xmx512m" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class TimeLookupBenchmark {

    private static final LocalDateTime START = LocalDateTime.of(2024, 3, 1, 0, 0);

    @Param({ "8" })
    private int fileCount;

    @Param({ "86400" })
    private int rowsPerFile;

    private Path dataDir;
    private TimeGroup group;
    private SplittableRandom random;
    private long spanMicros;

    @Setup(Level.Trial)
    public void setup() throws IOException {
        dataDir = Files.createTempDirectory("driftwood-time");
        for (int file = 0; file < fileCount; file++) {
            Path data = dataDir.resolve(String.format("offsets_%03d.csv", file));
            try (BufferedWriter writer = Files.newBufferedWriter(data)) {
                writer.write("Time,Offset\n");
                for (int i = 0; i < rowsPerFile; i++) {
                    long second = (long) file * rowsPerFile + i;
                    writer.write(TimeFormat.STANDARD.format(START.plusSeconds(second)) + "," + (second % 1000) * 1e-9 + "\n");
                }
            }
        }

        group = TimeGroup.open(GroupDescriptor.builder(dataDir, "offsets_\\d{3}\\.csv").build(),
                TimeLayout.ONE_COLUMN_STANDARD, true);
        random = new SplittableRandom(42);
        spanMicros = (long) fileCount * rowsPerFile * 1_000_000L;
    }

    @TearDown(Level.Trial)
    public void tearDown() throws IOException {
        group.close();
        try (Stream<Path> paths = Files.walk(dataDir)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        }
    }

    private LocalDateTime randomTime() {
        return START.plusNanos(random.nextLong(spanMicros) * 1_000L);
    }

    @Benchmark
    public void closestIndex(Blackhole blackhole) throws IOException {
        blackhole.consume(group.closestIndex(randomTime()));
    }

    @Benchmark
    public void colAtTime(Blackhole blackhole) throws IOException {
        blackhole.consume(group.colAtTime(randomTime(), "Offset"));
    }
}
