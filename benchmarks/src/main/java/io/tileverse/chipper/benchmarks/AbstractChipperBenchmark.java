/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.chipper.benchmarks;

import io.tileverse.chipper.RasterDescriptor;
import io.tileverse.chipper.array.ElementType;
import io.tileverse.chipper.backend.BackendPolicy;
import io.tileverse.chipper.range.AxisRange;
import io.tileverse.chipper.range.Window;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import org.apache.commons.io.FileUtils;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.profile.GCProfiler;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

/**
 * Base class for chipper benchmarks.
 * <p>
 * Creates a square single band raster file once per trial and pre-computes the origins of the windows each
 * benchmark invocation visits, so that the memory-mapped and manual backends are measured on the same access
 * sequence.
 */
@BenchmarkMode({Mode.Throughput})
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
public abstract class AbstractChipperBenchmark {

    /**
     * Order in which windows are visited.
     */
    public enum AccessPattern {
        SEQUENTIAL, // row-major tile order
        RANDOM // random window origins
    }

    /**
     * Backend policy under test.
     */
    @Param({"MAPPED", "MANUAL"})
    public BackendPolicy backend;

    /**
     * Rows and columns of the raster.
     */
    @Param({"4096"})
    public int rasterSize;

    /**
     * Raw element type of the raster.
     */
    @Param({"INT16", "FLOAT32"})
    public ElementType rawType;

    /**
     * Rows and columns of each window.
     */
    @Param({"64", "512"})
    public int windowSize;

    @Param({"SEQUENTIAL", "RANDOM"})
    public AccessPattern accessPattern;

    /**
     * Number of windows per benchmark invocation.
     */
    @Param({"64"})
    public int numberOfWindows;

    protected Path tempDir;

    protected Path rasterFile;

    protected RasterDescriptor descriptor;

    /**
     * Window origins, {@code {row, col}}.
     */
    protected int[][] origins;

    @Setup(Level.Trial)
    public void setupTrial() throws IOException {
        tempDir = Files.createTempDirectory("chipper-benchmark");
        descriptor = RasterDescriptor.builder()
                .shape(rasterSize, rasterSize)
                .rawType(rawType)
                .build();
        rasterFile = tempDir.resolve("raster.bip");
        createRasterFile(rasterFile, descriptor.layout().endOffset());
        origins = generateOrigins(new Random(42));
    }

    @TearDown(Level.Trial)
    public void teardownTrial() throws IOException {
        if (tempDir != null && Files.exists(tempDir)) {
            FileUtils.deleteDirectory(tempDir.toFile());
        }
    }

    /**
     * Fills the raster file with random bytes, in chunks, using a fixed seed for reproducibility.
     */
    protected void createRasterFile(Path path, long size) throws IOException {
        Random random = new Random(42);
        byte[] chunk = new byte[1 << 20];
        try (OutputStream out = Files.newOutputStream(path)) {
            for (long written = 0; written < size; written += chunk.length) {
                random.nextBytes(chunk);
                out.write(chunk, 0, (int) Math.min(chunk.length, size - written));
            }
        }
    }

    protected int[][] generateOrigins(Random random) {
        final int limit = rasterSize - windowSize;
        final int tilesPerRow = rasterSize / windowSize;
        int[][] result = new int[numberOfWindows][];
        for (int i = 0; i < numberOfWindows; i++) {
            result[i] = switch (accessPattern) {
                case SEQUENTIAL -> new int[] {
                    (i / tilesPerRow % tilesPerRow) * windowSize, (i % tilesPerRow) * windowSize
                };
                case RANDOM -> new int[] {random.nextInt(limit + 1), random.nextInt(limit + 1)};
            };
        }
        return result;
    }

    protected Window contiguousWindow(int[] origin) {
        return Window.of(origin[0], origin[1], windowSize, windowSize);
    }

    /**
     * @return a window covering the same area as {@link #contiguousWindow(int[])}, every other row and column,
     *     traversed backwards
     */
    protected Window reversedStridedWindow(int[] origin) {
        int lastRow = origin[0] + windowSize - 1;
        int lastCol = origin[1] + windowSize - 1;
        return Window.of(AxisRange.of(lastRow, origin[0] - 1, -2), AxisRange.of(lastCol, origin[1] - 1, -2));
    }

    /**
     * Runs the benchmarks of one class with the GC profiler.
     */
    public static void runBenchmark(Class<? extends AbstractChipperBenchmark> benchmarkClass)
            throws RunnerException {
        Options options = new OptionsBuilder()
                .include(benchmarkClass.getSimpleName())
                .addProfiler(GCProfiler.class)
                .build();

        new Runner(options).run();
    }
}
