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

import io.tileverse.chipper.BipWriter;
import io.tileverse.chipper.array.RasterArray;
import java.io.IOException;
import java.nio.ByteOrder;
import java.util.Random;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.runner.RunnerException;

/**
 * Measures block writes through {@link BipWriter}: square tiles, written row by row, and full-width row bands,
 * written as a single contiguous run.
 */
@State(Scope.Benchmark)
public class ChipperWriteBenchmark extends AbstractChipperBenchmark {

    private BipWriter writer;

    private RasterArray tile;

    private RasterArray rowBand;

    @Setup(Level.Iteration)
    public void openWriter() throws IOException {
        writer = BipWriter.builder()
                .path(rasterFile)
                .descriptor(descriptor)
                .backendPolicy(backend)
                .build();
        tile = randomBlock(windowSize, windowSize);
        rowBand = randomBlock(Math.max(1, windowSize * windowSize / rasterSize), rasterSize);
    }

    @TearDown(Level.Iteration)
    public void closeWriter() throws IOException {
        if (writer != null) {
            writer.close();
        }
    }

    @Benchmark
    public void writeTiles() throws IOException {
        for (int[] origin : origins) {
            writer.write(tile, origin[0], origin[1]);
        }
    }

    @Benchmark
    public void writeRowBands() throws IOException {
        final int lastRow = rasterSize - rowBand.rows();
        for (int[] origin : origins) {
            writer.write(rowBand, Math.min(origin[0], lastRow), 0);
        }
    }

    private RasterArray randomBlock(int rows, int cols) {
        Random random = new Random(7);
        RasterArray block = RasterArray.allocate(rawType, ByteOrder.nativeOrder(), rows, cols, 1);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                block.setDouble(r, c, 0, random.nextInt(Short.MAX_VALUE));
            }
        }
        return block;
    }

    public static void main(String[] args) throws RunnerException {
        runBenchmark(ChipperWriteBenchmark.class);
    }
}
