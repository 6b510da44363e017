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

import io.tileverse.chipper.BipChipper;
import io.tileverse.chipper.array.RasterArray;
import java.io.IOException;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.RunnerException;

/**
 * Measures window reads through {@link BipChipper} with the memory-mapped and the manual backends.
 */
@State(Scope.Benchmark)
public class ChipperReadBenchmark extends AbstractChipperBenchmark {

    private BipChipper chipper;

    @Setup(Level.Iteration)
    public void openChipper() throws IOException {
        chipper = BipChipper.builder()
                .path(rasterFile)
                .descriptor(descriptor)
                .backendPolicy(backend)
                .build();
    }

    @TearDown(Level.Iteration)
    public void closeChipper() throws IOException {
        if (chipper != null) {
            chipper.close();
        }
    }

    @Benchmark
    public void readContiguous(Blackhole blackhole) throws IOException {
        for (int[] origin : origins) {
            RasterArray chip = chipper.read(contiguousWindow(origin));
            blackhole.consume(chip);
        }
    }

    @Benchmark
    public void readReversedStrided(Blackhole blackhole) throws IOException {
        for (int[] origin : origins) {
            RasterArray chip = chipper.read(reversedStridedWindow(origin));
            blackhole.consume(chip);
        }
    }

    public static void main(String[] args) throws RunnerException {
        runBenchmark(ChipperReadBenchmark.class);
    }
}
