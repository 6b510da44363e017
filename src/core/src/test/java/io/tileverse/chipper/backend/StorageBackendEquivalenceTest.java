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
package io.tileverse.chipper.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.tileverse.chipper.RasterFixtures;
import io.tileverse.chipper.RasterFixtures.SampleFunction;
import io.tileverse.chipper.array.ElementType;
import io.tileverse.chipper.array.RasterArray;
import io.tileverse.chipper.range.IndexRange;
import io.tileverse.chipper.range.ResolvedWindow;
import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Reads and writes the same windows through the mapped and the manual backends, which must agree byte for byte.
 */
class StorageBackendEquivalenceTest {

    private static final BipLayout LAYOUT = new BipLayout(20, 13, 3, ElementType.INT16, ByteOrder.BIG_ENDIAN, 7);

    private static final SampleFunction VALUES = (r, c, b) -> 100 * r + 3 * c + b;

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        file = RasterFixtures.createFile(tempDir.resolve("raster.bip"), LAYOUT, VALUES);
    }

    static Stream<Arguments> windows() {
        return Stream.of(
                Arguments.of("full raster", ResolvedWindow.contiguous(0, 0, 20, 13)),
                Arguments.of("inner block", ResolvedWindow.contiguous(5, 2, 4, 6)),
                Arguments.of("single pixel", ResolvedWindow.contiguous(19, 12, 1, 1)),
                Arguments.of("full rows", ResolvedWindow.contiguous(3, 0, 2, 13)),
                Arguments.of("strided", new ResolvedWindow(new IndexRange(1, 3, 6), new IndexRange(0, 2, 7))),
                Arguments.of("reversed", new ResolvedWindow(new IndexRange(19, -1, 20), new IndexRange(12, -1, 13))),
                Arguments.of(
                        "reversed strided columns",
                        new ResolvedWindow(IndexRange.contiguous(2, 3), new IndexRange(11, -4, 3))),
                Arguments.of("empty", new ResolvedWindow(IndexRange.empty(), IndexRange.contiguous(0, 4))));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("windows")
    void testReadWindow(String description, ResolvedWindow window) throws IOException {
        RasterArray expected = expected(window);

        RasterArray mapped = read(BackendPolicy.MAPPED, window);
        RasterArray manual = read(BackendPolicy.MANUAL, window);

        assertEquals(expected, mapped);
        assertEquals(expected, manual);
        assertEquals(LAYOUT.order(), manual.order());
    }

    @ParameterizedTest
    @EnumSource(value = BackendPolicy.class, names = {"MAPPED", "MANUAL"})
    void testWritePartialRows(BackendPolicy policy) throws IOException {
        SampleFunction blockValues = (r, c, b) -> -(1000 + 10 * r + c) - b;
        RasterArray block = RasterFixtures.array(ElementType.INT16, 4, 5, 3, blockValues)
                .withOrder(ByteOrder.LITTLE_ENDIAN);

        try (StorageBackend backend = StorageBackends.open(file, LAYOUT, true, policy, FileMapper.DEFAULT)) {
            backend.writeWindow(6, 8, block);
        }

        assertFileContains((r, c, b) -> r >= 6 && r < 10 && c >= 8
                ? blockValues.value(r - 6, c - 8, b)
                : VALUES.value(r, c, b));
    }

    @ParameterizedTest
    @EnumSource(value = BackendPolicy.class, names = {"MAPPED", "MANUAL"})
    void testWriteFullRows(BackendPolicy policy) throws IOException {
        SampleFunction blockValues = (r, c, b) -> 7 * r - c + b;
        RasterArray block = RasterFixtures.array(ElementType.INT16, 3, 13, 3, blockValues);

        try (StorageBackend backend = StorageBackends.open(file, LAYOUT, true, policy, FileMapper.DEFAULT)) {
            backend.writeWindow(17, 0, block);
        }

        assertFileContains((r, c, b) -> r >= 17 ? blockValues.value(r - 17, c, b) : VALUES.value(r, c, b));
    }

    private void assertFileContains(SampleFunction values) throws IOException {
        ResolvedWindow all = ResolvedWindow.contiguous(0, 0, LAYOUT.rows(), LAYOUT.cols());
        RasterArray expected = RasterFixtures.array(ElementType.INT16, LAYOUT.rows(), LAYOUT.cols(), 3, values);
        assertEquals(expected, read(BackendPolicy.MANUAL, all));
        assertEquals(expected, read(BackendPolicy.MAPPED, all));
    }

    private RasterArray read(BackendPolicy policy, ResolvedWindow window) throws IOException {
        try (StorageBackend backend = StorageBackends.open(file, LAYOUT, false, policy, FileMapper.DEFAULT)) {
            assertEquals(policy.name(), backend.kind().name());
            return backend.readWindow(window);
        }
    }

    private static RasterArray expected(ResolvedWindow window) {
        return RasterFixtures.array(
                ElementType.INT16,
                window.height(),
                window.width(),
                LAYOUT.bands(),
                (i, j, b) -> VALUES.value(window.rows().index(i), window.cols().index(j), b));
    }
}
