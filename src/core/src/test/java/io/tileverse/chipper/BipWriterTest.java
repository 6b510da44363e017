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
package io.tileverse.chipper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tileverse.chipper.RasterFixtures.SampleFunction;
import io.tileverse.chipper.array.ElementType;
import io.tileverse.chipper.array.ElementTypeMismatchException;
import io.tileverse.chipper.array.RasterArray;
import io.tileverse.chipper.backend.BackendKind;
import io.tileverse.chipper.backend.BackendPolicy;
import io.tileverse.chipper.backend.FileMapper;
import io.tileverse.chipper.compose.BandComposer;
import io.tileverse.chipper.compose.SampleTransform;
import io.tileverse.chipper.range.Window;
import io.tileverse.chipper.range.WindowOutOfBoundsException;
import io.tileverse.chipper.symmetry.Symmetry;
import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.ReadOnlyBufferException;
import java.nio.channels.FileChannel.MapMode;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class BipWriterTest {

    private static final SampleFunction INT16_VALUES = (r, c, b) -> r * 50 + c;

    @TempDir
    Path tempDir;

    private static RasterDescriptor int16Descriptor() {
        return RasterDescriptor.builder().shape(100, 50).rawType(ElementType.INT16).build();
    }

    private Path emptyFile(RasterDescriptor descriptor) throws IOException {
        return RasterFixtures.createEmptyFile(tempDir.resolve("out.bip"), descriptor.layout());
    }

    private static BipWriter writer(Path file, RasterDescriptor descriptor, BackendPolicy policy)
            throws IOException {
        return BipWriter.builder()
                .path(file)
                .descriptor(descriptor)
                .backendPolicy(policy)
                .build();
    }

    private static RasterArray readAll(Path file, RasterDescriptor descriptor) throws IOException {
        try (BipChipper chipper = BipChipper.builder()
                .path(file)
                .descriptor(descriptor)
                .backendPolicy(BackendPolicy.MANUAL)
                .build()) {
            return chipper.readAll();
        }
    }

    @ParameterizedTest
    @EnumSource(value = BackendPolicy.class, names = {"MAPPED", "MANUAL"})
    void testWriteBlocks(BackendPolicy policy) throws IOException {
        RasterDescriptor descriptor = int16Descriptor();
        Path file = emptyFile(descriptor);

        try (BipWriter writer = writer(file, descriptor, policy)) {
            assertEquals(policy.name(), writer.backendKind().name());
            for (int row = 0; row < 100; row += 20) {
                final int offset = row;
                SampleFunction values = (r, c, b) -> (r + offset) * 50 + c;
                writer.write(RasterFixtures.array(ElementType.INT16, 20, 50, 1, values), row, 0);
            }
            writer.write(RasterFixtures.array(ElementType.INT16, 3, 4, 1, (r, c, b) -> -1), 10, 20);
        }

        SampleFunction expected =
                (r, c, b) -> r >= 10 && r < 13 && c >= 20 && c < 24 ? -1 : INT16_VALUES.value(r, c, b);
        assertEquals(RasterFixtures.array(ElementType.INT16, 100, 50, 1, expected), readAll(file, descriptor));
    }

    @Test
    void testWriteDefaultsToOrigin() throws IOException {
        RasterDescriptor descriptor = int16Descriptor();
        Path file = emptyFile(descriptor);

        try (BipWriter writer = BipWriter.open(file, descriptor)) {
            writer.write(RasterArray.ofShorts(ElementType.INT16, new short[][] {{7, 8}, {9, 10}}));
        }

        try (BipChipper chipper = BipChipper.open(file, descriptor)) {
            assertEquals(
                    RasterArray.ofShorts(ElementType.INT16, new short[][] {{7, 8, 0}, {9, 10, 0}}),
                    chipper.read(Window.of(0, 0, 2, 3)));
        }
    }

    @Test
    void testWriteConvertsByteOrderAndLayout() throws IOException {
        RasterDescriptor descriptor = int16Descriptor();
        Path file = emptyFile(descriptor);
        RasterArray block = RasterFixtures.array(ElementType.INT16, 50, 100, 1, (r, c, b) -> c * 50 + r)
                .withOrder(ByteOrder.LITTLE_ENDIAN);

        try (BipWriter writer = writer(file, descriptor, BackendPolicy.MANUAL)) {
            writer.write(block.transpose());
        }

        assertEquals(RasterFixtures.array(ElementType.INT16, 100, 50, 1, INT16_VALUES), readAll(file, descriptor));
        assertEquals(0, Files.readAllBytes(file)[0]);
        assertEquals(1, Files.readAllBytes(file)[3]);
    }

    @Test
    void testTypeMismatchWritesNothing() throws IOException {
        RasterDescriptor descriptor =
                RasterDescriptor.builder().shape(10, 10).rawType(ElementType.UINT8).build();
        Path file = RasterFixtures.createFile(tempDir.resolve("uint8.bip"), descriptor.layout(), (r, c, b) -> r + c);
        byte[] before = Files.readAllBytes(file);

        try (BipWriter writer = BipWriter.open(file, descriptor)) {
            RasterArray doubles = RasterFixtures.array(ElementType.FLOAT64, 2, 2, 1, (r, c, b) -> 0.5);
            ElementTypeMismatchException e =
                    assertThrows(ElementTypeMismatchException.class, () -> writer.write(doubles, 0, 0));
            assertEquals(ElementType.UINT8, e.getExpected());
            assertEquals(ElementType.FLOAT64, e.getActual());
            assertFalse(writer.hasFailed());
        }

        assertThat(Files.readAllBytes(file)).isEqualTo(before);
    }

    @Test
    void testInvalidBlocksWriteNothing() throws IOException {
        RasterDescriptor descriptor = int16Descriptor();
        Path file = RasterFixtures.createFile(tempDir.resolve("int16.bip"), descriptor.layout(), INT16_VALUES);
        byte[] before = Files.readAllBytes(file);

        try (BipWriter writer = BipWriter.open(file, descriptor)) {
            RasterArray block = RasterFixtures.array(ElementType.INT16, 5, 5, 1, (r, c, b) -> 1);
            RasterArray twoBands = RasterFixtures.array(ElementType.INT16, 5, 5, 2, (r, c, b) -> 1);
            assertThrows(WindowOutOfBoundsException.class, () -> writer.write(block, 96, 0));
            assertThrows(WindowOutOfBoundsException.class, () -> writer.write(block, 0, 46));
            assertThrows(WindowOutOfBoundsException.class, () -> writer.write(block, -1, 0));
            assertThrows(IllegalArgumentException.class, () -> writer.write(twoBands, 0, 0));
            assertFalse(writer.hasFailed());
        }

        assertThat(Files.readAllBytes(file)).isEqualTo(before);
    }

    @ParameterizedTest
    @EnumSource(value = BackendPolicy.class, names = {"MAPPED", "MANUAL"})
    void testWriteWithSymmetry(BackendPolicy policy) throws IOException {
        final int rows = 6;
        final int cols = 4;
        RasterDescriptor descriptor = RasterDescriptor.builder()
                .shape(rows, cols)
                .rawType(ElementType.INT32)
                .symmetry(Symmetry.of(true, true, true))
                .build();
        Path file = emptyFile(descriptor);
        SampleFunction logical = (r, c, b) -> 10 * r + c;

        try (BipWriter writer = writer(file, descriptor, policy)) {
            writer.write(RasterFixtures.array(ElementType.INT32, 3, 4, 1, logical), 0, 0);
            SampleFunction bottom = (r, c, b) -> logical.value(r + 3, c, b);
            SampleFunction negated = (r, c, b) -> -logical.value(r + 1, c + 1, b);
            writer.write(RasterFixtures.array(ElementType.INT32, 3, 4, 1, bottom), 3, 0);
            writer.write(RasterFixtures.array(ElementType.INT32, 2, 2, 1, negated), 1, 1);
        }

        SampleFunction expected = (r, c, b) ->
                r >= 1 && r < 3 && c >= 1 && c < 3 ? -logical.value(r, c, b) : logical.value(r, c, b);
        assertEquals(RasterFixtures.array(ElementType.INT32, rows, cols, 1, expected), readAll(file, descriptor));

        // logical (r, c) is stored at raw (cols - 1 - c, rows - 1 - r)
        RasterDescriptor raw = RasterDescriptor.builder().shape(cols, rows).rawType(ElementType.INT32).build();
        SampleFunction stored = (i, j, b) -> expected.value(rows - 1 - j, cols - 1 - i, b);
        assertEquals(RasterFixtures.array(ElementType.INT32, cols, rows, 1, stored), readAll(file, raw));
    }

    @Test
    void testWriteAdjacentPairComplex() throws IOException {
        RasterDescriptor raw = RasterDescriptor.builder()
                .shape(100, 50)
                .rawType(ElementType.FLOAT32)
                .byteOrder(ByteOrder.LITTLE_ENDIAN)
                .bands(2)
                .build();
        RasterDescriptor complex = raw.toBuilder()
                .bands(1)
                .composer(BandComposer.adjacentPair())
                .build();
        Path file = emptyFile(raw);
        float[][] real = new float[100][50];
        float[][] imaginary = new float[100][50];
        for (int r = 0; r < 100; r++) {
            for (int c = 0; c < 50; c++) {
                real[r][c] = r * 0.5f + c;
                imaginary[r][c] = -(c * 0.25f) - r;
            }
        }
        RasterArray samples = RasterArray.ofComplex(real, imaginary);

        try (BipWriter writer = BipWriter.open(file, complex)) {
            writer.write(samples);
            assertThrows(
                    ElementTypeMismatchException.class,
                    () -> writer.write(RasterArray.ofFloats(new float[][] {{1f}}), 0, 0));
        }

        RasterArray bands = readAll(file, raw);
        assertEquals(ElementType.FLOAT32, bands.type());
        assertEquals(2, bands.bands());
        for (int r = 0; r < 100; r++) {
            for (int c = 0; c < 50; c++) {
                assertEquals(real[r][c], bands.getFloat(r, c, 0));
                assertEquals(imaginary[r][c], bands.getFloat(r, c, 1));
            }
        }

        try (BipChipper chipper = BipChipper.open(file, complex)) {
            RasterArray read = chipper.readAll();
            assertEquals(ElementType.COMPLEX64, read.type());
            assertEquals(samples, read);
        }
    }

    @Test
    void testWriteAdjacentPairConvertsDoublePrecision() throws IOException {
        RasterDescriptor raw = RasterDescriptor.builder()
                .shape(4, 3)
                .rawType(ElementType.FLOAT32)
                .bands(2)
                .build();
        RasterDescriptor complex =
                raw.toBuilder().bands(1).composer(BandComposer.adjacentPair()).build();
        Path file = emptyFile(raw);
        RasterArray wide = RasterArray.allocate(ElementType.COMPLEX128, ByteOrder.BIG_ENDIAN, 2, 3, 1);
        for (int c = 0; c < 3; c++) {
            wide.setComplex(0, c, 0, 0.5 * c, 100);
            wide.setComplex(1, c, 0, 7, -0.25 * c);
        }

        try (BipWriter writer = BipWriter.open(file, complex)) {
            writer.write(wide, 2, 0);
        }

        RasterArray bands = readAll(file, raw);
        assertEquals(1f, bands.getFloat(2, 2, 0));
        assertEquals(100f, bands.getFloat(2, 2, 1));
        assertEquals(7f, bands.getFloat(3, 2, 0));
        assertEquals(-0.5f, bands.getFloat(3, 2, 1));
        assertEquals(0f, bands.getFloat(0, 0, 0));
    }

    @ParameterizedTest
    @EnumSource(value = BackendPolicy.class, names = {"MAPPED", "MANUAL"})
    void testTransformRoundTrip(BackendPolicy policy) throws IOException {
        RasterDescriptor descriptor = RasterDescriptor.builder()
                .shape(12, 7)
                .rawType(ElementType.INT16)
                .symmetry(Symmetry.of(true, false, true))
                .composer(BandComposer.transform(int16Complex()))
                .build();
        Path file = emptyFile(descriptor);
        RasterArray samples = RasterArray.allocate(ElementType.COMPLEX64, ByteOrder.BIG_ENDIAN, 12, 7, 1);
        for (int r = 0; r < 12; r++) {
            for (int c = 0; c < 7; c++) {
                samples.setComplex(r, c, 0, r * 7 + c, -r - 100 * c);
            }
        }

        try (BipWriter writer = writer(file, descriptor, policy)) {
            writer.write(samples);
        }

        try (BipChipper chipper = BipChipper.builder()
                .path(file)
                .descriptor(descriptor)
                .backendPolicy(policy)
                .build()) {
            assertEquals(samples, chipper.readAll());
            RasterArray window = chipper.read(Window.of(3, 2, 4, 3));
            assertEquals(samples.getReal(3, 2, 0), window.getReal(0, 0, 0));
            assertEquals(samples.getImaginary(6, 4, 0), window.getImaginary(3, 2, 0));
        }

        // logical (r, c) is stored at raw (c, rows - 1 - r), re and im as two INT16 bands
        RasterDescriptor raw = RasterDescriptor.builder()
                .shape(7, 12)
                .rawType(ElementType.INT16)
                .bands(2)
                .build();
        RasterArray stored = readAll(file, raw);
        assertEquals(3 * 7 + 2, stored.getLong(2, 11 - 3, 0));
        assertEquals(-3 - 200, stored.getLong(2, 11 - 3, 1));
    }

    @Test
    void testRejectedTransformOutputWritesNothing() throws IOException {
        SampleTransform threeBands = SampleTransform.of(
                ElementType.COMPLEX64,
                raw -> raw,
                domain -> RasterArray.allocate(
                        ElementType.INT16, ByteOrder.BIG_ENDIAN, domain.rows(), domain.cols(), 3));
        RasterDescriptor descriptor = RasterDescriptor.builder()
                .shape(4, 4)
                .rawType(ElementType.INT16)
                .composer(BandComposer.transform(threeBands))
                .build();
        Path file = RasterFixtures.createFile(
                tempDir.resolve("transform.bip"), descriptor.layout(), (r, c, b) -> r + c + b);
        byte[] before = Files.readAllBytes(file);
        RasterArray block = RasterArray.allocate(ElementType.COMPLEX64, ByteOrder.BIG_ENDIAN, 2, 2, 1);

        try (BipWriter writer = BipWriter.open(file, descriptor)) {
            IllegalArgumentException e =
                    assertThrows(IllegalArgumentException.class, () -> writer.write(block, 1, 1));
            assertThat(e).hasMessageContaining("2x2x2");
            assertFalse(writer.hasFailed());
        }

        assertThat(Files.readAllBytes(file)).isEqualTo(before);
    }

    /**
     * INT16 real and imaginary bands composed into COMPLEX64, rounding back to INT16 on write.
     */
    private static SampleTransform int16Complex() {
        return SampleTransform.of(
                ElementType.COMPLEX64,
                raw -> {
                    RasterArray out = RasterArray.allocate(
                            ElementType.COMPLEX64, raw.order(), raw.rows(), raw.cols(), raw.bands() / 2);
                    for (int r = 0; r < raw.rows(); r++) {
                        for (int c = 0; c < raw.cols(); c++) {
                            for (int b = 0; b < out.bands(); b++) {
                                out.setComplex(r, c, b, raw.getLong(r, c, 2 * b), raw.getLong(r, c, 2 * b + 1));
                            }
                        }
                    }
                    return out;
                },
                domain -> {
                    RasterArray out = RasterArray.allocate(
                            ElementType.INT16, domain.order(), domain.rows(), domain.cols(), 2 * domain.bands());
                    for (int r = 0; r < domain.rows(); r++) {
                        for (int c = 0; c < domain.cols(); c++) {
                            for (int b = 0; b < domain.bands(); b++) {
                                out.setLong(r, c, 2 * b, Math.round(domain.getReal(r, c, b)));
                                out.setLong(r, c, 2 * b + 1, Math.round(domain.getImaginary(r, c, b)));
                            }
                        }
                    }
                    return out;
                });
    }

    @Test
    void testFailedWriteStillCloses() throws IOException {
        RasterDescriptor descriptor = int16Descriptor();
        Path file = emptyFile(descriptor);
        FileMapper readOnly = (channel, mode, position, size) -> channel.map(MapMode.READ_ONLY, position, size);

        BipWriter writer = BipWriter.builder()
                .path(file)
                .descriptor(descriptor)
                .backendPolicy(BackendPolicy.MAPPED)
                .fileMapper(readOnly)
                .build();
        RasterArray block = RasterFixtures.array(ElementType.INT16, 2, 50, 1, INT16_VALUES);

        assertThrows(ReadOnlyBufferException.class, () -> writer.write(block, 0, 0));
        assertTrue(writer.hasFailed());

        writer.close();
        assertTrue(writer.isClosed());
        writer.close();
        assertThrows(IllegalStateException.class, () -> writer.write(block, 0, 0));
    }

    @ParameterizedTest
    @EnumSource(value = BackendPolicy.class, names = {"MAPPED", "MANUAL"})
    void testConcurrentWritersOnDisjointRows(BackendPolicy policy) throws Exception {
        RasterDescriptor descriptor = int16Descriptor();
        Path file = emptyFile(descriptor);
        final int writers = 4;
        final int rowsPerWriter = 100 / writers;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                final int firstRow = w * rowsPerWriter;
                futures.add(executor.submit(() -> {
                    try (BipWriter writer = writer(file, descriptor, policy)) {
                        for (int row = firstRow; row < firstRow + rowsPerWriter; row += 5) {
                            final int offset = row;
                            SampleFunction values = (r, c, b) -> INT16_VALUES.value(r + offset, c, b);
                            writer.write(RasterFixtures.array(ElementType.INT16, 5, 50, 1, values), row, 0);
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(RasterFixtures.array(ElementType.INT16, 100, 50, 1, INT16_VALUES), readAll(file, descriptor));
    }

    @Test
    void testWriterExtendsShortFile() throws IOException {
        RasterDescriptor descriptor = int16Descriptor();
        Path file = Files.createFile(tempDir.resolve("new.bip"));

        try (BipWriter writer = writer(file, descriptor, BackendPolicy.MANUAL)) {
            assertEquals(BackendKind.MANUAL, writer.backendKind());
            writer.write(RasterFixtures.array(ElementType.INT16, 100, 50, 1, INT16_VALUES));
        }

        assertEquals(descriptor.layout().endOffset(), Files.size(file));
        assertEquals(RasterFixtures.array(ElementType.INT16, 100, 50, 1, INT16_VALUES), readAll(file, descriptor));
    }

    @Test
    void testMissingFile() {
        Path missing = tempDir.resolve("missing.bip");
        assertThrows(NoSuchFileException.class, () -> BipWriter.open(missing, int16Descriptor()));
        assertThat(missing).doesNotExist();
    }
}
