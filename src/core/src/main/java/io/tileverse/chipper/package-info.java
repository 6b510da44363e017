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
/**
 * Out-of-core window access to band interleaved by pixel (BIP) raster files, such as complex radar imagery.
 * <p>
 * A raster is described once by a {@link io.tileverse.chipper.RasterDescriptor}: logical shape, raw element type and
 * byte order, offset of the first sample, band count, {@link io.tileverse.chipper.symmetry.Symmetry orientation} and
 * {@link io.tileverse.chipper.compose.BandComposer band composition}. A {@link io.tileverse.chipper.BipChipper} then
 * reads rectangular, strided or reversed windows of it, and a {@link io.tileverse.chipper.BipWriter} writes blocks
 * back into a pre-existing file.
 *
 * <h2>Key Classes</h2>
 * <ul>
 * <li>{@link io.tileverse.chipper.BipChipper} - reads windows as {@link io.tileverse.chipper.array.RasterArray}s</li>
 * <li>{@link io.tileverse.chipper.BipWriter} - writes blocks at logical positions</li>
 * <li>{@link io.tileverse.chipper.range.Window} / {@link io.tileverse.chipper.range.AxisRange} - window requests
 *     with {@code start:stop:step} semantics per axis</li>
 * <li>{@link io.tileverse.chipper.backend.StorageBackend} - memory-mapped or manual positioned file access, chosen
 *     once per instance</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RasterDescriptor descriptor = RasterDescriptor.builder()
 *         .shape(rows, cols)
 *         .rawType(ElementType.FLOAT32)
 *         .byteOffset(headerLength)
 *         .composer(BandComposer.adjacentPair())
 *         .build();
 *
 * try (BipChipper chipper = BipChipper.open(path, descriptor)) {
 *     // every other row of the first 1000, columns 500 down to 0
 *     RasterArray chip = chipper.read(AxisRange.of(0, 1000, 2), AxisRange.reversedFrom(500));
 *     double re = chip.getReal(0, 0, 0);
 *     double im = chip.getImaginary(0, 0, 0);
 * }
 * }</pre>
 *
 * <h2>Errors</h2>
 * <ul>
 * <li>{@link java.io.IOException}s when the file can't be opened, read or written</li>
 * <li>{@link io.tileverse.chipper.RasterConfigurationException} for inconsistent raster descriptions</li>
 * <li>{@link io.tileverse.chipper.range.WindowOutOfBoundsException} for windows outside the raster, never
 *     clamped</li>
 * <li>{@link io.tileverse.chipper.array.ElementTypeMismatchException} for arrays of the wrong element type</li>
 * </ul>
 */
package io.tileverse.chipper;
