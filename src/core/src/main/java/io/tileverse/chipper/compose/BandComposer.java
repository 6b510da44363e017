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
package io.tileverse.chipper.compose;

import io.tileverse.chipper.array.ElementType;
import io.tileverse.chipper.array.RasterArray;

/**
 * Merges raw bands into domain samples on read, and splits domain samples back into raw bands on write.
 * <p>
 * Three policies are available:
 * <ul>
 * <li>{@link #none()}: raw bands pass through, arrays must have exactly the raw element type;
 * <li>{@link #transform(SampleTransform)}: a caller supplied bidirectional mapping, whose outputs are type checked
 *     each time it is applied;
 * <li>{@link #adjacentPair()}: bands {@code 2k} and {@code 2k + 1} are the real and imaginary parts of one complex
 *     sample, the raw type must be the float type of matching width.
 * </ul>
 * A composer is stateless and may be shared between chippers and writers.
 */
public interface BandComposer {

    /**
     * The composition policy of a {@link BandComposer}.
     */
    enum Mode {
        NONE,
        TRANSFORM,
        ADJACENT_PAIR
    }

    /**
     * @return the passthrough composer
     */
    static BandComposer none() {
        return PassthroughComposer.INSTANCE;
    }

    /**
     * @return the adjacent band composer pairing {@link ElementType#FLOAT32} raw bands into
     *     {@link ElementType#COMPLEX64} samples
     */
    static BandComposer adjacentPair() {
        return adjacentPair(ElementType.COMPLEX64);
    }

    /**
     * @param complexType {@link ElementType#COMPLEX64} or {@link ElementType#COMPLEX128}
     * @return the adjacent band composer for the given complex width
     */
    static BandComposer adjacentPair(ElementType complexType) {
        return new AdjacentPairComposer(complexType);
    }

    static BandComposer transform(SampleTransform transform) {
        return new TransformComposer(transform);
    }

    Mode mode();

    /**
     * @param bands number of bands of a domain sample array
     * @return number of bands stored per pixel in the raw file
     */
    int rawBands(int bands);

    /**
     * Checks, before any I/O, that this composer can work with the given raw element type.
     *
     * @throws io.tileverse.chipper.RasterConfigurationException if the raw type is incompatible
     */
    void validate(ElementType rawType);

    /**
     * Read direction: turns raw samples into domain samples.
     *
     * @param raw samples as stored, with {@link #rawBands(int)} bands
     * @param rawType the declared raw element type
     * @throws io.tileverse.chipper.array.ElementTypeMismatchException if a transform produced the wrong type
     */
    RasterArray compose(RasterArray raw, ElementType rawType);

    /**
     * Write direction: turns domain samples into raw samples of the declared raw type.
     *
     * @param data the samples to write
     * @param rawType the declared raw element type
     * @throws io.tileverse.chipper.array.ElementTypeMismatchException if {@code data}, or the transform output, has
     *     the wrong type
     */
    RasterArray decompose(RasterArray data, ElementType rawType);
}
