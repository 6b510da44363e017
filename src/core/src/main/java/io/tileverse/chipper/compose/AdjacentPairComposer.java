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

import static java.util.Objects.requireNonNull;

import io.tileverse.chipper.RasterConfigurationException;
import io.tileverse.chipper.array.ElementType;
import io.tileverse.chipper.array.ElementTypeMismatchException;
import io.tileverse.chipper.array.RasterArray;

/**
 * Complex samples stored as adjacent real/imaginary float bands.
 * <p>
 * A pixel of {@code n} complex samples is stored as {@code 2n} floats: {@code re0, im0, re1, im1, ...}, which is also
 * the in-memory layout of a complex array, so composition reinterprets bytes instead of converting values.
 */
final class AdjacentPairComposer implements BandComposer {

    private final ElementType complexType;

    AdjacentPairComposer(ElementType complexType) {
        requireNonNull(complexType, "complexType");
        if (!complexType.isComplex()) {
            throw new IllegalArgumentException("Adjacent band pairs compose into a complex type, got " + complexType);
        }
        this.complexType = complexType;
    }

    @Override
    public Mode mode() {
        return Mode.ADJACENT_PAIR;
    }

    @Override
    public int rawBands(int bands) {
        return 2 * bands;
    }

    @Override
    public void validate(ElementType rawType) {
        if (rawType != complexType.componentType()) {
            throw new RasterConfigurationException(
                    "Adjacent band %s composition requires raw element type %s, declared raw type is %s"
                            .formatted(complexType, complexType.componentType(), rawType));
        }
    }

    @Override
    public RasterArray compose(RasterArray raw, ElementType rawType) {
        if (raw.type() != rawType) {
            throw new ElementTypeMismatchException(rawType, raw.type(), "raw read");
        }
        return raw.reinterpret(complexType, raw.bands() / 2);
    }

    @Override
    public RasterArray decompose(RasterArray data, ElementType rawType) {
        if (!data.type().isComplex()) {
            throw new ElementTypeMismatchException(complexType, data.type(), "data to write");
        }
        RasterArray complex = data.type() == complexType ? data : convert(data);
        return complex.reinterpret(complexType.componentType(), 2 * complex.bands());
    }

    private RasterArray convert(RasterArray data) {
        RasterArray converted =
                RasterArray.allocate(complexType, data.order(), data.rows(), data.cols(), data.bands());
        for (int r = 0; r < data.rows(); r++) {
            for (int c = 0; c < data.cols(); c++) {
                for (int b = 0; b < data.bands(); b++) {
                    converted.setComplex(r, c, b, data.getReal(r, c, b), data.getImaginary(r, c, b));
                }
            }
        }
        return converted;
    }

    @Override
    public String toString() {
        return "BandComposer[ADJACENT_PAIR " + complexType + "]";
    }
}
