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
package io.tileverse.chipper.array;

/**
 * Fixed-width element types a raster sample can be stored as.
 * <p>
 * Byte order is not part of the element type, it is carried by the {@link RasterArray} holding the samples and by
 * the raster descriptor for the on-disk representation.
 */
public enum ElementType {
    INT8(1, false, false),
    UINT8(1, false, true),
    INT16(2, false, false),
    UINT16(2, false, true),
    INT32(4, false, false),
    UINT32(4, false, true),
    INT64(8, false, false),
    FLOAT32(4, true, false),
    FLOAT64(8, true, false),
    COMPLEX64(8, true, false),
    COMPLEX128(16, true, false);

    private final int size;
    private final boolean floatingPoint;
    private final boolean unsigned;

    ElementType(int size, boolean floatingPoint, boolean unsigned) {
        this.size = size;
        this.floatingPoint = floatingPoint;
        this.unsigned = unsigned;
    }

    /**
     * @return the number of bytes one element occupies
     */
    public int size() {
        return size;
    }

    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    public boolean isComplex() {
        return this == COMPLEX64 || this == COMPLEX128;
    }

    /**
     * Returns the type of the real and imaginary parts of a complex type.
     *
     * @return {@link #FLOAT32} for {@link #COMPLEX64}, {@link #FLOAT64} for {@link #COMPLEX128}
     * @throws IllegalStateException if this type is not complex
     */
    public ElementType componentType() {
        return switch (this) {
            case COMPLEX64 -> FLOAT32;
            case COMPLEX128 -> FLOAT64;
            default -> throw new IllegalStateException(this + " is not a complex type");
        };
    }

    /**
     * Returns the complex type whose parts are of this floating point type.
     *
     * @return {@link #COMPLEX64} for {@link #FLOAT32}, {@link #COMPLEX128} for {@link #FLOAT64}
     * @throws IllegalStateException if this type is not a real floating point type
     */
    public ElementType complexType() {
        return switch (this) {
            case FLOAT32 -> COMPLEX64;
            case FLOAT64 -> COMPLEX128;
            default -> throw new IllegalStateException(this + " has no complex counterpart");
        };
    }
}
