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

import static java.util.Objects.requireNonNull;

import io.tileverse.chipper.array.ElementType;
import io.tileverse.chipper.backend.BipLayout;
import io.tileverse.chipper.compose.BandComposer;
import io.tileverse.chipper.symmetry.Symmetry;
import io.tileverse.chipper.symmetry.SymmetryTransform;
import java.nio.ByteOrder;

/**
 * Immutable description of a band interleaved by pixel raster: its logical shape, how its samples are encoded in
 * the file, how the file orientation relates to the logical one, and how raw bands compose into samples.
 * <p>
 * The shape is the logical one, after {@link Symmetry} is applied; the raw, on-disk shape is derived from it. The
 * band count is the number of <em>domain</em> bands; the number of bands stored per pixel is
 * {@link #rawBands()}, doubled for instance when adjacent bands compose into complex samples.
 *
 * <pre>{@code
 * RasterDescriptor descriptor = RasterDescriptor.builder()
 *         .shape(4096, 2048)
 *         .rawType(ElementType.FLOAT32)
 *         .byteOrder(ByteOrder.BIG_ENDIAN)
 *         .byteOffset(headerLength)
 *         .composer(BandComposer.adjacentPair())
 *         .build();
 * }</pre>
 */
public final class RasterDescriptor {

    private final int rows;
    private final int cols;
    private final ElementType rawType;
    private final ByteOrder byteOrder;
    private final long byteOffset;
    private final int bands;
    private final Symmetry symmetry;
    private final BandComposer composer;

    private RasterDescriptor(Builder builder) {
        this.rows = builder.rows;
        this.cols = builder.cols;
        this.rawType = builder.rawType;
        this.byteOrder = builder.byteOrder;
        this.byteOffset = builder.byteOffset;
        this.bands = builder.bands;
        this.symmetry = builder.symmetry;
        this.composer = builder.composer;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder initialized with the values of this descriptor
     */
    public Builder toBuilder() {
        return new Builder()
                .shape(rows, cols)
                .rawType(rawType)
                .byteOrder(byteOrder)
                .byteOffset(byteOffset)
                .bands(bands)
                .symmetry(symmetry)
                .composer(composer);
    }

    /**
     * @return number of logical rows
     */
    public int rows() {
        return rows;
    }

    /**
     * @return number of logical columns
     */
    public int cols() {
        return cols;
    }

    public int rawRows() {
        return symmetry.transpose() ? cols : rows;
    }

    public int rawCols() {
        return symmetry.transpose() ? rows : cols;
    }

    public ElementType rawType() {
        return rawType;
    }

    public ByteOrder byteOrder() {
        return byteOrder;
    }

    public long byteOffset() {
        return byteOffset;
    }

    public int bands() {
        return bands;
    }

    public int rawBands() {
        return composer.rawBands(bands);
    }

    public Symmetry symmetry() {
        return symmetry;
    }

    public BandComposer composer() {
        return composer;
    }

    /**
     * @return the on-disk layout of the raster
     */
    public BipLayout layout() {
        return new BipLayout(rawRows(), rawCols(), rawBands(), rawType, byteOrder, byteOffset);
    }

    public SymmetryTransform symmetryTransform() {
        return new SymmetryTransform(symmetry, rows, cols);
    }

    @Override
    public String toString() {
        return "RasterDescriptor[%dx%dx%d %s %s, offset=%d, %s, %s]"
                .formatted(rows, cols, bands, rawType, byteOrder, byteOffset, symmetry, composer);
    }

    /**
     * Builder for {@link RasterDescriptor}.
     */
    public static class Builder {
        private int rows = -1;
        private int cols = -1;
        private ElementType rawType;
        private ByteOrder byteOrder = ByteOrder.BIG_ENDIAN;
        private long byteOffset;
        private int bands = 1;
        private Symmetry symmetry = Symmetry.NONE;
        private BandComposer composer = BandComposer.none();

        private Builder() {}

        /**
         * Sets the logical shape, after symmetry is applied.
         *
         * @param rows number of logical rows
         * @param cols number of logical columns
         * @return this builder
         */
        public Builder shape(int rows, int cols) {
            this.rows = rows;
            this.cols = cols;
            return this;
        }

        public Builder rawType(ElementType rawType) {
            this.rawType = requireNonNull(rawType, "rawType");
            return this;
        }

        /**
         * Sets the byte order of the samples in the file, {@link ByteOrder#BIG_ENDIAN} by default.
         */
        public Builder byteOrder(ByteOrder byteOrder) {
            this.byteOrder = requireNonNull(byteOrder, "byteOrder");
            return this;
        }

        /**
         * Sets the position of the first sample in the file, zero by default.
         */
        public Builder byteOffset(long byteOffset) {
            this.byteOffset = byteOffset;
            return this;
        }

        /**
         * Sets the number of domain bands, one by default.
         */
        public Builder bands(int bands) {
            this.bands = bands;
            return this;
        }

        public Builder symmetry(Symmetry symmetry) {
            this.symmetry = requireNonNull(symmetry, "symmetry");
            return this;
        }

        /**
         * Sets the band composition policy, {@link BandComposer#none()} by default.
         */
        public Builder composer(BandComposer composer) {
            this.composer = requireNonNull(composer, "composer");
            return this;
        }

        /**
         * Validates and builds the descriptor.
         *
         * @return a new descriptor
         * @throws RasterConfigurationException if the shape was not set or is negative, the offset is negative, the
         *     band count is below one, the raw type was not set, or the composer does not support the raw type
         */
        public RasterDescriptor build() {
            if (rows < 0 || cols < 0) {
                throw new RasterConfigurationException(
                        "The raster shape must be set, with non-negative dimensions, got %dx%d".formatted(rows, cols));
            }
            if (rawType == null) {
                throw new RasterConfigurationException("The raw element type must be set");
            }
            if (byteOffset < 0) {
                throw new RasterConfigurationException("The byte offset can't be negative: " + byteOffset);
            }
            if (bands < 1) {
                throw new RasterConfigurationException("The band count must be at least 1: " + bands);
            }
            composer.validate(rawType);
            return new RasterDescriptor(this);
        }
    }
}
