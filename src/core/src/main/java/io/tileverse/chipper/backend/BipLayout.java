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

import static java.util.Objects.requireNonNull;

import io.tileverse.chipper.array.ElementType;
import java.nio.ByteOrder;

/**
 * Band interleaved by pixel layout of a raster inside a file: rows are stored one after the other, each row stores
 * its pixels one after the other, and each pixel stores all of its bands contiguously. No padding is assumed between
 * rows or pixels.
 *
 * @param rows number of raw rows
 * @param cols number of raw columns, the per-row pixel count
 * @param bands number of raw bands per pixel
 * @param type raw element type
 * @param order raw byte order
 * @param byteOffset position of the first sample in the file
 */
public record BipLayout(int rows, int cols, int bands, ElementType type, ByteOrder order, long byteOffset) {

    public BipLayout {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("rows and cols must be non-negative: %dx%d".formatted(rows, cols));
        }
        if (bands < 1) {
            throw new IllegalArgumentException("bands must be at least 1: " + bands);
        }
        requireNonNull(type, "type");
        requireNonNull(order, "order");
        if (byteOffset < 0) {
            throw new IllegalArgumentException("byteOffset can't be < 0: " + byteOffset);
        }
    }

    /**
     * @return bytes per pixel, all bands included
     */
    public int elementSize() {
        return type.size() * bands;
    }

    /**
     * @return bytes per row
     */
    public long rowStride() {
        return (long) elementSize() * cols;
    }

    /**
     * @return bytes occupied by the whole raster, excluding the leading offset
     */
    public long dataBytes() {
        return rowStride() * rows;
    }

    /**
     * @return the file position right after the last sample
     */
    public long endOffset() {
        return byteOffset + dataBytes();
    }

    /**
     * @return the file position of the first band of pixel {@code (row, col)}
     */
    public long offsetOf(int row, int col) {
        return byteOffset + row * rowStride() + (long) col * elementSize();
    }
}
