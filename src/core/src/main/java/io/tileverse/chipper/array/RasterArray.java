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

import static java.util.Objects.requireNonNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * A dense, in-memory three dimensional array of raster samples, indexed by {@code (row, col, band)}.
 * <p>
 * Samples are stored in a heap {@link ByteBuffer} whose {@link ByteBuffer#order() byte order} is the byte order of
 * the samples. An array is addressed through an element offset and per-axis strides, so {@link #transpose()} and
 * {@link #flip(int)} return views sharing the same storage. The band axis always has a stride of one element: all the
 * bands of one pixel are adjacent, as in the band interleaved by pixel file layout.
 * <p>
 * A <em>contiguous</em> array stores its elements in row-major order, starting at the beginning of its buffer, which
 * is the layout the storage backends read and write. {@link #contiguous()} copies any view into that layout.
 * <p>
 * Instances are not thread-safe: setters write through to the shared buffer.
 */
public final class RasterArray {

    private final ElementType type;
    private final ByteBuffer buffer;
    private final int rows;
    private final int cols;
    private final int bands;
    private final int offset;
    private final int rowStride;
    private final int colStride;

    private RasterArray(
            ElementType type,
            ByteBuffer buffer,
            int rows,
            int cols,
            int bands,
            int offset,
            int rowStride,
            int colStride) {
        this.type = type;
        this.buffer = buffer;
        this.rows = rows;
        this.cols = cols;
        this.bands = bands;
        this.offset = offset;
        this.rowStride = rowStride;
        this.colStride = colStride;
    }

    /**
     * Allocates a zero filled contiguous array.
     *
     * @param type the element type
     * @param order the byte order of the samples
     * @param rows number of rows, non-negative
     * @param cols number of columns, non-negative
     * @param bands number of bands, at least one
     * @return a new contiguous array
     * @throws IllegalArgumentException if the shape is invalid or the array would exceed {@code Integer.MAX_VALUE}
     *     bytes
     */
    public static RasterArray allocate(ElementType type, ByteOrder order, int rows, int cols, int bands) {
        requireNonNull(type, "type");
        requireNonNull(order, "order");
        int byteCount = checkedByteCount(type, rows, cols, bands);
        ByteBuffer buffer = ByteBuffer.allocate(byteCount).order(order);
        return new RasterArray(type, buffer, rows, cols, bands, 0, cols * bands, bands);
    }

    /**
     * Wraps the remaining bytes of {@code data} as a contiguous array, using the buffer's byte order.
     * <p>
     * The buffer content is shared, its position and limit are not modified.
     *
     * @param type the element type
     * @param data the sample bytes, row-major, band interleaved by pixel
     * @param rows number of rows
     * @param cols number of columns
     * @param bands number of bands
     * @return a contiguous array backed by {@code data}
     * @throws IllegalArgumentException if the remaining byte count does not match the shape
     */
    public static RasterArray wrap(ElementType type, ByteBuffer data, int rows, int cols, int bands) {
        requireNonNull(type, "type");
        requireNonNull(data, "data");
        int byteCount = checkedByteCount(type, rows, cols, bands);
        if (data.remaining() != byteCount) {
            throw new IllegalArgumentException("Expected %,d bytes for a %dx%dx%d %s array, got %,d"
                    .formatted(byteCount, rows, cols, bands, type, data.remaining()));
        }
        ByteBuffer slice = data.slice().order(data.order());
        return new RasterArray(type, slice, rows, cols, bands, 0, cols * bands, bands);
    }

    public static RasterArray ofBytes(ElementType type, byte[][] values) {
        if (type != ElementType.INT8 && type != ElementType.UINT8) {
            throw new IllegalArgumentException("byte values require INT8 or UINT8, got " + type);
        }
        RasterArray array = allocateFor(type, values.length, width(values.length, i -> values[i].length));
        for (int r = 0; r < array.rows; r++) {
            checkRowLength(values[r].length, array.cols, r);
            for (int c = 0; c < array.cols; c++) {
                array.buffer.put(array.byteIndex(r, c, 0), values[r][c]);
            }
        }
        return array;
    }

    public static RasterArray ofShorts(ElementType type, short[][] values) {
        if (type != ElementType.INT16 && type != ElementType.UINT16) {
            throw new IllegalArgumentException("short values require INT16 or UINT16, got " + type);
        }
        RasterArray array = allocateFor(type, values.length, width(values.length, i -> values[i].length));
        for (int r = 0; r < array.rows; r++) {
            checkRowLength(values[r].length, array.cols, r);
            for (int c = 0; c < array.cols; c++) {
                array.buffer.putShort(array.byteIndex(r, c, 0), values[r][c]);
            }
        }
        return array;
    }

    public static RasterArray ofInts(int[][] values) {
        RasterArray array = allocateFor(ElementType.INT32, values.length, width(values.length, i -> values[i].length));
        for (int r = 0; r < array.rows; r++) {
            checkRowLength(values[r].length, array.cols, r);
            for (int c = 0; c < array.cols; c++) {
                array.buffer.putInt(array.byteIndex(r, c, 0), values[r][c]);
            }
        }
        return array;
    }

    public static RasterArray ofFloats(float[][] values) {
        RasterArray array =
                allocateFor(ElementType.FLOAT32, values.length, width(values.length, i -> values[i].length));
        for (int r = 0; r < array.rows; r++) {
            checkRowLength(values[r].length, array.cols, r);
            for (int c = 0; c < array.cols; c++) {
                array.buffer.putFloat(array.byteIndex(r, c, 0), values[r][c]);
            }
        }
        return array;
    }

    public static RasterArray ofDoubles(double[][] values) {
        RasterArray array =
                allocateFor(ElementType.FLOAT64, values.length, width(values.length, i -> values[i].length));
        for (int r = 0; r < array.rows; r++) {
            checkRowLength(values[r].length, array.cols, r);
            for (int c = 0; c < array.cols; c++) {
                array.buffer.putDouble(array.byteIndex(r, c, 0), values[r][c]);
            }
        }
        return array;
    }

    /**
     * Builds a single band {@link ElementType#COMPLEX64} array from its real and imaginary parts.
     *
     * @param real real parts, {@code real[row][col]}
     * @param imaginary imaginary parts, same shape as {@code real}
     * @return a new contiguous array in native byte order
     */
    public static RasterArray ofComplex(float[][] real, float[][] imaginary) {
        if (real.length != imaginary.length) {
            throw new IllegalArgumentException("real and imaginary parts differ in row count");
        }
        RasterArray array = allocateFor(ElementType.COMPLEX64, real.length, width(real.length, i -> real[i].length));
        for (int r = 0; r < array.rows; r++) {
            checkRowLength(real[r].length, array.cols, r);
            checkRowLength(imaginary[r].length, array.cols, r);
            for (int c = 0; c < array.cols; c++) {
                array.setComplex(r, c, 0, real[r][c], imaginary[r][c]);
            }
        }
        return array;
    }

    public ElementType type() {
        return type;
    }

    public ByteOrder order() {
        return buffer.order();
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int bands() {
        return bands;
    }

    /**
     * @return {@code rows * cols * bands}
     */
    public int elementCount() {
        return rows * cols * bands;
    }

    /**
     * @return the number of bytes a contiguous copy of this array occupies
     */
    public int byteCount() {
        return elementCount() * type.size();
    }

    public boolean isEmpty() {
        return elementCount() == 0;
    }

    /**
     * Whether the elements of this array are laid out row-major, band interleaved by pixel, from the beginning of the
     * backing buffer.
     *
     * @return {@code true} if {@link #contiguous()} would return this same instance
     */
    public boolean isContiguous() {
        return offset == 0 && colStride == bands && rowStride == cols * bands;
    }

    public long getLong(int row, int col, int band) {
        int i = byteIndex(row, col, band);
        return switch (type) {
            case INT8 -> buffer.get(i);
            case UINT8 -> buffer.get(i) & 0xFFL;
            case INT16 -> buffer.getShort(i);
            case UINT16 -> buffer.getShort(i) & 0xFFFFL;
            case INT32 -> buffer.getInt(i);
            case UINT32 -> buffer.getInt(i) & 0xFFFFFFFFL;
            case INT64 -> buffer.getLong(i);
            case FLOAT32 -> (long) buffer.getFloat(i);
            case FLOAT64 -> (long) buffer.getDouble(i);
            case COMPLEX64, COMPLEX128 -> throw new IllegalStateException("Use getReal/getImaginary for " + type);
        };
    }

    public double getDouble(int row, int col, int band) {
        int i = byteIndex(row, col, band);
        return switch (type) {
            case FLOAT32 -> buffer.getFloat(i);
            case FLOAT64 -> buffer.getDouble(i);
            case COMPLEX64, COMPLEX128 -> throw new IllegalStateException("Use getReal/getImaginary for " + type);
            default -> getLong(row, col, band);
        };
    }

    public float getFloat(int row, int col, int band) {
        return (float) getDouble(row, col, band);
    }

    /**
     * Returns the real part of a sample; for real valued types this is the sample value itself.
     */
    public double getReal(int row, int col, int band) {
        int i = byteIndex(row, col, band);
        return switch (type) {
            case COMPLEX64 -> buffer.getFloat(i);
            case COMPLEX128 -> buffer.getDouble(i);
            default -> getDouble(row, col, band);
        };
    }

    /**
     * Returns the imaginary part of a sample; zero for real valued types.
     */
    public double getImaginary(int row, int col, int band) {
        int i = byteIndex(row, col, band);
        return switch (type) {
            case COMPLEX64 -> buffer.getFloat(i + Float.BYTES);
            case COMPLEX128 -> buffer.getDouble(i + Double.BYTES);
            default -> 0d;
        };
    }

    public void setLong(int row, int col, int band, long value) {
        int i = byteIndex(row, col, band);
        switch (type) {
            case INT8, UINT8 -> buffer.put(i, (byte) value);
            case INT16, UINT16 -> buffer.putShort(i, (short) value);
            case INT32, UINT32 -> buffer.putInt(i, (int) value);
            case INT64 -> buffer.putLong(i, value);
            case FLOAT32 -> buffer.putFloat(i, value);
            case FLOAT64 -> buffer.putDouble(i, value);
            case COMPLEX64, COMPLEX128 -> setComplex(row, col, band, value, 0);
        }
    }

    public void setDouble(int row, int col, int band, double value) {
        int i = byteIndex(row, col, band);
        switch (type) {
            case FLOAT32 -> buffer.putFloat(i, (float) value);
            case FLOAT64 -> buffer.putDouble(i, value);
            case COMPLEX64, COMPLEX128 -> setComplex(row, col, band, value, 0);
            default -> setLong(row, col, band, (long) value);
        }
    }

    public void setComplex(int row, int col, int band, double real, double imaginary) {
        int i = byteIndex(row, col, band);
        switch (type) {
            case COMPLEX64 -> {
                buffer.putFloat(i, (float) real);
                buffer.putFloat(i + Float.BYTES, (float) imaginary);
            }
            case COMPLEX128 -> {
                buffer.putDouble(i, real);
                buffer.putDouble(i + Double.BYTES, imaginary);
            }
            default -> throw new IllegalStateException(type + " is not a complex type");
        }
    }

    /**
     * Returns a view with rows and columns swapped. Bands are unaffected.
     */
    public RasterArray transpose() {
        return new RasterArray(type, buffer, cols, rows, bands, offset, colStride, rowStride);
    }

    /**
     * Returns a view reversed along one spatial axis.
     *
     * @param axis {@code 0} to reverse the row order, {@code 1} to reverse the column order
     */
    public RasterArray flip(int axis) {
        return switch (axis) {
            case 0 -> rows == 0
                    ? this
                    : new RasterArray(
                            type, buffer, rows, cols, bands, offset + (rows - 1) * rowStride, -rowStride, colStride);
            case 1 -> cols == 0
                    ? this
                    : new RasterArray(
                            type, buffer, rows, cols, bands, offset + (cols - 1) * colStride, rowStride, -colStride);
            default -> throw new IllegalArgumentException("axis must be 0 or 1: " + axis);
        };
    }

    /**
     * Returns this array if it is already {@link #isContiguous() contiguous}, or a contiguous copy otherwise. The
     * copy keeps the element type and byte order.
     */
    public RasterArray contiguous() {
        return isContiguous() ? this : copy();
    }

    /**
     * @return a contiguous deep copy of this array
     */
    public RasterArray copy() {
        RasterArray target = allocate(type, order(), rows, cols, bands);
        final int size = type.size();
        int t = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int s = byteIndex(r, c, 0);
                int pixelBytes = bands * size;
                target.buffer.put(t, buffer, s, pixelBytes);
                t += pixelBytes;
            }
        }
        return target;
    }

    /**
     * Reinterprets the bytes of this array as another element type and band count, sharing storage.
     * <p>
     * Used to view {@code n} interleaved real/imaginary float bands as {@code n / 2} complex samples and back; the
     * byte count per pixel must be preserved.
     *
     * @param newType the element type of the view
     * @param newBands the band count of the view
     * @return a contiguous view over the bytes of {@link #contiguous()}
     * @throws IllegalArgumentException if the pixel byte count differs
     */
    public RasterArray reinterpret(ElementType newType, int newBands) {
        requireNonNull(newType, "newType");
        if (newBands < 1 || (long) newBands * newType.size() != (long) bands * type.size()) {
            throw new IllegalArgumentException("Can't view %d %s bands as %d %s bands"
                    .formatted(bands, type, newBands, newType));
        }
        RasterArray source = contiguous();
        return new RasterArray(newType, source.buffer, rows, cols, newBands, 0, cols * newBands, newBands);
    }

    /**
     * Returns a contiguous array holding the same values encoded in the requested byte order.
     * <p>
     * Bytes are swapped per component (real and imaginary parts separately for complex types), so floating point
     * payloads are preserved bit for bit.
     */
    public RasterArray withOrder(ByteOrder order) {
        requireNonNull(order, "order");
        RasterArray source = contiguous();
        if (order.equals(order())) {
            return source;
        }
        RasterArray target = allocate(type, order, rows, cols, bands);
        final int component = type.isComplex() ? type.size() / 2 : type.size();
        final int length = source.byteCount();
        for (int base = 0; base < length; base += component) {
            for (int k = 0; k < component; k++) {
                target.buffer.put(base + k, source.buffer.get(base + component - 1 - k));
            }
        }
        return target;
    }

    /**
     * Returns a read-only buffer over the bytes of a contiguous array, positioned at zero with the limit set to
     * {@link #byteCount()}.
     *
     * @throws IllegalStateException if this array is not contiguous
     */
    public ByteBuffer contiguousBytes() {
        if (!isContiguous()) {
            throw new IllegalStateException("Array is not contiguous, call contiguous() first");
        }
        return buffer.asReadOnlyBuffer().position(0).limit(byteCount()).slice().order(order());
    }

    /**
     * Two arrays are equal when they have the same element type, the same shape, and bit-identical samples, no
     * matter their byte order or memory layout.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RasterArray other)) {
            return false;
        }
        if (type != other.type || rows != other.rows || cols != other.cols || bands != other.bands) {
            return false;
        }
        ByteBuffer mine = withOrder(ByteOrder.BIG_ENDIAN).contiguousBytes();
        ByteBuffer theirs = other.withOrder(ByteOrder.BIG_ENDIAN).contiguousBytes();
        return mine.equals(theirs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, rows, cols, bands, withOrder(ByteOrder.BIG_ENDIAN).contiguousBytes());
    }

    @Override
    public String toString() {
        return "RasterArray[%s %dx%dx%d %s]".formatted(type, rows, cols, bands, order());
    }

    private int byteIndex(int row, int col, int band) {
        Objects.checkIndex(row, rows);
        Objects.checkIndex(col, cols);
        Objects.checkIndex(band, bands);
        return (offset + row * rowStride + col * colStride + band) * type.size();
    }

    private static int checkedByteCount(ElementType type, int rows, int cols, int bands) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("rows and cols must be non-negative: %dx%d".formatted(rows, cols));
        }
        if (bands < 1) {
            throw new IllegalArgumentException("bands must be at least 1: " + bands);
        }
        long bytes = (long) rows * cols * bands * type.size();
        if (bytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "A %dx%dx%d %s array exceeds %,d bytes".formatted(rows, cols, bands, type, Integer.MAX_VALUE));
        }
        return (int) bytes;
    }

    private static RasterArray allocateFor(ElementType type, int rows, int cols) {
        return allocate(type, ByteOrder.nativeOrder(), rows, cols, 1);
    }

    private static int width(int rows, IntUnaryOperator rowLength) {
        return rows == 0 ? 0 : rowLength.applyAsInt(0);
    }

    private static void checkRowLength(int length, int expected, int row) {
        if (length != expected) {
            throw new IllegalArgumentException(
                    "Array is not rectangular: row %d has %d columns, expected %d".formatted(row, length, expected));
        }
    }
}
