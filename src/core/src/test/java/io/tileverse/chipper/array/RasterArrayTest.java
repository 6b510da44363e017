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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.junit.jupiter.api.Test;

class RasterArrayTest {

    @Test
    void testAllocate() {
        RasterArray array = RasterArray.allocate(ElementType.INT16, ByteOrder.LITTLE_ENDIAN, 3, 4, 2);
        assertEquals(3, array.rows());
        assertEquals(4, array.cols());
        assertEquals(2, array.bands());
        assertEquals(24, array.elementCount());
        assertEquals(48, array.byteCount());
        assertEquals(ByteOrder.LITTLE_ENDIAN, array.order());
        assertTrue(array.isContiguous());
        assertEquals(0, array.getLong(2, 3, 1));

        assertTrue(RasterArray.allocate(ElementType.UINT8, ByteOrder.BIG_ENDIAN, 0, 4, 1).isEmpty());
        assertThrows(
                IllegalArgumentException.class,
                () -> RasterArray.allocate(ElementType.UINT8, ByteOrder.BIG_ENDIAN, 2, 2, 0));
        assertThrows(
                IllegalArgumentException.class,
                () -> RasterArray.allocate(ElementType.FLOAT64, ByteOrder.BIG_ENDIAN, 65536, 65536, 1));
    }

    @Test
    void testUnsignedValues() {
        RasterArray bytes = RasterArray.ofBytes(ElementType.UINT8, new byte[][] {{(byte) 0xFF, 1}});
        assertEquals(255, bytes.getLong(0, 0, 0));
        RasterArray signed = RasterArray.ofBytes(ElementType.INT8, new byte[][] {{(byte) 0xFF, 1}});
        assertEquals(-1, signed.getLong(0, 0, 0));

        RasterArray shorts = RasterArray.ofShorts(ElementType.UINT16, new short[][] {{(short) 0xFFFF}});
        assertEquals(65535, shorts.getLong(0, 0, 0));
    }

    @Test
    void testTransposeIsAView() {
        RasterArray array = RasterArray.ofInts(new int[][] {{1, 2, 3}, {4, 5, 6}});
        RasterArray transposed = array.transpose();

        assertEquals(3, transposed.rows());
        assertEquals(2, transposed.cols());
        assertEquals(4, transposed.getLong(0, 1, 0));
        assertFalse(transposed.isContiguous());

        transposed.setLong(2, 1, 0, 60);
        assertEquals(60, array.getLong(1, 2, 0));
    }

    @Test
    void testFlip() {
        RasterArray array = RasterArray.ofInts(new int[][] {{1, 2, 3}, {4, 5, 6}});

        assertEquals(RasterArray.ofInts(new int[][] {{4, 5, 6}, {1, 2, 3}}), array.flip(0));
        assertEquals(RasterArray.ofInts(new int[][] {{3, 2, 1}, {6, 5, 4}}), array.flip(1));
        assertEquals(array, array.flip(0).flip(0));
        assertThrows(IllegalArgumentException.class, () -> array.flip(2));
    }

    @Test
    void testContiguousCopy() {
        RasterArray array = RasterArray.ofInts(new int[][] {{1, 2, 3}, {4, 5, 6}});
        RasterArray view = array.flip(1).transpose();

        RasterArray copy = view.contiguous();

        assertTrue(copy.isContiguous());
        assertEquals(view, copy);
        assertEquals(RasterArray.ofInts(new int[][] {{3, 6}, {2, 5}, {1, 4}}), copy);
        assertThat(array.contiguous()).isSameAs(array);

        copy.setLong(0, 0, 0, 30);
        assertEquals(3, array.getLong(0, 2, 0));
    }

    @Test
    void testMultiBandPixelsStayTogether() {
        RasterArray array = RasterArray.allocate(ElementType.UINT16, ByteOrder.BIG_ENDIAN, 2, 2, 3);
        for (int r = 0; r < 2; r++) {
            for (int c = 0; c < 2; c++) {
                for (int b = 0; b < 3; b++) {
                    array.setLong(r, c, b, 100 * r + 10 * c + b);
                }
            }
        }
        RasterArray transposed = array.transpose().contiguous();
        assertEquals(102, transposed.getLong(0, 1, 2));
        assertEquals(12, transposed.getLong(1, 0, 2));
    }

    @Test
    void testWithOrder() {
        RasterArray array = RasterArray.allocate(ElementType.FLOAT32, ByteOrder.BIG_ENDIAN, 1, 2, 1);
        array.setDouble(0, 0, 0, 1.5);
        array.setDouble(0, 1, 0, Float.NaN);

        RasterArray little = array.withOrder(ByteOrder.LITTLE_ENDIAN);

        assertEquals(ByteOrder.LITTLE_ENDIAN, little.order());
        assertEquals(1.5f, little.getFloat(0, 0, 0));
        assertTrue(Float.isNaN(little.getFloat(0, 1, 0)));
        ByteBuffer bytes = little.contiguousBytes();
        assertEquals(Float.floatToRawIntBits(1.5f), bytes.order(ByteOrder.LITTLE_ENDIAN).getInt(0));
        assertEquals(array, little);
        assertThat(array.withOrder(ByteOrder.BIG_ENDIAN)).isSameAs(array);
    }

    @Test
    void testWithOrderSwapsComplexComponentsSeparately() {
        RasterArray array = RasterArray.ofComplex(new float[][] {{1f, -2f}}, new float[][] {{3f, 4.25f}});
        ByteOrder other =
                array.order() == ByteOrder.BIG_ENDIAN ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;

        RasterArray swapped = array.withOrder(other);

        assertEquals(-2d, swapped.getReal(0, 1, 0));
        assertEquals(4.25d, swapped.getImaginary(0, 1, 0));
        assertEquals(array, swapped);
        assertEquals(array.hashCode(), swapped.hashCode());
    }

    @Test
    void testReinterpret() {
        RasterArray bands = RasterArray.allocate(ElementType.FLOAT32, ByteOrder.BIG_ENDIAN, 2, 2, 2);
        bands.setDouble(1, 0, 0, 7);
        bands.setDouble(1, 0, 1, -8);

        RasterArray complex = bands.reinterpret(ElementType.COMPLEX64, 1);

        assertEquals(ElementType.COMPLEX64, complex.type());
        assertEquals(1, complex.bands());
        assertEquals(7d, complex.getReal(1, 0, 0));
        assertEquals(-8d, complex.getImaginary(1, 0, 0));
        assertEquals(bands, complex.reinterpret(ElementType.FLOAT32, 2));
        assertThrows(IllegalArgumentException.class, () -> bands.reinterpret(ElementType.COMPLEX128, 1));
        assertThrows(IllegalStateException.class, () -> complex.getLong(0, 0, 0));
    }

    @Test
    void testWrap() {
        ByteBuffer buffer = ByteBuffer.allocate(6).order(ByteOrder.BIG_ENDIAN);
        buffer.putShort((short) 1).putShort((short) 2).putShort((short) 3).flip();

        RasterArray array = RasterArray.wrap(ElementType.INT16, buffer, 1, 3, 1);

        assertEquals(3, array.getLong(0, 2, 0));
        assertEquals(0, buffer.position());
        assertThrows(IllegalArgumentException.class, () -> RasterArray.wrap(ElementType.INT16, buffer, 2, 3, 1));
    }

    @Test
    void testEquality() {
        RasterArray a = RasterArray.ofInts(new int[][] {{1, 2}, {3, 4}});
        assertEquals(a, a.copy());
        assertNotEquals(a, a.transpose());
        assertNotEquals(a, a.reinterpret(ElementType.FLOAT32, 1));
        assertNotEquals(a, RasterArray.ofInts(new int[][] {{1, 2, 3, 4}}));
    }

    @Test
    void testInvalidInput() {
        assertThrows(
                IllegalArgumentException.class,
                () -> RasterArray.ofBytes(ElementType.UINT8, new byte[][] {{1, 2}, {3}}));
        assertThrows(IllegalArgumentException.class, () -> RasterArray.ofBytes(ElementType.INT16, new byte[1][1]));
        RasterArray array = RasterArray.ofInts(new int[][] {{1, 2}});
        assertThrows(IndexOutOfBoundsException.class, () -> array.getLong(1, 0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> array.getLong(0, 0, 1));
        assertThrows(IllegalStateException.class, () -> array.transpose().contiguousBytes());
    }
}
