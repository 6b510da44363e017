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
package io.tileverse.chipper.range;

import static java.util.Objects.requireNonNull;

/**
 * Resolves {@link AxisRange} requests into concrete {@link IndexRange}s over an axis of known length.
 * <p>
 * Resolution rules:
 * <ul>
 * <li>{@code stop == -1} with a positive step resolves {@code stop} to the axis length;
 * <li>{@code stop == -1} with a negative step keeps {@code -1} as the exclusive bound, so traversal goes down to and
 *     includes index {@code 0};
 * <li>any other combination is used verbatim.
 * </ul>
 * A range resolving to no index is valid and yields {@link IndexRange#empty()}. A non empty range with any index
 * outside {@code [0, length)} fails with {@link WindowOutOfBoundsException}.
 */
public final class RangeNormalizer {

    private RangeNormalizer() {
        // utility class
    }

    /**
     * Normalizes one axis request.
     *
     * @param range the request
     * @param length the axis length, non-negative
     * @return the resolved index sequence, in the requested traversal order
     * @throws WindowOutOfBoundsException if the resolved indices fall outside {@code [0, length)}
     */
    public static IndexRange normalize(AxisRange range, int length) {
        requireNonNull(range, "range");
        if (length < 0) {
            throw new IllegalArgumentException("length can't be < 0: " + length);
        }
        final int step = range.step();
        final long start = range.start();
        long stop = range.stop();
        if (stop == AxisRange.TO_END && step > 0) {
            stop = length;
        }
        long count = step > 0 ? ceilDiv(stop - start, step) : ceilDiv(start - stop, -(long) step);
        if (count <= 0) {
            return IndexRange.empty();
        }
        if (count > length) {
            // necessarily out of bounds, avoids int overflow below
            throw new WindowOutOfBoundsException("Range %s addresses %,d indices on an axis of length %d"
                    .formatted(range, count, length));
        }
        IndexRange resolved = new IndexRange((int) start, step, (int) count);
        if (resolved.min() < 0 || resolved.max() >= length) {
            throw WindowOutOfBoundsException.of(range, resolved, length);
        }
        return resolved;
    }

    /**
     * Normalizes both axes of a window.
     *
     * @param window the request
     * @param rows length of the first axis
     * @param cols length of the second axis
     * @return the resolved row and column index sequences
     */
    public static ResolvedWindow normalize(Window window, int rows, int cols) {
        requireNonNull(window, "window");
        return new ResolvedWindow(normalize(window.rows(), rows), normalize(window.cols(), cols));
    }

    private static long ceilDiv(long numerator, long denominator) {
        return -Math.floorDiv(-numerator, denominator);
    }
}
