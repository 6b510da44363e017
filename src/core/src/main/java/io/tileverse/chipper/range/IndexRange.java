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

/**
 * A fully resolved, bounded index sequence along one axis: {@code first, first + step, ..., first + (count - 1) *
 * step}.
 *
 * @param first the first index, meaningless when {@code count == 0}
 * @param step the increment between consecutive indices, never zero
 * @param count the number of indices, non-negative
 */
public record IndexRange(int first, int step, int count) {

    private static final IndexRange EMPTY = new IndexRange(0, 1, 0);

    public IndexRange {
        if (step == 0) {
            throw new IllegalArgumentException("step can't be 0");
        }
        if (count < 0) {
            throw new IllegalArgumentException("count can't be < 0: " + count);
        }
    }

    public static IndexRange empty() {
        return EMPTY;
    }

    /**
     * @return the contiguous ascending range {@code [start, start + count)}
     */
    public static IndexRange contiguous(int start, int count) {
        return new IndexRange(start, 1, count);
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * @param i position in the sequence, {@code 0 <= i < count}
     * @return the axis index at that position
     */
    public int index(int i) {
        return first + i * step;
    }

    public int last() {
        return index(count - 1);
    }

    /**
     * @return the smallest index of a non empty range
     */
    public int min() {
        return step > 0 ? first : last();
    }

    /**
     * @return the largest index of a non empty range
     */
    public int max() {
        return step > 0 ? last() : first;
    }

    /**
     * @return the number of indices from {@link #min()} to {@link #max()} inclusive, that is, the extent of the
     *     contiguous run covering this range at step one
     */
    public int span() {
        return isEmpty() ? 0 : max() - min() + 1;
    }

    /**
     * @return the same indices in the opposite order
     */
    public IndexRange reverse() {
        return isEmpty() ? this : new IndexRange(last(), -step, count);
    }

    /**
     * Mirrors this range on an axis of the given length: index {@code i} becomes {@code length - 1 - i}, preserving
     * the traversal order of the positions.
     */
    public IndexRange mirror(int length) {
        return isEmpty() ? this : new IndexRange(length - 1 - first, -step, count);
    }
}
