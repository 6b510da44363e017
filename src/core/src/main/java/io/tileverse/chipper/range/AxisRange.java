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
 * A user supplied request along one axis: {@code start} inclusive, {@code stop} exclusive, {@code step} non-zero.
 * <p>
 * A {@code stop} of {@code -1} is a sentinel meaning "to the natural end of the axis in the direction of traversal":
 * with a positive step it resolves to the axis length, with a negative step traversal continues down to and
 * including index {@code 0}. Any other value is used verbatim. See {@link RangeNormalizer}.
 *
 * @param start first index requested
 * @param stop exclusive bound, or {@code -1}
 * @param step index increment, negative for reversed traversal
 */
public record AxisRange(int start, int stop, int step) {

    /** Sentinel {@code stop} value resolving to the natural end of the axis. */
    public static final int TO_END = -1;

    /**
     * Compact constructor, rejects a zero step.
     */
    public AxisRange {
        if (step == 0) {
            throw new IllegalArgumentException("step can't be 0");
        }
    }

    /**
     * @return the range covering the whole axis in natural order
     */
    public static AxisRange all() {
        return new AxisRange(0, TO_END, 1);
    }

    public static AxisRange of(int start, int stop) {
        return new AxisRange(start, stop, 1);
    }

    public static AxisRange of(int start, int stop, int step) {
        return new AxisRange(start, stop, step);
    }

    /**
     * Traverses the axis backwards from {@code start} down to index {@code 0}.
     */
    public static AxisRange reversedFrom(int start) {
        return new AxisRange(start, TO_END, -1);
    }

    @Override
    public String toString() {
        return "%d:%d:%d".formatted(start, stop, step);
    }
}
