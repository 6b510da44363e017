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
 * A rectangular, possibly strided or reversed, request over the two spatial axes of a raster.
 *
 * @param rows the request along the first axis
 * @param cols the request along the second axis
 */
public record Window(AxisRange rows, AxisRange cols) {

    public Window {
        requireNonNull(rows, "rows");
        requireNonNull(cols, "cols");
    }

    /**
     * @return the window covering the whole raster
     */
    public static Window all() {
        return new Window(AxisRange.all(), AxisRange.all());
    }

    public static Window of(AxisRange rows, AxisRange cols) {
        return new Window(rows, cols);
    }

    /**
     * @return the contiguous window {@code [row, row + height) x [col, col + width)}
     */
    public static Window of(int row, int col, int height, int width) {
        return new Window(AxisRange.of(row, row + height), AxisRange.of(col, col + width));
    }
}
