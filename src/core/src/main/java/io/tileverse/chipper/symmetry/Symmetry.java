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
package io.tileverse.chipper.symmetry;

/**
 * The fixed orientation change between the raw on-disk raster and the logical raster presented to callers.
 * <p>
 * The mapping from a logical index {@code (i, j)} on a logical raster of shape {@code (rows, cols)} to the raw index
 * is always applied in this order:
 * <ol>
 * <li>flip the logical row axis: {@code i -> rows - 1 - i}, if {@link #flipRows()};
 * <li>flip the logical column axis: {@code j -> cols - 1 - j}, if {@link #flipCols()};
 * <li>swap the two axes, if {@link #transpose()}.
 * </ol>
 * Flips are thus expressed in logical axes and happen before the transpose. Readers and writers share this order.
 *
 * @param flipRows reverse the order of logical rows
 * @param flipCols reverse the order of logical columns
 * @param transpose logical rows are raw columns and vice versa
 */
public record Symmetry(boolean flipRows, boolean flipCols, boolean transpose) {

    /** Raw and logical orientations are the same. */
    public static final Symmetry NONE = new Symmetry(false, false, false);

    public static Symmetry of(boolean flipRows, boolean flipCols, boolean transpose) {
        return new Symmetry(flipRows, flipCols, transpose);
    }

    public boolean isIdentity() {
        return !flipRows && !flipCols && !transpose;
    }
}
