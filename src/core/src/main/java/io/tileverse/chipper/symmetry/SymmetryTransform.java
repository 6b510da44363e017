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

import static java.util.Objects.requireNonNull;

import io.tileverse.chipper.array.RasterArray;
import io.tileverse.chipper.range.IndexRange;
import io.tileverse.chipper.range.ResolvedWindow;

/**
 * Translates windows and arrays between the logical orientation of a raster and its raw on-disk orientation, for a
 * given {@link Symmetry} and logical shape.
 * <p>
 * On read, a logical window is translated with {@link #toRaw(ResolvedWindow)} before I/O; flips become reversed
 * index sequences, so the backend already returns samples in logical traversal order and
 * {@link #toLogicalOrder(RasterArray)} only has to undo the transpose. On write, a logical block is reoriented with
 * {@link #toRawOrientation(RasterArray)} and stored at the origin of its raw window.
 */
public final class SymmetryTransform {

    private final Symmetry symmetry;
    private final int rows;
    private final int cols;

    /**
     * @param symmetry the orientation change
     * @param rows number of logical rows
     * @param cols number of logical columns
     */
    public SymmetryTransform(Symmetry symmetry, int rows, int cols) {
        this.symmetry = requireNonNull(symmetry, "symmetry");
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("shape must be non-negative: %dx%d".formatted(rows, cols));
        }
        this.rows = rows;
        this.cols = cols;
    }

    public Symmetry symmetry() {
        return symmetry;
    }

    public int rawRows() {
        return symmetry.transpose() ? cols : rows;
    }

    public int rawCols() {
        return symmetry.transpose() ? rows : cols;
    }

    /**
     * Translates a resolved logical window into the raw window holding the same samples, in the same traversal
     * order.
     */
    public ResolvedWindow toRaw(ResolvedWindow logical) {
        IndexRange r = symmetry.flipRows() ? logical.rows().mirror(rows) : logical.rows();
        IndexRange c = symmetry.flipCols() ? logical.cols().mirror(cols) : logical.cols();
        ResolvedWindow raw = new ResolvedWindow(r, c);
        return symmetry.transpose() ? raw.transpose() : raw;
    }

    /**
     * Reorders the array read for a window obtained from {@link #toRaw(ResolvedWindow)} into logical order.
     *
     * @return a contiguous array
     */
    public RasterArray toLogicalOrder(RasterArray rawWindowData) {
        return symmetry.transpose() ? rawWindowData.transpose().contiguous() : rawWindowData;
    }

    /**
     * Reorients a block of logical samples so that it can be stored, as is, at the origin of its raw window.
     *
     * @return a contiguous array in raw orientation
     */
    public RasterArray toRawOrientation(RasterArray logicalBlock) {
        RasterArray view = logicalBlock;
        if (symmetry.flipRows()) {
            view = view.flip(0);
        }
        if (symmetry.flipCols()) {
            view = view.flip(1);
        }
        if (symmetry.transpose()) {
            view = view.transpose();
        }
        return view.contiguous();
    }

    /**
     * Inverse of {@link #toRawOrientation(RasterArray)}: reorients a block in raw orientation into logical
     * orientation.
     *
     * @return a contiguous array in logical orientation
     */
    public RasterArray toLogicalOrientation(RasterArray rawBlock) {
        RasterArray view = symmetry.transpose() ? rawBlock.transpose() : rawBlock;
        if (symmetry.flipCols()) {
            view = view.flip(1);
        }
        if (symmetry.flipRows()) {
            view = view.flip(0);
        }
        return view.contiguous();
    }
}
