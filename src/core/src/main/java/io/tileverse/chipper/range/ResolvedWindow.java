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
 * A {@link Window} whose axes have been resolved into concrete index sequences.
 *
 * @param rows row indices, in output order
 * @param cols column indices, in output order
 */
public record ResolvedWindow(IndexRange rows, IndexRange cols) {

    public ResolvedWindow {
        requireNonNull(rows, "rows");
        requireNonNull(cols, "cols");
    }

    /**
     * @return the contiguous ascending window {@code [row, row + height) x [col, col + width)}
     */
    public static ResolvedWindow contiguous(int row, int col, int height, int width) {
        return new ResolvedWindow(IndexRange.contiguous(row, height), IndexRange.contiguous(col, width));
    }

    public int height() {
        return rows.count();
    }

    public int width() {
        return cols.count();
    }

    public boolean isEmpty() {
        return rows.isEmpty() || cols.isEmpty();
    }

    /**
     * @return this window with its axes swapped
     */
    public ResolvedWindow transpose() {
        return new ResolvedWindow(cols, rows);
    }
}
