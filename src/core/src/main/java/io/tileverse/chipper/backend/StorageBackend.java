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

import io.tileverse.chipper.array.RasterArray;
import io.tileverse.chipper.range.ResolvedWindow;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads and writes rectangular windows of a {@link BipLayout band interleaved by pixel} raster stored in a file.
 * <p>
 * Windows are expressed in raw, on-disk, orientation and have already been normalized: a backend only checks that
 * they lie within the raster. Exactly one resource, either a memory-mapped view or an open file channel, is held from
 * construction until {@link #close()}.
 * <p>
 * Implementations are not thread-safe: the mapped view or the channel position is shared mutable state.
 */
public interface StorageBackend extends Closeable {

    BackendKind kind();

    BipLayout layout();

    /**
     * @return the file this backend reads from or writes to
     */
    Path path();

    boolean isWritable();

    boolean isClosed();

    /**
     * Reads a window into a new, contiguous array of the raw element type, byte order and band count.
     *
     * @param window raw row and column indices, in output order; steps may be negative
     * @return an array of shape {@code (window.height(), window.width(), layout().bands())}
     * @throws IOException if reading fails
     * @throws io.tileverse.chipper.range.WindowOutOfBoundsException if the window reaches outside the raster
     * @throws IllegalStateException if the backend is closed
     */
    RasterArray readWindow(ResolvedWindow window) throws IOException;

    /**
     * Writes a block of samples at a raw position.
     *
     * @param startRow raw row of the first row of {@code data}
     * @param startCol raw column of the first column of {@code data}
     * @param data samples of the raw element type and band count, in raw orientation; any byte order or layout
     * @throws IOException if writing fails, in which case the file may be partially written
     * @throws io.tileverse.chipper.array.ElementTypeMismatchException if {@code data} has the wrong element type
     * @throws io.tileverse.chipper.range.WindowOutOfBoundsException if the block reaches outside the raster
     * @throws IllegalStateException if the backend is closed or read-only
     */
    void writeWindow(int startRow, int startCol, RasterArray data) throws IOException;

    /**
     * Releases the mapped view or file channel. Idempotent.
     *
     * @throws IOException if releasing the resource fails; the backend is closed anyway
     */
    @Override
    void close() throws IOException;
}
