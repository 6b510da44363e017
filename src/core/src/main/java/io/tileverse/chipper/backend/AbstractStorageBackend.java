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

import static java.util.Objects.requireNonNull;

import io.tileverse.chipper.array.ElementTypeMismatchException;
import io.tileverse.chipper.array.RasterArray;
import io.tileverse.chipper.range.IndexRange;
import io.tileverse.chipper.range.ResolvedWindow;
import io.tileverse.chipper.range.WindowOutOfBoundsException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class providing the common implementation of {@link StorageBackend}.
 * <p>
 * The template methods {@link #readWindow(ResolvedWindow)}, {@link #writeWindow(int, int, RasterArray)} and
 * {@link #close()} handle state checks, bounds and type validation, byte order conversion and idempotent release;
 * subclasses only move bytes in {@link #doReadWindow(ResolvedWindow, ByteBuffer)},
 * {@link #doWriteWindow(int, int, int, int, ByteBuffer)} and release their resource in {@link #doClose()}.
 */
@Slf4j
abstract class AbstractStorageBackend implements StorageBackend {

    protected final Path path;
    protected final BipLayout layout;
    private final boolean writable;
    private final AtomicBoolean closed = new AtomicBoolean();

    protected AbstractStorageBackend(Path path, BipLayout layout, boolean writable) {
        this.path = requireNonNull(path, "path");
        this.layout = requireNonNull(layout, "layout");
        this.writable = writable;
    }

    @Override
    public BipLayout layout() {
        return layout;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public boolean isWritable() {
        return writable;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public final RasterArray readWindow(ResolvedWindow window) throws IOException {
        requireNonNull(window, "window");
        checkOpen();
        final int height = window.height();
        final int width = window.width();
        if (window.isEmpty()) {
            return RasterArray.allocate(layout.type(), layout.order(), height, width, layout.bands());
        }
        checkBounds(window.rows(), layout.rows(), "row");
        checkBounds(window.cols(), layout.cols(), "column");

        long byteCount = (long) height * width * layout.elementSize();
        if (byteCount > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Window %dx%d is too large to read at once (%,d bytes)"
                    .formatted(height, width, byteCount));
        }
        ByteBuffer target = ByteBuffer.allocate((int) byteCount).order(layout.order());
        doReadWindow(window, target);
        if (target.hasRemaining()) {
            throw new IllegalStateException("Backend read %,d bytes out of %,d"
                    .formatted(target.position(), target.capacity()));
        }
        target.flip();
        return RasterArray.wrap(layout.type(), target, height, width, layout.bands());
    }

    @Override
    public final void writeWindow(int startRow, int startCol, RasterArray data) throws IOException {
        requireNonNull(data, "data");
        checkOpen();
        if (!writable) {
            throw new IllegalStateException("Backend for " + path + " is read-only");
        }
        if (data.type() != layout.type()) {
            throw new ElementTypeMismatchException(layout.type(), data.type(), "data to write");
        }
        if (data.bands() != layout.bands()) {
            throw new IllegalArgumentException(
                    "Expected %d bands per pixel, got %d".formatted(layout.bands(), data.bands()));
        }
        if (startRow < 0
                || startCol < 0
                || (long) startRow + data.rows() > layout.rows()
                || (long) startCol + data.cols() > layout.cols()) {
            throw new WindowOutOfBoundsException("Block %dx%d at (%d, %d) exceeds raster bounds %dx%d"
                    .formatted(data.rows(), data.cols(), startRow, startCol, layout.rows(), layout.cols()));
        }
        if (data.isEmpty()) {
            return;
        }
        ByteBuffer bytes = data.withOrder(layout.order()).contiguousBytes();
        doWriteWindow(startRow, startCol, data.rows(), data.cols(), bytes);
    }

    @Override
    public final void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            log.debug("Closing {} backend for {}", kind(), path);
            doClose();
        }
    }

    /**
     * Reads the samples of a non empty, in bounds, window.
     *
     * @param window raw indices, in output order
     * @param target heap buffer of exactly {@code height * width * elementSize} bytes, positioned at zero; must be
     *     filled row by row, pixel by pixel, advancing its position
     */
    protected abstract void doReadWindow(ResolvedWindow window, ByteBuffer target) throws IOException;

    /**
     * Writes a non empty, in bounds, block.
     *
     * @param startRow raw row of the first block row
     * @param startCol raw column of the first block column
     * @param height number of block rows
     * @param width number of block columns
     * @param source contiguous block bytes in the raw byte order, from position zero to its limit
     */
    protected abstract void doWriteWindow(int startRow, int startCol, int height, int width, ByteBuffer source)
            throws IOException;

    /**
     * Releases the underlying resource. Called at most once.
     */
    protected abstract void doClose() throws IOException;

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException(kind() + " backend for " + path + " is closed");
        }
    }

    private static void checkBounds(IndexRange range, int length, String axis) {
        if (range.min() < 0 || range.max() >= length) {
            throw new WindowOutOfBoundsException("Raw %s indices [%d, %d] outside of [0, %d)"
                    .formatted(axis, range.min(), range.max(), length));
        }
    }

    @Override
    public String toString() {
        return "%s[%s, %s]".formatted(getClass().getSimpleName(), path, layout);
    }
}
