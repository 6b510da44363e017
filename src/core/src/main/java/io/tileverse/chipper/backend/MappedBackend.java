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

import io.tileverse.chipper.range.IndexRange;
import io.tileverse.chipper.range.ResolvedWindow;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileChannel.MapMode;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * {@link StorageBackend} over a memory-mapped view of the raster region of a file.
 * <p>
 * The view covers exactly {@link BipLayout#dataBytes()} bytes from {@link BipLayout#byteOffset()}; writable views
 * extend the file if it is shorter. The channel used to create the mapping is closed right away, the view being the
 * only resource held afterwards. Reads copy samples out of the view, never exposing it to callers.
 * <p>
 * A single {@link MappedByteBuffer} addresses at most {@code Integer.MAX_VALUE} bytes, larger rasters can't be mapped.
 */
final class MappedBackend extends AbstractStorageBackend {

    private MappedByteBuffer view;

    private MappedBackend(Path path, BipLayout layout, boolean writable, MappedByteBuffer view) {
        super(path, layout, writable);
        this.view = view;
    }

    /**
     * Opens the file and maps its raster region.
     *
     * @throws MappingFailedException if the file could be opened but not mapped
     * @throws IOException if the file can't be opened
     */
    static MappedBackend open(Path path, BipLayout layout, boolean writable, FileMapper mapper) throws IOException {
        try (FileChannel channel = writable
                ? FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)
                : FileChannel.open(path, StandardOpenOption.READ)) {
            MapMode mode = writable ? MapMode.READ_WRITE : MapMode.READ_ONLY;
            MappedByteBuffer view;
            try {
                view = mapper.map(channel, mode, layout.byteOffset(), layout.dataBytes());
            } catch (IOException | RuntimeException e) {
                throw new MappingFailedException(path, layout.dataBytes(), e);
            }
            return new MappedBackend(path, layout, writable, view);
        }
    }

    @Override
    public BackendKind kind() {
        return BackendKind.MAPPED;
    }

    @Override
    protected void doReadWindow(ResolvedWindow window, ByteBuffer target) {
        final IndexRange rows = window.rows();
        final IndexRange cols = window.cols();
        final int elementSize = layout.elementSize();
        for (int i = 0; i < rows.count(); i++) {
            final int rowStart = position(rows.index(i), 0);
            if (cols.step() == 1) {
                int length = cols.count() * elementSize;
                target.put(target.position(), view, rowStart + cols.first() * elementSize, length);
                target.position(target.position() + length);
                continue;
            }
            for (int j = 0; j < cols.count(); j++) {
                target.put(target.position(), view, rowStart + cols.index(j) * elementSize, elementSize);
                target.position(target.position() + elementSize);
            }
        }
    }

    @Override
    protected void doWriteWindow(int startRow, int startCol, int height, int width, ByteBuffer source) {
        if (startCol == 0 && width == layout.cols()) {
            view.put(position(startRow, 0), source, 0, source.remaining());
            return;
        }
        final int rowBytes = width * layout.elementSize();
        for (int i = 0; i < height; i++) {
            view.put(position(startRow + i, startCol), source, i * rowBytes, rowBytes);
        }
    }

    @Override
    protected void doClose() {
        MappedByteBuffer released = view;
        view = null;
        if (isWritable() && !released.isReadOnly()) {
            released.force();
        }
    }

    private int position(int row, int col) {
        return (int) (layout.offsetOf(row, col) - layout.byteOffset());
    }
}
