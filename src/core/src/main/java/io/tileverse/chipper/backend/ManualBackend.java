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
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * {@link StorageBackend} positioning a {@link FileChannel} explicitly before each read or write.
 * <p>
 * Reads seek once per row, to the first pixel of the column span the window covers, and read that whole span at step
 * one in a single run; column subsampling and reversal are then applied in memory. This transfers more bytes than
 * strictly required for strided windows, in exchange for one seek per row instead of one per pixel.
 * <p>
 * Writes covering full rows are issued as one contiguous write. Narrower blocks are written row by row, moving the
 * channel position forward by the gap to the next row in between; no position change follows the last row, so the
 * channel never moves past the end of the written data.
 */
final class ManualBackend extends AbstractStorageBackend {

    private final FileChannel channel;

    private ManualBackend(Path path, BipLayout layout, boolean writable, FileChannel channel) {
        super(path, layout, writable);
        this.channel = channel;
    }

    static ManualBackend open(Path path, BipLayout layout, boolean writable) throws IOException {
        FileChannel channel = writable
                ? FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)
                : FileChannel.open(path, StandardOpenOption.READ);
        return new ManualBackend(path, layout, writable, channel);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.MANUAL;
    }

    @Override
    protected void doReadWindow(ResolvedWindow window, ByteBuffer target) throws IOException {
        final IndexRange rows = window.rows();
        final IndexRange cols = window.cols();
        final int elementSize = layout.elementSize();
        final int firstCol = cols.min();
        final ByteBuffer run = ByteBuffer.allocate(cols.span() * elementSize);
        for (int i = 0; i < rows.count(); i++) {
            channel.position(layout.offsetOf(rows.index(i), firstCol));
            run.clear();
            readFully(run);
            for (int j = 0; j < cols.count(); j++) {
                int source = (cols.index(j) - firstCol) * elementSize;
                target.put(target.position(), run, source, elementSize);
                target.position(target.position() + elementSize);
            }
        }
    }

    @Override
    protected void doWriteWindow(int startRow, int startCol, int height, int width, ByteBuffer source)
            throws IOException {
        channel.position(layout.offsetOf(startRow, startCol));
        if (startCol == 0 && width == layout.cols()) {
            writeFully(source);
            return;
        }
        final int rowBytes = width * layout.elementSize();
        final long gap = (long) layout.elementSize() * (layout.cols() - width);
        for (int i = 0; i < height; i++) {
            writeFully(source.slice(i * rowBytes, rowBytes));
            if (i < height - 1) {
                channel.position(channel.position() + gap);
            }
        }
    }

    @Override
    protected void doClose() throws IOException {
        channel.close();
    }

    private void readFully(ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) == -1) {
                throw new EOFException("Unexpected end of file %s at position %,d, %,d bytes missing"
                        .formatted(path, channel.position(), buffer.remaining()));
            }
        }
    }

    private void writeFully(ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }
}
