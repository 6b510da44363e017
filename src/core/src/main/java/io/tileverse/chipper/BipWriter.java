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
package io.tileverse.chipper;

import static java.util.Objects.requireNonNull;

import io.tileverse.chipper.array.RasterArray;
import io.tileverse.chipper.backend.BackendKind;
import io.tileverse.chipper.backend.BackendPolicy;
import io.tileverse.chipper.backend.FileMapper;
import io.tileverse.chipper.backend.StorageBackend;
import io.tileverse.chipper.backend.StorageBackends;
import io.tileverse.chipper.range.ResolvedWindow;
import io.tileverse.chipper.range.WindowOutOfBoundsException;
import io.tileverse.chipper.symmetry.SymmetryTransform;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes blocks of samples into a pre-existing band interleaved by pixel raster file.
 * <p>
 * A writer typically covers one output file, or one segment of a multi-segment output, each segment getting its own
 * writer and {@link RasterDescriptor#byteOffset() byte offset}. Several writers may target disjoint row ranges of the
 * same file concurrently; keeping those ranges disjoint is up to the caller, writers don't coordinate.
 * <p>
 * Each {@link #write(RasterArray, int, int) write} validates the block before any I/O: it must fit in the raster and
 * be accepted by the {@link io.tileverse.chipper.compose.BandComposer}, otherwise nothing is written. If the I/O
 * itself fails the exception propagates and the writer remembers it; {@link #close()} still releases the file and
 * logs that the output may be partially written and corrupt.
 *
 * <pre>{@code
 * try (BipWriter writer = BipWriter.open(path, descriptor)) {
 *     for (int row = 0; row < rows; row += blockHeight) {
 *         writer.write(nextBlock(row), row, 0);
 *     }
 * }
 * }</pre>
 */
public class BipWriter implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(BipWriter.class);

    private final Path path;
    private final RasterDescriptor descriptor;
    private final SymmetryTransform symmetry;
    private final StorageBackend backend;
    private volatile boolean failed;

    BipWriter(Path path, RasterDescriptor descriptor, BackendPolicy policy, FileMapper mapper) throws IOException {
        this.path = requireNonNull(path, "path");
        this.descriptor = requireNonNull(descriptor, "descriptor");
        this.symmetry = descriptor.symmetryTransform();
        this.backend = StorageBackends.open(path, descriptor.layout(), true, policy, mapper);
    }

    /**
     * Opens a writer with the default backend policy from {@link ChipperConfig#fromEnvironment()}.
     *
     * @param path an existing file; it is extended if shorter than the described raster
     * @param descriptor the raster description
     * @return an open writer
     * @throws IOException if the file does not exist, is not a regular file, or can't be opened for writing
     */
    public static BipWriter open(Path path, RasterDescriptor descriptor) throws IOException {
        return builder().path(path).descriptor(descriptor).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Writes a block at the origin of the raster.
     *
     * @see #write(RasterArray, int, int)
     */
    public void write(RasterArray data) throws IOException {
        write(data, 0, 0);
    }

    /**
     * Writes a block of domain samples at a logical position.
     * <p>
     * Non contiguous arrays are copied into contiguous layout first. Byte order conversion is handled here too.
     *
     * @param data samples, with {@link RasterDescriptor#bands()} bands
     * @param startRow logical row of the first block row
     * @param startCol logical column of the first block column
     * @throws WindowOutOfBoundsException if the block reaches outside the raster
     * @throws io.tileverse.chipper.array.ElementTypeMismatchException if the element type of {@code data}, or of the
     *     output of a sample transform, is not the expected one; nothing is written
     * @throws IOException if writing fails, the file may then be partially written
     * @throws IllegalStateException if this writer is closed
     */
    public void write(RasterArray data, int startRow, int startCol) throws IOException {
        requireNonNull(data, "data");
        if (backend.isClosed()) {
            throw new IllegalStateException("Writer for " + path + " is closed");
        }
        if (startRow < 0
                || startCol < 0
                || (long) startRow + data.rows() > descriptor.rows()
                || (long) startCol + data.cols() > descriptor.cols()) {
            throw new WindowOutOfBoundsException("Block %dx%d at (%d, %d) exceeds raster bounds %dx%d"
                    .formatted(data.rows(), data.cols(), startRow, startCol, descriptor.rows(), descriptor.cols()));
        }
        if (data.bands() != descriptor.bands()) {
            throw new IllegalArgumentException(
                    "Expected %d bands, got %d".formatted(descriptor.bands(), data.bands()));
        }
        RasterArray raw = descriptor.composer().decompose(data.contiguous(), descriptor.rawType());
        if (raw.rows() != data.rows() || raw.cols() != data.cols() || raw.bands() != descriptor.rawBands()) {
            throw new IllegalArgumentException("Band composer produced a %dx%dx%d raw block, expected %dx%dx%d"
                    .formatted(
                            raw.rows(),
                            raw.cols(),
                            raw.bands(),
                            data.rows(),
                            data.cols(),
                            descriptor.rawBands()));
        }
        if (raw.isEmpty()) {
            return;
        }
        ResolvedWindow target = symmetry.toRaw(ResolvedWindow.contiguous(startRow, startCol, data.rows(), data.cols()));
        RasterArray oriented = symmetry.toRawOrientation(raw);
        try {
            backend.writeWindow(target.rows().min(), target.cols().min(), oriented);
        } catch (IOException | RuntimeException e) {
            failed = true;
            throw e;
        }
    }

    public RasterDescriptor descriptor() {
        return descriptor;
    }

    public Path path() {
        return path;
    }

    public BackendKind backendKind() {
        return backend.kind();
    }

    /**
     * @return whether a write failed during I/O, leaving the file possibly incomplete
     */
    public boolean hasFailed() {
        return failed;
    }

    public boolean isClosed() {
        return backend.isClosed();
    }

    /**
     * Flushes and releases the mapped view or file channel. Idempotent. If a write failed beforehand, the release
     * still happens and an error is logged stating the file may be only partially written.
     *
     * @throws IOException if flushing or releasing fails
     */
    @Override
    public void close() throws IOException {
        if (backend.isClosed()) {
            return;
        }
        try {
            backend.close();
        } finally {
            if (failed) {
                logger.error(
                        "{} failed during processing. The file {} may be only partially generated and corrupt.",
                        getClass().getSimpleName(),
                        path);
            }
        }
    }

    @Override
    public String toString() {
        return "BipWriter[%s, %s, %s]".formatted(path, descriptor, backend.kind());
    }

    /**
     * Builder for {@link BipWriter}.
     */
    public static class Builder {
        private Path path;
        private RasterDescriptor descriptor;
        private BackendPolicy policy;
        private FileMapper mapper = FileMapper.DEFAULT;

        private Builder() {}

        public Builder path(Path path) {
            this.path = requireNonNull(path, "Path cannot be null");
            return this;
        }

        public Builder descriptor(RasterDescriptor descriptor) {
            this.descriptor = requireNonNull(descriptor, "descriptor");
            return this;
        }

        /**
         * Sets the backend policy, overriding {@link ChipperConfig#fromEnvironment()}.
         */
        public Builder backendPolicy(BackendPolicy policy) {
            this.policy = requireNonNull(policy, "policy");
            return this;
        }

        public Builder fileMapper(FileMapper mapper) {
            this.mapper = requireNonNull(mapper, "mapper");
            return this;
        }

        public BipWriter build() throws IOException {
            if (path == null || descriptor == null) {
                throw new IllegalStateException("Path and descriptor must be set");
            }
            BackendPolicy effective =
                    policy == null ? ChipperConfig.fromEnvironment().backendPolicy() : policy;
            return new BipWriter(path, descriptor, effective, mapper);
        }
    }
}
