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
import io.tileverse.chipper.range.AxisRange;
import io.tileverse.chipper.range.RangeNormalizer;
import io.tileverse.chipper.range.ResolvedWindow;
import io.tileverse.chipper.range.Window;
import io.tileverse.chipper.symmetry.SymmetryTransform;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads arbitrary windows of a band interleaved by pixel raster file, without loading the whole file.
 * <p>
 * A read goes through these steps:
 * <ol>
 * <li>each axis request is resolved against the logical shape by {@link RangeNormalizer};
 * <li>the resolved window is translated into raw orientation by the {@link SymmetryTransform};
 * <li>the {@link StorageBackend} reads the raw samples;
 * <li>the {@link io.tileverse.chipper.compose.BandComposer} turns raw bands into domain samples;
 * <li>the result is reordered into logical orientation.
 * </ol>
 * The backend is chosen once, when the chipper is opened: a memory-mapped view of the file, or, if mapping fails and
 * the {@link BackendPolicy} allows it, explicit positioned reads. Both return identical arrays.
 * <p>
 * A chipper is not thread-safe. Close it, preferably with try-with-resources, to release the file:
 *
 * <pre>{@code
 * try (BipChipper chipper = BipChipper.open(path, descriptor)) {
 *     RasterArray chip = chipper.read(Window.of(AxisRange.of(100, 200), AxisRange.of(500, 0, -2)));
 * }
 * }</pre>
 */
public class BipChipper implements Closeable {

    private final Path path;
    private final RasterDescriptor descriptor;
    private final SymmetryTransform symmetry;
    private final StorageBackend backend;

    BipChipper(Path path, RasterDescriptor descriptor, BackendPolicy policy, FileMapper mapper) throws IOException {
        this.path = requireNonNull(path, "path");
        this.descriptor = requireNonNull(descriptor, "descriptor");
        this.symmetry = descriptor.symmetryTransform();
        checkFileLength(path, descriptor);
        this.backend = StorageBackends.open(path, descriptor.layout(), false, policy, mapper);
    }

    /**
     * Opens a chipper with the default backend policy from {@link ChipperConfig#fromEnvironment()}.
     *
     * @param path the raster file
     * @param descriptor the raster description
     * @return an open chipper
     * @throws IOException if the file does not exist, is not a regular file, or can't be read
     * @throws RasterConfigurationException if the file is too short for the described raster
     */
    public static BipChipper open(Path path, RasterDescriptor descriptor) throws IOException {
        return builder().path(path).descriptor(descriptor).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a window of the logical raster.
     *
     * @param window the requested rows and columns, in logical orientation
     * @return a new contiguous array of shape {@code (rows, cols, bands)} holding domain samples
     * @throws io.tileverse.chipper.range.WindowOutOfBoundsException if the window reaches outside the raster
     * @throws io.tileverse.chipper.array.ElementTypeMismatchException if a sample transform produced the wrong type
     * @throws IOException if reading fails
     * @throws IllegalStateException if this chipper is closed
     */
    public RasterArray read(Window window) throws IOException {
        ResolvedWindow logical = RangeNormalizer.normalize(window, descriptor.rows(), descriptor.cols());
        RasterArray raw = backend.readWindow(symmetry.toRaw(logical));
        RasterArray composed = descriptor.composer().compose(raw, descriptor.rawType());
        return symmetry.toLogicalOrder(composed);
    }

    /**
     * @see #read(Window)
     */
    public RasterArray read(AxisRange rows, AxisRange cols) throws IOException {
        return read(Window.of(rows, cols));
    }

    /**
     * Reads the whole raster.
     *
     * @see #read(Window)
     */
    public RasterArray readAll() throws IOException {
        return read(Window.all());
    }

    /**
     * @return number of logical rows
     */
    public int rows() {
        return descriptor.rows();
    }

    /**
     * @return number of logical columns
     */
    public int cols() {
        return descriptor.cols();
    }

    public RasterDescriptor descriptor() {
        return descriptor;
    }

    public Path path() {
        return path;
    }

    /**
     * @return the backend selected when this chipper was opened
     */
    public BackendKind backendKind() {
        return backend.kind();
    }

    public boolean isClosed() {
        return backend.isClosed();
    }

    /**
     * Releases the mapped view or file channel. Idempotent.
     */
    @Override
    public void close() throws IOException {
        backend.close();
    }

    private static void checkFileLength(Path path, RasterDescriptor descriptor) throws IOException {
        if (!Files.isRegularFile(path)) {
            // reported by the backend
            return;
        }
        long required = descriptor.layout().endOffset();
        long size = Files.size(path);
        if (size < required) {
            throw new RasterConfigurationException("File %s has %,d bytes, the described raster requires %,d"
                    .formatted(path, size, required));
        }
    }

    @Override
    public String toString() {
        return "BipChipper[%s, %s, %s]".formatted(path, descriptor, backend.kind());
    }

    /**
     * Builder for {@link BipChipper}.
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

        /**
         * Sets how the file is memory-mapped, {@link FileMapper#DEFAULT} by default.
         */
        public Builder fileMapper(FileMapper mapper) {
            this.mapper = requireNonNull(mapper, "mapper");
            return this;
        }

        /**
         * Opens the chipper.
         *
         * @throws IllegalStateException if path or descriptor were not set
         * @throws IOException if the file can't be opened
         */
        public BipChipper build() throws IOException {
            if (path == null || descriptor == null) {
                throw new IllegalStateException("Path and descriptor must be set");
            }
            BackendPolicy effective =
                    policy == null ? ChipperConfig.fromEnvironment().backendPolicy() : policy;
            return new BipChipper(path, descriptor, effective, mapper);
        }
    }
}
