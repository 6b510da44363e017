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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens the {@link StorageBackend} of a chipper or writer, applying a {@link BackendPolicy}.
 * <p>
 * Under {@link BackendPolicy#AUTO}, a {@link MappingFailedException} is recovered from by opening a
 * {@link BackendKind#MANUAL manual} backend instead; the failover is reported once, as a warning, and is not visible
 * to callers otherwise. Failures to open the file itself are never recovered from.
 */
@Slf4j
public final class StorageBackends {

    private StorageBackends() {
        // utility class
    }

    /**
     * Opens a backend.
     *
     * @param path the raster file, which must exist
     * @param layout the raster layout in the file
     * @param writable whether the backend is used to write
     * @param policy the selection policy
     * @param mapper maps the file when the policy allows it
     * @return an open backend
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException if the path is not a regular file, can't be opened with the required access, or, under
     *     {@link BackendPolicy#MAPPED}, can't be mapped
     */
    public static StorageBackend open(
            Path path, BipLayout layout, boolean writable, BackendPolicy policy, FileMapper mapper)
            throws IOException {
        requireNonNull(path, "path");
        requireNonNull(layout, "layout");
        requireNonNull(policy, "policy");
        requireNonNull(mapper, "mapper");
        checkRegularFile(path);

        StorageBackend backend =
                switch (policy) {
                    case MANUAL -> ManualBackend.open(path, layout, writable);
                    case MAPPED -> MappedBackend.open(path, layout, writable, mapper);
                    case AUTO -> openWithFailover(path, layout, writable, mapper);
                };
        log.debug("Opened {} {} backend for {}", writable ? "read-write" : "read-only", backend.kind(), path);
        return backend;
    }

    private static StorageBackend openWithFailover(Path path, BipLayout layout, boolean writable, FileMapper mapper)
            throws IOException {
        try {
            return MappedBackend.open(path, layout, writable, mapper);
        } catch (MappingFailedException e) {
            log.warn(
                    "Falling back to {} file {} manually instead of using a memory map. {}",
                    writable ? "writing" : "reading",
                    path,
                    e.getMessage());
            return ManualBackend.open(path, layout, writable);
        }
    }

    private static void checkRegularFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Path " + path + " is not a regular file");
        }
    }
}
