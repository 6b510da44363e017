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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Signals that a file was opened but its raster region could not be memory-mapped, for instance because the region
 * exceeds what a single view can address or the process ran out of address space.
 */
public class MappingFailedException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * @param path the file
     * @param size the size of the requested view
     * @param cause the mapping failure
     */
    public MappingFailedException(Path path, long size, Throwable cause) {
        super("Unable to map %,d bytes of %s: %s".formatted(size, path, cause.getMessage()), cause);
    }
}
