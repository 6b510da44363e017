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
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileChannel.MapMode;

/**
 * Maps a region of a file channel into memory. {@link #DEFAULT} delegates to {@link FileChannel#map}; other
 * implementations can decorate it, for instance to restrict the size of the views a process is allowed to map.
 */
@FunctionalInterface
public interface FileMapper {

    /** Maps through {@link FileChannel#map(MapMode, long, long)}. */
    FileMapper DEFAULT = FileChannel::map;

    /**
     * @param channel an open channel, readable, and writable if {@code mode} is {@link MapMode#READ_WRITE}
     * @param mode the mapping mode
     * @param position file position where the view starts
     * @param size size of the view in bytes
     * @return the mapped view
     * @throws IOException if the mapping fails
     */
    MappedByteBuffer map(FileChannel channel, MapMode mode, long position, long size) throws IOException;
}
