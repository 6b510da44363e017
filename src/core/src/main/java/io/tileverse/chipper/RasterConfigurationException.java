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

/**
 * Thrown when a chipper or writer can't be constructed because its raster description is inconsistent: invalid
 * shape, offset or band count, a band composition incompatible with the raw element type, or a file too short for
 * the declared raster.
 * <p>
 * No object is produced and no resource is left open when this exception is raised.
 */
public class RasterConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message the detail message
     */
    public RasterConfigurationException(String message) {
        super(message);
    }
}
