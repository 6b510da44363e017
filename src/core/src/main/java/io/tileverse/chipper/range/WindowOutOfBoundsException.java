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
package io.tileverse.chipper.range;

/**
 * Thrown when a requested window, once normalized, reaches outside the bounds of the raster axis it addresses.
 * <p>
 * Windows are never clamped: callers wanting clamping must clamp before issuing the request.
 */
public class WindowOutOfBoundsException extends IndexOutOfBoundsException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message the detail message
     */
    public WindowOutOfBoundsException(String message) {
        super(message);
    }

    static WindowOutOfBoundsException of(AxisRange request, IndexRange resolved, int length) {
        return new WindowOutOfBoundsException("Range %s resolves to indices [%d, %d], outside of axis bounds [0, %d)"
                .formatted(request, resolved.min(), resolved.max(), length));
    }
}
