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
package io.tileverse.chipper.compose;

import io.tileverse.chipper.array.ElementType;
import io.tileverse.chipper.array.ElementTypeMismatchException;
import io.tileverse.chipper.array.RasterArray;

final class PassthroughComposer implements BandComposer {

    static final PassthroughComposer INSTANCE = new PassthroughComposer();

    private PassthroughComposer() {}

    @Override
    public Mode mode() {
        return Mode.NONE;
    }

    @Override
    public int rawBands(int bands) {
        return bands;
    }

    @Override
    public void validate(ElementType rawType) {
        // any raw type can be passed through
    }

    @Override
    public RasterArray compose(RasterArray raw, ElementType rawType) {
        return check(raw, rawType, "raw read");
    }

    @Override
    public RasterArray decompose(RasterArray data, ElementType rawType) {
        return check(data, rawType, "data to write");
    }

    private static RasterArray check(RasterArray array, ElementType rawType, String context) {
        if (array.type() != rawType) {
            throw new ElementTypeMismatchException(rawType, array.type(), context);
        }
        return array;
    }

    @Override
    public String toString() {
        return "BandComposer[NONE]";
    }
}
