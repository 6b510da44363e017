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

import static java.util.Objects.requireNonNull;

import io.tileverse.chipper.RasterConfigurationException;
import io.tileverse.chipper.array.ElementType;
import io.tileverse.chipper.array.ElementTypeMismatchException;
import io.tileverse.chipper.array.RasterArray;

final class TransformComposer implements BandComposer {

    private final SampleTransform transform;

    TransformComposer(SampleTransform transform) {
        this.transform = requireNonNull(transform, "transform");
    }

    @Override
    public Mode mode() {
        return Mode.TRANSFORM;
    }

    @Override
    public int rawBands(int bands) {
        return bands * transform.rawBandFactor();
    }

    @Override
    public void validate(ElementType rawType) {
        if (transform.domainType() == null) {
            throw new RasterConfigurationException("Sample transform declares no domain type");
        }
        if (transform.rawBandFactor() < 1) {
            throw new RasterConfigurationException("Invalid raw band factor: " + transform.rawBandFactor());
        }
    }

    @Override
    public RasterArray compose(RasterArray raw, ElementType rawType) {
        RasterArray domain = transform.toDomain(raw);
        ElementType expected = transform.domainType();
        if (domain == null || domain.type() != expected) {
            throw new ElementTypeMismatchException(
                    expected, domain == null ? null : domain.type(), "sample transform (read direction)");
        }
        return domain;
    }

    @Override
    public RasterArray decompose(RasterArray data, ElementType rawType) {
        RasterArray raw = transform.toRaw(data);
        if (raw == null || raw.type() != rawType) {
            throw new ElementTypeMismatchException(
                    rawType, raw == null ? null : raw.type(), "sample transform (write direction)");
        }
        return raw;
    }

    @Override
    public String toString() {
        return "BandComposer[TRANSFORM " + transform.domainType() + "]";
    }
}
