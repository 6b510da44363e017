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

import io.tileverse.chipper.array.ElementType;
import io.tileverse.chipper.array.RasterArray;
import java.util.function.UnaryOperator;

/**
 * A caller supplied, bidirectional mapping between raw samples and domain samples.
 * <p>
 * Typical uses are the SICD integer pixel types, for instance two {@code INT16} bands per pixel holding the real and
 * imaginary parts of one complex sample, or an {@code UINT8} amplitude/phase pair decoded through a lookup table.
 * The element types of the produced arrays can't be verified up front, so they are checked every time a direction is
 * applied.
 */
public interface SampleTransform {

    /**
     * @return the element type {@link #toDomain(RasterArray)} produces
     */
    ElementType domainType();

    /**
     * @return how many raw bands are stored per domain band, {@code 2} for real/imaginary pairs
     */
    default int rawBandFactor() {
        return 2;
    }

    /**
     * Read direction.
     *
     * @param raw samples of the raw element type, with {@code bands * rawBandFactor()} bands
     * @return samples of {@link #domainType()}
     */
    RasterArray toDomain(RasterArray raw);

    /**
     * Write direction.
     *
     * @param domain samples to write
     * @return samples of the raw element type, with {@code bands * rawBandFactor()} bands
     */
    RasterArray toRaw(RasterArray domain);

    /**
     * Builds a transform from two functions.
     *
     * @param domainType the element type produced by {@code toDomain}
     * @param toDomain read direction
     * @param toRaw write direction
     * @return a transform with a raw band factor of {@code 2}
     */
    static SampleTransform of(
            ElementType domainType, UnaryOperator<RasterArray> toDomain, UnaryOperator<RasterArray> toRaw) {
        requireNonNull(domainType, "domainType");
        requireNonNull(toDomain, "toDomain");
        requireNonNull(toRaw, "toRaw");
        return new SampleTransform() {
            @Override
            public ElementType domainType() {
                return domainType;
            }

            @Override
            public RasterArray toDomain(RasterArray raw) {
                return toDomain.apply(raw);
            }

            @Override
            public RasterArray toRaw(RasterArray domain) {
                return toRaw.apply(domain);
            }
        };
    }
}
