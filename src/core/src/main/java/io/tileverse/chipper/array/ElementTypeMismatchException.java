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
package io.tileverse.chipper.array;

/**
 * Thrown when an array, or the output of a sample transform, does not have the element type the operation requires.
 * <p>
 * Raised before any I/O takes place: a rejected write leaves the target file untouched.
 */
public class ElementTypeMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final ElementType expected;
    private final ElementType actual;

    /**
     * @param expected the required element type
     * @param actual the element type found, may be {@code null} if there was no array at all
     * @param context what produced the offending array, used in the message
     */
    public ElementTypeMismatchException(ElementType expected, ElementType actual, String context) {
        super("Expected element type %s, got %s from %s".formatted(expected, actual, context));
        this.expected = expected;
        this.actual = actual;
    }

    public ElementType getExpected() {
        return expected;
    }

    public ElementType getActual() {
        return actual;
    }
}
