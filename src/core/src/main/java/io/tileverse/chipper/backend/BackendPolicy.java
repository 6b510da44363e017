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

/**
 * How a chipper or writer selects its {@link StorageBackend}. The selection happens once, at construction.
 */
public enum BackendPolicy {
    /** Map the file, falling back to manual access if the mapping fails. */
    AUTO,
    /** Map the file, a mapping failure is fatal. */
    MAPPED,
    /** Never map the file. */
    MANUAL
}
