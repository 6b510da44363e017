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
 * The I/O strategy a chipper or writer ended up with.
 */
public enum BackendKind {
    /** Samples are accessed through a memory-mapped view of the file. */
    MAPPED,
    /** Samples are accessed through explicit positioning and reads/writes on a file channel. */
    MANUAL
}
