/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
/**
 * Key-value storage engine: an in-memory sorted map made durable by a
 * write-ahead log and a snapshot file.
 * <ul>
 *   <li>{@link dev.mars.raftkv.storage.KvStorage} - The storage interface</li>
 *   <li>{@link dev.mars.raftkv.storage.FileKvStorage} - File-based implementation</li>
 *   <li>{@link dev.mars.raftkv.storage.KvStorageConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Write-ahead:</b> a mutation is on disk before the map changes</li>
 *   <li><b>Exactly-once apply:</b> committed entries at or below the last applied index are skipped</li>
 *   <li><b>All-or-nothing snapshots:</b> a snapshot is validated completely before it replaces the key space</li>
 * </ul>
 *
 * @see dev.mars.raftkv.storage.KvStorage
 */
package dev.mars.raftkv.storage;
