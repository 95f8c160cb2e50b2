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
 * Peer transport: delivery of protocol messages between nodes.
 * <ul>
 *   <li>{@link dev.mars.raftkv.transport.PeerDirectory} - explicit id to address table</li>
 *   <li>{@link dev.mars.raftkv.transport.MessageCodec} - CRC-checked length-prefixed frames</li>
 *   <li>{@link dev.mars.raftkv.transport.TcpPeerTransport} - outbound, bounded and asynchronous</li>
 *   <li>{@link dev.mars.raftkv.transport.PeerListener} - inbound, feeds the driver</li>
 * </ul>
 */
package dev.mars.raftkv.transport;
