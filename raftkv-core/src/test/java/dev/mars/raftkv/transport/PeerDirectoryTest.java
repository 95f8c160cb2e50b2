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
package dev.mars.raftkv.transport;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeerDirectoryTest {

    @Test
    void testFromPeerList_AssignsIdsByPosition() {
        PeerDirectory directory = PeerDirectory.fromPeerList(
                List.of("10.0.0.1:5001", "10.0.0.2:5002", "10.0.0.3:5003"));

        assertEquals(3, directory.size());
        assertEquals("10.0.0.2", directory.address(2).orElseThrow().getHostString());
        assertEquals(5003, directory.address(3).orElseThrow().getPort());
        assertTrue(directory.address(4).isEmpty());
    }

    @Test
    void testParseAddress_Ipv6InBrackets() {
        InetSocketAddress address = PeerDirectory.parseAddress("[::1]:6000");

        assertEquals("::1", address.getHostString());
        assertEquals(6000, address.getPort());
        assertTrue(address.isUnresolved());
    }

    @Test
    void testParseAddress_Malformed_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> PeerDirectory.parseAddress("no-port"));
        assertThrows(IllegalArgumentException.class, () -> PeerDirectory.parseAddress("host:"));
        assertThrows(IllegalArgumentException.class, () -> PeerDirectory.parseAddress(":80"));
        assertThrows(IllegalArgumentException.class, () -> PeerDirectory.parseAddress("host:abc"));
        assertThrows(IllegalArgumentException.class, () -> PeerDirectory.parseAddress("host:70000"));
        assertThrows(IllegalArgumentException.class, () -> PeerDirectory.parseAddress(" "));
    }

    @Test
    void testPutAndRemove_NonContiguousIds() {
        PeerDirectory directory = new PeerDirectory();
        directory.put(7, PeerDirectory.parseAddress("a:1"));
        directory.put(42, PeerDirectory.parseAddress("b:2"));
        directory.put(7, PeerDirectory.parseAddress("c:3"));

        directory.remove(42);

        assertEquals(List.of(7L), List.copyOf(directory.asMap().keySet()));
        assertEquals("c", directory.address(7).orElseThrow().getHostString());
        assertFalse(directory.contains(42));
        assertThrows(IllegalArgumentException.class, () -> directory.put(0, PeerDirectory.parseAddress("d:4")));
    }
}
