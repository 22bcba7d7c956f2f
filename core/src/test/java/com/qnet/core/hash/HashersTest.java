package com.qnet.core.hash;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashersTest {

    @Test
    @DisplayName("Fingerprint should not depend on id order")
    void testFingerprintOrderIndependent() {
        String a = Hashers.fingerprint(List.of("node-1", "node-2", "node-3"));
        String b = Hashers.fingerprint(List.of("node-3", "node-1", "node-2"));

        assertEquals(a, b);
        assertEquals(64, a.length());
        assertNotEquals(a, Hashers.fingerprint(List.of("node-1", "node-2")));
    }

    @Test
    @DisplayName("SHA-256 of a known input")
    void testSha256() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            Hashers.toHex(Hashers.sha256("abc")));
    }
}
