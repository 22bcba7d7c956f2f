package com.qnet.core.hash;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stable hash helpers used to fingerprint weight snapshots.
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Computes the SHA-256 hash of a UTF-8 string.
     *
     * @param str Input string
     * @return 32-byte SHA-256 hash
     */
    public static byte[] sha256(String str) {
        return Hashing.sha256().hashString(str, StandardCharsets.UTF_8).asBytes();
    }

    /**
     * Converts a byte array to a hex string (lowercase).
     *
     * @param bytes Input bytes
     * @return Hex string (e.g., "a3f2...")
     */
    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /**
     * Fingerprints a node-id set independent of iteration order.
     *
     * @param nodeIds node identifiers
     * @return hex SHA-256 of the sorted, comma-joined ids
     */
    public static String fingerprint(Iterable<String> nodeIds) {
        List<String> sorted = new ArrayList<>();
        nodeIds.forEach(sorted::add);
        Collections.sort(sorted);
        return toHex(sha256(String.join(",", sorted)));
    }
}
