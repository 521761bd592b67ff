package com.example.mediacache.cache;

import java.nio.charset.StandardCharsets;

/**
 * 64-bit FNV-1 hash (multiply, then xor).
 */
final class Fnv64 {
    private static final long OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long PRIME = 0x100000001b3L;

    private Fnv64() {
    }

    static long hash(byte[] data) {
        long hash = OFFSET_BASIS;
        for (byte b : data) {
            hash *= PRIME;
            hash ^= (b & 0xff);
        }
        return hash;
    }

    static String hashToDecimal(String text) {
        return Long.toUnsignedString(hash(text.getBytes(StandardCharsets.UTF_8)));
    }
}
