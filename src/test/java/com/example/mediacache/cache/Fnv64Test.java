package com.example.mediacache.cache;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;

class Fnv64Test {
    @Test
    void matchesReferenceVectors() {
        assertEquals(0xcbf29ce484222325L, Fnv64.hash(new byte[0]));
        assertEquals(0xaf63bd4c8601b7beL, Fnv64.hash("a".getBytes(StandardCharsets.UTF_8)));
        assertEquals("14695981039346656037", Fnv64.hashToDecimal(""));
    }
}
