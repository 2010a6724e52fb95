package com.coordkit.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyUtilsTest {

    @Test
    void buildKeyPrependsPrefix() {
        assertEquals("lock:order", KeyUtils.buildKey("lock:", "order"));
    }

    @Test
    void emptyPrefixLeavesKeyUnchanged() {
        assertEquals("order", KeyUtils.buildKey("", "order"));
        assertEquals("order", KeyUtils.buildKey(null, "order"));
    }

    @Test
    void buildKeysKeepsOrder() {
        assertArrayEquals(new String[]{"p:a", "p:b"}, KeyUtils.buildKeys("p:", "a", "b"));
        assertEquals(0, KeyUtils.buildKeys("p:").length);
    }

    @Test
    void requireKeyRejectsBlank() {
        assertEquals("k", KeyUtils.requireKey("k"));
        assertThrows(IllegalArgumentException.class, () -> KeyUtils.requireKey(null));
        assertThrows(IllegalArgumentException.class, () -> KeyUtils.requireKey(""));
        assertThrows(IllegalArgumentException.class, () -> KeyUtils.requireKey("  "));
    }
}
