package com.ownedset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OwnedSetConfigTest {

    @Test
    @DisplayName("Defaults are applied when nothing is set")
    void defaults() {
        OwnedSetConfig config = OwnedSetConfig.defaults();

        assertEquals(OwnedSetConfig.DEFAULT_NAME, config.getName());
        assertEquals(OwnedSetConfig.DEFAULT_INITIAL_CAPACITY, config.getInitialCapacity());
        assertTrue(config.isLeakDetection());
    }

    @Test
    @DisplayName("Builder values are kept")
    void builderValues() {
        OwnedSetConfig config = OwnedSetConfig.builder()
            .name("listeners")
            .initialCapacity(256)
            .leakDetection(false)
            .build();

        assertEquals("listeners", config.getName());
        assertEquals(256, config.getInitialCapacity());
        assertFalse(config.isLeakDetection());
        assertEquals("OwnedSetConfig[name=listeners, initialCapacity=256, leakDetection=false]", config.toString());
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void invalidValues() {
        assertThrows(IllegalArgumentException.class, () -> OwnedSetConfig.builder().initialCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> OwnedSetConfig.builder().initialCapacity(-4));
        assertThrows(IllegalArgumentException.class, () -> OwnedSetConfig.builder().name("  "));
        assertThrows(NullPointerException.class, () -> OwnedSetConfig.builder().name(null));
    }

    @Test
    @DisplayName("Set without leak detection still removes on close")
    void withoutLeakDetection() {
        OwnedSet<String> set = new OwnedSet<>(OwnedSetConfig.builder().leakDetection(false).build());
        SharedOwner<String> owner = set.insertShared("a");
        SharedOwner<String> copy = owner.share();

        owner.close();
        assertEquals(1, set.size());
        copy.close();
        copy.close();
        assertTrue(set.isEmpty());
    }
}
