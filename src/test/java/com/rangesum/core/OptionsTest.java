package com.rangesum.core;

import com.rangesum.cache.InvalidCapacityException;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class OptionsTest {

    @Test
    void testDefaults() {
        assertEquals(1000, Options.defaultOptions().getCacheCapacity());
    }

    @Test
    void testBuilder() {
        Options options = Options.builder().cacheCapacity(64).build();
        assertEquals(64, options.getCacheCapacity());
        assertEquals("Options{cacheCapacity=64}", options.toString());

        assertThrows(InvalidCapacityException.class, () -> Options.builder().cacheCapacity(0));
    }
}
