package com.rangesum.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 随机操作序列下与访问顺序LinkedHashMap对照
 */
class LRUCacheReferenceTest {

    private static final int OPERATIONS = 20_000;

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 17, 40})
    @DisplayName("任意put/get/delete序列的淘汰顺序与参考实现一致")
    void testMatchesAccessOrderedMap(int capacity) {
        Random random = new Random(7L * capacity + 1);
        LRUCache<Integer, Integer> cache = new LRUCache<>(capacity);
        LinkedHashMap<Integer, Integer> reference = new LinkedHashMap<>(16, 0.75f, true);
        int keySpace = capacity * 3 + 2;

        for (int op = 0; op < OPERATIONS; op++) {
            int key = random.nextInt(keySpace);
            int choice = random.nextInt(10);
            if (choice < 5) {
                int value = random.nextInt(1000);
                cache.put(key, value);
                referencePut(reference, key, value, capacity);
            } else if (choice < 9) {
                Optional<Integer> expected = Optional.ofNullable(reference.get(key));
                assertEquals(expected, cache.get(key), "get at step " + op);
            } else {
                boolean expected = reference.remove(key) != null;
                assertEquals(expected, cache.delete(key), "delete at step " + op);
            }

            assertEquals(mostRecentFirst(reference), cache.keys(), "keys at step " + op);
        }
    }

    private static void referencePut(LinkedHashMap<Integer, Integer> reference, int key, int value, int capacity) {
        reference.put(key, value);
        if (reference.size() > capacity) {
            Iterator<Map.Entry<Integer, Integer>> it = reference.entrySet().iterator();
            it.next();
            it.remove();
        }
    }

    private static List<Integer> mostRecentFirst(LinkedHashMap<Integer, Integer> reference) {
        List<Integer> keys = new ArrayList<>(reference.keySet());
        Collections.reverse(keys);
        return keys;
    }
}
