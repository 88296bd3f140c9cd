package com.rangesum.cache;

import java.util.*;

/**
 * 基于LRU算法的缓存实现
 *
 * <p>键到槽位的映射使用HashMap，访问顺序由按槽位下标链接的双向链表维护，
 * 头部为最近使用，尾部为最久未使用。槽位数组按需扩容，上限为容量，
 * 删除或淘汰释放的槽位进入空闲栈复用。
 *
 * <p>非线程安全，并发访问需要调用方加锁。
 */
public class LRUCache<K, V> implements Cache<K, V> {
    private static final int NIL = -1;
    private static final int INITIAL_SLOTS = 16;

    private final int capacity;
    private final Map<K, Integer> index;
    private final CacheStats stats;

    // 槽位数组
    private Object[] slotKeys;
    private Object[] slotValues;
    private int[] prev;
    private int[] next;

    private int head;
    private int tail;

    // 空闲槽位栈，以及尚未使用过的下一个槽位
    private int[] freeSlots;
    private int freeTop;
    private int nextFresh;

    public LRUCache(int capacity) {
        if (capacity <= 0) {
            throw new InvalidCapacityException(capacity);
        }

        this.capacity = capacity;
        this.index = new HashMap<>();
        this.stats = new CacheStats();

        int slots = Math.min(capacity, INITIAL_SLOTS);
        this.slotKeys = new Object[slots];
        this.slotValues = new Object[slots];
        this.prev = new int[slots];
        this.next = new int[slots];
        this.freeSlots = new int[slots];
        this.head = NIL;
        this.tail = NIL;
        this.freeTop = 0;
        this.nextFresh = 0;
    }

    @Override
    public void put(K key, V value) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");

        Integer slot = index.get(key);
        if (slot != null) {
            // 覆盖已有条目，数量不变，不触发淘汰
            slotValues[slot] = value;
            moveToHead(slot);
            stats.recordOverwrite();
            return;
        }

        // 先腾出位置，新插入的键不会成为淘汰对象
        if (index.size() >= capacity) {
            evictOldest();
        }

        int s = allocateSlot();
        slotKeys[s] = key;
        slotValues[s] = value;
        linkAtHead(s);
        index.put(key, s);
        stats.recordInsert();
    }

    @Override
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "Key cannot be null");

        Integer slot = index.get(key);
        if (slot == null) {
            stats.recordMiss();
            return Optional.empty();
        }

        moveToHead(slot);
        stats.recordHit();
        return Optional.of(valueAt(slot));
    }

    @Override
    public boolean delete(K key) {
        Objects.requireNonNull(key, "Key cannot be null");

        Integer slot = index.remove(key);
        if (slot == null) {
            return false;
        }

        unlink(slot);
        releaseSlot(slot);
        stats.recordDelete();
        return true;
    }

    /**
     * 返回键的快照，顺序为最近使用到最久未使用。
     * 快照与内部链表无关，遍历时可以安全地调用delete
     */
    @Override
    public List<K> keys() {
        List<K> result = new ArrayList<>(index.size());
        for (int s = head; s != NIL; s = next[s]) {
            result.add(keyAt(s));
        }
        return result;
    }

    @Override
    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return index.containsKey(key);
    }

    /**
     * 清空条目，统计信息保留
     */
    @Override
    public void clear() {
        index.clear();
        Arrays.fill(slotKeys, null);
        Arrays.fill(slotValues, null);
        head = NIL;
        tail = NIL;
        freeTop = 0;
        nextFresh = 0;
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(stats); // 返回拷贝
    }

    /**
     * 获取最久未使用的键（用于测试和监控）
     */
    Optional<K> eldestKey() {
        return tail == NIL ? Optional.empty() : Optional.of(keyAt(tail));
    }

    /**
     * 淘汰最旧的条目
     */
    private void evictOldest() {
        if (tail == NIL) {
            return;
        }

        int victim = tail;
        index.remove(keyAt(victim));
        unlink(victim);
        releaseSlot(victim);
        stats.recordEviction();
    }

    private void moveToHead(int s) {
        if (s == head) {
            return;
        }
        unlink(s);
        linkAtHead(s);
    }

    private void linkAtHead(int s) {
        prev[s] = NIL;
        next[s] = head;
        if (head != NIL) {
            prev[head] = s;
        }
        head = s;
        if (tail == NIL) {
            tail = s;
        }
    }

    private void unlink(int s) {
        if (prev[s] != NIL) {
            next[prev[s]] = next[s];
        } else {
            head = next[s];
        }

        if (next[s] != NIL) {
            prev[next[s]] = prev[s];
        } else {
            tail = prev[s];
        }

        prev[s] = NIL;
        next[s] = NIL;
    }

    private int allocateSlot() {
        if (freeTop > 0) {
            return freeSlots[--freeTop];
        }
        if (nextFresh == slotKeys.length) {
            grow();
        }
        return nextFresh++;
    }

    private void releaseSlot(int s) {
        slotKeys[s] = null;
        slotValues[s] = null;
        freeSlots[freeTop++] = s;
    }

    /**
     * 槽位数组翻倍扩容，不超过容量
     */
    private void grow() {
        int newLength = (int) Math.min((long) slotKeys.length * 2, capacity);
        slotKeys = Arrays.copyOf(slotKeys, newLength);
        slotValues = Arrays.copyOf(slotValues, newLength);
        prev = Arrays.copyOf(prev, newLength);
        next = Arrays.copyOf(next, newLength);
        freeSlots = Arrays.copyOf(freeSlots, newLength);
    }

    @SuppressWarnings("unchecked")
    private K keyAt(int s) {
        return (K) slotKeys[s];
    }

    @SuppressWarnings("unchecked")
    private V valueAt(int s) {
        return (V) slotValues[s];
    }

    @Override
    public String toString() {
        return String.format("LRUCache{entries=%d, capacity=%d, hitRate=%.2f, evictions=%d}",
                index.size(), capacity, stats.getHitRate(), stats.getEvictionCount());
    }
}
