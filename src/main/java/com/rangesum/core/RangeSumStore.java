package com.rangesum.core;

import com.rangesum.cache.Cache;
import com.rangesum.cache.CacheStats;
import com.rangesum.cache.LRUCache;

import java.util.Objects;
import java.util.Optional;

/**
 * 带LRU缓存的区间和存储
 *
 * <p>查询结果按区间 [left, right] 缓存。每次单点更新后，所有包含该下标的
 * 缓存区间都会被删除，因此缓存中的值始终等于当前数组上的真实区间和。
 * 失效操作扫描全部缓存键，代价与缓存大小成正比。
 *
 * <p>非线程安全。多线程共享同一实例时，调用方需要用同一把锁包住每次
 * {@link #rangeSum} 和 {@link #update} 调用。
 */
public class RangeSumStore {
    private final long[] values;
    private final Cache<IntervalKey, Long> cache;

    private boolean lastQueryHit;
    private long invalidationCount;

    public RangeSumStore(long[] initialValues, int cacheCapacity) {
        this(initialValues, new LRUCache<>(cacheCapacity));
    }

    public RangeSumStore(long[] initialValues, Options options) {
        this(initialValues, options.getCacheCapacity());
    }

    RangeSumStore(long[] initialValues, Cache<IntervalKey, Long> cache) {
        Objects.requireNonNull(initialValues, "Initial values cannot be null");
        this.values = initialValues.clone();
        this.cache = Objects.requireNonNull(cache, "Cache cannot be null");
        this.lastQueryHit = false;
        this.invalidationCount = 0;
    }

    /**
     * 计算闭区间 [left, right] 的和，优先读取缓存
     *
     * @throws OutOfRangeException 区间越界或 left &gt; right，此时不修改任何状态
     */
    public long rangeSum(int left, int right) {
        if (left < 0 || right >= values.length || left > right) {
            throw new OutOfRangeException(left, right, values.length);
        }

        IntervalKey key = IntervalKey.of(left, right);
        Optional<Long> cached = cache.get(key);
        if (cached.isPresent()) {
            lastQueryHit = true;
            return cached.get();
        }

        long sum = sumDirect(left, right);
        cache.put(key, sum);
        lastQueryHit = false;
        return sum;
    }

    /**
     * 更新单个元素，并使所有包含该下标的缓存区间失效
     *
     * @throws OutOfRangeException 下标越界，此时不修改任何状态
     */
    public void update(int index, long value) {
        checkIndex(index);

        values[index] = value;

        // keys() 返回快照，遍历期间可以删除
        for (IntervalKey key : cache.keys()) {
            if (key.contains(index) && cache.delete(key)) {
                invalidationCount++;
            }
        }
    }

    public long get(int index) {
        checkIndex(index);
        return values[index];
    }

    public int length() {
        return values.length;
    }

    public long[] toArray() {
        return values.clone();
    }

    /**
     * 区间是否已缓存（不改变访问顺序）
     */
    public boolean isCached(int left, int right) {
        if (left < 0 || right >= values.length || left > right) {
            return false;
        }
        return cache.containsKey(IntervalKey.of(left, right));
    }

    public int cacheSize() {
        return cache.size();
    }

    public int cacheCapacity() {
        return cache.getCapacity();
    }

    /**
     * 最近一次成功的查询是否命中缓存
     */
    public boolean lastQueryHit() {
        return lastQueryHit;
    }

    /**
     * 因更新而被删除的缓存区间总数
     */
    public long invalidationCount() {
        return invalidationCount;
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    /**
     * 清空缓存，数组内容不变
     */
    public void clearCache() {
        cache.clear();
    }

    private long sumDirect(int left, int right) {
        long sum = 0;
        for (int i = left; i <= right; i++) {
            sum += values[i];
        }
        return sum;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= values.length) {
            throw new OutOfRangeException(index, values.length);
        }
    }

    @Override
    public String toString() {
        CacheStats stats = cache.getStats();
        return String.format("RangeSumStore{length=%d, cached=%d, capacity=%d, hitRate=%.2f, invalidations=%d}",
                values.length, cache.size(), cache.getCapacity(), stats.getHitRate(), invalidationCount);
    }
}
