package com.rangesum.cache;

/**
 * 缓存计数器
 *
 * <p>只由所属缓存在单线程内更新，对外通过 {@link Cache#getStats()} 提供快照。
 */
public class CacheStats {
    private long hits;
    private long misses;
    private long inserts;
    private long overwrites;
    private long deletes;
    private long evictions;

    CacheStats() {
    }

    /**
     * 快照拷贝
     */
    public CacheStats(CacheStats source) {
        this.hits = source.hits;
        this.misses = source.misses;
        this.inserts = source.inserts;
        this.overwrites = source.overwrites;
        this.deletes = source.deletes;
        this.evictions = source.evictions;
    }

    void recordHit() {
        hits++;
    }

    void recordMiss() {
        misses++;
    }

    void recordInsert() {
        inserts++;
    }

    // put 覆盖已有键
    void recordOverwrite() {
        overwrites++;
    }

    void recordDelete() {
        deletes++;
    }

    void recordEviction() {
        evictions++;
    }

    public long getHitCount() {
        return hits;
    }

    public long getMissCount() {
        return misses;
    }

    public long getInsertCount() {
        return inserts;
    }

    public long getOverwriteCount() {
        return overwrites;
    }

    public long getDeleteCount() {
        return deletes;
    }

    public long getEvictionCount() {
        return evictions;
    }

    /**
     * get 调用总数
     */
    public long getLookupCount() {
        return hits + misses;
    }

    public double getHitRate() {
        long lookups = getLookupCount();
        return lookups > 0 ? (double) hits / lookups : 0.0;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{lookups=%d, hitRate=%.3f, inserts=%d, overwrites=%d, deletes=%d, evictions=%d}",
                getLookupCount(), getHitRate(), inserts, overwrites, deletes, evictions);
    }
}
