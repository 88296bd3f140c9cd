package com.rangesum.cache;

import java.util.List;
import java.util.Optional;

/**
 * 缓存接口
 */
public interface Cache<K, V> {
    /**
     * 插入或覆盖数据，并将其标记为最近使用
     */
    void put(K key, V value);

    /**
     * 查找缓存数据，命中时提升为最近使用
     */
    Optional<V> get(K key);

    /**
     * 删除缓存数据，键不存在时返回false
     */
    boolean delete(K key);

    /**
     * 获取当前所有键的快照
     */
    List<K> keys();

    /**
     * 判断键是否存在（不影响访问顺序）
     */
    boolean containsKey(K key);

    /**
     * 清空缓存
     */
    void clear();

    /**
     * 获取缓存条目数量
     */
    int size();

    /**
     * 获取缓存容量（条目数）
     */
    int getCapacity();

    /**
     * 获取缓存命中统计
     */
    CacheStats getStats();
}
