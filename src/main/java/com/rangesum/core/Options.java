package com.rangesum.core;

import com.rangesum.cache.InvalidCapacityException;

/**
 * 区间和存储配置选项
 */
public class Options {
    public static final int DEFAULT_CACHE_CAPACITY = 1000;

    private final int cacheCapacity;

    private Options(Builder builder) {
        this.cacheCapacity = builder.cacheCapacity;
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    /**
     * Builder模式创建配置
     */
    public static class Builder {
        private int cacheCapacity = DEFAULT_CACHE_CAPACITY;

        public Builder cacheCapacity(int capacity) {
            if (capacity <= 0) throw new InvalidCapacityException(capacity);
            this.cacheCapacity = capacity;
            return this;
        }

        public Options build() {
            return new Options(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Options defaultOptions() {
        return new Builder().build();
    }

    @Override
    public String toString() {
        return String.format("Options{cacheCapacity=%d}", cacheCapacity);
    }
}
