package com.rangesum.cache;

/**
 * 缓存容量非法（小于1）
 */
public class InvalidCapacityException extends IllegalArgumentException {
    private final long capacity;

    public InvalidCapacityException(long capacity) {
        super("Capacity must be positive, got " + capacity);
        this.capacity = capacity;
    }

    public long getCapacity() {
        return capacity;
    }
}
