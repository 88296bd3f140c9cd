package com.rangesum.core;

/**
 * 闭区间 [left, right] 查询的缓存键
 */
public final class IntervalKey {
    private final int left;
    private final int right;

    private IntervalKey(int left, int right) {
        this.left = left;
        this.right = right;
    }

    public static IntervalKey of(int left, int right) {
        if (left < 0 || right < left) {
            throw new IllegalArgumentException("Invalid interval [" + left + ", " + right + "]");
        }
        return new IntervalKey(left, right);
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }

    /**
     * 下标是否落在区间内
     */
    public boolean contains(int index) {
        return left <= index && index <= right;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        IntervalKey that = (IntervalKey) obj;
        return left == that.left && right == that.right;
    }

    @Override
    public int hashCode() {
        return 31 * left + right;
    }

    @Override
    public String toString() {
        return "[" + left + ", " + right + "]";
    }
}
