package com.rangesum.core;

/**
 * 查询区间或更新下标越界
 */
public class OutOfRangeException extends IndexOutOfBoundsException {
    private final int left;
    private final int right;
    private final int length;

    public OutOfRangeException(int index, int length) {
        super(String.format("Index %d out of range [0, %d)", index, length));
        this.left = index;
        this.right = index;
        this.length = length;
    }

    public OutOfRangeException(int left, int right, int length) {
        super(String.format("Interval [%d, %d] out of range [0, %d)", left, right, length));
        this.left = left;
        this.right = right;
        this.length = length;
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }

    public int getLength() {
        return length;
    }
}
