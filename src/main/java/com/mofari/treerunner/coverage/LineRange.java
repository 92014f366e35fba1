package com.mofari.treerunner.coverage;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * 单个未运行行，或连续未运行行组成的闭区间
 */
public final class LineRange {

    private final int start;
    private final int end;

    private LineRange(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public static LineRange single(int line) {
        return new LineRange(line, line);
    }

    public static LineRange of(int start, int end) {
        if (end < start) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
        return new LineRange(start, end);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean isSingle() {
        return start == end;
    }

    public int size() {
        return end - start + 1;
    }

    /**
     * JSON 形式：单行为数字，区间为两个元素的数组
     */
    @JsonValue
    public Object toJson() {
        return isSingle() ? (Object) start : new int[]{start, end};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LineRange)) {
            return false;
        }
        LineRange other = (LineRange) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return isSingle() ? Integer.toString(start) : start + "-" + end;
    }
}
