package com.chicu.regimetrader.validation;

/**
 * Полуоткрытый диапазон индексов баров [start, end).
 */
public record IndexRange(int start, int end) {

    public IndexRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + "," + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }

    public boolean overlaps(IndexRange other) {
        return start < other.end && other.start < end;
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")";
    }
}
