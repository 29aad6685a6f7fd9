package com.codeaudit.syntax;

/**
 * 源码区间 [start, end)，以规范化文本中的字符偏移表示
 */
public record SourceSpan(int start, int end) implements Comparable<SourceSpan> {

    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("非法区间: [" + start + ", " + end + ")");
        }
    }

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean contains(SourceSpan other) {
        return start <= other.start && other.end <= end;
    }

    public boolean overlaps(SourceSpan other) {
        return start < other.end && other.start < end;
    }

    @Override
    public int compareTo(SourceSpan other) {
        if (start != other.start) {
            return Integer.compare(start, other.start);
        }
        // 起点相同时外层（更长）的区间排在前面
        return Integer.compare(other.end, end);
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + ")";
    }
}
