package com.initialone.jconstify.util;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;

import java.util.Arrays;
import java.util.Optional;

/**
 * JavaParser 的 (line, column) -> 源码字符偏移。
 * 行终止符与 JavaParser 一致：\n、\r\n、\r；列从 1 开始，tab 记 1 列。
 */
public final class SourceOffsets {
    private final int[] lineStarts;
    private final int length;

    public SourceOffsets(String source) {
        int[] starts = new int[16];
        int n = 0;
        starts[n++] = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r') {
                if (i + 1 < source.length() && source.charAt(i + 1) == '\n') i++;
            } else if (c != '\n') {
                continue;
            }
            if (n == starts.length) starts = Arrays.copyOf(starts, n * 2);
            starts[n++] = i + 1;
        }
        this.lineStarts = Arrays.copyOf(starts, n);
        this.length = source.length();
    }

    public int offsetOf(Position p) {
        int line = Math.max(1, Math.min(p.line, lineStarts.length));
        return Math.min(length, lineStarts[line - 1] + p.column - 1);
    }

    /** 节点起始偏移（含） */
    public Optional<Integer> begin(Node node) {
        return node.getRange().map(r -> offsetOf(r.begin));
    }

    /** 节点结束偏移（不含） */
    public Optional<Integer> end(Node node) {
        return node.getRange().map(r -> Math.min(length, offsetOf(r.end) + 1));
    }

    public Optional<Span> span(Node node) {
        return node.getRange().map(r -> new Span(offsetOf(r.begin), Math.min(length, offsetOf(r.end) + 1)));
    }

    /** [start, end) */
    public static final class Span {
        public final int start;
        public final int end;

        public Span(int start, int end) {
            this.start = start;
            this.end = end;
        }

        public boolean contains(int from, int to) {
            return from >= start && to <= end;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Span)) return false;
            Span s = (Span) o;
            return s.start == start && s.end == end;
        }

        @Override
        public int hashCode() {
            return 31 * start + end;
        }

        @Override
        public String toString() {
            return "[" + start + "," + end + ")";
        }
    }
}
