package com.initialone.jconstify.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 一次字面量出现。
 * offset：SAFE 为字面量本身的起始字符偏移；MANUAL 为所属拼接表达式的起始偏移。
 */
public final class LiteralOccurrence {
    public final String text;
    public final Path file;
    public final int offset;
    public final LiteralCategory category;

    public LiteralOccurrence(String text, Path file, int offset, LiteralCategory category) {
        this.text = Objects.requireNonNull(text, "text");
        this.file = file;
        this.offset = offset;
        this.category = Objects.requireNonNull(category, "category");
    }

    public boolean isSafe() {
        return category == LiteralCategory.SAFE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralOccurrence)) return false;
        LiteralOccurrence that = (LiteralOccurrence) o;
        return offset == that.offset
                && text.equals(that.text)
                && Objects.equals(file, that.file)
                && category == that.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, file, offset, category);
    }

    @Override
    public String toString() {
        return category + "[" + file + "@" + offset + "] \"" + text + "\"";
    }
}
