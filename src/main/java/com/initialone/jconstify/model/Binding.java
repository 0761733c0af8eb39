package com.initialone.jconstify.model;

import java.nio.file.Path;
import java.util.Objects;

/** 字面量文本 ↔ 常量名，一次运行内 literalText 与 identifierName 都唯一 */
public final class Binding {
    public final String literalText;
    public final String identifierName;
    public final LiteralCategory category;
    /** 首次出现的位置（用于 manual 区块的 "Found in" 注释） */
    public final Path firstSeenFile;
    public final int firstSeenOffset;

    public Binding(String literalText, String identifierName, LiteralOccurrence firstSeen) {
        this.literalText = Objects.requireNonNull(literalText, "literalText");
        this.identifierName = Objects.requireNonNull(identifierName, "identifierName");
        this.category = firstSeen.category;
        this.firstSeenFile = firstSeen.file;
        this.firstSeenOffset = firstSeen.offset;
    }

    public boolean isSafe() {
        return category == LiteralCategory.SAFE;
    }

    @Override
    public String toString() {
        return identifierName + " = \"" + literalText + "\" (" + category + ")";
    }
}
