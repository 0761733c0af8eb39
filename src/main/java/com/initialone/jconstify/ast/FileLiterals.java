package com.initialone.jconstify.ast;

import com.initialone.jconstify.model.LiteralOccurrence;
import com.initialone.jconstify.util.SourceOffsets.Span;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** LiteralCollector 对单个文件的结果 */
public final class FileLiterals {
    public final Path file;
    /** 可自动替换（允许重复，调用方去重） */
    public final List<LiteralOccurrence> safe;
    /** 需人工确认（不去重，保留出处） */
    public final List<LiteralOccurrence> manual;
    /** 被跳过的源码区间，改写阶段不得触碰 */
    public final List<Span> protectedRanges;
    /** 文件中所有 "..." 字面量 token 的区间 */
    public final Set<Span> literalSpans;
    /** 纯字面量 + 拼接的区间 -> 合并后的文本，改写时整体替换 */
    public final Map<Span, String> concatenations;

    FileLiterals(Path file, List<LiteralOccurrence> safe, List<LiteralOccurrence> manual,
                 List<Span> protectedRanges, Set<Span> literalSpans, Map<Span, String> concatenations) {
        this.file = file;
        this.safe = Collections.unmodifiableList(new ArrayList<>(safe));
        this.manual = Collections.unmodifiableList(new ArrayList<>(manual));
        this.protectedRanges = Collections.unmodifiableList(new ArrayList<>(protectedRanges));
        this.literalSpans = Collections.unmodifiableSet(new HashSet<>(literalSpans));
        this.concatenations = Collections.unmodifiableMap(new LinkedHashMap<>(concatenations));
    }

    public List<String> safeTexts() {
        List<String> out = new ArrayList<>(safe.size());
        for (LiteralOccurrence o : safe) out.add(o.text);
        return out;
    }

    public List<LiteralOccurrence> all() {
        List<LiteralOccurrence> out = new ArrayList<>(safe.size() + manual.size());
        out.addAll(safe);
        out.addAll(manual);
        return out;
    }

    public boolean isProtected(int start, int end) {
        for (Span s : protectedRanges) {
            if (s.contains(start, end)) return true;
        }
        return false;
    }

    public boolean isLiteralToken(int start, int end) {
        return literalSpans.contains(new Span(start, end));
    }
}
