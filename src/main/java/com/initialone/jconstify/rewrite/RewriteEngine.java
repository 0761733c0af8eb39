package com.initialone.jconstify.rewrite;

import com.github.javaparser.ast.CompilationUnit;
import com.initialone.jconstify.ast.FileLiterals;
import com.initialone.jconstify.ast.JavaSources;
import com.initialone.jconstify.ast.LiteralCollector;
import com.initialone.jconstify.model.Binding;
import com.initialone.jconstify.naming.SymbolTable;
import com.initialone.jconstify.util.JavaStrings;
import com.initialone.jconstify.util.SourceOffsets.Span;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文本级替换："字面量" -> 常量名，然后补 import。
 *
 * 每个绑定预编译成一条精确匹配规则（Pattern.quote），命中必须同时满足：
 * - 恰好覆盖一个字符串字面量 token（排除注释里的文本、两个字面量之间的 " + " 之类的误命中）；
 * - 不在保护区间内（日志调用、异常构造、注解、map 键）。
 * 纯字面量的 + 拼接按整个表达式区间替换成合并文本对应的常量。
 * 所有命中都基于原文计算后一次性应用，替换进去的标识符不会被后续规则再次匹配；
 * 区间重叠时保留起点最早、范围最大的那一处。
 */
public class RewriteEngine {

    private final JavaSources sources;
    private final LiteralCollector collector;
    private final ImportInjector importer;
    private final List<Rule> rules = new ArrayList<>();
    private final Map<String, String> identifiers = new HashMap<>();

    /**
     * @param importer 为 null 时不补 import（常量类在默认包）
     */
    public RewriteEngine(SymbolTable table, JavaSources sources, LiteralCollector collector, ImportInjector importer) {
        this.sources = sources;
        this.collector = collector;
        this.importer = importer;
        for (Binding b : table.all()) {
            rules.add(new Rule(Pattern.compile(Pattern.quote(JavaStrings.quote(b.literalText))), b.identifierName));
            identifiers.put(b.literalText, b.identifierName);
        }
    }

    public Result rewrite(Path file, String source) {
        Optional<CompilationUnit> cu = sources.parseQuietly(source);
        if (cu.isEmpty()) {
            System.err.println("[rewrite] skip (no syntax tree): " + file);
            return new Result(source, 0, false, false);
        }
        FileLiterals literals = collector.collect(cu.get(), file, source);

        List<Edit> edits = new ArrayList<>();
        for (Rule r : rules) {
            Matcher m = r.pattern.matcher(source);
            int from = 0;
            while (from <= source.length() && m.find(from)) {
                int start = m.start();
                int end = m.end();
                if (literals.isLiteralToken(start, end) && !literals.isProtected(start, end)) {
                    edits.add(new Edit(start, end, r.identifier));
                    from = end;
                } else {
                    // 误命中（如跨越两个字面量的引号），从下一个字符继续找
                    from = start + 1;
                }
            }
        }
        for (Map.Entry<Span, String> c : literals.concatenations.entrySet()) {
            String identifier = identifiers.get(c.getValue());
            Span span = c.getKey();
            if (identifier != null && !literals.isProtected(span.start, span.end)) {
                edits.add(new Edit(span.start, span.end, identifier));
            }
        }
        edits.sort(Comparator.comparingInt((Edit e) -> e.start).thenComparingInt(e -> -e.end));

        StringBuilder out = new StringBuilder(source.length());
        int pos = 0;
        int applied = 0;
        for (Edit e : edits) {
            if (e.start < pos) continue;
            out.append(source, pos, e.start).append(e.replacement);
            pos = e.end;
            applied++;
        }
        out.append(source, pos, source.length());
        String rewritten = out.toString();

        boolean importAdded = false;
        if (importer != null) {
            String withImport = importer.ensureImport(rewritten);
            importAdded = !withImport.equals(rewritten);
            rewritten = withImport;
        }
        return new Result(rewritten, applied, importAdded, !rewritten.equals(source));
    }

    public static final class Result {
        public final String source;
        public final int replacements;
        public final boolean importAdded;
        public final boolean changed;

        Result(String source, int replacements, boolean importAdded, boolean changed) {
            this.source = source;
            this.replacements = replacements;
            this.importAdded = importAdded;
            this.changed = changed;
        }
    }

    private static final class Rule {
        final Pattern pattern;
        final String identifier;

        Rule(Pattern pattern, String identifier) {
            this.pattern = pattern;
            this.identifier = identifier;
        }
    }

    private static final class Edit {
        final int start;
        final int end;
        final String replacement;

        Edit(int start, int end, String replacement) {
            this.start = start;
            this.end = end;
            this.replacement = replacement;
        }
    }
}
