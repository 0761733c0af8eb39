package com.initialone.jconstify.ast;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.initialone.jconstify.model.LiteralCategory;
import com.initialone.jconstify.model.LiteralOccurrence;
import com.initialone.jconstify.util.SourceOffsets;
import com.initialone.jconstify.util.SourceOffsets.Span;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 遍历单个文件的语法树，把字符串字面量分成 SAFE / MANUAL 两类。
 *
 * 跳过（既不收集，也记为保护区间）：
 * - 注解参数、注解成员默认值；
 * - Map.of / Map.entry 的键，以及 get/put 等按键访问的第一个参数；
 * - 日志类调用（整个调用）；
 * - 异常构造（整个 new 表达式）。
 *
 * 纯字面量的 + 拼接合并成一个 SAFE 文本；混入表达式的拼接，其中每个字面量片段记为 MANUAL。
 * 遍历只读，不修改语法树。
 */
public class LiteralCollector {

    public static final Set<String> DEFAULT_IGNORED_CALLS = Set.of(
            "print", "println", "printf", "log",
            "trace", "debug", "info", "warn", "error",
            "fine", "warning", "severe");

    public static final Set<String> DEFAULT_IGNORED_CONSTRUCTORS = Set.of(
            "Exception", "RuntimeException", "IllegalArgumentException", "IllegalStateException",
            "UnsupportedOperationException", "NullPointerException", "IOException",
            "UncheckedIOException", "Error", "AssertionError");

    public static final Set<String> DEFAULT_KEY_CALLS = Set.of(
            "get", "put", "containsKey", "getOrDefault", "remove",
            "putIfAbsent", "computeIfAbsent", "getProperty", "setProperty");

    private static final Set<String> MAP_TYPES = Set.of("Map", "java.util.Map", "ImmutableMap");

    private final Set<String> ignoredCalls;
    private final Set<String> ignoredConstructors;
    private final Set<String> keyCalls;

    public LiteralCollector() {
        this(DEFAULT_IGNORED_CALLS, DEFAULT_IGNORED_CONSTRUCTORS, DEFAULT_KEY_CALLS);
    }

    public LiteralCollector(Set<String> ignoredCalls, Set<String> ignoredConstructors, Set<String> keyCalls) {
        this.ignoredCalls = Set.copyOf(ignoredCalls);
        this.ignoredConstructors = Set.copyOf(ignoredConstructors);
        this.keyCalls = Set.copyOf(keyCalls);
    }

    public FileLiterals collect(CompilationUnit cu, Path file, String source) {
        Walk w = new Walk(file, new SourceOffsets(source));
        w.visit(cu);

        Set<Span> spans = new LinkedHashSet<>();
        for (StringLiteralExpr s : cu.findAll(StringLiteralExpr.class)) {
            w.offsets.span(s).ifPresent(spans::add);
        }
        return new FileLiterals(file, w.safe, w.manual, w.protectedRanges, spans, w.concatenations);
    }

    LiteralNodeKind classify(Node node) {
        if (node instanceof StringLiteralExpr) return LiteralNodeKind.SIMPLE;
        if (node instanceof TextBlockLiteralExpr) return LiteralNodeKind.TEXT_BLOCK;
        if (node instanceof AnnotationExpr
                || node instanceof AnnotationMemberDeclaration
                || node instanceof ImportDeclaration
                || node instanceof PackageDeclaration) {
            return LiteralNodeKind.DIRECTIVE;
        }
        if (node instanceof ObjectCreationExpr oc) {
            return ignoredConstructors.contains(oc.getType().getNameAsString())
                    ? LiteralNodeKind.IGNORED_CONSTRUCTOR : LiteralNodeKind.OTHER;
        }
        if (node instanceof MethodCallExpr mc) {
            String name = mc.getNameAsString();
            if (ignoredCalls.contains(name)) return LiteralNodeKind.IGNORED_CALL;
            if (isMapFactory(mc)) return LiteralNodeKind.MAP_LITERAL;
            if (keyCalls.contains(name) && !mc.getArguments().isEmpty()) return LiteralNodeKind.INDEX_ACCESS;
            return LiteralNodeKind.OTHER;
        }
        if (node instanceof BinaryExpr be && be.getOperator() == BinaryExpr.Operator.PLUS) {
            List<Expression> leaves = flatten(be);
            int literals = 0;
            for (Expression e : leaves) if (isTextLiteral(e)) literals++;
            if (literals == 0) return LiteralNodeKind.OTHER;
            return literals == leaves.size() ? LiteralNodeKind.CONCATENATION : LiteralNodeKind.INTERPOLATION;
        }
        return LiteralNodeKind.OTHER;
    }

    private static boolean isMapFactory(MethodCallExpr mc) {
        String name = mc.getNameAsString();
        if (!name.equals("of") && !name.equals("entry")) return false;
        return mc.getScope().map(s -> MAP_TYPES.contains(s.toString())).orElse(false);
    }

    private static boolean isTextLiteral(Expression e) {
        return e instanceof StringLiteralExpr || e instanceof TextBlockLiteralExpr;
    }

    private static String textOf(Expression e) {
        if (e instanceof StringLiteralExpr s) return s.asString();
        if (e instanceof TextBlockLiteralExpr t) return t.translateEscapes();
        return "";
    }

    /** 左结合的 a + b + c 展开成叶子列表；括号表达式算一个叶子 */
    private static List<Expression> flatten(BinaryExpr be) {
        List<Expression> out = new ArrayList<>();
        flattenInto(be, out);
        return out;
    }

    private static void flattenInto(Expression e, List<Expression> out) {
        if (e instanceof BinaryExpr be && be.getOperator() == BinaryExpr.Operator.PLUS) {
            flattenInto(be.getLeft(), out);
            flattenInto(be.getRight(), out);
        } else {
            out.add(e);
        }
    }

    private final class Walk {
        final Path file;
        final SourceOffsets offsets;
        final List<LiteralOccurrence> safe = new ArrayList<>();
        final List<LiteralOccurrence> manual = new ArrayList<>();
        final List<Span> protectedRanges = new ArrayList<>();
        final Map<Span, String> concatenations = new LinkedHashMap<>();

        Walk(Path file, SourceOffsets offsets) {
            this.file = file;
            this.offsets = offsets;
        }

        void visit(Node node) {
            switch (classify(node)) {
                case SIMPLE -> add(((StringLiteralExpr) node).asString(), node, LiteralCategory.SAFE);
                case TEXT_BLOCK -> add(((TextBlockLiteralExpr) node).translateEscapes(), node, LiteralCategory.MANUAL);
                case CONCATENATION -> {
                    StringBuilder combined = new StringBuilder();
                    for (Expression leaf : flatten((BinaryExpr) node)) combined.append(textOf(leaf));
                    if (combined.length() > 0) {
                        String text = combined.toString();
                        add(text, node, LiteralCategory.SAFE);
                        offsets.span(node).ifPresent(s -> concatenations.put(s, text));
                    }
                }
                case INTERPOLATION -> {
                    for (Expression leaf : flatten((BinaryExpr) node)) {
                        if (isTextLiteral(leaf)) {
                            // 片段挂在整个拼接表达式的位置上
                            add(textOf(leaf), node, LiteralCategory.MANUAL);
                        } else {
                            visit(leaf);
                        }
                    }
                }
                case DIRECTIVE, IGNORED_CALL, IGNORED_CONSTRUCTOR -> protect(node);
                case MAP_LITERAL -> {
                    MethodCallExpr mc = (MethodCallExpr) node;
                    mc.getScope().ifPresent(this::visit);
                    boolean entry = mc.getNameAsString().equals("entry");
                    for (int i = 0; i < mc.getArguments().size(); i++) {
                        boolean keyPosition = entry ? i == 0 : i % 2 == 0;
                        visitArgument(mc.getArgument(i), keyPosition);
                    }
                }
                case INDEX_ACCESS -> {
                    MethodCallExpr mc = (MethodCallExpr) node;
                    mc.getScope().ifPresent(this::visit);
                    for (int i = 0; i < mc.getArguments().size(); i++) {
                        visitArgument(mc.getArgument(i), i == 0);
                    }
                }
                default -> {
                    for (Node child : node.getChildNodes()) visit(child);
                }
            }
        }

        private void visitArgument(Expression arg, boolean keyPosition) {
            if (keyPosition && arg instanceof StringLiteralExpr) {
                protect(arg);
            } else {
                visit(arg);
            }
        }

        private void add(String text, Node at, LiteralCategory category) {
            int offset = offsets.begin(at).orElse(-1);
            LiteralOccurrence o = new LiteralOccurrence(text, file, offset, category);
            if (category == LiteralCategory.SAFE) safe.add(o);
            else manual.add(o);
        }

        private void protect(Node node) {
            offsets.span(node).ifPresent(protectedRanges::add);
        }
    }
}
