package com.initialone.jconstify.codegen;

import com.initialone.jconstify.model.Binding;
import com.initialone.jconstify.naming.SymbolTable;
import com.initialone.jconstify.util.JavaStrings;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

/**
 * 把符号表写成一个 Java 常量类：
 * 先是可自动替换的常量，再是需人工替换的常量（每条带 "Found in" 出处注释）。
 */
public class ConstantsEmitter {

    public static final String HEADER = "// GENERATED STRING CONSTANTS";
    public static final String SAFE_MARKER = "// ✅ Automatically replaceable";
    public static final String MANUAL_MARKER = "// ⚠️ Manual replacements required";

    private static final String INDENT = "    ";

    private final String packageName;
    private final String className;
    private final Function<Path, String> displayPath;

    /**
     * @param packageName 空串表示默认包
     * @param displayPath 出处注释里的文件展示形式
     */
    public ConstantsEmitter(String packageName, String className, Function<Path, String> displayPath) {
        this.packageName = packageName == null ? "" : packageName;
        this.className = className;
        this.displayPath = displayPath == null ? String::valueOf : displayPath;
    }

    public String emit(SymbolTable table) {
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER).append('\n');
        if (!packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n");
        }
        sb.append('\n');
        sb.append("public final class ").append(className).append(" {\n\n");
        sb.append(INDENT).append("private ").append(className).append("() {\n");
        sb.append(INDENT).append("}\n\n");

        sb.append(INDENT).append(SAFE_MARKER).append('\n');
        for (Binding b : table.safeBindings()) {
            declaration(sb, b);
        }

        List<Binding> manual = table.manualBindings();
        if (!manual.isEmpty()) {
            sb.append('\n');
            sb.append(INDENT).append(MANUAL_MARKER).append('\n');
            for (Binding b : manual) {
                sb.append(INDENT).append("// Found in: ").append(displayPath.apply(b.firstSeenFile)).append('\n');
                declaration(sb, b);
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static void declaration(StringBuilder sb, Binding b) {
        sb.append(INDENT)
                .append("public static final String ")
                .append(b.identifierName)
                .append(" = ")
                .append(JavaStrings.quote(b.literalText))
                .append(";\n");
    }
}
