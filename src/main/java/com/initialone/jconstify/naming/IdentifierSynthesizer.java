package com.initialone.jconstify.naming;

import javax.lang.model.SourceVersion;
import java.text.BreakIterator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 字面量文本 -> 合法、唯一、有长度上限的 Java 常量名。
 *
 * 规则：
 * - 不 trim，首尾空格也编码进名字；
 * - 按字素（grapheme）遍历：符号表命中 -> 助记词，ASCII 字母数字 -> 原样，其余丢弃；
 * - 整个文本恰好是一个符号 -> prefix + 助记词；
 * - 主体为空 -> prefix + "Symbol" + N；
 * - 数字开头或与关键字冲突 -> 前置 "_"；
 * - 超长 -> 截断并追加 _EXCEEDS；
 * - 重名 -> 追加 _1, _2, ...
 */
public class IdentifierSynthesizer {

    public static final String DEFAULT_PREFIX = "k";
    public static final int DEFAULT_MAX_LENGTH = 40;
    public static final String OVERFLOW_MARKER = "_EXCEEDS";

    private static final Map<String, String> SYMBOL_MNEMONICS = buildSymbolTable();

    private final NamingContext context;
    private final String prefix;
    private final int maxLength;

    public IdentifierSynthesizer(NamingContext context) {
        this(context, DEFAULT_PREFIX, DEFAULT_MAX_LENGTH);
    }

    public IdentifierSynthesizer(NamingContext context, String prefix, int maxLength) {
        this.context = Objects.requireNonNull(context, "context");
        this.prefix = prefix == null ? "" : prefix;
        if (!this.prefix.isEmpty() && !SourceVersion.isIdentifier(this.prefix)) {
            throw new IllegalArgumentException("prefix is not a valid Java identifier: " + prefix);
        }
        if (maxLength < minimumMaxLength(this.prefix)) {
            throw new IllegalArgumentException("max length " + maxLength
                    + " too small, need at least " + minimumMaxLength(this.prefix));
        }
        this.maxLength = maxLength;
    }

    /** prefix + "_" + 至少 1 个字符 + 溢出标记 + "_NN" 要放得下 */
    public static int minimumMaxLength(String prefix) {
        return (prefix == null ? 0 : prefix.length()) + 1 + OVERFLOW_MARKER.length() + 4;
    }

    public static Map<String, String> symbolTable() {
        return SYMBOL_MNEMONICS;
    }

    public int maxLength() {
        return maxLength;
    }

    /**
     * 发放一个名字并登记到 NamingContext。
     */
    public String synthesize(String text) {
        Candidate c = candidateOf(text);
        if (c.usesPlaceholder) {
            context.advanceSymbolCounter();
        }
        return reserveUnique(c.name);
    }

    /**
     * 第一候选名（未做重名处理），不改变任何状态。
     */
    public String candidate(String text) {
        return candidateOf(text).name;
    }

    private Candidate candidateOf(String text) {
        Objects.requireNonNull(text, "text");
        boolean placeholder = false;
        String body;

        String direct = SYMBOL_MNEMONICS.get(text);
        if (direct != null) {
            body = direct;
        } else {
            body = encodeGraphemes(text);
            if (body.isEmpty()) {
                body = "Symbol" + context.peekSymbolCounter();
                placeholder = true;
            }
        }

        String name = prefix + body;
        if (Character.isDigit(name.charAt(0)) || SourceVersion.isKeyword(name)) {
            name = "_" + name;
        }
        if (name.length() > maxLength) {
            name = name.substring(0, maxLength - OVERFLOW_MARKER.length()) + OVERFLOW_MARKER;
        }
        return new Candidate(name, placeholder);
    }

    private static String encodeGraphemes(String text) {
        StringBuilder sb = new StringBuilder();
        BreakIterator it = BreakIterator.getCharacterInstance(Locale.ROOT);
        it.setText(text);
        int start = it.first();
        for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
            String g = text.substring(start, end);
            String mnemonic = SYMBOL_MNEMONICS.get(g);
            if (mnemonic != null) {
                sb.append(mnemonic);
            } else if (isAsciiAlphanumeric(g)) {
                sb.append(g);
            }
        }
        return sb.toString();
    }

    private static boolean isAsciiAlphanumeric(String g) {
        if (g.length() != 1) return false;
        char c = g.charAt(0);
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    private String reserveUnique(String base) {
        if (context.reserve(base)) {
            return base;
        }
        int suffix = 1;
        String name;
        do {
            name = withSuffix(base, "_" + suffix);
            suffix++;
        } while (context.isUsed(name));
        context.reserve(name);
        return name;
    }

    private String withSuffix(String base, String suffix) {
        String name = base + suffix;
        if (name.length() <= maxLength) {
            return name;
        }
        // 加上序号后超长：主体再截短，保留溢出标记
        String body = base.endsWith(OVERFLOW_MARKER)
                ? base.substring(0, base.length() - OVERFLOW_MARKER.length())
                : base;
        int keep = maxLength - OVERFLOW_MARKER.length() - suffix.length();
        if (keep < 0) {
            // 序号长到放不下溢出标记
            return body.substring(0, Math.min(Math.max(0, maxLength - suffix.length()), body.length())) + suffix;
        }
        return body.substring(0, Math.min(keep, body.length())) + OVERFLOW_MARKER + suffix;
    }

    private static final class Candidate {
        final String name;
        final boolean usesPlaceholder;

        Candidate(String name, boolean usesPlaceholder) {
            this.name = name;
            this.usesPlaceholder = usesPlaceholder;
        }
    }

    private static Map<String, String> buildSymbolTable() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("₹", "Rupees");
        m.put("/", "Slash");
        m.put("%", "Percent");
        m.put(" ", "Space");
        m.put("-", "Dash");
        m.put("+", "Plus");
        m.put("@", "At");
        m.put("#", "Hash");
        m.put("&", "Ampersand");
        m.put("*", "Asterisk");
        m.put(",", "Comma");
        m.put(".", "Dot");
        m.put(":", "Colon");
        m.put(";", "Semicolon");
        m.put("?", "QuestionMark");
        m.put("!", "Exclamation");
        m.put("~", "Tilde");
        m.put("^", "Caret");
        m.put("$", "Dollar");
        m.put("=", "Equals");
        m.put("<", "LessThan");
        m.put(">", "GreaterThan");
        m.put("|", "Pipe");
        m.put("\\", "Backslash");
        m.put("\"", "Quote");
        m.put("'", "Apostrophe");
        m.put("(", "OpenParen");
        m.put(")", "CloseParen");
        m.put("[", "OpenBracket");
        m.put("]", "CloseBracket");
        m.put("{", "OpenBrace");
        m.put("}", "CloseBrace");
        m.put("", "EmptyString");
        return Collections.unmodifiableMap(m);
    }
}
