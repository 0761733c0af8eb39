package com.initialone.jconstify.ast;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

import java.nio.file.Path;
import java.util.Optional;

/**
 * JavaParser 封装：语法错误不中断，尽量返回部分语法树。
 */
public class JavaSources {
    private final JavaParser parser;

    public JavaSources() {
        ParserConfiguration cfg = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(cfg);
    }

    /**
     * @param file 仅用于日志
     * @return 语法树；完全无法解析时为空
     */
    public Optional<CompilationUnit> parse(String source, Path file) {
        return parse(source, file, true);
    }

    /** 不打印问题，用于同一文件的二次解析 */
    public Optional<CompilationUnit> parseQuietly(String source) {
        return parse(source, null, false);
    }

    private Optional<CompilationUnit> parse(String source, Path file, boolean report) {
        ParseResult<CompilationUnit> res = parser.parse(source);
        if (!report) {
            return res.getResult();
        }
        if (!res.isSuccessful()) {
            Problem first = res.getProblems().isEmpty() ? null : res.getProblems().get(0);
            System.err.println("[parse] " + res.getProblems().size() + " problem(s) in " + file
                    + (first != null ? " : " + first.getVerboseMessage() : ""));
        }
        if (res.getResult().isEmpty()) {
            System.err.println("[parse] parse fail: " + file);
        }
        return res.getResult();
    }
}
