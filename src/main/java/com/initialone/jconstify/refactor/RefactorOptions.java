package com.initialone.jconstify.refactor;

import com.initialone.jconstify.ast.LiteralCollector;
import com.initialone.jconstify.naming.IdentifierSynthesizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 一次运行的配置。默认值即命令行默认值；命令行追加的忽略项与默认集合合并。
 */
public class RefactorOptions {
    /** 常量类包名；null 表示自动推断 */
    public String packageName;
    public String prefix = IdentifierSynthesizer.DEFAULT_PREFIX;
    public int maxLength = IdentifierSynthesizer.DEFAULT_MAX_LENGTH;
    public Set<String> ignoredCalls = new LinkedHashSet<>(LiteralCollector.DEFAULT_IGNORED_CALLS);
    public Set<String> ignoredConstructors = new LinkedHashSet<>(LiteralCollector.DEFAULT_IGNORED_CONSTRUCTORS);
    public Set<String> keyCalls = new LinkedHashSet<>(LiteralCollector.DEFAULT_KEY_CALLS);
    public List<String> extensions = new ArrayList<>(List.of(".java"));
    public boolean dryRun;

    public LiteralCollector newCollector() {
        return new LiteralCollector(ignoredCalls, ignoredConstructors, keyCalls);
    }
}
