package com.initialone.jconstify.naming;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 一次运行内的命名状态：已发放的常量名 + 纯符号文本的占位计数器。
 * 每次运行新建一个，不跨运行保存。
 */
public final class NamingContext {
    private final Set<String> usedNames = new LinkedHashSet<>();
    private int symbolCounter = 1;

    public boolean isUsed(String name) {
        return usedNames.contains(name);
    }

    /** @return false 如果该名字已被占用 */
    public boolean reserve(String name) {
        return usedNames.add(name);
    }

    public Set<String> usedNames() {
        return Collections.unmodifiableSet(usedNames);
    }

    int peekSymbolCounter() {
        return symbolCounter;
    }

    void advanceSymbolCounter() {
        symbolCounter++;
    }
}
