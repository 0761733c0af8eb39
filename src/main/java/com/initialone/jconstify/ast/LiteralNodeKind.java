package com.initialone.jconstify.ast;

/**
 * 收集器关心的节点种类。封闭集合，LiteralCollector 用 switch 显式处理，OTHER 只向下遍历。
 */
enum LiteralNodeKind {
    /** 普通字符串字面量 */
    SIMPLE,
    /** 全部由字符串字面量组成的 + 拼接 */
    CONCATENATION,
    /** 字面量与表达式混合的 + 拼接（相当于插值字符串） */
    INTERPOLATION,
    /** 文本块 """...""" */
    TEXT_BLOCK,
    /** 注解、import/package 等结构性声明 */
    DIRECTIVE,
    /** Map.of(...) / Map.entry(...) */
    MAP_LITERAL,
    /** map.get("key") 一类的按键访问 */
    INDEX_ACCESS,
    /** 日志类调用 */
    IGNORED_CALL,
    /** 异常构造 */
    IGNORED_CONSTRUCTOR,
    OTHER
}
