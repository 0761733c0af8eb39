package com.initialone.jconstify.model;

/** SAFE：可自动替换；MANUAL：拼接表达式中的静态片段，需要人工确认 */
public enum LiteralCategory {
    SAFE,
    MANUAL
}
