package com.initialone.jconstify.model;

import java.util.ArrayList;
import java.util.List;

/** --report 输出的 JSON 结构（Jackson 直接序列化 public 字段） */
public class RunReport {
    public String input;
    public String constantsFile;
    public String constantsClass;
    public boolean dryRun;
    public int filesProcessed;
    public int filesChanged;
    public long replacements;
    public int safeCount;
    public int manualCount;
    public List<Entry> bindings = new ArrayList<>();

    public static class Entry {
        public String name;
        public String text;
        public String category;
        public String file;   // relative to input root
        public int offset;
    }
}
