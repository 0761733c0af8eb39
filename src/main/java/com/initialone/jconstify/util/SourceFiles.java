package com.initialone.jconstify.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** 输入路径（文件或目录）-> 待处理文件列表（按路径排序） */
public final class SourceFiles {
    private SourceFiles() {}

    public static List<Path> collect(Path input, List<String> exts, Path exclude) throws IOException {
        Set<String> allow = normalize(exts);
        Path excluded = exclude == null ? null : exclude.toAbsolutePath().normalize();

        List<Path> out = new ArrayList<>();
        if (Files.isRegularFile(input)) {
            if (allow.contains(extOf(input)) && !isSame(input, excluded)) out.add(input);
            return out;
        }
        if (!Files.isDirectory(input)) {
            return out;
        }
        try (Stream<Path> s = Files.walk(input)) {
            s.filter(Files::isRegularFile)
                    .filter(p -> allow.contains(extOf(p)))
                    .filter(p -> !isSame(p, excluded))
                    .forEach(out::add);
        }
        out.sort(Comparator.comparing(Path::toString));
        return out;
    }

    /** 文件相对输入根的展示路径，统一用 '/' */
    public static String display(Path root, Path file) {
        if (file == null) return "";
        Path base = Files.isDirectory(root) ? root : root.toAbsolutePath().getParent();
        Path rel;
        try {
            rel = base == null ? file : base.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        } catch (IllegalArgumentException e) {
            rel = file;
        }
        return rel.toString().replace('\\', '/');
    }

    private static Set<String> normalize(List<String> exts) {
        List<String> in = exts == null || exts.isEmpty() ? List.of(".java") : exts;
        return in.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.startsWith(".") ? s.toLowerCase() : "." + s.toLowerCase())
                .collect(Collectors.toSet());
    }

    private static boolean isSame(Path p, Path excluded) {
        return excluded != null && p.toAbsolutePath().normalize().equals(excluded);
    }

    private static String extOf(Path p) {
        String n = p.getFileName().toString().toLowerCase();
        int i = n.lastIndexOf('.');
        return (i >= 0 ? n.substring(i) : "");
    }
}
