package com.initialone.jconstify.util;

import com.google.googlejavaformat.java.Formatter;
import com.google.googlejavaformat.java.FormatterException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * 只在子进程里运行：对传入的 .java 文件（或目录下全部 .java）做 google-java-format。
 *
 * 用法（由 {@link com.initialone.jconstify.util.Formatter} 通过 ProcessBuilder 调）:
 *   java <exports...> -cp <cp> com.initialone.jconstify.util.FormatterWorker <file|dir>
 */
public class FormatterWorker {

    public static void main(String[] args) throws Exception {
        if (args.length != 1) {
            System.err.println("[formatter-worker] usage: FormatterWorker <file|dir>");
            System.exit(2);
        }
        Path target = Paths.get(args[0]);
        if (!Files.exists(target)) {
            System.err.println("[formatter-worker] not found: " + target.toAbsolutePath());
            System.exit(2);
        }

        List<Path> javaFiles = SourceFiles.collect(target, List.of(".java"), null);
        System.out.println("[formatter-worker] formatting " + javaFiles.size() + " file(s) under " + target);

        Formatter fmt = new Formatter();
        int ok = 0;
        int fail = 0;
        for (Path file : javaFiles) {
            try {
                String original = Files.readString(file, StandardCharsets.UTF_8);
                String formatted;
                try {
                    formatted = fmt.formatSource(original);
                } catch (FormatterException fe) {
                    // 无法格式化的文件跳过，不让整个流程失败
                    System.err.println("[formatter-worker] skip (FormatterException): " + file + " : " + fe.getMessage());
                    fail++;
                    continue;
                }
                if (!formatted.equals(original)) {
                    Files.writeString(file, formatted, StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
                }
                ok++;
            } catch (Exception e) {
                System.err.println("[formatter-worker] fail " + file + " : " + e);
                fail++;
            }
        }

        System.out.println("[formatter-worker] done. ok=" + ok + " fail=" + fail);
        if (fail > 0) System.exit(1);
    }
}
