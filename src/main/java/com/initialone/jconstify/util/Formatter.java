package com.initialone.jconstify.util;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 用 google-java-format 格式化生成的常量类（单个文件或目录）。
 *
 * 不在当前 JVM 里直接调用 google-java-format（会触发模块封装 IllegalAccessError），
 * 而是 fork 一个带 --add-exports 的子进程跑 FormatterWorker。
 */
public class Formatter {

    private static final String[] JAVAC_PACKAGES = {"api", "code", "file", "main", "parser", "tree", "util"};

    public static void formatJava(Path target) throws Exception {
        if (target == null) {
            System.err.println("[formatter] skip: target == null");
            return;
        }
        if (!Files.exists(target)) {
            System.err.println("[formatter] skip: not found: " + target.toAbsolutePath());
            return;
        }

        // -Djconstify.format.skip=true 可完全跳过
        if (Boolean.getBoolean("jconstify.format.skip")) {
            System.out.println("[formatter] skip formatting due to jconstify.format.skip=true");
            return;
        }

        List<String> cmd = buildFormatterSubprocessCmd(target);
        System.out.println("[formatter] spawn formatter worker: " + target);

        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.inheritIO();
        Process p = pb.start();
        int rc = p.waitFor();

        if (rc != 0) {
            throw new IllegalStateException("[formatter] formatter worker exit code " + rc);
        }
    }

    /**
     * java --add-exports jdk.compiler/...=ALL-UNNAMED ... -cp <cp> ...FormatterWorker <target>
     */
    static List<String> buildFormatterSubprocessCmd(Path target) {
        List<String> cmd = new ArrayList<>();

        String javaHome = System.getProperty("java.home");
        cmd.add(javaHome + File.separator + "bin" + File.separator + "java");

        for (String pkg : JAVAC_PACKAGES) {
            cmd.add("--add-exports");
            cmd.add("jdk.compiler/com.sun.tools.javac." + pkg + "=ALL-UNNAMED");
        }

        cmd.add("-Xmx" + System.getProperty("jconstify.format.xmx", "512m"));

        // 避免子进程递归 spawn
        cmd.add("-Djconstify.format.skip=false");

        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));

        cmd.add(FormatterWorker.class.getName());
        cmd.add(target.toAbsolutePath().toString());
        return cmd;
    }
}
