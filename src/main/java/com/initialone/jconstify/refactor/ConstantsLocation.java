package com.initialone.jconstify.refactor;

import javax.lang.model.SourceVersion;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 生成常量类的包名与类名。
 * 包名优先级：显式指定 > src/<set>/java 源码根之下的相对目录 > 相对输入根目录 > 默认包。
 */
public final class ConstantsLocation {
    public final String packageName;
    public final String className;

    private ConstantsLocation(String packageName, String className) {
        this.packageName = packageName;
        this.className = className;
    }

    public static ConstantsLocation resolve(Path constantsFile, Path inputRoot, String explicitPackage) {
        String className = classNameOf(constantsFile);
        if (explicitPackage != null && !explicitPackage.isBlank()) {
            String pkg = explicitPackage.trim();
            if (!SourceVersion.isName(pkg)) {
                throw new IllegalArgumentException("not a valid package name: " + explicitPackage);
            }
            return new ConstantsLocation(pkg, className);
        }
        Path dir = constantsFile.toAbsolutePath().normalize().getParent();
        String pkg = fromSourceRoot(dir);
        if (pkg == null && inputRoot != null && Files.isDirectory(inputRoot)) {
            Path root = inputRoot.toAbsolutePath().normalize();
            if (dir != null && dir.startsWith(root)) {
                pkg = toPackage(root.relativize(dir));
            }
        }
        return new ConstantsLocation(pkg == null ? "" : pkg, className);
    }

    public String fqn() {
        return packageName.isEmpty() ? className : packageName + "." + className;
    }

    public boolean isDefaultPackage() {
        return packageName.isEmpty();
    }

    static String classNameOf(Path constantsFile) {
        String n = constantsFile.getFileName().toString();
        int dot = n.lastIndexOf('.');
        String base = dot > 0 ? n.substring(0, dot) : n;
        if (!SourceVersion.isIdentifier(base) || SourceVersion.isKeyword(base)) {
            throw new IllegalArgumentException("constants file name is not a valid Java class name: " + n);
        }
        return base;
    }

    /** 找最近的 .../src/<set>/java 祖先 */
    private static String fromSourceRoot(Path dir) {
        for (Path p = dir; p != null; p = p.getParent()) {
            Path set = p.getParent();
            Path src = set == null ? null : set.getParent();
            if (p.getFileName() != null && p.getFileName().toString().equals("java")
                    && src != null && src.getFileName() != null
                    && src.getFileName().toString().equals("src")) {
                return toPackage(p.relativize(dir));
            }
        }
        return null;
    }

    private static String toPackage(Path rel) {
        String s = rel.toString().replace('\\', '/');
        if (s.isEmpty()) return "";
        String pkg = s.replace('/', '.');
        return SourceVersion.isName(pkg) ? pkg : null;
    }
}
