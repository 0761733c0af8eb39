package com.initialone.jconstify.rewrite;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.initialone.jconstify.ast.JavaSources;
import com.initialone.jconstify.util.SourceOffsets;

import java.util.Optional;

/**
 * 保证文件里恰好有一条 import static <constantsFqn>.*;
 * 已存在则原样返回；否则插在最后一条 import 之后，没有 import 就放在 package 之后，都没有则放文件开头。
 */
public class ImportInjector {
    private final String constantsFqn;
    private final JavaSources sources;

    public ImportInjector(String constantsFqn, JavaSources sources) {
        this.constantsFqn = constantsFqn;
        this.sources = sources;
    }

    public String importStatement() {
        return "import static " + constantsFqn + ".*;";
    }

    /**
     * @return 改写后的源码；无法解析时原样返回
     */
    public String ensureImport(String source) {
        Optional<CompilationUnit> parsed = sources.parseQuietly(source);
        if (parsed.isEmpty()) {
            return source;
        }
        CompilationUnit cu = parsed.get();
        for (ImportDeclaration imp : cu.getImports()) {
            if (imp.isStatic() && imp.isAsterisk() && imp.getNameAsString().equals(constantsFqn)) {
                return source;
            }
        }

        SourceOffsets offsets = new SourceOffsets(source);
        String nl = source.contains("\r\n") ? "\r\n" : "\n";

        int lastImportEnd = -1;
        for (ImportDeclaration imp : cu.getImports()) {
            int end = offsets.end(imp).orElse(-1);
            if (end > lastImportEnd) lastImportEnd = end;
        }
        if (lastImportEnd >= 0) {
            return insert(source, lastImportEnd, nl + importStatement());
        }

        Optional<Integer> packageEnd = cu.getPackageDeclaration().flatMap(offsets::end);
        if (packageEnd.isPresent()) {
            return insert(source, packageEnd.get(), nl + nl + importStatement());
        }
        return insert(source, 0, importStatement() + nl + nl);
    }

    private static String insert(String source, int at, String text) {
        return source.substring(0, at) + text + source.substring(at);
    }
}
