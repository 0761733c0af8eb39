package com.initialone.jconstify.refactor;

import com.github.javaparser.ast.CompilationUnit;
import com.initialone.jconstify.ast.FileLiterals;
import com.initialone.jconstify.ast.JavaSources;
import com.initialone.jconstify.ast.LiteralCollector;
import com.initialone.jconstify.codegen.ConstantsEmitter;
import com.initialone.jconstify.model.Binding;
import com.initialone.jconstify.model.LiteralOccurrence;
import com.initialone.jconstify.model.RunReport;
import com.initialone.jconstify.naming.IdentifierSynthesizer;
import com.initialone.jconstify.naming.NamingContext;
import com.initialone.jconstify.naming.SymbolTable;
import com.initialone.jconstify.rewrite.ImportInjector;
import com.initialone.jconstify.rewrite.RewriteEngine;
import com.initialone.jconstify.util.SourceFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 串行流水线：discover -> collect -> bind/name -> emit -> rewrite。
 *
 * 命名必须在所有文件收集完之后进行（唯一性与 SAFE 优先都是全局的）。
 * 不做跨文件回滚：第 k 个文件写失败时，前 k-1 个文件已经被改写。
 */
public class StringRefactorer {
    private final RefactorOptions options;
    private final JavaSources sources = new JavaSources();
    private final LiteralCollector collector;

    public StringRefactorer(RefactorOptions options) {
        this.options = options == null ? new RefactorOptions() : options;
        this.collector = this.options.newCollector();
    }

    /**
     * @param input         单个文件或目录
     * @param constantsFile 生成的常量类路径（自身不参与处理）
     * @return 运行统计；没有输入文件时 filesProcessed 为 0，且不写任何文件
     */
    public RunReport run(Path input, Path constantsFile) throws IOException {
        ConstantsLocation location = ConstantsLocation.resolve(constantsFile, input, options.packageName);
        // 每次运行一份新的命名状态
        IdentifierSynthesizer synthesizer = new IdentifierSynthesizer(new NamingContext(), options.prefix, options.maxLength);

        RunReport report = new RunReport();
        report.input = input.toString();
        report.constantsFile = constantsFile.toString();
        report.constantsClass = location.fqn();
        report.dryRun = options.dryRun;

        List<Path> files = SourceFiles.collect(input, options.extensions, constantsFile);
        if (files.isEmpty()) {
            System.out.println("[jconstify] No Java files found in " + input);
            return report;
        }

        /* ========== 1/3 collect ========== */
        List<LiteralOccurrence> occurrences = new ArrayList<>();
        int safeCount = 0;
        int manualCount = 0;
        for (Path file : files) {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            Optional<CompilationUnit> cu = sources.parse(source, file);
            if (cu.isEmpty()) continue;
            FileLiterals literals = collector.collect(cu.get(), file, source);
            occurrences.addAll(literals.all());
            safeCount += literals.safe.size();
            manualCount += literals.manual.size();
        }
        SymbolTable table = new SymbolTable(synthesizer);
        table.bindAll(occurrences);
        System.out.println("[collect] files=" + files.size()
                + " safe=" + safeCount + " manual=" + manualCount
                + " -> constants=" + table.size()
                + " (safe=" + table.safeBindings().size() + ", manual=" + table.manualBindings().size() + ")");
        if (table.isEmpty()) {
            System.out.println("[collect] no string literals to extract");
        }

        /* ========== 2/3 emit ========== */
        ConstantsEmitter emitter = new ConstantsEmitter(location.packageName, location.className,
                p -> SourceFiles.display(input, p));
        String constants = emitter.emit(table);
        if (!options.dryRun) {
            Path parent = constantsFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(constantsFile, constants, StandardCharsets.UTF_8);
        }

        /* ========== 3/3 rewrite ========== */
        ImportInjector importer = null;
        if (location.isDefaultPackage()) {
            System.err.println("[rewrite] " + location.className
                    + " is in the default package, static imports are not injected (use --package)");
        } else {
            importer = new ImportInjector(location.fqn(), sources);
        }
        RewriteEngine engine = new RewriteEngine(table, sources, collector, importer);

        int changed = 0;
        long replacements = 0;
        for (Path file : files) {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            RewriteEngine.Result r = engine.rewrite(file, source);
            replacements += r.replacements;
            if (r.changed) {
                changed++;
                if (!options.dryRun) {
                    Files.writeString(file, r.source, StandardCharsets.UTF_8);
                }
            }
        }

        report.filesProcessed = files.size();
        report.filesChanged = changed;
        report.replacements = replacements;
        report.safeCount = table.safeBindings().size();
        report.manualCount = table.manualBindings().size();
        for (Binding b : table.all()) {
            RunReport.Entry e = new RunReport.Entry();
            e.name = b.identifierName;
            e.text = b.literalText;
            e.category = b.category.name();
            e.file = SourceFiles.display(input, b.firstSeenFile);
            e.offset = b.firstSeenOffset;
            report.bindings.add(e);
        }

        System.out.println("[rewrite] files changed=" + changed + ", replacements=" + replacements
                + (options.dryRun ? " (dry-run)" : ""));
        System.out.println("Processed " + files.size() + " files.");
        System.out.println("Const strings written to " + constantsFile + (options.dryRun ? " (dry-run, not written)" : ""));
        return report;
    }
}
