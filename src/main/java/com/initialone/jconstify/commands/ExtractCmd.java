package com.initialone.jconstify.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jconstify.model.RunReport;
import com.initialone.jconstify.naming.IdentifierSynthesizer;
import com.initialone.jconstify.refactor.RefactorOptions;
import com.initialone.jconstify.refactor.StringRefactorer;
import com.initialone.jconstify.util.Formatter;
import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 抽取字符串字面量为常量并改写源码。
 *
 * 用法：
 *   java -jar jconstify.jar src/main/java \
 *     src/main/java/com/acme/StringConstants.java \
 *     out/unused
 */
@CommandLine.Command(
        name = "jconstify",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Extract inline string literals into a generated constants class and rewrite the sources.",
                "Flow: discover → collect → name → emit → rewrite",
                "",
                "Logging calls, exception constructors, annotations and map keys are left untouched.",
                "Literals mixed into '+' expressions are listed under 'Manual replacements required'."
        }
)
public class ExtractCmd implements Callable<Integer> {

    /* 位置参数 */
    @CommandLine.Parameters(index = "0", description = "Input .java file or source dir")
    String inputPath;

    @CommandLine.Parameters(index = "1", description = "Output constants class, e.g. .../StringConstants.java")
    String outputConstFile;

    @CommandLine.Parameters(index = "2", description = "Reserved output path (accepted, currently unused)")
    String outputSourceFile;

    @CommandLine.Option(names = "--package",
            description = "Package of the constants class (default: inferred from its path)")
    String packageName;

    @CommandLine.Option(names = "--prefix", defaultValue = IdentifierSynthesizer.DEFAULT_PREFIX,
            description = "Constant name prefix (default: ${DEFAULT-VALUE})")
    String prefix;

    @CommandLine.Option(names = "--max-length", defaultValue = "40",
            description = "Max constant name length (default: ${DEFAULT-VALUE})")
    int maxLength;

    @CommandLine.Option(names = "--ignore-call", split = ",",
            description = "Extra method names whose arguments stay inline (adds to logging defaults)")
    List<String> ignoreCalls = new ArrayList<>();

    @CommandLine.Option(names = "--ignore-ctor", split = ",",
            description = "Extra constructor names whose arguments stay inline (adds to exception defaults)")
    List<String> ignoreCtors = new ArrayList<>();

    @CommandLine.Option(names = "--key-call", split = ",",
            description = "Extra keyed-access method names whose first literal argument is a key")
    List<String> keyCalls = new ArrayList<>();

    @CommandLine.Option(names = "--extensions", split = ",", defaultValue = ".java",
            description = "Comma-separated file extensions to process (default: ${DEFAULT-VALUE})")
    List<String> exts;

    @CommandLine.Option(names = "--dry-run", defaultValue = "false",
            description = "Analyze & print stats without writing files")
    boolean dryRun;

    @CommandLine.Option(names = "--report", description = "Write a JSON run report to this path")
    String reportJson;

    @CommandLine.Option(names = "--format", defaultValue = "false",
            description = "Format the generated class with google-java-format")
    boolean format;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        RefactorOptions options = toOptions();
        Path input = Paths.get(inputPath);
        Path constFile = Paths.get(outputConstFile);

        try {
            long t0 = System.currentTimeMillis();
            RunReport report = new StringRefactorer(options).run(input, constFile);
            if (report.filesProcessed == 0) {
                return 0;
            }

            if (format && !dryRun) {
                try {
                    Formatter.formatJava(constFile);
                } catch (Exception e) {
                    System.err.println("[jconstify] format skipped: " + e.getMessage());
                }
            }

            if (reportJson != null && !reportJson.isBlank()) {
                ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
                om.writeValue(Paths.get(reportJson).toFile(), report);
                System.out.println("[jconstify] report -> " + reportJson);
            }

            System.out.printf("[jconstify] done in %.2fs%n", (System.currentTimeMillis() - t0) / 1000.0);
            return 0;
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        } catch (Exception e) {
            e.printStackTrace();
            return 2;
        }
    }

    RefactorOptions toOptions() {
        RefactorOptions o = new RefactorOptions();
        o.packageName = packageName;
        o.prefix = prefix;
        if (maxLength < IdentifierSynthesizer.minimumMaxLength(prefix)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--max-length must be at least " + IdentifierSynthesizer.minimumMaxLength(prefix));
        }
        o.maxLength = maxLength;
        o.ignoredCalls.addAll(ignoreCalls);
        o.ignoredConstructors.addAll(ignoreCtors);
        o.keyCalls.addAll(keyCalls);
        if (exts != null && !exts.isEmpty()) o.extensions = new ArrayList<>(exts);
        o.dryRun = dryRun;
        return o;
    }
}
