package com.initialone.jconstify.ast;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.initialone.jconstify.model.LiteralCategory;
import com.initialone.jconstify.model.LiteralOccurrence;
import com.initialone.jconstify.util.SourceOffsets.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LiteralCollectorTest {

    private static final Path FILE = Path.of("demo/Greeter.java");

    private static final String GREETER = String.join("\n",
            "package demo;",
            "",
            "import java.util.Map;",
            "",
            "@SuppressWarnings(\"unchecked\")",
            "public class Greeter {",
            "    private static final Map<String, String> LABELS = Map.of(\"ok\", \"Okay\", \"no\", \"Nope\");",
            "",
            "    public String greet(String name, Map<String, String> labels) {",
            "        System.out.println(\"debug greet\");",
            "        if (name == null) {",
            "            throw new IllegalArgumentException(\"name is required\");",
            "        }",
            "        String title = labels.get(\"title\");",
            "        String combined = \"Hello\" + \", \" + \"there\";",
            "        String message = \"Welcome, \" + name + \"!\";",
            "        return title + combined + message;",
            "    }",
            "",
            "    public String plain() {",
            "        return \"Thanks\";",
            "    }",
            "}",
            "");

    private final JavaSources sources = new JavaSources();

    private FileLiterals collect(LiteralCollector collector, String source) {
        CompilationUnit cu = sources.parse(source, FILE).orElseThrow();
        return collector.collect(cu, FILE, source);
    }

    @Test
    @DisplayName("Plain and fully literal concatenations are safe; log, exception, annotation and key literals are skipped")
    void classifiesSafeLiterals() {
        FileLiterals result = collect(new LiteralCollector(), GREETER);

        assertEquals(List.of("Okay", "Nope", "Hello, there", "Thanks"), result.safeTexts());
        for (LiteralOccurrence o : result.safe) {
            assertEquals(LiteralCategory.SAFE, o.category);
            assertEquals(FILE, o.file);
        }
    }

    @Test
    @DisplayName("All-literal concatenations are recorded with the span of the whole expression")
    void concatenationSpans() {
        FileLiterals result = collect(new LiteralCollector(), GREETER);

        int start = GREETER.indexOf("\"Hello\" + ");
        int end = GREETER.indexOf("\"there\"") + "\"there\"".length();
        assertEquals(1, result.concatenations.size());
        assertEquals("Hello, there", result.concatenations.get(new Span(start, end)));
    }

    @Test
    @DisplayName("Literal fragments of a mixed concatenation are manual and point at the whole expression")
    void classifiesManualFragments() {
        FileLiterals result = collect(new LiteralCollector(), GREETER);

        assertEquals(List.of("Welcome, ", "!"),
                result.manual.stream().map(o -> o.text).collect(Collectors.toList()));
        int exprStart = GREETER.indexOf("\"Welcome, \" + name");
        for (LiteralOccurrence o : result.manual) {
            assertEquals(LiteralCategory.MANUAL, o.category);
            assertEquals(exprStart, o.offset);
            assertEquals(FILE, o.file);
        }
    }

    @Test
    @DisplayName("Safe occurrences carry the offset of the literal")
    void safeOffsets() {
        FileLiterals result = collect(new LiteralCollector(), GREETER);
        LiteralOccurrence thanks = result.safe.get(result.safe.size() - 1);
        assertEquals(GREETER.indexOf("\"Thanks\""), thanks.offset);
    }

    @Test
    @DisplayName("Skipped literals are reported as protected ranges")
    void protectedRanges() {
        FileLiterals result = collect(new LiteralCollector(), GREETER);

        for (String skipped : List.of("\"debug greet\"", "\"name is required\"", "\"unchecked\"",
                "\"title\"", "\"ok\"", "\"no\"")) {
            int start = GREETER.indexOf(skipped);
            assertTrue(result.isProtected(start, start + skipped.length()), skipped);
        }
        int thanks = GREETER.indexOf("\"Thanks\"");
        assertFalse(result.isProtected(thanks, thanks + "\"Thanks\"".length()));
        assertTrue(result.isLiteralToken(thanks, thanks + "\"Thanks\"".length()));
    }

    @Test
    @DisplayName("Ignore sets are configurable")
    void customIgnoreSets() {
        String source = String.join("\n",
                "class Tracker {",
                "    void run(Analytics analytics) {",
                "        analytics.track(\"Clicked\");",
                "        System.out.println(\"Printed\");",
                "        throw new ValidationException(\"Invalid\");",
                "    }",
                "}");
        LiteralCollector collector = new LiteralCollector(Set.of("track"), Set.of("ValidationException"), Set.of());

        assertEquals(List.of("Printed"), collect(collector, source).safeTexts());
    }

    @Test
    @DisplayName("Text blocks are flagged for manual replacement")
    void textBlocksAreManual() {
        String source = String.join("\n",
                "class Sql {",
                "    String query = \"\"\"",
                "        SELECT 1",
                "        \"\"\";",
                "}");
        FileLiterals result = collect(new LiteralCollector(), source);

        assertTrue(result.safe.isEmpty());
        assertEquals(1, result.manual.size());
        assertTrue(result.manual.get(0).text.contains("SELECT 1"));
    }

    @Test
    @DisplayName("Node kinds are matched explicitly")
    void classifyNodeKinds() {
        LiteralCollector collector = new LiteralCollector();

        Expression concat = StaticJavaParser.parseExpression("\"a\" + \"b\" + \"c\"");
        Expression mixed = StaticJavaParser.parseExpression("\"a\" + x + \"c\"");
        Expression numeric = StaticJavaParser.parseExpression("1 + x");
        MethodCallExpr log = StaticJavaParser.parseExpression("LOG.info(\"x\")").asMethodCallExpr();
        MethodCallExpr mapOf = StaticJavaParser.parseExpression("Map.of(\"k\", \"v\")").asMethodCallExpr();
        MethodCallExpr get = StaticJavaParser.parseExpression("m.get(\"k\")").asMethodCallExpr();

        assertEquals(LiteralNodeKind.CONCATENATION, collector.classify((BinaryExpr) concat));
        assertEquals(LiteralNodeKind.INTERPOLATION, collector.classify((BinaryExpr) mixed));
        assertEquals(LiteralNodeKind.OTHER, collector.classify((BinaryExpr) numeric));
        assertEquals(LiteralNodeKind.IGNORED_CALL, collector.classify(log));
        assertEquals(LiteralNodeKind.MAP_LITERAL, collector.classify(mapOf));
        assertEquals(LiteralNodeKind.INDEX_ACCESS, collector.classify(get));
    }

    @Test
    @DisplayName("Literals nested in a non-literal operand of a mixed concatenation are still visited")
    void nestedCallInsideConcatenation() {
        String source = String.join("\n",
                "class Nested {",
                "    String s(String n) {",
                "        return \"Hi \" + format(\"Dear\") + n;",
                "    }",
                "}");
        FileLiterals result = collect(new LiteralCollector(), source);

        assertEquals(List.of("Dear"), result.safeTexts());
        assertEquals(List.of("Hi "), result.manual.stream().map(o -> o.text).collect(Collectors.toList()));
    }
}
