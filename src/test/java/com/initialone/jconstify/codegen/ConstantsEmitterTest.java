package com.initialone.jconstify.codegen;

import com.initialone.jconstify.ast.JavaSources;
import com.initialone.jconstify.model.LiteralCategory;
import com.initialone.jconstify.model.LiteralOccurrence;
import com.initialone.jconstify.naming.IdentifierSynthesizer;
import com.initialone.jconstify.naming.NamingContext;
import com.initialone.jconstify.naming.SymbolTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConstantsEmitterTest {

    private static SymbolTable table(LiteralOccurrence... occurrences) {
        SymbolTable t = new SymbolTable(new IdentifierSynthesizer(new NamingContext()));
        t.bindAll(List.of(occurrences));
        return t;
    }

    private static LiteralOccurrence occ(String text, String file, LiteralCategory category) {
        return new LiteralOccurrence(text, Path.of(file), 0, category);
    }

    @Test
    @DisplayName("Safe block first, then manual block with origin comments")
    void layout() {
        SymbolTable t = table(
                occ("Welcome, ", "demo/A.java", LiteralCategory.MANUAL),
                occ("Hello", "demo/A.java", LiteralCategory.SAFE));
        String out = new ConstantsEmitter("demo", "K", Path::toString).emit(t);

        String expected = String.join("\n",
                "// GENERATED STRING CONSTANTS",
                "package demo;",
                "",
                "public final class K {",
                "",
                "    private K() {",
                "    }",
                "",
                "    // ✅ Automatically replaceable",
                "    public static final String kHello = \"Hello\";",
                "",
                "    // ⚠️ Manual replacements required",
                "    // Found in: demo/A.java",
                "    public static final String kWelcomeCommaSpace = \"Welcome, \";",
                "}",
                "");
        assertEquals(expected.replace("demo/A.java", Path.of("demo/A.java").toString()), out);
    }

    @Test
    @DisplayName("No manual block when every literal is safe; default package has no package line")
    void defaultPackageWithoutManual() {
        String out = new ConstantsEmitter("", "Strings", null).emit(table(occ("Save", "A.java", LiteralCategory.SAFE)));

        assertTrue(out.startsWith("// GENERATED STRING CONSTANTS\n\npublic final class Strings {"), out);
        assertFalse(out.contains("package "));
        assertFalse(out.contains(ConstantsEmitter.MANUAL_MARKER));
        assertTrue(out.contains("    public static final String kSave = \"Save\";\n}\n"), out);
    }

    @Test
    @DisplayName("An empty table still yields a compilable class")
    void emptyTable() {
        String out = new ConstantsEmitter("demo", "K", null).emit(table());
        assertTrue(out.contains(ConstantsEmitter.SAFE_MARKER));
        assertTrue(new JavaSources().parseQuietly(out).isPresent());
    }

    @Test
    @DisplayName("Values are written as escaped Java literals")
    void escaping() {
        SymbolTable t = table(
                occ("line1\nline2", "A.java", LiteralCategory.SAFE),
                occ("say \"hi\" \\o/", "A.java", LiteralCategory.SAFE),
                occ("bell\u0007", "A.java", LiteralCategory.SAFE));
        String out = new ConstantsEmitter("demo", "K", null).emit(t);

        assertTrue(out.contains("= \"line1\\nline2\";"), out);
        assertTrue(out.contains("= \"say \\\"hi\\\" \\\\o/\";"), out);
        assertTrue(out.contains("= \"bell\\007\";"), out);
        assertTrue(new JavaSources().parseQuietly(out).isPresent());
    }

    @Test
    @DisplayName("Every manual binding records the file it was first seen in")
    void manualOrigins() {
        SymbolTable t = table(
                occ("Hi ", "a/One.java", LiteralCategory.MANUAL),
                occ("!", "b/Two.java", LiteralCategory.MANUAL),
                occ("Hi ", "b/Two.java", LiteralCategory.MANUAL));
        String out = new ConstantsEmitter("demo", "K", p -> p.toString().replace('\\', '/')).emit(t);

        assertEquals(2, out.split("// Found in: ", -1).length - 1);
        assertTrue(out.contains("// Found in: a/One.java\n    public static final String kHiSpace = \"Hi \";"), out);
        assertTrue(out.contains("// Found in: b/Two.java\n    public static final String kExclamation = \"!\";"), out);
    }
}
