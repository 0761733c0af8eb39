package com.initialone.jconstify.rewrite;

import com.initialone.jconstify.ast.JavaSources;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ImportInjectorTest {

    private final ImportInjector injector = new ImportInjector("demo.K", new JavaSources());

    @Test
    void statement() {
        assertEquals("import static demo.K.*;", injector.importStatement());
    }

    @Test
    @DisplayName("Goes after the last existing import")
    void afterLastImport() {
        String src = "package p;\n\nimport java.util.List;\nimport java.util.Map;\n\nclass A {}\n";
        assertEquals("package p;\n\nimport java.util.List;\nimport java.util.Map;\nimport static demo.K.*;\n\nclass A {}\n",
                injector.ensureImport(src));
    }

    @Test
    @DisplayName("Goes after the package declaration when there are no imports")
    void afterPackage() {
        String src = "package p;\n\nclass A {}\n";
        assertEquals("package p;\n\nimport static demo.K.*;\n\nclass A {}\n", injector.ensureImport(src));
    }

    @Test
    @DisplayName("Goes to the top of a default-package file")
    void atTop() {
        assertEquals("import static demo.K.*;\n\nclass A {}\n", injector.ensureImport("class A {}\n"));
    }

    @Test
    @DisplayName("Keeps CRLF line endings")
    void crlf() {
        String src = "package p;\r\n\r\nclass A {}\r\n";
        assertEquals("package p;\r\n\r\nimport static demo.K.*;\r\n\r\nclass A {}\r\n", injector.ensureImport(src));
    }

    @Test
    @DisplayName("An existing static wildcard import is not duplicated")
    void idempotent() {
        String src = "package p;\n\nimport static demo.K.*;\n\nclass A {}\n";
        assertSame(src, injector.ensureImport(src));

        String once = injector.ensureImport("package p;\n\nclass A {}\n");
        assertEquals(once, injector.ensureImport(once));
    }

    @Test
    @DisplayName("Other imports of the same class do not count")
    void otherImportsOfSameClass() {
        String src = "package p;\n\nimport demo.K;\nimport static demo.K.kHello;\n\nclass A {}\n";
        String out = injector.ensureImport(src);
        assertTrue(out.contains("import static demo.K.kHello;\nimport static demo.K.*;\n"), out);
    }
}
