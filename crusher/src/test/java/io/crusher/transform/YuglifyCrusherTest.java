package io.crusher.transform;

import io.crusher.core.ContentType;
import io.crusher.error.CrushException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

public class YuglifyCrusherTest {
    final YuglifyCrusher yuglify = new YuglifyCrusher();

    private String crush(ContentType type, String content) throws Exception {
        return yuglify.crush(type, content).toCompletableFuture().get();
    }

    @Test
    void accepts_scripts_and_stylesheets() {
        assertEquals("yuglify", yuglify.name());
        assertTrue(yuglify.accepts().contains(ContentType.JS));
        assertTrue(yuglify.accepts().contains(ContentType.CSS));
    }

    @Test
    void compresses_scripts() throws Exception {
        assertEquals("var a=1;", crush(ContentType.JS, "var  a = 1 ;\n"));
    }

    @Test
    void munges_local_names() throws Exception {
        String out = crush(ContentType.JS, "function twice(longArgumentName) {\n  return longArgumentName * 2;\n}\n");
        assertTrue(out.startsWith("function twice("), out);
        assertFalse(out.contains("longArgumentName"), out);
    }

    @Test
    void compresses_stylesheets() throws Exception {
        assertEquals("a{color:red}", crush(ContentType.CSS, "/* note */\na {\n  color: red;\n}\n"));
    }

    @Test
    void syntax_errors_fail_the_stage() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> crush(ContentType.JS, "var = ;"));
        assertInstanceOf(CrushException.class, e.getCause());
        assertTrue(e.getCause().getMessage().contains("line 1"), e.getCause().getMessage());
    }
}
