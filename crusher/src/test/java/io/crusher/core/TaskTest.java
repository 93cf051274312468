package io.crusher.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TaskTest {
    @Test
    void parses_comma_delimited_engines() {
        assertEquals(List.of("a", "b", "c"), Task.parseEngines("a, b ,,c "));
        assertEquals(List.of("jsmin"), Task.parseEngines("jsmin"));
        assertTrue(Task.parseEngines(null).isEmpty());
        assertTrue(Task.parseEngines("  ").isEmpty());
        assertEquals("a, b", Task.of("a,b", "js", "").enginesString());
    }

    @Test
    void copy_shares_nothing_mutable() {
        Task task = new Task("1", List.of("jsmin"), "js", "var a;", true);
        task.recordIndividual("jsmin", 3);
        Task copy = task.copy();

        copy.content("changed").recordIndividual("yui", 1).id("2");

        assertEquals("var a;", task.content());
        assertEquals("1", task.id());
        assertEquals(1, task.individual().size());
        assertEquals(2, copy.individual().size());
        assertTrue(copy.gzip());
    }

    @Test
    void repeated_engine_time_accumulates() {
        Task task = Task.of("jsmin, jsmin", "js", "");
        task.recordIndividual("jsmin", 2).recordIndividual("jsmin", 5);
        assertEquals(Long.valueOf(7), task.individual().get("jsmin"));
        assertThrows(UnsupportedOperationException.class, () -> task.individual().put("x", 1L));
    }

    @Test
    void content_types_resolve_from_tags() {
        assertEquals(Optional.of(ContentType.CSS), ContentType.fromTag(".CSS"));
        assertEquals(Optional.of(ContentType.JS), ContentType.fromTag("js"));
        assertTrue(ContentType.fromTag("html").isEmpty());
        assertTrue(ContentType.fromTag(null).isEmpty());
    }

    @Test
    void gzip_size_of_repetitive_content_is_smaller() throws Exception {
        String content = "body{color:red}".repeat(100);
        long size = GzipSize.of(content);
        assertTrue(size > 0);
        assertTrue(size < content.length());
    }
}
