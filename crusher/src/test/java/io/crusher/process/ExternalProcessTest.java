package io.crusher.process;

import io.crusher.error.ExternalProcessException;
import io.crusher.error.ExternalProcessException.Kind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ExternalProcessTest {
    final ExternalProcess sh = new ExternalProcess(Path.of("/bin/sh"));

    private static ExternalProcessException failure(ExternalProcess p, List<String> argv, String content) throws Exception {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> p.invoke(argv, Map.of(), content).get(10, TimeUnit.SECONDS));
        return assertInstanceOf(ExternalProcessException.class, e.getCause());
    }

    @Test
    void builds_flags_from_truthy_options() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("type", "css");
        options.put("line-break", 256);
        options.put("verbose", false);
        options.put("charset", "");
        options.put("missing", null);
        options.put("level", 0);
        options.put("quiet", true);
        List<String> argv = new ArrayList<>(List.of("-jar", "yui.jar"));

        List<String> args = ExternalProcess.arguments(argv, options);

        assertEquals(List.of("-jar", "yui.jar", "--type", "css", "--line-break", "256", "--quiet"), args);
        assertEquals(List.of("-jar", "yui.jar"), argv);
    }

    @Test
    void null_options_leave_argv_alone() {
        assertEquals(List.of("-v"), ExternalProcess.arguments(List.of("-v"), null));
    }

    @Test
    void diagnostics_win_over_exit_code() {
        List<String> cmd = List.of("tool");
        ExternalProcessException e = assertThrows(ExternalProcessException.class,
                () -> ExternalProcess.classify(2, "out", "warning: x", cmd));
        assertEquals(Kind.DIAGNOSTIC, e.kind());
        assertEquals("warning: x", e.getMessage());
        assertEquals(2, e.exitCode());

        e = assertThrows(ExternalProcessException.class, () -> ExternalProcess.classify(2, "out", "", cmd));
        assertEquals(Kind.EXIT_CODE, e.kind());
        assertTrue(e.getMessage().contains("2"));

        e = assertThrows(ExternalProcessException.class, () -> ExternalProcess.classify(0, "", "", cmd));
        assertEquals(Kind.NO_OUTPUT, e.kind());
        assertTrue(e.getMessage().contains("tool"));
    }

    @Test
    void streams_content_through_the_process() throws Exception {
        String content = "line one\nline two\n".repeat(10_000);
        String out = sh.invoke(List.of("-c", "cat"), Map.of(), content).get(10, TimeUnit.SECONDS);
        assertEquals(content, out);
    }

    @Test
    void passes_option_flags_to_the_process() throws Exception {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("type", "js");
        options.put("verbose", true);
        options.put("skip", false);
        String out = sh.invoke(List.of("-c", "printf '%s ' \"$@\"", "sh"), options, "").get(10, TimeUnit.SECONDS);
        assertEquals("--type js --verbose ", out);
    }

    @Test
    void stderr_output_fails_with_its_text() throws Exception {
        ExternalProcessException e = failure(sh, List.of("-c", "echo oops >&2; echo fine"), "");
        assertEquals(Kind.DIAGNOSTIC, e.kind());
        assertEquals("oops\n", e.getMessage());
    }

    @Test
    void non_zero_exit_fails_with_code() throws Exception {
        ExternalProcessException e = failure(sh, List.of("-c", "cat >/dev/null; exit 3"), "x");
        assertEquals(Kind.EXIT_CODE, e.kind());
        assertEquals(3, e.exitCode());
    }

    @Test
    void empty_output_fails_naming_the_command() throws Exception {
        ExternalProcessException e = failure(sh, List.of("-c", "cat >/dev/null"), "x");
        assertEquals(Kind.NO_OUTPUT, e.kind());
        assertTrue(e.getMessage().contains("/bin/sh"), e.getMessage());
    }

    @Test
    void missing_executable_fails_to_spawn() throws Exception {
        ExternalProcess missing = new ExternalProcess(Path.of("/nonexistent/crusher-binary"));
        ExternalProcessException e = failure(missing, List.of(), "x");
        assertEquals(Kind.SPAWN, e.kind());
        assertEquals(-1, e.exitCode());
    }
}
