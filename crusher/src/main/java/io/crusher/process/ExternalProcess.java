package io.crusher.process;

import io.crusher.error.ExternalProcessException;
import io.crusher.error.ExternalProcessException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs an external executable as a content filter: content goes to stdin, the crushed result is
 * read from stdout. Both output streams are buffered concurrently so neither can fill its pipe and
 * stall the child.
 */
public class ExternalProcess {
    private static final Logger log = LoggerFactory.getLogger(ExternalProcess.class);

    private final Path executable;

    public ExternalProcess(Path executable) {
        this.executable = Objects.requireNonNull(executable, "executable");
    }

    public Path executable() { return executable; }

    /**
     * Spawns the executable with {@code argv} followed by the flags built from {@code options} and
     * feeds it {@code content}. The returned future completes with stdout, or exceptionally with an
     * {@link ExternalProcessException}.
     */
    public CompletableFuture<String> invoke(List<String> argv, Map<String, ?> options, String content) {
        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        command.addAll(arguments(argv, options));
        log.debug("Spawning {}", command);

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new ExternalProcessException(Kind.SPAWN, "Unable to start " + command + ": " + e.getMessage(), e));
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), Io.executor());
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), Io.executor());
        CompletableFuture<Void> stdin = CompletableFuture.runAsync(() -> feed(process.getOutputStream(), content), Io.executor());

        return CompletableFuture.allOf(stdout, stderr, stdin)
                .thenCombine(process.onExit(), (ignored, p) -> p.exitValue())
                .thenCompose(code -> {
                    try {
                        return CompletableFuture.completedFuture(classify(code, stdout.join(), stderr.join(), command));
                    } catch (ExternalProcessException e) {
                        return CompletableFuture.failedFuture(e);
                    }
                });
    }

    /**
     * Appends a {@code --key} flag for every truthy option. Boolean options contribute only the
     * flag; other values contribute the flag followed by the value. {@code argv} is not modified.
     */
    public static List<String> arguments(List<String> argv, Map<String, ?> options) {
        List<String> args = new ArrayList<>(argv);
        if (options == null) return args;
        for (Map.Entry<String, ?> option : options.entrySet()) {
            Object value = option.getValue();
            if (!truthy(value)) continue;
            args.add("--" + option.getKey());
            if (!(value instanceof Boolean)) args.add(String.valueOf(value));
        }
        return args;
    }

    static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        return true;
    }

    /**
     * Interprets a finished process. The diagnostic stream wins over a zero exit code since some
     * tools only warn there.
     */
    static String classify(int exitCode, String stdout, String stderr, List<String> command) throws ExternalProcessException {
        if (!stderr.isEmpty()) throw new ExternalProcessException(Kind.DIAGNOSTIC, exitCode, stderr);
        if (exitCode != 0) throw new ExternalProcessException(Kind.EXIT_CODE, exitCode, "Process exited with code " + exitCode);
        if (stdout.isEmpty()) throw new ExternalProcessException(Kind.NO_OUTPUT, exitCode, "No data returned " + command);
        return stdout;
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void feed(OutputStream out, String content) {
        try (out) {
            if (content != null) out.write(content.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            // the child stopped reading; its exit status and streams decide the outcome
            log.debug("Could not write all content to child process: {}", e.getMessage());
        }
    }

    // Stream pumps; each invocation parks up to three threads while the child runs.
    static final class Io {
        private static final ExecutorService EXEC = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "crusher-process-io");
            t.setDaemon(true);
            return t;
        });

        static ExecutorService executor() { return EXEC; }
    }
}
