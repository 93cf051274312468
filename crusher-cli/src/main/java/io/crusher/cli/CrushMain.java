package io.crusher.cli;

import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.crusher.config.CrusherConfig;
import io.crusher.config.CrusherModule;
import io.crusher.core.ContentType;
import io.crusher.core.Task;
import io.crusher.error.CrushException;
import io.crusher.metrics.Metrics;
import io.crusher.registry.CrusherRegistry;
import io.crusher.runtime.WorkerPool;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;

/**
 * CLI that crushes files through the worker pool and reports sizes and timings.
 */
@CommandLine.Command(name = "crush", mixinStandardHelpOptions = true, description = "Minify JavaScript and CSS files with a pool of workers")
public final class CrushMain implements Callable<Integer> {
    @CommandLine.Option(names = {"-e", "--engines"}, description = "Crushers to apply in order, e.g. \"jsmin, yui\"")
    String engines;

    @CommandLine.Option(names = {"-x", "--extension"}, description = "Content type (js|css); default is each file's suffix")
    String extension;

    @CommandLine.Option(names = {"-g", "--gzip"}, description = "Report the gzipped size of the result")
    boolean gzip;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Worker count; default is the number of CPUs")
    Integer workers;

    @CommandLine.Option(names = {"-m", "--mode"}, description = "Worker isolation: ${COMPLETION-CANDIDATES}")
    CrusherConfig.WorkerMode mode;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Directory for crushed files; stdout when omitted")
    Path outDir;

    @CommandLine.Option(names = {"-l", "--list"}, description = "List the available crushers per content type and exit")
    boolean list;

    @CommandLine.Parameters(description = "Files to crush")
    List<Path> files = new ArrayList<>();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new CrushMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CrusherConfig config = CrusherConfig.fromEnv();
        if (workers != null) config = config.withWorkers(workers);
        if (mode != null) config = config.withMode(mode);
        Injector injector = Guice.createInjector(new CrusherModule(config));
        CrusherRegistry registry = injector.getInstance(CrusherRegistry.class);

        if (list) {
            for (ContentType type : ContentType.values()) {
                out.println(type.tag() + ": " + String.join(", ", registry.names(type)));
            }
            out.flush();
            return 0;
        }
        if (engines == null || files.isEmpty()) {
            err.println("Both --engines and at least one file are required");
            return 2;
        }

        Map<Path, Task> tasks = new LinkedHashMap<>();
        for (Path file : files) {
            String tag = extension != null ? extension : suffix(file);
            Optional<ContentType> type = ContentType.fromTag(tag);
            if (type.isEmpty()) {
                err.println(file + ": unsupported extension '" + tag + "'");
                return 2;
            }
            List<String> requested = Task.parseEngines(engines);
            List<String> unknown = registry.unknown(requested, type.get());
            if (!unknown.isEmpty()) {
                err.println(file + ": unknown crushers for " + type.get() + ": " + unknown
                        + " (available: " + registry.names(type.get()) + ")");
                return 2;
            }
            String content = Files.readString(file, StandardCharsets.UTF_8);
            tasks.put(file, new Task(file.toString(), requested, type.get().tag(), content, gzip));
        }

        Map<Path, CrushException> errors = new ConcurrentHashMap<>();
        Map<Path, Task> results = new ConcurrentHashMap<>();
        CountDownLatch latch = new CountDownLatch(tasks.size());
        try (WorkerPool pool = injector.getInstance(WorkerPool.class)) {
            pool.initialize();
            for (Map.Entry<Path, Task> e : tasks.entrySet()) {
                pool.send(e.getValue(), (error, task) -> {
                    if (error != null) errors.put(e.getKey(), error);
                    results.put(e.getKey(), task);
                    latch.countDown();
                });
            }
            latch.await();
        }

        if (outDir != null) Files.createDirectories(outDir);
        for (Map.Entry<Path, Task> e : tasks.entrySet()) {
            Path file = e.getKey();
            Task result = results.get(file);
            CrushException error = errors.get(file);
            err.println(report(file, e.getValue(), result, error));
            if (error != null) continue;
            if (outDir != null) {
                Files.writeString(outDir.resolve(file.getFileName()), result.content(), StandardCharsets.UTF_8);
            } else {
                out.println(result.content());
            }
        }
        printTimers(err, injector.getInstance(Metrics.class), Task.parseEngines(engines));
        out.flush();
        err.flush();
        return errors.isEmpty() ? 0 : 1;
    }

    static String report(Path file, Task original, Task result, CrushException error) {
        StringBuilder sb = new StringBuilder(file.toString()).append(": ");
        if (error != null) sb.append("FAILED ").append(error.getMessage()).append(" | ");
        sb.append(original.content().length()).append(" -> ").append(result.content().length()).append(" chars");
        if (result.gzipSize() != null) sb.append(", gzip ").append(result.gzipSize()).append(" bytes");
        sb.append(" in ").append(result.duration()).append("ms ").append(result.individual());
        return sb.toString();
    }

    private static void printTimers(PrintWriter err, Metrics metrics, List<String> engines) {
        for (String engine : engines) {
            Timer t = metrics.crusherTimer(engine);
            if (t.getCount() == 0) continue;
            err.printf("  %s: count=%d p50=%.3fms%n", engine, t.getCount(), t.getSnapshot().getMedian() / 1_000_000.0);
        }
        long failures = metrics.counter(Metrics.POOL_CORRELATION_FAILURES).getCount();
        if (failures > 0) err.println("  correlation failures: " + failures);
    }

    private static String suffix(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1);
    }
}
