package io.crusher.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Unit of work and unit of reply correlation. The content buffer is replaced in place as the
 * pipeline progresses; timings are filled in by the worker that ran it.
 *
 * <p>A task is not thread-safe. Transports hand workers a {@link #copy()} so the caller and the
 * worker never share one instance.
 */
public final class Task {
    private String id;
    private final List<String> engines;
    private final String extension;
    private String content;
    private final boolean gzip;
    private Long gzipSize;
    private long duration;
    private final Map<String, Long> individual = new LinkedHashMap<>();

    public Task(String id, List<String> engines, String extension, String content, boolean gzip) {
        this.id = id;
        this.engines = List.copyOf(Objects.requireNonNull(engines, "engines"));
        this.extension = extension;
        this.content = content;
        this.gzip = gzip;
    }

    /** Builds a task without an id from a comma separated engine list such as {@code "jsmin, yui"}. */
    public static Task of(String engines, String extension, String content) {
        return new Task(null, parseEngines(engines), extension, content, false);
    }

    public static Task of(String engines, String extension, String content, boolean gzip) {
        return new Task(null, parseEngines(engines), extension, content, gzip);
    }

    public static List<String> parseEngines(String engines) {
        if (engines == null || engines.isBlank()) return List.of();
        return Arrays.stream(engines.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    public String id() { return id; }
    public Task id(String id) { this.id = id; return this; }

    public List<String> engines() { return engines; }
    public String enginesString() { return String.join(", ", engines); }

    public String extension() { return extension; }

    public String content() { return content; }
    public Task content(String content) { this.content = content; return this; }

    /** Whether a gzip size measurement was requested. */
    public boolean gzip() { return gzip; }

    /** Compressed byte length of the final content, or {@code null} when not measured. */
    public Long gzipSize() { return gzipSize; }
    public Task gzipSize(Long gzipSize) { this.gzipSize = gzipSize; return this; }

    /** Total pipeline wall time in milliseconds. */
    public long duration() { return duration; }
    public Task duration(long millis) { this.duration = millis; return this; }

    /** Crusher name to the wall time in milliseconds it consumed, in attempt order. */
    public Map<String, Long> individual() { return Collections.unmodifiableMap(individual); }

    public Task recordIndividual(String engine, long millis) {
        individual.merge(engine, millis, Long::sum);
        return this;
    }

    public Task copy() {
        Task t = new Task(id, new ArrayList<>(engines), extension, content, gzip);
        t.gzipSize = gzipSize;
        t.duration = duration;
        t.individual.putAll(individual);
        return t;
    }

    @Override
    public String toString() {
        return "Task{" +
                "id='" + id + '\'' +
                ", engines=" + engines +
                ", extension='" + extension + '\'' +
                ", contentLength=" + (content == null ? -1 : content.length()) +
                ", gzip=" + (gzipSize != null ? gzipSize : gzip) +
                ", duration=" + duration +
                ", individual=" + individual +
                '}';
    }
}
