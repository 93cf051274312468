package io.crusher.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Runtime configuration. Each value resolves from a system property, then an environment
 * variable, then a default.
 */
public record CrusherConfig(
        int workers,
        WorkerMode mode,
        Path vendorDir,
        Path javaExecutable,
        URI closureServiceUrl,
        long remoteQps,
        Duration remoteTimeout
) {
    public static final URI DEFAULT_CLOSURE_URL = URI.create("https://closure-compiler.appspot.com/compile");

    /** How workers are isolated from the control context. */
    public enum WorkerMode { THREAD, PROCESS }

    public static CrusherConfig fromEnv() {
        int workers = Integer.parseInt(value("crusher.workers", "CRUSHER_WORKERS",
                String.valueOf(Runtime.getRuntime().availableProcessors())));
        WorkerMode mode = WorkerMode.valueOf(value("crusher.mode", "CRUSHER_MODE", "thread").toUpperCase(Locale.ROOT));
        Path vendor = Path.of(value("crusher.vendor", "CRUSHER_VENDOR", "vendor"));
        String java = value("crusher.java", "CRUSHER_JAVA", "");
        URI closure = URI.create(value("crusher.closure.url", "CRUSHER_CLOSURE_URL", DEFAULT_CLOSURE_URL.toString()));
        long qps = Long.parseLong(value("crusher.remote.qps", "CRUSHER_REMOTE_QPS", "0"));
        long timeoutMs = Long.parseLong(value("crusher.remote.timeout.ms", "CRUSHER_REMOTE_TIMEOUT_MS", "10000"));
        return new CrusherConfig(workers, mode, vendor, java.isBlank() ? null : Path.of(java), closure, qps,
                Duration.ofMillis(timeoutMs));
    }

    public static CrusherConfig defaults() {
        return new CrusherConfig(Runtime.getRuntime().availableProcessors(), WorkerMode.THREAD, Path.of("vendor"),
                null, DEFAULT_CLOSURE_URL, 0, Duration.ofSeconds(10));
    }

    public CrusherConfig withWorkers(int n) {
        return new CrusherConfig(n, mode, vendorDir, javaExecutable, closureServiceUrl, remoteQps, remoteTimeout);
    }

    public CrusherConfig withMode(WorkerMode m) {
        return new CrusherConfig(workers, m, vendorDir, javaExecutable, closureServiceUrl, remoteQps, remoteTimeout);
    }

    /** Properties that reproduce this configuration in a forked worker JVM. */
    public Map<String, String> toSystemProperties() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("crusher.workers", String.valueOf(workers));
        props.put("crusher.mode", mode.name().toLowerCase(Locale.ROOT));
        props.put("crusher.vendor", vendorDir.toAbsolutePath().toString());
        if (javaExecutable != null) props.put("crusher.java", javaExecutable.toString());
        props.put("crusher.closure.url", closureServiceUrl.toString());
        props.put("crusher.remote.qps", String.valueOf(remoteQps));
        props.put("crusher.remote.timeout.ms", String.valueOf(remoteTimeout.toMillis()));
        return props;
    }

    private static String value(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }
}
