package io.crusher.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Optional external capabilities of this host, probed once at startup and immutable afterwards: a
 * {@code java} executable and the vendor jars it can run.
 */
public final class Capabilities {
    private static final Logger log = LoggerFactory.getLogger(Capabilities.class);

    public static final String YUI_JAR = "yui.jar";
    public static final String CLOSURE_JAR = "closure.jar";

    // main class of each vendor jar, used to find it on the class path
    private static final Map<String, String> VENDOR_CLASSES = Map.of(
            YUI_JAR, "com.yahoo.platform.yui.compressor.YUICompressor",
            CLOSURE_JAR, "com.google.javascript.jscomp.CommandLineRunner");

    private final Path java;
    private final Map<String, Path> jars;

    private Capabilities(Path java, Map<String, Path> jars) {
        this.java = java;
        this.jars = Collections.unmodifiableMap(new LinkedHashMap<>(jars));
    }

    public static Capabilities none() { return new Capabilities(null, Map.of()); }

    public static Capabilities withJava(Path java) { return new Capabilities(java, Map.of()); }

    public Capabilities withJar(String name, Path jar) {
        Map<String, Path> next = new LinkedHashMap<>(jars);
        next.put(name, jar);
        return new Capabilities(java, next);
    }

    /**
     * Resolves the {@code java} executable (configured path, then {@code PATH}, then the running
     * JVM) and each vendor jar (the vendor directory, then the class path).
     */
    public static Capabilities probe(CrusherConfig config) {
        Path java = null;
        if (config.javaExecutable() != null) {
            if (Files.isExecutable(config.javaExecutable())) {
                java = config.javaExecutable();
            } else {
                log.warn("Configured java executable {} is not executable, searching PATH", config.javaExecutable());
            }
        }
        if (java == null) java = which("java", System.getenv("PATH")).orElse(null);
        if (java == null) java = runningJava().orElse(null);

        Map<String, Path> jars = new LinkedHashMap<>();
        for (Map.Entry<String, String> vendor : VENDOR_CLASSES.entrySet()) {
            Path inVendorDir = config.vendorDir().resolve(vendor.getKey());
            Optional<Path> jar = Files.isRegularFile(inVendorDir) ? Optional.of(inVendorDir) : classpathJar(vendor.getValue());
            jar.ifPresentOrElse(p -> jars.put(vendor.getKey(), p),
                    () -> log.info("No {} found; its crusher will degrade", vendor.getKey()));
        }
        Capabilities caps = new Capabilities(java, jars);
        log.info("Probed {}", caps);
        return caps;
    }

    static Optional<Path> which(String binary, String searchPath) {
        if (searchPath == null || searchPath.isBlank()) return Optional.empty();
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, binary);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private static Optional<Path> runningJava() {
        Path candidate = Path.of(System.getProperty("java.home"), "bin", "java");
        return Files.isExecutable(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    /** The jar a class was loaded from, if it was loaded from a jar file. */
    static Optional<Path> classpathJar(String className) {
        try {
            Class<?> type = Class.forName(className, false, Capabilities.class.getClassLoader());
            CodeSource source = type.getProtectionDomain().getCodeSource();
            if (source == null || source.getLocation() == null) return Optional.empty();
            Path location = Path.of(source.getLocation().toURI());
            return Files.isRegularFile(location) ? Optional.of(location) : Optional.empty();
        } catch (ClassNotFoundException | LinkageError e) {
            log.debug("{} is not on the class path", className);
            return Optional.empty();
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Cannot resolve the jar of {}: {}", className, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<Path> java() { return Optional.ofNullable(java); }

    /** Path of a vendor jar such as {@link #YUI_JAR}, when present. */
    public Optional<Path> jar(String name) { return Optional.ofNullable(jars.get(name)); }

    @Override
    public String toString() { return "Capabilities{java=" + java + ", jars=" + jars + '}'; }
}
