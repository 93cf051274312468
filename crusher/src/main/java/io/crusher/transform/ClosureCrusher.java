package io.crusher.transform;

import io.crusher.core.ContentType;
import io.crusher.registry.CrusherKind;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Google Closure Compiler with simple optimizations. Runs the compiler jar when Java and the jar
 * are available and the hosted compiler service otherwise.
 */
public class ClosureCrusher extends JarCrusher {
    private final ClosureServiceClient service;

    public ClosureCrusher(Optional<Path> javaExecutable, Optional<Path> jar, ClosureServiceClient service) {
        super(CrusherKind.CLOSURE, javaExecutable, jar);
        this.service = service;
    }

    @Override
    protected Map<String, Object> options(ContentType type) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("charset", "ascii");
        options.put("compilation_level", "SIMPLE_OPTIMIZATIONS");
        options.put("language_in", "ECMASCRIPT5");
        options.put("warning_level", "QUIET");
        options.put("jscomp_off", "uselessCode");
        options.put("summary_detail_level", 0);
        return options;
    }

    @Override
    protected CompletionStage<String> withoutJava(ContentType type, String content) {
        return service.compile(content);
    }
}
