package io.crusher.transform;

import io.crusher.core.ContentType;
import io.crusher.process.ExternalProcess;
import io.crusher.registry.CrusherKind;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Crusher backed by a vendor jar run with the host's Java executable. It runs locally only when
 * both the executable and the jar were found; otherwise each subclass decides in
 * {@link #withoutJava}.
 */
public abstract class JarCrusher extends AbstractCrusher {
    private final Optional<ExternalProcess> java;
    private final Optional<Path> jar;

    protected JarCrusher(CrusherKind kind, Optional<Path> javaExecutable, Optional<Path> jar) {
        super(kind);
        this.java = jar.isPresent() ? javaExecutable.map(ExternalProcess::new) : Optional.empty();
        this.jar = jar;
    }

    @Override
    protected final CompletionStage<String> crushAccepted(ContentType type, String content) {
        if (java.isEmpty()) return withoutJava(type, content);
        return java.get().invoke(List.of("-jar", jar.get().toString()), options(type), content);
    }

    public Optional<Path> jar() { return jar; }

    public boolean runsLocally() { return java.isPresent(); }

    /** Command line flags for the jar; see {@link ExternalProcess#arguments}. */
    protected abstract Map<String, Object> options(ContentType type);

    protected abstract CompletionStage<String> withoutJava(ContentType type, String content);
}
