package io.crusher.transform;

import io.crusher.core.ContentType;
import io.crusher.core.Crusher;
import io.crusher.error.UnsupportedTypeException;
import io.crusher.registry.CrusherKind;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Gates every invocation on the content types declared by the crusher's {@link CrusherKind}.
 */
public abstract class AbstractCrusher implements Crusher {
    private final CrusherKind kind;

    protected AbstractCrusher(CrusherKind kind) {
        this.kind = kind;
    }

    public CrusherKind kind() { return kind; }

    @Override
    public String name() { return kind.engine(); }

    @Override
    public Set<ContentType> accepts() { return kind.accepts(); }

    @Override
    public final CompletionStage<String> crush(ContentType type, String content) {
        if (type == null || !kind.accepts(type)) {
            return CompletableFuture.failedFuture(new UnsupportedTypeException(name(), type));
        }
        try {
            return crushAccepted(type, content);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    protected abstract CompletionStage<String> crushAccepted(ContentType type, String content);
}
