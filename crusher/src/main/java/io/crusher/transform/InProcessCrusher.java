package io.crusher.transform;

import io.crusher.core.ContentType;
import io.crusher.error.CrushException;
import io.crusher.registry.CrusherKind;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Pure function over the content, run synchronously on the worker's thread.
 */
public abstract class InProcessCrusher extends AbstractCrusher {

    protected InProcessCrusher(CrusherKind kind) {
        super(kind);
    }

    @Override
    protected final CompletionStage<String> crushAccepted(ContentType type, String content) {
        try {
            return CompletableFuture.completedFuture(compact(type, content));
        } catch (CrushException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    protected abstract String compact(ContentType type, String content) throws CrushException;
}
