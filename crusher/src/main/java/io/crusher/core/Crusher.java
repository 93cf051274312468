package io.crusher.core;

import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * A named content-to-content function for one or more content types. Implementations complete the
 * returned stage exceptionally with a {@link io.crusher.error.CrushException} on failure and must
 * not block the calling thread on external work.
 */
public interface Crusher {
    String name();

    Set<ContentType> accepts();

    CompletionStage<String> crush(ContentType type, String content);
}
