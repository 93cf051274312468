package io.crusher.transform;

import io.crusher.core.ContentType;
import io.crusher.registry.CrusherKind;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * YUI Compressor for scripts and stylesheets. Without Java or the jar the content is passed
 * through unchanged.
 */
public class YuiCrusher extends JarCrusher {

    public YuiCrusher(Optional<Path> javaExecutable, Optional<Path> jar) {
        super(CrusherKind.YUI, javaExecutable, jar);
    }

    @Override
    protected Map<String, Object> options(ContentType type) {
        // no charset flag: YUI mangles utf-8 when forced to ascii
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("type", type.tag());
        options.put("line-break", 256);
        options.put("verbose", false);
        return options;
    }

    @Override
    protected CompletionStage<String> withoutJava(ContentType type, String content) {
        return CompletableFuture.completedFuture(content);
    }
}
