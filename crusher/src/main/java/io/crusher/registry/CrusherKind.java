package io.crusher.registry;

import io.crusher.core.ContentType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Every crusher this system knows about, with the content types it accepts. A name that does not
 * map to a kind can never be registered.
 */
public enum CrusherKind {
    JSMIN("jsmin", EnumSet.of(ContentType.JS)),
    SQWISH("sqwish", EnumSet.of(ContentType.CSS)),
    YUGLIFY("yuglify", EnumSet.of(ContentType.JS, ContentType.CSS)),
    YUI("yui", EnumSet.of(ContentType.JS, ContentType.CSS)),
    CLOSURE("closure", EnumSet.of(ContentType.JS));

    private final String engine;
    private final Set<ContentType> accepts;

    CrusherKind(String engine, EnumSet<ContentType> accepts) {
        this.engine = engine;
        this.accepts = Collections.unmodifiableSet(accepts);
    }

    /** Name used in task engine lists. */
    public String engine() { return engine; }

    public Set<ContentType> accepts() { return accepts; }

    public boolean accepts(ContentType type) { return accepts.contains(type); }

    public static Optional<CrusherKind> byEngine(String engine) {
        if (engine == null) return Optional.empty();
        for (CrusherKind kind : values()) {
            if (kind.engine.equals(engine)) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
