package io.crusher.registry;

import io.crusher.budget.RequestThrottle;
import io.crusher.config.Capabilities;
import io.crusher.config.CrusherConfig;
import io.crusher.core.ContentType;
import io.crusher.core.Crusher;
import io.crusher.transform.ClosureCrusher;
import io.crusher.transform.ClosureServiceClient;
import io.crusher.transform.CssCrusher;
import io.crusher.transform.JsMinCrusher;
import io.crusher.transform.YuglifyCrusher;
import io.crusher.transform.YuiCrusher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable mapping from {@link CrusherKind} to its implementation, queried per content type.
 * Built once at startup.
 */
public final class CrusherRegistry {
    private final Map<CrusherKind, Crusher> crushers;

    private CrusherRegistry(Map<CrusherKind, Crusher> crushers) {
        this.crushers = Collections.unmodifiableMap(new EnumMap<>(crushers));
    }

    /** Registry with every built-in crusher, wired to the probed capabilities. */
    public static CrusherRegistry standard(CrusherConfig config, Capabilities capabilities) {
        ClosureServiceClient service = new ClosureServiceClient(config.closureServiceUrl(), config.remoteTimeout(),
                new RequestThrottle(config.remoteQps()));
        return builder()
                .register(CrusherKind.JSMIN, new JsMinCrusher())
                .register(CrusherKind.SQWISH, new CssCrusher())
                .register(CrusherKind.YUGLIFY, new YuglifyCrusher())
                .register(CrusherKind.YUI, new YuiCrusher(capabilities.java(), capabilities.jar(Capabilities.YUI_JAR)))
                .register(CrusherKind.CLOSURE, new ClosureCrusher(capabilities.java(), capabilities.jar(Capabilities.CLOSURE_JAR), service))
                .build();
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Crusher registered under {@code engine} that accepts {@code type}; empty when the name is
     * unknown, unregistered or not applicable to the type.
     */
    public Optional<Crusher> lookup(String engine, ContentType type) {
        if (type == null) return Optional.empty();
        return CrusherKind.byEngine(engine)
                .filter(kind -> kind.accepts(type))
                .map(crushers::get);
    }

    /** Names of the crushers available for a content type. */
    public SortedSet<String> names(ContentType type) {
        SortedSet<String> names = new TreeSet<>();
        for (CrusherKind kind : crushers.keySet()) {
            if (kind.accepts(type)) names.add(kind.engine());
        }
        return Collections.unmodifiableSortedSet(names);
    }

    /** Engines from {@code engines} that would fail lookup for {@code type}, in request order. */
    public List<String> unknown(List<String> engines, ContentType type) {
        List<String> missing = new ArrayList<>();
        for (String engine : engines) {
            if (lookup(engine, type).isEmpty()) missing.add(engine);
        }
        return missing;
    }

    public static final class Builder {
        private final Map<CrusherKind, Crusher> crushers = new EnumMap<>(CrusherKind.class);

        public Builder register(CrusherKind kind, Crusher crusher) {
            if (!kind.engine().equals(crusher.name())) {
                throw new IllegalArgumentException("Crusher " + crusher.name() + " cannot be registered as " + kind.engine());
            }
            crushers.put(kind, crusher);
            return this;
        }

        public CrusherRegistry build() { return new CrusherRegistry(crushers); }
    }
}
