package io.crusher.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin view over a {@link MetricRegistry} with the metric names used by the pool and the pipeline.
 */
public class Metrics {
    public static final String PIPELINE_ERRORS = "crusher.pipeline.error.rate";
    public static final String POOL_DISPATCH = "pool.dispatch.rate";
    public static final String POOL_REPLY = "pool.reply.rate";
    public static final String POOL_INFLIGHT = "pool.inflight";
    public static final String POOL_CORRELATION_FAILURES = "pool.correlation.failures";
    public static final String POOL_WORKERS_KILLED = "pool.workers.killed";
    public static final String POOL_WORKERS_LOST = "pool.workers.lost";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Timer for one crusher, e.g. {@code crusher.jsmin.time}. */
    public Timer crusherTimer(String engine) { return registry.timer("crusher." + engine + ".time"); }
}
