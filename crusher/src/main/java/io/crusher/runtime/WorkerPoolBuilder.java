package io.crusher.runtime;

import com.codahale.metrics.MetricRegistry;
import io.crusher.error.CorrelationException;
import io.crusher.metrics.Metrics;

import java.util.Objects;
import java.util.function.Consumer;

public class WorkerPoolBuilder {
    private WorkerChannelFactory channels;
    private int workers = Runtime.getRuntime().availableProcessors();
    private MetricRegistry metricRegistry = new MetricRegistry();
    private Consumer<CorrelationException> onCorrelationFailure;

    public WorkerPoolBuilder channels(WorkerChannelFactory f) { this.channels = f; return this; }
    public WorkerPoolBuilder workers(int w) { this.workers = Math.max(1, w); return this; }
    public WorkerPoolBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public WorkerPoolBuilder onCorrelationFailure(Consumer<CorrelationException> h) { this.onCorrelationFailure = h; return this; }

    public WorkerPool build() {
        Objects.requireNonNull(channels, "channels");
        return new WorkerPool(channels, workers, new Metrics(metricRegistry), onCorrelationFailure);
    }
}
