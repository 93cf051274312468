package io.crusher.config;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.crusher.metrics.Metrics;
import io.crusher.registry.CrusherRegistry;
import io.crusher.runtime.PipelineExecutor;
import io.crusher.runtime.ProcessWorkerChannel;
import io.crusher.runtime.ThreadWorkerChannel;
import io.crusher.runtime.WorkerChannelFactory;
import io.crusher.runtime.WorkerPool;
import io.crusher.runtime.WorkerPoolBuilder;

public class CrusherModule extends AbstractModule {
    private final CrusherConfig config;

    public CrusherModule(CrusherConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(CrusherConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Capabilities capabilities() { return Capabilities.probe(config); }

    @Provides @Singleton CrusherRegistry registry(Capabilities capabilities) { return CrusherRegistry.standard(config, capabilities); }

    @Provides @Singleton PipelineExecutor pipelineExecutor(CrusherRegistry registry, Metrics metrics) { return new PipelineExecutor(registry, metrics); }

    @Provides @Singleton WorkerChannelFactory channels(PipelineExecutor executor) {
        return config.mode() == CrusherConfig.WorkerMode.PROCESS
                ? ProcessWorkerChannel.factory(config)
                : ThreadWorkerChannel.factory(executor);
    }

    @Provides @Singleton WorkerPool workerPool(WorkerChannelFactory channels, MetricRegistry registry) {
        return new WorkerPoolBuilder()
                .channels(channels)
                .workers(config.workers())
                .metrics(registry)
                .build();
    }
}
