package io.crusher.config;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.crusher.core.Task;
import io.crusher.metrics.Metrics;
import io.crusher.registry.CrusherRegistry;
import io.crusher.runtime.WorkerPool;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class CrusherModuleTest {
    @Test
    void wires_a_working_pool() throws Exception {
        Injector injector = Guice.createInjector(new CrusherModule(CrusherConfig.defaults().withWorkers(2)));
        assertSame(injector.getInstance(CrusherRegistry.class), injector.getInstance(CrusherRegistry.class));

        try (WorkerPool pool = injector.getInstance(WorkerPool.class)) {
            pool.initialize();
            assertEquals(2, pool.workers().size());
            CompletableFuture<Task> reply = new CompletableFuture<>();
            pool.send(Task.of("sqwish", "css", "a { color : red ; }"), (error, task) -> {
                if (error != null) reply.completeExceptionally(error);
                else reply.complete(task);
            });
            assertEquals("a{color :red}", reply.get(5, TimeUnit.SECONDS).content());
        }
        Metrics metrics = injector.getInstance(Metrics.class);
        assertEquals(1, metrics.crusherTimer("sqwish").getCount());
        assertEquals(1, metrics.meter(Metrics.POOL_REPLY).getCount());
    }
}
