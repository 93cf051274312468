package io.crusher.runtime;

import com.codahale.metrics.MetricRegistry;
import io.crusher.config.Capabilities;
import io.crusher.config.CrusherConfig;
import io.crusher.core.Task;
import io.crusher.metrics.Metrics;
import io.crusher.registry.CrusherRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of a process worker. Reads tasks from stdin, runs them on a single-threaded loop and
 * writes replies to stdout until stdin closes.
 */
public final class WorkerMain {
    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    private WorkerMain() {}

    public static void main(String[] args) throws Exception {
        CrusherConfig config = CrusherConfig.fromEnv();
        CrusherRegistry registry = CrusherRegistry.standard(config, Capabilities.probe(config));
        PipelineExecutor executor = new PipelineExecutor(registry, new Metrics(new MetricRegistry()));
        TaskCodec codec = new TaskCodec();
        PrintStream out = new PrintStream(System.out, false, StandardCharsets.UTF_8);
        ExecutorService loop = Executors.newSingleThreadExecutor(r -> new Thread(r, "crusher-worker-loop"));

        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                Task task;
                try {
                    task = codec.decodeTask(line);
                } catch (IOException e) {
                    log.error("Unreadable task message: {}", line, e);
                    continue;
                }
                loop.execute(() -> executor.execute(task, loop).thenAccept(reply -> write(out, codec, reply)));
            }
        } finally {
            loop.shutdown();
            loop.awaitTermination(30, TimeUnit.SECONDS);
            out.flush();
        }
    }

    private static void write(PrintStream out, TaskCodec codec, Reply reply) {
        try {
            String line = codec.encodeReply(reply);
            synchronized (out) {
                out.println(line);
                out.flush();
            }
        } catch (IOException e) {
            log.error("Unable to encode reply for task {}", reply.task().id(), e);
        }
    }
}
