package io.crusher.runtime;

import io.crusher.config.CrusherConfig;
import io.crusher.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Worker running in a forked JVM ({@link WorkerMain}). Tasks are written to the child's stdin and
 * replies read from its stdout, one JSON line each; the child's stderr is inherited for logging.
 */
public class ProcessWorkerChannel implements WorkerChannel {
    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerChannel.class);

    private final String name;
    private final Process process;
    private final BufferedWriter stdin;
    private final TaskCodec codec;
    private final Thread reader;
    private volatile Consumer<Reply> listener;
    private volatile Runnable lostListener;
    private volatile boolean destroyed;

    public ProcessWorkerChannel(String name, List<String> command, TaskCodec codec) throws IOException {
        this.name = name;
        this.codec = codec;
        this.process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.reader = new Thread(this::readReplies, name + "-reader");
        this.reader.setDaemon(true);
        this.reader.start();
        log.debug("Started worker process {} pid={}", name, process.pid());
    }

    /** Factory forking {@link WorkerMain} on this JVM's executable and class path. */
    public static WorkerChannelFactory factory(CrusherConfig config) {
        List<String> command = command(config);
        TaskCodec codec = new TaskCodec();
        return index -> new ProcessWorkerChannel("crusher-worker-" + index, command, codec);
    }

    static List<String> command(CrusherConfig config) {
        String java = ProcessHandle.current().info().command()
                .orElse(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        List<String> command = new ArrayList<>();
        command.add(java);
        for (Map.Entry<String, String> p : config.toSystemProperties().entrySet()) {
            command.add("-D" + p.getKey() + "=" + p.getValue());
        }
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(WorkerMain.class.getName());
        return command;
    }

    @Override
    public String name() { return name; }

    @Override
    public void onReply(Consumer<Reply> listener) { this.listener = listener; }

    @Override
    public void onLost(Runnable listener) { this.lostListener = listener; }

    @Override
    public void transmit(Task task) throws IOException {
        String line = codec.encodeTask(task);
        synchronized (stdin) {
            stdin.write(line);
            stdin.newLine();
            stdin.flush();
        }
    }

    private void readReplies() {
        try (BufferedReader in = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                Reply reply;
                try {
                    reply = codec.decodeReply(line);
                } catch (IOException e) {
                    log.error("Worker {} sent an unreadable reply: {}", name, line, e);
                    continue;
                }
                Consumer<Reply> l = listener;
                if (!destroyed && l != null) l.accept(reply);
            }
        } catch (IOException e) {
            if (!destroyed) {
                log.error("Lost connection to worker {}", name, e);
                lost();
            }
            return;
        }
        if (!destroyed) {
            log.error("Worker {} exited unexpectedly", name);
            lost();
        }
    }

    private void lost() {
        Runnable l = lostListener;
        if (l != null) l.run();
    }

    @Override
    public void destroy() {
        destroyed = true;
        try {
            synchronized (stdin) {
                stdin.close();
            }
        } catch (IOException e) {
            log.debug("Closing stdin of {} failed: {}", name, e.getMessage());
        }
        process.destroy();
    }

    @Override
    public String toString() { return name; }
}
