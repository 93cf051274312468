package io.crusher.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.crusher.core.Task;
import io.crusher.error.CrushException;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Line protocol between the pool and a process worker: one JSON document per line.
 *
 * <pre>
 * task:  {"id":..,"engines":"a, b","extension":"js","content":..,"gzip":true}
 * reply: {"error":null|{"type":..,"message":..},"task":{..,"gzip":123,"duration":4,"individual":{"a":1}}}
 * </pre>
 *
 * Error types do not survive the trip; a decoded error is a plain {@link CrushException} with the
 * original message.
 */
public final class TaskCodec {
    private final ObjectMapper mapper;

    public TaskCodec() {
        this(new ObjectMapper());
    }

    public TaskCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encodeTask(Task task) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", task.id());
        node.put("engines", task.enginesString());
        node.put("extension", task.extension());
        node.put("content", task.content());
        node.put("gzip", task.gzip());
        return mapper.writeValueAsString(node);
    }

    public Task decodeTask(String line) throws IOException {
        return readTask(mapper.readTree(line));
    }

    public String encodeReply(Reply reply) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        if (reply.error() == null) {
            node.putNull("error");
        } else {
            ObjectNode error = node.putObject("error");
            error.put("type", reply.error().getClass().getSimpleName());
            error.put("message", reply.error().getMessage());
        }
        Task task = reply.task();
        ObjectNode t = node.putObject("task");
        t.put("id", task.id());
        t.put("engines", task.enginesString());
        t.put("extension", task.extension());
        t.put("content", task.content());
        if (task.gzipSize() != null) t.put("gzip", task.gzipSize());
        else t.put("gzip", task.gzip());
        t.put("duration", task.duration());
        ObjectNode individual = t.putObject("individual");
        for (Map.Entry<String, Long> e : task.individual().entrySet()) individual.put(e.getKey(), e.getValue());
        return mapper.writeValueAsString(node);
    }

    public Reply decodeReply(String line) throws IOException {
        JsonNode node = mapper.readTree(line);
        JsonNode error = node.path("error");
        CrushException failure = error.isObject() ? new CrushException(error.path("message").asText()) : null;
        return new Reply(failure, readTask(node.path("task")));
    }

    private static Task readTask(JsonNode node) throws IOException {
        if (!node.isObject()) throw new IOException("Message carries no task: " + node);
        JsonNode gzip = node.path("gzip");
        Task task = new Task(
                node.hasNonNull("id") ? node.get("id").asText() : null,
                Task.parseEngines(node.path("engines").asText("")),
                node.hasNonNull("extension") ? node.get("extension").asText() : null,
                node.hasNonNull("content") ? node.get("content").asText() : null,
                gzip.isNumber() || gzip.asBoolean(false));
        if (gzip.isNumber()) task.gzipSize(gzip.asLong());
        task.duration(node.path("duration").asLong(0));
        Iterator<Map.Entry<String, JsonNode>> it = node.path("individual").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            task.recordIndividual(e.getKey(), e.getValue().asLong());
        }
        return task;
    }
}
