package io.crusher.runtime;

import java.io.IOException;

@FunctionalInterface
public interface WorkerChannelFactory {
    WorkerChannel create(int index) throws IOException;
}
