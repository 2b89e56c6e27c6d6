package dev.tmcp.client.transport;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

final class ClientExecutors {

    private ClientExecutors() {
    }

    static ExecutorService daemonPool(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
