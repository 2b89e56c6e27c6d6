package dev.tmcp.transport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cancellation scope shared by the reader and writer tasks of one connection. The first task to finish
 * closes the scope; closing cancels the remaining task and releases every registered resource in
 * reverse registration order. Closing is idempotent.
 */
public final class ConnectionScope implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionScope.class);

    private final String name;

    private final ExecutorService executor;

    private final List<Future<?>> tasks = new ArrayList<>();

    private final Deque<AutoCloseable> resources = new ArrayDeque<>();

    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    private boolean closed;

    public ConnectionScope(String name, ExecutorService executor) {
        this.name = name;
        this.executor = executor;
    }

    public String name() {
        return this.name;
    }

    /**
     * Start a task bound to this scope. When the task returns or fails the scope is closed.
     * @param taskName label used in log output
     * @param task body of the task
     */
    public void launch(String taskName, Task task) {
        synchronized (this) {
            if (this.closed) {
                throw new ChannelClosedException(this.name);
            }
            try {
                this.tasks.add(this.executor.submit(() -> run(taskName, task)));
            }
            catch (RejectedExecutionException ex) {
                logger.warn("Executor rejected task {} of {}", taskName, this.name);
                throw ex;
            }
        }
    }

    private void run(String taskName, Task task) {
        logger.debug("Task {} of {} started", taskName, this.name);
        try {
            task.run();
        }
        catch (ChannelClosedException ex) {
            logger.debug("Task {} of {} stopped: {}", taskName, this.name, ex.getMessage());
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.debug("Task {} of {} interrupted", taskName, this.name);
        }
        catch (Exception ex) {
            if (!isClosed()) {
                logger.error("Task {} of {} failed", taskName, this.name, ex);
            }
        }
        finally {
            close();
        }
    }

    /**
     * Register a resource released when the scope closes. A resource registered after the scope has
     * already closed is released immediately.
     */
    public void onClose(AutoCloseable resource) {
        synchronized (this) {
            if (!this.closed) {
                this.resources.push(resource);
                return;
            }
        }
        release(resource);
    }

    public synchronized boolean isClosed() {
        return this.closed;
    }

    /**
     * Completes once the scope has been closed and its resources released.
     */
    public CompletableFuture<Void> closeFuture() {
        return this.closeFuture;
    }

    @Override
    public void close() {
        List<Future<?>> running;
        List<AutoCloseable> toRelease;
        synchronized (this) {
            if (this.closed) {
                return;
            }
            this.closed = true;
            running = new ArrayList<>(this.tasks);
            toRelease = new ArrayList<>(this.resources);
            this.tasks.clear();
            this.resources.clear();
        }
        logger.debug("Closing scope {}", this.name);
        for (AutoCloseable resource : toRelease) {
            release(resource);
        }
        for (Future<?> task : running) {
            task.cancel(true);
        }
        this.closeFuture.complete(null);
    }

    private void release(AutoCloseable resource) {
        try {
            resource.close();
        }
        catch (Exception ex) {
            logger.warn("Failed to release resource of {}", this.name, ex);
        }
    }

    /**
     * Body of a scoped task.
     */
    @FunctionalInterface
    public interface Task {

        void run() throws Exception;

    }

}
