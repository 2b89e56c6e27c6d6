package dev.tmcp.transport;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Zero-capacity hand-off channel between a transport and its consumer. {@link #send(Object)} returns
 * only once a receiver has taken the element, so a slow consumer pushes back all the way to the wire.
 * After {@link #close()} every pending and future operation fails with {@link ChannelClosedException}.
 * @param <T> element type
 */
public final class RendezvousChannel<T> implements AutoCloseable {

    private final String name;

    private final ReentrantLock lock = new ReentrantLock();

    private final Condition changed = this.lock.newCondition();

    private T item;

    private long offered;

    private long taken;

    private boolean closed;

    public RendezvousChannel(String name) {
        this.name = name;
    }

    public String name() {
        return this.name;
    }

    /**
     * Hand an element to a receiver, blocking until one takes it.
     * @param element element to deliver, never {@code null}
     * @throws ChannelClosedException when the channel is closed before the element is taken
     * @throws InterruptedException when the calling thread is interrupted while waiting
     */
    public void send(T element) throws InterruptedException {
        if (element == null) {
            throw new IllegalArgumentException("element");
        }
        this.lock.lockInterruptibly();
        try {
            while (this.offered != this.taken && !this.closed) {
                this.changed.await();
            }
            if (this.closed) {
                throw new ChannelClosedException(this.name);
            }
            this.item = element;
            long ticket = ++this.offered;
            this.changed.signalAll();
            boolean delivered = false;
            try {
                while (this.taken < ticket && !this.closed) {
                    this.changed.await();
                }
                delivered = this.taken >= ticket;
            }
            finally {
                if (!delivered) {
                    withdraw(ticket);
                }
            }
            if (!delivered) {
                throw new ChannelClosedException(this.name);
            }
        }
        finally {
            this.lock.unlock();
        }
    }

    private void withdraw(long ticket) {
        if (this.taken < ticket) {
            this.item = null;
            this.offered = this.taken;
            this.changed.signalAll();
        }
    }

    /**
     * Take the next element, blocking until a sender offers one.
     * @return the element
     * @throws ChannelClosedException when the channel is closed
     * @throws InterruptedException when the calling thread is interrupted while waiting
     */
    public T receive() throws InterruptedException {
        this.lock.lockInterruptibly();
        try {
            while (this.offered == this.taken && !this.closed) {
                this.changed.await();
            }
            return takeLocked();
        }
        finally {
            this.lock.unlock();
        }
    }

    /**
     * Take the next element, waiting at most {@code timeout}.
     * @param timeout maximum time to wait
     * @return the element, or {@code null} when none was offered in time
     * @throws ChannelClosedException when the channel is closed
     * @throws InterruptedException when the calling thread is interrupted while waiting
     */
    public T poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        this.lock.lockInterruptibly();
        try {
            while (this.offered == this.taken && !this.closed) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = this.changed.awaitNanos(remaining);
            }
            return takeLocked();
        }
        finally {
            this.lock.unlock();
        }
    }

    private T takeLocked() {
        if (this.closed) {
            throw new ChannelClosedException(this.name);
        }
        T element = this.item;
        this.item = null;
        this.taken = this.offered;
        this.changed.signalAll();
        return element;
    }

    public boolean isClosed() {
        this.lock.lock();
        try {
            return this.closed;
        }
        finally {
            this.lock.unlock();
        }
    }

    @Override
    public void close() {
        this.lock.lock();
        try {
            this.closed = true;
            this.changed.signalAll();
        }
        finally {
            this.lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "RendezvousChannel[" + this.name + "]";
    }
}
