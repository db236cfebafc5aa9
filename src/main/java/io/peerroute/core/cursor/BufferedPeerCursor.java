package io.peerroute.core.cursor;

import io.peerroute.core.model.PeerRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Cursor fed by a producer running elsewhere (a network channel, a scheduler task).
 * <p>
 * The producer pushes with {@link #offer}, {@link #end()} and {@link #fail}; the consumer pulls with
 * {@link #next()}. Records pushed before a failure are still delivered before it. {@code onDemand}
 * runs whenever a pull finds the buffer empty, which lets the producer read more only when asked;
 * {@code onClose} runs once when the consumer abandons the cursor.
 */
public final class BufferedPeerCursor implements PeerCursor {

    private final Runnable onDemand;
    private final Runnable onClose;

    private final Deque<PeerRecord> buffer = new ArrayDeque<>();
    private CompletableFuture<Optional<PeerRecord>> pending;
    private boolean ended;
    private Throwable failure;
    private boolean closed;

    public BufferedPeerCursor(final Runnable onDemand, final Runnable onClose) {
        this.onDemand = onDemand;
        this.onClose = onClose;
    }

    @Override
    public CompletableFuture<Optional<PeerRecord>> next() {
        final CompletableFuture<Optional<PeerRecord>> waiter;
        synchronized (this) {
            if (closed) return CompletableFuture.failedFuture(new CancellationException("Cursor closed"));
            if (pending != null) {
                return CompletableFuture.failedFuture(new IllegalStateException("A pull is already outstanding"));
            }
            if (!buffer.isEmpty()) return CompletableFuture.completedFuture(Optional.of(buffer.poll()));
            if (failure != null) return CompletableFuture.failedFuture(failure);
            if (ended) return CompletableFuture.completedFuture(Optional.empty());

            waiter = new CompletableFuture<>();
            pending = waiter;
        }
        onDemand.run();
        return waiter;
    }

    /** @return false if the cursor no longer accepts records */
    public boolean offer(final PeerRecord record) {
        final CompletableFuture<Optional<PeerRecord>> waiter;
        synchronized (this) {
            if (closed || ended || failure != null) return false;
            waiter = pending;
            pending = null;
            if (waiter == null) {
                buffer.add(record);
                return true;
            }
        }
        waiter.complete(Optional.of(record));
        return true;
    }

    public void end() {
        final CompletableFuture<Optional<PeerRecord>> waiter;
        synchronized (this) {
            if (closed || ended || failure != null) return;
            ended = true;
            waiter = pending;
            pending = null;
        }
        if (waiter != null) waiter.complete(Optional.empty());
    }

    public void fail(final Throwable cause) {
        final CompletableFuture<Optional<PeerRecord>> waiter;
        synchronized (this) {
            if (closed || ended || failure != null) return;
            failure = cause;
            waiter = pending;
            pending = null;
        }
        if (waiter != null) waiter.completeExceptionally(cause);
    }

    /** True while a consumer is waiting on an empty buffer. */
    public synchronized boolean isDemanding() {
        return pending != null;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        final CompletableFuture<Optional<PeerRecord>> waiter;
        synchronized (this) {
            if (closed) return;
            closed = true;
            buffer.clear();
            waiter = pending;
            pending = null;
        }
        if (waiter != null) waiter.completeExceptionally(new CancellationException("Cursor closed"));
        onClose.run();
    }
}
