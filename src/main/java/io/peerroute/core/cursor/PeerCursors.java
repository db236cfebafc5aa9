package io.peerroute.core.cursor;

import io.peerroute.core.model.PeerRecord;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/** Factories for simple cursors and helpers that drain a cursor asynchronously. */
@UtilityClass
public final class PeerCursors {

    public PeerCursor empty() {
        return of(List.of());
    }

    public PeerCursor of(final PeerRecord... records) {
        return of(List.of(records));
    }

    /** Cursor over a snapshot of {@code records}. */
    public PeerCursor of(final List<PeerRecord> records) {
        return new IteratorCursor(List.copyOf(records).iterator());
    }

    /** Cursor whose every pull fails with {@code cause}. Nothing runs until the first pull. */
    public PeerCursor failed(final Throwable cause) {
        return deferred(() -> {
            throw cause instanceof RuntimeException re ? re : new CompletionException(cause);
        });
    }

    /**
     * Cursor that calls {@code source} on the first pull and delegates to the cursor it returns.
     * A throwing supplier fails the first and every later pull.
     */
    public PeerCursor deferred(final Supplier<PeerCursor> source) {
        return new DeferredCursor(source);
    }

    /**
     * Drains {@code cursor}, handing each record to {@code action} on whichever thread produced it.
     * The cursor is closed once the returned future settles; cancelling the future therefore abandons
     * the query. If {@code action} throws, the future fails with that exception.
     */
    public CompletableFuture<Void> forEach(final PeerCursor cursor, final Consumer<PeerRecord> action) {
        final CompletableFuture<Void> done = new CompletableFuture<>();
        done.whenComplete((v, err) -> cursor.close());
        pump(cursor, action, done);
        return done;
    }

    public CompletableFuture<List<PeerRecord>> collect(final PeerCursor cursor) {
        final List<PeerRecord> out = new ArrayList<>();
        return forEach(cursor, record -> {
            synchronized (out) {
                out.add(record);
            }
        }).thenApply(v -> {
            synchronized (out) {
                return List.copyOf(out);
            }
        });
    }

    /** Strips the {@link CompletionException} / {@link ExecutionException} wrappers futures add. */
    public Throwable unwrap(final Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private void pump(final PeerCursor cursor,
                      final Consumer<PeerRecord> action,
                      final CompletableFuture<Void> done) {
        // loop while pulls complete synchronously so long in-memory sequences do not grow the stack
        while (!done.isDone()) {
            final CompletableFuture<Optional<PeerRecord>> step;
            try {
                step = cursor.next();
            } catch (final RuntimeException e) {
                done.completeExceptionally(e);
                return;
            }

            if (!step.isDone()) {
                step.whenComplete((record, err) -> {
                    if (accept(record, err, action, done)) {
                        pump(cursor, action, done);
                    }
                });
                return;
            }

            Optional<PeerRecord> record = null;
            Throwable err = null;
            try {
                record = step.join();
            } catch (final CompletionException | CancellationException e) {
                err = e;
            }
            if (!accept(record, err, action, done)) return;
        }
    }

    /* Returns true when the pump should pull again. */
    private boolean accept(final Optional<PeerRecord> record,
                           final Throwable err,
                           final Consumer<PeerRecord> action,
                           final CompletableFuture<Void> done) {
        if (err != null) {
            done.completeExceptionally(unwrap(err));
            return false;
        }
        if (record == null || record.isEmpty()) {
            done.complete(null);
            return false;
        }
        try {
            action.accept(record.get());
        } catch (final RuntimeException e) {
            done.completeExceptionally(e);
            return false;
        }
        return !done.isDone();
    }

    private static final class IteratorCursor implements PeerCursor {
        private final Iterator<PeerRecord> it;
        private boolean closed;

        private IteratorCursor(final Iterator<PeerRecord> it) {
            this.it = it;
        }

        @Override
        public synchronized CompletableFuture<Optional<PeerRecord>> next() {
            if (closed) return CompletableFuture.failedFuture(new CancellationException("Cursor closed"));
            return CompletableFuture.completedFuture(it.hasNext() ? Optional.of(it.next()) : Optional.empty());
        }

        @Override
        public synchronized void close() {
            closed = true;
        }
    }

    private static final class DeferredCursor implements PeerCursor {
        private final Supplier<PeerCursor> source;
        private PeerCursor delegate;
        private RuntimeException openFailure;
        private boolean closed;

        private DeferredCursor(final Supplier<PeerCursor> source) {
            this.source = source;
        }

        @Override
        public CompletableFuture<Optional<PeerRecord>> next() {
            final PeerCursor target;
            synchronized (this) {
                if (closed) return CompletableFuture.failedFuture(new CancellationException("Cursor closed"));
                if (openFailure != null) return CompletableFuture.failedFuture(openFailure);
                if (delegate == null) {
                    try {
                        delegate = source.get();
                    } catch (final RuntimeException e) {
                        openFailure = e;
                        return CompletableFuture.failedFuture(e);
                    }
                }
                target = delegate;
            }
            return target.next();
        }

        @Override
        public void close() {
            final PeerCursor target;
            synchronized (this) {
                if (closed) return;
                closed = true;
                target = delegate;
            }
            if (target != null) target.close();
        }
    }
}
