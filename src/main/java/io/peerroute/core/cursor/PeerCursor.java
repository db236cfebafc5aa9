package io.peerroute.core.cursor;

import io.peerroute.core.model.PeerRecord;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Lazy, single-pass, pull-based sequence of {@link PeerRecord}s.
 * <p>
 * Nothing is produced until the first {@link #next()}. Only one pull may be outstanding at a time;
 * a second {@code next()} before the previous one settles fails with {@link IllegalStateException}.
 */
public interface PeerCursor extends AutoCloseable {

    /**
     * Pulls the next record.
     *
     * @return a future completing with the next record, with {@link Optional#empty()} once the
     *         sequence is exhausted, or exceptionally if the query failed
     */
    CompletableFuture<Optional<PeerRecord>> next();

    /**
     * Abandons the sequence and signals cancellation to whatever is producing it.
     * An outstanding pull fails with {@link java.util.concurrent.CancellationException}. Idempotent.
     */
    @Override
    void close();
}
