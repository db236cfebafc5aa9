package io.peerroute.routing.delegate;

import lombok.Getter;

import java.io.IOException;

/**
 * The delegate answered with an error status, an error event, or a body that could not be read.
 */
@Getter
public final class DelegateResponseException extends IOException {

    /** HTTP status, or {@code -1} when the failure is not tied to one. */
    private final int status;

    public DelegateResponseException(final int status, final String message) {
        super(message);
        this.status = status;
    }

    public DelegateResponseException(final String message, final Throwable cause) {
        super(message, cause);
        this.status = -1;
    }
}
