package com.ryuqq.relay.core.spi;

/**
 * Raised by a {@link Transport} when no response could be obtained.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class TransportException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int status;

    public TransportException(String message, Throwable cause) {
        this(message, 503, cause);
    }

    /**
     * @param message reason phrase reported to callers
     * @param status status reported to callers in place of an HTTP status
     * @param cause underlying failure
     */
    public TransportException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
