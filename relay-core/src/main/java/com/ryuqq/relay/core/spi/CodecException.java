package com.ryuqq.relay.core.spi;

/**
 * Raised by a {@link Codec} when a body cannot be encoded or decoded.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class CodecException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
