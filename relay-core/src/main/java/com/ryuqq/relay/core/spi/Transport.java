package com.ryuqq.relay.core.spi;

import java.net.URI;
import java.time.Duration;

/**
 * Client-side carrier: posts one request body and returns the raw response.
 *
 * <p>A transport does not interpret status codes; a 404 or 500 is returned as a
 * {@link TransportResponse}. Only failures to obtain any response (connection refused,
 * timeout, I/O error) are raised as {@link TransportException}.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface Transport {

    /**
     * Posts {@code body} to {@code uri}.
     *
     * @param uri target resolved from the endpoint pattern
     * @param body encoded request
     * @param timeout whole-call timeout
     * @return status and text of the response
     * @throws TransportException if no response could be obtained
     */
    TransportResponse post(URI uri, String body, Duration timeout) throws TransportException;
}
