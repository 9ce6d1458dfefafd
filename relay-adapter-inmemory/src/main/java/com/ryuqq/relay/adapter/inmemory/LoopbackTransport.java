package com.ryuqq.relay.adapter.inmemory;

import com.ryuqq.relay.application.service.Service;
import com.ryuqq.relay.application.service.ServiceResponse;
import com.ryuqq.relay.core.spi.Transport;
import com.ryuqq.relay.core.spi.TransportException;
import com.ryuqq.relay.core.spi.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link Transport} that hands every POST straight to a {@link Service}.
 *
 * <p>The request path is routed with {@link Service#dispatch(String, String)}, so a
 * client and a service sharing one description talk to each other exactly as they
 * would over HTTP: unknown paths answer 404 and application faults arrive as
 * {@code __exception__} bodies with status 200.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Service service = new Service(api, codec);
 * service.operation("upper", handler);
 *
 * Client client = new Client(api, new LoopbackTransport(service), codec);
 * client.invoke("upper", "hi");   // "HI"
 * </pre>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>The call runs on the caller's thread; the timeout is not enforced</li>
 *   <li>Scheme, host and port of the URI are ignored</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class LoopbackTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(LoopbackTransport.class);

    private static final int INTERNAL_ERROR = 500;

    private final Service service;
    private final AtomicLong requests = new AtomicLong();

    public LoopbackTransport(Service service) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        this.service = service;
    }

    @Override
    public TransportResponse post(URI uri, String body, Duration timeout) throws TransportException {
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
        requests.incrementAndGet();
        ServiceResponse response;
        try {
            response = service.dispatch(uri.getPath(), body);
        } catch (RuntimeException e) {
            log.warn("Loopback dispatch to {} failed", uri, e);
            throw new TransportException(TransportResponse.reasonPhrase(INTERNAL_ERROR), INTERNAL_ERROR, e);
        }
        return new TransportResponse(response.status(), response.body(), null);
    }

    /**
     * Number of POSTs handled so far.
     */
    public long requestCount() {
        return requests.get();
    }

    public Service service() {
        return service;
    }
}
