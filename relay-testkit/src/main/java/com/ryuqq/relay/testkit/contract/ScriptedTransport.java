package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.spi.Transport;
import com.ryuqq.relay.core.spi.TransportException;
import com.ryuqq.relay.core.spi.TransportResponse;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link Transport} that replays a scripted sequence of responses and failures.
 *
 * <p>Every POST is recorded; use {@link #requests()} to assert on what the client
 * sent.</p>
 *
 * <pre>
 * ScriptedTransport transport = new ScriptedTransport()
 *     .respond(200, "{\"result\":\"HI\"}")
 *     .respond(500, "");
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ScriptedTransport implements Transport {

    /**
     * One recorded POST.
     */
    public record Request(URI uri, String body, Duration timeout) {
    }

    private final Queue<Object> script = new ConcurrentLinkedQueue<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();

    public ScriptedTransport respond(int status, String text) {
        return respond(new TransportResponse(status, text, null));
    }

    public ScriptedTransport respond(TransportResponse response) {
        script.add(response);
        return this;
    }

    public ScriptedTransport fail(TransportException failure) {
        script.add(failure);
        return this;
    }

    @Override
    public TransportResponse post(URI uri, String body, Duration timeout) throws TransportException {
        requests.add(new Request(uri, body, timeout));
        Object next = script.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted response left for POST " + uri);
        }
        if (next instanceof TransportException failure) {
            throw failure;
        }
        return (TransportResponse) next;
    }

    public List<Request> requests() {
        return new ArrayList<>(requests);
    }

    /**
     * @return the most recent POST
     * @throws IllegalStateException if nothing has been posted
     */
    public Request lastRequest() {
        if (requests.isEmpty()) {
            throw new IllegalStateException("No request recorded");
        }
        return requests.get(requests.size() - 1);
    }

    public int remaining() {
        return script.size();
    }
}
