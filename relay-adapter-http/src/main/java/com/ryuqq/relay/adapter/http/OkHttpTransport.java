package com.ryuqq.relay.adapter.http;

import com.ryuqq.relay.core.spi.Transport;
import com.ryuqq.relay.core.spi.TransportException;
import com.ryuqq.relay.core.spi.TransportResponse;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link Transport} over OkHttp.
 *
 * <p>Each POST runs with a call timeout equal to the API timeout. Statuses are
 * returned as they are; only I/O failures raise {@link TransportException}:</p>
 * <ul>
 *   <li>timeout → status 504</li>
 *   <li>any other I/O failure → status 503</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class OkHttpTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(OkHttpTransport.class);

    private static final int UNAVAILABLE = 503;
    private static final int GATEWAY_TIMEOUT = 504;

    private final OkHttpClient client;
    private final MediaType mediaType;

    public OkHttpTransport() {
        this(new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .build());
    }

    public OkHttpTransport(OkHttpClient client) {
        this(client, "application/json; charset=utf-8");
    }

    public OkHttpTransport(OkHttpClient client, String contentType) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
        this.mediaType = MediaType.get(contentType);
    }

    @Override
    public TransportResponse post(URI uri, String body, Duration timeout) throws TransportException {
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
        OkHttpClient call = timeout == null ? client : client.newBuilder().callTimeout(timeout).build();
        Request request = new Request.Builder()
            .url(uri.toString())
            .post(RequestBody.create(body == null ? "" : body, mediaType))
            .build();

        try (Response response = call.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            return new TransportResponse(response.code(), text, response.message());
        } catch (InterruptedIOException e) {
            log.debug("POST {} timed out after {}", uri, timeout);
            throw new TransportException(TransportResponse.reasonPhrase(GATEWAY_TIMEOUT), GATEWAY_TIMEOUT, e);
        } catch (IOException e) {
            log.debug("POST {} failed: {}", uri, e.toString());
            throw new TransportException(TransportResponse.reasonPhrase(UNAVAILABLE), UNAVAILABLE, e);
        }
    }

    public OkHttpClient client() {
        return client;
    }
}
