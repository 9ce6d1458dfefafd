package com.ryuqq.relay.adapter.http;

import com.ryuqq.relay.application.service.Service;
import com.ryuqq.relay.application.service.ServiceResponse;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * POST {@code <endpoint pattern>}
 *
 * <p>Bridges HTTP requests into {@link Service#dispatch(String, String)}.</p>
 *
 * <p><strong>Responses:</strong></p>
 * <ul>
 *   <li>200: encoded response, or an {@code __exception__} body for application faults</li>
 *   <li>404: path matches no bound operation (empty body)</li>
 *   <li>405: any method other than POST</li>
 *   <li>413: body larger than {@link #MAX_BODY_BYTES}</li>
 *   <li>500: the service failed outside the fault boundary</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RelayServlet extends HttpServlet {

    private static final long serialVersionUID = 1L;

    private static final Logger log = LoggerFactory.getLogger(RelayServlet.class);

    public static final int MAX_BODY_BYTES = 102_400;

    private final transient Service service;
    private final int maxBodyBytes;

    public RelayServlet(Service service) {
        this(service, MAX_BODY_BYTES);
    }

    public RelayServlet(Service service, int maxBodyBytes) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("maxBodyBytes must be positive (current: " + maxBodyBytes + ")");
        }
        this.service = service;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        if (req.getContentLengthLong() > maxBodyBytes) {
            resp.setStatus(HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE);
            return;
        }
        byte[] bytes;
        try (InputStream in = req.getInputStream()) {
            bytes = in.readNBytes(maxBodyBytes + 1);
        }
        // Chunked bodies carry no Content-Length.
        if (bytes.length > maxBodyBytes) {
            resp.setStatus(HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE);
            return;
        }

        String path = req.getRequestURI().substring(req.getContextPath().length());
        ServiceResponse response;
        try {
            response = service.dispatch(path, new String(bytes, StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            log.error("Failed to dispatch POST {}", path, e);
            resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            return;
        }

        resp.setStatus(response.status());
        if (response.body().isEmpty()) {
            return;
        }
        byte[] out = response.body().getBytes(StandardCharsets.UTF_8);
        resp.setContentType(service.codec().contentType());
        resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
        resp.setContentLength(out.length);
        resp.getOutputStream().write(out);
    }

    public int maxBodyBytes() {
        return maxBodyBytes;
    }
}
