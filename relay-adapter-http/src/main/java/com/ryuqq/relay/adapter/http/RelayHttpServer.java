package com.ryuqq.relay.adapter.http;

import com.ryuqq.relay.application.service.Service;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Jetty 12 server hosting one {@link Service} behind a {@link RelayServlet}.
 *
 * <p>Host and port default to the service's endpoint; port 0 binds an ephemeral port,
 * readable through {@link #getPort()} once started. Threads are daemon threads.</p>
 *
 * <pre>
 * try (RelayHttpServer server = new RelayHttpServer(service, "localhost", 0)) {
 *     server.start();
 *     int port = server.getPort();
 *     ...
 * }
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RelayHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelayHttpServer.class);

    private static final int DEFAULT_PORT = 8080;
    private static final long STOP_TIMEOUT_MS = 2_000L;

    private final Service service;
    private final String host;
    private final int port;
    private final Object lifecycleLock = new Object();
    private Server server;
    private ServerConnector connector;

    public RelayHttpServer(Service service) {
        this(service,
            service == null ? null : service.api().endpoint().host(),
            service == null || service.api().endpoint().port() == null
                ? DEFAULT_PORT
                : service.api().endpoint().port());
    }

    public RelayHttpServer(Service service, String host, int port) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.service = service;
        this.host = host;
        this.port = port;
    }

    /**
     * Starts serving. Does nothing when already started.
     *
     * @throws IllegalStateException if a declared operation has no handler
     * @throws Exception if Jetty fails to start
     */
    public void start() throws Exception {
        synchronized (lifecycleLock) {
            if (server != null && server.isStarted()) {
                return;
            }
            service.checkHandlers();

            QueuedThreadPool threadPool = new QueuedThreadPool();
            threadPool.setDaemon(true);
            threadPool.setName("relay-http");

            Server jetty = new Server(threadPool);
            ServerConnector http = new ServerConnector(jetty);
            if (host != null && !host.isBlank()) {
                http.setHost(host);
            }
            http.setPort(port);
            jetty.addConnector(http);

            ServletContextHandler context = new ServletContextHandler();
            context.setContextPath("/");
            context.addServlet(new ServletHolder(new RelayServlet(service)), "/*");
            jetty.setHandler(context);
            jetty.setStopTimeout(STOP_TIMEOUT_MS);

            jetty.start();
            server = jetty;
            connector = http;
            log.info("Relay service '{}' listening on port {}", service.api().name(), getPort());
        }
    }

    /**
     * Stops serving. Stop failures are logged, not rethrown.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (server == null) {
                return;
            }
            Server jetty = server;
            server = null;
            connector = null;
            try {
                jetty.stop();
                log.info("Relay service '{}' stopped", service.api().name());
            } catch (Exception e) {
                log.warn("Error stopping relay service '{}'", service.api().name(), e);
            }
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return server != null && server.isRunning();
        }
    }

    /**
     * Bound port once started, otherwise the configured one.
     */
    public int getPort() {
        synchronized (lifecycleLock) {
            if (server != null && server.isStarted()) {
                return connector.getLocalPort();
            }
            return port;
        }
    }

    public Service service() {
        return service;
    }

    @Override
    public void close() {
        stop();
    }
}
