/**
 * HTTP adapter: embedded Jetty server and OkHttp client transport.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.adapter.http.RelayServlet} - POST bridge into a service</li>
 *   <li>{@link com.ryuqq.relay.adapter.http.RelayHttpServer} - Jetty lifecycle</li>
 *   <li>{@link com.ryuqq.relay.adapter.http.OkHttpTransport} - client side</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.adapter.http;
