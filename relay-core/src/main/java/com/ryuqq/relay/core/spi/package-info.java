/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Adapters implement these interfaces to give the client and service a concrete
 * wire format and carrier.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.spi.Codec} - container ↔ text body</li>
 *   <li>{@link com.ryuqq.relay.core.spi.Transport} - client-side POST of one body</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li><strong>relay-adapter-jackson:</strong> JSON codec</li>
 *   <li><strong>relay-adapter-inmemory:</strong> loopback transport straight into a service</li>
 *   <li><strong>relay-adapter-http:</strong> OkHttp transport, servlet and embedded Jetty server</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.spi;
