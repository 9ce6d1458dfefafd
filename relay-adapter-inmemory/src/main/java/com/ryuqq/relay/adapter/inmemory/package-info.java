/**
 * In-memory transport adapter.
 *
 * <p>{@link com.ryuqq.relay.adapter.inmemory.LoopbackTransport} hands each client POST
 * straight to {@link com.ryuqq.relay.application.service.Service#dispatch(String, String)}
 * in the same JVM. The codec still runs on both sides, so the wire text is exactly
 * what an HTTP deployment would carry.</p>
 *
 * <h2>Message Flow</h2>
 *
 * <pre>
 * Client.invoke("upper", "hi")
 *   └─► ClientProcessor.execute()
 *         └─► LoopbackTransport.post(uri, body, timeout)
 *               └─► Service.dispatch(uri.getPath(), body)
 *                     └─► ServiceProcessor.process() ─► encoded response
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>No timeout:</strong> the call runs on the caller's thread to completion</li>
 *   <li><strong>Single JVM:</strong> intended for tests and embedded use</li>
 * </ul>
 *
 * @see com.ryuqq.relay.core.spi.Transport
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory;
