/**
 * Reusable contract suites and test doubles for adapter modules.
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.testkit.contract.AbstractCodecContractTest} - every Codec adapter</li>
 *   <li>{@link com.ryuqq.relay.testkit.contract.AbstractTransportContractTest} - every Transport adapter, end to end</li>
 *   <li>{@link com.ryuqq.relay.testkit.contract.ScriptedTransport} - canned transport responses</li>
 *   <li>{@link com.ryuqq.relay.testkit.contract.RecordingPlugins} - ordering assertions</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.testkit.contract;
