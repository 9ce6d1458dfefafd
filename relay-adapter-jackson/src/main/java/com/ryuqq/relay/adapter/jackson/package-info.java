/**
 * Jackson-backed JSON codec and description loader.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.jackson;
