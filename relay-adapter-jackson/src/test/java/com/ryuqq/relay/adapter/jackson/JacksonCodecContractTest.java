package com.ryuqq.relay.adapter.jackson;

import com.ryuqq.relay.core.spi.Codec;
import com.ryuqq.relay.testkit.contract.AbstractCodecContractTest;

/**
 * Runs the codec contract against {@link JacksonCodec}.
 */
class JacksonCodecContractTest extends AbstractCodecContractTest {

    @Override
    protected Codec createCodec() {
        return new JacksonCodec();
    }
}
