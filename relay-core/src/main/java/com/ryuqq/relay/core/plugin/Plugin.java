package com.ryuqq.relay.core.plugin;

import com.ryuqq.relay.core.statemachine.ProcessorScope;

/**
 * 하나의 스코프에 속하는 미들웨어 단위.
 *
 * <p><strong>계속(continuation) 계약:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.processor.Context#proceed()} 호출 시 이후 플러그인, 이후 스코프,
 *       최종 동작까지 모두 실행한 뒤 호출자로 돌아옴</li>
 *   <li>{@code proceed()} 이전 코드는 들어가는 길에, 이후 코드는 나오는 길에 실행</li>
 *   <li>{@code proceed()}를 호출하지 않으면 파이프라인은 그 지점에서 종료</li>
 * </ul>
 *
 * <pre>
 * service.plugin((RequestPlugin) context -&gt; {
 *     long start = System.nanoTime();
 *     context.proceed();
 *     log.info("{} took {}ns", context.operation(), System.nanoTime() - start);
 * });
 * </pre>
 *
 * <p>같은 호출 안에서 {@code proceed()}를 두 번 이상 부르면 {@link IllegalStateException}이 발생합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public sealed interface Plugin permits RequestPlugin, OperationPlugin {

    /**
     * 이 플러그인이 속하는 체인의 스코프.
     *
     * @return REQUEST 또는 OPERATION
     */
    ProcessorScope scope();
}
