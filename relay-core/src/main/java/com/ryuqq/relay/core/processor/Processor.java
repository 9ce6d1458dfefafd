package com.ryuqq.relay.core.processor;

import com.ryuqq.relay.core.model.Container;
import com.ryuqq.relay.core.plugin.OperationPlugin;
import com.ryuqq.relay.core.plugin.Plugin;
import com.ryuqq.relay.core.plugin.PluginRegistry;
import com.ryuqq.relay.core.plugin.RequestPlugin;
import com.ryuqq.relay.core.statemachine.ProcessorScope;
import com.ryuqq.relay.core.statemachine.ScopeTransition;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 호출 하나를 플러그인 체인에 통과시키는 일회용 상태 머신.
 *
 * <p><strong>디스패치 흐름:</strong></p>
 * <pre>
 * process()
 *   step()                         enterScope(REQUEST)
 *     request plugin 0 ─ proceed()
 *       request plugin 1 ─ proceed()
 *         (체인 소진)              REQUEST → OPERATION, enterScope(OPERATION)
 *           operation 플러그인 ...
 *             (체인 소진)          OPERATION → FUNCTION, enterScope(FUNCTION)
 *               execute()          FUNCTION → DONE, exitScope(FUNCTION)
 *           exitScope(OPERATION)
 *       (request 플러그인의 proceed 이후 작업, 마지막 등록부터)
 *   exitScope(REQUEST)
 * </pre>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>현재 스코프 안의 디스패치 단계를 인덱스 하나로 셈</li>
 *   <li>인덱스가 스코프의 플러그인 수에 도달하면 다음 스코프로 전진하고 인덱스를 초기화</li>
 *   <li>FUNCTION에서는 {@link #execute()}를 정확히 한 번 실행</li>
 * </ul>
 *
 * <p>{@link #enterScope}는 스코프에 처음 들어갈 때 한 번, {@link #exitScope}는 위임한 하위 스코프까지
 * 포함해 정상 반환된 뒤 한 번 호출됩니다. 플러그인이 중간에 끊어 도달하지 못한 스코프는 둘 다 건너뜁니다.</p>
 *
 * <p><strong>스레드 안전하지 않음.</strong> 호출당 Processor 하나이며, 두 번째
 * {@link #process()}는 {@link AlreadyProcessedException}으로 실패합니다.</p>
 *
 * @param <R> 처리 후 노출하는 결과 타입
 * @author Relay Team
 * @since 1.0.0
 */
public abstract class Processor<R> {

    private final PluginRegistry plugins;
    private final String operation;
    private final Context context;
    private final Container request = new Container();
    private final Container response = new Container();
    private final Deque<Invocation> invocations = new ArrayDeque<>();

    private String requestBody;
    private String responseBody;

    private ProcessorScope scope = ProcessorScope.REQUEST;
    private int index = -1;
    private boolean processed;
    private boolean dispatching;

    /**
     * Processor 생성 (읽어갈 플러그인 레지스트리를 고정).
     *
     * @param plugins 플러그인 체인
     * @param operation 오퍼레이션 이름
     */
    protected Processor(PluginRegistry plugins, String operation) {
        if (plugins == null) {
            throw new IllegalArgumentException("plugins cannot be null");
        }
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation cannot be null or blank");
        }
        plugins.freeze();
        this.plugins = plugins;
        this.operation = operation;
        this.context = new Context(operation, this);
    }

    /**
     * 파이프라인 실행 후 결과 반환.
     *
     * @return Processor별 결과
     * @throws AlreadyProcessedException 두 번째 호출인 경우
     * @throws Exception 플러그인이나 최종 동작에서 발생한 예외
     */
    public R process() throws Exception {
        if (processed) {
            throw new AlreadyProcessedException("Already processed request for operation '" + operation + "'");
        }
        processed = true;
        dispatching = true;
        try {
            step();
        } finally {
            dispatching = false;
        }
        return result();
    }

    /**
     * {@link Context#proceed()}가 사용하는 계속 진입점.
     */
    final void proceed() throws Exception {
        if (!dispatching) {
            throw new IllegalStateException(
                "proceed() called outside of an active dispatch for operation '" + operation + "'");
        }
        if (scope == ProcessorScope.FUNCTION) {
            // 핸들러 안에서 호출됨. 더 진행할 단계가 없음
            return;
        }
        Invocation caller = invocations.peek();
        if (caller == null) {
            throw new IllegalStateException("proceed() may only be called by a plugin");
        }
        if (caller.continued) {
            throw new IllegalStateException(
                "proceed() called more than once by the same plugin in scope " + scope);
        }
        caller.continued = true;
        step();
    }

    private void step() throws Exception {
        ProcessorScope entered = null;
        if (index == -1) {
            entered = scope;
            enterScope(entered);
        }

        if (scope == ProcessorScope.FUNCTION) {
            execute();
            scope = ScopeTransition.advanceTo(scope, ProcessorScope.DONE);
        } else {
            advance();
        }

        if (entered != null) {
            exitScope(entered);
        }
    }

    private void advance() throws Exception {
        index++;
        List<Plugin> chain = plugins.plugins(scope);
        if (index < chain.size()) {
            invoke(chain.get(index));
        } else {
            scope = ScopeTransition.advance(scope);
            index = -1;
            step();
        }
    }

    private void invoke(Plugin plugin) throws Exception {
        invocations.push(new Invocation());
        try {
            if (plugin instanceof RequestPlugin requestPlugin) {
                requestPlugin.handle(context);
            } else {
                ((OperationPlugin) plugin).handle(request, response, context);
            }
        } finally {
            invocations.pop();
        }
    }

    /**
     * 최종 동작. FUNCTION 스코프에서 정확히 한 번 실행.
     */
    protected abstract void execute() throws Exception;

    /**
     * {@link #process()}가 반환할 값.
     */
    protected abstract R result();

    /**
     * {@code scope}에 처음 들어갈 때 호출되는 훅.
     */
    protected void enterScope(ProcessorScope scope) throws Exception {
    }

    /**
     * {@code scope}의 하위 흐름이 모두 끝난 뒤 한 번 호출되는 훅.
     */
    protected void exitScope(ProcessorScope scope) throws Exception {
    }

    public String operation() {
        return operation;
    }

    public ProcessorScope scope() {
        return scope;
    }

    public boolean isProcessed() {
        return processed;
    }

    public Context context() {
        return context;
    }

    public Container request() {
        return request;
    }

    public Container response() {
        return response;
    }

    public String requestBody() {
        return requestBody;
    }

    protected void requestBody(String requestBody) {
        this.requestBody = requestBody;
    }

    public String responseBody() {
        return responseBody;
    }

    protected void responseBody(String responseBody) {
        this.responseBody = responseBody;
    }

    // 실행 중인 플러그인당 프레임 하나. proceed 여부 기록
    private static final class Invocation {
        private boolean continued;
    }
}
