package com.ryuqq.relay.core.plugin;

import com.ryuqq.relay.core.statemachine.ProcessorScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 클라이언트/서비스별 플러그인 체인 (스코프별로 분리).
 *
 * <p><strong>생명주기:</strong></p>
 * <ul>
 *   <li>열려 있는 동안은 추가만 가능: {@link #register(Plugin)}는 등록 순서를 유지</li>
 *   <li>{@link #freeze()}는 불변 스냅샷을 만들며, 첫 Processor 생성 시 호출됨</li>
 *   <li>고정 이후 {@link #register(Plugin)}는 아무것도 추가하지 않고 실패</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> 등록과 고정은 synchronized로 처리합니다. 고정 이후
 * 조회는 락 없이 불변 스냅샷을 읽으므로 동시 호출 모두 같은 체인을 봅니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class PluginRegistry {

    private final Map<ProcessorScope, List<Plugin>> pending = new EnumMap<>(ProcessorScope.class);
    private volatile Map<ProcessorScope, List<Plugin>> snapshot;

    public PluginRegistry() {
        pending.put(ProcessorScope.REQUEST, new ArrayList<>());
        pending.put(ProcessorScope.OPERATION, new ArrayList<>());
    }

    /**
     * 플러그인을 해당 스코프 체인 끝에 추가.
     *
     * @param plugin 추가할 플러그인
     * @param <P> 플러그인 타입
     * @return 같은 플러그인
     * @throws IllegalArgumentException plugin이 null이거나 플러그인을 받지 않는 스코프인 경우
     * @throws IllegalStateException 이미 고정된 경우
     */
    public synchronized <P extends Plugin> P register(P plugin) {
        if (plugin == null) {
            throw new IllegalArgumentException("plugin cannot be null");
        }
        if (snapshot != null) {
            throw new IllegalStateException(
                "Plugin registry is frozen: plugins must be registered before the first call");
        }
        ProcessorScope scope = plugin.scope();
        if (scope == null || !scope.hasPlugins()) {
            throw new IllegalArgumentException("Plugins can only be registered in REQUEST or OPERATION scope: " + scope);
        }
        pending.get(scope).add(plugin);
        return plugin;
    }

    /**
     * 레지스트리 고정 (멱등).
     *
     * @return 이번 호출로 고정했으면 true, 이미 고정돼 있었으면 false
     */
    public synchronized boolean freeze() {
        if (snapshot != null) {
            return false;
        }
        Map<ProcessorScope, List<Plugin>> frozen = new EnumMap<>(ProcessorScope.class);
        pending.forEach((scope, plugins) -> frozen.put(scope, List.copyOf(plugins)));
        snapshot = Collections.unmodifiableMap(frozen);
        return true;
    }

    public boolean isFrozen() {
        return snapshot != null;
    }

    /**
     * 스코프에 등록된 플러그인 (등록 순서).
     *
     * @param scope REQUEST 또는 OPERATION (그 외 스코프는 항상 빈 목록)
     * @return 불변 List
     */
    public List<Plugin> plugins(ProcessorScope scope) {
        if (scope == null || !scope.hasPlugins()) {
            return List.of();
        }
        Map<ProcessorScope, List<Plugin>> frozen = snapshot;
        if (frozen != null) {
            return frozen.get(scope);
        }
        synchronized (this) {
            return List.copyOf(pending.get(scope));
        }
    }

    public int size(ProcessorScope scope) {
        return plugins(scope).size();
    }
}
