package com.ryuqq.relay.core.fault;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 핸들러와 플러그인이 던지는 예외의 기반 타입.
 *
 * <p>순서가 있는 위치 인자 목록을 가집니다. 화이트리스트에 있거나 서비스가 디버그 모드이면
 * {@link #faultName()}과 {@link #args()}가 그대로 전송되고, 클라이언트는 같은 이름과 인자로
 * 예외를 다시 만듭니다.</p>
 *
 * <pre>
 * public class NotFound extends ServiceException {
 *     public NotFound(String id) {
 *         super(id);
 *     }
 * }
 * </pre>
 *
 * <p>인자는 전송 가능한 값이어야 합니다 (문자열, 숫자, boolean, null 및 이들의 List/Map).</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ServiceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient List<Object> args;

    public ServiceException(Object... args) {
        this(null, args);
    }

    protected ServiceException(Throwable cause, Object... args) {
        this(cause, args == null ? List.of() : Arrays.asList(args));
    }

    protected ServiceException(Throwable cause, List<?> args) {
        super(describe(args), cause);
        this.args = args == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * 위치 인자 (순서 유지).
     *
     * @return 불변 List (null 포함 가능)
     */
    public List<Object> args() {
        return args;
    }

    /**
     * 전송 시 사용하는 예외 이름. 기본값은 단순 클래스 이름.
     *
     * @return 예외 이름
     */
    public String faultName() {
        return Faults.nameOf(getClass());
    }

    static String describe(List<?> args) {
        if (args == null || args.isEmpty()) {
            return null;
        }
        if (args.size() == 1) {
            return String.valueOf(args.get(0));
        }
        return args.toString();
    }
}
