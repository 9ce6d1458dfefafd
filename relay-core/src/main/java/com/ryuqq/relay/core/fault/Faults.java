package com.ryuqq.relay.core.fault;

import java.util.List;

/**
 * 임의의 Throwable을 와이어 예외 이름과 인자 목록으로 변환.
 *
 * <ul>
 *   <li>{@link ServiceException}: {@link ServiceException#faultName()}, {@link ServiceException#args()}</li>
 *   <li>그 외: 단순 클래스 이름과 {@code [message]} (메시지가 없으면 빈 목록)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class Faults {

    private Faults() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String nameOf(Throwable fault) {
        if (fault instanceof ServiceException serviceException) {
            return serviceException.faultName();
        }
        return nameOf(fault.getClass());
    }

    public static List<Object> argsOf(Throwable fault) {
        if (fault instanceof ServiceException serviceException) {
            return serviceException.args();
        }
        String message = fault.getMessage();
        return message == null ? List.of() : List.of(message);
    }

    // 익명/로컬 클래스는 단순 이름이 비어 있으므로 가장 가까운 이름 있는 상위 클래스 사용
    static String nameOf(Class<?> type) {
        Class<?> current = type;
        while (current.getSimpleName().isEmpty()) {
            current = current.getSuperclass();
        }
        return current.getSimpleName();
    }
}
