package com.ryuqq.relay.core.fault;

import java.util.List;

/**
 * 내장 Java 타입이 없는 예외를 클라이언트에서 재구성한 것.
 *
 * <p>예외의 정체성은 {@link FaultType} 핸들이며, 이를 만든 {@link ExceptionRegistry} 안에서
 * 항상 같은 인스턴스입니다:</p>
 * <pre>
 * try {
 *     client.invoke("lookup", "missing-id");
 * } catch (RemoteFault fault) {
 *     if (client.exceptions().get("NotFound").isInstance(fault)) {
 *         ...
 *     }
 * }
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RemoteFault extends ServiceException {

    private static final long serialVersionUID = 1L;

    private final transient FaultType type;

    RemoteFault(FaultType type, List<?> args) {
        super(null, args);
        this.type = type;
    }

    public FaultType type() {
        return type;
    }

    @Override
    public String faultName() {
        return type.name();
    }

    @Override
    public String toString() {
        String message = getMessage();
        return type.name() + (message == null ? "" : ": " + message);
    }
}
