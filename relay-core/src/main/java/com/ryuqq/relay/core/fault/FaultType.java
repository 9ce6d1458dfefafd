package com.ryuqq.relay.core.fault;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * {@link ExceptionRegistry}에서 이름으로 조회하는 예외 종류 핸들.
 *
 * <p>내장 핸들은 실제 Java 예외 (예: {@code IllegalArgumentException})를 만들고,
 * 그 외 핸들은 자기 자신에 묶인 {@link RemoteFault}를 만듭니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class FaultType {

    private final String name;
    private final Class<? extends RuntimeException> exceptionClass;
    private final Function<List<Object>, ? extends RuntimeException> factory;

    private FaultType(String name,
                      Class<? extends RuntimeException> exceptionClass,
                      Function<List<Object>, ? extends RuntimeException> factory) {
        this.name = name;
        this.exceptionClass = exceptionClass;
        this.factory = factory;
    }

    static <X extends RuntimeException> FaultType builtin(String name,
                                                          Class<X> exceptionClass,
                                                          Function<List<Object>, X> factory) {
        return new FaultType(name, exceptionClass, factory);
    }

    static FaultType remote(String name) {
        return new FaultType(name, RemoteFault.class, null);
    }

    public String name() {
        return name;
    }

    /**
     * 이 핸들이 만드는 인스턴스의 Java 타입.
     */
    public Class<? extends RuntimeException> exceptionClass() {
        return exceptionClass;
    }

    public boolean isBuiltin() {
        return factory != null;
    }

    /**
     * {@code args}를 담은 예외 인스턴스 생성.
     *
     * @param args 위치 인자
     * @return 새 예외 (이 메서드가 던지지는 않음)
     */
    public RuntimeException newInstance(List<?> args) {
        List<Object> values = args == null ? List.of() : List.copyOf(nullSafe(args));
        if (factory != null) {
            return factory.apply(values);
        }
        return new RemoteFault(this, args == null ? List.of() : args);
    }

    public RuntimeException newInstance(Object... args) {
        return newInstance(args == null ? List.of() : Arrays.asList(args));
    }

    /**
     * {@code fault}가 이 종류로 만들어졌는지 여부.
     *
     * @param fault 검사할 예외
     * @return 일치하면 true
     */
    public boolean isInstance(Throwable fault) {
        if (fault == null) {
            return false;
        }
        if (factory != null) {
            return exceptionClass.isInstance(fault);
        }
        return fault instanceof RemoteFault remote && remote.type() == this;
    }

    // List.copyOf는 null을 거부함. 내장 팩토리는 문자열 형태만 필요
    private static List<Object> nullSafe(List<?> args) {
        return args.stream().map(arg -> arg == null ? (Object) "null" : arg).toList();
    }

    @Override
    public String toString() {
        return "FaultType{" + name + (isBuiltin() ? ", builtin" : "") + '}';
    }
}
