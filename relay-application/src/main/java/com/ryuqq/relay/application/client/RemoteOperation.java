package com.ryuqq.relay.application.client;

import com.ryuqq.relay.core.fault.DescriptionException;
import com.ryuqq.relay.core.model.Container;
import com.ryuqq.relay.core.model.OperationDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 오퍼레이션 하나에 바인딩된 클라이언트 호출 객체.
 *
 * <p>위치 인자는 선언된 입력 순서대로 채우고, 결과는 선언된 출력 순서대로 꺼냅니다:</p>
 * <ul>
 *   <li>출력 없음 → {@code null}</li>
 *   <li>출력 1개 → 값 그대로</li>
 *   <li>출력 여러 개 → 선언 순서의 {@code List}</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class RemoteOperation {

    private final Client client;
    private final OperationDescriptor descriptor;

    RemoteOperation(Client client, OperationDescriptor descriptor) {
        this.client = client;
        this.descriptor = descriptor;
    }

    public String name() {
        return descriptor.name();
    }

    public OperationDescriptor descriptor() {
        return descriptor;
    }

    /**
     * 위치 인자로 오퍼레이션 호출.
     *
     * @param args 선언된 입력마다 값 하나 (순서대로)
     * @return 출력 순서로 꺼낸 결과
     * @throws DescriptionException 인자 개수가 맞지 않는 경우
     */
    public Object invoke(Object... args) {
        Object[] values = args == null ? new Object[0] : args;
        List<String> input = descriptor.input();
        if (values.length != input.size()) {
            throw new DescriptionException(
                "Operation '" + descriptor.name() + "' takes " + input.size()
                    + " argument(s) " + input + " but got " + values.length);
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            arguments.put(input.get(i), values[i]);
        }
        return project(client.call(descriptor.name(), arguments));
    }

    /**
     * 이름 있는 인자로 호출하고 응답 컨테이너를 그대로 반환.
     */
    public Container call(Map<String, ?> arguments) {
        return client.call(descriptor.name(), arguments);
    }

    Object project(Container response) {
        List<String> output = descriptor.output();
        for (String field : output) {
            if (!response.containsKey(field)) {
                throw new InvalidResponseException(
                    "Response for operation '" + descriptor.name() + "' is missing output '" + field + "'");
            }
        }
        if (output.isEmpty()) {
            return null;
        }
        if (output.size() == 1) {
            return response.get(output.get(0));
        }
        List<Object> values = new ArrayList<>(output.size());
        for (String field : output) {
            values.add(response.get(field));
        }
        return values;
    }
}
