package com.ryuqq.relay.core.model;

import com.ryuqq.relay.core.fault.DescriptionException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 원격 호출 가능한 오퍼레이션 하나의 선언.
 *
 * <p>입력/출력 필드 이름은 순서를 가집니다. 클라이언트는 입력 순서대로 위치 인자를
 * 채우고 출력 순서대로 결과를 꺼냅니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>이름과 모든 필드 이름은 {@link Names} 규칙을 따라야 함</li>
 *   <li>input 또는 output 안에서 필드 이름 중복 불가</li>
 * </ul>
 *
 * <p>metadata는 인식하지 못한 기술 키를 읽기 전용으로 보존합니다.</p>
 *
 * @param name 오퍼레이션 이름
 * @param input 입력 필드 이름 (순서 유지)
 * @param output 출력 필드 이름 (순서 유지)
 * @param metadata 기술에서 보존한 자유 형식 키
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record OperationDescriptor(
    String name,
    List<String> input,
    List<String> output,
    Map<String, Object> metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws DescriptionException 이름이나 필드 목록이 유효하지 않은 경우
     */
    public OperationDescriptor {
        Names.validate(name);
        input = fields(name, "input", input);
        output = fields(name, "output", output);
        metadata = ApiDescription.freeze(metadata);
    }

    /**
     * 입력, 출력, 메타데이터가 없는 오퍼레이션 생성.
     *
     * @param name 오퍼레이션 이름
     * @return 디스크립터
     */
    public static OperationDescriptor named(String name) {
        return new OperationDescriptor(name, List.of(), List.of(), Map.of());
    }

    public static OperationDescriptor of(String name, List<String> input, List<String> output) {
        return new OperationDescriptor(name, input, output, Map.of());
    }

    private static List<String> fields(String operation, String kind, List<String> names) {
        if (names == null) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        for (String field : names) {
            Names.validate(field);
            if (!seen.add(field)) {
                throw new DescriptionException(
                    String.format("Duplicate %s field '%s' in operation '%s'", kind, field, operation));
            }
        }
        return List.copyOf(names);
    }
}
