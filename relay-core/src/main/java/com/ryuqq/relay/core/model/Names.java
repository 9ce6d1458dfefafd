package com.ryuqq.relay.core.model;

import com.ryuqq.relay.core.fault.DescriptionException;

import java.util.regex.Pattern;

/**
 * 오퍼레이션, 필드, 예외 이름이 공유하는 식별자 규칙.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>첫 글자는 영문자 (숫자나 밑줄로 시작 불가)</li>
 *   <li>나머지는 영문자, 숫자, 밑줄만 허용</li>
 * </ul>
 *
 * <p>밑줄로 시작하는 이름은 {@code __exception__} 같은 예약 키를 위해 비워둡니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class Names {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Za-z]\\w*$");

    private Names() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 식별자 규칙을 만족하는지 확인.
     *
     * @param name 검사할 이름
     * @return 유효한 식별자이면 true
     */
    public static boolean isValid(String name) {
        return name != null && VALID_PATTERN.matcher(name).matches();
    }

    /**
     * 이름 검증.
     *
     * @param name 검사할 이름
     * @return 같은 이름 (체이닝용)
     * @throws DescriptionException null이거나 유효한 식별자가 아닌 경우
     */
    public static String validate(String name) {
        if (!isValid(name)) {
            throw new DescriptionException("Invalid name: '" + name + "'");
        }
        return name;
    }
}
