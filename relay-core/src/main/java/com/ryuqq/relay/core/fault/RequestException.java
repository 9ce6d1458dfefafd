package com.ryuqq.relay.core.fault;

import java.util.List;

/**
 * 프레임워크 범용 예외.
 *
 * <p><strong>사용처:</strong></p>
 * <ul>
 *   <li>가리기: 화이트리스트에 없는 예외는 {@code RequestException(500)}으로 전송</li>
 *   <li>전송 계층: 2xx가 아닌 상태나 I/O 실패는 클라이언트에서
 *       {@code RequestException("<status> <reason>")}으로 표면화</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RequestException extends ServiceException {

    private static final long serialVersionUID = 1L;

    public static final String NAME = "RequestException";
    public static final int INTERNAL_ERROR = 500;

    public RequestException(Object... args) {
        super(args);
    }

    public RequestException(Throwable cause, Object... args) {
        super(cause, args);
    }

    RequestException(List<?> args) {
        super(null, args);
    }

    @Override
    public String faultName() {
        return NAME;
    }
}
