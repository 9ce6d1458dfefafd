package com.ryuqq.relay.application.service;

import com.ryuqq.relay.application.Descriptions;
import com.ryuqq.relay.application.TokenCodec;
import com.ryuqq.relay.core.fault.ServiceException;
import com.ryuqq.relay.core.model.ApiConfig;
import com.ryuqq.relay.core.plugin.OperationPlugin;
import com.ryuqq.relay.core.plugin.PluginRegistry;
import com.ryuqq.relay.core.plugin.RequestPlugin;
import com.ryuqq.relay.core.processor.AlreadyProcessedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * ServiceProcessor 유닛 테스트.
 *
 * <p>예외 경계와 스코프 훅 검증:</p>
 * <ul>
 *   <li>OPERATION 진입 시 요청 디코딩, 종료 시 응답 인코딩</li>
 *   <li>화이트리스트 밖 예외는 RequestException(500)으로 가리고 응답을 비움</li>
 *   <li>화이트리스트 또는 디버그 모드 예외는 이름과 인자 유지</li>
 *   <li>일회성 실행</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ServiceProcessorTest {

    static class NotFound extends ServiceException {
        NotFound(Object... args) {
            super(args);
        }
    }

    @Mock
    private OperationHandler unusedHandler;

    private TokenCodec codec;
    private PluginRegistry plugins;
    private ApiConfig api;

    @BeforeEach
    void setUp() {
        codec = new TokenCodec();
        plugins = new PluginRegistry();
        api = Descriptions.text();
    }

    private ServiceProcessor processor(ApiConfig config, OperationHandler handler, Map<String, Object> request) {
        return new ServiceProcessor(config, plugins, codec, handler, "upper", codec.serialize(request));
    }

    private static final OperationHandler UPPER = (request, response, context) ->
        response.set("result", request.get("text", String.class).toUpperCase());

    // ============================================================
    // 1. 정상 처리
    // ============================================================

    @Test
    void process_Handler_ReturnsEncodedResponse() {
        // when
        String body = processor(api, UPPER, Map.of("text", "hi")).process();

        // then
        assertThat(codec.deserialize(body)).containsExactlyEntriesOf(Map.of("result", "HI"));
    }

    @Test
    void process_RequestPlugin_SeesEncodedResponseAfterProceed() {
        // given
        List<String> seen = new ArrayList<>();
        plugins.register((RequestPlugin) context -> {
            seen.add(String.valueOf(context.responseBody()));
            context.proceed();
            seen.add(context.responseBody());
        });

        // when
        String body = processor(api, UPPER, Map.of("text", "hi")).process();

        // then
        assertThat(seen).containsExactly("null", body);
    }

    @Test
    void process_OperationPlugin_SeesDecodedRequest() {
        // given
        List<Object> seen = new ArrayList<>();
        plugins.register((OperationPlugin) (request, response, context) -> {
            seen.add(request.get("text"));
            context.proceed();
        });

        // when
        processor(api, UPPER, Map.of("text", "hi")).process();

        // then
        assertThat(seen).containsExactly("hi");
    }

    @Test
    void process_OperationPluginShortCircuits_HandlerNeverRuns() throws Exception {
        // given
        plugins.register((OperationPlugin) (request, response, context) -> response.set("result", "cached"));

        // when
        String body = processor(api, unusedHandler, Map.of("text", "hi")).process();

        // then
        verify(unusedHandler, never()).handle(any(), any(), any());
        assertThat(codec.deserialize(body)).containsExactlyEntriesOf(Map.of("result", "cached"));
    }

    @Test
    void process_RequestPluginShortCircuits_ReturnsEmptyResponse() throws Exception {
        // given
        plugins.register((RequestPlugin) context -> { });

        // when
        String body = processor(api, unusedHandler, Map.of("text", "hi")).process();

        // then
        verify(unusedHandler, never()).handle(any(), any(), any());
        assertThat(codec.deserialize(body)).isEmpty();
    }

    @Test
    void process_SecondCall_ThrowsAlreadyProcessed() {
        // given
        ServiceProcessor processor = processor(api, UPPER, Map.of("text", "hi"));
        processor.process();

        // when & then
        assertThatThrownBy(processor::process).isInstanceOf(AlreadyProcessedException.class);
    }

    // ============================================================
    // 2. 예외 경계
    // ============================================================

    @Test
    void process_HandlerRaisesAlreadyProcessed_IsRedactedNotRethrown() {
        // given
        OperationHandler nested = (request, response, context) -> {
            throw new AlreadyProcessedException("nested");
        };

        // when
        String body = processor(api, nested, Map.of("text", "hi")).process();

        // then
        assertThat(codec.deserialize(body)).isEqualTo(
            Map.of("__exception__", Map.of("cls", "RequestException", "args", List.of(500))));
    }

    @Test
    void process_SecondCallAfterFault_StillThrowsAlreadyProcessed() {
        // given
        ServiceProcessor processor = processor(api, (request, response, context) -> {
            throw new IllegalStateException("boom");
        }, Map.of("text", "hi"));
        processor.process();

        // when & then
        assertThatThrownBy(processor::process).isInstanceOf(AlreadyProcessedException.class);
    }


    @Test
    void process_NonWhitelistedFault_IsRedactedAndResponseCleared() {
        // given
        OperationHandler failing = (request, response, context) -> {
            response.set("result", "partial");
            throw new IllegalStateException("secret detail");
        };

        // when
        String body = processor(api, failing, Map.of("text", "hi")).process();

        // then
        assertThat(codec.deserialize(body)).isEqualTo(
            Map.of("__exception__", Map.of("cls", "RequestException", "args", List.of(500))));
    }

    @Test
    void process_WhitelistedFault_KeepsNameAndArgs() {
        // given
        OperationHandler failing = (request, response, context) -> {
            throw new NotFound("id-1", 2);
        };

        // when
        String body = processor(api, failing, Map.of("text", "hi")).process();

        // then
        assertThat(codec.deserialize(body)).isEqualTo(
            Map.of("__exception__", Map.of("cls", "NotFound", "args", List.of("id-1", 2))));
    }

    @Test
    void process_DebugMode_KeepsNonWhitelistedFault() {
        // given
        OperationHandler failing = (request, response, context) -> {
            throw new IllegalStateException("detail");
        };

        // when
        String body = processor(Descriptions.text(true), failing, Map.of("text", "hi")).process();

        // then
        assertThat(codec.deserialize(body)).isEqualTo(
            Map.of("__exception__", Map.of("cls", "IllegalStateException", "args", List.of("detail"))));
    }

    @Test
    void process_FaultInRequestPlugin_IsMarshalled() {
        // given
        plugins.register((RequestPlugin) context -> {
            throw new IllegalArgumentException("no token");
        });

        // when
        String body = processor(api, UPPER, Map.of("text", "hi")).process();

        // then
        assertThat(codec.deserialize(body)).isEqualTo(
            Map.of("__exception__", Map.of("cls", "IllegalArgumentException", "args", List.of("no token"))));
    }

    @Test
    void process_UndecodableRequest_IsRedacted() {
        // when
        String body = new ServiceProcessor(api, plugins, codec, UPPER, "upper", "#unknown").process();

        // then
        assertThat(codec.deserialize(body)).isEqualTo(
            Map.of("__exception__", Map.of("cls", "RequestException", "args", List.of(500))));
    }

    @Test
    void process_FaultAfterProceedInRequestPlugin_ReplacesEncodedResponse() {
        // given
        plugins.register((RequestPlugin) context -> {
            context.proceed();
            throw new NotFound("late");
        });

        // when
        String body = processor(api, UPPER, Map.of("text", "hi")).process();

        // then
        assertThat(codec.deserialize(body)).isEqualTo(
            Map.of("__exception__", Map.of("cls", "NotFound", "args", List.of("late"))));
    }
}
