package com.ryuqq.relay.application.client;

import com.ryuqq.relay.core.fault.DescriptionException;
import com.ryuqq.relay.core.fault.ExceptionRegistry;
import com.ryuqq.relay.core.model.ApiConfig;
import com.ryuqq.relay.core.model.ApiDescription;
import com.ryuqq.relay.core.model.Container;
import com.ryuqq.relay.core.model.OperationDescriptor;
import com.ryuqq.relay.core.plugin.Plugin;
import com.ryuqq.relay.core.plugin.PluginRegistry;
import com.ryuqq.relay.core.spi.Codec;
import com.ryuqq.relay.core.spi.Transport;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * API 하나에 대한 클라이언트 스텁.
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * Client client = new Client(api, new OkHttpTransport(), new JacksonCodec());
 * Object result = client.invoke("upper", "hi");          // "HI"
 * Container raw = client.call("upper", Map.of("text", "hi"));
 * </pre>
 *
 * <p>서비스가 보낸 예외는 {@link #exceptions()}로 다시 만들어집니다. 내장 이름은 JDK 타입으로,
 * 그 외 이름은 {@link com.ryuqq.relay.core.fault.RemoteFault}로 복원됩니다.</p>
 *
 * <p>플러그인 등록이 끝나면 스레드 안전합니다. 첫 호출이 플러그인 레지스트리를 고정합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class Client {

    private final ApiConfig api;
    private final Transport transport;
    private final Codec codec;
    private final PluginRegistry plugins = new PluginRegistry();
    private final ExceptionRegistry exceptions = new ExceptionRegistry();
    private final Map<String, RemoteOperation> operations = new ConcurrentHashMap<>();

    /**
     * @throws DescriptionException 엔드포인트에 scheme, host, port, pattern 중 하나라도 없는 경우
     */
    public Client(ApiConfig api, Transport transport, Codec codec) {
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        api.clientFormat();
        this.api = api;
        this.transport = transport;
        this.codec = codec;
    }

    public static Client fromDescription(Map<String, ?> description, Transport transport, Codec codec) {
        return new Client(ApiDescription.fromDescription(description), transport, codec);
    }

    /**
     * 이름 있는 인자로 {@code operation} 호출.
     *
     * @param operation 오퍼레이션 이름
     * @param arguments 필드 이름별 입력 값
     * @return 응답 컨테이너 (가공 전)
     * @throws DescriptionException 선언되지 않은 오퍼레이션인 경우
     * @throws ClientException 플러그인이 checked 예외를 던진 경우
     */
    public Container call(String operation, Map<String, ?> arguments) {
        api.operation(operation);
        ClientProcessor processor =
            new ClientProcessor(api, plugins, exceptions, transport, codec, operation, arguments);
        try {
            return processor.process();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ClientException("Plugin failed during call to '" + operation + "'", e);
        }
    }

    /**
     * 위치 인자로 {@code operation} 호출 ({@link RemoteOperation#invoke(Object...)} 참고).
     */
    public Object invoke(String operation, Object... args) {
        return operation(operation).invoke(args);
    }

    /**
     * 오퍼레이션에 바인딩된 호출 객체 (이름당 한 번 생성).
     *
     * @throws DescriptionException 선언되지 않은 오퍼레이션인 경우
     */
    public RemoteOperation operation(String name) {
        OperationDescriptor descriptor = api.operation(name);
        return operations.computeIfAbsent(name, key -> new RemoteOperation(this, descriptor));
    }

    public <P extends Plugin> P plugin(P plugin) {
        return plugins.register(plugin);
    }

    public PluginRegistry plugins() {
        return plugins;
    }

    public ExceptionRegistry exceptions() {
        return exceptions;
    }

    public ApiConfig api() {
        return api;
    }
}
