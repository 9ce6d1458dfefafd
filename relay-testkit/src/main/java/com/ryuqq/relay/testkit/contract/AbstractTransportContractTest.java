package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.application.client.Client;
import com.ryuqq.relay.application.service.Service;
import com.ryuqq.relay.core.fault.RemoteFault;
import com.ryuqq.relay.core.fault.RequestException;
import com.ryuqq.relay.core.model.ApiDescription;
import com.ryuqq.relay.core.model.Container;
import com.ryuqq.relay.core.plugin.OperationPlugin;
import com.ryuqq.relay.core.plugin.RequestPlugin;
import com.ryuqq.relay.core.spi.Codec;
import com.ryuqq.relay.core.statemachine.ProcessorScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end contract every {@link com.ryuqq.relay.core.spi.Transport} adapter must satisfy.
 *
 * <p>A service is built from {@link #serviceDescription()} with four bound operations;
 * subclasses connect a client to it through their transport.</p>
 *
 * <p><strong>Operations:</strong></p>
 * <ul>
 *   <li>{@code upper(text) -> result}</li>
 *   <li>{@code divmod(a, b) -> quotient, remainder}</li>
 *   <li>{@code ping() -> }</li>
 *   <li>{@code fail(kind) -> } raises a fault chosen by {@code kind}</li>
 * </ul>
 *
 * <p>The client description also declares {@code missing}, which the service does not
 * know.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class LoopbackTransportContractTest extends AbstractTransportContractTest {
 *     {@literal @}Override
 *     protected Codec createCodec() {
 *         return new JacksonCodec();
 *     }
 *
 *     {@literal @}Override
 *     protected Client connect(Service service, Map&lt;String, Object&gt; clientDescription) {
 *         return new Client(ApiDescription.fromDescription(clientDescription),
 *             new LoopbackTransport(service), service.codec());
 *     }
 * }
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public abstract class AbstractTransportContractTest {

    protected Service service;
    protected Client client;
    protected RecordingPlugins recorder;

    protected abstract Codec createCodec();

    /**
     * Connects a client to {@code service}.
     *
     * @param service started service
     * @param clientDescription description the client must be built from; adapters may
     *                          adjust its endpoint (e.g. to an ephemeral port)
     * @return connected client
     */
    protected abstract Client connect(Service service, Map<String, Object> clientDescription) throws Exception;

    /**
     * Releases whatever {@link #connect} acquired.
     */
    protected void disconnect() throws Exception {
    }

    @BeforeEach
    void setUpTransport() throws Exception {
        recorder = new RecordingPlugins();
        service = new Service(ApiDescription.fromDescription(serviceDescription()), createCodec());
        service.operation("upper", recorder.handler("upper", (request, response, context) ->
            response.set("result", request.get("text", String.class).toUpperCase())));
        service.operation("divmod", (request, response, context) -> {
            int a = ((Number) request.get("a")).intValue();
            int b = ((Number) request.get("b")).intValue();
            response.set("quotient", a / b);
            response.set("remainder", a % b);
        });
        service.operation("ping", (request, response, context) -> recorder.record("ping:handler"));
        service.operation("fail", (request, response, context) -> {
            response.set("partial", "must not leak");
            String kind = request.get("kind", String.class);
            switch (kind) {
                case "notFound" -> throw service.exceptions().get("NotFound").newInstance("id-1");
                case "argument" -> throw new IllegalArgumentException("bad input");
                default -> throw new IllegalStateException("database password is hunter2");
            }
        });
        client = connect(service, clientDescription());
    }

    @AfterEach
    void tearDownTransport() throws Exception {
        disconnect();
    }

    /**
     * Description the service is built from. Every call returns a fresh copy.
     */
    protected static Map<String, Object> serviceDescription() {
        Map<String, Object> endpoint = new LinkedHashMap<>();
        endpoint.put("scheme", "http");
        endpoint.put("host", "localhost");
        endpoint.put("port", 0);
        endpoint.put("pattern", "/api/{version}/{operation}");

        List<Object> operations = new ArrayList<>();
        operations.add(operation("upper", List.of("text"), List.of("result")));
        operations.add(operation("divmod", List.of("a", "b"), List.of("quotient", "remainder")));
        operations.add("ping");
        operations.add(operation("fail", List.of("kind"), List.of()));

        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", "contract");
        description.put("version", "1");
        description.put("endpoint", endpoint);
        description.put("exceptions", new ArrayList<>(List.of("NotFound", "IllegalArgumentException")));
        description.put("operations", operations);
        return description;
    }

    /**
     * Service description plus the {@code missing} operation.
     */
    @SuppressWarnings("unchecked")
    protected static Map<String, Object> clientDescription() {
        Map<String, Object> description = serviceDescription();
        ((List<Object>) description.get("operations")).add("missing");
        return description;
    }

    private static Map<String, Object> operation(String name, List<String> input, List<String> output) {
        Map<String, Object> operation = new LinkedHashMap<>();
        operation.put("name", name);
        operation.put("input", new ArrayList<>(input));
        operation.put("output", new ArrayList<>(output));
        return operation;
    }

    @Test
    void invoke_SingleOutput_ReturnsBareValue() {
        assertEquals("HI", client.invoke("upper", "hi"));
    }

    @Test
    void invoke_MultipleOutputs_ReturnsValuesInDeclaredOrder() {
        // when
        Object result = client.invoke("divmod", 17, 5);

        // then
        List<?> values = assertInstanceOf(List.class, result);
        assertEquals(2, values.size());
        assertEquals(3, ((Number) values.get(0)).intValue());
        assertEquals(2, ((Number) values.get(1)).intValue());
    }

    @Test
    void invoke_NoOutputs_ReturnsNull() {
        assertNull(client.invoke("ping"));
        assertEquals(List.of("ping:handler"), recorder.events());
    }

    @Test
    void call_ReturnsResponseContainer() {
        // when
        Container response = client.call("upper", Map.of("text", "abc"));

        // then
        assertEquals("ABC", response.get("result"));
        assertEquals(1, response.size());
    }

    @Test
    void nonWhitelistedFault_ArrivesRedacted() {
        // when
        RequestException fault = assertThrows(RequestException.class, () -> client.invoke("fail", "secret"));

        // then
        assertEquals(1, fault.args().size());
        assertEquals(500, ((Number) fault.args().get(0)).intValue());
        assertFalse(String.valueOf(fault.getMessage()).contains("hunter2"));
    }

    @Test
    void whitelistedFault_ArrivesWithNameAndArgs() {
        // when
        RemoteFault fault = assertThrows(RemoteFault.class, () -> client.invoke("fail", "notFound"));

        // then
        assertEquals("NotFound", fault.faultName());
        assertEquals(List.of("id-1"), fault.args());
        assertTrue(client.exceptions().get("NotFound").isInstance(fault));
    }

    @Test
    void whitelistedBuiltinFault_ArrivesAsJdkType() {
        IllegalArgumentException fault =
            assertThrows(IllegalArgumentException.class, () -> client.invoke("fail", "argument"));
        assertEquals("bad input", fault.getMessage());
    }

    @Test
    void unknownOperation_RaisesNotFoundRequestException() {
        RequestException fault = assertThrows(RequestException.class, () -> client.invoke("missing"));
        assertEquals("404 Not Found", fault.getMessage());
    }

    @Test
    void requestPlugins_WrapInRegistrationOrder() {
        // given
        service.plugin(recorder.request("P1"));
        service.plugin(recorder.request("P2"));

        // when
        client.invoke("upper", "hi");

        // then
        assertEquals(List.of("P1:before", "P2:before", "upper:handler", "P2:after", "P1:after"),
            recorder.events());
    }

    @Test
    void operationPlugin_ShortCircuitsEmptyText() {
        // given
        OperationPlugin rejectEmpty = (request, response, context) -> {
            if ("".equals(request.get("text"))) {
                throw new IllegalArgumentException("text is empty");
            }
            context.proceed();
        };
        service.plugin(rejectEmpty);

        // when
        IllegalArgumentException fault =
            assertThrows(IllegalArgumentException.class, () -> client.invoke("upper", ""));

        // then
        assertEquals("text is empty", fault.getMessage());
        assertFalse(recorder.events().contains("upper:handler"));
        assertEquals("HI", client.invoke("upper", "hi"));
    }

    @Test
    void pluginRegistration_AfterFirstCall_Fails() {
        // given
        client.invoke("upper", "hi");
        RequestPlugin late = recorder.request("late");

        // when / then
        assertThrows(IllegalStateException.class, () -> service.plugin(late));
        assertEquals(0, service.plugins().size(ProcessorScope.REQUEST));
    }

    @Test
    void clientPlugin_SeesDecodedResponse() {
        // given
        OperationPlugin observe = (request, response, context) -> {
            context.proceed();
            recorder.record("client:" + response.get("result"));
        };
        client.plugin(observe);

        // when
        client.invoke("upper", "hi");

        // then
        assertTrue(recorder.events().contains("client:HI"));
    }
}
