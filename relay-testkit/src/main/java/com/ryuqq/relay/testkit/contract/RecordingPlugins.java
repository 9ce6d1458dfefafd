package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.application.service.OperationHandler;
import com.ryuqq.relay.core.plugin.OperationPlugin;
import com.ryuqq.relay.core.plugin.RequestPlugin;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Factory for plugins and handlers that append to a shared event log.
 *
 * <p><strong>Events:</strong></p>
 * <ul>
 *   <li>{@code <name>:before} / {@code <name>:after} around {@code proceed()}</li>
 *   <li>{@code <name>:stop} for a plugin that never proceeds</li>
 *   <li>{@code <name>:handler} when a wrapped handler runs</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RecordingPlugins {

    private final List<String> events = new CopyOnWriteArrayList<>();

    public RequestPlugin request(String name) {
        return context -> {
            record(name + ":before");
            context.proceed();
            record(name + ":after");
        };
    }

    public OperationPlugin operation(String name) {
        return (request, response, context) -> {
            record(name + ":before");
            context.proceed();
            record(name + ":after");
        };
    }

    public RequestPlugin stopRequest(String name) {
        return context -> record(name + ":stop");
    }

    public OperationPlugin stopOperation(String name) {
        return (request, response, context) -> record(name + ":stop");
    }

    public OperationHandler handler(String name, OperationHandler delegate) {
        return (request, response, context) -> {
            record(name + ":handler");
            delegate.handle(request, response, context);
        };
    }

    public void record(String event) {
        events.add(event);
    }

    public List<String> events() {
        return List.copyOf(events);
    }

    public void clear() {
        events.clear();
    }
}
