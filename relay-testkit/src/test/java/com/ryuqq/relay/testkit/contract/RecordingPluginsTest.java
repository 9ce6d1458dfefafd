package com.ryuqq.relay.testkit.contract;

import com.ryuqq.relay.core.model.Container;
import com.ryuqq.relay.core.plugin.PluginRegistry;
import com.ryuqq.relay.core.processor.Processor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecordingPlugins tests, driven through a bare {@link Processor}.
 */
class RecordingPluginsTest {

    private final RecordingPlugins recorder = new RecordingPlugins();

    private Processor<Container> processor(PluginRegistry plugins) {
        return new Processor<>(plugins, "upper") {
            @Override
            protected void execute() throws Exception {
                recorder.handler("upper", (request, response, context) -> response.set("result", "HI"))
                    .handle(request(), response(), context());
            }

            @Override
            protected Container result() {
                return response();
            }
        };
    }

    @Test
    void testNestedPluginsRecordOnionOrder() throws Exception {
        // Given
        PluginRegistry plugins = new PluginRegistry();
        plugins.register(recorder.request("R1"));
        plugins.register(recorder.operation("O1"));
        plugins.register(recorder.operation("O2"));

        // When
        Container response = processor(plugins).process();

        // Then
        assertEquals(
            List.of("R1:before", "O1:before", "O2:before", "upper:handler", "O2:after", "O1:after", "R1:after"),
            recorder.events());
        assertEquals("HI", response.get("result"));
    }

    @Test
    void testStoppingPluginSkipsHandler() throws Exception {
        // Given
        PluginRegistry plugins = new PluginRegistry();
        plugins.register(recorder.request("R1"));
        plugins.register(recorder.stopOperation("O1"));

        // When
        Container response = processor(plugins).process();

        // Then
        assertEquals(List.of("R1:before", "O1:stop", "R1:after"), recorder.events());
        assertTrue(response.isEmpty());
    }

    @Test
    void testStoppingRequestPluginSkipsOperationScope() throws Exception {
        // Given
        PluginRegistry plugins = new PluginRegistry();
        plugins.register(recorder.stopRequest("R1"));
        plugins.register(recorder.operation("O1"));

        // When
        processor(plugins).process();

        // Then
        assertEquals(List.of("R1:stop"), recorder.events());
    }

    @Test
    void testEventsAreSnapshotsAndClearResets() {
        // Given
        recorder.record("one");
        List<String> snapshot = recorder.events();

        // When
        recorder.record("two");
        recorder.clear();

        // Then
        assertEquals(List.of("one"), snapshot);
        assertTrue(recorder.events().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("three"));
    }
}
