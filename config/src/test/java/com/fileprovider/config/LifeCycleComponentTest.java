package com.fileprovider.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests ordering and rollback behaviour of {@link LifeCycleComponent}.
 */
class LifeCycleComponentTest {

    private List<String> events;
    private LifeCycleComponent lifecycle;

    // ---- test component type ----

    class RecordingComponent implements Component {
        private final String name;
        private final boolean failOnStart;
        private ComponentState state = ComponentState.UNINITIALIZED;

        RecordingComponent(String name, boolean failOnStart) {
            this.name = name;
            this.failOnStart = failOnStart;
        }

        @Override
        public void initialize() {
            events.add("init:" + name);
            state = ComponentState.INITIALIZED;
        }

        @Override
        public void start() throws Exception {
            events.add("start:" + name);
            if (failOnStart) {
                throw new Exception("boom: " + name);
            }
            state = ComponentState.ACTIVE;
        }

        @Override
        public void stop() {
            events.add("stop:" + name);
            state = ComponentState.STOPPED;
        }

        @Override public String getName() { return name; }
        @Override public ComponentState getState() { return state; }
    }

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        lifecycle = new LifeCycleComponent("test");
    }

    @Test
    void startsInOrderAndStopsInReverse() throws Exception {
        lifecycle.addComponent(new RecordingComponent("a", false))
                 .addComponent(new RecordingComponent("b", false));

        lifecycle.initialize();
        lifecycle.start();
        assertTrue(lifecycle.isActive());

        lifecycle.stop();

        assertEquals(List.of("init:a", "init:b", "start:a", "start:b", "stop:b", "stop:a"), events);
        assertEquals(ComponentState.STOPPED, lifecycle.getState());
    }

    @Test
    void failedStartStopsAlreadyStartedComponents() throws Exception {
        lifecycle.addComponent(new RecordingComponent("a", false))
                 .addComponent(new RecordingComponent("b", true))
                 .addComponent(new RecordingComponent("c", false));
        lifecycle.initialize();

        Exception ex = assertThrows(Exception.class, lifecycle::start);

        assertEquals("boom: b", ex.getMessage());
        assertEquals(List.of("init:a", "init:b", "init:c", "start:a", "start:b", "stop:b", "stop:a"), events);
        assertEquals(ComponentState.STOPPED, lifecycle.getState());
    }

    @Test
    void stopIsIdempotent() throws Exception {
        lifecycle.addComponent(new RecordingComponent("a", false));
        lifecycle.initialize();
        lifecycle.start();

        lifecycle.stop();
        lifecycle.stop();

        assertEquals(1, events.stream().filter(e -> e.startsWith("stop:")).count());
    }

    @Test
    void cannotAddAfterInitialization() throws Exception {
        lifecycle.initialize();

        assertThrows(IllegalStateException.class,
                () -> lifecycle.addComponent(new RecordingComponent("late", false)));
    }

    @Test
    void cannotStartBeforeInitialization() {
        assertThrows(IllegalStateException.class, lifecycle::start);
    }
}
