package com.ryuqq.listener.testkit.contract;

import com.ryuqq.listener.core.instrumentation.Instrumentation;
import com.ryuqq.listener.core.instrumentation.InstrumentationScope;
import com.ryuqq.listener.core.instrumentation.ListenerEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Instrumentation sink that keeps every recorded event in memory.
 *
 * <p>Events are stored in the order their scopes were opened. Each entry keeps a snapshot
 * of the metadata it was opened with and whether the scope failed.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingInstrumentation implements Instrumentation {

    private final List<RecordedEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public InstrumentationScope begin(ListenerEvent event, Map<String, Object> metadata) {
        RecordedEvent recorded = new RecordedEvent(event, metadata == null ? Map.of() : snapshot(metadata));
        events.add(recorded);
        return recorded;
    }

    /**
     * Returns all recorded events in begin order.
     *
     * @return an immutable snapshot
     */
    public List<RecordedEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns the recorded events of one type in begin order.
     *
     * @param event the event type
     * @return an immutable snapshot
     */
    public List<RecordedEvent> events(ListenerEvent event) {
        List<RecordedEvent> matching = new ArrayList<>();
        for (RecordedEvent recorded : events) {
            if (recorded.event() == event) {
                matching.add(recorded);
            }
        }
        return List.copyOf(matching);
    }

    /**
     * Counts the recorded events of one type.
     *
     * @param event the event type
     * @return number of matching events
     */
    public int count(ListenerEvent event) {
        return events(event).size();
    }

    /**
     * Clears all recorded events.
     */
    public void clear() {
        events.clear();
    }

    // insertion order kept; values may be null (exception_message)
    private static Map<String, Object> snapshot(Map<String, Object> metadata) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * One recorded instrumentation scope.
     */
    public static final class RecordedEvent implements InstrumentationScope {

        private final ListenerEvent event;
        private final Map<String, Object> metadata;
        private volatile Throwable failure;
        private volatile boolean closed;

        RecordedEvent(ListenerEvent event, Map<String, Object> metadata) {
            this.event = event;
            this.metadata = metadata;
        }

        @Override
        public void fail(Throwable error) {
            this.failure = error;
        }

        @Override
        public void close() {
            this.closed = true;
        }

        public ListenerEvent event() {
            return event;
        }

        public Map<String, Object> metadata() {
            return metadata;
        }

        public Throwable failure() {
            return failure;
        }

        public boolean failed() {
            return failure != null;
        }

        public boolean closed() {
            return closed;
        }

        /**
         * Returns the metadata value for a key.
         *
         * @param key the metadata key
         * @return the value, or null if absent
         */
        public Object get(String key) {
            return metadata.get(key);
        }

        @Override
        public String toString() {
            return event + (failed() ? "(failed)" : "(ok)") + metadata;
        }
    }
}
