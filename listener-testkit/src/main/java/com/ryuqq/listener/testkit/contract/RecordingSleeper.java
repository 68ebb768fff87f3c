package com.ryuqq.listener.testkit.contract;

import com.ryuqq.listener.adapter.runner.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested intervals without waiting.
 *
 * <p>An action can be attached to the n-th sleep (1-based); it runs on the processing thread
 * while that sleep is in progress.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> intervals = new CopyOnWriteArrayList<>();
    private final Map<Integer, Runnable> actions = new ConcurrentHashMap<>();

    @Override
    public void sleep(Duration interval) {
        intervals.add(interval);
        Runnable action = actions.remove(intervals.size());
        if (action != null) {
            action.run();
        }
    }

    /**
     * Registers an action for the n-th sleep.
     *
     * @param call 1-based sleep number
     * @param action action to run during that sleep
     * @return this sleeper
     */
    public RecordingSleeper onSleep(int call, Runnable action) {
        if (call <= 0) {
            throw new IllegalArgumentException("call must be positive (current: " + call + ")");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        actions.put(call, action);
        return this;
    }

    /**
     * Returns the requested intervals in call order.
     *
     * @return an immutable snapshot
     */
    public List<Duration> intervals() {
        return List.copyOf(intervals);
    }
}
