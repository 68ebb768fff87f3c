package com.ryuqq.listener.testkit.contract;

import com.ryuqq.listener.core.handler.MessageHandler;
import com.ryuqq.listener.core.model.ProcessingMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Message handler whose failures are scripted per payload.
 *
 * <p>Every invocation is recorded, including failed ones. By default every payload succeeds.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedMessageHandler handler = new ScriptedMessageHandler()
 *     .failTimes("m2", 2)      // fails twice, then succeeds
 *     .alwaysFail("poison");   // never succeeds
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedMessageHandler implements MessageHandler {

    private static final int ALWAYS = -1;

    private final Map<String, Integer> remainingFailures = new ConcurrentHashMap<>();
    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();

    /**
     * Makes the given payload fail a fixed number of times before succeeding.
     *
     * @param payload the payload to fail
     * @param times number of failures (positive)
     * @return this handler
     */
    public ScriptedMessageHandler failTimes(String payload, int times) {
        if (times <= 0) {
            throw new IllegalArgumentException("times must be positive (current: " + times + ")");
        }
        remainingFailures.put(payload, times);
        return this;
    }

    /**
     * Makes the given payload fail on every attempt.
     *
     * @param payload the payload to fail
     * @return this handler
     */
    public ScriptedMessageHandler alwaysFail(String payload) {
        remainingFailures.put(payload, ALWAYS);
        return this;
    }

    @Override
    public void consume(String payload, ProcessingMetadata metadata) {
        Integer remaining = remainingFailures.get(payload);
        boolean fail = remaining != null && (remaining == ALWAYS || remaining > 0);
        invocations.add(new Invocation(payload, metadata.getPartition(), metadata.getOffset(), metadata.getRetryCount(), !fail));

        if (fail) {
            if (remaining != ALWAYS) {
                remainingFailures.put(payload, remaining - 1);
            }
            throw new IllegalStateException("scripted failure for " + payload);
        }
    }

    /**
     * Returns all invocations in call order.
     *
     * @return an immutable snapshot
     */
    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    /**
     * Returns the payloads that were consumed successfully, in call order.
     *
     * @return an immutable snapshot
     */
    public List<String> succeededPayloads() {
        List<String> payloads = new ArrayList<>();
        for (Invocation invocation : invocations) {
            if (invocation.succeeded()) {
                payloads.add(invocation.payload());
            }
        }
        return List.copyOf(payloads);
    }

    /**
     * One handler invocation.
     *
     * @param payload the message payload
     * @param partition the message partition
     * @param offset the message offset
     * @param retryCount retry count at invocation time
     * @param succeeded whether the invocation returned normally
     */
    public record Invocation(String payload, int partition, long offset, int retryCount, boolean succeeded) {
    }
}
