package com.ryuqq.listener.testkit.contract;

import com.ryuqq.listener.adapter.inmemory.log.InMemoryLogClientFactory;
import com.ryuqq.listener.adapter.runner.PartitionListener;
import com.ryuqq.listener.core.instrumentation.ListenerEvent;
import com.ryuqq.listener.core.statemachine.ListenerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: stop ends retrying cooperatively and releases the client exactly once.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Always-failing handler, stop from another thread during the second backoff → ABORTED</li>
 *   <li>Stop while retrying → rest of the batch and later batches are not processed</li>
 *   <li>Stop after termination → no error, no second close</li>
 *   <li>Stop before start → start does nothing</li>
 *   <li>Stop while following an idle log → STOPPED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ShutdownContractTest extends AbstractContractTest {

    @Test
    void testAlwaysFailing_StopDuringSecondBackoff_Aborted() {
        // Given
        publish("poison");
        PartitionListener listener = createListener(new ScriptedMessageHandler().alwaysFail("poison"));
        sleeper.onSleep(2, () -> stopFromAnotherThread(listener));

        // When
        listener.start();

        // Then
        assertEquals(2, instrumentation.count(ListenerEvent.RETRY_HANDLER_ERROR));
        assertEquals(1, instrumentation.count(ListenerEvent.RETRY_ABORTED));
        assertTrue(instrumentation.events(ListenerEvent.PROCESS_MESSAGE).stream().allMatch(RecordingInstrumentation.RecordedEvent::failed),
                "No success event should be recorded");

        List<RecordingInstrumentation.RecordedEvent> timeline = instrumentation.events();
        RecordingInstrumentation.RecordedEvent aborted = instrumentation.events(ListenerEvent.RETRY_ABORTED).get(0);
        assertTrue(timeline.indexOf(aborted) > timeline.indexOf(instrumentation.events(ListenerEvent.RETRY_HANDLER_ERROR).get(1)),
                "Abort should be recorded after the second error");
        assertEquals(0L, aborted.get("offset"));

        assertListenerState(listener, ListenerState.ABORTED);
        assertCommitted(0, 0);
        assertClientsClosedOnce();
    }

    @Test
    void testStopWhileRetrying_HaltsBatchAndLaterBatches() {
        // Given
        publishTo(0, "m1", "poison", "m3");
        publishTo(1, "n1");
        ScriptedMessageHandler handler = new ScriptedMessageHandler().alwaysFail("poison");
        PartitionListener listener = createListener(handler);
        sleeper.onSleep(1, listener::stop);

        // When
        listener.start();

        // Then
        assertEquals(List.of("m1"), handler.succeededPayloads());
        assertTrue(handler.invocations().stream().noneMatch(invocation -> invocation.payload().equals("m3")));
        assertTrue(handler.invocations().stream().noneMatch(invocation -> invocation.payload().equals("n1")));
        assertListenerState(listener, ListenerState.ABORTED);
        assertCommitted(0, 0);
        assertCommitted(1, 0);
        assertClientsClosedOnce();
    }

    @Test
    void testStopAfterTermination_IsIdempotent() {
        // Given
        publish("m1");
        PartitionListener listener = createListener(new ScriptedMessageHandler());
        listener.start();

        // When
        assertDoesNotThrow(listener::stop);
        assertDoesNotThrow(listener::stop);

        // Then
        assertListenerState(listener, ListenerState.STOPPED);
        assertClientsClosedOnce();
        assertEquals(1, instrumentation.count(ListenerEvent.LISTENER_STOP));
    }

    @Test
    void testStopBeforeStart_StartDoesNothing() {
        // Given
        publish("m1");
        ScriptedMessageHandler handler = new ScriptedMessageHandler();
        PartitionListener listener = createListener(handler);

        // When
        listener.stop();
        listener.start();

        // Then
        assertListenerState(listener, ListenerState.STOPPED);
        assertTrue(handler.invocations().isEmpty());
        assertTrue(clientFactory.getClients().isEmpty(), "No client should be created");
        assertEquals(0, instrumentation.count(ListenerEvent.LISTENER_START));
    }

    @Test
    void testStopWhileFollowingIdleLog_Stopped() throws InterruptedException {
        // Given
        clientFactory = InMemoryLogClientFactory.following(log);
        publish("m1");
        ScriptedMessageHandler handler = new ScriptedMessageHandler();
        PartitionListener listener = createListener(handler);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch finished = new CountDownLatch(1);

        Thread processing = new Thread(() -> {
            try {
                listener.start();
            } catch (Throwable e) {
                failure.set(e);
            } finally {
                finished.countDown();
            }
        });
        processing.start();
        awaitCondition(Duration.ofSeconds(5), () -> handler.succeededPayloads().size() == 1);

        // When
        listener.stop();

        // Then
        assertTrue(finished.await(5, TimeUnit.SECONDS), "Listener should return after stop");
        assertNull(failure.get());
        assertListenerState(listener, ListenerState.STOPPED);
        assertCommitted(0, 1);
        assertClientsClosedOnce();
    }

    private static void stopFromAnotherThread(PartitionListener listener) {
        Thread stopper = new Thread(listener::stop, "stopper");
        stopper.start();
        try {
            stopper.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for stopper", e);
        }
    }
}
