package com.ryuqq.listener.adapter.inmemory.log;

import com.ryuqq.listener.core.model.Batch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the in-memory client, consumer and factory.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryLogConsumerTest {

    private InMemoryLog log;
    private InMemoryLogClientFactory factory;

    @BeforeEach
    void setUp() {
        log = new InMemoryLog();
        factory = new InMemoryLogClientFactory(log, 2, false);
    }

    @Test
    @DisplayName("drain mode delivers every message in bounded batches and returns")
    void eachBatch_DrainMode_DeliversAllAndReturns() {
        for (int i = 0; i < 5; i++) {
            log.append("orders", 0, "k" + i, "v" + i);
        }
        InMemoryLogConsumer consumer = (InMemoryLogConsumer) factory.create().consumer("g1");
        consumer.subscribe("orders");
        List<Batch> batches = new ArrayList<>();

        consumer.eachBatch(batches::add);

        assertEquals(3, batches.size());
        assertEquals(List.of(2, 2, 1), List.of(batches.get(0).size(), batches.get(1).size(), batches.get(2).size()));
        assertEquals(3L, batches.get(0).offsetLag());
        assertEquals(5L, batches.get(0).highwaterMarkOffset());
        assertEquals(0L, batches.get(2).offsetLag());
        assertEquals(5L, log.committed("g1", "orders", 0));
    }

    @Test
    @DisplayName("a throwing callback leaves the batch uncommitted and propagates unchanged")
    void eachBatch_CallbackThrows_NoCommitAndPropagates() {
        log.append("orders", 0, "k", "v");
        InMemoryLogConsumer consumer = (InMemoryLogConsumer) factory.create().consumer("g1");
        consumer.subscribe("orders");
        IllegalStateException failure = new IllegalStateException("handler failed");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> consumer.eachBatch(batch -> {
                throw failure;
            }));

        assertSame(failure, thrown);
        assertEquals(0L, log.committed("g1", "orders", 0));
    }

    @Test
    @DisplayName("a new consumer of the same group resumes from the committed offset")
    void eachBatch_SameGroup_ResumesFromCommit() {
        log.append("orders", 0, "k0", "v0");
        log.append("orders", 0, "k1", "v1");
        InMemoryLogConsumer first = (InMemoryLogConsumer) factory.create().consumer("g1");
        first.subscribe("orders");
        first.eachBatch(batch -> { });

        log.append("orders", 0, "k2", "v2");
        InMemoryLogConsumer second = (InMemoryLogConsumer) factory.create().consumer("g1");
        second.subscribe("orders");
        List<String> values = new ArrayList<>();
        second.eachBatch(batch -> batch.messages().forEach(message -> values.add(message.value())));

        assertEquals(List.of("v2"), values);
    }

    @Test
    @DisplayName("follow mode waits for new messages until stopped")
    void eachBatch_FollowMode_RunsUntilStopped() throws InterruptedException {
        InMemoryLogClientFactory following = InMemoryLogClientFactory.following(log);
        InMemoryLogConsumer consumer = (InMemoryLogConsumer) following.create().consumer("g1");
        consumer.subscribe("orders");
        CountDownLatch received = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);

        Thread poller = new Thread(() -> {
            consumer.eachBatch(batch -> received.countDown());
            finished.countDown();
        });
        poller.start();

        log.append("orders", 0, "k", "late");
        assertTrue(received.await(5, TimeUnit.SECONDS));
        assertEquals(1L, finished.getCount());

        consumer.stop();
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertTrue(consumer.isStopped());
    }

    @Test
    @DisplayName("closing a client stops its consumers and counts every close call")
    void close_StopsConsumersAndCountsCalls() {
        InMemoryLogClient client = factory.create();
        InMemoryLogConsumer consumer = (InMemoryLogConsumer) client.consumer("g1");

        client.close();

        assertTrue(consumer.isStopped());
        assertTrue(client.isClosed());
        assertEquals(1, client.getCloseCount());
        assertThrows(IllegalStateException.class, () -> client.consumer("g1"));
    }

    @Test
    @DisplayName("injected failures are thrown by the next create calls in order")
    void create_InjectedFailure_ThrownOnce() {
        factory.failNextCreate(new IllegalStateException("broker down"));

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> factory.create());

        assertEquals("broker down", thrown.getMessage());
        assertNotNull(factory.create());
        assertEquals(1, factory.getClients().size());
    }

    @Test
    void eachBatch_WithoutSubscribe_ThrowsException() {
        InMemoryLogConsumer consumer = (InMemoryLogConsumer) factory.create().consumer("g1");

        assertThrows(IllegalStateException.class, () -> consumer.eachBatch(batch -> { }));
        assertThrows(IllegalArgumentException.class, () -> consumer.subscribe(""));
    }
}
