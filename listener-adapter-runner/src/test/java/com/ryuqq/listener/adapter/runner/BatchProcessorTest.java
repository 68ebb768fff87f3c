package com.ryuqq.listener.adapter.runner;

import com.ryuqq.listener.core.backoff.BackoffPolicy;
import com.ryuqq.listener.core.failure.FailureClassifier;
import com.ryuqq.listener.core.failure.RetryAbortedException;
import com.ryuqq.listener.core.handler.MessageHandler;
import com.ryuqq.listener.core.instrumentation.noop.NoOpInstrumentation;
import com.ryuqq.listener.core.lifecycle.ShutdownSignal;
import com.ryuqq.listener.core.model.Batch;
import com.ryuqq.listener.core.model.ListenerIdentity;
import com.ryuqq.listener.core.model.Message;
import com.ryuqq.listener.core.model.ProcessingMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchProcessor 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BatchProcessorTest {

    private final ListenerIdentity identity = ListenerIdentity.generate("orders-group", "orders");

    private ShutdownSignal shutdownSignal;
    private BatchProcessor processor;

    @BeforeEach
    void setUp() {
        shutdownSignal = new ShutdownSignal();
        processor = new BatchProcessor(
            identity,
            new MessageRetryLoop(
                BackoffPolicy.fixed(Duration.ofMillis(5)),
                shutdownSignal,
                new NoOpInstrumentation(),
                interval -> { },
                FailureClassifier.RETRY_ALL
            )
        );
    }

    private static Batch batchOf(String... values) {
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            messages.add(Message.of("k" + i, values[i], 100L + i, 0));
        }
        return new Batch("orders", 0, messages, 0L, 100L + values.length);
    }

    @Test
    void process_메시지를_배치_순서대로_한번씩_처리함() {
        // given
        List<String> seen = new ArrayList<>();
        MessageHandler handler = (payload, metadata) -> seen.add(payload);

        // when
        int processed = processor.process(batchOf("a", "b", "c"), handler);

        // then
        assertThat(processed).isEqualTo(3);
        assertThat(seen).containsExactly("a", "b", "c");
    }

    @Test
    void process_실패한_메시지는_성공할_때까지_재시도한_뒤_다음_메시지로_진행함() {
        // given
        List<String> seen = new ArrayList<>();
        MessageHandler handler = (payload, metadata) -> {
            seen.add(payload + "#" + metadata.getRetryCount());
            if (payload.equals("b") && metadata.getRetryCount() < 2) {
                throw new IllegalStateException("retry me");
            }
        };

        // when
        processor.process(batchOf("a", "b", "c"), handler);

        // then
        assertThat(seen).containsExactly("a#0", "b#0", "b#1", "b#2", "c#0");
    }

    @Test
    void process_메시지마다_새_메타데이터를_사용하므로_retry_count가_이어지지_않음() {
        // given
        List<ProcessingMetadata> metadataSeen = new ArrayList<>();
        MessageHandler handler = (payload, metadata) -> {
            metadataSeen.add(metadata);
            if (payload.equals("a") && metadata.getRetryCount() == 0) {
                throw new IllegalStateException("once");
            }
        };

        // when
        processor.process(batchOf("a", "b"), handler);

        // then
        assertThat(metadataSeen).hasSize(3);
        assertThat(metadataSeen.get(2).getKey()).isEqualTo("k1");
        assertThat(metadataSeen.get(2).getRetryCount()).isZero();
        assertThat(metadataSeen.get(2).getOffset()).isEqualTo(101L);
        assertThat(metadataSeen.get(2).getIdentity()).isEqualTo(identity);
    }

    @Test
    void process_재시도_중_중단되면_나머지_메시지를_처리하지_않고_예외를_전파함() {
        // given
        List<String> seen = new ArrayList<>();
        MessageHandler handler = (payload, metadata) -> {
            seen.add(payload);
            if (payload.equals("b")) {
                shutdownSignal.request();
                throw new IllegalStateException("still failing");
            }
        };

        // when & then
        assertThatThrownBy(() -> processor.process(batchOf("a", "b", "c"), handler))
            .isInstanceOf(RetryAbortedException.class);
        assertThat(seen).containsExactly("a", "b");
    }

    @Test
    void process_빈_배치는_handler를_호출하지_않음() {
        // given
        List<String> seen = new ArrayList<>();

        // when
        int processed = processor.process(batchOf(), (payload, metadata) -> seen.add(payload));

        // then
        assertThat(processed).isZero();
        assertThat(seen).isEmpty();
    }

    @Test
    void process_null_인자는_예외() {
        assertThatThrownBy(() -> processor.process(null, (payload, metadata) -> { }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batch cannot be null");
        assertThatThrownBy(() -> processor.process(batchOf("a"), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("handler cannot be null");
    }
}
