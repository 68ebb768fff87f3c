package com.ryuqq.listener.adapter.runner;

import com.ryuqq.listener.core.backoff.BackoffPolicy;
import com.ryuqq.listener.core.failure.FailureClassifier;
import com.ryuqq.listener.core.failure.FailureDisposition;
import com.ryuqq.listener.core.failure.MessageProcessingException;
import com.ryuqq.listener.core.failure.RetryAbortedException;
import com.ryuqq.listener.core.handler.MessageHandler;
import com.ryuqq.listener.core.instrumentation.Instrumentation;
import com.ryuqq.listener.core.instrumentation.InstrumentationScope;
import com.ryuqq.listener.core.instrumentation.ListenerEvent;
import com.ryuqq.listener.core.lifecycle.ShutdownSignal;
import com.ryuqq.listener.core.model.ListenerIdentity;
import com.ryuqq.listener.core.model.Message;
import com.ryuqq.listener.core.model.ProcessingMetadata;
import com.ryuqq.listener.core.statemachine.RetryState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * MessageRetryLoop 유닛 테스트.
 *
 * <ul>
 *   <li>성공 시 1회 호출</li>
 *   <li>k회 실패 후 성공: backoff k회, retry_count 0..k-1</li>
 *   <li>backoff 직후 종료 신호 → RetryAbortedException</li>
 *   <li>PROPAGATE 분류 → MessageProcessingException</li>
 *   <li>sleep 인터럽트 → 중단</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class MessageRetryLoopTest {

    @Mock
    private Instrumentation instrumentation;

    @Mock
    private InstrumentationScope scope;

    @Captor
    private ArgumentCaptor<Map<String, Object>> captor;

    private final ListenerIdentity identity = ListenerIdentity.generate("orders-group", "orders");
    private final Message message = Message.of("order-1", "{\"id\":1}", 42L, 3);
    private final List<Duration> sleeps = new ArrayList<>();

    private ShutdownSignal shutdownSignal;
    private ProcessingMetadata metadata;

    @BeforeEach
    void setUp() {
        lenient().when(instrumentation.begin(any(), anyMap())).thenReturn(scope);
        shutdownSignal = new ShutdownSignal();
        metadata = ProcessingMetadata.forMessage(message, identity);
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    private MessageRetryLoop loop(Sleeper sleeper) {
        return loop(sleeper, FailureClassifier.RETRY_ALL);
    }

    private MessageRetryLoop loop(Sleeper sleeper, FailureClassifier classifier) {
        return new MessageRetryLoop(
            new ExponentialBackoffPolicy(100, 1000, 0.0),
            shutdownSignal,
            instrumentation,
            sleeper,
            classifier
        );
    }

    private Sleeper recordingSleeper() {
        return sleeps::add;
    }

    private static MessageHandler failingTimes(int failures, AtomicInteger calls) {
        return (payload, metadata) -> {
            if (calls.incrementAndGet() <= failures) {
                throw new IllegalStateException("downstream unavailable");
            }
        };
    }

    @Test
    void run_handler가_성공하면_한번만_호출하고_SUCCEEDED_반환() {
        // given
        List<String> payloads = new ArrayList<>();
        MessageHandler handler = (payload, meta) -> payloads.add(payload);

        // when
        RetryState result = loop(recordingSleeper()).run(handler, message, metadata);

        // then
        assertThat(result).isEqualTo(RetryState.SUCCEEDED);
        assertThat(payloads).containsExactly("{\"id\":1}");
        assertThat(sleeps).isEmpty();
        assertThat(metadata.getRetryCount()).isZero();
        verify(instrumentation).begin(eq(ListenerEvent.PROCESS_MESSAGE), anyMap());
        verify(instrumentation, never()).begin(eq(ListenerEvent.RETRY_HANDLER_ERROR), anyMap());
    }

    @Test
    void run_k번_실패_후_성공하면_k번_backoff하고_retry_count는_0부터_증가함() {
        // given
        AtomicInteger calls = new AtomicInteger();
        MessageHandler handler = failingTimes(3, calls);

        // when
        RetryState result = loop(recordingSleeper()).run(handler, message, metadata);

        // then
        assertThat(result).isEqualTo(RetryState.SUCCEEDED);
        assertThat(calls.get()).isEqualTo(4);
        assertThat(sleeps).containsExactly(
            Duration.ofMillis(100),
            Duration.ofMillis(200),
            Duration.ofMillis(400)
        );
        assertThat(metadata.getRetryCount()).isEqualTo(3);

        verify(instrumentation, times(3)).begin(eq(ListenerEvent.RETRY_HANDLER_ERROR), captor.capture());
        assertThat(captor.getAllValues())
            .extracting(error -> error.get("retry_count"))
            .containsExactly(0, 1, 2);
        verify(scope, times(3)).fail(any(IllegalStateException.class));
    }

    @Test
    void run_retry_handler_error_이벤트에_예외_정보와_대기_시간과_메타데이터가_포함됨() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when
        loop(recordingSleeper()).run(failingTimes(1, calls), message, metadata);

        // then
        verify(instrumentation).begin(eq(ListenerEvent.RETRY_HANDLER_ERROR), captor.capture());
        Map<String, Object> error = captor.getValue();
        assertThat(error)
            .containsEntry("exception_class", IllegalStateException.class.getName())
            .containsEntry("exception_message", "downstream unavailable")
            .containsEntry("waiting_time_ms", 100L)
            .containsEntry("listener_id", identity.listenerId())
            .containsEntry("key", "order-1")
            .containsEntry("partition", 3)
            .containsEntry("offset", 42L)
            .containsKey("backtrace");
        assertThat((List<?>) error.get("backtrace")).isNotEmpty();
    }

    @Test
    void run_backoff_도중_종료_신호가_설정되면_RetryAbortedException으로_중단함() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Sleeper stopDuringSleep = interval -> {
            sleeps.add(interval);
            shutdownSignal.request();
        };

        // when & then
        assertThatThrownBy(() -> loop(stopDuringSleep).run(failingTimes(Integer.MAX_VALUE, calls), message, metadata))
            .isInstanceOf(RetryAbortedException.class)
            .satisfies(e -> assertThat(((RetryAbortedException) e).getMetadata()).isSameAs(metadata));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).hasSize(1);
        assertThat(metadata.getRetryCount()).isEqualTo(1);
    }

    @Test
    void run_종료_신호는_backoff_직후에만_확인하므로_이미_설정되어_있어도_첫_시도는_실행됨() {
        // given
        shutdownSignal.request();
        AtomicInteger calls = new AtomicInteger();

        // when
        RetryState result = loop(recordingSleeper()).run(failingTimes(0, calls), message, metadata);

        // then
        assertThat(result).isEqualTo(RetryState.SUCCEEDED);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void run_Error_계열_실패도_재시도함() {
        // given
        AtomicInteger calls = new AtomicInteger();
        MessageHandler handler = (payload, meta) -> {
            if (calls.incrementAndGet() == 1) {
                throw new AssertionError("resource exhausted");
            }
        };

        // when
        RetryState result = loop(recordingSleeper()).run(handler, message, metadata);

        // then
        assertThat(result).isEqualTo(RetryState.SUCCEEDED);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void run_PROPAGATE로_분류되면_backoff_없이_MessageProcessingException을_던짐() {
        // given
        IllegalArgumentException poison = new IllegalArgumentException("malformed payload");
        MessageHandler handler = (payload, meta) -> {
            throw poison;
        };
        FailureClassifier classifier = (failure, meta) -> FailureDisposition.PROPAGATE;

        // when & then
        assertThatThrownBy(() -> loop(recordingSleeper(), classifier).run(handler, message, metadata))
            .isInstanceOf(MessageProcessingException.class)
            .hasCause(poison);
        assertThat(sleeps).isEmpty();
        verify(instrumentation, never()).begin(eq(ListenerEvent.RETRY_HANDLER_ERROR), anyMap());
    }

    @Test
    void run_backoff_sleep이_인터럽트되면_인터럽트_플래그를_복원하고_중단함() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Sleeper interrupted = interval -> {
            throw new InterruptedException("shutdown");
        };

        // when & then
        assertThatThrownBy(() -> loop(interrupted).run(failingTimes(Integer.MAX_VALUE, calls), message, metadata))
            .isInstanceOf(RetryAbortedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
        verify(scope).fail(any(InterruptedException.class));
    }

    @Test
    void 생성자_null_의존성은_예외() {
        BackoffPolicy backoff = BackoffPolicy.fixed(Duration.ZERO);

        assertThatThrownBy(() -> new MessageRetryLoop(null, shutdownSignal, instrumentation, Sleeper.THREAD_SLEEP, FailureClassifier.RETRY_ALL))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("backoffPolicy cannot be null");
        assertThatThrownBy(() -> new MessageRetryLoop(backoff, null, instrumentation, Sleeper.THREAD_SLEEP, FailureClassifier.RETRY_ALL))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("shutdownSignal cannot be null");
        assertThatThrownBy(() -> new MessageRetryLoop(backoff, shutdownSignal, instrumentation, null, FailureClassifier.RETRY_ALL))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sleeper cannot be null");
    }
}
