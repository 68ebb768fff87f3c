package com.ryuqq.listener.adapter.runner;

import com.ryuqq.listener.core.instrumentation.Instrumentation;
import com.ryuqq.listener.core.instrumentation.InstrumentationScope;
import com.ryuqq.listener.core.instrumentation.ListenerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * SLF4J 기반 Instrumentation 구현.
 *
 * <p>각 scope의 시작과 종료를 로그로 남깁니다.</p>
 *
 * <p><strong>로그 레벨:</strong></p>
 * <ul>
 *   <li>시작/성공 종료: DEBUG (소요 시간 포함)</li>
 *   <li>실패 종료: WARN (예외 클래스와 메시지 포함, 스택은 호출자가 ERROR로 남김)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LoggingInstrumentation implements Instrumentation {

    private static final Logger log = LoggerFactory.getLogger(LoggingInstrumentation.class);

    @Override
    public InstrumentationScope begin(ListenerEvent event, Map<String, Object> metadata) {
        log.debug("{} started {}", event, metadata);
        return new LoggingScope(event, metadata, System.nanoTime());
    }

    private static final class LoggingScope implements InstrumentationScope {

        private final ListenerEvent event;
        private final Map<String, Object> metadata;
        private final long startedAtNanos;
        private Throwable error;

        LoggingScope(ListenerEvent event, Map<String, Object> metadata, long startedAtNanos) {
            this.event = event;
            this.metadata = metadata;
            this.startedAtNanos = startedAtNanos;
        }

        @Override
        public void fail(Throwable error) {
            this.error = error;
        }

        @Override
        public void close() {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
            if (error != null) {
                log.warn("{} failed after {}ms: {} {}", event, elapsedMs, error.toString(), metadata);
            } else {
                log.debug("{} finished in {}ms {}", event, elapsedMs, metadata);
            }
        }
    }
}
