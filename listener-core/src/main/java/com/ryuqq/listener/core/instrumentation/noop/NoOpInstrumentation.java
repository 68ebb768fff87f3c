package com.ryuqq.listener.core.instrumentation.noop;

import com.ryuqq.listener.core.instrumentation.Instrumentation;
import com.ryuqq.listener.core.instrumentation.InstrumentationScope;
import com.ryuqq.listener.core.instrumentation.ListenerEvent;

import java.util.Map;

/**
 * Instrumentation NoOp 구현.
 *
 * <p>아무 이벤트도 기록하지 않습니다. 계측 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>begin(): 공유 NoOp scope 반환</li>
 *   <li>fail(), close(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpInstrumentation implements Instrumentation {

    private static final InstrumentationScope NO_OP_SCOPE = new InstrumentationScope() {
        @Override
        public void fail(Throwable error) {
            // NoOp
        }

        @Override
        public void close() {
            // NoOp
        }
    };

    @Override
    public InstrumentationScope begin(ListenerEvent event, Map<String, Object> metadata) {
        return NO_OP_SCOPE;
    }
}
