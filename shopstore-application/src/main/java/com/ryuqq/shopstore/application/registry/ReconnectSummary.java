package com.ryuqq.shopstore.application.registry;

import java.util.Map;

/**
 * 재연결 스캔 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param attempted 주소가 있어 재연결을 시도한 수
 * @param reconnected 성공 수
 * @param skipped 이미 열려 있거나 주소가 없어 건너뛴 수
 * @param failures 실패한 id와 원인
 */
public record ReconnectSummary(int attempted, int reconnected, int skipped, Map<String, Throwable> failures) {

    public ReconnectSummary {
        failures = Map.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
