package com.ryuqq.shopstore.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 일괄 작업에서 시도한 모든 항목이 실패했을 때 발생합니다.
 *
 * <p>일부만 실패한 경우에는 던지지 않습니다. 부분 실패는 호출 측에서 로그로 남깁니다.
 * 첫 번째 실패 원인이 cause로 연결되고, 나머지는 {@link #getFailures()}로 조회합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AggregateShopException extends ShopStoreException {

    private final Map<String, Throwable> failures;

    public AggregateShopException(String detail, Map<String, ? extends Throwable> failures) {
        super(ErrorCode.BATCH_FAILED, detail + " (" + failures.size() + " failures)", firstCause(failures));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /**
     * 실패한 id와 원인.
     *
     * @return 삽입 순서를 유지하는 읽기 전용 Map
     */
    public Map<String, Throwable> getFailures() {
        return failures;
    }

    private static Throwable firstCause(Map<String, ? extends Throwable> failures) {
        return failures.values().stream().findFirst().orElse(null);
    }
}
