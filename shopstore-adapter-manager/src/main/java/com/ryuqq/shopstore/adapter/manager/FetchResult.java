package com.ryuqq.shopstore.adapter.manager;

import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 동시 조회 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param records 성공한 레코드 (완료 순서)
 * @param failures 실패한 id → 원인 (완료 순서)
 */
public record FetchResult(List<ShopRecord> records, Map<ShopId, Throwable> failures) {

    public FetchResult {
        records = List.copyOf(records);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    static FetchResult empty() {
        return new FetchResult(List.of(), Map.of());
    }

    /**
     * 시도한 항목이 있고 모두 실패했는지 확인.
     */
    public boolean allFailed() {
        return records.isEmpty() && !failures.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * 실패 맵을 문자열 키로 변환 ({@link com.ryuqq.shopstore.core.exception.AggregateShopException}용).
     */
    public Map<String, Throwable> failuresById() {
        Map<String, Throwable> byId = new LinkedHashMap<>();
        failures.forEach((shopId, cause) -> byId.put(shopId.getValue(), cause));
        return byId;
    }
}
