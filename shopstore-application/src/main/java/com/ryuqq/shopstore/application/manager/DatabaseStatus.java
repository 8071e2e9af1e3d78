package com.ryuqq.shopstore.application.manager;

import com.ryuqq.shopstore.core.model.ShopId;

import java.time.Instant;

/**
 * 상점 저장소 하나의 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param shopId 상점 id
 * @param address 저장소 주소
 * @param loaded 레지스트리에 열려 있는지 여부
 * @param recordCount 문서 수 (열려 있지 않으면 0)
 * @param openedAt 열린 시각 (열려 있지 않으면 null)
 */
public record DatabaseStatus(ShopId shopId, String address, boolean loaded, int recordCount, Instant openedAt) {
}
