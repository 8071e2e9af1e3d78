package com.ryuqq.shopstore.application.registry;

import com.ryuqq.shopstore.core.model.ShopId;

import java.time.Instant;

/**
 * 열려 있는 핸들 정보 (스냅샷).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param shopId 상점 id
 * @param address 백엔드 저장소 주소
 * @param openedAt 레지스트리에 등록된 시각
 */
public record HandleInfo(ShopId shopId, String address, Instant openedAt) {
}
