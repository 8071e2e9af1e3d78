package com.ryuqq.shopstore.core.document;

import com.ryuqq.shopstore.core.model.ShopMetadata;

/**
 * 상점 하나의 이관용 번들 (문서 + 메타데이터).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param shopData 상점 문서
 * @param metadata 메타데이터 (가져오기 시 주소가 없거나 오래되었을 수 있음)
 */
public record ShopExport(ShopDocument shopData, ShopMetadata metadata) {

    public ShopExport {
        if (shopData == null) {
            throw new IllegalArgumentException("shopData cannot be null");
        }
    }
}
