package com.ryuqq.shopstore.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * 상점에 진열된 상품 한 줄.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 상품 id
 * @param name 상품 이름 (비어 있으면 저장 불가)
 * @param price 가격 (음수 불가)
 * @param description 설명
 * @param imageRefs 이미지 참조 목록 (불변 복사본)
 * @param created 생성 시각
 */
public record LineItem(
    String id,
    String name,
    BigDecimal price,
    String description,
    List<String> imageRefs,
    Instant created
) {

    public LineItem {
        imageRefs = imageRefs == null ? List.of() : List.copyOf(imageRefs);
    }
}
