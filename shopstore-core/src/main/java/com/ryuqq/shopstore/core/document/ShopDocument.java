package com.ryuqq.shopstore.core.document;

import com.ryuqq.shopstore.core.model.ContactInfo;
import com.ryuqq.shopstore.core.model.LineItem;
import com.ryuqq.shopstore.core.model.ThemeColors;

import java.time.Instant;
import java.util.List;

/**
 * 백엔드 문서 저장소에 기록되는 형태 (typed DTO).
 *
 * <p>백엔드와 주고받는 유일한 문서 타입입니다. 문서 저장소는 {@code id}를 키로 사용하며,
 * 같은 id로 put하면 덮어씁니다. {@code type}은 항상 {@value #TYPE_SHOP}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ShopDocument(
    String type,
    String id,
    String owner,
    String name,
    String description,
    Instant created,
    Instant updated,
    Content content,
    Assets assets,
    String storageAddress
) {

    public static final String TYPE_SHOP = "shop";

    public ShopDocument {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("document id cannot be null or blank");
        }
        if (type == null) {
            type = TYPE_SHOP;
        }
    }

    /**
     * 상점 문서인지 확인.
     */
    public boolean hasShopType() {
        return TYPE_SHOP.equals(type);
    }

    /**
     * 상점 본문.
     */
    public record Content(List<LineItem> items, ThemeColors theme, ContactInfo contact) {

        public Content {
            items = items == null ? List.of() : List.copyOf(items);
        }
    }

    /**
     * 에셋 참조.
     */
    public record Assets(String logoRef, List<String> itemImageRefs) {

        public Assets {
            itemImageRefs = itemImageRefs == null ? List.of() : List.copyOf(itemImageRefs);
        }
    }
}
