package com.ryuqq.shopstore.core.document;

import com.ryuqq.shopstore.core.model.ShopAssets;
import com.ryuqq.shopstore.core.model.ShopContent;
import com.ryuqq.shopstore.core.model.ShopRecord;

/**
 * {@link ShopRecord} ↔ {@link ShopDocument} 변환.
 *
 * <p>도메인 객체와 백엔드 문서 사이의 유일한 변환 지점입니다.
 * 문서는 불변이므로 어느 방향이든 결과는 원본과 상태를 공유하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShopDocumentMapper {

    private ShopDocumentMapper() {
    }

    public static ShopDocument toDocument(ShopRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        ShopContent content = record.getContent();
        ShopAssets assets = record.getAssets();
        return new ShopDocument(
            ShopDocument.TYPE_SHOP,
            record.getId(),
            record.getOwner(),
            record.getName(),
            record.getDescription(),
            record.getCreated(),
            record.getUpdated(),
            content == null ? null : new ShopDocument.Content(content.getItems(), content.getTheme(), content.getContact()),
            assets == null ? null : new ShopDocument.Assets(assets.getLogoRef(), assets.getItemImageRefs()),
            record.getStorageAddress()
        );
    }

    public static ShopRecord toRecord(ShopDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        ShopRecord record = ShopRecord.of(document.id(), document.owner(), document.name());
        record.setDescription(document.description());
        record.setCreated(document.created());
        record.setUpdated(document.updated());
        ShopDocument.Content content = document.content();
        if (content != null) {
            record.setContent(new ShopContent(content.items(), content.theme(), content.contact()));
        }
        ShopDocument.Assets assets = document.assets();
        if (assets != null) {
            record.setAssets(new ShopAssets(assets.logoRef(), assets.itemImageRefs()));
        }
        record.setStorageAddress(document.storageAddress());
        return record;
    }
}
