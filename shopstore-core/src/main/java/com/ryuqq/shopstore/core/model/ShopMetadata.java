package com.ryuqq.shopstore.core.model;

import com.ryuqq.shopstore.core.exception.ShopValidationException;

/**
 * 상점 메타데이터 (빠른 조회용 투영).
 *
 * <p>무거운 문서 데이터와 분리된 위치에 저장되며,
 * 백엔드 저장소의 주소({@code storageAddress})를 아는 유일한 출처입니다.</p>
 *
 * <p>저장소가 처음 생성되는 시점에는 name/owner가 아직 비어 있을 수 있습니다.
 * 이후 쓰기 작업에서 채워집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 상점 id
 * @param name 상점 이름 (nullable)
 * @param owner 소유자 식별자 (nullable)
 * @param storageAddress 백엔드 저장소 주소 (nullable, 한 번이라도 생성되면 채워짐)
 * @throws ShopValidationException id가 null이거나 비어 있는 경우
 */
public record ShopMetadata(String id, String name, String owner, String storageAddress) {

    public ShopMetadata {
        if (id == null || id.isBlank()) {
            throw new ShopValidationException("shop id cannot be null or blank");
        }
    }

    /**
     * 주소만 있는 최초 메타데이터 생성.
     */
    public static ShopMetadata addressOnly(ShopId shopId, String storageAddress) {
        return new ShopMetadata(shopId.getValue(), null, null, storageAddress);
    }

    /**
     * 저장소 주소가 기록되어 있는지 확인.
     */
    public boolean hasStorageAddress() {
        return storageAddress != null && !storageAddress.isBlank();
    }

    /**
     * storageAddress만 변경한 새 인스턴스 생성.
     */
    public ShopMetadata withStorageAddress(String storageAddress) {
        return new ShopMetadata(id, name, owner, storageAddress);
    }
}
