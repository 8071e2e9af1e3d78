package com.ryuqq.shopstore.core.exception;

/**
 * 메타데이터 또는 문서가 존재하지 않는 상점을 조회/수정/삭제할 때 발생합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ShopNotFoundException extends ShopStoreException {

    private final String shopId;

    public ShopNotFoundException(String shopId) {
        this(shopId, "shop not found: " + shopId);
    }

    public ShopNotFoundException(String shopId, String detail) {
        super(ErrorCode.SHOP_NOT_FOUND, detail);
        this.shopId = shopId;
    }

    public String getShopId() {
        return shopId;
    }
}
