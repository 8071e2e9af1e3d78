package com.ryuqq.shopstore.core.exception;

/**
 * 이미 메타데이터가 있는 id로 신규 생성을 시도할 때 발생합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ShopAlreadyExistsException extends ShopStoreException {

    public ShopAlreadyExistsException(String shopId) {
        super(ErrorCode.SHOP_ALREADY_EXISTS, "shop already exists: " + shopId);
    }
}
