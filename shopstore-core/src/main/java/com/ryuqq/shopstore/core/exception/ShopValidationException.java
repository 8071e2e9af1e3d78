package com.ryuqq.shopstore.core.exception;

/**
 * 입력값이 불변식을 만족하지 않을 때 발생합니다 (빈 id/owner/name, 잘못된 가격 등).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ShopValidationException extends ShopStoreException {

    public ShopValidationException(String detail) {
        super(ErrorCode.INVALID_INPUT, detail);
    }

    public ShopValidationException(String detail, Throwable cause) {
        super(ErrorCode.INVALID_INPUT, detail, cause);
    }
}
