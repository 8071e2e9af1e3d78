package com.ryuqq.shopstore.core.exception;

/**
 * 백엔드 저장소를 열거나, 생성하거나, 로드하지 못했을 때 발생합니다.
 *
 * <p>원인 예외는 {@link #getCause()}로 확인할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StoreUnavailableException extends ShopStoreException {

    public StoreUnavailableException(String detail, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, detail, cause);
    }
}
