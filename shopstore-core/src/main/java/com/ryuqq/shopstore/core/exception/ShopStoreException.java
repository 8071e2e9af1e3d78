package com.ryuqq.shopstore.core.exception;

/**
 * 저장소 계층의 최상위 예외.
 *
 * <p>{@link ErrorCode}를 통해 실패 유형을 표준화합니다.
 * 세부 유형은 하위 클래스로 표현하며, 하위 클래스가 없는 유형
 * (예: {@link ErrorCode#CANCELLED})은 이 클래스를 직접 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ShopStoreException extends RuntimeException {

    private final ErrorCode errorCode;

    public ShopStoreException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public ShopStoreException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public ShopStoreException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
