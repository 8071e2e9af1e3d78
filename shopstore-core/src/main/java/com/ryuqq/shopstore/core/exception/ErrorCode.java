package com.ryuqq.shopstore.core.exception;

/**
 * 저장소 계층 에러 코드.
 *
 * <p>모든 {@link ShopStoreException}은 하나의 ErrorCode를 가지며,
 * 호출자는 예외 타입 대신 코드로 분기할 수 있습니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>입력 오류: INVALID_INPUT</li>
 *   <li>존재 여부: SHOP_NOT_FOUND, SHOP_ALREADY_EXISTS</li>
 *   <li>핸들 상태: HANDLE_NOT_OPEN, STORE_UNAVAILABLE</li>
 *   <li>인프라: METADATA_ACCESS</li>
 *   <li>일괄 처리: BATCH_FAILED, CANCELLED</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCode {

    INVALID_INPUT("SS-001", "Invalid input value"),
    SHOP_NOT_FOUND("SS-002", "Shop not found"),
    SHOP_ALREADY_EXISTS("SS-003", "Shop already exists"),
    HANDLE_NOT_OPEN("SS-004", "Store handle is not open"),
    STORE_UNAVAILABLE("SS-005", "Backing store unavailable"),
    METADATA_ACCESS("SS-006", "Metadata index access failed"),
    BATCH_FAILED("SS-007", "Every item in the batch failed"),
    CANCELLED("SS-008", "Operation cancelled");

    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
