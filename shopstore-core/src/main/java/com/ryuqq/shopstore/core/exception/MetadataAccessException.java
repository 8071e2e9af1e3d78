package com.ryuqq.shopstore.core.exception;

/**
 * 메타데이터 인덱스 I/O 실패.
 *
 * <p>"메타데이터 없음"은 예외가 아니라 빈 Optional로 표현됩니다.
 * 이 예외는 읽기/쓰기 자체가 실패한 경우에만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MetadataAccessException extends ShopStoreException {

    public MetadataAccessException(String detail, Throwable cause) {
        super(ErrorCode.METADATA_ACCESS, detail, cause);
    }
}
