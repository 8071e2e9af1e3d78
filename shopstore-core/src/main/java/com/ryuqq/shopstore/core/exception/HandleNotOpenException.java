package com.ryuqq.shopstore.core.exception;

/**
 * 열려 있지 않은 핸들을 닫으려 할 때 발생합니다.
 *
 * <p>close는 멱등하지 않습니다. 두 번째 close는 항상 이 예외를 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class HandleNotOpenException extends ShopStoreException {

    public HandleNotOpenException(String shopId) {
        super(ErrorCode.HANDLE_NOT_OPEN, "database for shop " + shopId + " is not open");
    }
}
