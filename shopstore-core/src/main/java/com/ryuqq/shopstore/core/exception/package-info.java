/**
 * 저장소 계층 예외 계층.
 *
 * <p>모든 예외는 unchecked이며 {@link com.ryuqq.shopstore.core.exception.ShopStoreException}을
 * 상속하고 {@link com.ryuqq.shopstore.core.exception.ErrorCode}를 가집니다.</p>
 *
 * <ul>
 *   <li>단건 작업은 즉시 실패합니다 (fail fast).</li>
 *   <li>일괄 작업은 실패를 모아 로그로 남기고, 전부 실패한 경우에만
 *       {@link com.ryuqq.shopstore.core.exception.AggregateShopException}을 던집니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.core.exception;
