/**
 * 상점 저장소 파사드 API.
 *
 * <p>구현체는 shopstore-adapter-manager 모듈의 {@code DefaultShopManager}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.application.manager;
