/**
 * 저장소 핸들 레지스트리.
 *
 * <p>핸들의 open/create/close/repair/reload와 시작 시 재연결 스캔을 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.application.registry;
