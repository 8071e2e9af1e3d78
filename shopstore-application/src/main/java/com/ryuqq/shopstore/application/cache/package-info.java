/**
 * 상점 읽기 캐시.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.application.cache;
