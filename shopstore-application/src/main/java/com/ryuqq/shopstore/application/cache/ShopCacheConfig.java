package com.ryuqq.shopstore.application.cache;

import java.time.Duration;

/**
 * ShopCache 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>ttl: 항목 만료 시간 (기본 5분)</li>
 *   <li>maxSize: 최대 항목 수 (기본 100)</li>
 * </ul>
 *
 * <p>생성 후 변경할 수 없습니다. 캐시 용량과 TTL은 캐시 생성 시점에 고정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param ttl 항목 만료 시간 (양수여야 함)
 * @param maxSize 최대 항목 수 (1 이상이어야 함)
 */
public record ShopCacheConfig(Duration ttl, int maxSize) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: ttl=5분, maxSize=100</p>
     */
    public ShopCacheConfig() {
        this(Duration.ofMinutes(5), 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ShopCacheConfig {
        if (ttl == null) {
            throw new IllegalArgumentException("ttl cannot be null");
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
    }

    /**
     * ttl만 변경한 새 인스턴스 생성.
     */
    public ShopCacheConfig withTtl(Duration ttl) {
        return new ShopCacheConfig(ttl, maxSize);
    }

    /**
     * maxSize만 변경한 새 인스턴스 생성.
     */
    public ShopCacheConfig withMaxSize(int maxSize) {
        return new ShopCacheConfig(ttl, maxSize);
    }
}
