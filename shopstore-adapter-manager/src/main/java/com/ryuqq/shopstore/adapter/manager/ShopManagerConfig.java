package com.ryuqq.shopstore.adapter.manager;

import com.ryuqq.shopstore.application.cache.ShopCacheConfig;
import com.ryuqq.shopstore.core.spi.DocumentHandle;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/**
 * DefaultShopManager 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>listingConcurrency: 목록 조회 동시 처리 스레드 수 (기본 5)</li>
 *   <li>defaultListLimit: limit을 지정하지 않은 목록 조회의 페이지 크기 (기본 100)</li>
 *   <li>loadDepth: 저장소 load 깊이 (기본 -1 = 전체 이력)</li>
 *   <li>namespacePrefix: 새 저장소 네임스페이스 접두어 (기본 {@code shop-})</li>
 *   <li>shutdownTimeout: 작업 스레드 종료 대기 시간 (기본 60초)</li>
 *   <li>cache: 캐시 설정 (기본 TTL 5분, 최대 100건)</li>
 * </ul>
 *
 * <p><strong>Properties 키:</strong></p>
 * <pre>
 * shopstore.listing.concurrency=5
 * shopstore.listing.default-limit=100
 * shopstore.store.load-depth=-1
 * shopstore.store.namespace-prefix=shop-
 * shopstore.shutdown.timeout-ms=60000
 * shopstore.cache.ttl=PT5M
 * shopstore.cache.max-size=100
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param listingConcurrency 목록 조회 동시성 (1 이상)
 * @param defaultListLimit 기본 페이지 크기 (1 이상)
 * @param loadDepth load 깊이 ({@link DocumentHandle#FULL_DEPTH} 또는 양수)
 * @param namespacePrefix 네임스페이스 접두어 (null 불가)
 * @param shutdownTimeout 종료 대기 시간 (양수)
 * @param cache 캐시 설정 (null 불가)
 */
public record ShopManagerConfig(
    int listingConcurrency,
    int defaultListLimit,
    int loadDepth,
    String namespacePrefix,
    Duration shutdownTimeout,
    ShopCacheConfig cache
) {

    static final String CONCURRENCY_KEY = "shopstore.listing.concurrency";
    static final String DEFAULT_LIMIT_KEY = "shopstore.listing.default-limit";
    static final String LOAD_DEPTH_KEY = "shopstore.store.load-depth";
    static final String NAMESPACE_PREFIX_KEY = "shopstore.store.namespace-prefix";
    static final String SHUTDOWN_TIMEOUT_KEY = "shopstore.shutdown.timeout-ms";
    static final String CACHE_TTL_KEY = "shopstore.cache.ttl";
    static final String CACHE_MAX_SIZE_KEY = "shopstore.cache.max-size";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: listingConcurrency=5, defaultListLimit=100, loadDepth=-1,
     * namespacePrefix=shop-, shutdownTimeout=60s, cache=기본 캐시 설정</p>
     */
    public ShopManagerConfig() {
        this(5, 100, DocumentHandle.FULL_DEPTH, "shop-", Duration.ofSeconds(60), new ShopCacheConfig());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ShopManagerConfig {
        if (listingConcurrency <= 0) {
            throw new IllegalArgumentException(
                "listingConcurrency must be positive (current: " + listingConcurrency + ")"
            );
        }
        if (defaultListLimit <= 0) {
            throw new IllegalArgumentException(
                "defaultListLimit must be positive (current: " + defaultListLimit + ")"
            );
        }
        if (loadDepth != DocumentHandle.FULL_DEPTH && loadDepth <= 0) {
            throw new IllegalArgumentException(
                "loadDepth must be positive or " + DocumentHandle.FULL_DEPTH + " (current: " + loadDepth + ")"
            );
        }
        if (namespacePrefix == null) {
            throw new IllegalArgumentException("namespacePrefix cannot be null");
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
            throw new IllegalArgumentException(
                "shutdownTimeout must be positive (current: " + shutdownTimeout + ")"
            );
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
    }

    /**
     * Properties에서 설정을 읽습니다. 없는 키는 기본값을 사용합니다.
     *
     * @param properties 설정 원본
     * @return 설정
     * @throws IllegalArgumentException 값을 해석할 수 없거나 검증에 실패한 경우 (키 이름 포함)
     */
    public static ShopManagerConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        ShopManagerConfig defaults = new ShopManagerConfig();
        ShopCacheConfig cache = new ShopCacheConfig(
            durationValue(properties, CACHE_TTL_KEY, defaults.cache().ttl()),
            intValue(properties, CACHE_MAX_SIZE_KEY, defaults.cache().maxSize())
        );
        return new ShopManagerConfig(
            intValue(properties, CONCURRENCY_KEY, defaults.listingConcurrency()),
            intValue(properties, DEFAULT_LIMIT_KEY, defaults.defaultListLimit()),
            intValue(properties, LOAD_DEPTH_KEY, defaults.loadDepth()),
            properties.getProperty(NAMESPACE_PREFIX_KEY, defaults.namespacePrefix()).trim(),
            Duration.ofMillis(intValue(properties, SHUTDOWN_TIMEOUT_KEY, (int) defaults.shutdownTimeout().toMillis())),
            cache
        );
    }

    /**
     * listingConcurrency만 변경한 새 인스턴스 생성.
     */
    public ShopManagerConfig withListingConcurrency(int listingConcurrency) {
        return new ShopManagerConfig(listingConcurrency, defaultListLimit, loadDepth, namespacePrefix, shutdownTimeout, cache);
    }

    /**
     * defaultListLimit만 변경한 새 인스턴스 생성.
     */
    public ShopManagerConfig withDefaultListLimit(int defaultListLimit) {
        return new ShopManagerConfig(listingConcurrency, defaultListLimit, loadDepth, namespacePrefix, shutdownTimeout, cache);
    }

    /**
     * loadDepth만 변경한 새 인스턴스 생성.
     */
    public ShopManagerConfig withLoadDepth(int loadDepth) {
        return new ShopManagerConfig(listingConcurrency, defaultListLimit, loadDepth, namespacePrefix, shutdownTimeout, cache);
    }

    /**
     * namespacePrefix만 변경한 새 인스턴스 생성.
     */
    public ShopManagerConfig withNamespacePrefix(String namespacePrefix) {
        return new ShopManagerConfig(listingConcurrency, defaultListLimit, loadDepth, namespacePrefix, shutdownTimeout, cache);
    }

    /**
     * shutdownTimeout만 변경한 새 인스턴스 생성.
     */
    public ShopManagerConfig withShutdownTimeout(Duration shutdownTimeout) {
        return new ShopManagerConfig(listingConcurrency, defaultListLimit, loadDepth, namespacePrefix, shutdownTimeout, cache);
    }

    /**
     * cache만 변경한 새 인스턴스 생성.
     */
    public ShopManagerConfig withCache(ShopCacheConfig cache) {
        return new ShopManagerConfig(listingConcurrency, defaultListLimit, loadDepth, namespacePrefix, shutdownTimeout, cache);
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + raw + ")", e);
        }
    }

    private static Duration durationValue(Properties properties, String key, Duration defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Duration.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(key + " must be an ISO-8601 duration such as PT5M (current: " + raw + ")", e);
        }
    }
}
