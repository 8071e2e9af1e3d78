package com.ryuqq.shopstore.application.cache;

import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 크기 제한과 TTL이 있는 상점 읽기 캐시.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>get: 공유 락. 만료된 항목은 miss로 처리하되 제거하지 않음 (lazy expiry)</li>
 *   <li>put: 배타 락. 가득 찼고 새 id이면 마지막 접근이 가장 오래된 항목 1개를 제거</li>
 *   <li>모든 get/put은 깊은 복사. 호출자와 캐시는 인스턴스를 공유하지 않음</li>
 * </ul>
 *
 * <p><strong>축출 비용:</strong> put 시 O(N) 전체 스캔. maxSize가 작다는 전제입니다.</p>
 *
 * <p>마지막 접근 시각은 항목 내부의 volatile 필드이므로 공유 락 아래에서 갱신해도
 * Map 구조는 바뀌지 않습니다. 같은 시각에 접근한 항목은 접근 순번으로 구분합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShopCache {

    private static final Logger log = LoggerFactory.getLogger(ShopCache.class);

    private final ShopCacheConfig config;
    private final Clock clock;
    private final Map<ShopId, CacheEntry> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong accessSequence = new AtomicLong();

    public ShopCache(ShopCacheConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    /**
     * 캐시 조회.
     *
     * @param shopId 상점 id
     * @return 만료되지 않은 항목의 깊은 복사본, 없거나 만료되었으면 empty
     */
    public Optional<ShopRecord> get(ShopId shopId) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            CacheEntry entry = entries.get(shopId);
            if (entry == null) {
                return Optional.empty();
            }
            if (now.isAfter(entry.expiresAt)) {
                log.debug("Cache entry for shop {} expired at {}", shopId, entry.expiresAt);
                return Optional.empty();
            }
            entry.lastAccess = new AccessStamp(now, accessSequence.incrementAndGet());
            return Optional.of(entry.snapshot.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 캐시 저장 (덮어쓰기).
     *
     * @param shopId 상점 id
     * @param record 저장할 레코드 (깊은 복사본이 저장됨)
     */
    public void put(ShopId shopId, ShopRecord record) {
        if (shopId == null) {
            throw new IllegalArgumentException("shopId cannot be null");
        }
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        ShopRecord snapshot = record.copy();
        Instant now = clock.instant();

        lock.writeLock().lock();
        try {
            if (!entries.containsKey(shopId) && entries.size() >= config.maxSize()) {
                evictLeastRecentlyAccessed();
            }
            entries.put(shopId, new CacheEntry(
                snapshot,
                now.plus(config.ttl()),
                new AccessStamp(now, accessSequence.incrementAndGet())
            ));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 항목 제거. 없으면 아무것도 하지 않음.
     */
    public void invalidate(ShopId shopId) {
        lock.writeLock().lock();
        try {
            entries.remove(shopId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 전체 비우기.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 현재 항목 수 (만료되었지만 아직 제거되지 않은 항목 포함).
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public ShopCacheConfig config() {
        return config;
    }

    /**
     * 쓰기 락 보유 상태에서 호출.
     */
    private void evictLeastRecentlyAccessed() {
        ShopId victim = null;
        AccessStamp oldest = null;
        for (Map.Entry<ShopId, CacheEntry> candidate : entries.entrySet()) {
            AccessStamp stamp = candidate.getValue().lastAccess;
            if (oldest == null || stamp.isBefore(oldest)) {
                oldest = stamp;
                victim = candidate.getKey();
            }
        }
        if (victim != null) {
            entries.remove(victim);
            log.debug("Evicted shop {} from cache (last accessed {})", victim, oldest.at());
        }
    }

    private static final class CacheEntry {

        private final ShopRecord snapshot;
        private final Instant expiresAt;
        private volatile AccessStamp lastAccess;

        private CacheEntry(ShopRecord snapshot, Instant expiresAt, AccessStamp lastAccess) {
            this.snapshot = snapshot;
            this.expiresAt = expiresAt;
            this.lastAccess = lastAccess;
        }
    }

    private record AccessStamp(Instant at, long sequence) {

        boolean isBefore(AccessStamp other) {
            int byTime = at.compareTo(other.at);
            return byTime < 0 || (byTime == 0 && sequence < other.sequence);
        }
    }
}
