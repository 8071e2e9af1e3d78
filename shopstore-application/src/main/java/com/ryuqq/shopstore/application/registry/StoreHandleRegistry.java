package com.ryuqq.shopstore.application.registry;

import com.ryuqq.shopstore.core.exception.AggregateShopException;
import com.ryuqq.shopstore.core.exception.ErrorCode;
import com.ryuqq.shopstore.core.exception.HandleNotOpenException;
import com.ryuqq.shopstore.core.exception.ShopNotFoundException;
import com.ryuqq.shopstore.core.exception.ShopStoreException;
import com.ryuqq.shopstore.core.exception.StoreUnavailableException;
import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopMetadata;
import com.ryuqq.shopstore.core.spi.DocumentHandle;
import com.ryuqq.shopstore.core.spi.DocumentStore;
import com.ryuqq.shopstore.core.spi.DocumentStoreException;
import com.ryuqq.shopstore.core.spi.MetadataIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 상점 id → 열린 백엔드 핸들 레지스트리.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>지연 open-or-create ({@link #getOrCreate(ShopId)})</li>
 *   <li>close / repair / reloadAll / reconnectAll</li>
 *   <li>열린 핸들의 소유: 레지스트리에 등록된 핸들은 레지스트리만 닫음</li>
 * </ul>
 *
 * <p><strong>락 규칙:</strong></p>
 * <ul>
 *   <li>ReadWriteLock은 Map 조작에만 사용. 백엔드 I/O(open/create/load/close) 중에는 락을 잡지 않음</li>
 *   <li>같은 id에 대한 동시 miss는 하나의 open을 공유함 (per-id single-flight)</li>
 *   <li>repair / attach도 같은 in-flight 슬롯을 차지함. 진행 중인 open이 끝나길 기다린 뒤 시작하고,
 *       그동안 들어온 getOrCreate는 교체된 핸들을 받음</li>
 *   <li>등록 시점에 이미 다른 핸들이 있으면 기존 핸들을 유지하고 새 핸들은 닫음</li>
 * </ul>
 *
 * <p><strong>순서 보장:</strong> 새 저장소를 만들면 주소를 메타데이터에 먼저 기록한 뒤 load하고 등록합니다.
 * 메타데이터 기록이 실패하면 새 핸들은 닫히고 예외가 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StoreHandleRegistry {

    private static final Logger log = LoggerFactory.getLogger(StoreHandleRegistry.class);

    private final DocumentStore documentStore;
    private final MetadataIndex metadataIndex;
    private final Clock clock;
    private final int loadDepth;
    private final String namespacePrefix;

    private final Map<ShopId, OpenHandle> handles = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ConcurrentHashMap<ShopId, CompletableFuture<DocumentHandle>> inFlight = new ConcurrentHashMap<>();

    /**
     * 기본 설정 생성자 (전체 이력 로드, 네임스페이스 접두어 {@code shop-}).
     */
    public StoreHandleRegistry(DocumentStore documentStore, MetadataIndex metadataIndex, Clock clock) {
        this(documentStore, metadataIndex, clock, DocumentHandle.FULL_DEPTH, "shop-");
    }

    /**
     * 생성자.
     *
     * @param documentStore 백엔드 저장소
     * @param metadataIndex 메타데이터 인덱스
     * @param clock openedAt 기록용 시계
     * @param loadDepth load 깊이 ({@link DocumentHandle#FULL_DEPTH} 또는 양수)
     * @param namespacePrefix 새 저장소 네임스페이스 접두어
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StoreHandleRegistry(
        DocumentStore documentStore,
        MetadataIndex metadataIndex,
        Clock clock,
        int loadDepth,
        String namespacePrefix
    ) {
        if (documentStore == null) {
            throw new IllegalArgumentException("documentStore cannot be null");
        }
        if (metadataIndex == null) {
            throw new IllegalArgumentException("metadataIndex cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (namespacePrefix == null) {
            throw new IllegalArgumentException("namespacePrefix cannot be null");
        }
        this.documentStore = documentStore;
        this.metadataIndex = metadataIndex;
        this.clock = clock;
        this.loadDepth = loadDepth;
        this.namespacePrefix = namespacePrefix;
    }

    /**
     * 열린 핸들을 반환하거나, 없으면 열거나 새로 만듭니다.
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. 읽기 락으로 등록된 핸들 조회 → 있으면 반환
     * 2. in-flight 맵에 선점 시도 → 다른 스레드가 여는 중이면 그 결과를 기다림
     * 3. 메타데이터 조회
     *    - 주소 있음: open(address)
     *    - 주소 없음: create(prefix + id) → 메타데이터에 주소 기록
     * 4. load(depth) → 실패 시 핸들을 닫고 StoreUnavailableException
     * 5. 쓰기 락으로 등록
     * </pre>
     *
     * @param shopId 상점 id
     * @return 열린 핸들
     * @throws StoreUnavailableException open/create/load 실패 시
     * @throws com.ryuqq.shopstore.core.exception.MetadataAccessException 메타데이터 I/O 실패 시
     */
    public DocumentHandle getOrCreate(ShopId shopId) {
        if (shopId == null) {
            throw new IllegalArgumentException("shopId cannot be null");
        }
        DocumentHandle cached = lookup(shopId);
        if (cached != null) {
            return cached;
        }

        CompletableFuture<DocumentHandle> mine = new CompletableFuture<>();
        CompletableFuture<DocumentHandle> leader = inFlight.putIfAbsent(shopId, mine);
        if (leader != null) {
            return await(shopId, leader);
        }

        try {
            // 선점 직전에 다른 리더가 등록을 끝냈을 수 있음
            DocumentHandle handle = lookup(shopId);
            if (handle == null) {
                handle = register(shopId, openOrCreate(shopId));
            }
            mine.complete(handle);
            return handle;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(shopId, mine);
        }
    }

    /**
     * 등록된 핸들 조회 (열지 않음).
     */
    public Optional<DocumentHandle> find(ShopId shopId) {
        return Optional.ofNullable(lookup(shopId));
    }

    /**
     * 등록된 핸들 정보 조회 (열지 않음).
     */
    public Optional<HandleInfo> info(ShopId shopId) {
        lock.readLock().lock();
        try {
            OpenHandle open = handles.get(shopId);
            return open == null ? Optional.empty() : Optional.of(open.toInfo(shopId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isOpen(ShopId shopId) {
        return lookup(shopId) != null;
    }

    /**
     * 핸들을 레지스트리에서 제거하고 닫습니다.
     *
     * <p>멱등하지 않습니다. 열려 있지 않은 id는 {@link HandleNotOpenException}.</p>
     *
     * @throws HandleNotOpenException 열려 있지 않은 경우
     * @throws StoreUnavailableException 백엔드 close 실패 시 (레지스트리에서는 이미 제거됨)
     */
    public void close(ShopId shopId) {
        OpenHandle removed = unregister(shopId);
        if (removed == null) {
            throw new HandleNotOpenException(shopId.getValue());
        }
        try {
            removed.handle().close();
            log.info("Closed store for shop {}", shopId);
        } catch (DocumentStoreException e) {
            throw new StoreUnavailableException("failed to close store for shop " + shopId, e);
        }
    }

    /**
     * 저장소 복구.
     *
     * <p>열려 있으면 닫고, 메타데이터의 주소를 create-if-missing으로 다시 열어 로드합니다.
     * 실패하면 레지스트리에 핸들이 남지 않습니다.</p>
     *
     * @return 새로 등록된 핸들
     * @throws ShopNotFoundException 메타데이터나 주소가 없는 경우
     * @throws StoreUnavailableException 다시 열거나 로드하지 못한 경우
     */
    public DocumentHandle repair(ShopId shopId) {
        return exclusively(shopId, () -> reopen(shopId));
    }

    private DocumentHandle reopen(ShopId shopId) {
        ShopMetadata metadata = metadataIndex.find(shopId)
            .filter(ShopMetadata::hasStorageAddress)
            .orElseThrow(() -> new ShopNotFoundException(
                shopId.getValue(), "no storage address recorded for shop " + shopId));

        OpenHandle previous = unregister(shopId);
        if (previous != null) {
            closeQuietly(shopId, previous.handle());
        }

        DocumentHandle handle = openAt(shopId, metadata.storageAddress(), true);
        loadOrClose(shopId, handle);
        log.info("Repaired store for shop {} at {}", shopId, metadata.storageAddress());
        return register(shopId, handle);
    }

    /**
     * 가져오기용 등록.
     *
     * <p>기존 핸들을 닫고, {@code preferredAddress}를 열어 봅니다. 주소가 없거나 열 수 없으면
     * 새 저장소를 만들고 주소를 메타데이터에 기록합니다.</p>
     *
     * @param shopId 상점 id
     * @param preferredAddress 내보낸 시점의 주소 (nullable)
     * @return 등록된 핸들
     */
    public DocumentHandle attach(ShopId shopId, String preferredAddress) {
        return exclusively(shopId, () -> replace(shopId, preferredAddress));
    }

    private DocumentHandle replace(ShopId shopId, String preferredAddress) {
        OpenHandle previous = unregister(shopId);
        if (previous != null) {
            closeQuietly(shopId, previous.handle());
        }

        DocumentHandle handle = null;
        if (preferredAddress != null && !preferredAddress.isBlank()) {
            try {
                handle = documentStore.open(preferredAddress);
                handle.load(loadDepth);
            } catch (DocumentStoreException e) {
                log.warn("Address {} for shop {} is stale, creating a new store", preferredAddress, shopId, e);
                if (handle != null) {
                    closeQuietly(shopId, handle);
                }
                handle = null;
            }
        }

        if (handle == null) {
            handle = createAndRecord(shopId, metadataIndex.find(shopId));
            loadOrClose(shopId, handle);
        } else {
            recordAddress(shopId, metadataIndex.find(shopId), handle);
        }
        return register(shopId, handle);
    }

    /**
     * 메타데이터 전체를 스캔하여 주소가 있고 아직 열리지 않은 저장소를 엽니다.
     *
     * <p>개별 실패는 로그로 남기고 계속 진행합니다. 시도한 항목이 모두 실패한 경우에만
     * {@link AggregateShopException}을 던집니다.</p>
     *
     * @return 스캔 결과
     */
    public ReconnectSummary reconnectAll() {
        List<ShopId> shopIds = metadataIndex.listIds();
        int attempted = 0;
        int reconnected = 0;
        int skipped = 0;
        Map<String, Throwable> failures = new LinkedHashMap<>();

        for (ShopId shopId : shopIds) {
            if (isOpen(shopId)) {
                skipped++;
                continue;
            }
            Optional<ShopMetadata> metadata;
            try {
                metadata = metadataIndex.find(shopId);
            } catch (ShopStoreException e) {
                attempted++;
                failures.put(shopId.getValue(), e);
                log.warn("Failed to read metadata for shop {}", shopId, e);
                continue;
            }
            if (metadata.isEmpty() || !metadata.get().hasStorageAddress()) {
                skipped++;
                continue;
            }
            attempted++;
            if (tryReconnect(shopId, failures)) {
                reconnected++;
            }
        }

        log.info("Reconnect scan completed: {} reconnected out of {} attempted ({} skipped)",
            reconnected, attempted, skipped);

        if (attempted > 0 && reconnected == 0) {
            throw new AggregateShopException("failed to reconnect any store", failures);
        }
        return new ReconnectSummary(attempted, reconnected, skipped, failures);
    }

    /**
     * 열린 핸들을 모두 닫고 재연결 스캔을 다시 실행합니다.
     */
    public ReconnectSummary reloadAll() {
        Map<ShopId, OpenHandle> snapshot = drain();
        snapshot.forEach((shopId, open) -> closeQuietly(shopId, open.handle()));
        log.info("Closed {} stores for reload", snapshot.size());
        return reconnectAll();
    }

    /**
     * 열린 핸들을 모두 닫습니다. 개별 실패는 로그로 남깁니다.
     *
     * @return 닫은 핸들 수
     */
    public int closeAll() {
        Map<ShopId, OpenHandle> snapshot = drain();
        snapshot.forEach((shopId, open) -> closeQuietly(shopId, open.handle()));
        return snapshot.size();
    }

    /**
     * 열린 핸들 정보 스냅샷 (id 오름차순).
     */
    public List<HandleInfo> snapshot() {
        lock.readLock().lock();
        try {
            List<HandleInfo> infos = new ArrayList<>(handles.size());
            handles.forEach((shopId, open) -> infos.add(open.toInfo(shopId)));
            infos.sort((a, b) -> a.shopId().compareTo(b.shopId()));
            return infos;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 열린 핸들의 id 목록 (오름차순).
     */
    public List<ShopId> openIds() {
        lock.readLock().lock();
        try {
            List<ShopId> ids = new ArrayList<>(handles.keySet());
            ids.sort(null);
            return ids;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return handles.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 개별 재연결 시도. 실패해도 다른 항목 재연결을 방해하지 않습니다.
     */
    private boolean tryReconnect(ShopId shopId, Map<String, Throwable> failures) {
        try {
            getOrCreate(shopId);
            return true;
        } catch (ShopStoreException e) {
            failures.put(shopId.getValue(), e);
            log.warn("Failed to reconnect store for shop {}", shopId, e);
            return false;
        }
    }

    private DocumentHandle openOrCreate(ShopId shopId) {
        Optional<ShopMetadata> metadata = metadataIndex.find(shopId);
        DocumentHandle handle;
        if (metadata.isPresent() && metadata.get().hasStorageAddress()) {
            handle = openAt(shopId, metadata.get().storageAddress(), false);
            log.info("Reopened store for shop {} at {}", shopId, handle.address());
        } else {
            handle = createAndRecord(shopId, metadata);
        }
        loadOrClose(shopId, handle);
        return handle;
    }

    private DocumentHandle openAt(ShopId shopId, String address, boolean createIfMissing) {
        try {
            return documentStore.open(address, createIfMissing);
        } catch (DocumentStoreException e) {
            throw new StoreUnavailableException("failed to open store for shop " + shopId + " at " + address, e);
        }
    }

    private DocumentHandle createAndRecord(ShopId shopId, Optional<ShopMetadata> metadata) {
        DocumentHandle handle;
        try {
            handle = documentStore.create(namespacePrefix + shopId.getValue());
        } catch (DocumentStoreException e) {
            throw new StoreUnavailableException("failed to create store for shop " + shopId, e);
        }
        recordAddress(shopId, metadata, handle);
        log.info("Created store for shop {} at {}", shopId, handle.address());
        return handle;
    }

    private void recordAddress(ShopId shopId, Optional<ShopMetadata> metadata, DocumentHandle handle) {
        ShopMetadata updated = metadata
            .map(existing -> existing.withStorageAddress(handle.address()))
            .orElseGet(() -> ShopMetadata.addressOnly(shopId, handle.address()));
        try {
            metadataIndex.save(updated);
        } catch (RuntimeException e) {
            closeQuietly(shopId, handle);
            throw e;
        }
    }

    private void loadOrClose(ShopId shopId, DocumentHandle handle) {
        try {
            handle.load(loadDepth);
        } catch (DocumentStoreException e) {
            closeQuietly(shopId, handle);
            throw new StoreUnavailableException("failed to load store for shop " + shopId, e);
        }
    }

    /**
     * in-flight 슬롯을 차지한 상태로 핸들 교체 작업을 실행합니다.
     * 다른 스레드가 슬롯을 갖고 있으면 그 작업이 끝날 때까지 기다립니다 (결과는 무시).
     */
    private DocumentHandle exclusively(ShopId shopId, Supplier<DocumentHandle> action) {
        CompletableFuture<DocumentHandle> mine = new CompletableFuture<>();
        CompletableFuture<DocumentHandle> leader;
        while ((leader = inFlight.putIfAbsent(shopId, mine)) != null) {
            awaitSettled(shopId, leader);
        }

        try {
            DocumentHandle handle = action.get();
            mine.complete(handle);
            return handle;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(shopId, mine);
        }
    }

    private void awaitSettled(ShopId shopId, CompletableFuture<DocumentHandle> leader) {
        try {
            leader.handle((handle, failure) -> handle).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ShopStoreException(ErrorCode.CANCELLED, "interrupted while waiting for store of shop " + shopId, e);
        } catch (ExecutionException e) {
            throw new StoreUnavailableException("failed to wait for store of shop " + shopId, e.getCause());
        }
    }

    private DocumentHandle await(ShopId shopId, CompletableFuture<DocumentHandle> leader) {
        try {
            return leader.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ShopStoreException(ErrorCode.CANCELLED, "interrupted while opening store for shop " + shopId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new StoreUnavailableException("failed to open store for shop " + shopId, cause);
        }
    }

    private DocumentHandle lookup(ShopId shopId) {
        lock.readLock().lock();
        try {
            OpenHandle open = handles.get(shopId);
            return open == null ? null : open.handle();
        } finally {
            lock.readLock().unlock();
        }
    }

    private DocumentHandle register(ShopId shopId, DocumentHandle handle) {
        OpenHandle existing;
        lock.writeLock().lock();
        try {
            existing = handles.get(shopId);
            if (existing == null) {
                handles.put(shopId, new OpenHandle(handle, clock.instant()));
                return handle;
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Store for shop {} was registered concurrently, closing duplicate", shopId);
        closeQuietly(shopId, handle);
        return existing.handle();
    }

    private OpenHandle unregister(ShopId shopId) {
        lock.writeLock().lock();
        try {
            return handles.remove(shopId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Map<ShopId, OpenHandle> drain() {
        lock.writeLock().lock();
        try {
            Map<ShopId, OpenHandle> snapshot = new HashMap<>(handles);
            handles.clear();
            return snapshot;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void closeQuietly(ShopId shopId, DocumentHandle handle) {
        try {
            handle.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close store handle for shop {}", shopId, e);
        }
    }

    private record OpenHandle(DocumentHandle handle, Instant openedAt) {

        HandleInfo toInfo(ShopId shopId) {
            return new HandleInfo(shopId, handle.address(), openedAt);
        }
    }
}
