package com.ryuqq.shopstore.adapter.manager;

import com.ryuqq.shopstore.application.cache.ShopCache;
import com.ryuqq.shopstore.application.manager.DatabaseStats;
import com.ryuqq.shopstore.application.manager.DatabaseStatus;
import com.ryuqq.shopstore.application.manager.ListShopsOptions;
import com.ryuqq.shopstore.application.manager.ShopManager;
import com.ryuqq.shopstore.application.manager.SortField;
import com.ryuqq.shopstore.application.registry.HandleInfo;
import com.ryuqq.shopstore.application.registry.ReconnectSummary;
import com.ryuqq.shopstore.application.registry.StoreHandleRegistry;
import com.ryuqq.shopstore.core.document.ShopDocument;
import com.ryuqq.shopstore.core.document.ShopDocumentMapper;
import com.ryuqq.shopstore.core.document.ShopExport;
import com.ryuqq.shopstore.core.exception.AggregateShopException;
import com.ryuqq.shopstore.core.exception.ShopAlreadyExistsException;
import com.ryuqq.shopstore.core.exception.ShopNotFoundException;
import com.ryuqq.shopstore.core.exception.ShopStoreException;
import com.ryuqq.shopstore.core.exception.ShopValidationException;
import com.ryuqq.shopstore.core.exception.StoreUnavailableException;
import com.ryuqq.shopstore.core.model.AssetType;
import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopMetadata;
import com.ryuqq.shopstore.core.model.ShopRecord;
import com.ryuqq.shopstore.core.model.ShopRecordValidator;
import com.ryuqq.shopstore.core.spi.DocumentHandle;
import com.ryuqq.shopstore.core.spi.DocumentRef;
import com.ryuqq.shopstore.core.spi.DocumentStore;
import com.ryuqq.shopstore.core.spi.DocumentStoreException;
import com.ryuqq.shopstore.core.spi.MetadataIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ShopManager} 기본 구현체.
 *
 * <p><strong>읽기 경로:</strong></p>
 * <pre>
 * getShop(id)
 *   1. cache.get(id) → hit이면 복사본 반환
 *   2. metadataIndex.find(id) → 없으면 ShopNotFoundException
 *   3. registry.getOrCreate(id) → 핸들
 *   4. handle.query(type == shop &amp;&amp; id == id) → 없으면 ShopNotFoundException
 *   5. storageAddress = handle.address() → cache.put
 * </pre>
 *
 * <p><strong>쓰기 경로:</strong> 복사본에 created/updated/storageAddress를 채워 문서를 put하고,
 * 메타데이터(id, name, owner, storageAddress)를 저장한 뒤 캐시를 갱신합니다.
 * 호출자가 넘긴 레코드는 수정하지 않습니다.</p>
 *
 * <p><strong>목록 조회:</strong> 페이지를 먼저 자른 뒤 {@link ConcurrentShopFetcher}로 조회하고,
 * 소유자 필터와 정렬을 적용합니다. 소유자 필터가 페이지 이후에 적용되므로
 * 한 페이지의 결과가 limit보다 적을 수 있습니다. 필터 이후 결과가 비어 있고 조회 실패가 있으면
 * {@link AggregateShopException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultShopManager implements ShopManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultShopManager.class);

    private final MetadataIndex metadataIndex;
    private final StoreHandleRegistry registry;
    private final ShopCache cache;
    private final ConcurrentShopFetcher fetcher;
    private final ShopManagerConfig config;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * 기본 설정 생성자.
     */
    public DefaultShopManager(DocumentStore documentStore, MetadataIndex metadataIndex) {
        this(documentStore, metadataIndex, new ShopManagerConfig(), Clock.systemUTC());
    }

    /**
     * 생성자 (설정과 시계 주입).
     *
     * @param documentStore 백엔드 저장소
     * @param metadataIndex 메타데이터 인덱스
     * @param config 설정
     * @param clock 시계 (created/updated, TTL)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultShopManager(
        DocumentStore documentStore,
        MetadataIndex metadataIndex,
        ShopManagerConfig config,
        Clock clock
    ) {
        this(
            metadataIndex,
            new StoreHandleRegistry(
                documentStore, metadataIndex, requireClock(clock), requireConfig(config).loadDepth(), config.namespacePrefix()),
            new ShopCache(config.cache(), clock),
            new ConcurrentShopFetcher(config.listingConcurrency()),
            config,
            clock
        );
    }

    /**
     * 생성자 (구성 요소 직접 주입).
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultShopManager(
        MetadataIndex metadataIndex,
        StoreHandleRegistry registry,
        ShopCache cache,
        ConcurrentShopFetcher fetcher,
        ShopManagerConfig config,
        Clock clock
    ) {
        if (metadataIndex == null) {
            throw new IllegalArgumentException("metadataIndex cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.metadataIndex = metadataIndex;
        this.registry = registry;
        this.cache = cache;
        this.fetcher = fetcher;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void start() {
        ensureOpen();
        try {
            ReconnectSummary summary = registry.reconnectAll();
            log.info("Shop manager started: {} stores reconnected, {} skipped",
                summary.reconnected(), summary.skipped());
        } catch (ShopStoreException e) {
            log.warn("Shop manager started with no reconnected stores", e);
        }
    }

    @Override
    public ShopRecord getShop(ShopId shopId) {
        requireShopId(shopId);
        ensureOpen();

        Optional<ShopRecord> cached = cache.get(shopId);
        if (cached.isPresent()) {
            return cached.get();
        }

        metadataIndex.find(shopId).orElseThrow(() -> new ShopNotFoundException(shopId.getValue()));
        DocumentHandle handle = registry.getOrCreate(shopId);
        ShopDocument document = findDocument(shopId, handle)
            .orElseThrow(() -> new ShopNotFoundException(shopId.getValue(), "shop data not found: " + shopId));

        ShopRecord record = ShopDocumentMapper.toRecord(document);
        record.setStorageAddress(handle.address());
        cache.put(shopId, record);
        return record;
    }

    @Override
    public ShopRecord createShop(ShopRecord record) {
        ShopId shopId = ShopRecordValidator.validate(record);
        ensureOpen();

        DocumentHandle handle = registry.getOrCreate(shopId);
        if (findDocument(shopId, handle).isPresent()) {
            throw new ShopAlreadyExistsException(shopId.getValue());
        }
        ShopRecord saved = write(shopId, handle, record, clock.instant());
        log.info("Created shop {} for owner {}", shopId, saved.getOwner());
        return saved;
    }

    @Override
    public ShopRecord updateShop(ShopRecord record) {
        ShopId shopId = ShopRecordValidator.validate(record);
        ensureOpen();

        if (metadataIndex.find(shopId).isEmpty()) {
            throw new ShopNotFoundException(shopId.getValue());
        }
        DocumentHandle handle = registry.getOrCreate(shopId);
        ShopDocument existing = findDocument(shopId, handle)
            .orElseThrow(() -> new ShopNotFoundException(shopId.getValue(), "shop data not found: " + shopId));

        ShopRecord saved = write(shopId, handle, record, existing.created());
        log.debug("Updated shop {}", shopId);
        return saved;
    }

    @Override
    public ShopRecord saveShop(ShopRecord record) {
        ShopId shopId = ShopRecordValidator.validate(record);
        ensureOpen();

        DocumentHandle handle = registry.getOrCreate(shopId);
        Instant created = findDocument(shopId, handle)
            .map(ShopDocument::created)
            .orElseGet(clock::instant);
        return write(shopId, handle, record, created);
    }

    @Override
    public void deleteShop(ShopId shopId) {
        requireShopId(shopId);
        ensureOpen();

        if (metadataIndex.find(shopId).isEmpty()) {
            throw new ShopNotFoundException(shopId.getValue());
        }
        DocumentHandle handle = registry.getOrCreate(shopId);
        for (ShopDocument document : queryShop(shopId, handle)) {
            deleteDocument(shopId, handle, DocumentRef.ofKey(document.id()));
        }
        cache.invalidate(shopId);

        try {
            registry.close(shopId);
        } catch (ShopStoreException e) {
            log.warn("Failed to close store for deleted shop {}", shopId, e);
        }
        metadataIndex.delete(shopId);
        log.info("Deleted shop {}", shopId);
    }

    @Override
    public List<ShopRecord> listShops(ListShopsOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        ensureOpen();

        List<ShopId> shopIds = metadataIndex.listIds();
        int offset = options.offset();
        if (offset >= shopIds.size()) {
            return List.of();
        }
        int limit = options.limit() == ListShopsOptions.DEFAULT_LIMIT ? config.defaultListLimit() : options.limit();
        List<ShopId> page = shopIds.subList(offset, offset + Math.min(shopIds.size() - offset, limit));

        FetchResult result = fetcher.fetchAll(page, this::getShop);
        List<ShopRecord> shops = new ArrayList<>(result.records().size());
        for (ShopRecord record : result.records()) {
            if (!options.hasOwnerFilter() || options.owner().equals(record.getOwner())) {
                shops.add(record);
            }
        }

        // 필터 이후 결과가 비어 있고 실패가 하나라도 있으면 집계 예외
        if (shops.isEmpty() && result.hasFailures()) {
            throw new AggregateShopException(
                "failed to list shops: " + result.failures().size() + " of " + page.size() + " fetches failed",
                result.failuresById());
        }
        if (result.hasFailures()) {
            log.warn("Listed {} of {} shops, skipped failures: {}",
                shops.size(), page.size(), result.failures().keySet());
        }
        Comparator<ShopRecord> order = options.sortBy().comparator(options.descending());
        if (order != null) {
            shops.sort(order);
        }
        return shops;
    }

    @Override
    public List<ShopRecord> listShopsByOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new ShopValidationException("owner is required");
        }
        return listShops(new ListShopsOptions().withOwner(owner).withSortBy(SortField.NAME));
    }

    @Override
    public int countShops() {
        ensureOpen();
        return metadataIndex.listIds().size();
    }

    @Override
    public ShopRecord addAsset(ShopId shopId, AssetType type, String ref) {
        requireAsset(type, ref);
        ShopRecord record = getShop(shopId);
        record.getAssets().attach(type, ref);
        return persistAssets(shopId, record);
    }

    @Override
    public ShopRecord removeAsset(ShopId shopId, AssetType type, String ref) {
        requireAsset(type, ref);
        ShopRecord record = getShop(shopId);
        if (!record.getAssets().detach(type, ref)) {
            log.debug("Asset {} {} was not attached to shop {}", type, ref, shopId);
        }
        return persistAssets(shopId, record);
    }

    @Override
    public ShopExport exportShop(ShopId shopId) {
        ShopRecord record = getShop(shopId);
        ShopMetadata metadata = metadataIndex.find(shopId)
            .orElseThrow(() -> new ShopNotFoundException(shopId.getValue()));
        log.info("Exported shop {}", shopId);
        return new ShopExport(ShopDocumentMapper.toDocument(record), metadata);
    }

    @Override
    public ShopRecord importShop(ShopExport export) {
        if (export == null) {
            throw new IllegalArgumentException("export cannot be null");
        }
        ensureOpen();
        ShopDocument document = export.shopData();
        if (!document.hasShopType()) {
            throw new ShopValidationException("export does not contain shop data (type: " + document.type() + ")");
        }
        ShopRecord record = ShopDocumentMapper.toRecord(document);
        ShopId shopId = ShopRecordValidator.validate(record);

        ShopMetadata metadata = export.metadata();
        String preferredAddress = metadata != null && metadata.hasStorageAddress()
            ? metadata.storageAddress()
            : document.storageAddress();

        cache.invalidate(shopId);
        DocumentHandle handle = registry.attach(shopId, preferredAddress);

        Instant now = clock.instant();
        record.setCreated(record.getCreated() != null ? record.getCreated() : now);
        record.setUpdated(record.getUpdated() != null ? record.getUpdated() : now);
        record.setStorageAddress(handle.address());
        putDocument(shopId, handle, ShopDocumentMapper.toDocument(record));
        metadataIndex.save(new ShopMetadata(shopId.getValue(), record.getName(), record.getOwner(), handle.address()));
        cache.invalidate(shopId);

        log.info("Imported shop {} into {}", shopId, handle.address());
        return record;
    }

    @Override
    public ReconnectSummary reconnectAll() {
        ensureOpen();
        return registry.reconnectAll();
    }

    @Override
    public ReconnectSummary reloadAll() {
        ensureOpen();
        return registry.reloadAll();
    }

    @Override
    public void repairStore(ShopId shopId) {
        requireShopId(shopId);
        ensureOpen();
        registry.repair(shopId);
        cache.invalidate(shopId);
    }

    @Override
    public void closeStore(ShopId shopId) {
        requireShopId(shopId);
        cache.invalidate(shopId);
        registry.close(shopId);
    }

    @Override
    public DatabaseStatus databaseStatus(ShopId shopId) {
        requireShopId(shopId);
        Optional<HandleInfo> info = registry.info(shopId);
        Optional<DocumentHandle> handle = registry.find(shopId);
        if (info.isPresent() && handle.isPresent()) {
            return new DatabaseStatus(shopId, info.get().address(), true,
                countDocuments(shopId, handle.get()), info.get().openedAt());
        }
        ShopMetadata metadata = metadataIndex.find(shopId)
            .orElseThrow(() -> new ShopNotFoundException(shopId.getValue()));
        return new DatabaseStatus(shopId, metadata.storageAddress(), false, 0, null);
    }

    @Override
    public DatabaseStats databaseStats() {
        int totalStores = metadataIndex.listIds().size();
        List<HandleInfo> open = registry.snapshot();
        long totalRecords = 0;
        int loaded = 0;
        for (HandleInfo info : open) {
            Optional<DocumentHandle> handle = registry.find(info.shopId());
            if (handle.isEmpty()) {
                continue;
            }
            try {
                totalRecords += countDocuments(info.shopId(), handle.get());
                loaded++;
            } catch (StoreUnavailableException e) {
                log.warn("Skipping store {} in stats: {}", info.shopId(), e.getMessage());
            }
        }
        double average = loaded == 0 ? 0.0 : (double) totalRecords / loaded;
        return new DatabaseStats(totalStores, loaded, totalRecords, average);
    }

    @Override
    public List<HandleInfo> connectedStores() {
        return registry.snapshot();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int closedStores = registry.closeAll();
        cache.clear();
        try {
            fetcher.shutdown(config.shutdownTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping fetch workers");
        }
        log.info("Shop manager closed ({} stores closed)", closedStores);
    }

    private ShopRecord persistAssets(ShopId shopId, ShopRecord record) {
        DocumentHandle handle = registry.getOrCreate(shopId);
        return write(shopId, handle, record, record.getCreated());
    }

    private ShopRecord write(ShopId shopId, DocumentHandle handle, ShopRecord record, Instant created) {
        ShopRecord saved = record.copy();
        saved.setCreated(created);
        saved.setUpdated(clock.instant());
        saved.setStorageAddress(handle.address());

        putDocument(shopId, handle, ShopDocumentMapper.toDocument(saved));
        metadataIndex.save(new ShopMetadata(shopId.getValue(), saved.getName(), saved.getOwner(), handle.address()));
        cache.put(shopId, saved);
        return saved;
    }

    private Optional<ShopDocument> findDocument(ShopId shopId, DocumentHandle handle) {
        List<ShopDocument> documents = queryShop(shopId, handle);
        return documents.isEmpty() ? Optional.empty() : Optional.of(documents.get(0));
    }

    private List<ShopDocument> queryShop(ShopId shopId, DocumentHandle handle) {
        String id = shopId.getValue();
        try {
            return handle.query(document -> document.hasShopType() && id.equals(document.id()));
        } catch (DocumentStoreException e) {
            throw new StoreUnavailableException("failed to query store for shop " + shopId, e);
        }
    }

    private void putDocument(ShopId shopId, DocumentHandle handle, ShopDocument document) {
        try {
            handle.put(document);
        } catch (DocumentStoreException e) {
            throw new StoreUnavailableException("failed to write shop " + shopId, e);
        }
    }

    private void deleteDocument(ShopId shopId, DocumentHandle handle, DocumentRef ref) {
        try {
            handle.delete(ref);
        } catch (DocumentStoreException e) {
            throw new StoreUnavailableException("failed to delete shop " + shopId, e);
        }
    }

    private int countDocuments(ShopId shopId, DocumentHandle handle) {
        try {
            return handle.query(ShopDocument::hasShopType).size();
        } catch (DocumentStoreException e) {
            throw new StoreUnavailableException("failed to count documents for shop " + shopId, e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("shop manager is closed");
        }
    }

    private static void requireShopId(ShopId shopId) {
        if (shopId == null) {
            throw new IllegalArgumentException("shopId cannot be null");
        }
    }

    private static void requireAsset(AssetType type, String ref) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (ref == null || ref.isBlank()) {
            throw new ShopValidationException("asset reference is required");
        }
    }

    private static Clock requireClock(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return clock;
    }

    private static ShopManagerConfig requireConfig(ShopManagerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
