package com.ryuqq.shopstore.testkit.contract;

import com.ryuqq.shopstore.adapter.inmemory.store.InMemoryDocumentStore;
import com.ryuqq.shopstore.adapter.inmemory.store.InMemoryMetadataIndex;
import com.ryuqq.shopstore.adapter.manager.DefaultShopManager;
import com.ryuqq.shopstore.adapter.manager.ShopManagerConfig;
import com.ryuqq.shopstore.application.cache.ShopCacheConfig;
import com.ryuqq.shopstore.application.manager.ShopManager;
import com.ryuqq.shopstore.core.exception.ShopNotFoundException;
import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopRecord;
import com.ryuqq.shopstore.core.spi.MetadataIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Wires a {@link DefaultShopManager} over in-memory backends and a manually advanced clock,
 * and provides helpers for the scenarios the contract tests share.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryDocumentStore: document backend with fault injection (corrupt / heal / discard)</li>
 *   <li>MetadataIndex: in-memory by default, overridable via {@link #newMetadataIndex()}</li>
 *   <li>MutableClock: starts at {@link #T0}, moves only when advanced</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         createShop("alice-shop", "0xABC", "Alice's Goods");
 *         expireCache();
 *
 *         assertShopName("alice-shop", "Alice's Goods");
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    /** Initial clock instant for every test. */
    protected static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    protected InMemoryDocumentStore documentStore;
    protected MetadataIndex metadataIndex;
    protected MutableClock clock;
    protected ShopManager manager;

    /**
     * Creates fresh backends and a started manager before each test.
     */
    @BeforeEach
    void setUp() {
        documentStore = new InMemoryDocumentStore();
        metadataIndex = newMetadataIndex();
        clock = new MutableClock(T0);
        manager = newManager();
        manager.start();
    }

    /**
     * Closes the manager and drops all backend state.
     */
    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
        if (documentStore != null) {
            documentStore.clear();
        }
    }

    /**
     * Metadata index used by the manager. Subclasses override to test other implementations.
     */
    protected MetadataIndex newMetadataIndex() {
        return new InMemoryMetadataIndex();
    }

    /**
     * Manager configuration. Defaults to a 5 minute TTL and 100 cache entries.
     */
    protected ShopManagerConfig config() {
        return new ShopManagerConfig().withCache(new ShopCacheConfig(Duration.ofMinutes(5), 100));
    }

    /**
     * Simulates a process restart: closes the manager and starts a new one over the same backends.
     */
    protected void restartManager() {
        manager.close();
        manager = newManager();
        manager.start();
    }

    /**
     * Advances the clock past the cache TTL so the next read goes to the backend.
     */
    protected void expireCache() {
        clock.advance(config().cache().ttl().plusSeconds(1));
    }

    protected ShopRecord createShop(String id, String owner, String name) {
        return manager.createShop(ShopRecord.of(id, owner, name));
    }

    protected String storageAddressOf(String id) {
        return manager.getShop(ShopId.of(id)).getStorageAddress();
    }

    protected void assertShopName(String id, String expectedName) {
        ShopRecord shop = manager.getShop(ShopId.of(id));
        assertEquals(expectedName, shop.getName(),
                String.format("Expected name %s but was %s for shop: %s", expectedName, shop.getName(), id));
    }

    protected void assertShopNotFound(String id) {
        assertThrows(ShopNotFoundException.class, () -> manager.getShop(ShopId.of(id)),
                String.format("Expected shop %s to be absent", id));
    }

    protected void assertStoreOpen(String id) {
        assertTrue(isStoreOpen(id), String.format("Expected store for shop %s to be open", id));
    }

    protected void assertStoreClosed(String id) {
        assertFalse(isStoreOpen(id), String.format("Expected store for shop %s to be closed", id));
    }

    private boolean isStoreOpen(String id) {
        return manager.connectedStores().stream()
                .anyMatch(info -> info.shopId().getValue().equals(id));
    }

    private ShopManager newManager() {
        return new DefaultShopManager(documentStore, metadataIndex, config(), clock);
    }
}
