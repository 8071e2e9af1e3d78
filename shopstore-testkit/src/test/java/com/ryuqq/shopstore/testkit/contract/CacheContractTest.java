package com.ryuqq.shopstore.testkit.contract;

import com.ryuqq.shopstore.adapter.manager.ShopManagerConfig;
import com.ryuqq.shopstore.application.cache.ShopCacheConfig;
import com.ryuqq.shopstore.core.exception.StoreUnavailableException;
import com.ryuqq.shopstore.core.model.AssetType;
import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the read cache as seen through the manager.
 *
 * <p>The backend is corrupted after caching so that a successful read proves a cache hit
 * and a failing read proves a miss.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Isolation: callers never share mutable state with the cache</li>
 *   <li>TTL: entries are served until the TTL passes, then reloaded</li>
 *   <li>Capacity: inserting past capacity evicts the least recently accessed entry</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CacheContractTest extends AbstractContractTest {

    @Override
    protected ShopManagerConfig config() {
        return new ShopManagerConfig().withCache(new ShopCacheConfig(Duration.ofMinutes(1), 2));
    }

    @Test
    void testIsolation_MutatingInputOrResultDoesNotLeak() {
        // Given
        ShopRecord input = ShopRecord.of("s1", "0x1", "Original");
        manager.createShop(input);

        // When
        input.setName("Changed input");
        ShopRecord result = manager.getShop(ShopId.of("s1"));
        result.setName("Changed result");
        result.getAssets().attach(AssetType.ITEM_IMAGE, "bafy-x");

        // Then
        ShopRecord again = manager.getShop(ShopId.of("s1"));
        assertEquals("Original", again.getName());
        assertTrue(again.getAssets().getItemImageRefs().isEmpty());
    }

    @Test
    void testTtl_ServedFromCacheUntilExpiry() {
        // Given
        ShopRecord created = createShop("s1", "0x1", "Shop");
        documentStore.corrupt(created.getStorageAddress());

        // When: within TTL
        clock.advance(Duration.ofSeconds(59));

        // Then
        assertShopName("s1", "Shop");

        // When: past TTL
        clock.advance(Duration.ofSeconds(2));

        // Then
        assertThrows(StoreUnavailableException.class, () -> manager.getShop(ShopId.of("s1")));
    }

    @Test
    void testTtl_ExpiredEntryIsReloaded() {
        // Given
        createShop("s1", "0x1", "Shop");
        expireCache();

        // When
        ShopRecord reloaded = manager.getShop(ShopId.of("s1"));

        // Then
        assertEquals("Shop", reloaded.getName());
        assertEquals(T0, reloaded.getCreated());
    }

    @Test
    void testCapacity_EvictsLeastRecentlyAccessed() {
        // Given: capacity 2
        ShopRecord a = createShop("a", "0x1", "A");
        ShopRecord b = createShop("b", "0x1", "B");
        clock.advance(Duration.ofSeconds(1));
        manager.getShop(ShopId.of("a"));

        // When: third entry evicts b
        ShopRecord c = createShop("c", "0x1", "C");
        documentStore.corrupt(a.getStorageAddress());
        documentStore.corrupt(b.getStorageAddress());
        documentStore.corrupt(c.getStorageAddress());

        // Then
        assertShopName("a", "A");
        assertShopName("c", "C");
        assertThrows(StoreUnavailableException.class, () -> manager.getShop(ShopId.of("b")));
    }
}
