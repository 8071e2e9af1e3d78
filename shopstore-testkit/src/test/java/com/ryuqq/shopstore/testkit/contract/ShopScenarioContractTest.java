package com.ryuqq.shopstore.testkit.contract;

import com.ryuqq.shopstore.application.manager.ListShopsOptions;
import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopMetadata;
import com.ryuqq.shopstore.core.model.ShopRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the end-to-end shop scenario.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Create "alice-shop" owned by "0xABC" named "Alice's Goods"</li>
 *   <li>Get returns the same name and owner</li>
 *   <li>Listing filtered by owner "0xABC" returns exactly one record</li>
 *   <li>After delete, get fails with not-found</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ShopScenarioContractTest extends AbstractContractTest {

    @Test
    void testAliceShop_CreateGetListDelete() {
        // Given
        createShop("alice-shop", "0xABC", "Alice's Goods");
        createShop("bob-shop", "0xDEF", "Bob's Tools");

        // When: get
        ShopRecord alice = manager.getShop(ShopId.of("alice-shop"));

        // Then
        assertEquals("Alice's Goods", alice.getName());
        assertEquals("0xABC", alice.getOwner());

        // When: list by owner
        List<ShopRecord> owned = manager.listShops(new ListShopsOptions().withOwner("0xABC"));

        // Then
        assertEquals(1, owned.size());
        assertEquals("alice-shop", owned.get(0).getId());

        // When: delete
        manager.deleteShop(ShopId.of("alice-shop"));

        // Then
        assertShopNotFound("alice-shop");
        assertEquals(1, manager.countShops());
    }

    @Test
    void testAliceShop_MetadataHoldsNameOwnerAndAddress() {
        // When
        ShopRecord created = createShop("alice-shop", "0xABC", "Alice's Goods");

        // Then
        ShopMetadata metadata = metadataIndex.find(ShopId.of("alice-shop")).orElseThrow();
        assertEquals("alice-shop", metadata.id());
        assertEquals("Alice's Goods", metadata.name());
        assertEquals("0xABC", metadata.owner());
        assertEquals(created.getStorageAddress(), metadata.storageAddress());
        assertTrue(documentStore.exists(metadata.storageAddress()));
    }

    @Test
    void testAliceShop_SurvivesRestart() {
        // Given
        createShop("alice-shop", "0xABC", "Alice's Goods");

        // When
        restartManager();

        // Then
        assertStoreOpen("alice-shop");
        assertShopName("alice-shop", "Alice's Goods");
        assertEquals(T0, manager.getShop(ShopId.of("alice-shop")).getCreated());
    }
}
