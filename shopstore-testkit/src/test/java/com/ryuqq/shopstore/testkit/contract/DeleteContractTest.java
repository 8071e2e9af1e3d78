package com.ryuqq.shopstore.testkit.contract;

import com.ryuqq.shopstore.core.exception.ShopNotFoundException;
import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for delete.
 *
 * <p>After a successful delete the shop is not found, its metadata is absent and its
 * store handle is closed, also across restarts.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DeleteContractTest extends AbstractContractTest {

    @Test
    void testDelete_IsTerminal() {
        // Given
        createShop("s1", "0x1", "Shop");
        assertStoreOpen("s1");

        // When
        manager.deleteShop(ShopId.of("s1"));

        // Then
        assertShopNotFound("s1");
        assertTrue(metadataIndex.find(ShopId.of("s1")).isEmpty());
        assertStoreClosed("s1");
    }

    @Test
    void testDelete_StaysDeletedAfterRestart() {
        // Given
        createShop("s1", "0x1", "Shop");
        manager.deleteShop(ShopId.of("s1"));

        // When
        restartManager();

        // Then
        assertShopNotFound("s1");
        assertStoreClosed("s1");
        assertEquals(0, manager.countShops());
    }

    @Test
    void testDelete_Twice_SecondIsNotFound() {
        createShop("s1", "0x1", "Shop");
        manager.deleteShop(ShopId.of("s1"));

        assertThrows(ShopNotFoundException.class, () -> manager.deleteShop(ShopId.of("s1")));
    }

    @Test
    void testDelete_ThenCreateAgain_StartsFresh() {
        // Given
        ShopRecord first = createShop("s1", "0x1", "Old");
        manager.deleteShop(ShopId.of("s1"));
        clock.advance(Duration.ofMinutes(10));

        // When
        ShopRecord second = createShop("s1", "0x2", "New");

        // Then
        assertEquals(T0.plus(Duration.ofMinutes(10)), second.getCreated());
        assertNotEquals(first.getStorageAddress(), second.getStorageAddress());
        assertShopName("s1", "New");
    }

    @Test
    void testDelete_OnlyRemovesTargetShop() {
        // Given
        createShop("s1", "0x1", "One");
        createShop("s2", "0x1", "Two");

        // When
        manager.deleteShop(ShopId.of("s1"));
        expireCache();

        // Then
        assertShopName("s2", "Two");
        assertStoreOpen("s2");
    }
}
