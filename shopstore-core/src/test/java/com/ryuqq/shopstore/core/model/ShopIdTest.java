package com.ryuqq.shopstore.core.model;

import com.ryuqq.shopstore.core.exception.ErrorCode;
import com.ryuqq.shopstore.core.exception.ShopValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ShopId Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ShopIdTest {

    @Test
    void of_ValidValue_CreatesShopId() {
        // Given
        String value = "alice-shop";

        // When
        ShopId shopId = ShopId.of(value);

        // Then
        assertNotNull(shopId);
        assertEquals(value, shopId.getValue());
        assertEquals(value, shopId.toString());
    }

    @Test
    void of_WalletStyleValue_CreatesShopId() {
        // When
        ShopId shopId = ShopId.of("0xABC_store");

        // Then
        assertEquals("0xABC_store", shopId.getValue());
    }

    @Test
    void of_NullValue_ThrowsValidationException() {
        // When & Then
        ShopValidationException exception = assertThrows(
            ShopValidationException.class,
            () -> ShopId.of(null)
        );
        assertEquals(ErrorCode.INVALID_INPUT, exception.getErrorCode());
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsValidationException() {
        assertThrows(ShopValidationException.class, () -> ShopId.of("   "));
    }

    @Test
    void of_PathTraversal_ThrowsValidationException() {
        // When & Then
        ShopValidationException exception = assertThrows(
            ShopValidationException.class,
            () -> ShopId.of("../etc/passwd")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_DotInValue_ThrowsValidationException() {
        assertThrows(ShopValidationException.class, () -> ShopId.of("shop.v2"));
    }

    @Test
    void of_TooLong_ThrowsValidationException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        ShopValidationException exception = assertThrows(
            ShopValidationException.class,
            () -> ShopId.of(value)
        );
        assertTrue(exception.getMessage().contains("255"));
    }

    @Test
    void of_MaxLength_CreatesShopId() {
        assertEquals(255, ShopId.of("a".repeat(255)).getValue().length());
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        ShopId shopId1 = ShopId.of("shop-1");
        ShopId shopId2 = ShopId.of("shop-1");

        // Then
        assertEquals(shopId1, shopId2);
        assertEquals(shopId1.hashCode(), shopId2.hashCode());
    }

    @Test
    void compareTo_OrdersLexicographically() {
        assertTrue(ShopId.of("a-shop").compareTo(ShopId.of("b-shop")) < 0);
        assertEquals(0, ShopId.of("a-shop").compareTo(ShopId.of("a-shop")));
    }

    @Test
    void slugOf_StripsPunctuationAndHyphenatesSpaces() {
        assertEquals("alices-goods", ShopId.slugOf("Alice's Goods"));
    }

    @Test
    void slugOf_CollapsesAndTrimsHyphens() {
        assertEquals("bobs-bits", ShopId.slugOf("  Bob's -- Bits!  "));
    }

    @Test
    void slugOf_NullOrSymbolsOnly_ReturnsEmpty() {
        assertEquals("", ShopId.slugOf(null));
        assertEquals("", ShopId.slugOf("!!!"));
    }
}
