package com.ryuqq.shopstore.core.spi;

/**
 * Reference to a document inside one store.
 *
 * @param key document key ({@code ShopDocument.id})
 * @param revision revision assigned by the store on put, 0 when unknown
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DocumentRef(String key, long revision) {

    public DocumentRef {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    /**
     * Reference by key only, used for deletes.
     */
    public static DocumentRef ofKey(String key) {
        return new DocumentRef(key, 0L);
    }
}
