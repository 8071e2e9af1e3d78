package com.ryuqq.shopstore.core.spi;

/**
 * Document Store SPI.
 *
 * <p>Entry point to the per-shop document database engine. Each shop owns one independent store,
 * identified by an opaque address that the engine assigns on creation.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: may be called concurrently for different addresses</li>
 *   <li>Failures are reported as {@link DocumentStoreException}</li>
 *   <li>Returned handles are not loaded; callers invoke {@link DocumentHandle#load(int)}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DocumentStore {

    /**
     * Opens an existing store.
     *
     * @param address address previously returned by {@link DocumentHandle#address()}
     * @return a new, unloaded handle
     * @throws DocumentStoreException if no store exists at the address or it cannot be opened
     */
    default DocumentHandle open(String address) {
        return open(address, false);
    }

    /**
     * Opens a store, optionally recreating an empty one when nothing exists at the address.
     *
     * <p>{@code createIfMissing=true} is used by repair to recover from lost local state.</p>
     *
     * @param address store address
     * @param createIfMissing whether to create an empty store at the address
     * @return a new, unloaded handle
     * @throws DocumentStoreException if the store cannot be opened
     */
    DocumentHandle open(String address, boolean createIfMissing);

    /**
     * Creates a new store.
     *
     * @param namespace logical name, e.g. {@code shop-alice-shop}
     * @return a handle to the new store, whose {@link DocumentHandle#address()} is stable
     * @throws DocumentStoreException if creation fails
     */
    DocumentHandle create(String namespace);
}
