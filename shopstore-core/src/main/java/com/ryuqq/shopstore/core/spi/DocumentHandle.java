package com.ryuqq.shopstore.core.spi;

import com.ryuqq.shopstore.core.document.ShopDocument;

import java.util.List;
import java.util.function.Predicate;

/**
 * Handle to one open document store.
 *
 * <p>Documents are keyed by {@link ShopDocument#id()}; putting a document with an existing id replaces it.
 * After {@link #close()} every other method fails with {@link DocumentStoreException}.</p>
 *
 * <p>Blocking calls honour thread interruption where the engine supports it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DocumentHandle {

    /** Load everything, i.e. the full history. */
    int FULL_DEPTH = -1;

    /**
     * Stable address of this store.
     */
    String address();

    /**
     * Loads persisted state into memory.
     *
     * @param depth number of entries to load, or {@link #FULL_DEPTH}
     */
    void load(int depth);

    /**
     * Writes (inserts or replaces) a document.
     *
     * @return reference to the written document
     */
    DocumentRef put(ShopDocument document);

    /**
     * Returns every document matching the predicate, in unspecified order.
     */
    List<ShopDocument> query(Predicate<ShopDocument> predicate);

    /**
     * Deletes a document. Deleting an absent key is a no-op.
     */
    void delete(DocumentRef ref);

    /**
     * Closes the handle and releases its resources.
     */
    void close();
}
