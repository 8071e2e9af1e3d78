package com.ryuqq.shopstore.core.spi;

import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Metadata Index SPI.
 *
 * <p>Stores one {@link ShopMetadata} per shop, separate from the heavy document data, so that
 * enumeration and address lookup never touch a document store.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe</li>
 *   <li>{@link #save(ShopMetadata)} overwrites unconditionally</li>
 *   <li>Absence is not an error: {@link #find(ShopId)} returns empty, {@link #delete(ShopId)} is a no-op</li>
 *   <li>I/O failures raise {@link com.ryuqq.shopstore.core.exception.MetadataAccessException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MetadataIndex {

    /**
     * Saves (overwrites) metadata.
     *
     * @throws com.ryuqq.shopstore.core.exception.ShopValidationException if the id is invalid
     */
    void save(ShopMetadata metadata);

    /**
     * Looks up metadata.
     *
     * @return the metadata, or empty if none was ever saved
     */
    Optional<ShopMetadata> find(ShopId shopId);

    /**
     * Removes metadata. Missing entries are ignored.
     */
    void delete(ShopId shopId);

    /**
     * Enumerates every shop id, sorted ascending.
     */
    List<ShopId> listIds();
}
