package com.ryuqq.shopstore.adapter.inmemory.store;

import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopMetadata;
import com.ryuqq.shopstore.core.spi.MetadataIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link MetadataIndex} for testing and reference purposes.
 *
 * <p>Backed by a {@link ConcurrentSkipListMap}, so {@link #listIds()} is sorted by id without an
 * extra sort, matching the directory-order listing of the file adapter.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMetadataIndex implements MetadataIndex {

    private final ConcurrentSkipListMap<ShopId, ShopMetadata> entries = new ConcurrentSkipListMap<>();

    /**
     * {@inheritDoc}
     *
     * @throws com.ryuqq.shopstore.core.exception.ShopValidationException if the id is invalid
     */
    @Override
    public void save(ShopMetadata metadata) {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        entries.put(ShopId.of(metadata.id()), metadata);
    }

    @Override
    public Optional<ShopMetadata> find(ShopId shopId) {
        if (shopId == null) {
            throw new IllegalArgumentException("shopId cannot be null");
        }
        return Optional.ofNullable(entries.get(shopId));
    }

    @Override
    public void delete(ShopId shopId) {
        if (shopId == null) {
            throw new IllegalArgumentException("shopId cannot be null");
        }
        entries.remove(shopId);
    }

    @Override
    public List<ShopId> listIds() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Clears all entries. Intended for test isolation.
     */
    public void clear() {
        entries.clear();
    }
}
