/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete storage for the shop layer.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.shopstore.core.spi.DocumentStore} - open/create per-shop document stores</li>
 *   <li>{@link com.ryuqq.shopstore.core.spi.DocumentHandle} - load/put/query/delete/close on one store</li>
 *   <li>{@link com.ryuqq.shopstore.core.spi.MetadataIndex} - shop id → name, owner, storage address</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (shopstore-adapter-inmemory, shopstore-adapter-file) provide implementations.
 * The core depends on no infrastructure library.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.shopstore.core.spi;
