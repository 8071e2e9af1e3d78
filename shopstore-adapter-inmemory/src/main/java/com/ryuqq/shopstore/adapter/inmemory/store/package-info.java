/**
 * In-memory storage adapters.
 *
 * <p>Reference implementations of {@link com.ryuqq.shopstore.core.spi.DocumentStore} and
 * {@link com.ryuqq.shopstore.core.spi.MetadataIndex} used by tests and the testkit.
 * The document store exposes fault injection helpers (corrupt, heal, discard).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.adapter.inmemory.store;
