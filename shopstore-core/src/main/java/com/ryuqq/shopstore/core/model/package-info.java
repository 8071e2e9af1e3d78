/**
 * Domain model package.
 *
 * <p>Value objects and the mutable shop entity.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.shopstore.core.model.ShopId} - validated identifier, also used as file and namespace name</li>
 *   <li>{@link com.ryuqq.shopstore.core.model.ShopRecord} - mutable entity with deep {@code copy()}</li>
 *   <li>{@link com.ryuqq.shopstore.core.model.ShopMetadata} - lightweight projection holding the storage address</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.core.model;
