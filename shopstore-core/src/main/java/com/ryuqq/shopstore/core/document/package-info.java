/**
 * Backend document boundary.
 *
 * <p>{@link com.ryuqq.shopstore.core.document.ShopDocument} is the only shape written to or read from
 * a {@link com.ryuqq.shopstore.core.spi.DocumentHandle}. Conversion happens in
 * {@link com.ryuqq.shopstore.core.document.ShopDocumentMapper} and nowhere else.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.shopstore.core.document;
