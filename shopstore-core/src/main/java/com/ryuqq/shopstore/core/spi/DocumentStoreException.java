package com.ryuqq.shopstore.core.spi;

/**
 * Failure raised by a {@link DocumentStore} or {@link DocumentHandle} implementation.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
