package com.ryuqq.shopstore.adapter.inmemory.store;

import com.ryuqq.shopstore.core.document.ShopDocument;
import com.ryuqq.shopstore.core.spi.DocumentHandle;
import com.ryuqq.shopstore.core.spi.DocumentRef;
import com.ryuqq.shopstore.core.spi.DocumentStore;
import com.ryuqq.shopstore.core.spi.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link DocumentStore} SPI for testing and reference purposes.
 *
 * <p>Each created store is an independent {@link ConcurrentHashMap} keyed by document id,
 * addressed as {@code /inmemory/{uuid}/{namespace}}. Store contents outlive handles, so closing and
 * reopening an address sees the same documents, which simulates a process restart.</p>
 *
 * <p><strong>Fault Injection (test helpers):</strong></p>
 * <ul>
 *   <li>{@link #corrupt(String)}: open succeeds, but load and every read/write on that store fail</li>
 *   <li>{@link #heal(String)}: clears corruption</li>
 *   <li>{@link #discard(String)}: drops the store entirely, as if local state was lost;
 *       {@code open(address, true)} recreates it empty</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No persistence, no replication</li>
 *   <li>Load depth is accepted but ignored (everything is always in memory)</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * DocumentStore store = new InMemoryDocumentStore();
 *
 * DocumentHandle handle = store.create("shop-alice-shop");
 * handle.load(DocumentHandle.FULL_DEPTH);
 * handle.put(document);
 *
 * String address = handle.address();
 * handle.close();
 *
 * DocumentHandle reopened = store.open(address);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);
    private static final String ADDRESS_PREFIX = "/inmemory/";

    /**
     * Store contents by address.
     */
    private final ConcurrentHashMap<String, Database> databases = new ConcurrentHashMap<>();

    /**
     * Number of handles opened and not yet closed.
     */
    private final AtomicInteger openHandles = new AtomicInteger();

    /**
     * {@inheritDoc}
     *
     * @throws DocumentStoreException if the address is unknown and {@code createIfMissing} is false
     */
    @Override
    public DocumentHandle open(String address, boolean createIfMissing) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address cannot be null or blank");
        }
        Database database = createIfMissing
            ? databases.computeIfAbsent(address, a -> new Database())
            : databases.get(address);
        if (database == null) {
            throw new DocumentStoreException("no store exists at address " + address);
        }
        return newHandle(address, database);
    }

    @Override
    public DocumentHandle create(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        String address = ADDRESS_PREFIX + UUID.randomUUID() + "/" + namespace;
        Database database = new Database();
        databases.put(address, database);
        log.debug("Created in-memory store {}", address);
        return newHandle(address, database);
    }

    /**
     * Marks a store as corrupted.
     */
    public void corrupt(String address) {
        Database database = databases.get(address);
        if (database == null) {
            throw new IllegalArgumentException("unknown address: " + address);
        }
        database.corrupted = true;
    }

    /**
     * Clears corruption of a store.
     */
    public void heal(String address) {
        Database database = databases.get(address);
        if (database != null) {
            database.corrupted = false;
        }
    }

    /**
     * Drops a store and its documents.
     */
    public void discard(String address) {
        databases.remove(address);
    }

    public boolean exists(String address) {
        return databases.containsKey(address);
    }

    /**
     * Number of documents stored at the address, regardless of open handles.
     */
    public int documentCount(String address) {
        Database database = databases.get(address);
        return database == null ? 0 : database.documents.size();
    }

    public int storeCount() {
        return databases.size();
    }

    public int openHandleCount() {
        return openHandles.get();
    }

    /**
     * Clears all stores. Intended for test isolation.
     */
    public void clear() {
        databases.clear();
        openHandles.set(0);
    }

    private DocumentHandle newHandle(String address, Database database) {
        openHandles.incrementAndGet();
        return new InMemoryDocumentHandle(address, database);
    }

    /**
     * Contents of one store.
     */
    private static final class Database {

        private final ConcurrentHashMap<String, ShopDocument> documents = new ConcurrentHashMap<>();
        private final AtomicLong revision = new AtomicLong();
        private volatile boolean corrupted;
    }

    /**
     * Handle to one {@link Database}.
     */
    private final class InMemoryDocumentHandle implements DocumentHandle {

        private final String address;
        private final Database database;
        private volatile boolean closed;

        private InMemoryDocumentHandle(String address, Database database) {
            this.address = address;
            this.database = database;
        }

        @Override
        public String address() {
            return address;
        }

        @Override
        public void load(int depth) {
            checkUsable();
        }

        @Override
        public DocumentRef put(ShopDocument document) {
            if (document == null) {
                throw new IllegalArgumentException("document cannot be null");
            }
            checkUsable();
            database.documents.put(document.id(), document);
            return new DocumentRef(document.id(), database.revision.incrementAndGet());
        }

        @Override
        public List<ShopDocument> query(Predicate<ShopDocument> predicate) {
            if (predicate == null) {
                throw new IllegalArgumentException("predicate cannot be null");
            }
            checkUsable();
            List<ShopDocument> result = new ArrayList<>();
            for (Map.Entry<String, ShopDocument> entry : database.documents.entrySet()) {
                if (predicate.test(entry.getValue())) {
                    result.add(entry.getValue());
                }
            }
            return result;
        }

        @Override
        public void delete(DocumentRef ref) {
            if (ref == null) {
                throw new IllegalArgumentException("ref cannot be null");
            }
            checkUsable();
            database.documents.remove(ref.key());
            database.revision.incrementAndGet();
        }

        @Override
        public void close() {
            if (closed) {
                throw new DocumentStoreException("handle already closed: " + address);
            }
            closed = true;
            openHandles.decrementAndGet();
        }

        private void checkUsable() {
            if (closed) {
                throw new DocumentStoreException("handle is closed: " + address);
            }
            if (database.corrupted) {
                throw new DocumentStoreException("store is corrupted: " + address);
            }
        }
    }
}
