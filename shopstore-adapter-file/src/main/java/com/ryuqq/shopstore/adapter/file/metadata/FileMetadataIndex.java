package com.ryuqq.shopstore.adapter.file.metadata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.shopstore.adapter.file.json.ShopStoreJson;
import com.ryuqq.shopstore.core.exception.MetadataAccessException;
import com.ryuqq.shopstore.core.exception.ShopValidationException;
import com.ryuqq.shopstore.core.model.ShopId;
import com.ryuqq.shopstore.core.model.ShopMetadata;
import com.ryuqq.shopstore.core.spi.MetadataIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * File-based implementation of {@link MetadataIndex}.
 *
 * <p>One JSON file per shop, {@code {directory}/{id}-metadata.json}:</p>
 * <pre>
 * {
 *   "id" : "alice-shop",
 *   "name" : "Alice's Goods",
 *   "owner" : "0xABC",
 *   "storageAddress" : "/inmemory/.../shop-alice-shop"
 * }
 * </pre>
 *
 * <p><strong>Implementation Notes:</strong></p>
 * <ul>
 *   <li>Writes go to a temporary file first and are moved into place, so readers never see a partial file</li>
 *   <li>A {@link ReentrantReadWriteLock} serializes writers against readers within this process</li>
 *   <li>{@link #listIds()} scans the directory only and never opens a file; names that are not valid
 *       shop ids are skipped with a warning</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FileMetadataIndex implements MetadataIndex {

    private static final Logger log = LoggerFactory.getLogger(FileMetadataIndex.class);

    static final String FILE_SUFFIX = "-metadata.json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public FileMetadataIndex(Path directory) {
        this(directory, ShopStoreJson.newObjectMapper());
    }

    /**
     * 생성자. 디렉터리가 없으면 만듭니다.
     *
     * @param directory 메타데이터 디렉터리
     * @param objectMapper JSON 매퍼
     * @throws MetadataAccessException 디렉터리를 만들 수 없는 경우
     */
    public FileMetadataIndex(Path directory, ObjectMapper objectMapper) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.directory = directory;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new MetadataAccessException("failed to create metadata directory " + directory, e);
        }
    }

    @Override
    public void save(ShopMetadata metadata) {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        ShopId shopId = ShopId.of(metadata.id());
        Path target = pathOf(shopId);

        lock.writeLock().lock();
        try {
            Path temp = Files.createTempFile(directory, shopId.getValue() + "-", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), metadata);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new MetadataAccessException("failed to save metadata for shop " + shopId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<ShopMetadata> find(ShopId shopId) {
        if (shopId == null) {
            throw new IllegalArgumentException("shopId cannot be null");
        }
        Path path = pathOf(shopId);

        lock.readLock().lock();
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), ShopMetadata.class));
        } catch (FileNotFoundException | NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new MetadataAccessException("failed to read metadata for shop " + shopId, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void delete(ShopId shopId) {
        if (shopId == null) {
            throw new IllegalArgumentException("shopId cannot be null");
        }
        lock.writeLock().lock();
        try {
            Files.deleteIfExists(pathOf(shopId));
        } catch (IOException e) {
            throw new MetadataAccessException("failed to delete metadata for shop " + shopId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ShopId> listIds() {
        List<ShopId> ids = new ArrayList<>();
        lock.readLock().lock();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(FILE_SUFFIX))
                .forEach(name -> {
                    String id = name.substring(0, name.length() - FILE_SUFFIX.length());
                    try {
                        ids.add(ShopId.of(id));
                    } catch (ShopValidationException e) {
                        log.warn("Skipping metadata file with invalid shop id: {}", name);
                    }
                });
        } catch (IOException e) {
            throw new MetadataAccessException("failed to list metadata directory " + directory, e);
        } finally {
            lock.readLock().unlock();
        }
        ids.sort(null);
        return ids;
    }

    public Path directory() {
        return directory;
    }

    Path pathOf(ShopId shopId) {
        return directory.resolve(shopId.getValue() + FILE_SUFFIX);
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
