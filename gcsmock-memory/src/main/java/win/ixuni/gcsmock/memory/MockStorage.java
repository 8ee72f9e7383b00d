package win.ixuni.gcsmock.memory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.gcsmock.core.api.GcsStorage;
import win.ixuni.gcsmock.core.config.StorageConfig;
import win.ixuni.gcsmock.core.io.FileTransfer;
import win.ixuni.gcsmock.core.io.NioFileTransfer;
import win.ixuni.gcsmock.core.util.StorageValidationUtils;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memory 存储
 * <p>
 * In-memory replacement for the storage client. Buckets are created on first access and
 * live as long as this instance.
 */
@Slf4j
public class MockStorage implements GcsStorage {

    @Getter
    private final StorageConfig config;

    @Getter
    private final FileTransfer fileTransfer;

    private final Map<String, MockBucket> buckets = new ConcurrentHashMap<>();

    public MockStorage() {
        this(StorageConfig.defaults());
    }

    public MockStorage(StorageConfig config) {
        this(config, new NioFileTransfer());
    }

    public MockStorage(StorageConfig config, FileTransfer fileTransfer) {
        this.config = Objects.requireNonNull(config, "config");
        this.fileTransfer = Objects.requireNonNull(fileTransfer, "fileTransfer");
        // rejects a non-positive readChunkSize
        config.getReadChunkSize();
        log.debug("Initialized mock storage: {}", config.getName());
    }

    @Override
    public MockBucket bucket(String name) {
        String error = StorageValidationUtils.validateBucketName(name);
        if (error != null) {
            throw new IllegalArgumentException(error);
        }
        return buckets.computeIfAbsent(name, bucketName -> {
            log.info("[{}] Created bucket: {}", config.getName(), bucketName);
            return new MockBucket(this, bucketName);
        });
    }

    /**
     * @return read-only view of the buckets created so far
     */
    public Map<String, MockBucket> getBuckets() {
        return Collections.unmodifiableMap(buckets);
    }
}
