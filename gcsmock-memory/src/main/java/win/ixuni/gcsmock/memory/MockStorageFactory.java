package win.ixuni.gcsmock.memory;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.gcsmock.core.config.StorageConfig;
import win.ixuni.gcsmock.core.factory.StorageFactory;

/**
 * In-memory storage factory
 */
@Slf4j
public class MockStorageFactory implements StorageFactory {

    public static final String STORAGE_TYPE = "memory";

    @Override
    public String getStorageType() {
        return STORAGE_TYPE;
    }

    @Override
    public MockStorage createStorage(StorageConfig config) {
        log.info("Creating memory storage instance: {}", config.getName());
        return new MockStorage(config);
    }

    @Override
    public String getDescription() {
        return "In-memory storage with per-operation fault injection for tests";
    }
}
