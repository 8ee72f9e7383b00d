package win.ixuni.gcsmock.core.factory;

import win.ixuni.gcsmock.core.api.GcsStorage;
import win.ixuni.gcsmock.core.config.StorageConfig;

/**
 * Storage factory interface
 * <p>
 * Each storage implementation provides a factory that creates instances from configuration.
 */
public interface StorageFactory {

    /**
     * Get the storage type supported by this factory
     *
     * @return storage type identifier (e.g. "memory")
     */
    String getStorageType();

    /**
     * Create a storage instance from configuration
     *
     * @param config storage configuration
     * @return storage instance
     */
    GcsStorage createStorage(StorageConfig config);

    /**
     * Get the factory description
     *
     * @return description text
     */
    default String getDescription() {
        return getStorageType() + " storage";
    }
}
