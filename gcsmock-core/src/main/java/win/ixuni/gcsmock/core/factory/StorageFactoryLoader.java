package win.ixuni.gcsmock.core.factory;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Storage factory loader
 * <p>
 * Uses Java SPI (ServiceLoader) to discover StorageFactory implementations on the classpath.
 * Implementations declare themselves in META-INF/services.
 * <p>
 * Usage example:
 *
 * <pre>
 * GcsStorage storage = StorageFactoryLoader.find("memory")
 *         .orElseThrow()
 *         .createStorage(StorageConfig.defaults());
 * </pre>
 */
@Slf4j
public final class StorageFactoryLoader {

    private StorageFactoryLoader() {
        // Utility class, not instantiable
    }

    /**
     * Load all StorageFactory implementations via SPI
     *
     * @return list of discovered factories
     */
    public static List<StorageFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Load all StorageFactory implementations via SPI
     *
     * @param classLoader class loader
     * @return list of discovered factories
     */
    public static List<StorageFactory> load(ClassLoader classLoader) {
        ServiceLoader<StorageFactory> loader = ServiceLoader.load(StorageFactory.class, classLoader);
        List<StorageFactory> factories = new ArrayList<>();

        for (StorageFactory factory : loader) {
            factories.add(factory);
            log.debug("Discovered storage factory via SPI: {} - {}",
                    factory.getStorageType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No StorageFactory implementations found via SPI");
        }

        return Collections.unmodifiableList(factories);
    }

    /**
     * Find the factory for a storage type
     *
     * @param storageType storage type, e.g. "memory"
     * @return the factory, empty if none is registered
     */
    public static Optional<StorageFactory> find(String storageType) {
        return load().stream()
                .filter(factory -> factory.getStorageType().equals(storageType))
                .findFirst();
    }
}
