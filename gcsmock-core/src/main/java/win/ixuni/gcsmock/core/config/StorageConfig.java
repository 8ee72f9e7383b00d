package win.ixuni.gcsmock.core.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Storage configuration
 * <p>
 * Generic configuration structure. Implementation-specific settings live in properties.
 */
@Data
public class StorageConfig {

    public static final String SIGNED_URL_ENDPOINT = "signedUrlEndpoint";
    public static final String READ_CHUNK_SIZE = "readChunkSize";
    public static final String URI_SCHEME = "uriScheme";

    public static final String DEFAULT_SIGNED_URL_ENDPOINT = "https://storage.googleapis.com";
    public static final int DEFAULT_READ_CHUNK_SIZE = 64 * 1024;
    public static final String DEFAULT_URI_SCHEME = "gs";

    /**
     * Storage instance name
     */
    private String name = "gcs-mock";

    /**
     * Storage type (memory, ...)
     */
    private String type = "memory";

    /**
     * Implementation-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    public static StorageConfig defaults() {
        return new StorageConfig();
    }

    /**
     * Set a configuration value
     *
     * @return this config
     */
    public StorageConfig property(String key, Object value) {
        properties.put(key, value);
        return this;
    }

    /**
     * Get a string configuration value
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Get an integer configuration value
     */
    public Integer getInt(String key, Integer defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    /**
     * Signed URL endpoint without trailing slash
     */
    public String getSignedUrlEndpoint() {
        String endpoint = getString(SIGNED_URL_ENDPOINT, DEFAULT_SIGNED_URL_ENDPOINT);
        while (endpoint.endsWith("/")) {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }
        return endpoint;
    }

    /**
     * 读取流的分块大小（字节）
     *
     * @throws IllegalArgumentException if the configured size is not positive
     */
    public int getReadChunkSize() {
        int chunkSize = getInt(READ_CHUNK_SIZE, DEFAULT_READ_CHUNK_SIZE);
        if (chunkSize <= 0) {
            throw new IllegalArgumentException(READ_CHUNK_SIZE + " must be positive but was " + chunkSize);
        }
        return chunkSize;
    }

    public String getUriScheme() {
        return getString(URI_SCHEME, DEFAULT_URI_SCHEME);
    }
}
