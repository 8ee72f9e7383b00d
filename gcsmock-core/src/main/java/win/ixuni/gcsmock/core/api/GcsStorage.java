package win.ixuni.gcsmock.core.api;

/**
 * Storage client: entry point handing out buckets
 */
public interface GcsStorage {

    /**
     * Get a bucket handle
     *
     * @param name bucket name
     * @return bucket handle
     */
    GcsBucket bucket(String name);
}
