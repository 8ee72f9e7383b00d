package win.ixuni.gcsmock.core.api;

import reactor.core.publisher.Mono;
import win.ixuni.gcsmock.core.model.DownloadOptions;
import win.ixuni.gcsmock.core.model.ObjectMetadata;
import win.ixuni.gcsmock.core.model.SaveOptions;
import win.ixuni.gcsmock.core.model.SignedUrlConfig;

import java.nio.charset.StandardCharsets;

/**
 * File operations that go through fault injection, one per {@link MockableMethod}
 * <p>
 * All operations are lazy: nothing happens until the returned publisher is subscribed.
 */
public interface MockableFileOperations {

    /**
     * Delete the file
     *
     * @return completion signal, fails with ObjectNotFoundException if the file does not exist
     */
    Mono<Void> delete();

    /**
     * Check whether the file exists
     *
     * @return true if the file exists
     */
    Mono<Boolean> exists();

    /**
     * Download the file contents
     *
     * @param options download options, may be {@code null}
     * @return file contents
     */
    Mono<byte[]> download(DownloadOptions options);

    default Mono<byte[]> download() {
        return download(null);
    }

    /**
     * 生成签名 URL
     *
     * @param config signed URL configuration
     * @return signed URL
     */
    Mono<String> getSignedUrl(SignedUrlConfig config);

    /**
     * Store the given contents, creating the file if needed
     *
     * @param data    new contents
     * @param options save options, may be {@code null}
     * @return completion signal
     */
    Mono<Void> save(byte[] data, SaveOptions options);

    default Mono<Void> save(byte[] data) {
        return save(data, null);
    }

    default Mono<Void> save(String data) {
        return save(data.getBytes(StandardCharsets.UTF_8), null);
    }

    default Mono<Void> save(String data, SaveOptions options) {
        return save(data.getBytes(StandardCharsets.UTF_8), options);
    }

    /**
     * Merge the given metadata into the stored metadata
     *
     * @param metadata metadata to merge
     * @return the merged metadata
     */
    Mono<ObjectMetadata> setMetadata(ObjectMetadata metadata);

    /**
     * Get the stored metadata
     *
     * @return stored metadata
     */
    Mono<ObjectMetadata> getMetadata();
}
