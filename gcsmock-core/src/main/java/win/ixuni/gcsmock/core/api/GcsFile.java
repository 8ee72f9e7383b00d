package win.ixuni.gcsmock.core.api;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.gcsmock.core.model.CopyOptions;
import win.ixuni.gcsmock.core.model.CopyResult;

import java.io.OutputStream;
import java.net.URI;
import java.nio.ByteBuffer;

/**
 * A file (object) inside a bucket
 */
public interface GcsFile extends MockableFileOperations {

    String getName();

    GcsBucket getBucket();

    default GcsBucket getParent() {
        return getBucket();
    }

    GcsStorage getStorage();

    /**
     * @return resource identifier, e.g. {@code gs://bucket/path/to/file}
     */
    URI getCloudStorageUri();

    /**
     * Open a stream whose bytes replace the file contents when it is closed
     *
     * @return writable stream
     */
    OutputStream createWriteStream();

    /**
     * Read the file contents as a single-pass stream
     *
     * @return contents stream
     */
    Flux<ByteBuffer> createReadStream();

    /**
     * Copy this file
     *
     * @param destination a {@link String} name in the same bucket, a {@link GcsBucket} (same name)
     *                    or a {@link GcsFile}
     * @param options     copy options, may be {@code null}
     * @return the destination file and its stored metadata
     */
    Mono<CopyResult> copy(Object destination, CopyOptions options);

    default Mono<CopyResult> copy(String destinationName) {
        return copy(destinationName, null);
    }

    default Mono<CopyResult> copy(GcsBucket destinationBucket) {
        return copy(destinationBucket, null);
    }

    default Mono<CopyResult> copy(GcsFile destinationFile) {
        return copy(destinationFile, null);
    }
}
