package win.ixuni.gcsmock.core.api;

import reactor.core.publisher.Mono;
import win.ixuni.gcsmock.core.model.GetFilesOptions;
import win.ixuni.gcsmock.core.model.UploadOptions;
import win.ixuni.gcsmock.core.model.UploadResult;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * A bucket: namespace of files
 */
public interface GcsBucket {

    String getName();

    GcsStorage getStorage();

    /**
     * Get a file handle; does not create the file
     *
     * @param name file name
     * @return file handle
     */
    GcsFile file(String name);

    /**
     * Upload a local file
     *
     * @param source  local file to read
     * @param options upload options, may be {@code null}
     * @return uploaded file and its metadata
     */
    Mono<UploadResult> upload(Path source, UploadOptions options);

    default Mono<UploadResult> upload(Path source) {
        return upload(source, null);
    }

    /**
     * List existing files
     *
     * @param query prefix filter, may be {@code null}
     * @return matching files in creation order
     */
    Mono<List<GcsFile>> getFiles(GetFilesOptions query);

    default Mono<List<GcsFile>> getFiles() {
        return getFiles(null);
    }

    /**
     * 按前缀批量删除
     *
     * @param query prefix filter, may be {@code null}
     * @return completion signal
     */
    Mono<Void> deleteFiles(GetFilesOptions query);

    default Mono<Void> deleteFiles() {
        return deleteFiles(null);
    }

    /**
     * @return resource identifier, e.g. {@code gs://bucket}
     */
    URI getCloudStorageUri();
}
