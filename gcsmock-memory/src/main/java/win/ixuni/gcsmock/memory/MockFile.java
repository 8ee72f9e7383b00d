package win.ixuni.gcsmock.memory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.gcsmock.core.api.GcsBucket;
import win.ixuni.gcsmock.core.api.GcsFile;
import win.ixuni.gcsmock.core.api.MockableMethod;
import win.ixuni.gcsmock.core.exception.GcsMockException;
import win.ixuni.gcsmock.core.exception.InvalidDestinationException;
import win.ixuni.gcsmock.core.exception.ObjectNotFoundException;
import win.ixuni.gcsmock.core.model.CopyOptions;
import win.ixuni.gcsmock.core.model.CopyResult;
import win.ixuni.gcsmock.core.model.DownloadOptions;
import win.ixuni.gcsmock.core.model.ObjectMetadata;
import win.ixuni.gcsmock.core.model.SaveOptions;
import win.ixuni.gcsmock.core.model.SignedUrlConfig;
import win.ixuni.gcsmock.core.util.StorageValidationUtils;
import win.ixuni.gcsmock.memory.fault.FaultQueues;
import win.ixuni.gcsmock.memory.stream.MockWriteStream;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory file
 * <p>
 * A handle can live without the file existing: the file exists only while it is a member of its
 * bucket. Lookups never create it; save, write streams, copy targets and {@code put} do, and
 * only delete removes it.
 * <p>
 * Every {@link MockableMethod} first takes the next error queued with
 * {@link #mockErrorOnce(MockableMethod, Throwable)}; if there is one, the call fails with it
 * and nothing else happens.
 */
@Slf4j
public class MockFile implements GcsFile {

    @Getter
    private final String name;

    @Getter
    private final MockBucket bucket;

    @Getter
    private final MockStorage storage;

    private final FaultQueues faults = new FaultQueues();

    private volatile byte[] contents = new byte[0];

    private volatile ObjectMetadata metadata = ObjectMetadata.empty();

    MockFile(MockBucket bucket, String name) {
        this.name = name;
        this.bucket = bucket;
        this.storage = bucket.getStorage();
    }

    @Override
    public MockBucket getParent() {
        return bucket;
    }

    // ==================== Fault injection ====================

    /**
     * Make the next call of {@code method} fail with {@code error}, once
     *
     * @return this file
     */
    public MockFile mockErrorOnce(MockableMethod method, Throwable error) {
        faults.enqueue(method, error);
        return this;
    }

    /**
     * @param methodName client API name, e.g. "getSignedUrl"
     * @throws IllegalArgumentException if the method cannot be mocked
     */
    public MockFile mockErrorOnce(String methodName, Throwable error) {
        return mockErrorOnce(MockableMethod.fromMethodName(methodName), error);
    }

    public MockFile mockReset(MockableMethod method) {
        faults.reset(method);
        return this;
    }

    public MockFile mockReset() {
        faults.reset();
        return this;
    }

    public int pendingErrors(MockableMethod method) {
        return faults.size(method);
    }

    // ==================== Mockable operations ====================

    @Override
    public Mono<Boolean> exists() {
        return mockable(MockableMethod.EXISTS, this::isMember);
    }

    @Override
    public Mono<Void> delete() {
        return mockable(MockableMethod.DELETE, () -> {
            requireMember();
            bucket.removeMember(this);
            return null;
        });
    }

    @Override
    public Mono<byte[]> download(DownloadOptions options) {
        return mockable(MockableMethod.DOWNLOAD, () -> {
            requireMember();
            byte[] data = contents.clone();
            Path destination = options != null ? options.getDestination() : null;
            if (destination != null) {
                try {
                    storage.getFileTransfer().writeAllBytes(destination, data);
                } catch (IOException e) {
                    throw GcsMockException.ioError("Failed to write " + describe() + " to " + destination, e);
                }
            }
            return data;
        });
    }

    @Override
    public Mono<Void> save(byte[] data, SaveOptions options) {
        return mockable(MockableMethod.SAVE, () -> {
            Objects.requireNonNull(data, "data");
            applySave(data, options != null ? options.getMetadata() : null);
            return null;
        });
    }

    @Override
    public Mono<ObjectMetadata> setMetadata(ObjectMetadata update) {
        return mockable(MockableMethod.SET_METADATA, () -> {
            Objects.requireNonNull(update, "metadata");
            requireMember();
            return applyMetadataMerge(update);
        });
    }

    @Override
    public Mono<ObjectMetadata> getMetadata() {
        return mockable(MockableMethod.GET_METADATA, () -> {
            requireMember();
            return metadata;
        });
    }

    @Override
    public Mono<String> getSignedUrl(SignedUrlConfig config) {
        return mockable(MockableMethod.GET_SIGNED_URL, () -> {
            String error = StorageValidationUtils.validateSignedUrlConfig(config);
            if (error != null) {
                throw new IllegalArgumentException(error);
            }
            requireMember();
            return storage.getConfig().getSignedUrlEndpoint() + "/" + bucket.getName() + "/" + name
                    + "?X-Goog-Algorithm=MOCKED";
        });
    }

    // ==================== Streams ====================

    /**
     * The file exists as soon as the stream is opened; its contents are replaced when the stream
     * is closed. Write streams are not subject to fault injection.
     */
    @Override
    public MockWriteStream createWriteStream() {
        markAsExisting();
        log.debug("[{}] Opened write stream", describe());
        return new MockWriteStream(data -> {
            contents = data;
            log.debug("[{}] Write stream committed {} bytes", describe(), data.length);
        });
    }

    /**
     * Contents as of this call, split into chunks of the configured read chunk size.
     * The returned stream can be subscribed once. Not subject to fault injection.
     */
    @Override
    public Flux<ByteBuffer> createReadStream() {
        if (!isMember()) {
            return Flux.error(new ObjectNotFoundException(bucket.getName(), name));
        }
        final byte[] snapshot = contents.clone();
        final int chunkSize = storage.getConfig().getReadChunkSize();
        final AtomicBoolean consumed = new AtomicBoolean();

        return Flux.defer(() -> {
            if (!consumed.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException(
                        "Read stream of " + describe() + " has already been consumed"));
            }
            return Flux.fromIterable(chunk(snapshot, chunkSize));
        });
    }

    // ==================== Copy ====================

    /**
     * Copy via download + getMetadata on this file and save on the destination, so queued errors
     * of those operations apply. Custom metadata given in the options replaces the source's
     * custom metadata as a whole.
     */
    @Override
    public Mono<CopyResult> copy(Object destination, CopyOptions options) {
        return Mono.defer(() -> {
            final MockFile target;
            try {
                target = resolveDestination(destination);
            } catch (InvalidDestinationException e) {
                return Mono.error(e);
            }
            ObjectMetadata override = options != null ? options.getMetadata() : null;

            return download()
                    .zipWhen(data -> getMetadata())
                    .flatMap(source -> {
                        ObjectMetadata merged = source.getT2().overlay(override).normalized();
                        return target.save(source.getT1(), SaveOptions.withMetadata(merged))
                                .thenReturn(new CopyResult(target, merged));
                    })
                    .doOnSuccess(result -> log.debug("Copied {} to {}", describe(), target.describe()));
        });
    }

    private MockFile resolveDestination(Object destination) {
        if (destination instanceof String) {
            return bucket.file((String) destination);
        }
        if (destination instanceof GcsBucket) {
            if (!(destination instanceof MockBucket)) {
                throw new InvalidDestinationException(
                        "Destination bucket is not a mock bucket: " + destination.getClass().getName());
            }
            return ((MockBucket) destination).file(name);
        }
        if (destination instanceof GcsFile) {
            if (!(destination instanceof MockFile)) {
                throw new InvalidDestinationException(
                        "Destination file is not a mock file: " + destination.getClass().getName());
            }
            MockFile file = (MockFile) destination;
            return file.getBucket().file(file.getName());
        }
        throw new InvalidDestinationException("Invalid destination type: "
                + (destination != null ? destination.getClass().getName() : "null"));
    }

    // ==================== Properties ====================

    @Override
    public URI getCloudStorageUri() {
        try {
            return new URI(storage.getConfig().getUriScheme(), bucket.getName(), "/" + name, null, null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Cannot build URI for " + describe(), e);
        }
    }

    /**
     * @return copy of the current contents, whether or not the file exists
     */
    public byte[] getContents() {
        return contents.clone();
    }

    /**
     * Replace the contents directly, without making the file exist
     */
    public void setContents(byte[] data) {
        contents = Objects.requireNonNull(data, "data").clone();
    }

    /**
     * @return current metadata, whether or not the file exists
     */
    public ObjectMetadata getStoredMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "MockFile(" + describe() + ")";
    }

    // ==================== Internal state transitions ====================

    /**
     * save 语义：先标记存在，再替换内容；给定元数据时整体覆盖（不合并）
     */
    void applySave(byte[] data, ObjectMetadata replacement) {
        markAsExisting();
        contents = data.clone();
        if (replacement != null) {
            metadata = replacement.normalized();
        }
    }

    ObjectMetadata applyMetadataMerge(ObjectMetadata update) {
        metadata = metadata.merge(update);
        return metadata;
    }

    String describe() {
        return bucket.getName() + "/" + name;
    }

    private <R> Mono<R> mockable(MockableMethod method, Callable<R> action) {
        return OperationLogger.trace(describe(), method.getMethodName(), Mono.defer(() -> {
            Throwable injected = faults.poll(method);
            if (injected != null) {
                log.debug("[{}] Returning queued error for {}", describe(), method.getMethodName());
                return Mono.error(injected);
            }
            return Mono.fromCallable(action);
        }));
    }

    private boolean isMember() {
        return bucket.isMember(this);
    }

    private void markAsExisting() {
        bucket.addMember(this);
    }

    private void requireMember() {
        if (!isMember()) {
            throw new ObjectNotFoundException(bucket.getName(), name);
        }
    }

    private static List<ByteBuffer> chunk(byte[] data, int chunkSize) {
        List<ByteBuffer> chunks = new ArrayList<>();
        for (int offset = 0; offset < data.length; offset += chunkSize) {
            int length = Math.min(chunkSize, data.length - offset);
            chunks.add(ByteBuffer.wrap(data, offset, length).slice().asReadOnlyBuffer());
        }
        return chunks;
    }
}
