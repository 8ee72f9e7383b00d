package win.ixuni.gcsmock.memory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.gcsmock.core.api.GcsBucket;
import win.ixuni.gcsmock.core.api.GcsFile;
import win.ixuni.gcsmock.core.exception.GcsMockException;
import win.ixuni.gcsmock.core.exception.UnsupportedDestinationTypeException;
import win.ixuni.gcsmock.core.model.GetFilesOptions;
import win.ixuni.gcsmock.core.model.ObjectMetadata;
import win.ixuni.gcsmock.core.model.UploadOptions;
import win.ixuni.gcsmock.core.model.UploadResult;
import win.ixuni.gcsmock.core.util.StorageValidationUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory bucket
 * <p>
 * Keeps two maps: the files that exist (in creation order) and every handle handed out, so that
 * repeated lookups of a name return the same instance whether or not the file exists.
 */
@Slf4j
public class MockBucket implements GcsBucket {

    @Getter
    private final String name;

    @Getter
    private final MockStorage storage;

    /**
     * 存在的文件：name -> file，保持创建顺序
     */
    private final Map<String, MockFile> files = new LinkedHashMap<>();

    /**
     * All handles handed out: name -> file
     */
    private final Map<String, MockFile> handles = new HashMap<>();

    MockBucket(MockStorage storage, String name) {
        this.name = name;
        this.storage = storage;
    }

    @Override
    public MockFile file(String name) {
        return file(name, false);
    }

    /**
     * Get a file handle
     *
     * @param name            file name
     * @param forceMembership make the file exist right away (test setup)
     * @return file handle
     */
    public synchronized MockFile file(String name, boolean forceMembership) {
        requireValidName(name);
        MockFile file = files.get(name);
        if (file == null) {
            file = handles.computeIfAbsent(name, n -> new MockFile(this, n));
        }
        if (forceMembership) {
            files.put(name, file);
        }
        return file;
    }

    // ==================== Administrative setup ====================

    /**
     * Create or replace a file with fresh state, bypassing fault injection
     * <p>
     * The previous handle for {@code name}, if any, no longer refers to the stored file.
     *
     * @param name     file name
     * @param contents contents, stored with save semantics when not {@code null}
     * @param metadata metadata, merged with setMetadata semantics when not {@code null}
     * @return the new file
     */
    public Mono<MockFile> put(String name, byte[] contents, ObjectMetadata metadata) {
        return Mono.fromCallable(() -> {
            requireValidName(name);
            MockFile file = new MockFile(this, name);
            synchronized (this) {
                handles.put(name, file);
                files.put(name, file);
            }
            if (contents != null) {
                file.applySave(contents, null);
            }
            if (metadata != null) {
                file.applyMetadataMerge(metadata);
            }
            log.debug("[{}] Put file {} ({} bytes)", this.name, name, file.getContents().length);
            return file;
        });
    }

    public Mono<MockFile> put(String name, String contents, ObjectMetadata metadata) {
        return put(name, contents != null ? contents.getBytes(StandardCharsets.UTF_8) : null, metadata);
    }

    public Mono<MockFile> put(String name, String contents) {
        return put(name, contents, null);
    }

    public Mono<MockFile> put(String name) {
        return put(name, (byte[]) null, null);
    }

    // ==================== Client operations ====================

    @Override
    public Mono<UploadResult> upload(Path source, UploadOptions options) {
        return Mono.defer(() -> {
            Object destination = options != null ? options.getDestination() : null;
            if (destination != null && !(destination instanceof String)) {
                return Mono.error(new UnsupportedDestinationTypeException(destination.getClass()));
            }
            String target = destination != null ? (String) destination : source.getFileName().toString();

            byte[] data;
            try {
                data = storage.getFileTransfer().readAllBytes(source);
            } catch (IOException e) {
                return Mono.error(GcsMockException.ioError("Failed to read upload source " + source, e));
            }

            ObjectMetadata metadata = options != null ? options.getMetadata() : null;
            return put(target, data, metadata)
                    .map(file -> new UploadResult(file, file.getStoredMetadata()));
        }).doOnSuccess(result -> log.debug("[{}] Uploaded {} as {}", name, source, result.getFile().getName()));
    }

    @Override
    public Mono<List<GcsFile>> getFiles(GetFilesOptions query) {
        return Mono.fromSupplier(() -> {
            String prefix = query != null ? query.getPrefixOrEmpty() : "";
            synchronized (this) {
                return files.values().stream()
                        .filter(file -> file.getName().startsWith(prefix))
                        .<GcsFile>map(file -> file)
                        .toList();
            }
        });
    }

    @Override
    public Mono<Void> deleteFiles(GetFilesOptions query) {
        return Mono.fromRunnable(() -> {
            String prefix = query != null ? query.getPrefixOrEmpty() : "";
            int removed;
            synchronized (this) {
                int before = files.size();
                files.keySet().removeIf(fileName -> fileName.startsWith(prefix));
                removed = before - files.size();
            }
            log.debug("[{}] Deleted {} files with prefix '{}'", name, removed, prefix);
        });
    }

    @Override
    public URI getCloudStorageUri() {
        try {
            return new URI(storage.getConfig().getUriScheme(), name, null, null, null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Cannot build URI for bucket " + name, e);
        }
    }

    @Override
    public String toString() {
        return "MockBucket(" + name + ")";
    }

    // ==================== Membership ====================

    synchronized boolean isMember(MockFile file) {
        return files.get(file.getName()) == file;
    }

    /**
     * 仅在该名称没有存在的文件时加入；已存在的文件不会被其他句柄替换
     */
    synchronized void addMember(MockFile file) {
        if (files.putIfAbsent(file.getName(), file) == null) {
            handles.put(file.getName(), file);
        }
    }

    synchronized void removeMember(MockFile file) {
        files.remove(file.getName(), file);
    }

    private static void requireValidName(String name) {
        String error = StorageValidationUtils.validateObjectName(name);
        if (error != null) {
            throw new IllegalArgumentException(error);
        }
    }
}
