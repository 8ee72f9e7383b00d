package win.ixuni.gcsmock.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import win.ixuni.gcsmock.core.api.GcsFile;
import win.ixuni.gcsmock.core.config.StorageConfig;
import win.ixuni.gcsmock.core.exception.GcsMockException;
import win.ixuni.gcsmock.core.exception.UnsupportedDestinationTypeException;
import win.ixuni.gcsmock.core.io.FileTransfer;
import win.ixuni.gcsmock.core.model.GetFilesOptions;
import win.ixuni.gcsmock.core.model.ObjectMetadata;
import win.ixuni.gcsmock.core.model.UploadOptions;
import win.ixuni.gcsmock.core.model.UploadResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bucket 测试：文件句柄、put、upload、列举与批量删除
 */
public class MockBucketTest {

    private MockStorage storage;
    private MockBucket bucket;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setup() {
        storage = new MockStorage();
        bucket = storage.bucket("test-bucket");
    }

    // ==================== file ====================

    @Test
    @DisplayName("file() returns a handle without creating the file")
    void testFile_HandleDoesNotExist() {
        MockFile file = bucket.file("my-file.txt");

        assertNotNull(file);
        assertEquals("my-file.txt", file.getName());
        assertFalse(file.exists().block());
        assertTrue(bucket.getFiles().block().isEmpty());
    }

    @Test
    @DisplayName("重复查找返回同一个句柄")
    void testFile_IdentityStable() {
        MockFile first = bucket.file("my-file.txt");
        MockFile second = bucket.file("my-file.txt");

        assertSame(first, second);
    }

    @Test
    void testFile_ForceMembership() {
        MockFile file = bucket.file("assumed.txt", true);

        assertTrue(file.exists().block());
        assertSame(file, bucket.file("assumed.txt"));
        assertEquals(0, file.download().block().length);
    }

    @Test
    void testFile_EmptyNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> bucket.file(""));
    }

    @Test
    @DisplayName("Long names resolve without a length limit")
    void testFile_LongNameResolves() {
        String longName = "x".repeat(1025);

        MockFile file = assertDoesNotThrow(() -> bucket.file(longName));

        assertEquals(longName, file.getName());
        assertFalse(file.exists().block());
        assertSame(file, bucket.file(longName));
    }

    // ==================== put ====================

    @Test
    void testPut_NameAndContents() {
        MockFile file = bucket.put("file.txt", "Hello, world!").block();

        assertEquals("file.txt", file.getName());
        assertEquals("Hello, world!", new String(file.getContents(), StandardCharsets.UTF_8));
        assertTrue(file.exists().block());
    }

    @Test
    void testPut_NameAndMetadata() {
        MockFile file = bucket.put("file.txt", "", ObjectMetadata.of("contentType", "text/plain")).block();

        assertEquals("text/plain", file.getStoredMetadata().getContentType());
        assertEquals(Map.of(), file.getStoredMetadata().getMetadata());
    }

    @Test
    @DisplayName("put without contents still creates the file")
    void testPut_WithoutContentsExists() {
        MockFile file = bucket.put("empty.txt").block();

        assertTrue(file.exists().block());
        assertEquals(0, file.getContents().length);
    }

    @Test
    void testPut_UpdatesExistingContents() {
        bucket.put("file.txt", "Old contents").block();
        MockFile file = bucket.put("file.txt", "New contents").block();

        assertEquals("New contents", new String(file.getContents(), StandardCharsets.UTF_8));
        assertSame(file, bucket.file("file.txt"));
    }

    @Test
    @DisplayName("put 重置为全新状态：旧元数据不保留")
    void testPut_ReplacesMetadataWithFreshState() {
        bucket.put("file.txt", "", ObjectMetadata.of("contentType", "image/png").withCustom("a", "1")).block();
        MockFile file = bucket.put("file.txt", "", ObjectMetadata.of("contentType", "image/jpeg")).block();

        assertEquals("image/jpeg", file.getStoredMetadata().getContentType());
        assertEquals(Map.of(), file.getStoredMetadata().getMetadata());
    }

    @Test
    @DisplayName("put bypasses queued errors")
    void testPut_IgnoresFaultQueues() {
        MockFile previous = bucket.file("file.txt");
        previous.mockErrorOnce("save", new IllegalStateException("should not fire"));

        MockFile file = bucket.put("file.txt", "data").block();

        assertNotSame(previous, file);
        assertTrue(file.exists().block());
        assertFalse(previous.exists().block());
    }

    @Test
    @DisplayName("旧句柄写入不会替换 put 存入的文件")
    void testPut_StaleHandleDoesNotDisplaceStoredFile() {
        MockFile stale = bucket.file("s.txt");
        MockFile fresh = bucket.put("s.txt", "new").block();

        stale.save("old").block();

        assertTrue(fresh.exists().block());
        assertFalse(stale.exists().block());
        assertSame(fresh, bucket.file("s.txt"));
        assertEquals("new", new String(bucket.file("s.txt").download().block(), StandardCharsets.UTF_8));
    }

    @Test
    void testPut_StaleWriteStreamDoesNotDisplaceStoredFile() {
        MockFile stale = bucket.file("s.txt");
        MockFile fresh = bucket.put("s.txt", "new").block();

        stale.createWriteStream().close();

        assertTrue(fresh.exists().block());
        assertEquals(List.of("s.txt"), names(bucket.getFiles().block()));
        assertSame(fresh, bucket.getFiles().block().get(0));
    }

    @Test
    void testPut_KeepsPositionWhenReplacing() {
        bucket.put("a.txt").block();
        bucket.put("b.txt").block();
        bucket.put("a.txt", "again").block();

        assertEquals(List.of("a.txt", "b.txt"), names(bucket.getFiles().block()));
    }

    // ==================== upload ====================

    @Test
    @DisplayName("上传本地文件到指定名称")
    void testUpload_WithDestinationAndMetadata() throws IOException {
        Path source = tempDir.resolve("test.txt");
        Files.writeString(source, "hello world");

        UploadResult result = bucket.upload(source, UploadOptions.builder()
                .destination("uploaded.txt")
                .metadata(ObjectMetadata.of("key", "value"))
                .build()).block();

        assertEquals("uploaded.txt", result.getFile().getName());
        assertEquals(Map.of("metadata", Map.of(), "key", "value"), result.getMetadata().toMap());
        byte[] downloaded = bucket.file("uploaded.txt").download().block();
        assertEquals("hello world", new String(downloaded, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Without destination the source base name is used")
    void testUpload_DefaultsToBaseName() throws IOException {
        Path first = Files.createFile(tempDir.resolve("first.bin"));
        Path second = Files.createFile(tempDir.resolve("second.bin"));

        UploadResult r1 = bucket.upload(first).block();
        UploadResult r2 = bucket.upload(second).block();
        List<GcsFile> files = bucket.getFiles().block();

        assertEquals(List.of("first.bin", "second.bin"), names(files));
        assertEquals("first.bin", r1.getFile().getName());
        assertEquals(ObjectMetadata.empty(), r1.getMetadata());
        assertEquals(ObjectMetadata.empty(), r2.getMetadata());
    }

    @Test
    @DisplayName("文件句柄作为 destination 不支持")
    void testUpload_FileDestinationUnsupported() throws IOException {
        Path source = Files.writeString(tempDir.resolve("test.txt"), "x");
        MockFile destination = bucket.file("target.txt");

        UnsupportedDestinationTypeException e = assertThrows(UnsupportedDestinationTypeException.class,
                () -> bucket.upload(source, UploadOptions.builder().destination(destination).build()).block());

        assertEquals(400, e.getHttpStatus());
        assertFalse(destination.exists().block());
    }

    @Test
    void testUpload_MissingSourceFails() {
        GcsMockException e = assertThrows(GcsMockException.class,
                () -> bucket.upload(tempDir.resolve("missing.txt")).block());

        assertEquals(GcsMockException.IO_ERROR, e.getErrorCode());
        assertInstanceOf(IOException.class, e.getCause());
        assertTrue(bucket.getFiles().block().isEmpty());
    }

    @Test
    @DisplayName("Upload reads through the injected file transfer")
    void testUpload_UsesInjectedFileTransfer() {
        FileTransfer fake = new FileTransfer() {
            @Override
            public byte[] readAllBytes(Path source) {
                return ("from " + source.getFileName()).getBytes(StandardCharsets.UTF_8);
            }

            @Override
            public void writeAllBytes(Path destination, byte[] data) {
                throw new UnsupportedOperationException();
            }
        };
        MockBucket fakeBucket = new MockStorage(StorageConfig.defaults(), fake).bucket("fake");

        fakeBucket.upload(Path.of("nowhere", "report.csv")).block();

        assertEquals("from report.csv",
                new String(fakeBucket.file("report.csv").download().block(), StandardCharsets.UTF_8));
    }

    // ==================== getFiles ====================

    @Test
    void testGetFiles_PrefixFilterKeepsCreationOrder() {
        bucket.put("test-1.txt").block();
        bucket.put("test-2.txt").block();
        bucket.put("nn-test-3.txt").block();

        List<GcsFile> files = bucket.getFiles(GetFilesOptions.withPrefix("test-")).block();

        assertEquals(List.of("test-1.txt", "test-2.txt"), names(files));
    }

    @Test
    void testGetFiles_OnlyExistingFiles() {
        bucket.put("kept.txt").block();
        bucket.file("handle-only.txt");
        MockFile deleted = bucket.put("deleted.txt").block();
        deleted.delete().block();

        assertEquals(List.of("kept.txt"), names(bucket.getFiles(GetFilesOptions.builder().build()).block()));
    }

    @Test
    @DisplayName("Listing result is a snapshot")
    void testGetFiles_Snapshot() {
        bucket.put("a.txt").block();
        List<GcsFile> files = bucket.getFiles().block();

        bucket.put("b.txt").block();

        assertEquals(1, files.size());
        assertThrows(UnsupportedOperationException.class, () -> files.add(bucket.file("c.txt")));
    }

    // ==================== deleteFiles ====================

    @Test
    @DisplayName("按前缀批量删除")
    void testDeleteFiles_WithPrefix() {
        MockFile file1 = bucket.put("test-1.txt").block();
        MockFile file2 = bucket.put("test-2.txt").block();
        MockFile file3 = bucket.put("nn-test-3.txt").block();

        bucket.deleteFiles(GetFilesOptions.withPrefix("test-")).block();

        assertFalse(file1.exists().block());
        assertFalse(file2.exists().block());
        assertTrue(file3.exists().block());
    }

    @Test
    void testDeleteFiles_WithoutPrefixDeletesAll() {
        MockFile file1 = bucket.put("test-1.txt").block();
        MockFile file2 = bucket.put("test-2.txt").block();
        MockFile file3 = bucket.put("nn-test-3.txt").block();

        bucket.deleteFiles().block();

        assertFalse(file1.exists().block());
        assertFalse(file2.exists().block());
        assertFalse(file3.exists().block());
        assertSame(file1, bucket.file("test-1.txt"));
    }

    @Test
    void testDeleteFiles_NoMatchSucceeds() {
        bucket.put("a.txt").block();

        assertDoesNotThrow(() -> bucket.deleteFiles(GetFilesOptions.withPrefix("zzz")).block());
        assertEquals(1, bucket.getFiles().block().size());
    }

    // ==================== cloudStorageURI ====================

    @Test
    void testCloudStorageUri() {
        assertEquals("gs://test-bucket", bucket.getCloudStorageUri().toString());
    }

    private static List<String> names(List<GcsFile> files) {
        return files.stream().map(GcsFile::getName).collect(Collectors.toList());
    }
}
