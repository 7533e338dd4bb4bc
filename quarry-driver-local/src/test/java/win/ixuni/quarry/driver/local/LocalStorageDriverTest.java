package win.ixuni.quarry.driver.local;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;
import win.ixuni.quarry.core.config.DriverConfig;
import win.ixuni.quarry.core.exception.BucketNotEmptyException;
import win.ixuni.quarry.core.exception.BucketNotFoundException;
import win.ixuni.quarry.core.exception.IntegrityException;
import win.ixuni.quarry.core.exception.ObjectNotFoundException;
import win.ixuni.quarry.core.exception.VersionNotFoundException;
import win.ixuni.quarry.core.model.ByteRange;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.bucket.BucketExistsOperation;
import win.ixuni.quarry.core.operation.bucket.CreateBucketOperation;
import win.ixuni.quarry.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.quarry.core.operation.object.LookupObjectOperation;
import win.ixuni.quarry.core.operation.object.PutObjectOperation;
import win.ixuni.quarry.core.operation.object.ReadObjectOperation;
import win.ixuni.quarry.core.util.ETags;
import win.ixuni.quarry.driver.local.context.LocalDriverContext;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageDriverTest {

    private static final String BUCKET = "test-bucket";

    @TempDir
    Path baseDir;

    private LocalStorageDriver driver;

    @BeforeEach
    void setUp() {
        driver = newDriver(false);
        driver.execute(new CreateBucketOperation(BUCKET)).block();
    }

    private LocalStorageDriver newDriver(boolean versioning) {
        DriverConfig config = new DriverConfig();
        config.setName("local-test");
        config.setType("local");
        config.getProperties().put("base-path", baseDir.toString());
        config.getProperties().put("versioning", versioning);
        config.getProperties().put("read-buffer-size", 4);
        LocalStorageDriver created = new LocalStorageDriver(config);
        created.initialize().block();
        return created;
    }

    private ObjectMetadata put(LocalStorageDriver target, String key, String... chunks) {
        return target.execute(PutObjectOperation.builder()
                .bucketName(BUCKET)
                .key(key)
                .content(Flux.fromArray(chunks).map(c -> ByteBuffer.wrap(c.getBytes(StandardCharsets.UTF_8))))
                .contentType("text/plain")
                .userMetadata(Map.of("owner", "tests"))
                .build()).block();
    }

    private String read(LocalStorageDriver target, ObjectMetadata metadata, ByteRange range) {
        Flux<ByteBuffer> content = target.execute(new ReadObjectOperation(metadata, range)).block();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        content.toIterable().forEach(buffer -> {
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            out.writeBytes(bytes);
        });
        return out.toString(StandardCharsets.UTF_8);
    }

    private ObjectMetadata lookup(LocalStorageDriver target, String key) {
        return target.execute(LookupObjectOperation.current(BUCKET, key)).block();
    }

    private Path blobPath(ObjectMetadata metadata) {
        LocalDriverContext context = (LocalDriverContext) driver.getDriverContext();
        return context.getBlobPath(BUCKET, metadata.getLocation().getId());
    }

    @Test
    @DisplayName("流式写入后可查询并读取")
    void putLookupRead() {
        put(driver, "test-object.txt", "hello", " ", "world");

        ObjectMetadata found = lookup(driver, "test-object.txt");

        assertEquals(11, found.getSize());
        assertEquals(ETags.md5Hex("hello world".getBytes(StandardCharsets.UTF_8)), found.getEtag());
        assertEquals("text/plain", found.getContentType());
        assertEquals(Map.of("owner", "tests"), found.getUserMetadata());
        assertEquals("hello world", read(driver, found, ByteRange.full(11)));
    }

    @Test
    void nestedKeys() {
        put(driver, "dir/sub/test-object.txt", "nested");
        assertEquals(6, lookup(driver, "dir/sub/test-object.txt").getSize());
    }

    @Test
    @DisplayName("Range reads straddling read-buffer boundaries return the exact slice")
    void rangeReadAcrossBufferBoundaries() {
        ObjectMetadata metadata = put(driver, "test-object.txt", "hello world");

        assertEquals("lo wor", read(driver, metadata, new ByteRange(3, 8)));
        assertEquals("o w", read(driver, metadata, new ByteRange(4, 6)));
        assertEquals("world", read(driver, metadata, new ByteRange(6, 10)));
        assertEquals("h", read(driver, metadata, new ByteRange(0, 0)));
    }

    @Test
    void missingBucketAndKey() {
        StepVerifier.create(driver.execute(LookupObjectOperation.current("no-such-bucket", "k")))
                .verifyError(BucketNotFoundException.class);
        StepVerifier.create(driver.execute(LookupObjectOperation.current(BUCKET, "missing")))
                .verifyError(ObjectNotFoundException.class);
    }

    @Test
    @DisplayName("Truncated blob on disk is an integrity error")
    void truncatedBlobIsAnIntegrityError() throws Exception {
        ObjectMetadata metadata = put(driver, "test-object.txt", "hello world");
        Files.write(blobPath(metadata), "hello".getBytes(StandardCharsets.UTF_8));

        StepVerifier.create(driver.execute(new ReadObjectOperation(metadata, new ByteRange(0, 4))))
                .verifyError(IntegrityException.class);
    }

    @Test
    void missingBlobIsAnIntegrityError() throws Exception {
        ObjectMetadata metadata = put(driver, "test-object.txt", "hello world");
        Files.delete(blobPath(metadata));

        StepVerifier.create(driver.execute(new ReadObjectOperation(metadata, ByteRange.full(11))))
                .verifyError(IntegrityException.class);
    }

    @Test
    @DisplayName("覆盖写后，旧位置在宽限期内仍可读")
    void overwriteKeepsOldLocationUntilReclaimed() {
        ObjectMetadata old = put(driver, "test-object.txt", "hello world");
        put(driver, "test-object.txt", "goodbye");

        assertEquals("goodbye", read(driver, lookup(driver, "test-object.txt"), ByteRange.full(7)));
        assertEquals("hello world", read(driver, old, ByteRange.full(11)));

        StepVerifier.create(driver.reclaimSuperseded(Duration.ofMinutes(10)))
                .expectNext(0L)
                .verifyComplete();
        assertTrue(Files.exists(blobPath(old)));

        StepVerifier.create(driver.reclaimSuperseded(Duration.ZERO))
                .expectNext(1L)
                .verifyComplete();
        assertFalse(Files.exists(blobPath(old)));
        assertEquals("goodbye", read(driver, lookup(driver, "test-object.txt"), ByteRange.full(7)));
    }

    @Test
    void versioning() {
        LocalStorageDriver versioned = newDriver(true);

        ObjectMetadata v1 = put(versioned, "doc.txt", "first");
        ObjectMetadata v2 = put(versioned, "doc.txt", "second");

        ObjectMetadata first = versioned.execute(new LookupObjectOperation(BUCKET, "doc.txt", v1.getVersionId())).block();
        assertEquals("first", read(versioned, first, ByteRange.full(5)));
        assertEquals(v2.getVersionId(), lookup(versioned, "doc.txt").getVersionId());

        StepVerifier.create(versioned.execute(new LookupObjectOperation(BUCKET, "doc.txt", "nope")))
                .verifyError(VersionNotFoundException.class);

        StepVerifier.create(versioned.reclaimSuperseded(Duration.ZERO))
                .expectNext(0L)
                .verifyComplete();
    }

    @Test
    @DisplayName("重启后索引与数据仍然存在")
    void survivesRestart() {
        ObjectMetadata written = put(driver, "test-object.txt", "hello world");

        LocalStorageDriver restarted = newDriver(false);
        ObjectMetadata found = lookup(restarted, "test-object.txt");

        assertEquals(written.getEtag(), found.getEtag());
        assertEquals(written.getLocation(), found.getLocation());
        assertEquals(written.getLastModified().toEpochMilli(), found.getLastModified().toEpochMilli());
        assertEquals("hello world", read(restarted, found, ByteRange.full(11)));
    }

    @Test
    void bucketLifecycle() {
        put(driver, "test-object.txt", "hello world");

        StepVerifier.create(driver.execute(new DeleteBucketOperation(BUCKET)))
                .verifyError(BucketNotEmptyException.class);

        driver.execute(new CreateBucketOperation("empty-bucket")).block();
        StepVerifier.create(driver.execute(new DeleteBucketOperation("empty-bucket"))).verifyComplete();
        StepVerifier.create(driver.execute(new BucketExistsOperation("empty-bucket")))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void putIntoMissingBucketLeavesNoTempFiles() throws Exception {
        StepVerifier.create(driver.execute(PutObjectOperation.builder()
                        .bucketName("no-such-bucket").key("k")
                        .content(Flux.just(ByteBuffer.wrap(new byte[]{1, 2, 3})))
                        .build()))
                .verifyError(BucketNotFoundException.class);

        LocalDriverContext context = (LocalDriverContext) driver.getDriverContext();
        try (var files = Files.list(context.getTmpRoot())) {
            assertEquals(0, files.count());
        }
    }

    @Test
    @DisplayName("绝对路径 key 与 .. 桶名不能逃出存储根目录")
    void namesStayBelowStorageRoot(@TempDir Path outside) {
        String escapingKey = outside.resolve("escaped").toString();

        StepVerifier.create(driver.execute(PutObjectOperation.builder()
                        .bucketName(BUCKET).key(escapingKey)
                        .content(Flux.just(ByteBuffer.wrap(new byte[]{1, 2, 3})))
                        .build()))
                .verifyError(IllegalArgumentException.class);
        StepVerifier.create(driver.execute(LookupObjectOperation.current(BUCKET, escapingKey)))
                .verifyError(IllegalArgumentException.class);
        StepVerifier.create(driver.execute(new CreateBucketOperation("..")))
                .verifyError(IllegalArgumentException.class);

        assertFalse(Files.exists(outside.resolve("escaped.quarry.meta")));
    }
}
