package win.ixuni.quarry.server.controller;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.FileSystemUtils;
import win.ixuni.quarry.server.QuarryServerApplication;
import win.ixuni.quarry.server.service.StorageReclaimService;

import java.io.IOException;
import java.net.URI;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end over the filesystem driver: streaming range reads, integrity failures and reclamation
 */
@SpringBootTest(classes = QuarryServerApplication.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LocalDriverIntegrationTest {

    private static Path baseDir;

    @LocalServerPort
    private int port;

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private StorageReclaimService reclaimService;

    @DynamicPropertySource
    static void localDriver(DynamicPropertyRegistry registry) throws IOException {
        baseDir = Files.createTempDirectory("quarry-it");
        registry.add("quarry.drivers[0].name", () -> "disk");
        registry.add("quarry.drivers[0].type", () -> "local");
        registry.add("quarry.drivers[0].properties.base-path", () -> baseDir.toString());
        registry.add("quarry.drivers[0].properties.read-buffer-size", () -> "3");
        registry.add("quarry.routing.default-driver", () -> "disk");
        registry.add("quarry.reclaim.grace-period", () -> "0s");
        registry.add("quarry.reclaim.cron", () -> "-");
    }

    @AfterAll
    static void cleanup() throws IOException {
        FileSystemUtils.deleteRecursively(baseDir);
    }

    @Test
    @DisplayName("本地驱动 Range 读取跨越多个读缓冲区")
    void rangeAcrossBuffers() {
        String bucket = "disk-range";
        createBucket(bucket);
        put(bucket, "alphabet.txt", "abcdefghijklmnopqrstuvwxyz");

        webTestClient.get().uri("/{bucket}/{key}", bucket, "alphabet.txt")
                .header(HttpHeaders.RANGE, "bytes=4-12")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.PARTIAL_CONTENT)
                .expectHeader().valueEquals(HttpHeaders.CONTENT_RANGE, "bytes 4-12/26")
                .expectBody(String.class).isEqualTo("efghijklm");
    }

    @Test
    @DisplayName("磁盘上长度不符的 blob - 500 IntegrityError")
    void truncatedBlob() throws IOException {
        String bucket = "disk-corrupt";
        createBucket(bucket);
        put(bucket, "victim.bin", "0123456789");

        List<Path> blobs = blobsOf(bucket);
        assertEquals(1, blobs.size());
        try (FileChannel channel = FileChannel.open(blobs.get(0), StandardOpenOption.WRITE)) {
            channel.truncate(4);
        }

        webTestClient.get().uri("/{bucket}/{key}", bucket, "victim.bin")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR)
                .expectBody(String.class)
                .value(body -> assertTrue(body.contains("<Code>IntegrityError</Code>"), body));

        // HEAD 不打开存储
        webTestClient.head().uri("/{bucket}/{key}", bucket, "victim.bin")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentLength(10);
    }

    @Test
    @DisplayName("空对象的 blob 丢失 - 500 IntegrityError")
    void missingEmptyBlob() throws IOException {
        String bucket = "disk-empty";
        createBucket(bucket);
        put(bucket, "empty.bin", "");

        webTestClient.get().uri("/{bucket}/{key}", bucket, "empty.bin")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentLength(0);

        List<Path> blobs = blobsOf(bucket);
        assertEquals(1, blobs.size());
        Files.delete(blobs.get(0));

        webTestClient.get().uri("/{bucket}/{key}", bucket, "empty.bin")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR)
                .expectBody(String.class)
                .value(body -> assertTrue(body.contains("<Code>IntegrityError</Code>"), body));
    }

    @Test
    @DisplayName("覆盖写入后回收旧 blob，当前版本仍可读")
    void overwriteThenReclaim() throws IOException {
        String bucket = "disk-reclaim";
        createBucket(bucket);
        put(bucket, "config.json", "{\"v\":1}");
        put(bucket, "config.json", "{\"v\":2}");
        assertEquals(2, blobsOf(bucket).size());

        assertTrue(reclaimService.reclaim() >= 1);
        assertEquals(1, blobsOf(bucket).size());

        webTestClient.get().uri("/{bucket}/{key}", bucket, "config.json")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("{\"v\":2}");
    }

    @Test
    @DisplayName("双斜杠开头的绝对路径 key 被拒绝，不写到存储目录之外")
    void absoluteKeyStaysInsideBasePath() throws IOException {
        String bucket = "escape-bucket";
        createBucket(bucket);
        Path outside = Files.createTempDirectory("quarry-outside");
        try {
            URI escaping = URI.create("http://localhost:" + port + "/" + bucket + "/" + outside + "/pwned");

            webTestClient.put().uri(escaping)
                    .bodyValue("x".getBytes(StandardCharsets.UTF_8))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody(String.class)
                    .value(body -> assertTrue(body.contains("<Code>InvalidArgument</Code>"), body));
            webTestClient.get().uri(escaping)
                    .exchange()
                    .expectStatus().isBadRequest();

            URI encoded = URI.create("http://localhost:" + port + "/" + bucket + "/%2F"
                    + outside.toString().substring(1) + "/pwned");
            webTestClient.put().uri(encoded)
                    .bodyValue("x".getBytes(StandardCharsets.UTF_8))
                    .exchange();

            assertFalse(Files.exists(outside.resolve("pwned.quarry.meta")));
        } finally {
            FileSystemUtils.deleteRecursively(outside);
        }
    }

    @Test
    @DisplayName("非法桶名在读写时同样返回 InvalidBucketName")
    void invalidBucketNameOnObjectRequests() {
        webTestClient.get().uri("/{bucket}/{key}", "Not_A_Bucket", "k")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody(String.class)
                .value(body -> assertTrue(body.contains("<Code>InvalidBucketName</Code>"), body));

        webTestClient.delete().uri("/{bucket}", "Not_A_Bucket")
                .exchange()
                .expectStatus().isBadRequest();
    }

    private void createBucket(String bucket) {
        webTestClient.put().uri("/{bucket}", bucket).exchange().expectStatus().isOk();
    }

    private void put(String bucket, String key, String content) {
        webTestClient.put().uri("/{bucket}/{key}", bucket, key)
                .bodyValue(content.getBytes(StandardCharsets.UTF_8))
                .exchange()
                .expectStatus().isOk();
    }

    private List<Path> blobsOf(String bucket) throws IOException {
        try (Stream<Path> files = Files.list(baseDir.resolve("quarry").resolve("blobs").resolve(bucket))) {
            return files.filter(Files::isRegularFile).toList();
        }
    }
}
