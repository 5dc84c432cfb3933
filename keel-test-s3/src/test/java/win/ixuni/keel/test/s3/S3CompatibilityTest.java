package win.ixuni.keel.test.s3;

import org.junit.jupiter.api.*;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;
import win.ixuni.keel.server.KeelServerApplication;
import win.ixuni.keel.test.s3.util.DataIntegrityAssert;
import win.ixuni.keel.test.s3.util.S3ClientFactory;
import win.ixuni.keel.test.s3.util.TestDataGenerator;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * S3 兼容性测试
 * <p>
 * Drives the embedded server with the AWS SDK and checks responses and error codes as an S3 client sees them.
 * 每个场景都包含成功和失败两种情况的验证。
 */
@SpringBootTest(classes = KeelServerApplication.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class S3CompatibilityTest {

    @LocalServerPort
    private int port;

    private S3Client s3Client;

    private static final String TEST_BUCKET = "compat-bucket";
    private static final String TEST_BUCKET_2 = "compat-bucket-2";
    private static final String TEST_KEY = "test-object.txt";
    private static final String TEST_CONTENT = "Hello, S3Keel!";
    private static final String NON_EXISTENT_BUCKET = "non-existent-bucket-" + UUID.randomUUID();
    private static final String NON_EXISTENT_KEY = "non-existent-key-" + UUID.randomUUID() + ".txt";

    @BeforeAll
    void setUp() {
        s3Client = S3ClientFactory.create(port);
    }

    @AfterAll
    void tearDownAll() {
        if (s3Client != null) {
            s3Client.close();
        }
    }

    // ==================== Bucket 创建测试 ====================

    @Test
    @Order(1)
    @DisplayName("创建Bucket - 成功")
    void testCreateBucket_Success() {
        CreateBucketResponse response = s3Client.createBucket(b -> b.bucket(TEST_BUCKET));
        assertNotNull(response);
        assertEquals("/" + TEST_BUCKET, response.location());
    }

    @Test
    @Order(2)
    @DisplayName("创建Bucket - 失败：同名Bucket已存在")
    void testCreateBucket_Fail_AlreadyExists() {
        S3Exception ex = assertThrows(S3Exception.class,
                () -> s3Client.createBucket(b -> b.bucket(TEST_BUCKET)));
        assertEquals(409, ex.statusCode());
        assertEquals("BucketAlreadyExists", ex.awsErrorDetails().errorCode());
    }

    @Test
    @Order(3)
    @DisplayName("创建Bucket - 失败：名称不合法")
    void testCreateBucket_Fail_InvalidName() {
        S3Exception ex = assertThrows(S3Exception.class,
                () -> s3Client.createBucket(b -> b.bucket("ab")));
        assertEquals(400, ex.statusCode());
        assertEquals("InvalidArgument", ex.awsErrorDetails().errorCode());
    }

    @Test
    @Order(4)
    @DisplayName("Create second bucket - success")
    void testCreateSecondBucket_Success() {
        assertNotNull(s3Client.createBucket(b -> b.bucket(TEST_BUCKET_2)));
    }

    // ==================== Bucket 列表 / HEAD 测试 ====================

    @Test
    @Order(10)
    @DisplayName("ListBuckets - success: includes created buckets in name order")
    void testListBuckets_Success() {
        List<String> names = s3Client.listBuckets().buckets().stream()
                .map(Bucket::name)
                .toList();
        int first = names.indexOf(TEST_BUCKET);
        int second = names.indexOf(TEST_BUCKET_2);
        assertTrue(first >= 0, "Bucket list should contain " + TEST_BUCKET);
        assertTrue(second > first, "Buckets should be sorted by name: " + names);
        assertTrue(s3Client.listBuckets().buckets().stream()
                .allMatch(bucket -> bucket.creationDate() != null));
    }

    @Test
    @Order(11)
    @DisplayName("检查Bucket存在 (HEAD) - 成功")
    void testHeadBucket_Success() {
        assertNotNull(s3Client.headBucket(b -> b.bucket(TEST_BUCKET)));
    }

    @Test
    @Order(12)
    @DisplayName("检查Bucket存在 (HEAD) - 失败：Bucket不存在")
    void testHeadBucket_Fail_NotFound() {
        S3Exception ex = assertThrows(S3Exception.class,
                () -> s3Client.headBucket(b -> b.bucket(NON_EXISTENT_BUCKET)));
        assertEquals(404, ex.statusCode());
    }

    // ==================== Object PUT / GET 测试 ====================

    @Test
    @Order(20)
    @DisplayName("上传对象 (PUT) - 成功：ETag 为内容 MD5")
    void testPutObject_Success() {
        PutObjectResponse response = s3Client.putObject(
                b -> b.bucket(TEST_BUCKET).key(TEST_KEY).contentType("text/plain"),
                RequestBody.fromString(TEST_CONTENT));
        DataIntegrityAssert.assertETagMatchesContent(response.eTag(),
                TEST_CONTENT.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @Order(21)
    @DisplayName("上传对象 (PUT) - 失败：Bucket不存在")
    void testPutObject_Fail_BucketNotFound() {
        S3Exception ex = assertThrows(S3Exception.class, () -> s3Client.putObject(
                b -> b.bucket(NON_EXISTENT_BUCKET).key(TEST_KEY),
                RequestBody.fromString(TEST_CONTENT)));
        assertEquals(404, ex.statusCode());
        assertEquals("NoSuchBucket", ex.awsErrorDetails().errorCode());
    }

    @Test
    @Order(22)
    @DisplayName("下载对象 (GET) - 成功：内容与头部")
    void testGetObject_Success() {
        ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(
                b -> b.bucket(TEST_BUCKET).key(TEST_KEY));
        assertEquals(TEST_CONTENT, bytes.asString(StandardCharsets.UTF_8));
        assertEquals("text/plain", bytes.response().contentType());
        assertEquals(TEST_CONTENT.length(), bytes.response().contentLength());
        assertNotNull(bytes.response().lastModified());
    }

    @Test
    @Order(23)
    @DisplayName("Upload object (PUT) - success: overwrite replaces content")
    void testPutObject_Success_Overwrite() {
        String newContent = "Updated content";
        s3Client.putObject(b -> b.bucket(TEST_BUCKET).key(TEST_KEY).contentType("text/plain"),
                RequestBody.fromString(newContent));

        var getResponse = s3Client.getObjectAsBytes(b -> b.bucket(TEST_BUCKET).key(TEST_KEY));
        assertEquals(newContent, getResponse.asString(StandardCharsets.UTF_8));

        // 恢复原始内容
        s3Client.putObject(b -> b.bucket(TEST_BUCKET).key(TEST_KEY).contentType("text/plain"),
                RequestBody.fromString(TEST_CONTENT));
    }

    @Test
    @Order(24)
    @DisplayName("下载对象 (GET) - 失败：对象不存在")
    void testGetObject_Fail_NoSuchKey() {
        S3Exception ex = assertThrows(S3Exception.class,
                () -> s3Client.getObjectAsBytes(b -> b.bucket(TEST_BUCKET).key(NON_EXISTENT_KEY)));
        assertEquals(404, ex.statusCode());
        assertEquals("NoSuchKey", ex.awsErrorDetails().errorCode());
    }

    @Test
    @Order(25)
    @DisplayName("下载对象 (GET) - 失败：Bucket不存在")
    void testGetObject_Fail_NoSuchBucket() {
        S3Exception ex = assertThrows(S3Exception.class,
                () -> s3Client.getObjectAsBytes(b -> b.bucket(NON_EXISTENT_BUCKET).key(TEST_KEY)));
        assertEquals(404, ex.statusCode());
        assertEquals("NoSuchBucket", ex.awsErrorDetails().errorCode());
    }

    @Test
    @Order(26)
    @DisplayName("Binary object - success: 1MB random payload round trips")
    void testPutObject_Success_Binary() {
        TestDataGenerator.TestFile file = TestDataGenerator.generateTestFile("binary", 1024 * 1024);
        PutObjectResponse put = s3Client.putObject(b -> b.bucket(TEST_BUCKET_2).key(file.key()),
                RequestBody.fromBytes(file.content()));
        assertEquals(file.md5Hex(), put.eTag().replace("\"", ""));

        byte[] downloaded = s3Client.getObjectAsBytes(b -> b.bucket(TEST_BUCKET_2).key(file.key())).asByteArray();
        DataIntegrityAssert.assertContentEquals(file.content(), downloaded);

        s3Client.deleteObject(b -> b.bucket(TEST_BUCKET_2).key(file.key()));
    }

    @Test
    @Order(27)
    @DisplayName("Empty object - success: zero bytes with the empty MD5")
    void testPutObject_Success_Empty() {
        String key = "empty-" + UUID.randomUUID() + ".bin";
        PutObjectResponse put = s3Client.putObject(b -> b.bucket(TEST_BUCKET_2).key(key), RequestBody.empty());
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", put.eTag().replace("\"", ""));

        ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(b -> b.bucket(TEST_BUCKET_2).key(key));
        assertEquals(0, bytes.asByteArray().length);
        assertEquals(0L, bytes.response().contentLength());

        s3Client.deleteObject(b -> b.bucket(TEST_BUCKET_2).key(key));
    }

    // ==================== Object HEAD / 元数据 测试 ====================

    @Test
    @Order(30)
    @DisplayName("获取对象元数据 (HEAD) - 成功：用户元数据原样返回")
    void testHeadObject_Success_Metadata() {
        String key = "meta-" + UUID.randomUUID() + ".txt";
        Map<String, String> metadata = TestDataGenerator.generateTestMetadata();
        s3Client.putObject(b -> b.bucket(TEST_BUCKET).key(key).contentType("text/csv").metadata(metadata),
                RequestBody.fromString("a,b,c"));

        HeadObjectResponse head = s3Client.headObject(b -> b.bucket(TEST_BUCKET).key(key));
        assertEquals("text/csv", head.contentType());
        assertEquals(5L, head.contentLength());
        DataIntegrityAssert.assertETagMatchesContent(head.eTag(), "a,b,c".getBytes(StandardCharsets.UTF_8));
        DataIntegrityAssert.assertMetadataEquals(metadata, head.metadata());

        s3Client.deleteObject(b -> b.bucket(TEST_BUCKET).key(key));
    }

    @Test
    @Order(31)
    @DisplayName("获取对象元数据 (HEAD) - 失败：对象不存在")
    void testHeadObject_Fail_NotFound() {
        S3Exception ex = assertThrows(S3Exception.class,
                () -> s3Client.headObject(b -> b.bucket(TEST_BUCKET).key(NON_EXISTENT_KEY)));
        assertEquals(404, ex.statusCode());
    }

    @Test
    @Order(32)
    @DisplayName("Special keys - success: unicode, spaces and nested paths round trip")
    void testSpecialKeys_Success() {
        for (TestDataGenerator.KeyType type : TestDataGenerator.KeyType.values()) {
            String key = TestDataGenerator.generateSpecialKey(type);
            String content = "content of " + type;
            s3Client.putObject(b -> b.bucket(TEST_BUCKET_2).key(key), RequestBody.fromString(content));

            String downloaded = s3Client.getObjectAsBytes(b -> b.bucket(TEST_BUCKET_2).key(key))
                    .asString(StandardCharsets.UTF_8);
            assertEquals(content, downloaded, "Round trip failed for key " + key);

            List<String> keys = s3Client.listObjects(b -> b.bucket(TEST_BUCKET_2)).contents().stream()
                    .map(S3Object::key)
                    .toList();
            assertTrue(keys.contains(key), "Listing should contain " + key + " but was " + keys);

            s3Client.deleteObject(b -> b.bucket(TEST_BUCKET_2).key(key));
        }
    }

    // ==================== ListObjects 测试 ====================

    @Test
    @Order(40)
    @DisplayName("列出对象 (V1) - 成功：按 key 排序，前缀过滤")
    void testListObjects_Success_Prefix() {
        List<String> keys = List.of("photos/2024/b.jpg", "photos/2024/a.jpg", "photos/2025/c.jpg",
                "photos/readme.txt", "docs/x.txt");
        for (String key : keys) {
            s3Client.putObject(b -> b.bucket(TEST_BUCKET_2).key(key), RequestBody.fromString(key));
        }

        ListObjectsResponse all = s3Client.listObjects(b -> b.bucket(TEST_BUCKET_2));
        assertEquals(List.of("docs/x.txt", "photos/2024/a.jpg", "photos/2024/b.jpg", "photos/2025/c.jpg",
                "photos/readme.txt"), all.contents().stream().map(S3Object::key).toList());
        assertFalse(all.isTruncated());
        assertEquals(TEST_BUCKET_2, all.name());

        ListObjectsResponse photos2024 = s3Client.listObjects(b -> b.bucket(TEST_BUCKET_2).prefix("photos/2024/"));
        assertEquals(List.of("photos/2024/a.jpg", "photos/2024/b.jpg"),
                photos2024.contents().stream().map(S3Object::key).toList());
        S3Object first = photos2024.contents().get(0);
        assertEquals((long) "photos/2024/a.jpg".length(), first.size());
        DataIntegrityAssert.assertETagMatchesContent(first.eTag(),
                "photos/2024/a.jpg".getBytes(StandardCharsets.UTF_8));
        assertNotNull(first.lastModified());
    }

    @Test
    @Order(41)
    @DisplayName("列出对象 (V1) - 成功：分隔符汇总为 CommonPrefixes")
    void testListObjects_Success_Delimiter() {
        ListObjectsResponse response = s3Client.listObjects(
                b -> b.bucket(TEST_BUCKET_2).prefix("photos/").delimiter("/"));

        assertEquals(List.of("photos/readme.txt"), response.contents().stream().map(S3Object::key).toList());
        assertEquals(List.of("photos/2024/", "photos/2025/"),
                response.commonPrefixes().stream().map(CommonPrefix::prefix).toList());
    }

    @Test
    @Order(42)
    @DisplayName("List objects (V2) - success: key count and contents")
    void testListObjectsV2_Success() {
        ListObjectsV2Response response = s3Client.listObjectsV2(b -> b.bucket(TEST_BUCKET_2).prefix("photos/"));
        assertEquals(4, response.keyCount());
        assertEquals(4, response.contents().size());
        assertFalse(response.isTruncated());
    }

    @Test
    @Order(43)
    @DisplayName("列出对象 - 成功：前缀无匹配返回空列表")
    void testListObjects_Success_NoMatch() {
        ListObjectsV2Response response = s3Client.listObjectsV2(b -> b.bucket(TEST_BUCKET_2).prefix("nothing/"));
        assertEquals(0, response.keyCount());
        assertTrue(response.contents().isEmpty());
    }

    @Test
    @Order(44)
    @DisplayName("列出对象 - 失败：Bucket不存在")
    void testListObjects_Fail_NoSuchBucket() {
        S3Exception ex = assertThrows(S3Exception.class,
                () -> s3Client.listObjects(b -> b.bucket(NON_EXISTENT_BUCKET)));
        assertEquals(404, ex.statusCode());
        assertEquals("NoSuchBucket", ex.awsErrorDetails().errorCode());
    }

    // ==================== 删除测试 ====================

    @Test
    @Order(50)
    @DisplayName("删除对象 - 成功：不存在的 key 也返回成功")
    void testDeleteObject_Success_Missing() {
        assertDoesNotThrow(() -> s3Client.deleteObject(b -> b.bucket(TEST_BUCKET).key(NON_EXISTENT_KEY)));
    }

    @Test
    @Order(51)
    @DisplayName("删除对象 - 失败：Bucket不存在")
    void testDeleteObject_Fail_NoSuchBucket() {
        S3Exception ex = assertThrows(S3Exception.class,
                () -> s3Client.deleteObject(b -> b.bucket(NON_EXISTENT_BUCKET).key(TEST_KEY)));
        assertEquals(404, ex.statusCode());
    }

    @Test
    @Order(52)
    @DisplayName("删除Bucket - 失败：Bucket非空")
    void testDeleteBucket_Fail_NotEmpty() {
        S3Exception ex = assertThrows(S3Exception.class,
                () -> s3Client.deleteBucket(b -> b.bucket(TEST_BUCKET)));
        assertEquals(409, ex.statusCode());
        assertEquals("BucketNotEmpty", ex.awsErrorDetails().errorCode());

        // Bucket 与对象均保持不变
        assertEquals(TEST_CONTENT, s3Client.getObjectAsBytes(b -> b.bucket(TEST_BUCKET).key(TEST_KEY))
                .asString(StandardCharsets.UTF_8));
    }

    @Test
    @Order(53)
    @DisplayName("删除Bucket - 失败：Bucket不存在")
    void testDeleteBucket_Fail_NoSuchBucket() {
        S3Exception ex = assertThrows(S3Exception.class,
                () -> s3Client.deleteBucket(b -> b.bucket(NON_EXISTENT_BUCKET)));
        assertEquals(404, ex.statusCode());
        assertEquals("NoSuchBucket", ex.awsErrorDetails().errorCode());
    }

    @Test
    @Order(60)
    @DisplayName("Delete buckets - success: emptied buckets can be removed")
    void testDeleteBuckets_Success() {
        for (String bucket : List.of(TEST_BUCKET, TEST_BUCKET_2)) {
            for (S3Object obj : s3Client.listObjectsV2(b -> b.bucket(bucket)).contents()) {
                s3Client.deleteObject(b -> b.bucket(bucket).key(obj.key()));
            }
            s3Client.deleteBucket(b -> b.bucket(bucket));

            S3Exception ex = assertThrows(S3Exception.class, () -> s3Client.headBucket(b -> b.bucket(bucket)));
            assertEquals(404, ex.statusCode());
        }
        assertTrue(s3Client.listBuckets().buckets().stream()
                .noneMatch(b -> b.name().equals(TEST_BUCKET) || b.name().equals(TEST_BUCKET_2)));
    }
}
