package win.ixuni.keel.engine.blob;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import win.ixuni.keel.core.exception.StorageFailureException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LocalBlobStoreTest {

    @TempDir
    Path tempDir;

    private Path root;
    private LocalBlobStore store;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("blobs");
        store = new LocalBlobStore(root);
        store.initialize();
    }

    @Test
    @DisplayName("store / fetch / release")
    void testLifecycle() {
        byte[] data = "Hello World".getBytes(StandardCharsets.UTF_8);
        BlobReference ref = store.store(data);

        assertEquals(11, ref.getContentLength());
        assertEquals("b10a8db164e0754105b7a99be72e3fe5", ref.getEtag());
        assertArrayEquals(data, store.fetch(ref));
        assertEquals(1, store.blobCount());

        store.release(ref);
        assertEquals(0, store.blobCount());
    }

    @Test
    @DisplayName("No temp files remain after a store")
    void testNoTempLeftovers() throws IOException {
        store.store(new byte[]{1, 2, 3});
        try (Stream<Path> files = Files.list(root)) {
            assertTrue(files.allMatch(p -> p.getFileName().toString().endsWith(".blob")));
        }
    }

    @Test
    @DisplayName("Releasing twice is a programming error")
    void testDoubleRelease() {
        BlobReference ref = store.store(new byte[0]);
        store.release(ref);
        assertThrows(IllegalStateException.class, () -> store.release(ref));
    }

    @Test
    @DisplayName("Missing blob file surfaces as a storage failure")
    void testFetchMissingFile() throws IOException {
        BlobReference ref = store.store(new byte[]{1});
        Files.delete(root.resolve(ref.getBlobId() + ".blob"));
        assertThrows(StorageFailureException.class, () -> store.fetch(ref));
    }

    @Test
    @DisplayName("Write into an unusable root fails with a storage failure and leaves nothing behind")
    void testStoreFailure() throws IOException {
        Files.delete(root);
        Files.writeString(root, "not a directory");

        StorageFailureException ex = assertThrows(StorageFailureException.class, () -> store.store(new byte[]{1}));
        assertNotNull(ex.getCause());
    }

    @Test
    @DisplayName("initialize purges stale blobs and temp files")
    void testInitializePurges() throws IOException {
        store.store(new byte[]{1});
        Files.writeString(root.resolve("upload-123.tmp"), "partial");
        Files.writeString(root.resolve("keep.txt"), "unrelated");

        LocalBlobStore reopened = new LocalBlobStore(root);
        reopened.initialize();

        assertEquals(0, reopened.blobCount());
        assertFalse(Files.exists(root.resolve("upload-123.tmp")));
        assertTrue(Files.exists(root.resolve("keep.txt")));
    }
}
