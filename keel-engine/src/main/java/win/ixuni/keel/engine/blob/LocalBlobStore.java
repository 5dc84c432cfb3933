package win.ixuni.keel.engine.blob;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.keel.core.exception.StorageFailureException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * 本地文件系统 blob 存储
 * <p>
 * One file per blob under the root directory. Payloads are written to a temp file and moved
 * into place, so a blob file is either absent or complete.
 */
@Slf4j
public class LocalBlobStore extends AbstractBlobStore {

    private static final String BLOB_SUFFIX = ".blob";
    private static final String TEMP_SUFFIX = ".tmp";

    @Getter
    private final Path rootDir;

    public LocalBlobStore(Path rootDir) {
        this.rootDir = rootDir;
    }

    /**
     * Create the root directory and purge leftovers of a previous process. The index lives in
     * memory, so blobs on disk from an earlier run are unreachable.
     */
    @Override
    public void initialize() {
        try {
            Files.createDirectories(rootDir);
            List<Path> stale;
            try (Stream<Path> files = Files.list(rootDir)) {
                stale = files
                        .filter(p -> isBlobFile(p) || p.getFileName().toString().endsWith(TEMP_SUFFIX))
                        .toList();
            }
            stale.forEach(this::deleteLeftover);
            log.info("Local blob store ready at {} (purged {} stale files)", rootDir, stale.size());
        } catch (IOException e) {
            throw new StorageFailureException("Cannot initialize blob store at " + rootDir, e);
        }
    }

    @Override
    public BlobReference store(byte[] data) {
        BlobReference ref = newReference(data);
        Path temp = null;
        try {
            temp = Files.createTempFile(rootDir, "upload-", TEMP_SUFFIX);
            Files.write(temp, data);
            Files.move(temp, blobPath(ref), StandardCopyOption.ATOMIC_MOVE);
            return ref;
        } catch (IOException e) {
            deleteTemp(temp);
            throw new StorageFailureException("Failed to write blob " + ref.getBlobId(), e);
        }
    }

    @Override
    public byte[] fetch(BlobReference ref) {
        try {
            return Files.readAllBytes(blobPath(ref));
        } catch (NoSuchFileException e) {
            throw new StorageFailureException("Blob file missing: " + ref.getBlobId(), e);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to read blob " + ref.getBlobId(), e);
        }
    }

    @Override
    public void release(BlobReference ref) {
        try {
            Files.delete(blobPath(ref));
        } catch (NoSuchFileException e) {
            throw new IllegalStateException("Blob released twice or never stored: " + ref.getBlobId(), e);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to delete blob " + ref.getBlobId(), e);
        }
    }

    @Override
    public int blobCount() {
        try (Stream<Path> files = Files.list(rootDir)) {
            return (int) files.filter(this::isBlobFile).count();
        } catch (IOException e) {
            throw new StorageFailureException("Cannot list blob store at " + rootDir, e);
        }
    }

    private Path blobPath(BlobReference ref) {
        return rootDir.resolve(ref.getBlobId() + BLOB_SUFFIX);
    }

    private boolean isBlobFile(Path path) {
        return path.getFileName().toString().endsWith(BLOB_SUFFIX);
    }

    private void deleteLeftover(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to purge " + path, e);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
