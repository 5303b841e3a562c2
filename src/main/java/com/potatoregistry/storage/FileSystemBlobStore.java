package com.potatoregistry.storage;

import com.potatoregistry.config.RegistryProperties;
import com.potatoregistry.error.IntegrityException;
import com.potatoregistry.error.NotFoundException;
import com.potatoregistry.error.TransientStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Blob store on the local filesystem.
 *
 * <pre>
 * {root}/staging/upload-*.part          bytes being received
 * {root}/blobs/{algo}/ab/cd/abcd...      promoted blobs, sharded by the first two hash bytes
 * </pre>
 *
 * Staged files are fsync'ed before the atomic rename, so a crash leaves either nothing or a
 * complete blob at the final path. Modification times are set from the injected clock; the
 * garbage collector's grace period is measured against them.
 */
@Slf4j
@Component
public class FileSystemBlobStore implements BlobStore {

    private static final int BUFFER_SIZE = 8192;
    private static final int LOCK_STRIPES = 256;

    private final HashAlgo algo;
    private final Path blobRoot;
    private final Path stagingDir;
    private final Clock clock;
    // promote and deleteIf of one hash hold the same stripe
    private final Object[] stripes = new Object[LOCK_STRIPES];

    @Autowired
    public FileSystemBlobStore(RegistryProperties props, Clock clock) {
        this(props.storage().path(), props.storage().algo(), clock);
    }

    public FileSystemBlobStore(Path root, HashAlgo algo, Clock clock) {
        this.algo = Objects.requireNonNull(algo, "algo");
        this.clock = Objects.requireNonNull(clock, "clock");
        Path base = root.toAbsolutePath().normalize();
        this.blobRoot = base.resolve("blobs").resolve(algo.dirName());
        this.stagingDir = base.resolve("staging");
        for (int i = 0; i < stripes.length; i++) stripes[i] = new Object();
        try {
            Files.createDirectories(blobRoot);
            Files.createDirectories(stagingDir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create blob store under " + base, e);
        }
        log.info("blob store ready at {} ({})", base, algo.jcaName);
    }

    @Override
    public HashAlgo algo() { return algo; }

    @Override
    public StagedBlob stage(InputStream in, long maxBytes) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(stagingDir, "upload-", ".part");
            MessageDigest md = algo.newDigest();
            byte[] buf = new byte[BUFFER_SIZE];
            long total = 0;
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE);
                 OutputStream out = Channels.newOutputStream(ch)) {
                int n;
                while ((n = in.read(buf)) != -1) {
                    total += n;
                    if (total > maxBytes) {
                        throw new IntegrityException("upload exceeds declared size of " + maxBytes + " bytes");
                    }
                    md.update(buf, 0, n);
                    out.write(buf, 0, n);
                }
                ch.force(true);
            }
            return new StagedBlob(tmp, HashAlgo.toHex(md.digest()), total);
        } catch (IOException e) {
            TransientStorageException failure = new TransientStorageException("failed to stage upload", e);
            discard(tmp, failure);
            throw failure;
        } catch (RuntimeException e) {
            discard(tmp, e);
            throw e;
        }
    }

    @Override
    public BlobRecord promote(StagedBlob staged) {
        if (staged.released()) throw new IllegalStateException("staged blob already released: " + staged.contentHash());
        String hash = staged.contentHash();
        Path target = pathFor(hash);
        synchronized (stripeFor(hash)) {
            try {
                if (Files.exists(target)) {
                    return dedup(staged, target);
                }
                Files.createDirectories(target.getParent());
                try {
                    Files.move(staged.tempFile(), target, StandardCopyOption.ATOMIC_MOVE);
                } catch (FileAlreadyExistsException race) {
                    return dedup(staged, target);
                }
                staged.markReleased();
                touch(target);
                log.debug("promoted blob {} ({} bytes)", hash, staged.sizeBytes());
                return new BlobRecord(hash, staged.sizeBytes(), target);
            } catch (IOException e) {
                throw new TransientStorageException("failed to promote blob " + hash, e);
            }
        }
    }

    @Override
    public InputStream get(String contentHash) {
        String hash = algo.requireHex("contentHash", contentHash);
        Path p = pathFor(hash);
        try {
            InputStream in = new BufferedInputStream(Files.newInputStream(p), BUFFER_SIZE);
            return new VerifyingInputStream(in, algo, hash, -1, "blob " + hash);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("blob not found: " + hash);
        } catch (IOException e) {
            throw new TransientStorageException("failed to open blob " + hash, e);
        }
    }

    @Override
    public Optional<BlobInfo> stat(String contentHash) {
        String hash = algo.requireHex("contentHash", contentHash);
        return readInfo(hash, pathFor(hash));
    }

    @Override
    public boolean delete(String contentHash) {
        String hash = algo.requireHex("contentHash", contentHash);
        try {
            boolean deleted = Files.deleteIfExists(pathFor(hash));
            if (deleted) log.debug("deleted blob {}", hash);
            return deleted;
        } catch (IOException e) {
            throw new TransientStorageException("failed to delete blob " + hash, e);
        }
    }

    @Override
    public boolean deleteIf(String contentHash, Predicate<BlobInfo> condition) {
        String hash = algo.requireHex("contentHash", contentHash);
        synchronized (stripeFor(hash)) {
            Optional<BlobInfo> info = readInfo(hash, pathFor(hash));
            if (info.isEmpty() || !condition.test(info.get())) return false;
            return delete(hash);
        }
    }

    @Override
    public Stream<BlobInfo> list() {
        final Stream<Path> files;
        try {
            files = Files.walk(blobRoot, 3);
        } catch (IOException e) {
            throw new TransientStorageException("failed to list " + blobRoot, e);
        }
        return files
                .filter(Files::isRegularFile)
                .filter(p -> isHash(p.getFileName().toString()))
                .map(p -> readInfo(p.getFileName().toString(), p))
                .flatMap(Optional::stream);
    }

    @Override
    public int purgeStaging(Instant olderThan) {
        int removed = 0;
        try (Stream<Path> files = Files.list(stagingDir)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                if (modifiedBefore(p, olderThan) && Files.deleteIfExists(p)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new TransientStorageException("failed to purge staging area " + stagingDir, e);
        }
        if (removed > 0) log.info("removed {} stale staging file(s)", removed);
        return removed;
    }

    /** Content-addressed location: {@code blobs/<algo>/<h[0..2]>/<h[2..4]>/<h>}. */
    Path pathFor(String hash) {
        return blobRoot.resolve(hash.substring(0, 2)).resolve(hash.substring(2, 4)).resolve(hash);
    }

    Path stagingDir() { return stagingDir; }

    private Object stripeFor(String hash) {
        return stripes[Integer.parseInt(hash.substring(0, 2), 16) % LOCK_STRIPES];
    }

    private BlobRecord dedup(StagedBlob staged, Path target) throws IOException {
        // refresh mtime so a blob about to be re-referenced is inside the collector's grace period
        touch(target);
        staged.close();
        log.debug("blob {} already present, staged copy discarded", staged.contentHash());
        return new BlobRecord(staged.contentHash(), staged.sizeBytes(), target);
    }

    private void touch(Path p) throws IOException {
        Files.setLastModifiedTime(p, FileTime.from(clock.instant()));
    }

    private Optional<BlobInfo> readInfo(String hash, Path p) {
        try {
            BasicFileAttributes a = Files.readAttributes(p, BasicFileAttributes.class);
            return Optional.of(new BlobInfo(hash, a.size(), a.lastModifiedTime().toInstant()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new TransientStorageException("failed to stat blob " + hash, e);
        }
    }

    private boolean isHash(String name) {
        return name.length() == algo.hexLen && name.chars().allMatch(c -> Character.digit(c, 16) >= 0 && !Character.isUpperCase(c));
    }

    private static boolean modifiedBefore(Path p, Instant t) throws IOException {
        try {
            return Files.getLastModifiedTime(p).toInstant().isBefore(t);
        } catch (NoSuchFileException promotedMeanwhile) {
            return false;
        }
    }

    private static void discard(Path tmp, Throwable primary) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
