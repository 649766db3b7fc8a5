package io.tick4j.lock;

import io.tick4j.Job;
import io.tick4j.core.LockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Advisory, cross-process job lock backed by one lock file per job.
 *
 * <p>The lock file is {@code <directory>/<md5(jobId)>.lock}. It is created on first use and never
 * deleted, so later runs find the same file. OS file locks are held per JVM, so threads of the same
 * JVM are serialized by an in-memory lock taken before the file lock.
 *
 * <p>Only processes that go through this guard are excluded; the lock does not stop other writers.
 */
public class FileLockGuard implements LockGuard {
    private static final Logger log = LoggerFactory.getLogger(FileLockGuard.class);

    // shared by all guards of this JVM, keyed by absolute lock file path
    private static final ConcurrentHashMap<String, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private final Path directory;

    /**
     * Lock files in {@code java.io.tmpdir}.
     */
    public FileLockGuard() {
        this(Paths.get(System.getProperty("java.io.tmpdir")));
    }

    public FileLockGuard(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void withExclusiveLock(String jobId, Job body) throws Exception {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(body, "body must not be null");

        Path lockFile = lockFileFor(jobId);
        ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(
                lockFile.toAbsolutePath().normalize().toString(), k -> new ReentrantLock());

        local.lock();
        try (FileChannel channel = open(lockFile);
             FileLock ignored = acquire(channel, lockFile)) {
            log.debug("Lock acquired jobId={} file={}", jobId, lockFile);
            body.execute();
        } finally {
            local.unlock();
        }
    }

    /**
     * Path of the lock file used for {@code jobId}.
     */
    public Path lockFileFor(String jobId) {
        return directory.resolve(tokenFor(jobId) + ".lock");
    }

    /**
     * Filesystem-safe, stable token for a job id: the lowercase hex MD5 of its UTF-8 bytes.
     */
    public static String tokenFor(String jobId) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(jobId.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private FileChannel open(Path lockFile) {
        try {
            Files.createDirectories(directory);
            return FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new LockException("Cannot open lock file " + lockFile, e);
        }
    }

    private static FileLock acquire(FileChannel channel, Path lockFile) {
        try {
            return channel.lock();
        } catch (IOException e) {
            throw new LockException("Cannot lock " + lockFile, e);
        }
    }
}
