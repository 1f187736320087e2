package com.clawcron.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Instance lock. Ensures only one scheduler service runs against a given
 * jobs file. Uses OS-level advisory locking via {@link FileLock} on a
 * sibling {@code <store>.lock} file.
 * <p>
 * The lock file itself is never deleted: every holder locks the same inode,
 * so a waiter can never end up holding a lock on an unlinked file. Releasing
 * clears the owner record while the lock is still held.
 * <p>
 * The lock does not stop other tools from writing the jobs file directly;
 * it only keeps two long-running schedulers from dispatching the same jobs.
 */
@Slf4j
public class InstanceLock {

    private static final long DEFAULT_TIMEOUT_MS = 5000;
    private static final long DEFAULT_POLL_INTERVAL_MS = 100;

    /**
     * Lock files held by this JVM. Opening a second channel on a locked file and
     * closing it can drop the OS lock on some platforms, so local holders are
     * checked first.
     */
    private static final Set<Path> HELD = ConcurrentHashMap.newKeySet();

    /**
     * Handle to a held instance lock. Call {@link #release()} when done.
     */
    public static class LockHandle implements Closeable {
        private final Path lockPath;
        private final FileChannel channel;
        private final FileLock lock;
        private volatile boolean released = false;

        LockHandle(Path lockPath, FileChannel channel, FileLock lock) {
            this.lockPath = lockPath;
            this.channel = channel;
            this.lock = lock;
        }

        public Path getLockPath() {
            return lockPath;
        }

        public boolean isReleased() {
            return released;
        }

        public void release() {
            if (released)
                return;
            released = true;
            try {
                channel.truncate(0);
            } catch (IOException e) {
                log.debug("Failed to clear lock owner: {}", e.getMessage());
            }
            try {
                lock.release();
            } catch (IOException e) {
                log.debug("Failed to release lock: {}", e.getMessage());
            }
            closeQuietly(channel);
            HELD.remove(lockPath);
        }

        @Override
        public void close() {
            release();
        }
    }

    /**
     * Thrown when the instance lock cannot be acquired.
     */
    public static class InstanceLockError extends RuntimeException {
        public InstanceLockError(String message) {
            super(message);
        }

        public InstanceLockError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Lock file that guards the given jobs file.
     */
    public static Path lockPathFor(Path storePath) {
        return storePath.resolveSibling(storePath.getFileName() + ".lock");
    }

    /**
     * Whether some scheduler currently holds the lock guarding
     * {@code storePath}. A lock file left behind by a crashed process does not
     * count.
     */
    public static boolean isLocked(Path storePath) {
        Path lockPath = lockPathFor(storePath).toAbsolutePath().normalize();
        if (HELD.contains(lockPath)) {
            return true;
        }
        if (!Files.exists(lockPath)) {
            return false;
        }
        if (!HELD.add(lockPath)) {
            return true;
        }
        try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.WRITE)) {
            FileLock probe = channel.tryLock();
            if (probe == null) {
                return true;
            }
            probe.release();
            return false;
        } catch (OverlappingFileLockException e) {
            return true;
        } catch (IOException e) {
            log.debug("Lock probe failed: {}", e.getMessage());
            return false;
        } finally {
            HELD.remove(lockPath);
        }
    }

    /**
     * Attempt to acquire the lock guarding {@code storePath}.
     *
     * @throws InstanceLockError if the lock cannot be acquired within the timeout
     */
    public static LockHandle acquire(Path storePath) {
        return acquire(storePath, DEFAULT_TIMEOUT_MS, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Attempt to acquire the lock with custom timeouts.
     */
    public static LockHandle acquire(Path storePath, long timeoutMs, long pollIntervalMs) {
        Path lockPath = lockPathFor(storePath).toAbsolutePath().normalize();
        Path lockDir = lockPath.getParent();

        try {
            if (lockDir != null) {
                Files.createDirectories(lockDir);
            }
        } catch (IOException e) {
            throw new InstanceLockError("Failed to create lock directory: " + lockDir, e);
        }

        long startedAt = System.currentTimeMillis();

        do {
            FileChannel channel = null;
            if (HELD.add(lockPath)) {
                try {
                    channel = FileChannel.open(lockPath,
                            StandardOpenOption.CREATE,
                            StandardOpenOption.WRITE);

                    FileLock lock = channel.tryLock();
                    if (lock != null) {
                        String payload = String.format(
                                "{\"pid\":%d,\"createdAt\":\"%s\",\"store\":\"%s\"}",
                                ProcessHandle.current().pid(),
                                Instant.now().toString(),
                                storePath.toString().replace("\\", "\\\\"));
                        channel.truncate(0);
                        channel.write(ByteBuffer.wrap(payload.getBytes(StandardCharsets.UTF_8)));
                        channel.force(true);

                        log.info("Acquired instance lock: {}", lockPath);
                        return new LockHandle(lockPath, channel, lock);
                    }
                    // Held by another process
                    closeQuietly(channel);
                } catch (OverlappingFileLockException | IOException e) {
                    log.debug("Lock attempt failed: {}", e.getMessage());
                    closeQuietly(channel);
                }
                HELD.remove(lockPath);
            }

            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InstanceLockError("Lock acquisition interrupted");
            }
        } while (System.currentTimeMillis() - startedAt < timeoutMs);

        throw new InstanceLockError(
                "Scheduler already running for this store; lock timeout after " + timeoutMs + "ms at: " + lockPath);
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null)
            return;
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close lock channel: {}", e.getMessage());
        }
    }
}
