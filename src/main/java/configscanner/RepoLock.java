package configscanner;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

/**
 * An exclusive, file-based lock for one repository identity.
 *
 * The lock is held both within this JVM (so threads queue up instead of tripping over
 * {@link java.nio.channels.OverlappingFileLockException}) and across processes via
 * {@link FileChannel#lock()}. Acquiring blocks with no timeout.
 *
 * This is not re-entrant: acquiring twice on the same thread is an error.
 */
public class RepoLock {

  private static final Logger log = LoggerFactory.getLogger(RepoLock.class);
  private static final String prefix = "_CONFIGSCANNER_LOCK_";
  private static final ConcurrentMap<Path, ReentrantLock> inProcess = new ConcurrentHashMap<>();

  /** @return the lock file for {@code id}, which lives in {@code parentDir}, next to the host directories */
  public static Path lockFileFor(Path parentDir, RepoIdentity id) {
    return parentDir.resolve(prefix + encode(id.host) + "+" + encode(id.organization) + "+" + encode(id.name));
  }

  // '+' is our separator, so escape it (and the escape char, and path separators)
  @VisibleForTesting
  static String encode(String component) {
    return component.replace("%", "%25").replace("+", "%2B").replace("/", "%2F").replace("\\", "%5C");
  }

  private final Path lockFile;
  private final ReentrantLock local;

  public RepoLock(Path parentDir, RepoIdentity id) {
    this.lockFile = lockFileFor(parentDir, id).toAbsolutePath().normalize();
    this.local = inProcess.computeIfAbsent(lockFile, k -> new ReentrantLock());
  }

  public Path getLockFile() {
    return lockFile;
  }

  /** Blocks until the lock is held. Close the returned handle to release it. */
  public Held acquire() throws IOException {
    if (local.isHeldByCurrentThread()) {
      throw new IllegalStateException("Lock " + lockFile + " is already held by this thread");
    }
    local.lock();
    try {
      Files.createDirectories(lockFile.getParent());
      FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      try {
        log.debug("Waiting for lock {}", lockFile);
        FileLock fileLock = channel.lock();
        log.debug("Locked {}", lockFile);
        return new Held(channel, fileLock);
      } catch (IOException | RuntimeException e) {
        channel.close();
        throw e;
      }
    } catch (IOException | RuntimeException e) {
      local.unlock();
      throw e;
    }
  }

  public boolean isHeldByCurrentThread() {
    return local.isHeldByCurrentThread();
  }

  /** @throws IllegalStateException if the current thread does not hold the lock */
  public void checkHeld() {
    if (!isHeldByCurrentThread()) {
      throw new IllegalStateException("Lock " + lockFile + " must be held for this operation");
    }
  }

  @Override
  public String toString() {
    return lockFile.toString();
  }

  /** A held lock; closing releases it. */
  public class Held implements AutoCloseable {
    private final FileChannel channel;
    private final FileLock fileLock;

    private Held(FileChannel channel, FileLock fileLock) {
      this.channel = channel;
      this.fileLock = fileLock;
    }

    @Override
    public void close() throws IOException {
      try {
        fileLock.release();
      } finally {
        try {
          channel.close();
        } finally {
          local.unlock();
          log.debug("Unlocked {}", lockFile);
        }
      }
    }
  }

}
