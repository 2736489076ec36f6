package configscanner;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.eclipse.jgit.api.errors.GitAPIException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import configscanner.ConfigScanException.Phase;
import configscanner.scanners.FileScanner;

/**
 * Runs the pull, scan and delete operations on a mirror, each holding the repo lock throughout.
 *
 * Failures come out as a {@link ConfigScanException} naming the phase; every phase is safe to re-run.
 */
public class RepoUpdater {

  private static final Logger log = LoggerFactory.getLogger(RepoUpdater.class);

  private final MirrorRepository repo;
  private final PushTimeCheckpoint checkpoint;

  public RepoUpdater(MirrorRepository repo) {
    this.repo = repo;
    this.checkpoint = PushTimeCheckpoint.forClone(repo.location());
  }

  /** Clones or fetches, recording the upstream push time first. */
  public ScanPosition pull(RemoteRepository remote) {
    try (RepoLock.Held held = repo.lock().acquire()) {
      // check the push time before fetching: scanning one extra time beats missing a push
      long pushedAt = remote.pushedAt();
      checkpoint.write(pushedAt);
      repo.update(remote);
      return new ScanPosition(repo.refPositions(), pushedAt);
    } catch (ConfigScanException e) {
      throw e;
    } catch (IOException | GitAPIException | RuntimeException e) {
      throw new ConfigScanException(Phase.UPDATE, "could not update " + repo, e);
    }
  }

  public ScanPosition scan(Map<String, List<FileScanner>> scannersByBranch, boolean fullScan) {
    try (RepoLock.Held held = repo.lock().acquire()) {
      long pushedAt = checkpoint.read();
      Map<String, List<String>> scanned = new ConfigScan(repo).run(scannersByBranch, fullScan);
      scanned.forEach((branch, paths) -> log.info("Scanned {} files on {}", paths.size(), branch));
      return new ScanPosition(repo.refPositions(), pushedAt);
    } catch (ConfigScanException e) {
      throw e;
    } catch (IOException | GitAPIException | RuntimeException e) {
      throw new ConfigScanException(Phase.SCAN, "could not scan " + repo, e);
    }
  }

  /** Removes the clone (and its checkpoint), if there is one. */
  public void delete() {
    try (RepoLock.Held held = repo.lock().acquire()) {
      repo.delete();
      checkpoint.delete();
    } catch (ConfigScanException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new ConfigScanException(Phase.DELETE, "could not delete " + repo, e);
    }
  }

}
