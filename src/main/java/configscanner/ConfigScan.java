package configscanner;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import configscanner.scanners.FileScanner;

/**
 * Feeds the config files changed on each branch to that branch's scanners.
 *
 * How far each branch has been scanned is recorded as a tag, {@code _SCANNED_<branch>},
 * which is only moved once every scanner for the branch has finished. So if a scanner fails,
 * the next run scans the same files again.
 *
 * Files deleted since the last scan are passed to scanners with null content, after the
 * changed files; so are files that do not parse.
 */
public class ConfigScan {

  private static final Logger log = LoggerFactory.getLogger(ConfigScan.class);
  public static final String tagPrefix = "_SCANNED_";
  public static final String tagMessage = "Config scanner ran to here";

  private final MirrorRepository repo;
  private final Predicate<String> scannableFile;

  public ConfigScan(MirrorRepository repo) {
    this(repo, PathRules.configFiles().asFileFilter());
  }

  public ConfigScan(MirrorRepository repo, Predicate<String> scannableFile) {
    this.repo = repo;
    this.scannableFile = scannableFile;
  }

  public static String watermarkTag(String branch) {
    return tagPrefix + branch;
  }

  /**
   * Scans each branch, in map order; branches we have no local copy of are skipped.
   *
   * @param fullScan scan every file rather than only those changed since the last scan
   * @return the paths dispatched, per scanned branch
   */
  public Map<String, List<String>> run(Map<String, List<FileScanner>> scannersByBranch, boolean fullScan)
    throws IOException,
    GitAPIException {
    repo.lock().checkHeld();
    Map<String, List<String>> scanned = new LinkedHashMap<>();
    for (Map.Entry<String, List<FileScanner>> e : scannersByBranch.entrySet()) {
      String branch = e.getKey();
      if (!repo.hasRef(Constants.R_HEADS + branch)) {
        log.info("No local branch {} in {}, skipping", branch, repo.location());
        continue;
      }
      scanned.put(branch, scanBranch(branch, e.getValue(), fullScan));
    }
    return scanned;
  }

  private List<String> scanBranch(String branch, List<FileScanner> scanners, boolean fullScan) throws IOException, GitAPIException {
    repo.checkoutAndReset(Constants.R_HEADS + branch);

    String tag = watermarkTag(branch);
    String since = !fullScan && repo.hasRef(Constants.R_TAGS + tag) ? tag : null;
    Set<String> changed = repo.changedFiles(since, Constants.HEAD, scannableFile);
    Set<String> deleted = repo.deletedFiles(since, Constants.HEAD, scannableFile);
    log.info(
      "Scanning {} changed and {} deleted files on {} since {}",
      changed.size(),
      deleted.size(),
      branch,
      since == null ? "the beginning" : since);

    List<String> dispatched = new ArrayList<>();
    for (String path : changed) {
      dispatch(scanners, path, ConfigFileParser.parse(repo.location().resolve(path)));
      dispatched.add(path);
    }
    for (String path : deleted) {
      dispatch(scanners, path, null);
      dispatched.add(path);
    }
    for (FileScanner scanner : scanners) {
      scanner.finish();
    }

    repo.createTag(tag, tagMessage);
    return dispatched;
  }

  private static void dispatch(List<FileScanner> scanners, String path, Object content) throws IOException {
    log.debug("Scanning file {}", path);
    Path relative = Paths.get(path);
    for (FileScanner scanner : scanners) {
      scanner.scanFile(relative, content);
    }
  }

}
