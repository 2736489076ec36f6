package configscanner.scanners;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs each scanned file; mostly useful for checking what a scan would visit. */
public class FileListScanner implements FileScanner {

  public static final String NAME = "list";
  private static final Logger log = LoggerFactory.getLogger(FileListScanner.class);

  private final String branch;
  private final List<Path> scanned = new ArrayList<>();
  private final List<Path> absent = new ArrayList<>();

  public FileListScanner(ScannerContext context) {
    this.branch = context.branch;
  }

  @Override
  public void scanFile(Path path, Object content) {
    if (content == null) {
      log.info("{}: {} (no content)", branch, path);
      absent.add(path);
    } else {
      log.info("{}: {}", branch, path);
    }
    scanned.add(path);
  }

  @Override
  public void finish() {
    log.info("{}: scanned {} files, {} without content", branch, scanned.size(), absent.size());
  }

  public List<Path> getScanned() {
    return Collections.unmodifiableList(scanned);
  }

}
