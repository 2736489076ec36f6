package configscanner.scanners;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Visits the changed config files of one branch.
 *
 * A scanner sees every file of its branch before {@link #finish()} is called. Files may be
 * seen again after a failed run, so scanners must tolerate re-processing the same content.
 */
public interface FileScanner {

  /**
   * @param path the file's path relative to the repository root
   * @param content the parsed file, or null if it was deleted or could not be parsed
   */
  void scanFile(Path path, Object content) throws IOException;

  void finish() throws IOException;

}
