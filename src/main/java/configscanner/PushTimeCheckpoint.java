package configscanner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.io.FileUtils;

/**
 * The upstream push time (epoch seconds) recorded at our last fetch, kept next to the clone
 * in {@code <location>.upstream_push_time}.
 *
 * Written before fetching, since scanning one extra time is better than missing a push.
 */
public class PushTimeCheckpoint {

  private final Path file;

  public static PushTimeCheckpoint forClone(Path location) {
    return new PushTimeCheckpoint(location.resolveSibling(location.getFileName() + ".upstream_push_time"));
  }

  public PushTimeCheckpoint(Path file) {
    this.file = file;
  }

  public Path getFile() {
    return file;
  }

  public void write(long pushedAt) throws IOException {
    Files.createDirectories(file.getParent());
    FileUtils.writeStringToFile(file.toFile(), Long.toString(pushedAt), StandardCharsets.US_ASCII);
  }

  /** @throws IOException if there is no checkpoint (we have never pulled) or it is garbled */
  public long read() throws IOException {
    String text = FileUtils.readFileToString(file.toFile(), StandardCharsets.US_ASCII).trim();
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw new IOException("Invalid push time '" + text + "' in " + file, e);
    }
  }

  public void delete() throws IOException {
    Files.deleteIfExists(file);
  }

}
