package configscanner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import configscanner.scanners.FileScanner;

/** Remembers what it was given, in order; can be told to fail on a path. */
public class RecordingScanner implements FileScanner {

  public final Map<String, Object> files = new LinkedHashMap<>();
  public final List<String> events = new ArrayList<>();
  public String failOn;

  @Override
  public void scanFile(Path path, Object content) throws IOException {
    String p = path.toString().replace('\\', '/');
    if (p.equals(failOn)) {
      throw new IOException("failing on " + p);
    }
    files.put(p, content);
    events.add("scan " + p);
  }

  @Override
  public void finish() {
    events.add("finish");
  }

}
