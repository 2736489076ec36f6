package configscanner;

import java.nio.file.Path;
import java.util.function.Supplier;

import org.slf4j.Logger;

public class Utils {

  public static <T> T time(Logger log, String action, Supplier<T> s) {
    log.info("Starting " + action);
    long start = System.currentTimeMillis();
    T result = s.get();
    long stop = System.currentTimeMillis();
    log.info("Completed " + action + ": " + (stop - start) + "ms");
    return result;
  }

  /** @return {@code path} relative to {@code root}, always with forward slashes */
  public static String relativeKey(Path root, Path path) {
    return root.relativize(path).toString().replace('\\', '/');
  }

}
