package configscanner.store;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The few object store operations we need, against a single bucket.
 *
 * Keys are slash-separated; "folders" exist only implicitly, as key prefixes.
 */
public interface ObjectStore {

  /** @return every key starting with {@code prefix} (all keys if it is empty) */
  List<String> list(String prefix) throws IOException;

  /** @return the object's content, or null if there is no such key */
  byte[] get(String key) throws IOException;

  /** Uploads {@code file} to {@code key}, replacing any existing object. */
  void put(String key, Path file) throws IOException;

  /** Deletes {@code key}; deleting a missing key is not an error. */
  void delete(String key) throws IOException;

}
