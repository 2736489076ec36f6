package configscanner.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.jooq.lambda.Seq;

/** An in-memory {@link ObjectStore} that also records which keys were written/deleted. */
public class StubObjectStore implements ObjectStore {

  private final Map<String, byte[]> objects = new TreeMap<>();
  private final List<String> puts = new ArrayList<>();
  private final List<String> deletes = new ArrayList<>();

  @Override
  public List<String> list(String prefix) {
    return Seq.seq(objects.keySet()).filter(k -> k.startsWith(prefix)).toList();
  }

  @Override
  public byte[] get(String key) {
    byte[] data = objects.get(key);
    return data == null ? null : data.clone();
  }

  @Override
  public void put(String key, Path file) throws IOException {
    objects.put(key, Files.readAllBytes(file));
    puts.add(key);
  }

  @Override
  public void delete(String key) {
    objects.remove(key);
    deletes.add(key);
  }

  /** Seeds an object without recording it as a put. */
  public void write(String key, String content) {
    objects.put(key, content.getBytes(StandardCharsets.UTF_8));
  }

  /** @return the object's content as a string, or null */
  public String read(String key) {
    byte[] data = objects.get(key);
    return data == null ? null : new String(data, StandardCharsets.UTF_8);
  }

  public List<String> getKeys() {
    return new ArrayList<>(objects.keySet());
  }

  public List<String> getPuts() {
    return puts;
  }

  public List<String> getDeletes() {
    return deletes;
  }

  public void clearHistory() {
    puts.clear();
    deletes.clear();
  }

}
