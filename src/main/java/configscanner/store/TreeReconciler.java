package configscanner.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import configscanner.PathRules;
import configscanner.Utils;

/**
 * Makes the objects under a key prefix match the files of a local directory.
 *
 * A local file {@code <root>/<offset>/p} maps to the key {@code <prefix>/p}. Existing objects are
 * only re-uploaded when their bytes differ. Objects with no local counterpart are deleted, except
 * those whose first path segment (below the prefix) is an exclusion.
 *
 * With an empty prefix the whole bucket is shared, so an unmatched key is only deleted if it is
 * a single segment, or its first segment is a directory we have locally.
 *
 * Dot-files and dot-directories are never synchronized. Empty directories leave no trace in the store.
 */
public class TreeReconciler {

  private static final Logger log = LoggerFactory.getLogger(TreeReconciler.class);
  private static final PathRules hidden = PathRules.hiddenEntries();

  private final Path base;
  private final ObjectStore store;
  private final String prefix;
  private final Set<String> exclusions;

  /**
   * @param localRoot the directory to mirror, e.g. a clone
   * @param prefix the key prefix to mirror into, or empty for the top level
   * @param subdirOffset a directory under {@code localRoot} to mirror instead of the whole root, or empty
   * @param exclusions first segments (below the prefix) whose objects are never deleted
   */
  public TreeReconciler(Path localRoot, ObjectStore store, String prefix, String subdirOffset, Collection<String> exclusions) {
    String offset = StringUtils.strip(StringUtils.defaultString(subdirOffset), "/");
    this.base = offset.isEmpty() ? localRoot : localRoot.resolve(offset);
    this.store = store;
    this.prefix = StringUtils.strip(StringUtils.defaultString(prefix), "/");
    this.exclusions = Collections.unmodifiableSet(new LinkedHashSet<>(exclusions));
  }

  public SyncResults reconcile() throws IOException {
    return apply(plan());
  }

  public ReconciliationPlan plan() throws IOException {
    if (!Files.isDirectory(base)) {
      throw new IOException(base + " is not a directory");
    }
    List<String> localFiles = listLocalFiles();
    Set<String> localTopLevel = new TreeSet<>();
    try (Stream<Path> children = Files.list(base)) {
      children.filter(Files::isDirectory).map(p -> p.getFileName().toString()).filter(n -> !hidden.matches(n, true)).forEach(localTopLevel::add);
    }

    SortedSet<String> unmatched = new TreeSet<>(store.list(prefix.isEmpty() ? "" : prefix + "/"));
    SortedMap<String, Path> toAdd = new TreeMap<>();
    SortedMap<String, Path> toUpdate = new TreeMap<>();
    for (String relative : localFiles) {
      String key = keyFor(relative);
      Path file = base.resolve(relative);
      if (unmatched.remove(key)) {
        byte[] existing = store.get(key);
        if (existing == null) {
          // deleted since we listed
          toAdd.put(key, file);
        } else if (!Arrays.equals(existing, Files.readAllBytes(file))) {
          toUpdate.put(key, file);
        }
      } else {
        toAdd.put(key, file);
      }
    }

    SortedSet<String> toDelete = new TreeSet<>();
    for (String key : unmatched) {
      if (isDeletable(key, localTopLevel)) {
        toDelete.add(key);
      } else {
        log.debug("Keeping {}", key);
      }
    }

    ReconciliationPlan plan = new ReconciliationPlan(toAdd, toUpdate, toDelete);
    log.info("Plan for {} -> {}/{}: {}", base, store, prefix, plan);
    return plan;
  }

  private boolean isDeletable(String key, Set<String> localTopLevel) {
    if (key.endsWith("/")) {
      // a folder marker, not content
      return false;
    }
    String relative = prefix.isEmpty() ? key : key.substring(prefix.length() + 1);
    String first = StringUtils.substringBefore(relative, "/");
    if (exclusions.contains(first) || hidden.matchesAnySegment(relative)) {
      return false;
    }
    if (prefix.isEmpty() && relative.contains("/")) {
      return localTopLevel.contains(first);
    }
    return true;
  }

  /** Uploads and deletes per {@code plan}; a file that vanished since planning is deleted instead. */
  public SyncResults apply(ReconciliationPlan plan) throws IOException {
    List<String> added = new ArrayList<>();
    List<String> updated = new ArrayList<>();
    List<String> deleted = new ArrayList<>();
    for (Map.Entry<String, Path> e : plan.toAdd.entrySet()) {
      if (upload(e.getKey(), e.getValue())) {
        added.add(e.getKey());
      } else {
        deleted.add(e.getKey());
      }
    }
    for (Map.Entry<String, Path> e : plan.toUpdate.entrySet()) {
      if (upload(e.getKey(), e.getValue())) {
        updated.add(e.getKey());
      } else {
        deleted.add(e.getKey());
      }
    }
    for (String key : plan.toDelete) {
      log.info("Deleting {}", key);
      store.delete(key);
      deleted.add(key);
    }
    return new SyncResults(added, updated, deleted);
  }

  private boolean upload(String key, Path file) throws IOException {
    if (!Files.isRegularFile(file)) {
      log.info("{} disappeared, deleting {}", file, key);
      store.delete(key);
      return false;
    }
    log.info("Uploading {} to {}", file, key);
    store.put(key, file);
    return true;
  }

  private String keyFor(String relative) {
    return prefix.isEmpty() ? relative : prefix + "/" + relative;
  }

  private List<String> listLocalFiles() throws IOException {
    List<String> files = new ArrayList<>();
    try (Stream<Path> paths = Files.walk(base)) {
      paths.filter(Files::isRegularFile).forEach(p -> {
        String relative = Utils.relativeKey(base, p);
        if (!hidden.matchesAnySegment(relative)) {
          files.add(relative);
        }
      });
    }
    Collections.sort(files);
    return files;
  }

}
