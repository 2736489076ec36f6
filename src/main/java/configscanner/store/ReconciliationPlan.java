package configscanner.store;

import java.nio.file.Path;
import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.common.base.MoreObjects;

/**
 * The object store changes that make a prefix match a local tree.
 *
 * {@code toAdd} and {@code toUpdate} map object keys to the local files to upload.
 */
public class ReconciliationPlan {

  public final SortedMap<String, Path> toAdd;
  public final SortedMap<String, Path> toUpdate;
  public final SortedSet<String> toDelete;

  public ReconciliationPlan(SortedMap<String, Path> toAdd, SortedMap<String, Path> toUpdate, SortedSet<String> toDelete) {
    this.toAdd = Collections.unmodifiableSortedMap(new TreeMap<>(toAdd));
    this.toUpdate = Collections.unmodifiableSortedMap(new TreeMap<>(toUpdate));
    this.toDelete = Collections.unmodifiableSortedSet(new TreeSet<>(toDelete));
  }

  public boolean isEmpty() {
    return toAdd.isEmpty() && toUpdate.isEmpty() && toDelete.isEmpty();
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("toAdd", toAdd.keySet())
      .add("toUpdate", toUpdate.keySet())
      .add("toDelete", toDelete)
      .toString();
  }

}
