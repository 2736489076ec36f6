package configscanner.roster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The record names a roster reconciliation created, updated and removed. */
public class RosterResults {

  public final List<String> added;
  public final List<String> updated;
  public final List<String> removed;

  public RosterResults(List<String> added, List<String> updated, List<String> removed) {
    this.added = Collections.unmodifiableList(new ArrayList<>(added));
    this.updated = Collections.unmodifiableList(new ArrayList<>(updated));
    this.removed = Collections.unmodifiableList(new ArrayList<>(removed));
  }

  public boolean isEmpty() {
    return added.isEmpty() && updated.isEmpty() && removed.isEmpty();
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("added", new ArrayList<>(added));
    m.put("updated", new ArrayList<>(updated));
    m.put("removed", new ArrayList<>(removed));
    return m;
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

}
