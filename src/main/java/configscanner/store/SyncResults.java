package configscanner.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The object keys a reconciliation added, updated and deleted. */
public class SyncResults {

  public final List<String> added;
  public final List<String> updated;
  public final List<String> deleted;

  public SyncResults(List<String> added, List<String> updated, List<String> deleted) {
    this.added = Collections.unmodifiableList(new ArrayList<>(added));
    this.updated = Collections.unmodifiableList(new ArrayList<>(updated));
    this.deleted = Collections.unmodifiableList(new ArrayList<>(deleted));
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("added", new ArrayList<>(added));
    m.put("updated", new ArrayList<>(updated));
    m.put("deleted", new ArrayList<>(deleted));
    return m;
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

}
