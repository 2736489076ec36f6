package configscanner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of a pull or a scan: where each tracked branch is, and the upstream
 * push time (epoch seconds) recorded when we last fetched.
 */
public class ScanPosition {

  public final Map<String, BranchPosition> refPositions;
  public final long lastModified;

  public ScanPosition(Map<String, BranchPosition> refPositions, long lastModified) {
    this.refPositions = Collections.unmodifiableMap(new LinkedHashMap<>(refPositions));
    this.lastModified = lastModified;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> refs = new LinkedHashMap<>();
    refPositions.forEach((ref, position) -> refs.put(ref, position.toMap()));
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("refPositions", refs);
    m.put("lastModified", lastModified);
    return m;
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

}
