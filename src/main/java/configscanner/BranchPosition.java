package configscanner;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Where a branch points: commit hash, first line of the commit message, and commit time. */
public class BranchPosition {

  public final String hash;
  public final String summary;
  public final long commitDate;

  public BranchPosition(String hash, String summary, long commitDate) {
    this.hash = hash;
    this.summary = summary;
    this.commitDate = commitDate;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("hash", hash);
    m.put("summary", summary);
    m.put("commitDate", commitDate);
    return m;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof BranchPosition)) {
      return false;
    }
    BranchPosition other = (BranchPosition) o;
    return hash.equals(other.hash) && summary.equals(other.summary) && commitDate == other.commitDate;
  }

  @Override
  public int hashCode() {
    return Objects.hash(hash, summary, commitDate);
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

}
