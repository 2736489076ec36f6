package configscanner.roster;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.jooq.lambda.Seq;

/** An in-memory {@link RepoRecordStore} that remembers every mutation. */
public class StubRepoRecordStore implements RepoRecordStore {

  private final Map<String, RepoRecord> records = new TreeMap<>();
  private final List<String> mutations = new ArrayList<>();

  @Override
  public List<RepoRecord> list() {
    return Seq.seq(records.values()).filter(r -> r.source != null && r.source.startsWith(GITHUB_SOURCE_PREFIX)).toList();
  }

  @Override
  public void create(RepoRecord record, String workspace) {
    if (records.containsKey(record.name)) {
      throw new IllegalStateException("Record " + record.name + " already exists");
    }
    records.put(record.name, record);
    mutations.add("create " + record.name);
  }

  @Override
  public void delete(String name) {
    records.remove(name);
    mutations.add("delete " + name);
  }

  @Override
  public void updateLastModified(String name, long lastModified) {
    RepoRecord existing = records.get(name);
    if (existing == null) {
      throw new IllegalStateException("No record " + name);
    }
    records.put(name, existing.withLastModified(lastModified));
    mutations.add("update " + name);
  }

  /** Seeds a record (of any source) without recording a mutation. */
  public void put(RepoRecord record) {
    records.put(record.name, record);
  }

  public RepoRecord get(String name) {
    return records.get(name);
  }

  public List<String> getNames() {
    return new ArrayList<>(records.keySet());
  }

  public List<String> getMutations() {
    return mutations;
  }

}
