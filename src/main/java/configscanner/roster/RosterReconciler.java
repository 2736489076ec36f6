package configscanner.roster;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Sets;

/**
 * Creates, deletes and updates the repository records of a namespace so they match the
 * repositories the remote host lists for an organization.
 *
 * Only records from this integration are considered, see {@link RepoRecordStore#list()}. A
 * failure part way leaves the earlier mutations in place; re-running picks up where it left off.
 */
public class RosterReconciler {

  private static final Logger log = LoggerFactory.getLogger(RosterReconciler.class);

  private final RemoteRoster remote;
  private final RepoRecordStore store;
  private final SyncTarget target;

  public RosterReconciler(RemoteRoster remote, RepoRecordStore store, SyncTarget target) {
    this.remote = remote;
    this.store = store;
    this.target = target;
  }

  public RosterResults reconcile() throws IOException {
    Map<String, RepoRecord> live = byName(remote.repositories());
    Map<String, RepoRecord> existing = byName(store.list());
    log.info("{}: {} repos upstream, {} records in {}", target, live.size(), existing.size(), target.namespace);

    List<String> removed = new ArrayList<>(Sets.difference(existing.keySet(), live.keySet()));
    for (String name : removed) {
      log.info("Removing repo {} from {}", name, target.namespace);
      store.delete(name);
    }

    List<String> added = new ArrayList<>(Sets.difference(live.keySet(), existing.keySet()));
    for (String name : added) {
      log.info("Adding repo {} to {}", name, target.namespace);
      store.create(live.get(name).withSource(target.source()), target.workspace);
    }

    List<String> updated = new ArrayList<>();
    for (String name : Sets.intersection(live.keySet(), existing.keySet())) {
      Long upstream = live.get(name).lastModified;
      Long recorded = existing.get(name).lastModified;
      if (upstream != null && !Objects.equals(upstream, recorded)) {
        log.info("Updating repo {}, last modified {} -> {}", name, recorded, upstream);
        store.updateLastModified(name, upstream);
        updated.add(name);
      }
    }

    return new RosterResults(added, updated, removed);
  }

  private static Map<String, RepoRecord> byName(List<RepoRecord> records) {
    Map<String, RepoRecord> m = new TreeMap<>();
    records.forEach(r -> m.put(r.name, r));
    return m;
  }

}
