package configscanner.roster;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class RosterReconcilerTest {

  private static final String source = "github:org";
  private final RemoteRoster remote = mock(RemoteRoster.class);
  private final StubRepoRecordStore store = new StubRepoRecordStore();
  private final SyncTarget target = new SyncTarget("org", null, "ns", "ws");
  private final RosterReconciler reconciler = new RosterReconciler(remote, store, target);

  private static RepoRecord record(String name, Long lastModified, String source) {
    return new RepoRecord(name, lastModified, "https://github.com/org/" + name + ".git", "git@github.com:org/" + name + ".git", "org", source);
  }

  @Test
  public void testReconcile() throws Exception {
    // given
    when(remote.repositories()).thenReturn(Arrays.asList(record("a", 10L, null), record("b", 20L, null), record("c", 30L, null)));
    store.put(record("b", 20L, source));
    store.put(record("c", 5L, source));
    store.put(record("d", 40L, source));
    store.put(record("e", 50L, "gitlab:org"));
    // when
    RosterResults results = reconciler.reconcile();
    // then
    assertThat(results.added, contains("a"));
    assertThat(results.updated, contains("c"));
    assertThat(results.removed, contains("d"));
    assertThat(store.getMutations(), containsInAnyOrder("create a", "update c", "delete d"));
    assertThat(store.getNames(), contains("a", "b", "c", "e"));
    assertThat(store.get("a").source, is("github:org"));
    assertThat(store.get("a").lastModified, is(10L));
    assertThat(store.get("c").lastModified, is(30L));
    assertThat(store.get("e").lastModified, is(50L));
  }

  @Test
  public void testSecondRunIsQuiet() throws Exception {
    // given
    when(remote.repositories()).thenReturn(Arrays.asList(record("a", 10L, null), record("b", 20L, null)));
    store.put(record("b", 1L, source));
    reconciler.reconcile();
    store.getMutations().clear();
    // when
    RosterResults results = reconciler.reconcile();
    // then
    assertThat(results.isEmpty(), is(true));
    assertThat(store.getMutations(), is(empty()));
  }

  @Test
  public void testUnknownUpstreamTimeLeavesRecordAlone() throws Exception {
    // given
    when(remote.repositories()).thenReturn(Collections.singletonList(record("a", null, null)));
    store.put(record("a", 10L, source));
    // when
    RosterResults results = reconciler.reconcile();
    // then
    assertThat(results.isEmpty(), is(true));
    assertThat(store.get("a").lastModified, is(10L));
  }

  @Test
  public void testEmptyUpstreamRemovesOurRecordsOnly() throws Exception {
    // given
    when(remote.repositories()).thenReturn(Collections.emptyList());
    store.put(record("a", 10L, "github:org:team"));
    store.put(record("manual", null, null));
    // when
    RosterResults results = reconciler.reconcile();
    // then
    assertThat(results.removed, contains("a"));
    assertThat(store.getNames(), contains("manual"));
  }

  @Test
  public void testRemoteFailureChangesNothing() throws Exception {
    // given
    when(remote.repositories()).thenThrow(new IOException("rate limited"));
    store.put(record("a", 10L, source));
    // when
    try {
      reconciler.reconcile();
      fail();
    } catch (IOException e) {
      // then
      assertThat(e.getMessage(), is("rate limited"));
    }
    assertThat(store.getMutations(), is(empty()));
  }

  @Test
  public void testSource() {
    assertThat(target.source(), is("github:org"));
    assertThat(new SyncTarget("org", "team", "ns", null).source(), is("github:org:team"));
    assertThat(new SyncTarget("org", "team", "ns", null).workspace, is(nullValue()));
  }

}
