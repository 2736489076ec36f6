package configscanner;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.fail;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.ImmutableSet;

import configscanner.ConfigScanException.Phase;
import configscanner.TestRepos.Upstream;
import configscanner.scanners.FileScanner;

public class RepoUpdaterTest {

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private Upstream upstream;
  private MirrorRepository repo;
  private RepoUpdater updater;

  @Before
  public void before() throws Exception {
    upstream = new Upstream(temp.newFolder("upstream"));
    upstream.write("a.yaml", "a: 1").commit("first");
    repo = MirrorRepository.open(upstream.identity(), temp.newFolder("clones").toPath(), ImmutableSet.of("main"));
    updater = new RepoUpdater(repo);
  }

  @After
  public void after() {
    repo.close();
    upstream.close();
  }

  private Map<String, List<FileScanner>> scanners(RecordingScanner scanner) {
    return Collections.singletonMap("main", Arrays.<FileScanner> asList(scanner));
  }

  @Test
  public void testPullRecordsPushTime() throws Exception {
    // given
    upstream.pushedAt = 1712345678L;
    // when
    ScanPosition position = updater.pull(upstream);
    // then
    assertThat(position.lastModified, is(1712345678L));
    assertThat(position.refPositions.get("refs/heads/main").hash, is(upstream.tip("main")));
    assertThat(PushTimeCheckpoint.forClone(repo.location()).read(), is(1712345678L));
    assertThat(repo.lock().isHeldByCurrentThread(), is(false));
  }

  @Test
  public void testScanReportsThePushTimeOfTheLastPull() throws Exception {
    // given
    updater.pull(upstream);
    upstream.pushedAt = 1800000000L;
    RecordingScanner scanner = new RecordingScanner();
    // when
    ScanPosition position = updater.scan(scanners(scanner), false);
    // then
    assertThat(position.lastModified, is(1700000000L));
    assertThat(scanner.files.containsKey("a.yaml"), is(true));
  }

  @Test
  public void testScanBeforePullFails() {
    try {
      updater.scan(scanners(new RecordingScanner()), false);
      fail();
    } catch (ConfigScanException e) {
      assertThat(e.getPhase(), is(Phase.SCAN));
    }
  }

  @Test
  public void testUncheckedScannerFailureIsAScanFailure() throws Exception {
    // given a scanner that blows up
    updater.pull(upstream);
    FileScanner broken = new FileScanner() {
      @Override
      public void scanFile(Path path, Object content) {
        throw new IllegalStateException("bad state for " + path);
      }

      @Override
      public void finish() {
      }
    };
    // when
    try {
      updater.scan(Collections.singletonMap("main", Arrays.asList(broken)), false);
      fail();
    } catch (ConfigScanException e) {
      // then
      assertThat(e.getPhase(), is(Phase.SCAN));
      assertThat(e.getCause(), instanceOf(IllegalStateException.class));
    }
    assertThat(repo.hasRef("refs/tags/" + ConfigScan.watermarkTag("main")), is(false));
    assertThat(repo.lock().isHeldByCurrentThread(), is(false));
  }

  @Test
  public void testPullOfRewrittenHistoryFails() throws Exception {
    // given
    updater.pull(upstream);
    String before = upstream.tip("main");
    upstream.git.commit().setAmend(true).setMessage("amended").setSign(false).call();
    // when
    try {
      updater.pull(upstream);
      fail();
    } catch (ConfigScanException e) {
      // then
      assertThat(e.getPhase(), is(Phase.UPDATE));
    }
    assertThat(repo.refPositions().get("refs/heads/main").hash, is(before));
  }

  @Test
  public void testPullFromMissingUpstreamFails() throws Exception {
    // given an identity whose url goes nowhere
    RepoIdentity missing = new RepoIdentity("example.com", "org", "gone", temp.getRoot().toPath().resolve("nowhere").toString());
    try (MirrorRepository other = MirrorRepository.open(missing, temp.newFolder("other").toPath(), ImmutableSet.of("main"))) {
      // when
      new RepoUpdater(other).pull(upstream);
      fail();
    } catch (ConfigScanException e) {
      // then
      assertThat(e.getPhase(), is(Phase.UPDATE));
    }
  }

  @Test
  public void testDeleteRemovesCloneAndCheckpoint() throws Exception {
    // given
    updater.pull(upstream);
    Path checkpoint = PushTimeCheckpoint.forClone(repo.location()).getFile();
    assertThat(Files.exists(checkpoint), is(true));
    // when
    updater.delete();
    // then
    assertThat(Files.exists(repo.location()), is(false));
    assertThat(Files.exists(checkpoint), is(false));
    // and deleting again is fine
    updater.delete();
  }

  @Test
  public void testStatusPatch() throws Exception {
    // given
    ScanPosition pulled = updater.pull(upstream);
    // when
    String yaml = new StatusPatch().clonePosition(pulled).configScanPosition(pulled).toYaml();
    // then
    assertThat(yaml, containsString("status:"));
    assertThat(yaml, containsString("clonePosition:"));
    assertThat(yaml, containsString("configScanPosition:"));
    assertThat(yaml, containsString("refs/heads/main:"));
    assertThat(yaml, containsString("lastModified: 1700000000"));
  }

  @Test
  public void testStatusPatchAfterDelete() {
    String yaml = new StatusPatch().deleted().toYaml();
    assertThat(yaml, is("status:\n  clonePosition: null\n"));
  }

}
