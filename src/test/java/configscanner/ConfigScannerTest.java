package configscanner;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.fail;

import java.io.File;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.rvesse.airline.Cli;

import configscanner.ConfigScanner.RepoCommand;
import configscanner.ConfigScanner.RosterCommand;
import configscanner.ConfigScanner.SyncStoreCommand;

public class ConfigScannerTest {

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private final Cli<Runnable> cli = new Cli<>(ConfigScanner.class);

  @Test
  public void testParseRepo() {
    // when
    Runnable command = cli.parse("repo", "https://github.com/org/repo", "/clones", "--pull", "--config-scan", "--branch", "feature", "--enable-scanner", "list");
    // then
    assertThat(command, instanceOf(RepoCommand.class));
    RepoCommand repo = (RepoCommand) command;
    assertThat(repo.arguments, contains("https://github.com/org/repo", "/clones"));
    assertThat(repo.pull, is(true));
    assertThat(repo.configScan, is(true));
    assertThat(repo.delete, is(false));
    assertThat(repo.branch, is("feature"));
    assertThat(repo.enabledScanners, contains("list"));
  }

  @Test
  public void testParseSyncStore() {
    SyncStoreCommand sync = (SyncStoreCommand) cli.parse("sync-store", "/clones/org/repo", "bucket", "--prefix", "p", "--exclude", "keep", "--exclude", "also");
    assertThat(sync.arguments, contains("/clones/org/repo", "bucket"));
    assertThat(sync.prefix, is("p"));
    assertThat(sync.exclusions, contains("keep", "also"));
  }

  @Test
  public void testRepoWithNothingToDoIsUsageError() {
    // given
    RepoCommand repo = (RepoCommand) cli.parse("repo", "https://github.com/org/repo", temp.getRoot().getPath());
    // when
    repo.run();
    // then
    assertThat(repo.exitCode, is(2));
  }

  @Test
  public void testUnknownScannerIsUsageError() {
    RepoCommand repo = (RepoCommand) cli.parse("repo", "https://github.com/org/repo", temp.getRoot().getPath(), "--config-scan", "--enable-scanner", "model-crd");
    repo.run();
    assertThat(repo.exitCode, is(2));
  }

  @Test
  public void testObjectStoreScannerNeedsBucket() {
    RepoCommand repo = (RepoCommand) cli.parse("repo", "https://github.com/org/repo", temp.getRoot().getPath(), "--config-scan", "--enable-scanner", "object-store");
    repo.run();
    assertThat(repo.exitCode, is(2));
  }

  @Test
  public void testScanBeforePullIsFailure() {
    // given
    RepoCommand repo = (RepoCommand) cli.parse("repo", "https://github.com/org/repo", temp.getRoot().getPath(), "--config-scan");
    // when
    repo.run();
    // then no checkpoint to read
    assertThat(repo.exitCode, is(1));
  }

  @Test
  public void testDeleteOfMissingCloneIsFine() {
    // given
    RepoCommand repo = (RepoCommand) cli.parse("repo", "https://github.com/org/repo", temp.getRoot().getPath(), "--delete");
    // when
    repo.run();
    // then
    assertThat(repo.exitCode, is(0));
    assertThat(new File(temp.getRoot(), "github.com/org/repo").exists(), is(false));
  }

  @Test
  public void testSyncMissingDirectoryIsFailure() {
    // given
    SyncStoreCommand sync = (SyncStoreCommand) cli.parse("sync-store", new File(temp.getRoot(), "missing").getPath(), "bucket");
    // when
    sync.run();
    // then
    assertThat(sync.exitCode, is(1));
  }

  @Test
  public void testRosterModes() {
    checkMode(true, "roster", "--all-workspaces");
    checkMode(true, "roster", "--workspace", "ws");
    checkMode(true, "roster", "--namespace", "ns", "--organization", "org", "--team", "t");
    checkMode(false, "roster");
    checkMode(false, "roster", "--all-workspaces", "--workspace", "ws");
    checkMode(false, "roster", "--namespace", "ns");
    checkMode(false, "roster", "--workspace", "ws", "--team", "t");
  }

  private void checkMode(boolean valid, String... args) {
    RosterCommand roster = (RosterCommand) cli.parse(args);
    try {
      roster.checkMode();
      if (!valid) {
        fail("Expected " + String.join(" ", args) + " to be rejected");
      }
    } catch (IllegalArgumentException e) {
      if (valid) {
        throw e;
      }
    }
  }

}
