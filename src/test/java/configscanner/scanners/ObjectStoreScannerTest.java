package configscanner.scanners;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import configscanner.store.StubObjectStore;

public class ObjectStoreScannerTest {

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private final StubObjectStore store = new StubObjectStore();
  private final List<HarvestSummary> summaries = new ArrayList<>();
  private Path root;
  private ObjectStoreScanner scanner;

  @Before
  public void before() throws Exception {
    root = temp.newFolder("repo").toPath();
    scanner = new ObjectStoreScanner(store, root, "git-harvester", "ws", "org/repo", "main", summaries::add);
  }

  private void write(String path, String content) throws Exception {
    FileUtils.writeStringToFile(root.resolve(path).toFile(), content, StandardCharsets.UTF_8);
  }

  @Test
  public void testKeyLayout() {
    assertThat(scanner.keyFor(Paths.get("dir/a.json")), is("git-harvester/ws/org/repo/main/dir/a.json"));
  }

  @Test
  public void testAddUpdateDelete() throws Exception {
    // given
    write("new.json", "N");
    write("changed.json", "C2");
    write("same.json", "S");
    store.write("git-harvester/ws/org/repo/main/changed.json", "C1");
    store.write("git-harvester/ws/org/repo/main/same.json", "S");
    store.write("git-harvester/ws/org/repo/main/gone.json", "G");
    // when
    scanner.scanFile(Paths.get("new.json"), null);
    scanner.scanFile(Paths.get("changed.json"), null);
    scanner.scanFile(Paths.get("same.json"), null);
    scanner.scanFile(Paths.get("gone.json"), null);
    scanner.finish();
    // then
    assertThat(summaries.size(), is(1));
    HarvestSummary summary = summaries.get(0);
    assertThat(summary.added, contains("git-harvester/ws/org/repo/main/new.json"));
    assertThat(summary.updated, contains("git-harvester/ws/org/repo/main/changed.json"));
    assertThat(summary.deleted, contains("git-harvester/ws/org/repo/main/gone.json"));
    assertThat(store.read("git-harvester/ws/org/repo/main/changed.json"), is("C2"));
    assertThat(store.getPuts().contains("git-harvester/ws/org/repo/main/same.json"), is(false));
  }

  @Test
  public void testSummaryJson() throws Exception {
    // given
    write("a.json", "A");
    scanner.scanFile(Paths.get("a.json"), null);
    // when
    scanner.finish();
    // then
    String json = summaries.get(0).toJson();
    assertThat(json, containsString("\"workspace\":\"ws\""));
    assertThat(json, containsString("\"repository\":\"org/repo\""));
    assertThat(json, containsString("\"added_keys\":[\"git-harvester/ws/org/repo/main/a.json\"]"));
    assertThat(json, containsString("\"deleted_keys\":[]"));
  }

  @Test
  public void testEmptyPrefixIsSkipped() {
    ObjectStoreScanner noPrefix = new ObjectStoreScanner(store, root, "", "ws", "org/repo", "main", summaries::add);
    assertThat(noPrefix.keyFor(Paths.get("a.json")), is("ws/org/repo/main/a.json"));
  }

  @Test
  public void testFinishResetsForTheNextBatch() throws Exception {
    // given
    write("a.json", "A");
    scanner.scanFile(Paths.get("a.json"), null);
    scanner.finish();
    // when
    scanner.finish();
    // then
    assertThat(summaries.get(1).isEmpty(), is(true));
    assertThat(summaries.get(1).added, is(empty()));
  }

}
