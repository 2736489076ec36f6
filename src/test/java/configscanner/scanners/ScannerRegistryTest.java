package configscanner.scanners;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import configscanner.RepoIdentity;
import configscanner.store.StubObjectStore;

public class ScannerRegistryTest {

  private final AtomicInteger storesCreated = new AtomicInteger();
  private final ScannerRegistry registry = ScannerRegistry.defaults(() -> {
    storesCreated.incrementAndGet();
    return new StubObjectStore();
  }, summary -> {
  });
  private final ScannerContext context = new ScannerContext(
    new RepoIdentity("github.com", "org", "repo", "https://github.com/org/repo"),
    Paths.get("/clones/github.com/org/repo"),
    "main",
    "ws",
    true,
    Collections.singletonMap(ObjectStoreScanner.PREFIX_OPTION, "p"));

  @Test
  public void testNames() {
    assertThat(registry.names(), contains("list", "object-store"));
  }

  @Test
  public void testStoreOnlyCreatedWhenNeeded() {
    // when
    List<FileScanner> scanners = registry.create(Arrays.asList("list"), context);
    // then
    assertThat(scanners.get(0), instanceOf(FileListScanner.class));
    assertThat(storesCreated.get(), is(0));
  }

  @Test
  public void testStoreIsShared() {
    // when
    registry.create(Arrays.asList("object-store"), context);
    List<FileScanner> scanners = registry.create(Arrays.asList("object-store", "list"), context);
    // then
    assertThat(storesCreated.get(), is(1));
    assertThat(scanners.size(), is(2));
    assertThat(((ObjectStoreScanner) scanners.get(0)).keyFor(Paths.get("a.yaml")), is("p/ws/org/repo/main/a.yaml"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownScanner() {
    registry.create(Arrays.asList("model-crd"), context);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateRegistration() {
    registry.register("list", FileListScanner::new);
  }

  @Test
  public void testFileListScanner() {
    FileListScanner list = new FileListScanner(context);
    list.scanFile(Paths.get("a.yaml"), "a");
    list.scanFile(Paths.get("gone.yaml"), null);
    list.finish();
    assertThat(list.getScanned(), contains(Paths.get("a.yaml"), Paths.get("gone.yaml")));
  }

}
