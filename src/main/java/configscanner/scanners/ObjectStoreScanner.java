package configscanner.scanners;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

import org.apache.commons.lang3.StringUtils;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import configscanner.store.ObjectStore;

/**
 * Copies each scanned file into an object store under
 * {@code <prefix>/<workspace>/<org>/<repo>/<branch>/<path>}, and removes it from there when it
 * is deleted in the repository.
 *
 * On {@link #finish()} the keys touched for the branch are handed to a sink as a {@link HarvestSummary}.
 */
public class ObjectStoreScanner implements FileScanner {

  public static final String NAME = "object-store";
  public static final String PREFIX_OPTION = "store-prefix";
  private static final Logger log = LoggerFactory.getLogger(ObjectStoreScanner.class);

  private final ObjectStore store;
  private final Path root;
  private final String keyPrefix;
  private final String workspace;
  private final String repository;
  private final String branch;
  private final Consumer<HarvestSummary> sink;
  private final List<String> added = new ArrayList<>();
  private final List<String> updated = new ArrayList<>();
  private final List<String> deleted = new ArrayList<>();

  public static ObjectStoreScanner create(ScannerContext context, ObjectStore store, Consumer<HarvestSummary> sink) {
    return new ObjectStoreScanner(
      store,
      context.location,
      context.option(PREFIX_OPTION, ""),
      context.namespace,
      context.identity.organization + "/" + context.identity.name,
      context.branch,
      sink);
  }

  public ObjectStoreScanner(
    ObjectStore store,
    Path root,
    String prefix,
    String workspace,
    String repository,
    String branch,
    Consumer<HarvestSummary> sink) {
    this.store = store;
    this.root = root;
    this.workspace = workspace;
    this.repository = repository;
    this.branch = branch;
    this.sink = sink;
    this.keyPrefix = Seq.of(StringUtils.strip(prefix, "/"), workspace, repository, branch).filter(StringUtils::isNotEmpty).toString("/");
  }

  String keyFor(Path path) {
    return keyPrefix + "/" + path.toString().replace('\\', '/');
  }

  @Override
  public void scanFile(Path path, Object content) throws IOException {
    Path local = root.resolve(path.toString());
    String key = keyFor(path);
    if (Files.isRegularFile(local)) {
      byte[] existing = store.get(key);
      if (existing == null) {
        log.info("Adding {}", key);
        store.put(key, local);
        added.add(key);
      } else if (!Arrays.equals(existing, Files.readAllBytes(local))) {
        log.info("Updating {}", key);
        store.put(key, local);
        updated.add(key);
      } else {
        log.debug("{} is unchanged", key);
      }
    } else {
      log.info("Deleting {}", key);
      store.delete(key);
      deleted.add(key);
    }
  }

  @Override
  public void finish() {
    HarvestSummary summary = new HarvestSummary(workspace, repository, branch, added, updated, deleted);
    added.clear();
    updated.clear();
    deleted.clear();
    sink.accept(summary);
  }

}
