package configscanner.scanners;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import configscanner.RepoIdentity;

/** What a scanner is created for: which repo, clone, branch and namespace. */
public class ScannerContext {

  public final RepoIdentity identity;
  public final Path location;
  public final String branch;
  public final String namespace;
  public final boolean production;
  public final Map<String, String> options;

  public ScannerContext(
    RepoIdentity identity,
    Path location,
    String branch,
    String namespace,
    boolean production,
    Map<String, String> options) {
    this.identity = identity;
    this.location = location;
    this.branch = branch;
    this.namespace = namespace;
    this.production = production;
    this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
  }

  public String option(String name, String defaultValue) {
    return options.getOrDefault(name, defaultValue);
  }

}
