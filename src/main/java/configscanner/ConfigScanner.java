package configscanner;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.jar.Manifest;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.rvesse.airline.annotations.Arguments;
import com.github.rvesse.airline.annotations.Cli;
import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.github.rvesse.airline.help.Help;
import com.google.common.collect.ImmutableMap;

import configscanner.ConfigScanException.Phase;
import configscanner.ConfigScanner.RepoCommand;
import configscanner.ConfigScanner.RosterCommand;
import configscanner.ConfigScanner.SyncStoreCommand;
import configscanner.ConfigScanner.VersionCommand;
import configscanner.github.CredentialProvider;
import configscanner.github.GitHubAppCredentialProvider;
import configscanner.github.GitHubOrganization;
import configscanner.github.GitHubRemoteRepository;
import configscanner.roster.KubernetesRepoRecordStore;
import configscanner.roster.KubernetesWorkspaces;
import configscanner.roster.RosterReconciler;
import configscanner.roster.RosterResults;
import configscanner.roster.SyncTarget;
import configscanner.scanners.FileScanner;
import configscanner.scanners.ObjectStoreScanner;
import configscanner.scanners.ScannerContext;
import configscanner.scanners.ScannerRegistry;
import configscanner.store.ObjectStore;
import configscanner.store.S3ObjectStore;
import configscanner.store.SyncResults;
import configscanner.store.TreeReconciler;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

@Cli(name = "config-scanner", description = "keeps git mirrors current, scans their config files, and syncs them to object stores", commands = {
  RepoCommand.class,
  SyncStoreCommand.class,
  RosterCommand.class,
  VersionCommand.class }, defaultCommand = Help.class)
public class ConfigScanner {

  private static final Logger log = LoggerFactory.getLogger(ConfigScanner.class);
  static final int failureExitCode = 1;
  static final int usageExitCode = 2;
  static final int partialFailureExitCode = 3;

  static {
    LoggingConfig.init();
  }

  public static void main(String[] args) throws Exception {
    com.github.rvesse.airline.Cli<Runnable> cli = new com.github.rvesse.airline.Cli<>(ConfigScanner.class);
    Runnable command = cli.parse(args);
    command.run();
    if (command instanceof BaseCommand && ((BaseCommand) command).exitCode != 0) {
      System.exit(((BaseCommand) command).exitCode);
    }
  }

  @Command(name = "version")
  public static class VersionCommand implements Runnable {
    @Override
    public void run() {
      System.out.println("Current Version: " + getVersion());
    }
  }

  public static abstract class BaseCommand implements Runnable {
    @Option(name = "--debug", description = "log debug output for config-scanner itself")
    public boolean debug;

    @Option(name = "--log-file", description = "also log to this file")
    public String logFile;

    int exitCode;

    @Override
    public final void run() {
      if (debug) {
        LoggingConfig.enableDebug();
      }
      if (logFile != null) {
        LoggingConfig.enableLogFile(Paths.get(logFile));
      }
      try {
        exitCode = runCommand();
      } catch (IllegalArgumentException e) {
        log.error(e.getMessage());
        exitCode = usageExitCode;
      } catch (ConfigScanException e) {
        log.error(e.getMessage(), e.getCause());
        exitCode = failureExitCode;
      }
    }

    /** @return the process exit code */
    protected abstract int runCommand();
  }

  public static abstract class GitHubCommand extends BaseCommand {
    @Option(name = "--app-id-from", description = "file containing the GitHub App id, default: $GITHUB_APP_ID")
    public String appIdFrom;

    @Option(name = "--app-private-key-from", description = "file containing the GitHub App private key (PKCS#8 PEM), default: $GITHUB_APP_PRIVATE_KEY")
    public String appPrivateKeyFrom;

    protected CredentialProvider credentials(String host, Phase phase) {
      try {
        return GitHubAppCredentialProvider.fromFilesOrEnvironment(host, appIdFrom, appPrivateKeyFrom);
      } catch (IOException e) {
        throw new ConfigScanException(phase, "could not load GitHub App credentials", e);
      }
    }
  }

  @Command(name = "repo", description = "pull, scan or delete the local mirror of a repository")
  public static class RepoCommand extends GitHubCommand {
    @Arguments(title = { "repourl", "dest" }, description = "repository URL, and the parent dir for clones")
    public List<String> arguments = new ArrayList<>();

    @Option(name = "--location", description = "clone here instead of <dest>/<host>/<org>/<name>; must end in <org>/<name>")
    public String location;

    @Option(name = "--pull", description = "update (fetch or clone) our copy of the repo from upstream")
    public boolean pull;

    @Option(name = "--config-scan", description = "scan for and process config files in the clone")
    public boolean configScan;

    @Option(name = "--full-scan", description = "scan every file, not just those changed since the last scan")
    public boolean fullScan;

    @Option(name = "--delete", description = "delete the local copy of the repo")
    public boolean delete;

    @Option(name = "--branch", description = "workspace branch to fetch and scan, in addition to main and develop, default: main")
    public String branch = "main";

    @Option(name = "--enable-scanner", description = "scanner to run, one of: list, object-store; can be repeated")
    public List<String> enabledScanners = new ArrayList<>();

    @Option(name = "--prod-namespace", description = "namespace for resources scanned from main, default: default")
    public String prodNamespace = "default";

    @Option(name = "--workspace-namespace", description = "namespace for resources scanned from other branches, default: default")
    public String workspaceNamespace = "default";

    @Option(name = "--store-bucket", description = "bucket for the object-store scanner")
    public String storeBucket;

    @Option(name = "--store-prefix", description = "key prefix for the object-store scanner")
    public String storePrefix = "";

    @Override
    protected int runCommand() {
      if (arguments.size() != 2) {
        throw new IllegalArgumentException("Expected <repourl> <dest>, got " + arguments);
      }
      if (!pull && !configScan && !delete) {
        throw new IllegalArgumentException("Nothing to do: pass --pull, --config-scan and/or --delete");
      }
      RepoIdentity identity = RepoIdentity.fromUrl(arguments.get(0));
      Path dest = Paths.get(arguments.get(1));
      ScannerRegistry registry = ScannerRegistry.defaults(this::objectStore, summary -> {
        log.info("Harvested: {}", summary.toJson());
      });
      registry.checkNames(enabledScanners);
      if (enabledScanners.contains(ObjectStoreScanner.NAME)) {
        requireBucket();
      }

      Set<String> branches = new LinkedHashSet<>();
      branches.add("main");
      branches.add("develop");
      branches.add(branch);
      StatusPatch patch = new StatusPatch();
      try (MirrorRepository repo = location == null
        ? MirrorRepository.open(identity, dest, branches)
        : MirrorRepository.openAt(identity, Paths.get(location), branches)) {
        RepoUpdater updater = new RepoUpdater(repo);
        if (pull) {
          GitHubRemoteRepository remote = authenticate(identity);
          patch.clonePosition(Utils.time(log, "pull of " + identity.cloneUrl(), () -> updater.pull(remote)));
        }
        if (configScan) {
          Map<String, List<FileScanner>> scanners = new LinkedHashMap<>();
          scanners.put("main", scanners(registry, repo, "main", prodNamespace, true));
          scanners.put("develop", scanners(registry, repo, "develop", workspaceNamespace, false));
          scanners.put(branch, scanners(registry, repo, branch, workspaceNamespace, false));
          patch.configScanPosition(Utils.time(log, "scan of " + identity.cloneUrl(), () -> updater.scan(scanners, fullScan)));
        }
        if (delete) {
          updater.delete();
          patch.deleted();
        }
      }
      System.out.print(patch.toYaml());
      return 0;
    }

    private GitHubRemoteRepository authenticate(RepoIdentity identity) {
      try {
        return GitHubRemoteRepository.authenticate(identity, credentials(identity.host, Phase.UPDATE));
      } catch (IOException e) {
        throw new ConfigScanException(Phase.UPDATE, "could not look up " + identity.cloneUrl(), e);
      }
    }

    private List<FileScanner> scanners(ScannerRegistry registry, MirrorRepository repo, String branch, String namespace, boolean production) {
      Map<String, String> options = ImmutableMap.of(ObjectStoreScanner.PREFIX_OPTION, storePrefix);
      return registry.create(enabledScanners, new ScannerContext(repo.identity(), repo.location(), branch, namespace, production, options));
    }

    private ObjectStore objectStore() {
      try {
        return S3ObjectStore.fromEnvironment(requireBucket());
      } catch (IOException e) {
        throw new ConfigScanException(Phase.SCAN, "could not connect to the object store", e);
      }
    }

    private String requireBucket() {
      if (storeBucket == null) {
        throw new IllegalArgumentException("--store-bucket is required by the object-store scanner");
      }
      return storeBucket;
    }
  }

  @Command(name = "sync-store", description = "make a prefix of an object store bucket match a local directory")
  public static class SyncStoreCommand extends BaseCommand {
    @Arguments(title = { "clone_dir", "bucket" }, description = "local directory, and the bucket to sync into")
    public List<String> arguments = new ArrayList<>();

    @Option(name = "--prefix", description = "key prefix to sync into, default: the top level")
    public String prefix = "";

    @Option(name = "--subdir", description = "sync only this directory under clone_dir")
    public String subdir = "";

    @Option(name = "--exclude", description = "top-level name under the prefix whose objects are never deleted; can be repeated")
    public List<String> exclusions = new ArrayList<>();

    @Option(name = "--repo-url", description = "hold this repository's lock while syncing; clone_dir must be its clone")
    public String repoUrl;

    @Override
    protected int runCommand() {
      if (arguments.size() != 2) {
        throw new IllegalArgumentException("Expected <clone_dir> <bucket>, got " + arguments);
      }
      Path cloneDir = Paths.get(arguments.get(0));
      SyncResults results = Utils.time(log, "sync of " + cloneDir, () -> {
        try {
          TreeReconciler reconciler = new TreeReconciler(cloneDir, S3ObjectStore.fromEnvironment(arguments.get(1)), prefix, subdir, exclusions);
          if (repoUrl == null) {
            return reconciler.reconcile();
          }
          RepoIdentity identity = RepoIdentity.fromUrl(repoUrl);
          try (RepoLock.Held held = new RepoLock(identity.parentDirOf(cloneDir), identity).acquire()) {
            return reconciler.reconcile();
          }
        } catch (IOException e) {
          throw new ConfigScanException(Phase.RECONCILE, "could not sync " + cloneDir, e);
        }
      });
      System.out.print(StatusPatch.toYaml(results.toMap()));
      return 0;
    }
  }

  @Command(name = "roster", description = "create, delete and update Repo records to match the repos of GitHub organizations")
  public static class RosterCommand extends GitHubCommand {
    @Option(name = "--host", description = "GitHub host, default: github.com")
    public String host = "github.com";

    @Option(name = "--all-workspaces", description = "sync every Workspace's organization into its namespace")
    public boolean allWorkspaces;

    @Option(name = "--workspace", description = "sync this Workspace's organization into its namespace")
    public String workspace;

    @Option(name = "--namespace", description = "sync into this namespace; needs --organization")
    public String namespace;

    @Option(name = "--organization", description = "sync the repos of this organization; needs --namespace")
    public String organization;

    @Option(name = "--team", description = "only sync repos this team can see; needs --organization and --namespace")
    public String team;

    @Override
    protected int runCommand() {
      checkMode();
      CredentialProvider credentials = credentials(host, Phase.ROSTER);
      boolean failed = false;
      try (KubernetesClient client = new KubernetesClientBuilder().build()) {
        Map<String, Object> output = new LinkedHashMap<>();
        for (SyncTarget target : targets(client)) {
          try {
            GitHubOrganization org = GitHubOrganization.authenticate(host, target.organization, target.team, credentials);
            RosterResults results = new RosterReconciler(org, new KubernetesRepoRecordStore(client, target.namespace), target).reconcile();
            output.put(target.namespace, results.toMap());
          } catch (IOException | RuntimeException e) {
            log.error("Could not sync " + target, e);
            failed = true;
          }
        }
        System.out.print(StatusPatch.toYaml(output));
      }
      return failed ? partialFailureExitCode : 0;
    }

    void checkMode() {
      int modes = (allWorkspaces ? 1 : 0) + (workspace != null ? 1 : 0) + (namespace != null || organization != null ? 1 : 0);
      if (modes != 1) {
        throw new IllegalArgumentException("Pass exactly one of --all-workspaces, --workspace, or --namespace with --organization");
      }
      if ((namespace == null) != (organization == null)) {
        throw new IllegalArgumentException("--namespace and --organization must be given together");
      }
      if (team != null && organization == null) {
        throw new IllegalArgumentException("--team needs --organization and --namespace");
      }
    }

    private List<SyncTarget> targets(KubernetesClient client) {
      try {
        if (allWorkspaces) {
          return new KubernetesWorkspaces(client).allTargets();
        } else if (workspace != null) {
          List<SyncTarget> one = new ArrayList<>();
          one.add(new KubernetesWorkspaces(client).forWorkspace(workspace));
          return one;
        } else {
          List<SyncTarget> one = new ArrayList<>();
          one.add(new SyncTarget(organization, StringUtils.trimToNull(team), namespace, null));
          return one;
        }
      } catch (IOException e) {
        throw new ConfigScanException(Phase.ROSTER, "could not find what to sync", e);
      }
    }
  }

  public static String getVersion() {
    String version = null;
    URL url = ConfigScanner.class.getResource("/META-INF/MANIFEST.MF");
    try {
      try (InputStream in = url.openStream()) {
        Manifest m = new Manifest(in);
        version = m.getMainAttributes().getValue("ConfigScanner-Version");
      }
    } catch (Exception e) {
      log.error("Error loading manifest", e);
    }
    return StringUtils.defaultIfEmpty(version, "unspecified");
  }

}
