package configscanner;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.jgit.api.FetchCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ResetCommand.ResetType;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffEntry.ChangeType;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.RefUpdate.Result;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.lib.StoredConfig;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.transport.FetchResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteConfig;
import org.eclipse.jgit.transport.TagOpt;
import org.eclipse.jgit.transport.TrackingRefUpdate;
import org.eclipse.jgit.transport.URIish;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.TreeFilter;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Sets;

/**
 * A local clone of a subset of an upstream repository's branches.
 *
 * Local branches only ever move by fast-forward, i.e. the ref is moved directly to the
 * fetched remote-tracking ref, never merged or rebased.
 *
 * {@link #open} is cheap and does no network I/O; the clone may not exist yet (or be
 * broken), in which case {@link #update} creates it. All mutating operations require
 * {@link #lock()} to be held by the calling thread.
 */
public class MirrorRepository implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(MirrorRepository.class);
  public static final String remoteName = "origin";
  private static final String initialBranch = "main";
  private static final String taggerName = "Config Scanner";
  private static final String taggerEmail = "configscanner@ai-pipeline.org";

  private final RepoIdentity identity;
  private final Path location;
  private final RepoLock lock;
  private final Set<String> branches;
  // null until a valid clone exists
  private Repository repo;

  /** Opens the mirror of {@code identity} at its default location under {@code parentDir}. */
  public static MirrorRepository open(RepoIdentity identity, Path parentDir, Set<String> branches) {
    return new MirrorRepository(identity, identity.locationUnder(parentDir), parentDir, branches);
  }

  /** Opens the mirror of {@code identity} at an explicit {@code location}, which must end in {@code org/name}. */
  public static MirrorRepository openAt(RepoIdentity identity, Path location, Set<String> branches) {
    return new MirrorRepository(identity, location, identity.parentDirOf(location), branches);
  }

  private MirrorRepository(RepoIdentity identity, Path location, Path parentDir, Set<String> branches) {
    if (branches.isEmpty() || branches.stream().anyMatch(StringUtils::isBlank)) {
      throw new IllegalArgumentException("At least one (non-blank) branch must be tracked: " + branches);
    }
    this.identity = identity;
    this.location = location.toAbsolutePath().normalize();
    this.lock = new RepoLock(parentDir, identity);
    this.branches = new LinkedHashSet<>(branches);
    this.repo = tryOpen(this.location);
  }

  public RepoIdentity identity() {
    return identity;
  }

  public Path location() {
    return location;
  }

  public RepoLock lock() {
    return lock;
  }

  public boolean isCloned() {
    return repo != null;
  }

  public Set<String> trackedBranches() {
    return Collections.unmodifiableSet(new TreeSet<>(branches));
  }

  @VisibleForTesting
  List<RefSpec> refSpecs() {
    return Seq.seq(new TreeSet<>(branches)).map(MirrorRepository::refSpec).toList();
  }

  /**
   * Clones or fetches, then fast-forwards every tracked branch.
   *
   * Branches that do not exist upstream are dropped from the tracked set. A clone that
   * cannot be opened is deleted and re-created from scratch.
   */
  public void update(RemoteRepository remote) throws IOException, GitAPIException {
    lock.checkHeld();
    log.info("Updating repo {} in {}", identity.cloneUrl(), location);

    Set<String> missing = Sets.difference(branches, remote.branchNames()).immutableCopy();
    if (!missing.isEmpty()) {
      log.info("Branches {} do not exist upstream, not fetching them", missing);
      branches.removeAll(missing);
    }

    // check again now that we hold the lock
    if (repo == null) {
      repo = tryOpen(location);
    }
    if (repo == null) {
      log.info("Repo {} does not exist in {}; cloning", identity.cloneUrl(), location);
      createEmptyClone();
    }

    if (branches.isEmpty()) {
      log.warn("None of the tracked branches exist upstream for {}", identity.cloneUrl());
      return;
    }

    log.info("Fetching {} into {}", identity.cloneUrl(), location);
    try (Git git = new Git(repo)) {
      FetchCommand fetch = git.fetch().setRemote(remoteName).setRefSpecs(refSpecs()).setTagOpt(TagOpt.NO_TAGS);
      if (remote.accessToken().isPresent()) {
        fetch.setCredentialsProvider(new UsernamePasswordCredentialsProvider("x-access-token", remote.accessToken().get()));
      }
      FetchResult result = fetch.call();
      log.info("Fetched {} ref updates", result.getTrackingRefUpdates().size());
      checkFetched(result);
    }

    for (String branch : new TreeSet<>(branches)) {
      fastForward(branch);
    }
    log.debug("Positions after update {}", refPositions());
  }

  // a rejected tracking ref (e.g. upstream history was rewritten) would leave the branch stale
  private static void checkFetched(FetchResult result) throws IOException {
    for (TrackingRefUpdate update : result.getTrackingRefUpdates()) {
      switch (update.getResult()) {
        case NEW:
        case FAST_FORWARD:
        case FORCED:
        case NO_CHANGE:
        case NOT_ATTEMPTED:
          break;
        default:
          throw new IOException("Fetch could not update "
            + update.getLocalName()
            + " from "
            + update.getRemoteName()
            + " to "
            + update.getNewObjectId().name()
            + ": "
            + update.getResult());
      }
    }
  }

  private void fastForward(String branch) throws IOException, GitAPIException {
    Ref remoteRef = repo.exactRef(Constants.R_REMOTES + remoteName + "/" + branch);
    if (remoteRef == null) {
      log.warn("No remote-tracking ref for {} after fetch", branch);
      return;
    }
    String localName = Constants.R_HEADS + branch;
    if (repo.exactRef(localName) == null) {
      log.info("Creating local branch {} at {}", branch, remoteRef.getObjectId().name());
    } else {
      log.info("Fast-forwarding local branch {} to {}", branch, remoteRef.getObjectId().name());
    }
    moveRef(localName, remoteRef.getObjectId());
    checkoutAndReset(localName);
  }

  private void moveRef(String refName, ObjectId target) throws IOException {
    RefUpdate update = repo.updateRef(refName);
    update.setNewObjectId(target);
    update.setForceUpdate(true);
    update.setRefLogMessage("config-scanner: move to fetched position", false);
    Result result = update.update();
    switch (result) {
      case NEW:
      case FAST_FORWARD:
      case FORCED:
      case NO_CHANGE:
        break;
      default:
        throw new IOException("Could not move " + refName + " to " + target.name() + ": " + result);
    }
  }

  private void createEmptyClone() throws IOException, GitAPIException {
    // a leftover directory is a broken or partial clone
    if (Files.exists(location)) {
      log.info("Deleting unusable clone directory {}", location);
      FileUtils.deleteDirectory(location.toFile());
    }
    Files.createDirectories(location);
    Git.init().setDirectory(location.toFile()).setInitialBranch(initialBranch).call().close();
    repo = tryOpen(location);
    if (repo == null) {
      throw new IOException("Could not open newly created repository in " + location);
    }

    StoredConfig config = repo.getConfig();
    RemoteConfig remoteConfig;
    try {
      remoteConfig = new RemoteConfig(config, remoteName);
      remoteConfig.addURI(new URIish(identity.cloneUrl()));
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid repository URL " + identity.cloneUrl(), e);
    }
    refSpecs().forEach(remoteConfig::addFetchRefSpec);
    remoteConfig.update(config);
    config.save();
  }

  /**
   * @return for each tracked branch with a local ref, its full ref name mapped to its position;
   *         branches left over from earlier runs but no longer tracked are not included
   */
  public Map<String, BranchPosition> refPositions() throws IOException {
    Map<String, BranchPosition> positions = new LinkedHashMap<>();
    if (repo == null) {
      return positions;
    }
    try (RevWalk walk = new RevWalk(repo)) {
      for (String branch : new TreeSet<>(branches)) {
        Ref ref = repo.exactRef(Constants.R_HEADS + branch);
        if (ref == null) {
          continue;
        }
        RevCommit commit = walk.parseCommit(ref.getObjectId());
        String summary = StringUtils.substringBefore(commit.getFullMessage(), "\n");
        positions.put(ref.getName(), new BranchPosition(commit.name(), summary, commit.getCommitTime()));
      }
    }
    return positions;
  }

  /** @param refName e.g. {@code refs/tags/foo}, {@code refs/heads/main}, or a short name */
  public boolean hasRef(String refName) throws IOException {
    if (repo == null) {
      return false;
    }
    Ref ref = refName.startsWith(Constants.R_REFS) ? repo.exactRef(refName) : repo.findRef(refName);
    return ref != null;
  }

  /**
   * Makes HEAD, the index and the working tree match {@code refName} exactly, discarding
   * any local modifications. Branches are checked out; anything else detaches HEAD.
   */
  public void checkoutAndReset(String refName) throws IOException, GitAPIException {
    lock.checkHeld();
    requireClone();
    Ref ref = refName.startsWith(Constants.R_REFS) ? repo.exactRef(refName) : repo.findRef(refName);
    if (ref == null) {
      throw new IllegalArgumentException("No such ref " + refName + " in " + location);
    }
    ObjectId commitId;
    try (RevWalk walk = new RevWalk(repo)) {
      commitId = walk.parseCommit(ref.getObjectId()).getId();
    }

    Result result;
    if (ref.getName().startsWith(Constants.R_HEADS)) {
      RefUpdate head = repo.updateRef(Constants.HEAD);
      head.disableRefLog();
      result = head.link(ref.getName());
    } else {
      RefUpdate head = repo.updateRef(Constants.HEAD, true);
      head.setNewObjectId(commitId);
      head.setForceUpdate(true);
      head.disableRefLog();
      result = head.update();
    }
    switch (result) {
      case NEW:
      case FAST_FORWARD:
      case FORCED:
      case NO_CHANGE:
        break;
      default:
        throw new IOException("Could not point HEAD at " + ref.getName() + ": " + result);
    }

    try (Git git = new Git(repo)) {
      git.reset().setMode(ResetType.HARD).setRef(commitId.name()).call();
    }
  }

  /** Creates an annotated tag {@code name} at HEAD, replacing any existing tag of that name. */
  public void createTag(String name, String message) throws IOException, GitAPIException {
    lock.checkHeld();
    requireClone();
    deleteTag(name);
    try (Git git = new Git(repo); RevWalk walk = new RevWalk(repo)) {
      ObjectId head = repo.resolve(Constants.HEAD);
      if (head == null) {
        throw new IOException("HEAD does not point at a commit in " + location);
      }
      git
        .tag()
        .setName(name)
        .setMessage(message)
        .setAnnotated(true)
        .setTagger(new PersonIdent(taggerName, taggerEmail))
        .setObjectId(walk.parseCommit(head))
        .call();
    }
  }

  /** Deletes the tag {@code name} if it exists, otherwise does nothing. */
  public void deleteTag(String name) throws GitAPIException {
    lock.checkHeld();
    requireClone();
    try (Git git = new Git(repo)) {
      git.tagDelete().setTags(name).call();
    }
  }

  /**
   * @param since a revision, or null to list every file at {@code until}
   * @return the paths (relative to the repo root) added or modified between {@code since} and
   *         {@code until} (or all paths at {@code until} if {@code since} is null) that match {@code filter}
   */
  public Set<String> changedFiles(String since, String until, Predicate<String> filter) throws IOException {
    requireClone();
    Set<String> files = new TreeSet<>();
    try (ObjectReader reader = repo.newObjectReader(); TreeWalk walk = new TreeWalk(reader)) {
      walk.setRecursive(true);
      if (since == null) {
        walk.addTree(resolveTree(until));
        while (walk.next()) {
          addIfMatches(files, walk.getPathString(), filter);
        }
      } else {
        for (DiffEntry entry : diff(walk, since, until)) {
          if (entry.getChangeType() != ChangeType.DELETE) {
            addIfMatches(files, entry.getNewPath(), filter);
          }
        }
      }
    }
    return files;
  }

  /** @return the paths present at {@code since} but gone at {@code until}; empty if {@code since} is null */
  public Set<String> deletedFiles(String since, String until, Predicate<String> filter) throws IOException {
    requireClone();
    Set<String> files = new TreeSet<>();
    if (since == null) {
      return files;
    }
    try (ObjectReader reader = repo.newObjectReader(); TreeWalk walk = new TreeWalk(reader)) {
      walk.setRecursive(true);
      for (DiffEntry entry : diff(walk, since, until)) {
        if (entry.getChangeType() == ChangeType.DELETE) {
          addIfMatches(files, entry.getOldPath(), filter);
        }
      }
    }
    return files;
  }

  private List<DiffEntry> diff(TreeWalk walk, String since, String until) throws IOException {
    walk.addTree(resolveTree(since));
    walk.addTree(resolveTree(until));
    walk.setFilter(TreeFilter.ANY_DIFF);
    return DiffEntry.scan(walk);
  }

  private static void addIfMatches(Set<String> files, String path, Predicate<String> filter) {
    if (filter.test(path)) {
      files.add(path);
    }
  }

  private ObjectId resolveTree(String revision) throws IOException {
    ObjectId tree = repo.resolve(revision + "^{tree}");
    if (tree == null) {
      throw new IOException("Unknown revision " + revision + " in " + location);
    }
    return tree;
  }

  /** Deletes the clone from disk. */
  public void delete() throws IOException {
    lock.checkHeld();
    close();
    if (Files.exists(location)) {
      log.info("Deleting clone {}", location);
      FileUtils.deleteDirectory(location.toFile());
    }
  }

  @Override
  public void close() {
    if (repo != null) {
      repo.close();
      repo = null;
    }
  }

  private void requireClone() {
    if (repo == null) {
      throw new IllegalStateException("No clone exists in " + location);
    }
  }

  private static RefSpec refSpec(String branch) {
    return new RefSpec(Constants.R_HEADS + branch + ":" + Constants.R_REMOTES + remoteName + "/" + branch);
  }

  /** @return the repository at {@code location}, or null if there isn't a usable one */
  private static Repository tryOpen(Path location) {
    File gitDir = location.resolve(Constants.DOT_GIT).toFile();
    if (!gitDir.isDirectory()) {
      return null;
    }
    try {
      Repository r = new FileRepositoryBuilder().setGitDir(gitDir).setWorkTree(location.toFile()).setMustExist(true).build();
      if (!r.getObjectDatabase().exists()) {
        r.close();
        return null;
      }
      return r;
    } catch (IOException | RuntimeException e) {
      log.info("Could not open existing clone in {}: {}", location, e.getMessage());
      return null;
    }
  }

  @Override
  public String toString() {
    return identity.cloneUrl() + " in " + location;
  }

}
