package configscanner.roster;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/** Which organization (and optionally team) to mirror the repository list of, and into which namespace. */
public class SyncTarget {

  public final String organization;
  public final String team;
  public final String namespace;
  public final String workspace;

  public SyncTarget(String organization, String team, String namespace, String workspace) {
    this.organization = Objects.requireNonNull(organization);
    this.team = team;
    this.namespace = Objects.requireNonNull(namespace);
    this.workspace = workspace;
  }

  /** @return the source annotation for records we create, e.g. {@code github:org:team} */
  public String source() {
    return RepoRecordStore.GITHUB_SOURCE_PREFIX + organization + (team == null ? "" : ":" + team);
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .omitNullValues()
      .add("organization", organization)
      .add("team", team)
      .add("namespace", namespace)
      .add("workspace", workspace)
      .toString();
  }

}
