package configscanner.roster;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * One repository, as listed by the remote host or as recorded in the cluster.
 *
 * Records are identified by {@code name} within a namespace. {@code lastModified} (the last push,
 * epoch seconds) may be null for a record that has never been given a status.
 */
public class RepoRecord {

  public final String name;
  public final Long lastModified;
  public final String httpsUrl;
  public final String sshUrl;
  public final String organization;
  public final String source;

  public RepoRecord(String name, Long lastModified, String httpsUrl, String sshUrl, String organization, String source) {
    this.name = Objects.requireNonNull(name);
    this.lastModified = lastModified;
    this.httpsUrl = httpsUrl;
    this.sshUrl = sshUrl;
    this.organization = organization;
    this.source = source;
  }

  public RepoRecord withSource(String source) {
    return new RepoRecord(name, lastModified, httpsUrl, sshUrl, organization, source);
  }

  public RepoRecord withLastModified(Long lastModified) {
    return new RepoRecord(name, lastModified, httpsUrl, sshUrl, organization, source);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues().add("name", name).add("lastModified", lastModified).add("source", source).toString();
  }

}
