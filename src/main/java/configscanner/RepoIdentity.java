package configscanner;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.MoreObjects;

/**
 * Identifies a remote repository by host, organization and name.
 *
 * The clone location is derived from these three values, e.g. {@code /repos/github.com/org/name}.
 */
public class RepoIdentity {

  public final String host;
  public final String organization;
  public final String name;
  private final String url;

  /** @param url an https URL of the form {@code https://host/org/name.git} */
  public static RepoIdentity fromUrl(String url) {
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid repository URL " + url, e);
    }
    String host = uri.getHost();
    String[] parts = StringUtils.strip(StringUtils.defaultString(uri.getPath()), "/").split("/");
    if (host == null || parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
      throw new IllegalArgumentException("Repository URL must look like https://host/org/name.git: " + url);
    }
    return new RepoIdentity(host, parts[0], StringUtils.removeEnd(parts[1], ".git"), url);
  }

  public RepoIdentity(String host, String organization, String name, String url) {
    this.host = Objects.requireNonNull(host);
    this.organization = Objects.requireNonNull(organization);
    this.name = Objects.requireNonNull(name);
    this.url = Objects.requireNonNull(url);
  }

  /** @return the URL (or local path) we fetch from */
  public String cloneUrl() {
    return url;
  }

  /** @return the clone location for this repository under {@code parentDir} */
  public Path locationUnder(Path parentDir) {
    return parentDir.resolve(host).resolve(organization).resolve(name);
  }

  /**
   * @return the parent dir implied by an explicitly given clone {@code location}
   * @throws IllegalArgumentException if the location does not end in {@code org/name}
   */
  public Path parentDirOf(Path location) {
    Path abs = location.toAbsolutePath().normalize();
    if (abs.getNameCount() < 3
      || !abs.getFileName().toString().equals(name)
      || !abs.getParent().getFileName().toString().equals(organization)) {
      throw new IllegalArgumentException("Location " + location + " does not end in " + organization + "/" + name);
    }
    return abs.getParent().getParent().getParent();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof RepoIdentity)) {
      return false;
    }
    RepoIdentity other = (RepoIdentity) o;
    return host.equals(other.host) && organization.equals(other.organization) && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, organization, name);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("host", host).add("org", organization).add("name", name).toString();
  }

}
