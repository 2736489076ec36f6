package configscanner.github;

import java.io.IOException;
import java.util.Date;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;

import configscanner.RemoteRepository;
import configscanner.RepoIdentity;

/** A repository on GitHub (or GitHub Enterprise), for one pull or scan. */
public class GitHubRemoteRepository implements RemoteRepository {

  private final GHRepository repository;
  private final Optional<String> token;

  /** @return the REST API root for {@code host} */
  public static String apiUrl(String host) {
    return "github.com".equals(host) ? "https://api.github.com" : "https://" + host + "/api/v3";
  }

  static GitHub connect(String host, Optional<String> token) throws IOException {
    GitHubBuilder builder = new GitHubBuilder().withEndpoint(apiUrl(host));
    if (token.isPresent()) {
      builder.withAppInstallationToken(token.get());
    }
    return builder.build();
  }

  public static GitHubRemoteRepository authenticate(RepoIdentity identity, CredentialProvider credentials) throws IOException {
    Optional<String> token = credentials.repositoryToken(identity.organization, identity.name);
    GitHub github = connect(identity.host, token);
    return new GitHubRemoteRepository(github.getRepository(identity.organization + "/" + identity.name), token);
  }

  GitHubRemoteRepository(GHRepository repository, Optional<String> token) {
    this.repository = repository;
    this.token = token;
  }

  @Override
  public Set<String> branchNames() throws IOException {
    return new TreeSet<>(repository.getBranches().keySet());
  }

  @Override
  public long pushedAt() throws IOException {
    Date pushedAt = repository.getPushedAt();
    if (pushedAt == null) {
      throw new IOException("No push time for " + repository.getFullName());
    }
    return pushedAt.getTime() / 1000;
  }

  @Override
  public Optional<String> accessToken() {
    return token;
  }

}
