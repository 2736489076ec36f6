package configscanner.github;

import java.io.IOException;
import java.util.Optional;

/**
 * Mints short-lived access tokens for the remote host.
 *
 * Tokens are asked for once per operation and never cached; empty means anonymous access.
 */
public interface CredentialProvider {

  Optional<String> repositoryToken(String organization, String repository) throws IOException;

  Optional<String> organizationToken(String organization) throws IOException;

  /** No credentials: only public repositories are visible. */
  static CredentialProvider anonymous() {
    return new CredentialProvider() {
      @Override
      public Optional<String> repositoryToken(String organization, String repository) {
        return Optional.empty();
      }

      @Override
      public Optional<String> organizationToken(String organization) {
        return Optional.empty();
      }

      @Override
      public String toString() {
        return "anonymous";
      }
    };
  }

}
