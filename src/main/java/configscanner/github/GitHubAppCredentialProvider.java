package configscanner.github;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.util.Optional;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.kohsuke.github.GHAppInstallation;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.extras.authorization.JWTTokenProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates as a GitHub App, then mints a token for the app's installation on the
 * organization (or repository) in question.
 *
 * The private key must be a PKCS#8 PEM file.
 */
public class GitHubAppCredentialProvider implements CredentialProvider {

  private static final Logger log = LoggerFactory.getLogger(GitHubAppCredentialProvider.class);

  private final String apiUrl;
  private final String appId;
  private final Path privateKeyFile;

  /**
   * Reads the app id and key from the given files; where a file is not given, falls back to the
   * {@code GITHUB_APP_ID} / {@code GITHUB_APP_PRIVATE_KEY} environment variables. With neither,
   * access is anonymous.
   */
  public static CredentialProvider fromFilesOrEnvironment(String host, String appIdFile, String privateKeyFile) throws IOException {
    String appId = appIdFile != null
      ? FileUtils.readFileToString(Paths.get(appIdFile).toFile(), StandardCharsets.UTF_8).trim()
      : StringUtils.trimToNull(System.getenv("GITHUB_APP_ID"));
    Path keyFile = privateKeyFile != null ? Paths.get(privateKeyFile) : keyFileFromEnvironment();
    if (appId == null || keyFile == null) {
      log.info("No GitHub App credentials, using anonymous access");
      return CredentialProvider.anonymous();
    }
    return new GitHubAppCredentialProvider(GitHubRemoteRepository.apiUrl(host), appId, keyFile);
  }

  private static Path keyFileFromEnvironment() throws IOException {
    String key = StringUtils.trimToNull(System.getenv("GITHUB_APP_PRIVATE_KEY"));
    if (key == null) {
      return null;
    }
    Path file = Files.createTempFile("github-app", ".pem");
    file.toFile().deleteOnExit();
    FileUtils.writeStringToFile(file.toFile(), key, StandardCharsets.UTF_8);
    return file;
  }

  public GitHubAppCredentialProvider(String apiUrl, String appId, Path privateKeyFile) {
    this.apiUrl = apiUrl;
    this.appId = appId;
    this.privateKeyFile = privateKeyFile;
  }

  @Override
  public Optional<String> repositoryToken(String organization, String repository) throws IOException {
    return Optional.of(mint(app().getApp().getInstallationByRepository(organization, repository)));
  }

  @Override
  public Optional<String> organizationToken(String organization) throws IOException {
    return Optional.of(mint(app().getApp().getInstallationByOrganization(organization)));
  }

  private static String mint(GHAppInstallation installation) throws IOException {
    log.debug("Creating token for installation {}", installation.getId());
    return installation.createToken().create().getToken();
  }

  private GitHub app() throws IOException {
    try {
      return new GitHubBuilder().withEndpoint(apiUrl).withAuthorizationProvider(new JWTTokenProvider(appId, privateKeyFile)).build();
    } catch (GeneralSecurityException e) {
      throw new IOException("Could not load GitHub App key " + privateKeyFile, e);
    }
  }

  @Override
  public String toString() {
    return "GitHub App " + appId;
  }

}
