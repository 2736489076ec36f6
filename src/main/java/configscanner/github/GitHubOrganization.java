package configscanner.github;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GHTeam;
import org.kohsuke.github.GitHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import configscanner.roster.RemoteRoster;
import configscanner.roster.RepoRecord;

/**
 * The repositories of a GitHub organization that we can see, optionally limited to the ones a
 * team can see. With a token this is whatever the app installation has been granted; without,
 * only public repositories.
 */
public class GitHubOrganization implements RemoteRoster {

  private static final Logger log = LoggerFactory.getLogger(GitHubOrganization.class);

  private final GitHub github;
  private final String organization;
  private final String team;
  private final boolean installation;

  public static GitHubOrganization authenticate(String host, String organization, String team, CredentialProvider credentials)
    throws IOException {
    Optional<String> token = credentials.organizationToken(organization);
    return new GitHubOrganization(GitHubRemoteRepository.connect(host, token), organization, team, token.isPresent());
  }

  GitHubOrganization(GitHub github, String organization, String team, boolean installation) {
    this.github = github;
    this.organization = organization;
    this.team = team;
    this.installation = installation;
  }

  @Override
  public List<RepoRecord> repositories() throws IOException {
    Iterable<GHRepository> candidates = installation
      ? github.getInstallation().listRepositories()
      : github.getOrganization(organization).listRepositories();
    List<RepoRecord> records = new ArrayList<>();
    for (GHRepository repo : candidates) {
      if (!organization.equalsIgnoreCase(repo.getOwnerName())) {
        continue;
      }
      if (team != null && !teamCanSee(repo)) {
        log.debug("Team {} cannot see {}", team, repo.getName());
        continue;
      }
      Date pushedAt = repo.getPushedAt();
      records.add(new RepoRecord(
        repo.getName(),
        pushedAt == null ? null : pushedAt.getTime() / 1000,
        repo.getHttpTransportUrl(),
        repo.getSshUrl(),
        repo.getOwnerName(),
        null));
    }
    return records;
  }

  private boolean teamCanSee(GHRepository repo) throws IOException {
    for (GHTeam t : repo.getTeams()) {
      if (team.equals(t.getName())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return team == null ? organization : organization + ":" + team;
  }

}
