package configscanner;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

/**
 * An authenticated, session-scoped view of the upstream repository.
 *
 * Obtained once per pull/scan and not cached beyond it.
 */
public interface RemoteRepository {

  /** @return the names of the branches that currently exist upstream */
  Set<String> branchNames() throws IOException;

  /** @return the time of the last push upstream, in epoch seconds */
  long pushedAt() throws IOException;

  /** @return a token for fetching, or empty for anonymous (public) access */
  Optional<String> accessToken();

}
