package configscanner.roster;

import java.io.IOException;
import java.util.List;

/** The live list of repositories at the remote host. */
public interface RemoteRoster {

  List<RepoRecord> repositories() throws IOException;

}
