package configscanner.roster;

import java.io.IOException;
import java.util.List;

/**
 * The repository records of one namespace.
 *
 * Every mutation touches a single record, there are no transactions.
 */
public interface RepoRecordStore {

  /** The annotation naming where a record came from, e.g. {@code github:org:team}. */
  String SOURCE_ANNOTATION = "ai-pipeline.org/repo-source";
  String GITHUB_SOURCE_PREFIX = "github:";

  /** @return only the records whose source starts with {@link #GITHUB_SOURCE_PREFIX} */
  List<RepoRecord> list() throws IOException;

  /** Creates the record, including its last-modified status. */
  void create(RepoRecord record, String workspace) throws IOException;

  void delete(String name) throws IOException;

  void updateLastModified(String name, long lastModified) throws IOException;

}
