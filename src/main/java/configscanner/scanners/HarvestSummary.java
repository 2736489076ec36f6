package configscanner.scanners;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.annotations.SerializedName;

/** What an {@link ObjectStoreScanner} changed in the object store for one branch. */
public class HarvestSummary {

  private static final Gson gson = new Gson();

  public final String workspace;
  public final String repository;
  public final String branch;
  @SerializedName("added_keys")
  public final List<String> added;
  @SerializedName("updated_keys")
  public final List<String> updated;
  @SerializedName("deleted_keys")
  public final List<String> deleted;

  public HarvestSummary(String workspace, String repository, String branch, List<String> added, List<String> updated, List<String> deleted) {
    this.workspace = workspace;
    this.repository = repository;
    this.branch = branch;
    this.added = new ArrayList<>(added);
    this.updated = new ArrayList<>(updated);
    this.deleted = new ArrayList<>(deleted);
  }

  public boolean isEmpty() {
    return added.isEmpty() && updated.isEmpty() && deleted.isEmpty();
  }

  public String toJson() {
    return gson.toJson(this);
  }

  @Override
  public String toString() {
    return toJson();
  }

}
