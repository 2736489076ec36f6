package configscanner;

import java.util.LinkedHashMap;
import java.util.Map;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * The status update for a repository's cluster record, i.e. {@code {status: {clonePosition, configScanPosition}}},
 * printed as YAML for whatever applies it.
 */
public class StatusPatch {

  private final Map<String, Object> status = new LinkedHashMap<>();

  public StatusPatch clonePosition(ScanPosition position) {
    status.put("clonePosition", position.toMap());
    return this;
  }

  public StatusPatch configScanPosition(ScanPosition position) {
    status.put("configScanPosition", position.toMap());
    return this;
  }

  /** Records that there is no clone any more. */
  public StatusPatch deleted() {
    status.put("clonePosition", null);
    return this;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", new LinkedHashMap<>(status));
    return m;
  }

  public String toYaml() {
    return toYaml(toMap());
  }

  public static String toYaml(Object value) {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    return new Yaml(options).dump(value);
  }

}
