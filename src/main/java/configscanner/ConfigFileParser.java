package configscanner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Reads a scanned file into the value handed to scanners: YAML and JSON become maps/lists/scalars,
 * anything else is its text.
 *
 * A file that is gone or that does not parse yields null, so one bad file never stops a scan.
 */
public class ConfigFileParser {

  private static final Logger log = LoggerFactory.getLogger(ConfigFileParser.class);
  private static final Gson gson = new Gson();

  public static Object parse(Path file) {
    if (!Files.isRegularFile(file)) {
      log.debug("{} no longer exists", file);
      return null;
    }
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    try {
      String text = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
      if (name.endsWith(".yaml") || name.endsWith(".yml")) {
        // Yaml instances are not thread-safe
        return new Yaml(new SafeConstructor(new LoaderOptions())).load(text);
      } else if (name.endsWith(".json")) {
        return gson.fromJson(text, Object.class);
      } else {
        return text;
      }
    } catch (IOException e) {
      log.warn("Could not read {}: {}", file, e.getMessage());
      return null;
    } catch (YAMLException | JsonParseException e) {
      log.warn("Could not parse {}: {}", file, e.getMessage());
      return null;
    }
  }

}
