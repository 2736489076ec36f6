package configscanner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

import org.apache.commons.lang3.tuple.Pair;
import org.eclipse.jgit.ignore.FastIgnoreRule;
import org.jooq.lambda.Seq;

/**
 * A list of .gitignore-style patterns, evaluated in order so that a later {@code !pattern}
 * can re-include what an earlier pattern matched.
 */
public class PathRules {

  /** The config file types we parse and hand to scanners. */
  public static PathRules configFiles() {
    return new PathRules("*.yaml", "*.yml", "*.json");
  }

  /** Dot-files and dot-directories (including {@code .git}) anywhere in the tree. */
  public static PathRules hiddenEntries() {
    return new PathRules(".*");
  }

  private final List<Pair<String, FastIgnoreRule>> rules = new ArrayList<>();

  public PathRules(String... lines) {
    this(Arrays.asList(lines));
  }

  public PathRules(List<String> lines) {
    for (String line : lines) {
      if (line.length() > 0 && !line.startsWith("#") && !line.equals("/")) {
        addRule(line);
      }
    }
  }

  public void addRule(String line) {
    FastIgnoreRule rule = new FastIgnoreRule(line);
    if (!rule.isEmpty()) {
      rules.add(Pair.of(line, rule));
    }
  }

  /** @return true if {@code path} (slash-separated, relative) matches the rules */
  public boolean matches(String path, boolean isDirectory) {
    boolean result = false;
    for (Pair<String, FastIgnoreRule> t : rules) {
      FastIgnoreRule rule = t.getRight();
      if (rule.isMatch(path, isDirectory)) {
        result = rule.getResult();
        // don't break, keep going so we can look for a "!..." after this
      }
    }
    return result;
  }

  /** @return true if {@code path} or any of its parent directories match */
  public boolean matchesAnySegment(String path) {
    String[] parts = path.split("/");
    StringBuilder prefix = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) {
        prefix.append('/');
      }
      prefix.append(parts[i]);
      if (matches(prefix.toString(), i < parts.length - 1)) {
        return true;
      }
    }
    return false;
  }

  /** @return a predicate over file paths, as used for {@link MirrorRepository#changedFiles} */
  public Predicate<String> asFileFilter() {
    return path -> matches(path, false);
  }

  public List<String> getLines() {
    return Seq.seq(rules).map(t -> t.getLeft()).toList();
  }

  @Override
  public String toString() {
    return getLines().toString();
  }

}
