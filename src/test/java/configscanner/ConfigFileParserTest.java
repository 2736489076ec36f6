package configscanner;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ConfigFileParserTest {

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();

  private File write(String name, String content) throws Exception {
    File f = new File(temp.getRoot(), name);
    FileUtils.writeStringToFile(f, content, StandardCharsets.UTF_8);
    return f;
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testYaml() throws Exception {
    Object parsed = ConfigFileParser.parse(write("a.yaml", "kind: Model\nitems:\n  - one\n  - two\n").toPath());
    assertThat(parsed, instanceOf(Map.class));
    Map<String, Object> map = (Map<String, Object>) parsed;
    assertThat(map.get("kind"), is("Model"));
    assertThat(((List<Object>) map.get("items")).size(), is(2));
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testJson() throws Exception {
    Object parsed = ConfigFileParser.parse(write("b.json", "{\"type\": \"Catalog\", \"links\": []}").toPath());
    assertThat(parsed, instanceOf(Map.class));
    assertThat(((Map<String, Object>) parsed).get("type"), is("Catalog"));
  }

  @Test
  public void testOtherFilesAreText() throws Exception {
    assertThat(ConfigFileParser.parse(write("c.txt", "hello").toPath()), is("hello"));
  }

  @Test
  public void testMissingFileIsNull() {
    assertThat(ConfigFileParser.parse(temp.getRoot().toPath().resolve("gone.yaml")), is(nullValue()));
  }

  @Test
  public void testBadYamlIsNull() throws Exception {
    assertThat(ConfigFileParser.parse(write("bad.yaml", "a: [unclosed\n").toPath()), is(nullValue()));
  }

  @Test
  public void testBadJsonIsNull() throws Exception {
    assertThat(ConfigFileParser.parse(write("bad.json", "{\"a\": ").toPath()), is(nullValue()));
  }

  @Test
  public void testYamlDoesNotConstructArbitraryTypes() throws Exception {
    assertThat(ConfigFileParser.parse(write("evil.yml", "!!java.io.File [\"/tmp\"]\n").toPath()), is(nullValue()));
  }

}
