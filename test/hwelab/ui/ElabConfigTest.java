package hwelab.ui;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.error.YAMLException;

class ElabConfigTest {

  @Test
  void testDefaults() {
    ElabConfig cfg = new ElabConfig();
    Assertions.assertFalse(cfg.fail_fast);
    Assertions.assertTrue(cfg.literal_fold_extract);
    Assertions.assertEquals(100, cfg.max_errors);
    Assertions.assertTrue(cfg.log_commands);
  }

  @Test
  void testLoadResource() throws Exception {
    try (InputStream in = getClass().getClassLoader().getResourceAsStream("elab-strict.yaml")) {
      Assertions.assertNotNull(in);
      ElabConfig cfg = ElabConfig.load(in);
      Assertions.assertTrue(cfg.fail_fast);
      Assertions.assertFalse(cfg.literal_fold_extract);
      Assertions.assertEquals(5, cfg.max_errors);
      // missing key keeps its default
      Assertions.assertTrue(cfg.log_commands);
    }
  }

  @Test
  void testEmptyAndUnknownKeys() {
    ElabConfig empty = ElabConfig.load(new ByteArrayInputStream(new byte[0]));
    Assertions.assertEquals(100, empty.max_errors);
    Assertions.assertThrows(YAMLException.class,
                            () -> ElabConfig.load(new ByteArrayInputStream("no_such_option: 1\n".getBytes(StandardCharsets.UTF_8))));
  }
}
