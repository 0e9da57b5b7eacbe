package hwelab.ui;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold elaboration options.
 */
public class ElabConfig {

  /** Throw user-facing validation errors immediately instead of collecting them until finish. */
  public boolean fail_fast = false;
  /** Compute bit extraction on literal receivers directly instead of emitting a command. */
  public boolean literal_fold_extract = true;
  /** Abort once this many errors have been collected. */
  public int max_errors = 100;
  /** Log every emitted command at trace level. */
  public boolean log_commands = true;

  /**
   * Reads a configuration from YAML; missing keys keep their defaults.
   * @param yamlFile path to the YAML file
   * @return the configuration
   * @throws IOException if the file cannot be read
   */
  public static ElabConfig load(String yamlFile) throws IOException {
    try (InputStream readFile = new FileInputStream(yamlFile)) {
      return load(readFile);
    }
  }

  public static ElabConfig load(InputStream in) {
    Yaml yamlCfg = new Yaml(new Constructor(ElabConfig.class, new LoaderOptions()));
    ElabConfig cfg = yamlCfg.load(in);
    return cfg == null ? new ElabConfig() : cfg;
  }

  @Override
  public String toString() {
    return String.format("ElabConfig(fail_fast=%b, literal_fold_extract=%b, max_errors=%d, log_commands=%b)", fail_fast,
                         literal_fold_extract, max_errors, log_commands);
  }
}
