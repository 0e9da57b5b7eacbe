package hwelab;

import hwelab.elab.Builder;
import hwelab.elab.ElabError;
import hwelab.elab.ElaborationException;
import hwelab.ir.Circuit;
import hwelab.ui.CircuitGenerator;
import hwelab.ui.ElabConfig;
import hwelab.util.CircuitYaml;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Elaborates circuit generators with a fixed configuration and hands the result to the YAML backend.
 */
public class HWElab {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ElabConfig cfg;

  public HWElab() { this(new ElabConfig()); }
  public HWElab(ElabConfig cfg) { this.cfg = cfg; }

  public ElabConfig getConfig() { return cfg; }

  /**
   * Elaborates a generator on the current thread.
   * @throws ElaborationException if the description is malformed
   */
  public Circuit elaborate(CircuitGenerator generator) {
    logger.info("Elaborating {}", generator.name());
    return Builder.elaborate(generator.name(), cfg, generator::build);
  }

  /**
   * Elaborates a generator and writes its YAML IR.
   * Errors are logged, not thrown.
   * @param generator the circuit description
   * @param outFile the YAML file to write
   * @return true on success
   */
  public boolean generate(CircuitGenerator generator, Path outFile) {
    Circuit circuit;
    try {
      circuit = elaborate(generator);
    } catch (ElaborationException e) {
      for (ElabError err : e.getErrors())
        logger.fatal("{}: {}", generator.name(), err);
      return false;
    }
    try {
      CircuitYaml.write(circuit, outFile);
    } catch (IOException e) {
      logger.fatal("Cannot write {}: {}", outFile, e.getMessage());
      return false;
    }
    return true;
  }
}
