package hwelab.ui;

import hwelab.HWElab;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.error.YAMLException;

public class ElabCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  static final int EXIT_OK = 0;
  static final int EXIT_ELAB_ERROR = 1;
  static final int EXIT_USAGE = -1;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static int printHelp(Options options) {
    helper.printHelp("hwelab - elaborate a circuit generator into its YAML IR", options);
    return EXIT_USAGE;
  }

  static Options buildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("g")
                          .longOpt("generator")
                          .argName("class name")
                          .hasArg()
                          .required(true)
                          .desc("Fully qualified name of a class implementing " + CircuitGenerator.class.getName())
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with elaboration options")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("out")
                          .argName("file")
                          .hasArg()
                          .required(false)
                          .desc("Output YAML file; <circuit name>.yaml by default")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print every emitted command and enable -v").build());
    return options;
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args));
  }

  /**
   * Parses the arguments, elaborates the generator and writes its IR.
   * @return the process exit code: 0 on success, 1 on elaboration errors, -1 on usage errors
   */
  public static int run(String[] args) {
    Options options = buildOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    String generatorName;
    String configFile;
    String outFile;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h"))
        return printHelp(options);

      generatorName = line.getOptionValue("g");
      configFile = line.getOptionValue("c");
      outFile = line.getOptionValue("o");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      return printHelp(options);
    }

    ElabConfig cfg = new ElabConfig();
    if (configFile != null) {
      try {
        cfg = ElabConfig.load(configFile);
      } catch (IOException e) {
        logger.error("Config file {} could not be read: {}", configFile, e.getMessage());
        return EXIT_USAGE;
      } catch (YAMLException e) {
        logger.error("Config file {} is malformed: {}", configFile, e.getMessage());
        return EXIT_USAGE;
      }
    }

    CircuitGenerator generator;
    try {
      Object instance = Class.forName(generatorName).getDeclaredConstructor().newInstance();
      if (!(instance instanceof CircuitGenerator)) {
        logger.error("{} does not implement {}", generatorName, CircuitGenerator.class.getSimpleName());
        return EXIT_USAGE;
      }
      generator = (CircuitGenerator)instance;
    } catch (ReflectiveOperationException e) {
      logger.error("Generator {} could not be instantiated: {}", generatorName, e.toString());
      return EXIT_USAGE;
    }

    //////////   elaborate and write   //////////
    Path outPath = Path.of(outFile != null ? outFile : generator.name() + ".yaml");
    boolean success = new HWElab(cfg).generate(generator, outPath);
    return success ? EXIT_OK : EXIT_ELAB_ERROR;
  }
}
