package de.uni_passau.fluxbench;

import de.uni_passau.fluxbench.conf.Constants;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * CLI arguments parser. Only the options -cf and -help are supported.
 */
public class CommandCli {
  private static final String HELP_ARGS = "help";
  private static final String CONFIG_ARGS = "cf";
  private static final String CONFIG_NAME = "config file";

  private static final int MAX_HELP_CONSOLE_WIDTH = 88;

  /**
   * Registers CLI options.
   *
   * @return CLI options.
   */
  private Options createOptions() {
    Options options = new Options();
    Option help = new Option(HELP_ARGS, false, "Display help information");
    help.setRequired(false);
    options.addOption(help);

    Option config =
        Option.builder(CONFIG_ARGS)
            .argName(CONFIG_NAME)
            .hasArg()
            .required()
            .desc("Config file path")
            .build();
    options.addOption(config);

    return options;
  }

  /**
   * Parses the CLI input and publishes the config file path as a system property.
   *
   * @param args CLI input.
   * @return true if options were entered correctly, false otherwise.
   */
  public boolean init(String[] args) {
    Options options = createOptions();
    HelpFormatter hf = new HelpFormatter();
    hf.setWidth(MAX_HELP_CONSOLE_WIDTH);
    CommandLineParser parser = new DefaultParser();

    if (args == null || args.length == 0) {
      System.out.println("Require more params input, please check the following hint.");
      hf.printHelp(Constants.CONSOLE_PREFIX, options, true);
      return false;
    }
    try {
      CommandLine commandLine = parser.parse(options, args);
      if (commandLine.hasOption(HELP_ARGS)) {
        hf.printHelp(Constants.CONSOLE_PREFIX, options, true);
        return false;
      }
      System.setProperty(Constants.BENCHMARK_CONF, commandLine.getOptionValue(CONFIG_ARGS));
    } catch (ParseException e) {
      System.out.println("Wrong params input, because " + e.getMessage());
      hf.printHelp(Constants.CONSOLE_PREFIX, options, true);
      return false;
    }
    return true;
  }
}
