package de.uni_passau.fluxbench.conf;

import de.uni_passau.fluxbench.enums.UseCase;
import de.uni_passau.fluxbench.tsdb.DB;
import java.io.File;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.XMLConfiguration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser of XML configuration files. The file is taken from the {@link Constants#BENCHMARK_CONF}
 * system property; without it every setting keeps its default.
 */
public enum ConfigParser {
  INSTANCE;

  private final Config config;

  ConfigParser() {
    String xmlPath = System.getProperty(Constants.BENCHMARK_CONF);
    if (xmlPath == null) {
      config = new Config();
      return;
    }
    Config parsed = null;
    try {
      parsed = load(new File(xmlPath));
    } catch (ConfigurationException e) {
      // Static fields of an enum are not initialized yet while its constants are constructed.
      Logger logger = LoggerFactory.getLogger(ConfigParser.class);
      logger.error("Could not parse config {}.", xmlPath, e);
      System.exit(1);
    }
    config = parsed;
  }

  public Config config() {
    return config;
  }

  /**
   * Loads config parameters from an XML file. Missing keys keep their defaults.
   *
   * @param configFile XML config file.
   * @return Loaded configuration.
   * @throws ConfigurationException if the file cannot be read or parsed.
   */
  static Config load(File configFile) throws ConfigurationException {
    XMLConfiguration xml = new Configurations().xml(configFile);
    Config config = new Config();

    config.FORMAT = enumValue(xml, "format", DB.class, config.FORMAT);
    config.USE_CASE = enumValue(xml, "useCase", UseCase.class, config.USE_CASE);
    config.QUERY_TYPE = xml.getString("queryType", config.QUERY_TYPE);
    config.QUERIES = xml.getInt("queries", config.QUERIES);
    config.SCALE = xml.getInt("scale", config.SCALE);
    config.SEED = xml.getLong("seed", config.SEED);

    config.START_TIME = xml.getString("timestamp.start", config.START_TIME);
    config.END_TIME = xml.getString("timestamp.end", config.END_TIME);
    config.OUTPUT = xml.getString("output", config.OUTPUT);

    config.INFLUX_URL = xml.getString("influx.url", config.INFLUX_URL);
    config.INFLUX_TOKEN = xml.getString("influx.token", config.INFLUX_TOKEN);
    config.INFLUX_ORG = xml.getString("influx.org", config.INFLUX_ORG);
    config.INFLUX_BUCKET = xml.getString("influx.bucket", config.INFLUX_BUCKET);
    config.ERASE_BUCKET = xml.getBoolean("influx.bucket[@erase]", config.ERASE_BUCKET);
    return config;
  }

  private static <E extends Enum<E>> E enumValue(
      XMLConfiguration xml, String key, Class<E> type, E defaultValue)
      throws ConfigurationException {
    String value = xml.getString(key, defaultValue.name());
    try {
      return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      String supported =
          Arrays.stream(type.getEnumConstants())
              .map(constant -> constant.name().toLowerCase(Locale.ROOT))
              .collect(Collectors.joining(", "));
      throw new ConfigurationException(
          String.format("unknown %s '%s', supported: %s", key, value, supported), e);
    }
  }
}
