package de.uni_passau.fluxbench;

import de.uni_passau.fluxbench.conf.Config;
import de.uni_passau.fluxbench.conf.ConfigParser;
import de.uni_passau.fluxbench.tsdb.DBFactory;
import de.uni_passau.fluxbench.tsdb.TsdbException;
import de.uni_passau.fluxbench.tsdb.influx2.BucketManager;
import de.uni_passau.fluxbench.utils.LaggedFibonacciRandom;
import de.uni_passau.fluxbench.utils.TimeUtils;
import de.uni_passau.fluxbench.workload.QueryCorpus;
import de.uni_passau.fluxbench.workload.QueryWriter;
import de.uni_passau.fluxbench.workload.WorkloadException;
import de.uni_passau.fluxbench.workload.devops.DevopsQueries;
import de.uni_passau.fluxbench.workload.devops.DevopsQueryType;
import de.uni_passau.fluxbench.workload.iot.IotQueries;
import de.uni_passau.fluxbench.workload.iot.IotQueryType;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starting point of the query generator. Reads the configuration file passed with -cf, builds
 * the generator of the configured format and use case, and writes the requested number of
 * queries of one query type as JSON lines, see {@link QueryWriter}. If asked to, the benchmark
 * bucket is dropped and recreated first.
 */
public class App {

  private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

  /**
   * Entry point, e.g., <code>-cf conf/devops.xml</code>.
   *
   * @param args CLI params.
   */
  public static void main(String[] args) {
    CommandCli cli = new CommandCli();
    if (!cli.init(args)) {
      return;
    }
    Config config = ConfigParser.INSTANCE.config();
    if (config.ERASE_BUCKET) {
      try {
        BucketManager buckets = new BucketManager(config);
        buckets.removeOldBucket(config.INFLUX_BUCKET);
        buckets.createBucket(config.INFLUX_BUCKET);
      } catch (TsdbException e) {
        LOGGER.error("Could not erase bucket {} because ", config.INFLUX_BUCKET, e);
        System.exit(1);
      }
    }
    try (QueryWriter writer = new QueryWriter(openOutput(config))) {
      generate(config, writer);
      LOGGER.info(
          "Wrote {} {} queries of type {} to {}",
          writer.getWritten(),
          config.USE_CASE,
          config.QUERY_TYPE,
          config.OUTPUT.isEmpty() ? "stdout" : config.OUTPUT);
    } catch (WorkloadException e) {
      LOGGER.error("Could not generate {} queries because ", config.QUERY_TYPE, e);
      System.exit(1);
    } catch (IOException e) {
      LOGGER.error("Could not write queries because ", e);
      System.exit(1);
    }
  }

  /**
   * Generates the configured queries.
   *
   * @param config Configuration params instance.
   * @param writer Output.
   * @throws WorkloadException if a template rejects its parameters.
   * @throws IOException if the output cannot be written.
   */
  static void generate(Config config, QueryWriter writer) throws WorkloadException, IOException {
    Instant start = TimeUtils.convertDateStrToInstant(config.START_TIME);
    Instant end = TimeUtils.convertDateStrToInstant(config.END_TIME);
    LaggedFibonacciRandom random = new LaggedFibonacciRandom(config.SEED);
    DBFactory factory = new DBFactory();

    switch (config.USE_CASE) {
      case DEVOPS:
        DevopsQueryType devopsType = DevopsQueryType.fromName(config.QUERY_TYPE);
        DevopsQueries devops = factory.getDevops(config.FORMAT, start, end, config.SCALE, random);
        new QueryCorpus<>(devops, devopsType::fill).writeTo(config.QUERIES, writer);
        break;
      case IOT:
        IotQueryType iotType = IotQueryType.fromName(config.QUERY_TYPE);
        IotQueries iot = factory.getIot(config.FORMAT, start, end, config.SCALE, random);
        new QueryCorpus<>(iot, iotType::fill).writeTo(config.QUERIES, writer);
        break;
      default:
        throw new IllegalArgumentException("Unsupported use case " + config.USE_CASE);
    }
  }

  private static Writer openOutput(Config config) throws IOException {
    if (config.OUTPUT.isEmpty()) {
      return new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    }
    return Files.newBufferedWriter(Paths.get(config.OUTPUT), StandardCharsets.UTF_8);
  }
}
