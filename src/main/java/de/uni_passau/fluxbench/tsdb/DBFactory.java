package de.uni_passau.fluxbench.tsdb;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import de.uni_passau.fluxbench.tsdb.influx2.Influx2Devops;
import de.uni_passau.fluxbench.tsdb.influx2.Influx2IoT;
import de.uni_passau.fluxbench.utils.LaggedFibonacciRandom;
import de.uni_passau.fluxbench.workload.devops.DevopsCore;
import de.uni_passau.fluxbench.workload.devops.DevopsQueries;
import de.uni_passau.fluxbench.workload.iot.IotCore;
import de.uni_passau.fluxbench.workload.iot.IotQueries;
import java.time.Instant;
import org.apache.commons.lang3.NotImplementedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates query generators for a query format. */
public class DBFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(DBFactory.class);

  /**
   * Creates a devops generator.
   *
   * @param db Query format.
   * @param start Start of the simulated interval.
   * @param end End of the simulated interval, strictly after <code>start</code>.
   * @param scale Number of hosts, at least 1.
   * @param random Random source shared by every draw of the generator.
   * @return Generator for the given format.
   */
  public DevopsQueries getDevops(
      DB db, Instant start, Instant end, int scale, LaggedFibonacciRandom random) {
    checkParameters(db, start, end, scale);
    switch (db) {
      case INFLUX_2:
        return new Influx2Devops(new DevopsCore(start, end, scale, random));
      default:
        LOGGER.error("unsupported format {} for devops", db);
        throw new NotImplementedException("devops queries are not implemented for " + db);
    }
  }

  /**
   * Creates an IoT generator.
   *
   * @param db Query format.
   * @param start Start of the simulated interval.
   * @param end End of the simulated interval, strictly after <code>start</code>.
   * @param scale Number of trucks, at least 1.
   * @param random Random source shared by every draw of the generator.
   * @return Generator for the given format.
   */
  public IotQueries getIot(
      DB db, Instant start, Instant end, int scale, LaggedFibonacciRandom random) {
    checkParameters(db, start, end, scale);
    switch (db) {
      case INFLUX_2:
        return new Influx2IoT(new IotCore(start, end, scale, random));
      default:
        LOGGER.error("unsupported format {} for iot", db);
        throw new NotImplementedException("iot queries are not implemented for " + db);
    }
  }

  private static void checkParameters(DB db, Instant start, Instant end, int scale) {
    checkNotNull(db);
    checkNotNull(start);
    checkNotNull(end);
    checkArgument(end.isAfter(start), "end %s must be after start %s", end, start);
    checkArgument(scale >= 1, "scale must be at least 1, got %s", scale);
  }
}
