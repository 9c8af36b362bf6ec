package de.uni_passau.fluxbench.workload.iot;

import de.uni_passau.fluxbench.workload.QueryFiller;
import de.uni_passau.fluxbench.workload.WorkloadException;
import de.uni_passau.fluxbench.workload.query.impl.Query;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Named IoT query types.
 */
public enum IotQueryType {
  LAST_LOC("last-loc", (g, q) -> g.lastLocPerTruck(q)),
  SINGLE_LAST_LOC("single-last-loc", (g, q) -> g.lastLocByTruck(q, 1)),
  LOW_FUEL("low-fuel", (g, q) -> g.trucksWithLowFuel(q)),
  HIGH_LOAD("high-load", (g, q) -> g.trucksWithHighLoad(q)),
  STATIONARY_TRUCKS("stationary-trucks", (g, q) -> g.stationaryTrucks(q)),
  LONG_DRIVING_SESSIONS("long-driving-sessions", (g, q) -> g.trucksWithLongDrivingSessions(q)),
  LONG_DAILY_SESSIONS("long-daily-sessions", (g, q) -> g.trucksWithLongDailySessions(q)),
  AVG_VS_PROJECTED_FUEL_CONSUMPTION(
      "avg-vs-projected-fuel-consumption", (g, q) -> g.avgVsProjectedFuelConsumption(q)),
  AVG_DAILY_DRIVING_DURATION(
      "avg-daily-driving-duration", (g, q) -> g.avgDailyDrivingDuration(q)),
  AVG_DAILY_DRIVING_SESSION("avg-daily-driving-session", (g, q) -> g.avgDailyDrivingSession(q)),
  AVG_LOAD("avg-load", (g, q) -> g.avgLoad(q)),
  DAILY_ACTIVITY("daily-activity", (g, q) -> g.dailyTruckActivity(q)),
  BREAKDOWN_FREQUENCY("breakdown-frequency", (g, q) -> g.truckBreakdownFrequency(q));

  private final String typeName;

  private final QueryFiller<IotQueries> filler;

  IotQueryType(String typeName, QueryFiller<IotQueries> filler) {
    this.typeName = typeName;
    this.filler = filler;
  }

  public String getTypeName() {
    return typeName;
  }

  /**
   * Fills an empty query with this query type.
   *
   * @param generator IoT generator.
   * @param query Empty query.
   * @throws WorkloadException if the template rejects its parameters.
   */
  public void fill(IotQueries generator, Query query) throws WorkloadException {
    filler.fill(generator, query);
  }

  /**
   * Looks a query type up by its name, e.g., <code>high-load</code>.
   *
   * @param typeName Name of the query type.
   * @return The query type.
   * @throws IllegalArgumentException if no query type has this name.
   */
  public static IotQueryType fromName(String typeName) {
    for (IotQueryType type : values()) {
      if (type.typeName.equals(typeName)) {
        return type;
      }
    }
    String supported =
        Arrays.stream(values()).map(IotQueryType::getTypeName).collect(Collectors.joining(", "));
    throw new IllegalArgumentException(
        String.format("unknown iot query type '%s', supported: %s", typeName, supported));
  }
}
