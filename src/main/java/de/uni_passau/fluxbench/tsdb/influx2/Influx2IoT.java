package de.uni_passau.fluxbench.tsdb.influx2;

import com.google.common.collect.ImmutableMap;
import de.uni_passau.fluxbench.workload.TimeInterval;
import de.uni_passau.fluxbench.workload.WorkloadException;
import de.uni_passau.fluxbench.workload.iot.IotCore;
import de.uni_passau.fluxbench.workload.iot.IotQueries;
import de.uni_passau.fluxbench.workload.query.impl.Query;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * IoT (trucks) queries rendered as Flux for InfluxDB 2.x.
 */
public class Influx2IoT extends Influx2Generator implements IotQueries {

  private static final String TEMPLATES = "templates/influx2/iot.stg";

  /** Tag identifying a truck. */
  private static final String TRUCK_TAG = "name";

  private final IotCore core;

  /**
   * Creates an IoT generator.
   *
   * @param core Simulation interval, truck fleet and random source.
   */
  public Influx2IoT(IotCore core) {
    super(TEMPLATES);
    this.core = core;
  }

  @Override
  public void lastLocByTruck(Query query, int nTrucks) throws WorkloadException {
    List<String> trucks = core.getRandomTrucks(nTrucks);

    String flux =
        render(
            "lastLocByTruck",
            ImmutableMap.of("trucksFilter", FluxPredicates.tagDisjunction(TRUCK_TAG, trucks)));
    String humanLabel = LABEL_PREFIX + " last location by specific truck";
    fillInQuery(
        query, humanLabel, String.format("%s: random %4d trucks", humanLabel, nTrucks), flux);
  }

  @Override
  public void lastLocPerTruck(Query query) {
    String flux = render("lastLocPerTruck", ImmutableMap.of("fleet", core.getRandomFleet()));
    String humanLabel = LABEL_PREFIX + " last location per truck";
    fillInQuery(query, humanLabel, humanLabel, flux);
  }

  @Override
  public void trucksWithLowFuel(Query query) {
    String flux = render("trucksWithLowFuel", ImmutableMap.of("fleet", core.getRandomFleet()));
    String humanLabel = LABEL_PREFIX + " trucks with low fuel";
    fillInQuery(query, humanLabel, humanLabel + ": under 10 percent", flux);
  }

  @Override
  public void trucksWithHighLoad(Query query) {
    String flux = render("trucksWithHighLoad", ImmutableMap.of("fleet", core.getRandomFleet()));
    String humanLabel = LABEL_PREFIX + " trucks with high load";
    fillInQuery(query, humanLabel, humanLabel + ": over 90 percent", flux);
  }

  @Override
  public void stationaryTrucks(Query query) throws WorkloadException {
    TimeInterval interval = core.randomWindow(IotCore.STATIONARY_DURATION);
    String fleet = core.getRandomFleet();

    String flux =
        render(
            "stationaryTrucks",
            ImmutableMap.of(
                "start", interval.startString(),
                "end", interval.endString(),
                "fleet", fleet));
    String humanLabel = LABEL_PREFIX + " stationary trucks";
    fillInQuery(
        query, humanLabel, humanLabel + ": with low avg velocity in last 10 minutes", flux);
  }

  @Override
  public void trucksWithLongDrivingSessions(Query query) throws WorkloadException {
    String flux =
        longSessions(
            IotCore.LONG_DRIVING_SESSION_DURATION,
            IotCore.tenMinutePeriods(5, IotCore.LONG_DRIVING_SESSION_DURATION));
    String humanLabel = LABEL_PREFIX + " trucks with longer driving sessions";
    fillInQuery(
        query, humanLabel, humanLabel + ": stopped less than 20 mins in 4 hour period", flux);
  }

  @Override
  public void trucksWithLongDailySessions(Query query) throws WorkloadException {
    String flux =
        longSessions(
            IotCore.DAILY_DRIVING_DURATION,
            IotCore.tenMinutePeriods(35, IotCore.DAILY_DRIVING_DURATION));
    String humanLabel = LABEL_PREFIX + " trucks with longer daily sessions";
    fillInQuery(
        query, humanLabel, humanLabel + ": drove more than 10 hours in the last 24 hours", flux);
  }

  /**
   * Renders the driving session shape shared by the 4h and the 24h variant. Both count over the
   * 4h session window, printed as its nanosecond count with an <code>s</code> unit.
   */
  private String longSessions(Duration window, int threshold) throws WorkloadException {
    TimeInterval interval = core.randomWindow(window);
    String fleet = core.getRandomFleet();

    Map<String, Object> attributes =
        ImmutableMap.<String, Object>builder()
            .put("start", interval.startString())
            .put("end", interval.endString())
            .put("fleet", fleet)
            .put("every", IotCore.LONG_DRIVING_SESSION_DURATION.toNanos())
            .put("offset", core.getInterval().startSecondOfDay())
            .put("threshold", threshold)
            .build();
    return render("longDrivingSessions", attributes);
  }

  @Override
  public void avgVsProjectedFuelConsumption(Query query) {
    String flux = render("avgVsProjectedFuelConsumption", ImmutableMap.of());
    String humanLabel = LABEL_PREFIX + " average vs projected fuel consumption per fleet";
    fillInQuery(query, humanLabel, humanLabel, flux);
  }

  @Override
  public void avgDailyDrivingDuration(Query query) {
    String flux = render("avgDailyDrivingDuration", fullInterval());
    String humanLabel = LABEL_PREFIX + " average driver driving duration per day";
    fillInQuery(query, humanLabel, humanLabel, flux);
  }

  @Override
  public void avgDailyDrivingSession(Query query) {
    String flux = render("avgDailyDrivingSession", fullInterval());
    String humanLabel = LABEL_PREFIX + " average driver driving session without stopping per day";
    fillInQuery(query, humanLabel, humanLabel, flux);
  }

  @Override
  public void avgLoad(Query query) {
    String flux = render("avgLoad", ImmutableMap.of());
    String humanLabel = LABEL_PREFIX + " average load per truck model per fleet";
    fillInQuery(query, humanLabel, humanLabel, flux);
  }

  @Override
  public void dailyTruckActivity(Query query) {
    String flux = render("dailyTruckActivity", fullInterval());
    String humanLabel = LABEL_PREFIX + " daily truck activity per fleet per model";
    fillInQuery(query, humanLabel, humanLabel, flux);
  }

  @Override
  public void truckBreakdownFrequency(Query query) {
    String flux = render("truckBreakdownFrequency", fullInterval());
    String humanLabel = LABEL_PREFIX + " truck breakdown frequency per model";
    fillInQuery(query, humanLabel, humanLabel, flux);
  }

  private Map<String, String> fullInterval() {
    TimeInterval interval = core.getInterval();
    return ImmutableMap.of("start", interval.startString(), "end", interval.endString());
  }
}
