package de.uni_passau.fluxbench.workload.iot;

import static com.google.common.base.Preconditions.checkNotNull;

import de.uni_passau.fluxbench.utils.LaggedFibonacciRandom;
import de.uni_passau.fluxbench.workload.FleetSampler;
import de.uni_passau.fluxbench.workload.TimeInterval;
import de.uni_passau.fluxbench.workload.WorkloadException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Database independent state and helpers of the IoT use case: the simulation interval, the
 * trucks, the fleet names and the shared random source.
 */
public class IotCore {

  /** Window that is checked for trucks standing still. */
  public static final Duration STATIONARY_DURATION = Duration.ofMinutes(10);

  /** Window that is checked for driving sessions without a break. */
  public static final Duration LONG_DRIVING_SESSION_DURATION = Duration.ofHours(4);

  /** Window that is checked for too much driving per day. */
  public static final Duration DAILY_DRIVING_DURATION = Duration.ofHours(24);

  /** Fleets every truck belongs to one of. */
  public static final List<String> FLEET_CHOICES =
      Collections.unmodifiableList(Arrays.asList("East", "West", "North", "South"));

  /** Global simulation interval. */
  private final TimeInterval interval;

  /** Truck sampler. */
  private final FleetSampler trucks;

  /** Random source shared by every sampling step. */
  private final LaggedFibonacciRandom random;

  /**
   * Creates the IoT core.
   *
   * @param start Start of the simulation interval.
   * @param end End of the simulation interval.
   * @param scale Number of trucks.
   * @param random Shared random source.
   */
  public IotCore(Instant start, Instant end, int scale, LaggedFibonacciRandom random) {
    this.interval = new TimeInterval(start, end);
    this.trucks = new FleetSampler("truck", "trucks", scale);
    this.random = checkNotNull(random);
  }

  public TimeInterval getInterval() {
    return interval;
  }

  public int getScale() {
    return trucks.getScale();
  }

  /**
   * Picks a random window of the given length within the simulation interval.
   *
   * @param window Window length.
   * @return Random window.
   * @throws WorkloadException if the window is larger than the simulation interval.
   */
  public TimeInterval randomWindow(Duration window) throws WorkloadException {
    return interval.mustRandWindow(window, random);
  }

  /**
   * Draws <code>nTrucks</code> distinct truck names in draw order.
   *
   * @param nTrucks Number of trucks.
   * @return Truck names.
   * @throws WorkloadException if <code>nTrucks</code> is below 1 or exceeds the scale.
   */
  public List<String> getRandomTrucks(int nTrucks) throws WorkloadException {
    return trucks.sample(nTrucks, random);
  }

  /**
   * Picks one of {@link #FLEET_CHOICES} uniformly.
   *
   * @return Fleet name.
   */
  public String getRandomFleet() {
    return FLEET_CHOICES.get(random.nextInt(FLEET_CHOICES.size()));
  }

  /**
   * Number of ten minute periods that fit into <code>duration</code> after taking off a break of
   * <code>minutesPerHour</code> minutes for every hour. E.g. 4h with 5 minutes per hour leaves
   * 3h40m, i.e., 22 periods.
   *
   * @param minutesPerHour Break minutes per hour.
   * @param duration Total duration.
   * @return Number of whole ten minute periods, rounded towards negative infinity.
   */
  public static int tenMinutePeriods(double minutesPerHour, Duration duration) {
    double durationMinutes = duration.toNanos() / 60e9;
    double leftover = minutesPerHour * (duration.toNanos() / 3600e9);
    return (int) Math.floor((durationMinutes - leftover) / 10);
  }
}
