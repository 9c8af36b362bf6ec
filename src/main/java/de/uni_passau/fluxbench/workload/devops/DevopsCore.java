package de.uni_passau.fluxbench.workload.devops;

import static com.google.common.base.Preconditions.checkNotNull;

import de.uni_passau.fluxbench.utils.LaggedFibonacciRandom;
import de.uni_passau.fluxbench.utils.TimeUtils;
import de.uni_passau.fluxbench.workload.FleetSampler;
import de.uni_passau.fluxbench.workload.TimeInterval;
import de.uni_passau.fluxbench.workload.WorkloadException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Database independent state and helpers of the devops use case: the simulation interval, the
 * fleet of hosts, the CPU metric catalog and the shared random source.
 */
public class DevopsCore {

  /** Window length of double group-by queries. */
  public static final Duration DOUBLE_GROUP_BY_DURATION = Duration.ofHours(12);

  /** Window length of high CPU queries. */
  public static final Duration HIGH_CPU_DURATION = Duration.ofHours(12);

  /** Window length of max-all queries. */
  public static final Duration MAX_ALL_DURATION = Duration.ofHours(8);

  /** Name of the tag that identifies a host. */
  public static final String HOSTNAME_TAG = "hostname";

  private static final List<String> CPU_METRICS =
      Collections.unmodifiableList(
          Arrays.asList(
              "usage_user",
              "usage_system",
              "usage_idle",
              "usage_nice",
              "usage_iowait",
              "usage_irq",
              "usage_softirq",
              "usage_steal",
              "usage_guest",
              "usage_guest_nice"));

  private static final String ERR_NO_METRICS = "cannot get 0 metrics";
  private static final String ERR_TOO_MANY_METRICS = "too many metrics asked for";
  private static final String ERR_NEGATIVE_HOSTS = "nHosts cannot be negative";

  /** Global simulation interval. */
  private final TimeInterval interval;

  /** Host sampler. */
  private final FleetSampler hosts;

  /** Random source shared by every sampling step. */
  private final LaggedFibonacciRandom random;

  /**
   * Creates the devops core.
   *
   * @param start Start of the simulation interval.
   * @param end End of the simulation interval.
   * @param scale Number of hosts.
   * @param random Shared random source.
   */
  public DevopsCore(Instant start, Instant end, int scale, LaggedFibonacciRandom random) {
    this.interval = new TimeInterval(start, end);
    this.hosts = new FleetSampler("host", "hosts", scale);
    this.random = checkNotNull(random);
  }

  public TimeInterval getInterval() {
    return interval;
  }

  public int getScale() {
    return hosts.getScale();
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
   * Draws <code>nHosts</code> distinct host names in draw order.
   *
   * @param nHosts Number of hosts.
   * @return Host names.
   * @throws WorkloadException if <code>nHosts</code> is below 1 or exceeds the scale.
   */
  public List<String> getRandomHosts(int nHosts) throws WorkloadException {
    return hosts.sample(nHosts, random);
  }

  /**
   * Returns the first <code>numMetrics</code> CPU metrics of the catalog.
   *
   * @param numMetrics Number of metrics.
   * @return Metric names in catalog order.
   * @throws WorkloadException if <code>numMetrics</code> is not positive or exceeds the catalog.
   */
  public static List<String> getCpuMetricsSlice(int numMetrics) throws WorkloadException {
    if (numMetrics <= 0) {
      throw new WorkloadException(ERR_NO_METRICS);
    }
    if (numMetrics > CPU_METRICS.size()) {
      throw new WorkloadException(ERR_TOO_MANY_METRICS);
    }
    return CPU_METRICS.subList(0, numMetrics);
  }

  /**
   * Returns the whole CPU metric catalog.
   *
   * @return All CPU metrics in catalog order.
   */
  public static List<String> getAllCpuMetrics() {
    return CPU_METRICS;
  }

  /**
   * Returns the number of metrics in the CPU catalog.
   *
   * @return Catalog size.
   */
  public static int getCpuMetricsCount() {
    return CPU_METRICS.size();
  }

  public static String getDoubleGroupByLabel(String dbName, int numMetrics) {
    return String.format(
        "%s mean of %d metrics, all hosts, random %s by 1h",
        dbName, numMetrics, TimeUtils.formatDuration(DOUBLE_GROUP_BY_DURATION));
  }

  public static String getMaxAllLabel(String dbName, int nHosts) {
    return String.format(
        "%s max of all CPU metrics, random %4d hosts, random %s by 1h",
        dbName, nHosts, TimeUtils.formatDuration(MAX_ALL_DURATION));
  }

  /**
   * Returns the label of a high CPU query.
   *
   * @param dbName Database name prefix.
   * @param nHosts Number of hosts, 0 means all hosts.
   * @return Label.
   * @throws WorkloadException if <code>nHosts</code> is negative.
   */
  public static String getHighCpuLabel(String dbName, int nHosts) throws WorkloadException {
    if (nHosts < 0) {
      throw new WorkloadException(ERR_NEGATIVE_HOSTS);
    }
    if (nHosts == 0) {
      return dbName + " CPU over threshold, all hosts";
    }
    return String.format("%s CPU over threshold, %d host(s)", dbName, nHosts);
  }
}
