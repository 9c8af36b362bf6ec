package de.uni_passau.fluxbench.tsdb.influx2;

import com.google.common.collect.ImmutableMap;
import de.uni_passau.fluxbench.utils.TimeUtils;
import de.uni_passau.fluxbench.workload.TimeInterval;
import de.uni_passau.fluxbench.workload.WorkloadException;
import de.uni_passau.fluxbench.workload.devops.DevopsCore;
import de.uni_passau.fluxbench.workload.devops.DevopsQueries;
import de.uni_passau.fluxbench.workload.query.impl.Query;
import java.time.Duration;
import java.util.List;

/**
 * Devops (cpu) queries rendered as Flux for InfluxDB 2.x.
 */
public class Influx2Devops extends Influx2Generator implements DevopsQueries {

  private static final String TEMPLATES = "templates/influx2/devops.stg";

  private final DevopsCore core;

  /**
   * Creates a devops generator.
   *
   * @param core Simulation interval, host fleet and random source.
   */
  public Influx2Devops(DevopsCore core) {
    super(TEMPLATES);
    this.core = core;
  }

  @Override
  public void groupByTime(Query query, int nHosts, int numMetrics, Duration timeRange)
      throws WorkloadException {
    TimeInterval interval = core.randomWindow(timeRange);
    List<String> metrics = DevopsCore.getCpuMetricsSlice(numMetrics);
    List<String> hosts = core.getRandomHosts(nHosts);

    String flux =
        render(
            "groupByTime",
            ImmutableMap.of(
                "start", interval.startString(),
                "end", interval.endString(),
                "metricsFilter", FluxPredicates.fieldDisjunction(metrics),
                "hostsFilter", hostsFilter(hosts)));
    String humanLabel =
        String.format(
            "%s %d cpu metric(s), random %4d hosts, random %s by 1m",
            LABEL_PREFIX, numMetrics, nHosts, TimeUtils.formatDuration(timeRange));
    fillInQuery(query, humanLabel, humanLabel + ": " + interval.startString(), flux);
  }

  @Override
  public void groupByOrderByLimit(Query query) throws WorkloadException {
    TimeInterval interval = core.randomWindow(Duration.ofHours(1));

    String flux = render("groupByOrderByLimit", ImmutableMap.of("end", interval.endString()));
    String humanLabel = LABEL_PREFIX + " max cpu over last 5 min-intervals (random end)";
    fillInQuery(query, humanLabel, humanLabel + ": " + interval.startString(), flux);
  }

  @Override
  public void groupByTimeAndPrimaryTag(Query query, int numMetrics) throws WorkloadException {
    List<String> metrics = DevopsCore.getCpuMetricsSlice(numMetrics);
    TimeInterval interval = core.randomWindow(DevopsCore.DOUBLE_GROUP_BY_DURATION);

    String flux =
        render(
            "groupByTimeAndPrimaryTag",
            ImmutableMap.of(
                "start", interval.startString(),
                "end", interval.endString(),
                "metricsFilter", FluxPredicates.fieldDisjunction(metrics)));
    String humanLabel = DevopsCore.getDoubleGroupByLabel(LABEL_PREFIX, numMetrics);
    fillInQuery(query, humanLabel, humanLabel + ": " + interval.startString(), flux);
  }

  @Override
  public void maxAllCpu(Query query, int nHosts, Duration duration) throws WorkloadException {
    TimeInterval interval = core.randomWindow(duration);
    List<String> hosts = core.getRandomHosts(nHosts);

    String flux =
        render(
            "maxAllCpu",
            ImmutableMap.of(
                "start", interval.startString(),
                "end", interval.endString(),
                "metricsFilter", FluxPredicates.fieldDisjunction(DevopsCore.getAllCpuMetrics()),
                "hostsFilter", hostsFilter(hosts)));
    String humanLabel = DevopsCore.getMaxAllLabel(LABEL_PREFIX, nHosts);
    fillInQuery(query, humanLabel, humanLabel + ": " + interval.startString(), flux);
  }

  @Override
  public void lastPointPerHost(Query query) {
    String flux = render("lastPointPerHost", ImmutableMap.of());
    String humanLabel = LABEL_PREFIX + " last row per host";
    fillInQuery(query, humanLabel, humanLabel + ": cpu", flux);
  }

  @Override
  public void highCpuForHosts(Query query, int nHosts) throws WorkloadException {
    TimeInterval interval = core.randomWindow(DevopsCore.HIGH_CPU_DURATION);
    // Zero hosts means the whole fleet, so no hostname clause at all.
    String hostsClause = nHosts == 0 ? "" : " and " + hostsFilter(core.getRandomHosts(nHosts));
    String humanLabel = DevopsCore.getHighCpuLabel(LABEL_PREFIX, nHosts);

    String flux =
        render(
            "highCpuForHosts",
            ImmutableMap.of(
                "start", interval.startString(),
                "end", interval.endString(),
                "hostsFilter", hostsClause));
    fillInQuery(query, humanLabel, humanLabel + ": " + interval.startString(), flux);
  }

  private static String hostsFilter(List<String> hosts) {
    return FluxPredicates.tagDisjunction(DevopsCore.HOSTNAME_TAG, hosts);
  }
}
