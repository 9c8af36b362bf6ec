package de.uni_passau.fluxbench.workload.devops;

import de.uni_passau.fluxbench.workload.QueryGenerator;
import de.uni_passau.fluxbench.workload.WorkloadException;
import de.uni_passau.fluxbench.workload.query.impl.Query;
import java.time.Duration;

/**
 * Query types of the devops use case. Every method fills exactly one empty query.
 */
public interface DevopsQueries extends QueryGenerator {

  /**
   * MAX of <code>numMetrics</code> CPU metrics per minute for <code>nHosts</code> random hosts
   * over a random window of length <code>timeRange</code>.
   */
  void groupByTime(Query query, int nHosts, int numMetrics, Duration timeRange)
      throws WorkloadException;

  /** MAX usage_user per minute for the last five minutes before a random end. */
  void groupByOrderByLimit(Query query) throws WorkloadException;

  /** Hourly mean of <code>numMetrics</code> metrics per host over a random 12h window. */
  void groupByTimeAndPrimaryTag(Query query, int numMetrics) throws WorkloadException;

  /** Hourly MAX of every CPU metric for <code>nHosts</code> random hosts. */
  void maxAllCpu(Query query, int nHosts, Duration duration) throws WorkloadException;

  /** The last reading of every host. */
  void lastPointPerHost(Query query);

  /** Readings with usage_user above 90 for <code>nHosts</code> hosts, 0 meaning all. */
  void highCpuForHosts(Query query, int nHosts) throws WorkloadException;
}
