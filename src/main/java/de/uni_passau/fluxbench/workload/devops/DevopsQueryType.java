package de.uni_passau.fluxbench.workload.devops;

import de.uni_passau.fluxbench.workload.QueryFiller;
import de.uni_passau.fluxbench.workload.WorkloadException;
import de.uni_passau.fluxbench.workload.query.impl.Query;
import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Named devops query types. The <code>single-groupby-M-H-T</code> types select M metrics of H
 * random hosts over a random window of T hours.
 */
public enum DevopsQueryType {
  SINGLE_GROUPBY_1_1_1("single-groupby-1-1-1", (g, q) -> g.groupByTime(q, 1, 1, hours(1))),
  SINGLE_GROUPBY_1_1_12("single-groupby-1-1-12", (g, q) -> g.groupByTime(q, 1, 1, hours(12))),
  SINGLE_GROUPBY_1_8_1("single-groupby-1-8-1", (g, q) -> g.groupByTime(q, 8, 1, hours(1))),
  SINGLE_GROUPBY_5_1_1("single-groupby-5-1-1", (g, q) -> g.groupByTime(q, 1, 5, hours(1))),
  SINGLE_GROUPBY_5_1_12("single-groupby-5-1-12", (g, q) -> g.groupByTime(q, 1, 5, hours(12))),
  SINGLE_GROUPBY_5_8_1("single-groupby-5-8-1", (g, q) -> g.groupByTime(q, 8, 5, hours(1))),
  CPU_MAX_ALL_1(
      "cpu-max-all-1", (g, q) -> g.maxAllCpu(q, 1, DevopsCore.MAX_ALL_DURATION)),
  CPU_MAX_ALL_8(
      "cpu-max-all-8", (g, q) -> g.maxAllCpu(q, 8, DevopsCore.MAX_ALL_DURATION)),
  DOUBLE_GROUPBY_1("double-groupby-1", (g, q) -> g.groupByTimeAndPrimaryTag(q, 1)),
  DOUBLE_GROUPBY_5("double-groupby-5", (g, q) -> g.groupByTimeAndPrimaryTag(q, 5)),
  DOUBLE_GROUPBY_ALL(
      "double-groupby-all",
      (g, q) -> g.groupByTimeAndPrimaryTag(q, DevopsCore.getCpuMetricsCount())),
  HIGH_CPU_ALL("high-cpu-all", (g, q) -> g.highCpuForHosts(q, 0)),
  HIGH_CPU_1("high-cpu-1", (g, q) -> g.highCpuForHosts(q, 1)),
  LASTPOINT("lastpoint", (g, q) -> g.lastPointPerHost(q)),
  GROUPBY_ORDERBY_LIMIT("groupby-orderby-limit", (g, q) -> g.groupByOrderByLimit(q));

  private final String typeName;

  private final QueryFiller<DevopsQueries> filler;

  DevopsQueryType(String typeName, QueryFiller<DevopsQueries> filler) {
    this.typeName = typeName;
    this.filler = filler;
  }

  public String getTypeName() {
    return typeName;
  }

  /**
   * Fills an empty query with this query type.
   *
   * @param generator Devops generator.
   * @param query Empty query.
   * @throws WorkloadException if the template rejects its parameters.
   */
  public void fill(DevopsQueries generator, Query query) throws WorkloadException {
    filler.fill(generator, query);
  }

  /**
   * Looks a query type up by its name, e.g., <code>double-groupby-all</code>.
   *
   * @param typeName Name of the query type.
   * @return The query type.
   * @throws IllegalArgumentException if no query type has this name.
   */
  public static DevopsQueryType fromName(String typeName) {
    for (DevopsQueryType type : values()) {
      if (type.typeName.equals(typeName)) {
        return type;
      }
    }
    throw new IllegalArgumentException(
        String.format(
            "unknown devops query type '%s', supported: %s", typeName, supportedNames()));
  }

  private static String supportedNames() {
    return Arrays.stream(values())
        .map(DevopsQueryType::getTypeName)
        .collect(Collectors.joining(", "));
  }

  private static Duration hours(long hours) {
    return Duration.ofHours(hours);
  }
}
