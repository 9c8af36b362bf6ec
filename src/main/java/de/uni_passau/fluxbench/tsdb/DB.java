package de.uni_passau.fluxbench.tsdb;

/**
 * Supported query formats.
 */
public enum DB {
  /** Flux over the InfluxDB 2.x HTTP API. */
  INFLUX_2
}
