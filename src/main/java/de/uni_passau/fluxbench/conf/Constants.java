package de.uni_passau.fluxbench.conf;

/** Constants container. */
public class Constants {

  /** Prefix to print in console. */
  public static final String CONSOLE_PREFIX = "fluxbench>";

  /** System property holding the config file path. */
  public static final String BENCHMARK_CONF = "conf";

  /** Default start of the simulated interval. */
  public static final String DEFAULT_START_TIME = "2016-01-01T00:00:00Z";

  /** Default end of the simulated interval. */
  public static final String DEFAULT_END_TIME = "2016-01-02T00:00:00Z";

  /** Canonical seed of the query generators. */
  public static final long DEFAULT_SEED = 123;

  private Constants() {}
}
