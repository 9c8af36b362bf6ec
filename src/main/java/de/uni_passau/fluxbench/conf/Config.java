package de.uni_passau.fluxbench.conf;

import de.uni_passau.fluxbench.enums.UseCase;
import de.uni_passau.fluxbench.tsdb.DB;

public class Config {

  /** Only {@link ConfigParser} should be able to instantiate an object. */
  Config() {}

  /** Query format to generate. */
  public DB FORMAT = DB.INFLUX_2;

  /** Use case the queries belong to. */
  public UseCase USE_CASE = UseCase.DEVOPS;

  /** Query type name, e.g., single-groupby-1-1-1 or high-load. */
  public String QUERY_TYPE = "single-groupby-1-1-1";

  /** Number of queries to generate. */
  public int QUERIES = 1000;

  /** Number of hosts or trucks. */
  public int SCALE = 1;

  /** Seed of the random source shared by all draws. */
  public long SEED = Constants.DEFAULT_SEED;

  /** Start of the simulated interval. */
  public String START_TIME = Constants.DEFAULT_START_TIME;

  /** End of the simulated interval. */
  public String END_TIME = Constants.DEFAULT_END_TIME;

  /** Output file. Queries go to stdout if empty. */
  public String OUTPUT = "";

  /** Base URL of the InfluxDB 2.x server. */
  public String INFLUX_URL = "http://localhost:8086";

  /** API token. */
  public String INFLUX_TOKEN = "";

  /** Organization ID owning the benchmark bucket. */
  public String INFLUX_ORG = "";

  /** Benchmark bucket. */
  public String INFLUX_BUCKET = "benchmark";

  /** Drops and recreates the benchmark bucket before generating queries. */
  public boolean ERASE_BUCKET = false;
}
