package de.uni_passau.fluxbench.enums;

/**
 * Benchmark use cases, each with its own data model and query set.
 */
public enum UseCase {
  /** Server cpu metrics of a fleet of hosts. */
  DEVOPS,
  /** Readings and diagnostics of a fleet of trucks. */
  IOT
}
