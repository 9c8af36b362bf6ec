package de.uni_passau.fluxbench.workload;

import de.uni_passau.fluxbench.workload.query.impl.Query;

/**
 * Fills an empty query using one template of a generator.
 *
 * @param <G> Generator type.
 */
@FunctionalInterface
public interface QueryFiller<G extends QueryGenerator> {

  /**
   * Fills the query.
   *
   * @param generator Generator to use.
   * @param query Empty query.
   * @throws WorkloadException if the template parameters are invalid.
   */
  void fill(G generator, Query query) throws WorkloadException;
}
