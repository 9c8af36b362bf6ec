package de.uni_passau.fluxbench.workload;

import de.uni_passau.fluxbench.workload.query.impl.Query;

/**
 * Anything that allocates query records which its query methods can fill in afterwards.
 */
public interface QueryGenerator {

  /**
   * Allocates a query whose fields are all empty.
   *
   * @return Empty query.
   */
  Query generateEmptyQuery();
}
