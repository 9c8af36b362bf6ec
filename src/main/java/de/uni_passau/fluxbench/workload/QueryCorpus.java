package de.uni_passau.fluxbench.workload;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import de.uni_passau.fluxbench.workload.query.impl.Query;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces a sequence of queries of one query type. All queries come from the same generator, so
 * the sequence is fully determined by the generator's random source.
 *
 * @param <G> Generator type.
 */
public class QueryCorpus<G extends QueryGenerator> {

  private static final Logger LOGGER = LoggerFactory.getLogger(QueryCorpus.class);

  private final G generator;

  private final QueryFiller<G> filler;

  /**
   * Creates a corpus.
   *
   * @param generator Generator providing empty queries and templates.
   * @param filler Query type to fill every query with.
   */
  public QueryCorpus(G generator, QueryFiller<G> filler) {
    this.generator = checkNotNull(generator);
    this.filler = checkNotNull(filler);
  }

  /**
   * Generates the next query.
   *
   * @return Filled query.
   * @throws WorkloadException if the query type rejects its parameters.
   */
  public Query next() throws WorkloadException {
    Query query = generator.generateEmptyQuery();
    filler.fill(generator, query);
    return query;
  }

  /**
   * Generates <code>count</code> queries.
   *
   * @param count Number of queries.
   * @return Queries in generation order.
   * @throws WorkloadException if the query type rejects its parameters.
   */
  public List<Query> generate(int count) throws WorkloadException {
    checkArgument(count >= 0, "query count cannot be negative: %s", count);
    List<Query> queries = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      queries.add(next());
    }
    return queries;
  }

  /**
   * Generates <code>count</code> queries and writes them as they are produced.
   *
   * @param count Number of queries.
   * @param writer Output.
   * @throws WorkloadException if the query type rejects its parameters.
   * @throws IOException if the output cannot be written.
   */
  public void writeTo(int count, QueryWriter writer) throws WorkloadException, IOException {
    checkArgument(count >= 0, "query count cannot be negative: %s", count);
    for (int i = 0; i < count; i++) {
      writer.write(next());
      if ((i + 1) % 10000 == 0) {
        LOGGER.info("{} queries generated", i + 1);
      }
    }
  }
}
