package de.uni_passau.fluxbench.workload;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.uni_passau.fluxbench.workload.query.impl.Query;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes queries as JSON lines, one object per query with the fields humanLabel,
 * humanDescription, method, path, rawQuery and body.
 */
public class QueryWriter implements Closeable {

  private final ObjectMapper mapper =
      new ObjectMapper().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

  private final Writer out;

  private long written;

  /**
   * Creates a writer.
   *
   * @param out Target, closed together with this writer.
   */
  public QueryWriter(Writer out) {
    this.out = out;
  }

  /**
   * Appends one query.
   *
   * @param query Filled query.
   * @throws IOException if the target cannot be written.
   */
  public void write(Query query) throws IOException {
    ObjectNode node = mapper.createObjectNode();
    node.put("humanLabel", query.getHumanLabel());
    node.put("humanDescription", query.getHumanDescription());
    node.put("method", query.getMethod());
    node.put("path", query.getPath());
    node.put("rawQuery", query.getRawQuery());
    node.put("body", query.getBody());
    out.write(mapper.writeValueAsString(node));
    out.write('\n');
    written++;
  }

  /**
   * Returns the number of queries written so far.
   *
   * @return Number of queries.
   */
  public long getWritten() {
    return written;
  }

  @Override
  public void close() throws IOException {
    out.close();
  }
}
