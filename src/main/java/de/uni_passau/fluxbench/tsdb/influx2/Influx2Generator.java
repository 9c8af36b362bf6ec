package de.uni_passau.fluxbench.tsdb.influx2;

import static com.google.common.base.Preconditions.checkNotNull;

import de.uni_passau.fluxbench.workload.QueryGenerator;
import de.uni_passau.fluxbench.workload.query.impl.Query;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stringtemplate.v4.AutoIndentWriter;
import org.stringtemplate.v4.ST;
import org.stringtemplate.v4.STGroupFile;

/**
 * Shared part of the InfluxDB 2.x generators: Flux templates and the packaging of rendered
 * Flux into HTTP queries against <code>/api/v2/query</code>.
 */
public abstract class Influx2Generator implements QueryGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(Influx2Generator.class);

  /** Prefix of every human readable label. */
  static final String LABEL_PREFIX = "Influx 2.x";

  /** HTTP method of every query. */
  static final String METHOD = "POST";

  /** HTTP path of every query. */
  static final String PATH = "/api/v2/query";

  /** Flux scenario templates. Flux uses angle brackets, hence $ delimiters. */
  private final STGroupFile scenarioTemplates;

  /**
   * Creates a generator backed by the given template group.
   *
   * @param templatesPath Class path location of the group file.
   */
  protected Influx2Generator(String templatesPath) {
    scenarioTemplates = new STGroupFile(templatesPath, '$', '$');
  }

  @Override
  public Query generateEmptyQuery() {
    return new Query();
  }

  /**
   * Fills in an HTTP query carrying the given Flux text as both raw query and body.
   *
   * @param query Query to fill.
   * @param humanLabel Label.
   * @param humanDescription Description.
   * @param flux Flux text.
   */
  void fillInQuery(Query query, String humanLabel, String humanDescription, String flux) {
    checkNotNull(query);
    LOGGER.debug("Generated query: {}", humanDescription);
    query
        .setHumanLabel(humanLabel)
        .setHumanDescription(humanDescription)
        .setMethod(METHOD)
        .setPath(PATH)
        .setRawQuery(flux)
        .setBody(flux);
  }

  /**
   * Renders a Flux template. Lines are always separated by a single LF and the query opens with
   * a line break, so the first pipeline line is indented like all others.
   *
   * @param name Template name.
   * @param attributes Template arguments.
   * @return Flux text.
   */
  String render(String name, Map<String, ?> attributes) {
    ST template = scenarioTemplates.getInstanceOf(name);
    checkNotNull(template, "no Flux template named %s", name);
    for (Map.Entry<String, ?> attribute : attributes.entrySet()) {
      template.add(attribute.getKey(), attribute.getValue());
    }
    StringWriter flux = new StringWriter();
    flux.write('\n');
    try {
      template.write(new AutoIndentWriter(flux, "\n"));
    } catch (IOException e) {
      throw new IllegalStateException("Could not render Flux template " + name, e);
    }
    return flux.toString();
  }
}
