package de.uni_passau.fluxbench.tsdb.influx2;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builders of disjunctive Flux filter fragments.
 */
public final class FluxPredicates {

  private FluxPredicates() {}

  /**
   * Builds <code>(r.&lt;tag&gt; == 'v1' or r.&lt;tag&gt; == 'v2' ...)</code>. A single value is
   * still wrapped in parentheses.
   *
   * @param tag Tag name, e.g., hostname.
   * @param values Tag values, not empty.
   * @return Filter fragment.
   */
  public static String tagDisjunction(String tag, List<String> values) {
    checkNotNull(tag);
    checkNotNull(values);
    checkArgument(!values.isEmpty(), "cannot build a %s filter without values", tag);
    return values.stream()
        .map(value -> String.format("r.%s == '%s'", tag, value))
        .collect(Collectors.joining(" or ", "(", ")"));
  }

  /**
   * Builds <code>(r._field == 'f1' or r._field == 'f2' ...)</code>.
   *
   * @param fields Field names, not empty.
   * @return Filter fragment.
   */
  public static String fieldDisjunction(List<String> fields) {
    return tagDisjunction("_field", fields);
  }
}
