package de.uni_passau.fluxbench.workload.query.impl;

import java.util.Objects;

/**
 * A fully materialized HTTP query as consumed by the benchmark executor. A freshly allocated
 * query has all fields set to the empty string; a generator fills it exactly once.
 */
public class Query {

  /** Short label that groups queries of the same type in reports. */
  private String humanLabel = "";

  /** Label plus the parameters that make this particular query unique. */
  private String humanDescription = "";

  /** HTTP method. */
  private String method = "";

  /** HTTP path, relative to the server's base URL. */
  private String path = "";

  /** Query text as sent to the server. */
  private String rawQuery = "";

  /** HTTP request body. */
  private String body = "";

  public String getHumanLabel() {
    return humanLabel;
  }

  /**
   * Sets the human-readable label.
   *
   * @param humanLabel Label.
   * @return The muted object to use in the builder style.
   */
  public Query setHumanLabel(String humanLabel) {
    this.humanLabel = humanLabel;
    return this;
  }

  public String getHumanDescription() {
    return humanDescription;
  }

  /**
   * Sets the human-readable description.
   *
   * @param humanDescription Description.
   * @return The muted object to use in the builder style.
   */
  public Query setHumanDescription(String humanDescription) {
    this.humanDescription = humanDescription;
    return this;
  }

  public String getMethod() {
    return method;
  }

  /**
   * Sets the HTTP method.
   *
   * @param method HTTP method, e.g., POST.
   * @return The muted object to use in the builder style.
   */
  public Query setMethod(String method) {
    this.method = method;
    return this;
  }

  public String getPath() {
    return path;
  }

  /**
   * Sets the HTTP path.
   *
   * @param path Path of the query endpoint.
   * @return The muted object to use in the builder style.
   */
  public Query setPath(String path) {
    this.path = path;
    return this;
  }

  public String getRawQuery() {
    return rawQuery;
  }

  /**
   * Sets the query text.
   *
   * @param rawQuery Query text.
   * @return The muted object to use in the builder style.
   */
  public Query setRawQuery(String rawQuery) {
    this.rawQuery = rawQuery;
    return this;
  }

  public String getBody() {
    return body;
  }

  /**
   * Sets the HTTP request body.
   *
   * @param body Request body.
   * @return The muted object to use in the builder style.
   */
  public Query setBody(String body) {
    this.body = body;
    return this;
  }

  /**
   * Checks whether no field has been filled in yet.
   *
   * @return true if every field is empty.
   */
  public boolean isEmpty() {
    return humanLabel.isEmpty()
        && humanDescription.isEmpty()
        && method.isEmpty()
        && path.isEmpty()
        && rawQuery.isEmpty()
        && body.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Query)) {
      return false;
    }
    Query other = (Query) o;
    return humanLabel.equals(other.humanLabel)
        && humanDescription.equals(other.humanDescription)
        && method.equals(other.method)
        && path.equals(other.path)
        && rawQuery.equals(other.rawQuery)
        && body.equals(other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(humanLabel, humanDescription, method, path, rawQuery, body);
  }

  @Override
  public String toString() {
    return "Query{humanLabel='" + humanLabel + "', method='" + method + "', path='" + path + "'}";
  }
}
