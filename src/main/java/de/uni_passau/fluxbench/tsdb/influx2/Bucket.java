package de.uni_passau.fluxbench.tsdb.influx2;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Bucket as listed by <code>GET /api/v2/buckets</code>. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Bucket {

  private final String name;

  private final String id;

  private final String type;

  @JsonCreator
  public Bucket(
      @JsonProperty("name") String name,
      @JsonProperty("id") String id,
      @JsonProperty("type") String type) {
    this.name = name;
    this.id = id;
    this.type = type;
  }

  public String getName() {
    return name;
  }

  public String getId() {
    return id;
  }

  boolean isSystem() {
    return "system".equals(type);
  }

  @Override
  public String toString() {
    return "Bucket{name='" + name + "', id='" + id + "', type='" + type + "'}";
  }
}
