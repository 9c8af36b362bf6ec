package de.uni_passau.fluxbench.tsdb.influx2;

import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.uni_passau.fluxbench.conf.Config;
import de.uni_passau.fluxbench.tsdb.TsdbException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administration of the benchmark bucket over the InfluxDB 2.x HTTP API. System buckets are
 * invisible to this class.
 */
public class BucketManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(BucketManager.class);

  private static final String BUCKETS_PATH = "/api/v2/buckets";

  private static final String CREATE_DESCRIPTION = "tsbs load test";

  private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(1);

  private final ObjectMapper mapper = new ObjectMapper();

  /** The client that is used to access HTTP API endpoints of InfluxDB. */
  private final HttpClient client;

  private final String baseUrl;

  private final String token;

  private final String orgId;

  /** Time to wait after a bucket has been created or deleted. */
  private final Duration settleTime;

  /**
   * Creates a manager for the server configured in {@link Config}.
   *
   * @param config Configuration params instance.
   */
  public BucketManager(Config config) {
    this(
        HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
        config.INFLUX_URL,
        config.INFLUX_TOKEN,
        config.INFLUX_ORG,
        Duration.ofSeconds(1));
  }

  /**
   * Creates a manager.
   *
   * @param client HTTP client.
   * @param baseUrl Server URL without trailing slash, e.g., http://localhost:8086.
   * @param token API token.
   * @param orgId ID of the organization owning created buckets.
   * @param settleTime Time to wait after a bucket has been created or deleted.
   */
  public BucketManager(
      HttpClient client, String baseUrl, String token, String orgId, Duration settleTime) {
    this.client = checkNotNull(client);
    this.baseUrl = checkNotNull(baseUrl);
    this.token = checkNotNull(token);
    this.orgId = checkNotNull(orgId);
    this.settleTime = checkNotNull(settleTime);
  }

  /**
   * Lists the non-system buckets.
   *
   * @return User buckets in server order.
   * @throws TsdbException if the server cannot be reached or answers unexpectedly.
   */
  public List<Bucket> listBuckets() throws TsdbException {
    HttpRequest request = authorized(URI.create(baseUrl + BUCKETS_PATH)).GET().build();
    HttpResponse<String> response = send(request);
    if (response.statusCode() != 200) {
      throw new TsdbException(
          String.format("list buckets returned non-200 code: %d", response.statusCode()));
    }
    BucketListing listing;
    try {
      listing = mapper.readValue(response.body(), BucketListing.class);
    } catch (JsonProcessingException e) {
      throw new TsdbException("list buckets error unmarshalling JSON: " + e.getMessage(), e);
    }
    if (listing.buckets == null) {
      return Collections.emptyList();
    }
    return listing.buckets.stream().filter(b -> !b.isSystem()).collect(Collectors.toList());
  }

  /**
   * Checks whether a user bucket exists.
   *
   * @param name Bucket name.
   * @return true if a non-system bucket has this name.
   * @throws TsdbException if the buckets cannot be listed.
   */
  public boolean bucketExists(String name) throws TsdbException {
    return find(name).isPresent();
  }

  /**
   * Creates a bucket without retention rules.
   *
   * @param name Bucket name.
   * @throws TsdbException if the server does not answer with 201.
   */
  public void createBucket(String name) throws TsdbException {
    HttpRequest request =
        authorized(URI.create(baseUrl + BUCKETS_PATH))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(createBody(name)))
            .build();
    HttpResponse<String> response = send(request);
    if (response.statusCode() != 201) {
      LOGGER.error("Could not create bucket {}: {}", name, response.body());
      throw new TsdbException(
          String.format("create bucket returned non-201 code: %d", response.statusCode()));
    }
    LOGGER.info("Created bucket {}", name);
    settle();
  }

  /**
   * Deletes a bucket if it exists.
   *
   * @param name Bucket name.
   * @throws TsdbException if the server does not answer with 204.
   */
  public void removeOldBucket(String name) throws TsdbException {
    Optional<Bucket> bucket = find(name);
    if (!bucket.isPresent()) {
      LOGGER.debug("Bucket {} does not exist, nothing to remove", name);
      return;
    }
    HttpRequest request =
        authorized(URI.create(baseUrl + BUCKETS_PATH + "/" + bucket.get().getId()))
            .DELETE()
            .build();
    HttpResponse<String> response = send(request);
    if (response.statusCode() != 204) {
      throw new TsdbException(
          String.format("drop bucket returned non-204 code: %d", response.statusCode()));
    }
    LOGGER.info("Removed bucket {}", name);
    settle();
  }

  /**
   * Builds the JSON body of a bucket creation request.
   *
   * @param name Bucket name.
   * @return JSON document.
   * @throws TsdbException if the document cannot be encoded.
   */
  String createBody(String name) throws TsdbException {
    ObjectNode body = mapper.createObjectNode();
    body.put("name", name);
    body.put("orgID", orgId);
    body.put("type", "user");
    body.putArray("retentionRules");
    body.put("description", CREATE_DESCRIPTION);
    try {
      return mapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new TsdbException("Could not encode bucket " + name, e);
    }
  }

  private Optional<Bucket> find(String name) throws TsdbException {
    return listBuckets().stream().filter(b -> b.getName().equals(name)).findFirst();
  }

  private HttpRequest.Builder authorized(URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(REQUEST_TIMEOUT)
        .header("Authorization", "Token " + token);
  }

  private HttpResponse<String> send(HttpRequest request) throws TsdbException {
    LOGGER.debug("{} {}", request.method(), request.uri());
    try {
      return client.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TsdbException(request.method() + " " + request.uri() + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TsdbException(request.method() + " " + request.uri() + " interrupted", e);
    }
  }

  private void settle() throws TsdbException {
    if (settleTime.isZero()) {
      return;
    }
    try {
      Thread.sleep(settleTime.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TsdbException("Interrupted while waiting for the bucket change", e);
    }
  }

  /** Envelope of the bucket listing. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class BucketListing {
    @JsonProperty("buckets")
    List<Bucket> buckets = new ArrayList<>();
  }
}
