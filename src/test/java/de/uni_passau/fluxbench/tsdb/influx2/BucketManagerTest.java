package de.uni_passau.fluxbench.tsdb.influx2;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import de.uni_passau.fluxbench.tsdb.TsdbException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

public class BucketManagerTest {

  private static final String LISTING =
      "{\"links\":{\"self\":\"/api/v2/buckets\"},\"buckets\":["
          + "{\"id\":\"aa01\",\"orgID\":\"org1\",\"type\":\"system\",\"name\":\"_monitoring\"},"
          + "{\"id\":\"aa02\",\"orgID\":\"org1\",\"type\":\"system\",\"name\":\"_tasks\"},"
          + "{\"id\":\"bb01\",\"orgID\":\"org1\",\"type\":\"user\",\"name\":\"benchmark\","
          + "\"retentionRules\":[{\"type\":\"expire\",\"everySeconds\":0}],\"labels\":[]}"
          + "]}";

  private HttpClient client;

  private BucketManager manager;

  @Before
  public void before() throws Exception {
    client = mock(HttpClient.class);
    manager = new BucketManager(client, "http://influx:8086", "secret", "org1", Duration.ZERO);
  }

  @SuppressWarnings("unchecked")
  private static HttpResponse<String> response(int status, String body) {
    HttpResponse<String> response = mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    return response;
  }

  private List<HttpRequest> sentRequests(int count) throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(client, times(count)).send(captor.capture(), any());
    return captor.getAllValues();
  }

  @Test
  public void testListBucketsSkipsSystemBuckets() throws Exception {
    doReturn(response(200, LISTING)).when(client).send(any(), any());

    List<Bucket> buckets = manager.listBuckets();
    assertEquals(1, buckets.size());
    assertEquals("benchmark", buckets.get(0).getName());
    assertEquals("bb01", buckets.get(0).getId());

    HttpRequest request = sentRequests(1).get(0);
    assertEquals("GET", request.method());
    assertEquals(URI.create("http://influx:8086/api/v2/buckets"), request.uri());
    assertEquals("Token secret", request.headers().firstValue("Authorization").get());
  }

  @Test
  public void testBucketExists() throws Exception {
    doReturn(response(200, LISTING)).when(client).send(any(), any());
    assertTrue(manager.bucketExists("benchmark"));
    assertFalse(manager.bucketExists("_monitoring"));
    assertFalse(manager.bucketExists("other"));
  }

  @Test
  public void testCreateBucket() throws Exception {
    doReturn(response(201, "{}")).when(client).send(any(), any());
    manager.createBucket("benchmark");

    HttpRequest request = sentRequests(1).get(0);
    assertEquals("POST", request.method());
    assertEquals(URI.create("http://influx:8086/api/v2/buckets"), request.uri());
    assertEquals("application/json", request.headers().firstValue("Content-Type").get());
    assertEquals("Token secret", request.headers().firstValue("Authorization").get());
  }

  @Test
  public void testCreateBody() throws Exception {
    assertEquals(
        "{\"name\":\"benchmark\",\"orgID\":\"org1\",\"type\":\"user\",\"retentionRules\":[],"
            + "\"description\":\"tsbs load test\"}",
        manager.createBody("benchmark"));
  }

  @Test
  public void testCreateBucketRejected() throws Exception {
    doReturn(response(422, "{\"code\":\"conflict\"}")).when(client).send(any(), any());
    try {
      manager.createBucket("benchmark");
      fail();
    } catch (TsdbException e) {
      assertEquals("create bucket returned non-201 code: 422", e.getMessage());
    }
  }

  @Test
  public void testRemoveOldBucket() throws Exception {
    HttpResponse<String> listed = response(200, LISTING);
    HttpResponse<String> deleted = response(204, "");
    doReturn(listed, deleted).when(client).send(any(), any());

    manager.removeOldBucket("benchmark");

    HttpRequest delete = sentRequests(2).get(1);
    assertEquals("DELETE", delete.method());
    assertEquals(URI.create("http://influx:8086/api/v2/buckets/bb01"), delete.uri());
  }

  @Test
  public void testRemoveMissingBucketIsNoOp() throws Exception {
    doReturn(response(200, LISTING)).when(client).send(any(), any());
    manager.removeOldBucket("other");
    assertEquals("GET", sentRequests(1).get(0).method());
  }

  @Test
  public void testRemoveOldBucketRejected() throws Exception {
    HttpResponse<String> listed = response(200, LISTING);
    HttpResponse<String> refused = response(404, "");
    doReturn(listed, refused).when(client).send(any(), any());
    try {
      manager.removeOldBucket("benchmark");
      fail();
    } catch (TsdbException e) {
      assertEquals("drop bucket returned non-204 code: 404", e.getMessage());
    }
  }

  @Test
  public void testUndecodableListing() throws Exception {
    doReturn(response(200, "not json")).when(client).send(any(), any());
    try {
      manager.listBuckets();
      fail();
    } catch (TsdbException e) {
      assertTrue(e.getMessage().startsWith("list buckets error unmarshalling JSON"));
    }
  }

  @Test
  public void testConnectionFailure() throws Exception {
    doThrow(new IOException("connection refused")).when(client).send(any(), any());
    try {
      manager.listBuckets();
      fail();
    } catch (TsdbException e) {
      assertTrue(e.getCause() instanceof IOException);
    }
  }
}
