package de.uni_passau.fluxbench.tsdb.influx2;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class FluxPredicatesTest {

  @Test
  public void testTagDisjunction() throws Exception {
    assertEquals(
        "(r.hostname == 'host_9')",
        FluxPredicates.tagDisjunction("hostname", Collections.singletonList("host_9")));
    assertEquals(
        "(r.name == 'truck_9' or r.name == 'truck_3' or r.name == 'truck_5')",
        FluxPredicates.tagDisjunction("name", Arrays.asList("truck_9", "truck_3", "truck_5")));
  }

  @Test
  public void testFieldDisjunction() throws Exception {
    assertEquals(
        "(r._field == 'usage_user' or r._field == 'usage_system')",
        FluxPredicates.fieldDisjunction(Arrays.asList("usage_user", "usage_system")));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyTagValues() throws Exception {
    FluxPredicates.tagDisjunction("hostname", Collections.emptyList());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyFields() throws Exception {
    FluxPredicates.fieldDisjunction(Collections.emptyList());
  }
}
