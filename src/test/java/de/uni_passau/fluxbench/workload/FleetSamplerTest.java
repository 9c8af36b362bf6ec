package de.uni_passau.fluxbench.workload;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import de.uni_passau.fluxbench.utils.LaggedFibonacciRandom;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import org.junit.Test;

public class FleetSamplerTest {

  private final FleetSampler trucks = new FleetSampler("truck", "trucks", 10);

  @Test
  public void testSampleKeepsDrawOrder() throws Exception {
    assertEquals(
        Arrays.asList("truck_5", "truck_9", "truck_3"),
        trucks.sample(3, new LaggedFibonacciRandom(123)));
  }

  @Test
  public void testSampleWholeFleet() throws Exception {
    List<String> all = trucks.sample(10, new LaggedFibonacciRandom(123));
    assertEquals(
        Arrays.asList(
            "truck_5", "truck_9", "truck_3", "truck_1", "truck_7",
            "truck_2", "truck_8", "truck_4", "truck_6", "truck_0"),
        all);
  }

  @Test
  public void testSampleIsDistinctAndInRange() throws Exception {
    FleetSampler hosts = new FleetSampler("host", "hosts", 100);
    LaggedFibonacciRandom random = new LaggedFibonacciRandom(42);
    for (int n = 1; n <= 100; n += 11) {
      List<String> names = hosts.sample(n, random);
      assertEquals(n, names.size());
      assertEquals(n, new HashSet<>(names).size());
      for (String name : names) {
        int index = Integer.parseInt(name.substring("host_".length()));
        assertTrue(index >= 0 && index < 100);
      }
    }
  }

  @Test
  public void testTooFew() throws Exception {
    try {
      new FleetSampler("host", "hosts", 10).sample(0, new LaggedFibonacciRandom(123));
      fail();
    } catch (WorkloadException e) {
      assertEquals("number of hosts cannot be < 1; got 0", e.getMessage());
    }
  }

  @Test
  public void testTooMany() throws Exception {
    try {
      trucks.sample(20, new LaggedFibonacciRandom(123));
      fail();
    } catch (WorkloadException e) {
      assertEquals(
          "number of trucks (20) larger than total trucks. See --scale (10)", e.getMessage());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroScale() throws Exception {
    new FleetSampler("host", "hosts", 0);
  }
}
