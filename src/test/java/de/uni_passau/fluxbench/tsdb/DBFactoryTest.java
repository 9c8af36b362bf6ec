package de.uni_passau.fluxbench.tsdb;

import static org.junit.Assert.assertTrue;

import de.uni_passau.fluxbench.tsdb.influx2.Influx2Devops;
import de.uni_passau.fluxbench.tsdb.influx2.Influx2IoT;
import de.uni_passau.fluxbench.utils.LaggedFibonacciRandom;
import java.time.Instant;
import org.junit.Test;

public class DBFactoryTest {

  private static final Instant START = Instant.parse("2016-01-01T00:00:00Z");
  private static final Instant END = Instant.parse("2016-01-02T00:00:00Z");

  private final DBFactory factory = new DBFactory();

  @Test
  public void testInflux2Generators() throws Exception {
    LaggedFibonacciRandom random = new LaggedFibonacciRandom(123);
    assertTrue(factory.getDevops(DB.INFLUX_2, START, END, 1, random) instanceof Influx2Devops);
    assertTrue(factory.getIot(DB.INFLUX_2, START, END, 1, random) instanceof Influx2IoT);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyInterval() throws Exception {
    factory.getDevops(DB.INFLUX_2, START, START, 1, new LaggedFibonacciRandom(123));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEndBeforeStart() throws Exception {
    factory.getIot(DB.INFLUX_2, END, START, 1, new LaggedFibonacciRandom(123));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroScale() throws Exception {
    factory.getIot(DB.INFLUX_2, START, END, 0, new LaggedFibonacciRandom(123));
  }
}
