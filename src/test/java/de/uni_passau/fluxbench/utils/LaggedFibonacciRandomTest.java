package de.uni_passau.fluxbench.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class LaggedFibonacciRandomTest {

  @Test
  public void testFirstValues() throws Exception {
    assertEquals(5577006791947779410L, new LaggedFibonacciRandom(1).nextLong());

    LaggedFibonacciRandom random = new LaggedFibonacciRandom(123);
    assertEquals(5361704182646325489L, random.nextLong());
    assertEquals(241876450138978746L, random.nextLong());
  }

  @Test
  public void testBoundedInts() throws Exception {
    LaggedFibonacciRandom random = new LaggedFibonacciRandom(1);
    int[] drawn = new int[10];
    for (int i = 0; i < drawn.length; i++) {
      drawn[i] = random.nextInt(100);
    }
    assertArrayEquals(new int[] {81, 87, 47, 59, 81, 18, 25, 40, 56, 0}, drawn);
  }

  @Test
  public void testBoundedLongs() throws Exception {
    LaggedFibonacciRandom random = new LaggedFibonacciRandom(123);
    assertEquals(241L, random.nextLong(1024));
    assertEquals(384_702_675_386L, random.nextLong(1L << 40));
    assertEquals(2_850_894_865_143L, random.nextLong(3_600_000_000_000L));

    LaggedFibonacciRandom other = new LaggedFibonacciRandom(7);
    for (int i = 0; i < 1000; i++) {
      long value = other.nextLong(3_599_000_000_001L);
      assertTrue(value >= 0 && value < 3_599_000_000_001L);
    }
  }

  @Test
  public void testSeedResidues() throws Exception {
    assertEquals(
        new LaggedFibonacciRandom(89482311).nextLong(), new LaggedFibonacciRandom(0).nextLong());
    assertEquals(
        new LaggedFibonacciRandom(123).nextLong(),
        new LaggedFibonacciRandom(123L + Integer.MAX_VALUE).nextLong());
    assertEquals(
        new LaggedFibonacciRandom(Integer.MAX_VALUE - 5L).nextLong(),
        new LaggedFibonacciRandom(-5).nextLong());
  }

  @Test
  public void testSetSeedRestarts() throws Exception {
    LaggedFibonacciRandom random = new LaggedFibonacciRandom(123);
    long first = random.nextLong();
    random.nextLong();
    random.setSeed(123);
    assertEquals(first, random.nextLong());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveIntBound() throws Exception {
    new LaggedFibonacciRandom(1).nextInt(0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveLongBound() throws Exception {
    new LaggedFibonacciRandom(1).nextLong(-1);
  }
}
