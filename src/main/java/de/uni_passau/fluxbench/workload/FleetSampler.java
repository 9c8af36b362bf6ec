package de.uni_passau.fluxbench.workload;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import de.uni_passau.fluxbench.utils.LaggedFibonacciRandom;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Draws distinct tag values, e.g., <code>host_3</code>, from a fleet of <code>scale</code>
 * members named <code>&lt;prefix&gt;_0 ... &lt;prefix&gt;_(scale-1)</code>, the names the data
 * generators give hosts and trucks.
 */
public class FleetSampler {

  private static final String ERR_TOO_FEW = "number of %s cannot be < 1; got %d";
  private static final String ERR_TOO_MANY =
      "number of %s (%d) larger than total %s. See --scale (%d)";

  /** Tag value prefix, e.g., host. */
  private final String prefix;

  /** Plural noun used in error messages, e.g., hosts. */
  private final String noun;

  /** Fleet size. */
  private final int scale;

  /**
   * Creates a sampler.
   *
   * @param prefix Tag value prefix.
   * @param noun Plural noun used in error messages.
   * @param scale Fleet size, at least 1.
   */
  public FleetSampler(String prefix, String noun, int scale) {
    checkNotNull(prefix);
    checkNotNull(noun);
    checkArgument(scale >= 1, "scale must be at least 1, got %s", scale);
    this.prefix = prefix;
    this.noun = noun;
    this.scale = scale;
  }

  public int getScale() {
    return scale;
  }

  /**
   * Returns the tag value of the fleet member with the given index.
   *
   * @param index Index in <code>[0, scale)</code>.
   * @return Tag value.
   */
  public String name(int index) {
    return prefix + "_" + index;
  }

  /**
   * Draws <code>n</code> distinct members. Indices are drawn one at a time and redrawn on
   * collision, so the result keeps the draw order.
   *
   * @param n Number of members to draw.
   * @param random Shared random source.
   * @return Tag values in draw order.
   * @throws WorkloadException if <code>n</code> is below 1 or exceeds the scale.
   */
  public List<String> sample(int n, LaggedFibonacciRandom random) throws WorkloadException {
    if (n < 1) {
      throw new WorkloadException(String.format(ERR_TOO_FEW, noun, n));
    }
    if (n > scale) {
      throw new WorkloadException(String.format(ERR_TOO_MANY, noun, n, noun, scale));
    }
    Set<Integer> seen = new HashSet<>();
    List<String> names = new ArrayList<>(n);
    while (names.size() < n) {
      int index = random.nextInt(scale);
      if (seen.add(index)) {
        names.add(name(index));
      }
    }
    return names;
  }
}
