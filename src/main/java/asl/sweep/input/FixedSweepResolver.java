package asl.sweep.input;

/**
 * Resolver for when the sweep count and direction are already known, i.e., there is no LO trace
 * and the values were supplied by the user.
 */
public class FixedSweepResolver implements SweepParameterResolver {

  private final int sweepCount;
  private final boolean sweepUp;

  public FixedSweepResolver(int sweepCount, boolean sweepUp) {
    this.sweepCount = sweepCount;
    this.sweepUp = sweepUp;
  }

  @Override
  public SweepGeometry resolve(int totalSamples) {
    return SweepGeometry.forSamples(totalSamples, sweepCount, sweepUp);
  }
}
