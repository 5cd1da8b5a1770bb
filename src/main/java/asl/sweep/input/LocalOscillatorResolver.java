package asl.sweep.input;

import asl.sweep.processing.SweepProcessingException;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import org.apache.log4j.Logger;

/**
 * Gets the sweep count and direction from the local oscillator (LO) voltage recorded along with
 * the detector intensity. The LO trace swings through zero each time the sweep turns around, so
 * the number of sign changes between neighboring points is the number of sweeps, and the sign of
 * the first point tells which way the first sweep goes (a negative LO voltage starts at the low
 * end of the band, so the first sweep is going up).
 */
public class LocalOscillatorResolver implements SweepParameterResolver {

  private static final Logger logger = Logger.getLogger(LocalOscillatorResolver.class);

  private final double[] loTrace;

  /**
   * @param loTrace Local oscillator voltage trace; not modified
   */
  public LocalOscillatorResolver(double[] loTrace) {
    this.loTrace = loTrace.clone();
  }

  /**
   * Count the points where the LO trace changes sign from the previous point.
   *
   * @param trace LO voltage trace
   * @return Number of zero crossings in the trace
   */
  public static int countCrossings(double[] trace) {
    int crossings = 0;
    for (int i = 1; i < trace.length; ++i) {
      if (trace[i] * trace[i - 1] < 0) {
        ++crossings;
      }
    }
    return crossings;
  }

  /**
   * Get the direction of the first sweep from the LO trace
   *
   * @param trace LO voltage trace
   * @return True if the first sweep increases in frequency
   */
  public static boolean firstSweepUp(double[] trace) {
    if (trace.length == 0) {
      throw new SweepProcessingException(ErrorType.EMPTY_DATA, "LO trace");
    }
    return trace[0] < 0;
  }

  @Override
  public SweepGeometry resolve(int totalSamples) {
    int crossings = countCrossings(loTrace);
    if (crossings == 0) {
      throw new SweepProcessingException(ErrorType.NO_LO_CROSSINGS, loTrace.length);
    }
    if (crossings % 2 != 0) {
      // data should cover full up-down cycles
      logger.warn("LO trace has an odd number of crossings (" + crossings
          + "), data may not cover full sweep cycles");
    }
    boolean sweepUp = firstSweepUp(loTrace);
    logger.debug("LO trace gives " + crossings + " sweeps, first sweep up: " + sweepUp);
    return SweepGeometry.forSamples(totalSamples, crossings, sweepUp);
  }
}
