package asl.sweep.input;

/**
 * Source of the sweep count and initial sweep direction for a set of intensity data. These are
 * either read off of a local oscillator trace recorded alongside the data or given directly by
 * whoever is running the processing (say, by answering a prompt); either way the processing code
 * only ever sees the resolved values.
 */
public interface SweepParameterResolver {

  /**
   * Resolve the sweep layout for a run of intensity samples
   *
   * @param totalSamples Number of samples (rows) in the raw intensity data
   * @return Sweep count, direction and points per sweep for the data
   */
  SweepGeometry resolve(int totalSamples);

}
