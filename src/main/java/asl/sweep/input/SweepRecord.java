package asl.sweep.input;

/**
 * A raw recording to be processed: the intensity data of every sweep laid end to end, one column
 * per band, together with a name for the record and the means of working out how the record is
 * split into sweeps.
 */
public class SweepRecord {

  private final String name;
  private final SweepMatrix intensity;
  private final SweepParameterResolver resolver;

  public SweepRecord(String name, SweepMatrix intensity, SweepParameterResolver resolver) {
    this.name = name;
    this.intensity = intensity;
    this.resolver = resolver;
  }

  public String getName() {
    return name;
  }

  public SweepMatrix getIntensity() {
    return intensity;
  }

  public SweepParameterResolver getResolver() {
    return resolver;
  }

  /**
   * Work out the sweep count, direction and length for this record's samples
   *
   * @return Geometry of the record
   */
  public SweepGeometry resolveGeometry() {
    return resolver.resolve(intensity.getRows());
  }

  /**
   * Check that there is anything to process
   *
   * @return True if the record has a resolver and at least one sample
   */
  public boolean hasData() {
    return intensity != null && resolver != null && intensity.getRows() > 0;
  }
}
