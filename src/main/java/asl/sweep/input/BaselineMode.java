package asl.sweep.input;

/**
 * Which baseline corrections to apply to the sweep data.
 */
public enum BaselineMode {

  /**
   * No baseline removal of any kind, including sweep continuity correction
   */
  NONE("No baseline removal"),
  /**
   * Polynomial fit per sweep and a linear fit over the full stitched spectrum
   */
  POLYNOMIAL("Polynomial baseline"),
  /**
   * Polynomial fits as above, each followed by an adaptive spline fit
   */
  POLYNOMIAL_AND_SPLINE("Polynomial and spline baseline");

  private final String name;

  BaselineMode(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public boolean removesBaseline() {
    return this != NONE;
  }

  public boolean usesSpline() {
    return this == POLYNOMIAL_AND_SPLINE;
  }
}
