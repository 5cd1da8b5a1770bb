package asl.sweep.processing;

/**
 * Thrown when sweep data cannot be processed with the given parameters. Every failure in the
 * processing stages is raised as one of these, tagged with the {@link ErrorType} describing what
 * went wrong, so that a caller can decide how to present it (or whether to ask for new input).
 */
public class SweepProcessingException extends RuntimeException {

  private static final long serialVersionUID = -2404188165830519427L;

  /**
   * Broad grouping of errors, in the order they are usually detected during a run.
   */
  public enum Category {
    /**
     * Bad parameter values, caught before any array is touched
     */
    CONFIGURATION,
    /**
     * Array lengths or dimensions that do not fit together
     */
    SHAPE,
    /**
     * A fit or filter that cannot produce a meaningful result on the given data
     */
    NUMERICAL
  }

  /**
   * Every kind of error the processing code can raise, with the template used to build the
   * exception message. Template arguments are filled with {@link String#format(String, Object...)}.
   */
  public enum ErrorType {
    INVALID_POINTS_PER_SWEEP(Category.CONFIGURATION,
        "Points per sweep must be at least 2 (got %d)"),
    INVALID_BANDWIDTH(Category.CONFIGURATION,
        "Sweep bandwidth must be positive (got %s)"),
    INVALID_ORDINAL(Category.CONFIGURATION,
        "%s sweep ordinal %d is outside of the range [1, %d]"),
    NON_POSITIVE_ORDINAL(Category.CONFIGURATION,
        "%s sweep ordinal must be at least 1 (got %d)"),
    NEGATIVE_DELAY(Category.CONFIGURATION,
        "Detector delay cannot be negative (got %d)"),
    INVALID_DELAY(Category.CONFIGURATION,
        "Detector delay must be in the range [0, %d) samples (got %d)"),
    INVALID_SWEEP_COUNT(Category.CONFIGURATION,
        "Sweep count must be positive (got %d)"),
    INVALID_POLYNOMIAL_DEGREE(Category.CONFIGURATION,
        "Polynomial degree must be non-negative (got %d)"),
    NO_CENTER_FREQUENCY(Category.CONFIGURATION,
        "At least one center frequency must be given"),
    NO_LO_CROSSINGS(Category.CONFIGURATION,
        "LO trace of %d points has no zero crossings, cannot count sweeps"),
    INCOMPLETE_SWEEPS(Category.SHAPE,
        "Intensity length %d is not a multiple of the sweep count %d"),
    INCOMPLETE_SWEEP_LENGTH(Category.SHAPE,
        "Intensity length %d is not a multiple of %d points per sweep"),
    TOO_SHORT(Category.SHAPE,
        "%s needs at least %d samples (got %d)"),
    MISMATCHED_SHAPE(Category.SHAPE,
        "Shape mismatch: %s is %d x %d but %s is %d x %d"),
    RAGGED_MATRIX(Category.SHAPE,
        "Row %d has %d values, expected %d"),
    EMPTY_DATA(Category.SHAPE,
        "%s contains no data"),
    WINDOW_TOO_LARGE(Category.NUMERICAL,
        "Boxcar window of %d points does not fit in %d samples"),
    TOO_FEW_POINTS(Category.NUMERICAL,
        "Fit of order %d needs at least %d points (got %d)"),
    SINGULAR_FIT(Category.NUMERICAL,
        "Baseline fit over %d points has no unique solution");

    private final Category category;
    private final String template;

    ErrorType(Category category, String template) {
      this.category = category;
      this.template = template;
    }

    public Category getCategory() {
      return category;
    }

    /**
     * Fill in the message template with the given arguments
     *
     * @param args Values to substitute into the template, in order
     * @return Human-readable message for this error
     */
    public String format(Object... args) {
      return String.format(template, args);
    }
  }

  private final ErrorType type;

  public SweepProcessingException(ErrorType type, Object... args) {
    super(type.format(args));
    this.type = type;
  }

  public ErrorType getType() {
    return type;
  }

  public Category getCategory() {
    return type.getCategory();
  }
}
