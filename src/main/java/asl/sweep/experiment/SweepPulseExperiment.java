package asl.sweep.experiment;

import asl.sweep.input.BaselineMode;
import asl.sweep.input.Configuration;
import asl.sweep.input.SweepGeometry;
import asl.sweep.input.SweepMatrix;
import asl.sweep.input.SweepParameters;
import asl.sweep.input.SweepRecord;
import asl.sweep.output.SpectrumData;
import asl.sweep.processing.BoxcarSmoother;
import asl.sweep.processing.DelayCorrector;
import asl.sweep.processing.Differentiator;
import asl.sweep.processing.FrequencyReconstructor;
import asl.sweep.processing.PerSweepDebaseliner;
import asl.sweep.processing.SweepExtractor;
import asl.sweep.processing.SweepProcessingException;
import asl.sweep.processing.SweepStitcher;
import asl.sweep.processing.WidebandDebaseliner;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Reconstructs a spectrum from a record of pulsed linear frequency sweeps. The frequency of each
 * sample is worked out from the sweep geometry and the band centers, the signal sweep is picked
 * out of the record (or averaged over every sweep going the same way), the detector delay is
 * taken out, baselines are removed from each sweep and then from the whole spectrum, and the
 * bands are stitched together into a single waveform. The result can then be smoothed and
 * differentiated.
 *
 * Two charts are produced. The first holds the final spectrum; the second holds the signal
 * extracted for each band before any baseline was removed.
 */
public class SweepPulseExperiment extends Experiment {

  private static final Logger logger = Logger.getLogger(SweepPulseExperiment.class);

  private SweepParameters parameters;
  private SweepGeometry geometry;
  private SpectrumData spectrum;
  private String outputName;

  public SweepPulseExperiment() {
    super();
    parameters = null;
  }

  public SweepPulseExperiment(SweepParameters parameters) {
    super();
    this.parameters = parameters;
  }

  /**
   * Set the parameters to use in the next run
   *
   * @param parameters Run settings
   */
  public void setParameters(SweepParameters parameters) {
    this.parameters = parameters;
  }

  public SweepParameters getParameters() {
    if (parameters == null) {
      parameters = SweepParameters.builder().build();
    }
    return parameters;
  }

  @Override
  protected void backend(final SweepRecord record) {
    SweepParameters params = getParameters();
    try {
      spectrum = process(record, params);
    } catch (SweepProcessingException e) {
      logger.error("Could not process " + record.getName() + " (" + e.getCategory() + "): "
          + e.getMessage(), e);
      fireStateChange("Processing failed: " + e.getMessage());
      throw e;
    }
    logger.info("Processed " + record.getName() + " into " + spectrum.size()
        + " points for " + outputName);
    fireStateChange("Done!");
  }

  private SpectrumData process(final SweepRecord record, SweepParameters params) {
    dataNames.add(record.getName());
    outputName = params.getOutputName(record.getName());
    dataNames.add(outputName);
    Configuration config = params.getConfiguration();

    fireStateChange("Resolving sweep geometry...");
    geometry = record.resolveGeometry();
    int pointsPerSweep = geometry.getPointsPerSweep();
    int delay = params.getDelay();
    DelayCorrector.checkDelay(delay, pointsPerSweep);
    logger.debug("Geometry for " + record.getName() + ": " + geometry);

    fireStateChange("Reconstructing frequency axis...");
    int foreground = params.getForeground();
    // sweeps of the same parity as the first one run the same way
    boolean foregroundUp = geometry.isSweepUp() == (foreground % 2 == 1);
    SweepMatrix frequency = FrequencyReconstructor.reconstruct(params.getCenterFrequencies(),
        pointsPerSweep, foregroundUp, params.getBandwidth());

    fireStateChange("Extracting sweeps...");
    SweepMatrix raw = DelayCorrector.roll(record.getIntensity(), delay);
    Integer background = params.getBackground();
    SweepMatrix intensity =
        SweepExtractor.extractOrAverage(raw, pointsPerSweep, foreground, background);
    int sweepCount = SweepExtractor.countSweeps(raw, pointsPerSweep);
    Pair<SweepMatrix, SweepMatrix> corrected =
        DelayCorrector.wrapsToStart(sweepCount, foreground, background)
            ? DelayCorrector.truncateLeading(frequency, intensity, delay)
            : DelayCorrector.truncate(frequency, intensity, delay);
    frequency = corrected.getFirst();
    intensity = corrected.getSecond();
    xySeriesData.add(sweepChart(frequency, intensity));

    BaselineMode mode = params.getBaselineMode();
    if (mode.removesBaseline()) {
      fireStateChange("Removing baseline from each sweep...");
      intensity = PerSweepDebaseliner.debaseline(intensity, params.getPolynomialDegree(),
          mode.usesSpline(), config);
    }

    fireStateChange("Stitching sweeps...");
    Pair<double[], double[]> stitched =
        SweepStitcher.stitch(frequency, intensity, mode.removesBaseline());
    double[] freqOut = stitched.getFirst();
    double[] intenOut = stitched.getSecond();

    if (mode.removesBaseline()) {
      fireStateChange("Removing wideband baseline...");
      intenOut = WidebandDebaseliner.debaseline(intenOut, mode.usesSpline(), config);
    }

    Integer window = params.getBoxcarWindow();
    if (window != null) {
      fireStateChange("Smoothing...");
      Pair<double[], double[]> smoothed = BoxcarSmoother.boxcar(freqOut, intenOut, window);
      freqOut = smoothed.getFirst();
      intenOut = smoothed.getSecond();
    }

    if (params.isDifferentiate()) {
      fireStateChange("Differentiating...");
      Pair<double[], double[]> derivative = Differentiator.differentiate(freqOut, intenOut);
      freqOut = derivative.getFirst();
      intenOut = derivative.getSecond();
    }

    XYSeriesCollection spectrumChart = new XYSeriesCollection();
    spectrumChart.addSeries(toSeries(outputName, freqOut, intenOut));
    xySeriesData.add(0, spectrumChart);
    return new SpectrumData(freqOut, intenOut, frequency.getBands(), geometry);
  }

  private XYSeriesCollection sweepChart(SweepMatrix frequency, SweepMatrix intensity) {
    XYSeriesCollection collection = new XYSeriesCollection();
    for (int band = 0; band < frequency.getBands(); ++band) {
      collection.addSeries(toSeries("Band " + (band + 1),
          frequency.getColumn(band), intensity.getColumn(band)));
    }
    return collection;
  }

  /**
   * Get the spectrum produced by the most recent run
   *
   * @return Final frequency and intensity data
   */
  public SpectrumData getSpectrum() {
    return spectrum;
  }

  /**
   * Get the sweep geometry resolved for the most recent run
   *
   * @return Sweep count, direction, and points per sweep
   */
  public SweepGeometry getGeometry() {
    return geometry;
  }

  /**
   * Get the name that the most recent run's output should be written under
   *
   * @return Output target name
   */
  public String getOutputName() {
    return outputName;
  }

  @Override
  String[] getDataStrings() {
    DecimalFormat df = DECIMAL_FORMAT.get();
    List<String> strings = new ArrayList<>();
    strings.add("Sweeps: " + geometry.getSweepCount() + " (first sweep "
        + (geometry.isSweepUp() ? "up" : "down") + ")");
    strings.add("Points per sweep: " + geometry.getPointsPerSweep());
    strings.add("Bands: " + spectrum.getBandCount());
    strings.add("Baseline: " + getParameters().getBaselineMode().getName());
    strings.add("Output points: " + spectrum.size());
    strings.add("Frequency range: " + df.format(spectrum.getMinFrequency()) + " to "
        + df.format(spectrum.getMaxFrequency()));
    return strings.toArray(new String[0]);
  }

}
