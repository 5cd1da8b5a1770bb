package asl.sweep.experiment;

import asl.sweep.input.SweepRecord;
import asl.sweep.utils.NumericUtils;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Template for a processing run over a raw sweep record. Concrete extensions define a backend
 * that does the actual calculation and loads the results into XY series collections, one per
 * chart to be drawn.
 *
 * Experiments are set up before they are run, in the manner of a builder: any settings that
 * change how the calculation is done are given first, and then "runExperimentOnData" is called
 * with the record to process. Getters for additional results (report strings, the final spectrum)
 * are only valid once a run has finished.
 */
public abstract class Experiment {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        NumericUtils.setInfinityPrintable(format);
        return format;
      });

  private final EventListenerList eventHelper;
  List<XYSeriesCollection> xySeriesData;
  /**
   * Names of the records sent into the experiment, plus the output target name where one is used
   */
  List<String> dataNames;
  private String status;

  Experiment() {
    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();
    status = "";
    eventHelper = new EventListenerList();
  }

  /**
   * Load paired x and y arrays into a new series
   *
   * @param name Name of the series
   * @param x Values along the x-axis
   * @param y Values along the y-axis, same length as x
   * @return Series holding the given points
   */
  static XYSeries toSeries(String name, double[] x, double[] y) {
    // autosort off: a stitched spectrum keeps its own sample order
    XYSeries series = new XYSeries(name, false);
    for (int i = 0; i < x.length; ++i) {
      series.add(x[i], y[i]);
    }
    return series;
  }

  /**
   * Stub method to be overridden to produce String data for the experiment result.
   *
   * @return Human-readable result strings
   */
  String[] getDataStrings() {
    return new String[]{""};
  }

  /**
   * Produce a report of the experiment's result data, one data string per line.
   *
   * @return String containing human-readable data
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    String[] strings = getDataStrings();
    for (int i = 0; i < strings.length; ++i) {
      sb.append(strings[i]);
      if (i + 1 < strings.length) {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  /**
   * Add an object to the list of objects to be notified when the experiment's status changes
   *
   * @param listener ChangeListener to be notified
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  /**
   * Remove an object from the list of objects notified of status changes
   *
   * @param listener ChangeListener to no longer be notified
   */
  public void removeChangeListener(ChangeListener listener) {
    eventHelper.remove(ChangeListener.class, listener);
  }

  /**
   * Runs the calculations specific to a given procedure.
   *
   * @param record Raw sweep record to process
   */
  protected abstract void backend(final SweepRecord record);

  /**
   * Update processing status and notify listeners of change
   *
   * @param newStatus Status change message to notify listeners of
   */
  void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Return the plottable data for this experiment, populated in the backend. Each entry in the
   * list is the data for a separate chart.
   *
   * @return Plottable data
   */
  public List<XYSeriesCollection> getData() {
    return xySeriesData;
  }

  /**
   * Get the names of data sent into the experiment (set during backend calculations)
   *
   * @return Names of input records and outputs
   */
  public List<String> getInputNames() {
    return dataNames;
  }

  /**
   * Return newest status message produced by this experiment
   *
   * @return String representing status of the run
   */
  public String getStatus() {
    return status;
  }

  /**
   * Check whether a record holds enough to run the calculation on
   *
   * @param record Record to be fed into the experiment
   * @return True if the experiment can be run
   */
  public boolean hasEnoughData(final SweepRecord record) {
    return record != null && record.hasData();
  }

  /**
   * Driver to process a record: resets the results of any earlier run, then calls the concrete
   * backend.
   *
   * @param record Raw sweep record to be processed
   */
  public void runExperimentOnData(final SweepRecord record) {
    fireStateChange("Beginning loading data...");
    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();
    backend(record);
  }

}
