package data;

import org.apache.commons.math3.util.MathArrays;

/**
 * Input accepted by the conjugate priors: a single number, a sequence of numbers (one observation each), a batch with
 * one row per observation, or a {@link TimeSeries}.
 */
public final class Observations {

    private final double[][] batch;
    private final TimeSeries timeSeries;
    private final boolean scalar;

    private Observations(double[][] batch, TimeSeries timeSeries, boolean scalar) {
        this.batch = batch;
        this.timeSeries = timeSeries;
        this.scalar = scalar;
    }

    public static Observations scalar(double value) {
        return new Observations(new double[][]{{value}}, null, true);
    }

    public static Observations of(double[] values) {
        double[][] batch = new double[values.length][1];
        for (int i = 0; i < values.length; i++) {
            batch[i][0] = values[i];
        }
        return new Observations(batch, null, false);
    }

    public static Observations of(double[][] rows) {
        double[][] batch = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            batch[i] = MathArrays.copyOf(rows[i]);
        }
        return new Observations(batch, null, false);
    }

    public static Observations of(TimeSeries timeSeries) {
        return new Observations(null, timeSeries, false);
    }

    public boolean isTimeSeries() {
        return timeSeries != null;
    }

    public boolean isScalar() {
        return scalar;
    }

    public TimeSeries getTimeSeries() {
        return timeSeries;
    }

    /**
     * The observations as rows. Only for bare numeric input.
     */
    public double[][] getBatch() {
        if (batch == null) {
            throw new IllegalStateException("Observations backed by a time series have no bare batch");
        }
        return batch;
    }

    public int size() {
        return batch != null ? batch.length : timeSeries.getValues().length;
    }
}
