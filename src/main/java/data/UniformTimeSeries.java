package data;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.util.MathArrays;

/**
 * Immutable time series whose variables share one sorted time index. Alignment resamples all variables onto the
 * uniform grid from the first to the last timestamp, spaced by the median gap between timestamps, interpolating
 * linearly.
 */
public class UniformTimeSeries implements TimeSeries {

    private final double[] timeStamps;
    private final double[][] values;
    private final int dimension;

    public UniformTimeSeries(double[] timeStamps, double[][] values) {
        if (timeStamps.length != values.length) {
            throw new DimensionMismatchException(values.length, timeStamps.length);
        }
        if (timeStamps.length == 0) {
            throw new IllegalArgumentException("A time series needs at least one timestamp");
        }
        MathArrays.checkOrder(timeStamps, MathArrays.OrderDirection.INCREASING, true);
        this.dimension = values[0].length;
        this.timeStamps = MathArrays.copyOf(timeStamps);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != dimension) {
                throw new DimensionMismatchException(values[i].length, dimension);
            }
            this.values[i] = MathArrays.copyOf(values[i]);
        }
    }

    /**
     * A univariate series.
     */
    public UniformTimeSeries(double[] timeStamps, double[] values) {
        this(timeStamps, column(values));
    }

    private static double[][] column(double[] values) {
        double[][] column = new double[values.length][1];
        for (int i = 0; i < values.length; i++) {
            column[i][0] = values[i];
        }
        return column;
    }

    @Override
    public double[] getTimeStamps() {
        return MathArrays.copyOf(timeStamps);
    }

    @Override
    public double getT0() {
        return timeStamps[0];
    }

    @Override
    public double getTf() {
        return timeStamps[timeStamps.length - 1];
    }

    @Override
    public double[][] getValues() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = MathArrays.copyOf(values[i]);
        }
        return copy;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    public int size() {
        return timeStamps.length;
    }

    @Override
    public TimeSeries align() {
        if (timeStamps.length < 3 || isUniform()) {
            return this;
        }
        double step = medianGap();
        int size = (int) Math.round((getTf() - getT0()) / step) + 1;
        double[] grid = new double[size];
        double[][] resampled = new double[size][dimension];
        int right = 1;
        for (int i = 0; i < size; i++) {
            double t = i == size - 1 ? getTf() : getT0() + i * step;
            grid[i] = t;
            while (right < timeStamps.length - 1 && timeStamps[right] < t) {
                right++;
            }
            int left = right - 1;
            double span = timeStamps[right] - timeStamps[left];
            double weight = (t - timeStamps[left]) / span;
            for (int d = 0; d < dimension; d++) {
                resampled[i][d] = values[left][d] + weight * (values[right][d] - values[left][d]);
            }
        }
        return new UniformTimeSeries(grid, resampled);
    }

    private boolean isUniform() {
        double step = timeStamps[1] - timeStamps[0];
        for (int i = 2; i < timeStamps.length; i++) {
            if (Math.abs(timeStamps[i] - timeStamps[i - 1] - step) > 1e-9 * Math.max(1.0, Math.abs(step))) {
                return false;
            }
        }
        return true;
    }

    private double medianGap() {
        double[] gaps = new double[timeStamps.length - 1];
        for (int i = 1; i < timeStamps.length; i++) {
            gaps[i - 1] = timeStamps[i] - timeStamps[i - 1];
        }
        return new Median().evaluate(gaps);
    }
}
