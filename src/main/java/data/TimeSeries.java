package data;

/**
 * A multivariate series of observations indexed by timestamps (in seconds).
 */
public interface TimeSeries {

    /**
     * Timestamps of the rows of {@link #getValues()}, in increasing order.
     */
    double[] getTimeStamps();

    /**
     * First timestamp of the series.
     */
    double getT0();

    /**
     * Last timestamp of the series.
     */
    double getTf();

    /**
     * One row per timestamp, one column per variable.
     */
    double[][] getValues();

    int getDimension();

    /**
     * Resamples the series onto a uniformly spaced time grid shared by all of its variables.
     */
    TimeSeries align();
}
