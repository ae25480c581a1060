package priors;

import data.Observations;
import data.TimeSeries;
import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * Turns {@link Observations} into an {@link AlignedBatch} relative to the time anchor of a prior, fixing the anchor
 * and the dimension of the prior on first use.
 */
final class ObservationPreprocessor {

    private ObservationPreprocessor() {
    }

    /**
     * @return the aligned batch, or null when {@code x} is null
     * @throws DimensionMismatchException if the number of columns differs from the dimension already fixed for the
     *                                    prior; the prior is left untouched in that case
     */
    static AlignedBatch process(ConjugatePrior prior, Observations x) {
        if (x == null) {
            return null;
        }
        if (x.isTimeSeries()) {
            TimeSeries aligned = x.getTimeSeries().align();
            double[][] values = aligned.getValues();
            checkDimension(prior, values, aligned.getDimension());
            if (!prior.isAnchored()) {
                double t0 = aligned.getT0();
                double tf = aligned.getTf();
                prior.anchor(t0, tf != t0 ? tf - t0 : 1);
            }
            double[] stamps = aligned.getTimeStamps();
            double[] t = new double[stamps.length];
            for (int i = 0; i < stamps.length; i++) {
                t[i] = (stamps[i] - prior.getT0()) / prior.getDt();
            }
            prior.fixDimension(aligned.getDimension());
            return new AlignedBatch(t, values);
        }

        double[][] values = x.getBatch();
        if (values.length == 0) {
            return new AlignedBatch(new double[0], values);
        }
        int columns = values[0].length;
        checkDimension(prior, values, columns);
        if (!prior.isAnchored()) {
            prior.anchor(0, x.isScalar() ? 1 : values.length);
        }
        double[] t = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            t[i] = (prior.getN() + i - prior.getT0()) / prior.getDt();
        }
        prior.fixDimension(columns);
        return new AlignedBatch(t, values);
    }

    private static void checkDimension(ConjugatePrior prior, double[][] values, int columns) {
        Integer dim = prior.getDim();
        if (dim != null && dim != columns) {
            throw new DimensionMismatchException(columns, dim);
        }
        for (double[] row : values) {
            if (row.length != columns) {
                throw new DimensionMismatchException(row.length, columns);
            }
        }
    }
}
