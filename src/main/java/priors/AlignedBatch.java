package priors;

import org.ejml.data.DenseMatrix64F;

/**
 * A preprocessed batch: normalized time positions {@code t} and the observation matrix {@code x}, one row per
 * observation.
 */
public final class AlignedBatch {

    private final double[] t;
    private final double[][] x;

    AlignedBatch(double[] t, double[][] x) {
        this.t = t;
        this.x = x;
    }

    public double[] getTimes() {
        return t;
    }

    public double[][] getValues() {
        return x;
    }

    public int size() {
        return t.length;
    }

    public boolean isEmpty() {
        return t.length == 0;
    }

    /**
     * The values flattened to one number per observation, for one-dimensional priors.
     */
    public double[] flatten() {
        double[] flat = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            flat[i] = x[i][0];
        }
        return flat;
    }

    public DenseMatrix64F toMatrix() {
        if (x.length == 0) {
            return new DenseMatrix64F(0, 0);
        }
        return new DenseMatrix64F(x);
    }

    /**
     * The single-observation batch at row i.
     */
    public AlignedBatch row(int i) {
        return new AlignedBatch(new double[]{t[i]}, new double[][]{x[i]});
    }
}
