package distributions;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.MathArrays;

/**
 * Multivariate normal distribution that tolerates a singular covariance matrix: the density is taken with respect to
 * the subspace spanned by the covariance, using its pseudo-inverse and pseudo-determinant.
 */
public class MultivariateNormalDistribution implements Distribution {
    /** Vector of means. */
    private final double[] means;
    private final double[][] covariances;
    private final PseudoInverse covarianceInverse;

    public MultivariateNormalDistribution(final double[] means, final double[][] covariances)
            throws DimensionMismatchException {
        final int dim = means.length;

        if (covariances.length != dim) {
            throw new DimensionMismatchException(covariances.length, dim);
        }

        this.means = MathArrays.copyOf(means);
        this.covariances = new double[dim][];
        for (int i = 0; i < dim; i++) {
            this.covariances[i] = MathArrays.copyOf(covariances[i]);
        }
        covarianceInverse = new PseudoInverse(this.covariances);
    }

    @Override
    public Family getFamily() {
        return Family.MULTIVARIATE_NORMAL;
    }

    @Override
    public int getDimension() {
        return means.length;
    }

    @Override
    public double logDensity(double[] x) {
        if (x.length != means.length) {
            throw new DimensionMismatchException(x.length, means.length);
        }
        int rank = covarianceInverse.getRank();
        return -0.5 * (rank * FastMath.log(2 * FastMath.PI)
                + covarianceInverse.getLogPseudoDeterminant()
                + covarianceInverse.mahalanobis(x, means));
    }

    @Override
    public double[] getMean() {
        return MathArrays.copyOf(means);
    }

    public double[][] getCovariances() {
        double[][] copy = new double[covariances.length][];
        for (int i = 0; i < covariances.length; i++) {
            copy[i] = MathArrays.copyOf(covariances[i]);
        }
        return copy;
    }
}
