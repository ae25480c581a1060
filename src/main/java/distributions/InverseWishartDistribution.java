package distributions;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.MathArrays;
import org.apache.commons.math3.util.Precision;

/**
 * Inverse-Wishart distribution over p x p covariance matrices, with degrees of freedom nu and scale matrix Psi:
 * <pre>
 * log p(X) = nu/2 log|Psi| - nu p/2 log 2 - log Gamma_p(nu/2) - (nu + p + 1)/2 log|X| - 1/2 tr(Psi X^-1)
 * </pre>
 * Points are p x p matrices flattened row by row. Matrices that are not positive definite have density zero.
 */
public class InverseWishartDistribution implements Distribution {

    private final double degreesOfFreedom;
    private final double[][] scale;
    private final double logScaleDeterminant;

    public InverseWishartDistribution(double degreesOfFreedom, double[][] scale) {
        for (double[] row : scale) {
            if (row.length != scale.length) {
                throw new DimensionMismatchException(row.length, scale.length);
            }
        }
        this.degreesOfFreedom = degreesOfFreedom;
        this.scale = new double[scale.length][];
        for (int i = 0; i < scale.length; i++) {
            this.scale[i] = MathArrays.copyOf(scale[i]);
        }
        this.logScaleDeterminant = new PseudoInverse(this.scale).getLogPseudoDeterminant();
    }

    public double getDegreesOfFreedom() {
        return degreesOfFreedom;
    }

    public double[][] getScale() {
        double[][] copy = new double[scale.length][];
        for (int i = 0; i < scale.length; i++) {
            copy[i] = MathArrays.copyOf(scale[i]);
        }
        return copy;
    }

    /**
     * Order of the matrices this distribution is defined over.
     */
    public int getOrder() {
        return scale.length;
    }

    @Override
    public Family getFamily() {
        return Family.INVERSE_WISHART;
    }

    @Override
    public int getDimension() {
        return scale.length * scale.length;
    }

    @Override
    public double logDensity(double[] x) {
        int p = scale.length;
        if (x.length != p * p) {
            throw new DimensionMismatchException(x.length, p * p);
        }
        double[][] matrix = new double[p][p];
        for (int i = 0; i < p; i++) {
            System.arraycopy(x, i * p, matrix[i], 0, p);
        }
        return logDensity(matrix);
    }

    public double logDensity(double[][] x) {
        int p = scale.length;
        if (x.length != p) {
            throw new DimensionMismatchException(x.length, p);
        }
        RealMatrix matrix = new Array2DRowRealMatrix(x);
        if (matrix.getFrobeniusNorm() == 0) {
            return Double.NEGATIVE_INFINITY;
        }
        matrix = matrix.add(matrix.transpose()).scalarMultiply(0.5);
        EigenDecomposition decomposition = new EigenDecomposition(matrix);
        double[] eigenvalues = decomposition.getRealEigenvalues();
        double largest = 0.0;
        for (double eigenvalue : eigenvalues) {
            largest = FastMath.max(largest, FastMath.abs(eigenvalue));
        }
        double logDet = 0.0;
        for (double eigenvalue : eigenvalues) {
            // singular to working precision, outside the support
            if (eigenvalue <= Precision.EPSILON * largest) {
                return Double.NEGATIVE_INFINITY;
            }
            logDet += FastMath.log(eigenvalue);
        }
        RealMatrix product = new Array2DRowRealMatrix(scale).multiply(decomposition.getSolver().getInverse());
        double nu = degreesOfFreedom;
        return nu / 2 * logScaleDeterminant
                - nu * p / 2 * FastMath.log(2)
                - logMultivariateGamma(nu / 2, p)
                - (nu + p + 1) / 2 * logDet
                - 0.5 * product.getTrace();
    }

    public double density(double[][] x) {
        return FastMath.exp(logDensity(x));
    }

    /**
     * Psi / (nu - p - 1), or NaNs when nu <= p + 1 and the mean does not exist.
     */
    public double[][] getMeanMatrix() {
        int p = scale.length;
        double divisor = degreesOfFreedom - p - 1;
        double[][] mean = new double[p][p];
        for (int i = 0; i < p; i++) {
            for (int j = 0; j < p; j++) {
                mean[i][j] = divisor > 0 ? scale[i][j] / divisor : Double.NaN;
            }
        }
        return mean;
    }

    /**
     * Psi / (nu + p + 1)
     */
    public double[][] getModeMatrix() {
        int p = scale.length;
        double[][] mode = new double[p][p];
        for (int i = 0; i < p; i++) {
            for (int j = 0; j < p; j++) {
                mode[i][j] = scale[i][j] / (degreesOfFreedom + p + 1);
            }
        }
        return mode;
    }

    @Override
    public double[] getMean() {
        int p = scale.length;
        double[][] mean = getMeanMatrix();
        double[] flat = new double[p * p];
        for (int i = 0; i < p; i++) {
            System.arraycopy(mean[i], 0, flat, i * p, p);
        }
        return flat;
    }

    static double logMultivariateGamma(double a, int p) {
        double sum = p * (p - 1) / 4.0 * FastMath.log(FastMath.PI);
        for (int j = 1; j <= p; j++) {
            sum += Gamma.logGamma(a + (1 - j) / 2.0);
        }
        return sum;
    }
}
