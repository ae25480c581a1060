package distributions;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Precision;

/**
 * Eigen decomposition of a symmetric positive semi-definite matrix, restricted to the eigenvalues above a relative
 * cutoff. Gives the pseudo-determinant and Mahalanobis distances on the supported subspace, so singular shape or
 * covariance matrices can still be evaluated.
 */
class PseudoInverse {

    private static final double RELATIVE_CUTOFF = 1e6 * Precision.EPSILON;

    private final int dim;
    /** eigenvectors of the kept eigenvalues, one per row */
    private final double[][] basis;
    private final double[] eigenvalues;
    private final double logPseudoDeterminant;

    PseudoInverse(double[][] matrix) {
        dim = matrix.length;
        for (double[] row : matrix) {
            if (row.length != dim) {
                throw new DimensionMismatchException(row.length, dim);
            }
        }
        if (isZero(matrix)) {
            basis = new double[0][];
            eigenvalues = new double[0];
            logPseudoDeterminant = 0;
            return;
        }
        RealMatrix symmetric = new Array2DRowRealMatrix(matrix);
        // average out rounding asymmetry before decomposing
        symmetric = symmetric.add(symmetric.transpose()).scalarMultiply(0.5);
        EigenDecomposition decomposition = new EigenDecomposition(symmetric);
        double[] all = decomposition.getRealEigenvalues();

        double largest = 0;
        for (double value : all) {
            largest = FastMath.max(largest, FastMath.abs(value));
        }
        double cutoff = RELATIVE_CUTOFF * largest;

        int rank = 0;
        for (double value : all) {
            if (value > cutoff) {
                rank++;
            }
        }
        basis = new double[rank][];
        eigenvalues = new double[rank];
        double logDet = 0;
        int kept = 0;
        for (int i = 0; i < all.length; i++) {
            if (all[i] > cutoff) {
                basis[kept] = decomposition.getEigenvector(i).toArray();
                eigenvalues[kept] = all[i];
                logDet += FastMath.log(all[i]);
                kept++;
            }
        }
        logPseudoDeterminant = logDet;
    }

    private static boolean isZero(double[][] matrix) {
        for (double[] row : matrix) {
            for (double value : row) {
                if (value != 0) {
                    return false;
                }
            }
        }
        return true;
    }

    int getDimension() {
        return dim;
    }

    int getRank() {
        return eigenvalues.length;
    }

    double getLogPseudoDeterminant() {
        return logPseudoDeterminant;
    }

    /**
     * (x - mean)^T A^+ (x - mean)
     */
    double mahalanobis(double[] x, double[] mean) {
        if (x.length != dim) {
            throw new DimensionMismatchException(x.length, dim);
        }
        double sum = 0;
        for (int k = 0; k < eigenvalues.length; k++) {
            double projection = 0;
            for (int i = 0; i < dim; i++) {
                projection += basis[k][i] * (x[i] - mean[i]);
            }
            sum += projection * projection / eigenvalues[k];
        }
        return sum;
    }
}
