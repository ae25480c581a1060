package util;

import org.apache.commons.math3.util.FastMath;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;

import java.util.ArrayList;
import java.util.List;

/**
 * Matrix helpers shared by the conjugate priors.
 */
@SuppressWarnings("WeakerAccess")
public class Util {

    /**
     * Moore-Penrose pseudo-inverse of A. Used in place of a plain inverse everywhere, so that rank deficient design or
     * precision matrices (e.g. after a single observation) still give an answer.
     */
    public static DenseMatrix64F pinv(DenseMatrix64F A) {
        DenseMatrix64F inverse = new DenseMatrix64F(A.numCols, A.numRows);
        // the SVD based pinv divides by a zero singular value here; the pseudo-inverse of 0 is 0
        if (isZero(A))
            return inverse;
        CommonOps.pinv(A, inverse);
        return inverse;
    }

    public static boolean isZero(DenseMatrix64F A) {
        for (int i = 0; i < A.getNumElements(); i++)
            if (A.get(i) != 0)
                return false;
        return true;
    }

    /**
     * log |det(A)|; -Infinity for a singular matrix.
     */
    public static double logAbsDet(DenseMatrix64F A) {
        return FastMath.log(FastMath.abs(CommonOps.det(A)));
    }

    /**
     * w^T A w for a column vector w. With a matrix w (one column per output) this is the trace of w^T A w.
     */
    public static double quadraticForm(DenseMatrix64F w, DenseMatrix64F A) {
        DenseMatrix64F Aw = new DenseMatrix64F(A.numRows, w.numCols);
        CommonOps.mult(A, w, Aw);
        double sum = 0;
        for (int i = 0; i < w.getNumElements(); i++) {
            sum += w.get(i) * Aw.get(i);
        }
        return sum;
    }

    /**
     * mean of the rows of data, as a column vector
     */
    public static DenseMatrix64F getSampleMean(DenseMatrix64F data) {
        DenseMatrix64F mean = new DenseMatrix64F(data.numCols, 1);//initialized to 0
        for (int i = 0; i < data.numRows; i++)
            for (int j = 0; j < data.numCols; j++)
                mean.set(j, 0, mean.get(j, 0) + data.get(i, j));
        CommonOps.scale(1.0 / data.numRows, mean);
        return mean;
    }

    /**
     * Scatter matrix sum_i (x_i - mean)(x_i - mean)^T of the rows of data, i.e. the sample covariance times the
     * number of rows.
     *
     * @param mean mean of the data; can be calculated by calling getSampleMean (see above)
     */
    public static DenseMatrix64F getScatter(DenseMatrix64F data, DenseMatrix64F mean) {
        DenseMatrix64F centered = new DenseMatrix64F(data.numRows, data.numCols);
        for (int i = 0; i < data.numRows; i++)
            for (int j = 0; j < data.numCols; j++)
                centered.set(i, j, data.get(i, j) - mean.get(j, 0));
        DenseMatrix64F scatter = new DenseMatrix64F(data.numCols, data.numCols);
        CommonOps.multTransA(centered, centered, scatter);
        return scatter;
    }

    /**
     * The n x 2 design matrix with rows (t_i, 1).
     */
    public static DenseMatrix64F designMatrix(double[] t) {
        DenseMatrix64F design = new DenseMatrix64F(t.length, 2);
        for (int i = 0; i < t.length; i++) {
            design.set(i, 0, t[i]);
            design.set(i, 1, 1.0);
        }
        return design;
    }

    public static DenseMatrix64F columnVector(double[] values) {
        DenseMatrix64F vector = new DenseMatrix64F(values.length, 1);
        for (int i = 0; i < values.length; i++)
            vector.set(i, 0, values[i]);
        return vector;
    }

    public static double[][] toArray(DenseMatrix64F A) {
        double[][] array = new double[A.numRows][A.numCols];
        for (int i = 0; i < A.numRows; i++)
            for (int j = 0; j < A.numCols; j++)
                array[i][j] = A.get(i, j);
        return array;
    }

    /**
     * Entries of A stacked column by column (vec(A)).
     */
    public static double[] vec(DenseMatrix64F A) {
        double[] stacked = new double[A.getNumElements()];
        int k = 0;
        for (int j = 0; j < A.numCols; j++)
            for (int i = 0; i < A.numRows; i++)
                stacked[k++] = A.get(i, j);
        return stacked;
    }

    /**
     * Kronecker product A (x) B.
     */
    public static DenseMatrix64F kron(DenseMatrix64F A, DenseMatrix64F B) {
        DenseMatrix64F product = new DenseMatrix64F(A.numRows * B.numRows, A.numCols * B.numCols);
        for (int i = 0; i < A.numRows; i++)
            for (int j = 0; j < A.numCols; j++)
                for (int k = 0; k < B.numRows; k++)
                    for (int l = 0; l < B.numCols; l++)
                        product.set(i * B.numRows + k, j * B.numCols + l, A.get(i, j) * B.get(k, l));
        return product;
    }

    /**
     * (A + A^T) / 2, removing the rounding asymmetry that accumulates in sums of outer products.
     */
    public static DenseMatrix64F symmetrize(DenseMatrix64F A) {
        DenseMatrix64F symmetric = new DenseMatrix64F(A.numRows, A.numCols);
        CommonOps.transpose(A, symmetric);
        CommonOps.addEquals(symmetric, A);
        CommonOps.scale(0.5, symmetric);
        return symmetric;
    }

    /* state (de)serialization: matrices become plain nested lists of doubles */

    public static List<Double> toList(DenseMatrix64F vector) {
        if (vector == null)
            return null;
        List<Double> list = new ArrayList<>(vector.getNumElements());
        for (int i = 0; i < vector.getNumElements(); i++)
            list.add(vector.get(i));
        return list;
    }

    public static List<List<Double>> toNestedList(DenseMatrix64F matrix) {
        if (matrix == null)
            return null;
        List<List<Double>> rows = new ArrayList<>(matrix.numRows);
        for (int i = 0; i < matrix.numRows; i++) {
            List<Double> row = new ArrayList<>(matrix.numCols);
            for (int j = 0; j < matrix.numCols; j++)
                row.add(matrix.get(i, j));
            rows.add(row);
        }
        return rows;
    }

    /**
     * Reads a list of numbers back into a column vector.
     */
    public static DenseMatrix64F toVector(Object value) {
        if (value == null)
            return null;
        List<?> list = asList(value);
        DenseMatrix64F vector = new DenseMatrix64F(list.size(), 1);
        for (int i = 0; i < list.size(); i++)
            vector.set(i, 0, toDouble(list.get(i)));
        return vector;
    }

    /**
     * Reads a list of rows back into a matrix.
     */
    public static DenseMatrix64F toMatrix(Object value) {
        if (value == null)
            return null;
        List<?> rows = asList(value);
        int numCols = rows.isEmpty() ? 0 : asList(rows.get(0)).size();
        DenseMatrix64F matrix = new DenseMatrix64F(rows.size(), numCols);
        for (int i = 0; i < rows.size(); i++) {
            List<?> row = asList(rows.get(i));
            if (row.size() != numCols)
                throw new IllegalArgumentException("Ragged matrix: row " + i + " has " + row.size() + " entries, expected " + numCols);
            for (int j = 0; j < numCols; j++)
                matrix.set(i, j, toDouble(row.get(j)));
        }
        return matrix;
    }

    public static double toDouble(Object value) {
        if (value instanceof Number)
            return ((Number) value).doubleValue();
        if (value instanceof String)
            return Double.parseDouble((String) value);
        throw new IllegalArgumentException("Expected a number but got " + value);
    }

    public static Integer toInteger(Object value) {
        if (value == null)
            return null;
        double number = toDouble(value);
        if (number != Math.rint(number))
            throw new IllegalArgumentException("Expected an integer but got " + value);
        return (int) number;
    }

    public static Double toNullableDouble(Object value) {
        return value == null ? null : toDouble(value);
    }

    private static List<?> asList(Object value) {
        if (!(value instanceof List))
            throw new IllegalArgumentException("Expected a list but got " + value);
        return (List<?>) value;
    }
}
