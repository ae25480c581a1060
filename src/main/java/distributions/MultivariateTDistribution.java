package distributions;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.MathArrays;

import java.util.Arrays;

/**
 * Multivariate Student-t distribution with location, shape matrix and degrees of freedom. Like
 * {@link MultivariateNormalDistribution}, a singular shape matrix is handled on its supported subspace.
 */
public class MultivariateTDistribution implements Distribution {

    private final double[] location;
    private final double[][] shape;
    private final double degreesOfFreedom;
    private final PseudoInverse shapeInverse;

    public MultivariateTDistribution(double[] location, double[][] shape, double degreesOfFreedom) {
        if (shape.length != location.length) {
            throw new DimensionMismatchException(shape.length, location.length);
        }
        this.location = MathArrays.copyOf(location);
        this.shape = new double[shape.length][];
        for (int i = 0; i < shape.length; i++) {
            this.shape[i] = MathArrays.copyOf(shape[i]);
        }
        this.degreesOfFreedom = degreesOfFreedom;
        this.shapeInverse = new PseudoInverse(this.shape);
    }

    public double[] getLocation() {
        return MathArrays.copyOf(location);
    }

    public double[][] getShape() {
        double[][] copy = new double[shape.length][];
        for (int i = 0; i < shape.length; i++) {
            copy[i] = MathArrays.copyOf(shape[i]);
        }
        return copy;
    }

    public double getDegreesOfFreedom() {
        return degreesOfFreedom;
    }

    @Override
    public Family getFamily() {
        return Family.MULTIVARIATE_T;
    }

    @Override
    public int getDimension() {
        return location.length;
    }

    @Override
    public double logDensity(double[] x) {
        if (x.length != location.length) {
            throw new DimensionMismatchException(x.length, location.length);
        }
        double nu = degreesOfFreedom;
        int rank = shapeInverse.getRank();
        double val = shapeInverse.mahalanobis(x, location);
        return Gamma.logGamma((nu + rank) / 2) - Gamma.logGamma(nu / 2)
                - rank / 2.0 * (FastMath.log(nu) + FastMath.log(FastMath.PI))
                - 0.5 * shapeInverse.getLogPseudoDeterminant()
                - (nu + rank) / 2 * FastMath.log1p(val / nu);
    }

    /**
     * The location, or NaNs for degrees of freedom <= 1.
     */
    @Override
    public double[] getMean() {
        double[] mean = MathArrays.copyOf(location);
        if (degreesOfFreedom <= 1) {
            Arrays.fill(mean, Double.NaN);
        }
        return mean;
    }
}
