package distributions;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.util.FastMath;

/**
 * Base class of the distributions over a single real (or binary) value.
 */
public abstract class ScalarDistribution implements Distribution {

    public abstract double logDensity(double x);

    public abstract double mean();

    public double density(double x) {
        return FastMath.exp(logDensity(x));
    }

    @Override
    public int getDimension() {
        return 1;
    }

    @Override
    public double logDensity(double[] x) {
        if (x.length != 1) {
            throw new DimensionMismatchException(x.length, 1);
        }
        return logDensity(x[0]);
    }

    @Override
    public double[] getMean() {
        return new double[]{mean()};
    }
}
