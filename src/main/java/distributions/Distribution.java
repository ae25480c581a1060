package distributions;

import org.apache.commons.math3.util.FastMath;

/**
 * A posterior distribution handed out by a conjugate prior. Instances are immutable and evaluated analytically.
 * Points are passed as flat arrays: a length-1 array for scalar families, a vector for multivariate families and a
 * row-major flattened matrix for matrix-valued families.
 */
public interface Distribution {

    enum Family {
        BERNOULLI,
        BETA,
        INVERSE_GAMMA,
        STUDENT_T,
        MULTIVARIATE_T,
        INVERSE_WISHART,
        MULTIVARIATE_NORMAL
    }

    Family getFamily();

    /**
     * Number of entries of a point of this distribution.
     */
    int getDimension();

    double logDensity(double[] x);

    default double density(double[] x) {
        return FastMath.exp(logDensity(x));
    }

    double[] getMean();
}
