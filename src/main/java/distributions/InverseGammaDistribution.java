package distributions;

import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.FastMath;

/**
 * Inverse-Gamma distribution with shape alpha and scale beta:
 * p(x) = beta^alpha / Gamma(alpha) * x^(-alpha - 1) * exp(-beta / x)
 */
public class InverseGammaDistribution extends ScalarDistribution {

    private final double alpha;
    private final double beta;

    public InverseGammaDistribution(double alpha, double beta) {
        this.alpha = alpha;
        this.beta = beta;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    @Override
    public Family getFamily() {
        return Family.INVERSE_GAMMA;
    }

    @Override
    public double logDensity(double x) {
        if (x <= 0) {
            return Double.NEGATIVE_INFINITY;
        }
        return alpha * FastMath.log(beta) - Gamma.logGamma(alpha) - (alpha + 1) * FastMath.log(x) - beta / x;
    }

    /**
     * Infinite when alpha <= 1.
     */
    @Override
    public double mean() {
        if (alpha <= 1) {
            return Double.POSITIVE_INFINITY;
        }
        return beta / (alpha - 1);
    }

    public double mode() {
        return beta / (alpha + 1);
    }
}
