package distributions;

/**
 * Beta(alpha, beta) over the unit interval, backed by the commons-math implementation.
 */
public class BetaDistribution extends ScalarDistribution {

    private final double alpha;
    private final double beta;
    private final org.apache.commons.math3.distribution.BetaDistribution delegate;

    public BetaDistribution(double alpha, double beta) {
        this.alpha = alpha;
        this.beta = beta;
        this.delegate = new org.apache.commons.math3.distribution.BetaDistribution(null, alpha, beta);
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    @Override
    public Family getFamily() {
        return Family.BETA;
    }

    @Override
    public double logDensity(double x) {
        if (x < 0 || x > 1) {
            return Double.NEGATIVE_INFINITY;
        }
        return delegate.logDensity(x);
    }

    @Override
    public double mean() {
        return delegate.getNumericalMean();
    }
}
