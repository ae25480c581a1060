package distributions;

import org.apache.commons.math3.distribution.BinomialDistribution;

/**
 * Bernoulli distribution over {0, 1}. Any other value has probability zero.
 */
public class BernoulliDistribution extends ScalarDistribution {

    private final double p;
    private final BinomialDistribution binomial;

    public BernoulliDistribution(double p) {
        this.p = p;
        this.binomial = new BinomialDistribution(null, 1, p);
    }

    public double getP() {
        return p;
    }

    @Override
    public Family getFamily() {
        return Family.BERNOULLI;
    }

    @Override
    public double logDensity(double x) {
        if (x != 0 && x != 1) {
            return Double.NEGATIVE_INFINITY;
        }
        return binomial.logProbability((int) x);
    }

    @Override
    public double mean() {
        return p;
    }
}
