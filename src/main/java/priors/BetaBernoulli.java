package priors;

import data.Observations;
import distributions.BernoulliDistribution;
import distributions.BetaDistribution;
import util.Util;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Beta-Bernoulli conjugate prior for binary data:
 * <pre>
 * X     ~ Bernoulli(theta)
 * theta ~ Beta(alpha, beta)
 * </pre>
 * Observing x_1 ... x_n adds the number of ones to alpha and the number of zeros to beta.
 */
public class BetaBernoulli extends ScalarConjugatePrior {

    private double alpha;
    private double beta;

    public BetaBernoulli() {
        super();
        this.alpha = 1;
        this.beta = 1;
    }

    public BetaBernoulli(Observations sample) {
        this();
        if (sample != null) {
            update(sample);
        }
    }

    protected BetaBernoulli(BetaBernoulli other) {
        super(other);
        this.alpha = other.alpha;
        this.beta = other.beta;
    }

    public static BetaBernoulli fromDict(Map<String, ?> state) {
        BetaBernoulli prior = new BetaBernoulli();
        prior.readDict(state);
        return prior;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    @Override
    protected void absorb(AlignedBatch batch) {
        double[] x = batch.flatten();
        for (double value : x) {
            alpha += value;
            beta += 1 - value;
        }
        n += x.length;
    }

    /**
     * The posterior of x is Bernoulli(alpha / (alpha + beta)).
     */
    @Override
    public PosteriorResult posterior(Observations x, boolean returnRv, boolean log) {
        AlignedBatch batch = process(x);
        BernoulliDistribution rv = new BernoulliDistribution(alpha / (alpha + beta));
        return PosteriorResult.evaluate(rv, batch == null ? null : batch.flatten(), returnRv, log);
    }

    /**
     * The posterior of theta is Beta(alpha, beta).
     *
     * @param theta values to evaluate at, or null for the distribution
     */
    public PosteriorResult thetaPosterior(double[] theta, boolean returnRv, boolean log) {
        BetaDistribution rv = new BetaDistribution(alpha, beta);
        return PosteriorResult.evaluate(rv, theta, returnRv, log);
    }

    @Override
    public BetaBernoulli copy() {
        return new BetaBernoulli(this);
    }

    @Override
    protected void writeState(Map<String, Object> state) {
        state.put("alpha", alpha);
        state.put("beta", beta);
    }

    @Override
    protected List<String> stateFields() {
        return Arrays.asList("alpha", "beta");
    }

    @Override
    protected void readState(Map<String, ?> state) {
        alpha = Util.toDouble(state.get("alpha"));
        beta = Util.toDouble(state.get("beta"));
    }
}
