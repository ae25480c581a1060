package priors;

import data.Observations;
import distributions.InverseGammaDistribution;
import distributions.StudentTDistribution;
import org.apache.commons.math3.util.FastMath;
import util.Util;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Normal-InverseGamma conjugate prior for a scalar normal variable with unknown mean and variance
 * (Murphy 2007, "Conjugate Bayesian analysis of the Gaussian distribution"):
 * <pre>
 * X       ~ N(mu, sigma^2)
 * mu      ~ N(mu_0, sigma^2 / n)
 * sigma^2 ~ InvGamma(alpha, beta)
 * </pre>
 * For a batch x_1 ... x_m with mean xbar the update is
 * <pre>
 * alpha = alpha + m / 2
 * beta  = beta + 1/2 sum_i (x_i - xbar)^2 + 1/2 n m / (n + m) (mu_0 - xbar)^2
 * mu_0  = (n mu_0 + m xbar) / (n + m)
 * n     = n + m
 * </pre>
 */
public class NormInvGamma extends ScalarConjugatePrior {

    private double mu0;
    private double alpha;
    private double beta;

    public NormInvGamma() {
        super();
        this.mu0 = 0;
        this.alpha = 0;
        this.beta = 0;
    }

    public NormInvGamma(Observations sample) {
        this();
        if (sample != null) {
            update(sample);
        }
    }

    protected NormInvGamma(NormInvGamma other) {
        super(other);
        this.mu0 = other.mu0;
        this.alpha = other.alpha;
        this.beta = other.beta;
    }

    public static NormInvGamma fromDict(Map<String, ?> state) {
        NormInvGamma prior = new NormInvGamma();
        prior.readDict(state);
        return prior;
    }

    public double getMu0() {
        return mu0;
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
        int n0 = this.n;
        int m = x.length;

        double xbar = 0;
        for (double value : x) {
            xbar += value;
        }
        xbar /= m;
        double sampleComp = 0;
        for (double value : x) {
            sampleComp += (value - xbar) * (value - xbar);
        }
        double priorComp = (double) n0 * m / (n0 + m) * (mu0 - xbar) * (mu0 - xbar);

        alpha = alpha + m / 2.0;
        beta = beta + sampleComp / 2 + priorComp / 2;
        mu0 = mu0 * n0 / (n0 + m) + xbar * m / (n0 + m);
        n = n0 + m;
    }

    /**
     * The posterior of mu is Student-t with 2 alpha degrees of freedom, location mu_0 and squared scale
     * beta / (n alpha).
     */
    public PosteriorResult muPosterior(double[] mu, boolean returnRv, boolean log) {
        double scale = beta / (alpha * n);
        StudentTDistribution rv = new StudentTDistribution(mu0, FastMath.sqrt(scale), 2 * alpha);
        return PosteriorResult.evaluate(rv, mu, returnRv, log);
    }

    /**
     * The posterior of sigma^2 is InvGamma(alpha, beta).
     */
    public PosteriorResult sigma2Posterior(double[] sigma2, boolean returnRv, boolean log) {
        InverseGammaDistribution rv = new InverseGammaDistribution(alpha, beta);
        return PosteriorResult.evaluate(rv, sigma2, returnRv, log);
    }

    /**
     * The posterior of x is Student-t with 2 alpha degrees of freedom, location mu_0 and squared scale
     * (n + 1) beta / (n alpha).
     */
    @Override
    public PosteriorResult posterior(Observations x, boolean returnRv, boolean log) {
        AlignedBatch batch = process(x);
        double scale = beta * (n + 1) / (alpha * n);
        StudentTDistribution rv = new StudentTDistribution(mu0, FastMath.sqrt(scale), 2 * alpha);
        return PosteriorResult.evaluate(rv, batch == null ? null : batch.flatten(), returnRv, log);
    }

    @Override
    public NormInvGamma copy() {
        return new NormInvGamma(this);
    }

    @Override
    protected void writeState(Map<String, Object> state) {
        state.put("mu_0", mu0);
        state.put("alpha", alpha);
        state.put("beta", beta);
    }

    @Override
    protected List<String> stateFields() {
        return Arrays.asList("mu_0", "alpha", "beta");
    }

    @Override
    protected void readState(Map<String, ?> state) {
        mu0 = Util.toDouble(state.get("mu_0"));
        alpha = Util.toDouble(state.get("alpha"));
        beta = Util.toDouble(state.get("beta"));
    }
}
