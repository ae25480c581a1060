package priors;

import data.Observations;
import distributions.InverseGammaDistribution;
import distributions.MultivariateNormalDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.FastMath;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.Util;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Bayesian linear regression of a scalar observation on time:
 * <pre>
 * x(t)    ~ N(m t + b, sigma^2)
 * w       ~ N((m_0, b_0), sigma^2 Lambda_0^-1)
 * sigma^2 ~ InvGamma(alpha, beta)
 * </pre>
 * With T the m x 2 matrix of rows (t_i, 1) and x the new observations, the update is
 * <pre>
 * w_OLS    = T^+ x
 * Lambda_n = Lambda_0 + T^T T
 * w_n      = Lambda_n^+ (Lambda_0 w_0 + T^T T w_OLS)
 * alpha_n  = alpha_0 + m / 2
 * beta_n   = beta_0 + 1/2 (x^T x + w_0^T Lambda_0 w_0 - w_n^T Lambda_n w_n)
 * </pre>
 * Pseudo-inverses keep the update defined for rank deficient batches, e.g. a single point.
 */
public class BayesianLinReg extends ScalarConjugatePrior {
    private static final Logger logger = LoggerFactory.getLogger(BayesianLinReg.class);

    /**
     * (slope, intercept) as a 2 x 1 column vector.
     */
    private DenseMatrix64F w0;
    private DenseMatrix64F lambda0;
    private double alpha;
    private double beta;

    public BayesianLinReg() {
        super();
        this.w0 = new DenseMatrix64F(2, 1);
        this.lambda0 = new DenseMatrix64F(2, 2);
        this.alpha = 0;
        this.beta = 0;
    }

    public BayesianLinReg(Observations sample) {
        this();
        if (sample != null) {
            update(sample);
        }
    }

    protected BayesianLinReg(BayesianLinReg other) {
        super(other);
        this.w0 = other.w0.copy();
        this.lambda0 = other.lambda0.copy();
        this.alpha = other.alpha;
        this.beta = other.beta;
    }

    public static BayesianLinReg fromDict(Map<String, ?> state) {
        BayesianLinReg prior = new BayesianLinReg();
        prior.readDict(state);
        return prior;
    }

    /**
     * (slope, intercept), with time in units of the anchor's dt.
     */
    public double[] getW0() {
        return w0.getData().clone();
    }

    public double[][] getLambda0() {
        return Util.toArray(lambda0);
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    @Override
    protected void absorb(AlignedBatch batch) {
        DenseMatrix64F t = Util.designMatrix(batch.getTimes());
        DenseMatrix64F x = Util.columnVector(batch.flatten());

        // Initial prediction
        double pred0 = Util.quadraticForm(w0, lambda0);

        // Update predictive coefficients & uncertainty
        DenseMatrix64F design = new DenseMatrix64F(2, 2);
        CommonOps.multTransA(t, t, design);
        DenseMatrix64F ols = new DenseMatrix64F(2, 1);
        CommonOps.mult(Util.pinv(t), x, ols);

        DenseMatrix64F newLambda = new DenseMatrix64F(2, 2);
        CommonOps.add(lambda0, design, newLambda);
        DenseMatrix64F rhs = new DenseMatrix64F(2, 1);
        CommonOps.mult(lambda0, w0, rhs);
        CommonOps.multAdd(design, ols, rhs);
        DenseMatrix64F newW = new DenseMatrix64F(2, 1);
        CommonOps.mult(Util.pinv(newLambda), rhs, newW);
        w0 = newW;
        lambda0 = newLambda;

        // Updated prediction
        double pred = Util.quadraticForm(w0, lambda0);

        double xx = 0;
        for (int i = 0; i < x.numRows; i++) {
            xx += x.get(i, 0) * x.get(i, 0);
        }
        n = n + x.numRows;
        alpha = alpha + x.numRows / 2.0;
        beta = beta + (xx + pred0 - pred) / 2;
        if (beta < 0) {
            logger.warn("Negative beta {} after absorbing {} observations, the batch is numerically degenerate", beta, x.numRows);
        }
    }

    /**
     * Predictive posterior computed as a ratio of marginal likelihoods. With Lambda_n, alpha_n, beta_n the values after
     * updating on the queried point,
     * <pre>
     * p(x | t) = (2 pi)^(-1/2) sqrt(det Lambda_0 / det Lambda_n) beta_0^alpha_0 / beta_n^alpha_n
     *            Gamma(alpha_n) / Gamma(alpha_0)
     * </pre>
     * evaluated in log space. Observations of a batch are scored one after another, each conditioned on the ones
     * before it, so the log densities of a batch sum to its joint log marginal likelihood. On an empty prior the first
     * point scores +Infinity: one point fits a line exactly, beta_n stays 0 and its marginal likelihood is improper.
     * The points right after it can then score NaN.
     *
     * @throws UnsupportedOperationException if x is null or returnRv is set; this prior has no closed form
     *                                       distribution object for x
     */
    @Override
    public PosteriorResult posterior(Observations x, boolean returnRv, boolean log) {
        return posterior(x, returnRv, log, false);
    }

    /**
     * As {@link #posterior(Observations, boolean, boolean)}; the updated prior is the copy that scored the last point.
     */
    @Override
    public PosteriorResult posterior(Observations x, boolean returnRv, boolean log, boolean returnUpdated) {
        if (x == null || returnRv) {
            throw new UnsupportedOperationException("Bayesian linear regression doesn't have a random variable posterior. "
                    + "Please specify a non-null value of x and set returnRv = false.");
        }
        AlignedBatch batch = process(x);
        double[] result = new double[batch.size()];
        BayesianLinReg current = this;
        for (int i = 0; i < batch.size(); i++) {
            BayesianLinReg updated = current.copy();
            updated.absorb(batch.row(i));
            double logp = logMarginalRatio(current, updated);
            result[i] = log ? logp : FastMath.exp(logp);
            current = updated;
        }
        PosteriorResult posterior = PosteriorResult.ofDensities(result);
        if (!returnUpdated) {
            return posterior;
        }
        return posterior.withUpdated(current == this ? copy() : current);
    }

    /**
     * log of the marginal likelihood of one observation, as the ratio between the normalizers before and after
     * absorbing it. An empty prior contributes no normalizer.
     */
    private static double logMarginalRatio(BayesianLinReg before, BayesianLinReg after) {
        double a = -(after.n - before.n) / 2.0 * FastMath.log(2 * FastMath.PI);
        double b = -Util.logAbsDet(after.lambda0) / 2;
        double c = -after.alpha * FastMath.log(after.beta);
        double d = Gamma.logGamma(after.alpha);
        if (before.n > 0) {
            b += Util.logAbsDet(before.lambda0) / 2;
            c += before.alpha * FastMath.log(before.beta);
            d -= Gamma.logGamma(before.alpha);
        }
        return a + b + c + d;
    }

    /**
     * Naive computation of the posterior with Bayes' rule, plugging in point estimates
     * sigma2_hat = E[sigma^2] and w_hat = E[w | sigma^2 = sigma2_hat]:
     * <pre>
     * p(x | t) = p(w_hat, sigma2_hat) p(x | t, w_hat, sigma2_hat) / p(w_hat, sigma2_hat | x, t)
     * </pre>
     * Agrees with {@link #posterior(Observations, boolean, boolean)} once Lambda_0 has full rank. When E[sigma^2] does
     * not exist (alpha <= 1) the mode of sigma^2 is used instead.
     */
    public double[] naivePosterior(Observations x, boolean log) {
        AlignedBatch batch = process(x);
        double[] result = new double[batch.size()];
        BayesianLinReg current = this;
        for (int i = 0; i < batch.size(); i++) {
            AlignedBatch point = batch.row(i);
            BayesianLinReg updated = current.copy();
            updated.absorb(point);
            double logp = current.naiveLogDensity(updated, point.getTimes()[0], point.getValues()[0][0]);
            result[i] = log ? logp : FastMath.exp(logp);
            current = updated;
        }
        return result;
    }

    public double[] naivePosterior(double[] x, boolean log) {
        return naivePosterior(Observations.of(x), log);
    }

    private double naiveLogDensity(BayesianLinReg updated, double t, double x) {
        // Get priors & point estimates for sigma^2 and w; get the point estimate for x(t)
        InverseGammaDistribution priorSigma2 = new InverseGammaDistribution(alpha, beta);
        double sigma2Hat = alpha > 1 ? priorSigma2.mean() : priorSigma2.mode();
        double[] wHat = w0.getData().clone();
        MultivariateNormalDistribution priorW = weightDistribution(w0, lambda0, sigma2Hat);
        double xHat = t * wHat[0] + wHat[1];

        // Get posteriors
        InverseGammaDistribution postSigma2 = new InverseGammaDistribution(updated.alpha, updated.beta);
        MultivariateNormalDistribution postW = weightDistribution(updated.w0, updated.lambda0, sigma2Hat);

        // Apply Bayes' rule
        double evidence;
        if (sigma2Hat > 0) {
            evidence = new NormalDistribution(null, xHat, FastMath.sqrt(sigma2Hat)).logDensity(x);
        } else {
            // point mass at xHat
            evidence = x == xHat ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        }
        double prior = priorSigma2.logDensity(sigma2Hat) + priorW.logDensity(wHat);
        double post = postSigma2.logDensity(sigma2Hat) + postW.logDensity(wHat);
        return evidence + prior - post;
    }

    private static MultivariateNormalDistribution weightDistribution(DenseMatrix64F w, DenseMatrix64F lambda, double sigma2) {
        DenseMatrix64F covariance = Util.symmetrize(Util.pinv(lambda));
        CommonOps.scale(sigma2, covariance);
        return new MultivariateNormalDistribution(w.getData().clone(), Util.toArray(covariance));
    }

    @Override
    public BayesianLinReg copy() {
        return new BayesianLinReg(this);
    }

    @Override
    protected void writeState(Map<String, Object> state) {
        state.put("w_0", Util.toList(w0));
        state.put("Lambda_0", Util.toNestedList(lambda0));
        state.put("alpha", alpha);
        state.put("beta", beta);
    }

    @Override
    protected List<String> stateFields() {
        return Arrays.asList("w_0", "Lambda_0", "alpha", "beta");
    }

    @Override
    protected void readState(Map<String, ?> state) {
        w0 = Util.toVector(state.get("w_0"));
        lambda0 = Util.toMatrix(state.get("Lambda_0"));
        alpha = Util.toDouble(state.get("alpha"));
        beta = Util.toDouble(state.get("beta"));
        if (w0 == null || lambda0 == null) {
            throw new IllegalArgumentException("Fields 'w_0' and 'Lambda_0' of " + getName() + " cannot be null");
        }
    }
}
