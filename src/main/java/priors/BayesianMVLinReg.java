package priors;

import data.Observations;
import distributions.InverseWishartDistribution;
import distributions.MultivariateNormalDistribution;
import org.apache.commons.math3.util.FastMath;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import util.Util;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Bayesian multivariate linear regression of a d-dimensional observation on time (Geisser 1965):
 * <pre>
 * X(t)   ~ N_d(m t + b, Sigma)
 * (m, b) ~ N_2d((m_0, b_0), Sigma (x) Lambda_0^-1)
 * Sigma  ~ InvWishart_nu(V_0)
 * </pre>
 * With T the m x 2 matrix of rows (t_i, 1), X the m x d observations and W = [m, b]^T the 2 x d weights:
 * <pre>
 * nu_n     = nu_0 + m
 * W_n      = (Lambda_0 + T^T T)^+ (Lambda_0 W_0 + T^T X)
 * V_n      = V_0 + (X - T W_n)^T (X - T W_n) + (W_n - W_0)^T Lambda_0 (W_n - W_0)
 * Lambda_n = Lambda_0 + T^T T
 * </pre>
 */
public class BayesianMVLinReg extends ConjugatePrior {

    private double nu;
    /**
     * 2 x d weights, first row slopes, second row intercepts.
     */
    private DenseMatrix64F w0;
    private DenseMatrix64F lambda0;
    /**
     * d x d scale matrix of the Inverse-Wishart.
     */
    private DenseMatrix64F v0;

    public BayesianMVLinReg() {
        super();
        this.nu = 0;
        this.lambda0 = new DenseMatrix64F(2, 2);
    }

    public BayesianMVLinReg(Observations sample) {
        this();
        if (sample != null) {
            update(sample);
        }
    }

    protected BayesianMVLinReg(BayesianMVLinReg other) {
        super(other);
        this.nu = other.nu;
        this.w0 = other.w0 == null ? null : other.w0.copy();
        this.lambda0 = other.lambda0.copy();
        this.v0 = other.v0 == null ? null : other.v0.copy();
    }

    public static BayesianMVLinReg fromDict(Map<String, ?> state) {
        BayesianMVLinReg prior = new BayesianMVLinReg();
        prior.readDict(state);
        return prior;
    }

    public double getNu() {
        return nu;
    }

    public double[][] getW0() {
        return w0 == null ? null : Util.toArray(w0);
    }

    public double[][] getLambda0() {
        return Util.toArray(lambda0);
    }

    public double[][] getV0() {
        return v0 == null ? null : Util.toArray(v0);
    }

    @Override
    protected void absorb(AlignedBatch batch) {
        DenseMatrix64F x = batch.toMatrix();
        int m = x.numRows;
        int d = x.numCols;
        if (v0 == null) {
            v0 = new DenseMatrix64F(d, d);
        }
        if (w0 == null) {
            w0 = new DenseMatrix64F(2, d);
        }

        DenseMatrix64F t = Util.designMatrix(batch.getTimes());
        DenseMatrix64F design = new DenseMatrix64F(2, 2);
        CommonOps.multTransA(t, t, design);
        DenseMatrix64F newLambda = new DenseMatrix64F(2, 2);
        CommonOps.add(design, lambda0, newLambda);
        DenseMatrix64F rhs = new DenseMatrix64F(2, d);
        CommonOps.multTransA(t, x, rhs);
        CommonOps.multAdd(lambda0, w0, rhs);
        DenseMatrix64F newW = new DenseMatrix64F(2, d);
        CommonOps.mult(Util.pinv(newLambda), rhs, newW);

        n = n + m;
        nu = nu + m;
        DenseMatrix64F residual = new DenseMatrix64F(m, d);
        CommonOps.mult(t, newW, residual);
        CommonOps.sub(x, residual, residual);
        DenseMatrix64F deltaW = new DenseMatrix64F(2, d);
        CommonOps.sub(newW, w0, deltaW);
        DenseMatrix64F lambdaDelta = new DenseMatrix64F(2, d);
        CommonOps.mult(lambda0, deltaW, lambdaDelta);

        DenseMatrix64F newV = v0.copy();
        CommonOps.multAddTransA(residual, residual, newV);
        CommonOps.multAddTransA(deltaW, lambdaDelta, newV);
        v0 = Util.symmetrize(newV);
        w0 = newW;
        lambda0 = newLambda;
    }

    /**
     * Naive computation of the posterior with Bayes' rule, plugging in point estimates Sigma_hat = E[Sigma] and
     * W_hat = E[W | Sigma = Sigma_hat]:
     * <pre>
     * p(X | t) = p(W_hat, Sigma_hat) p(X | t, W_hat, Sigma_hat) / p(W_hat, Sigma_hat | X, t)
     * </pre>
     * When E[Sigma] does not exist (nu <= d + 1) the mode of Sigma is used instead. Observations of a batch are scored
     * one after another, each conditioned on the ones before it.
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
            throw new UnsupportedOperationException("Bayesian multivariate linear regression doesn't have a random variable posterior. "
                    + "Please specify a non-null value of x and set returnRv = false.");
        }
        AlignedBatch batch = process(x);
        double[] result = new double[batch.size()];
        BayesianMVLinReg current = this;
        for (int i = 0; i < batch.size(); i++) {
            AlignedBatch point = batch.row(i);
            BayesianMVLinReg updated = current.copy();
            updated.absorb(point);
            double logp = current.naiveLogDensity(updated, point.getTimes()[0], point.getValues()[0]);
            result[i] = log ? logp : FastMath.exp(logp);
            current = updated;
        }
        PosteriorResult posterior = PosteriorResult.ofDensities(result);
        if (!returnUpdated) {
            return posterior;
        }
        return posterior.withUpdated(current == this ? copy() : current);
    }

    private double naiveLogDensity(BayesianMVLinReg updated, double t, double[] x) {
        int d = x.length;
        DenseMatrix64F priorV = v0 != null ? v0 : new DenseMatrix64F(d, d);
        DenseMatrix64F priorWeights = w0 != null ? w0 : new DenseMatrix64F(2, d);

        // Get priors & point estimates for Sigma and W; get the point estimate for x(t)
        InverseWishartDistribution priorSigma = new InverseWishartDistribution(nu, Util.toArray(priorV));
        double[][] sigmaHat = nu > d + 1 ? priorSigma.getMeanMatrix() : priorSigma.getModeMatrix();
        DenseMatrix64F sigmaHatMatrix = new DenseMatrix64F(sigmaHat);
        double[] wHat = Util.vec(priorWeights);
        MultivariateNormalDistribution priorW = weightDistribution(priorWeights, lambda0, sigmaHatMatrix);
        double[] xHat = new double[d];
        for (int j = 0; j < d; j++) {
            xHat[j] = t * priorWeights.get(0, j) + priorWeights.get(1, j);
        }

        // Get posteriors
        InverseWishartDistribution postSigma = new InverseWishartDistribution(updated.nu, Util.toArray(updated.v0));
        MultivariateNormalDistribution postW = weightDistribution(updated.w0, updated.lambda0, sigmaHatMatrix);

        // Apply Bayes' rule
        double evidence = new MultivariateNormalDistribution(xHat, sigmaHat).logDensity(x);
        double prior = priorSigma.logDensity(sigmaHat) + priorW.logDensity(wHat);
        double post = postSigma.logDensity(sigmaHat) + postW.logDensity(wHat);
        return evidence + prior - post;
    }

    /**
     * Distribution of vec(W) given Sigma: N(vec(W), Sigma (x) Lambda^+).
     */
    private static MultivariateNormalDistribution weightDistribution(DenseMatrix64F w, DenseMatrix64F lambda, DenseMatrix64F sigma) {
        DenseMatrix64F covariance = Util.kron(sigma, Util.symmetrize(Util.pinv(lambda)));
        return new MultivariateNormalDistribution(Util.vec(w), Util.toArray(covariance));
    }

    @Override
    public BayesianMVLinReg copy() {
        return new BayesianMVLinReg(this);
    }

    @Override
    protected void writeState(Map<String, Object> state) {
        state.put("nu", nu);
        state.put("w_0", Util.toNestedList(w0));
        state.put("Lambda_0", Util.toNestedList(lambda0));
        state.put("V_0", Util.toNestedList(v0));
    }

    @Override
    protected List<String> stateFields() {
        return Arrays.asList("nu", "w_0", "Lambda_0", "V_0");
    }

    @Override
    protected void readState(Map<String, ?> state) {
        nu = Util.toDouble(state.get("nu"));
        w0 = Util.toMatrix(state.get("w_0"));
        lambda0 = Util.toMatrix(state.get("Lambda_0"));
        v0 = Util.toMatrix(state.get("V_0"));
        if (lambda0 == null) {
            throw new IllegalArgumentException("Field 'Lambda_0' of " + getName() + " cannot be null");
        }
    }
}
