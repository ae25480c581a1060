package priors;

import data.Observations;
import distributions.InverseWishartDistribution;
import distributions.MultivariateTDistribution;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import util.Util;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Multivariate Normal-InverseWishart conjugate prior, the multivariate counterpart of {@link NormInvGamma}:
 * <pre>
 * X     ~ N_d(mu, Sigma)
 * mu    ~ N_d(mu_0, Sigma / n)
 * Sigma ~ InvWishart_nu(Lambda)
 * </pre>
 * For a batch x_1 ... x_m with mean xbar the update is
 * <pre>
 * nu     = nu + m
 * Lambda = Lambda + sum_i (x_i - xbar)(x_i - xbar)^T + n m / (n + m) (xbar - mu_0)(xbar - mu_0)^T
 * mu_0   = (n mu_0 + m xbar) / (n + m)
 * n      = n + m
 * </pre>
 * The first batch simply sets mu_0 to its mean and Lambda to its scatter matrix.
 */
public class MVNormInvWishart extends ConjugatePrior {

    private double nu;
    /**
     * Posterior mean, a d x 1 column vector.
     */
    private DenseMatrix64F mu0;
    /**
     * Posterior scale matrix, d x d.
     */
    private DenseMatrix64F lambda;

    public MVNormInvWishart() {
        super();
        this.nu = 0;
    }

    public MVNormInvWishart(Observations sample) {
        this();
        if (sample != null) {
            update(sample);
        }
    }

    protected MVNormInvWishart(MVNormInvWishart other) {
        super(other);
        this.nu = other.nu;
        this.mu0 = other.mu0 == null ? null : other.mu0.copy();
        this.lambda = other.lambda == null ? null : other.lambda.copy();
    }

    public static MVNormInvWishart fromDict(Map<String, ?> state) {
        MVNormInvWishart prior = new MVNormInvWishart();
        prior.readDict(state);
        return prior;
    }

    public double getNu() {
        return nu;
    }

    public double[] getMu0() {
        return mu0 == null ? null : mu0.getData().clone();
    }

    public double[][] getLambda() {
        return lambda == null ? null : Util.toArray(lambda);
    }

    @Override
    protected void absorb(AlignedBatch batch) {
        DenseMatrix64F x = batch.toMatrix();
        int n0 = this.n;
        int m = x.numRows;
        nu = nu + m;

        DenseMatrix64F sampleMean = Util.getSampleMean(x);
        DenseMatrix64F sampleComp = Util.getScatter(x, sampleMean);
        if (n0 == 0) {
            mu0 = sampleMean;
            lambda = sampleComp;
            n = m;
            return;
        }

        DenseMatrix64F delta = new DenseMatrix64F(dim, 1);
        CommonOps.sub(sampleMean, mu0, delta);
        DenseMatrix64F priorComp = new DenseMatrix64F(dim, dim);
        CommonOps.multTransB(delta, delta, priorComp);
        CommonOps.scale((double) m * n0 / (m + n0), priorComp);

        CommonOps.addEquals(lambda, sampleComp);
        CommonOps.addEquals(lambda, priorComp);

        DenseMatrix64F newMean = new DenseMatrix64F(dim, 1);
        CommonOps.add((double) n0 / (n0 + m), mu0, (double) m / (n0 + m), sampleMean, newMean);
        mu0 = newMean;
        n = n0 + m;
    }

    private double degreesOfFreedom() {
        return Math.max(nu - dim + 1, 1);
    }

    private MultivariateTDistribution studentT(double shapeFactor) {
        if (mu0 == null) {
            throw new IllegalStateException(getName() + " has no observations yet, its posterior is undefined");
        }
        double dof = degreesOfFreedom();
        DenseMatrix64F shape = new DenseMatrix64F(lambda);
        CommonOps.scale(shapeFactor / (n * dof), shape);
        return new MultivariateTDistribution(mu0.getData().clone(), Util.toArray(shape), dof);
    }

    /**
     * The posterior of mu is multivariate Student-t with nu - d + 1 degrees of freedom, location mu_0 and shape
     * Lambda / (n (nu - d + 1)).
     */
    public PosteriorResult muPosterior(double[][] mu, boolean returnRv, boolean log) {
        return PosteriorResult.evaluate(studentT(1), mu, returnRv, log);
    }

    /**
     * The posterior of Sigma is InvWishart_nu(Lambda).
     *
     * @param sigma a covariance matrix to evaluate the density at, or null for the distribution
     */
    public PosteriorResult sigmaPosterior(double[][] sigma, boolean returnRv, boolean log) {
        if (lambda == null) {
            throw new IllegalStateException(getName() + " has no observations yet, its posterior is undefined");
        }
        InverseWishartDistribution rv = new InverseWishartDistribution(nu, Util.toArray(lambda));
        if (sigma == null || returnRv) {
            return PosteriorResult.ofDistribution(rv);
        }
        return PosteriorResult.ofDensities(new double[]{log ? rv.logDensity(sigma) : rv.density(sigma)});
    }

    /**
     * The posterior of x is multivariate Student-t with nu - d + 1 degrees of freedom, location mu_0 and shape
     * (n + 1) Lambda / (n (nu - d + 1)).
     */
    @Override
    public PosteriorResult posterior(Observations x, boolean returnRv, boolean log) {
        AlignedBatch batch = process(x);
        MultivariateTDistribution rv = studentT((n + 1.0) / n);
        return PosteriorResult.evaluate(rv, batch == null ? null : batch.getValues(), returnRv, log);
    }

    @Override
    public MVNormInvWishart copy() {
        return new MVNormInvWishart(this);
    }

    @Override
    protected void writeState(Map<String, Object> state) {
        state.put("nu", nu);
        state.put("mu_0", Util.toList(mu0));
        state.put("Lambda", Util.toNestedList(lambda));
    }

    @Override
    protected List<String> stateFields() {
        return Arrays.asList("nu", "mu_0", "Lambda");
    }

    @Override
    protected void readState(Map<String, ?> state) {
        nu = Util.toDouble(state.get("nu"));
        mu0 = Util.toVector(state.get("mu_0"));
        lambda = Util.toMatrix(state.get("Lambda"));
    }
}
