package distributions;

import org.apache.commons.math3.distribution.TDistribution;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DistributionsTest {

    @Test
    public void testStudentTMatchesStandardT() {
        TDistribution standard = new TDistribution(5.0);
        StudentTDistribution t = new StudentTDistribution(0.0, 1.0, 5.0);
        for (double x : new double[]{-3.0, -0.5, 0.0, 1.2, 4.0}) {
            assertEquals(standard.logDensity(x), t.logDensity(x), 1e-10);
        }
    }

    @Test
    public void testStudentTLocationScale() {
        TDistribution standard = new TDistribution(3.0);
        StudentTDistribution t = new StudentTDistribution(2.0, 0.5, 3.0);
        assertEquals(standard.density((3.0 - 2.0) / 0.5) / 0.5, t.density(3.0), 1e-10);
        assertEquals(2.0, t.mean(), 0.0);
        assertTrue(Double.isNaN(new StudentTDistribution(2.0, 0.5, 1.0).mean()));
    }

    @Test
    public void testUnivariateMultivariateTMatchesStudentT() {
        MultivariateTDistribution mvt = new MultivariateTDistribution(new double[]{1.5}, new double[][]{{4.0}}, 7.0);
        StudentTDistribution t = new StudentTDistribution(1.5, 2.0, 7.0);
        for (double x : new double[]{-2.0, 1.5, 3.3}) {
            assertEquals(t.logDensity(x), mvt.logDensity(new double[]{x}), 1e-10);
        }
    }

    @Test
    public void testMultivariateNormalMatchesCommonsMath() {
        double[] mean = {1.0, -1.0};
        double[][] covariance = {{2.0, 0.3}, {0.3, 1.0}};
        org.apache.commons.math3.distribution.MultivariateNormalDistribution reference =
                new org.apache.commons.math3.distribution.MultivariateNormalDistribution(mean, covariance);
        MultivariateNormalDistribution normal = new MultivariateNormalDistribution(mean, covariance);
        double[] x = {0.4, 0.1};
        assertEquals(reference.density(x), normal.density(x), 1e-12);
        assertEquals(Distribution.Family.MULTIVARIATE_NORMAL, normal.getFamily());
    }

    @Test
    public void testSingularMultivariateNormal() {
        // all the mass sits on the diagonal x = y
        MultivariateNormalDistribution normal = new MultivariateNormalDistribution(
                new double[]{0.0, 0.0}, new double[][]{{1.0, 1.0}, {1.0, 1.0}});
        // one-dimensional normal with variance 2 along (1, 1) / sqrt(2)
        double expected = -0.5 * (Math.log(2 * Math.PI) + Math.log(2.0));
        assertEquals(expected, normal.logDensity(new double[]{0.0, 0.0}), 1e-10);
    }

    @Test
    public void testInverseWishartReducesToInverseGamma() {
        InverseWishartDistribution wishart = new InverseWishartDistribution(6.0, new double[][]{{3.0}});
        InverseGammaDistribution gamma = new InverseGammaDistribution(3.0, 1.5);
        for (double x : new double[]{0.2, 0.5, 1.0, 2.5}) {
            assertEquals(gamma.logDensity(x), wishart.logDensity(new double[]{x}), 1e-10);
        }
        assertEquals(gamma.mean(), wishart.getMeanMatrix()[0][0], 1e-12);
        assertEquals(gamma.mode(), wishart.getModeMatrix()[0][0], 1e-12);
    }

    @Test
    public void testInverseWishartOutsideSupport() {
        InverseWishartDistribution wishart = new InverseWishartDistribution(5.0, new double[][]{{1.0, 0.0}, {0.0, 1.0}});
        assertEquals(Double.NEGATIVE_INFINITY, wishart.logDensity(new double[][]{{1.0, 2.0}, {2.0, 1.0}}));
        assertTrue(Double.isNaN(new InverseWishartDistribution(2.0, new double[][]{{1.0, 0.0}, {0.0, 1.0}}).getMean()[0]));
        assertEquals(1.0 / 2.0, wishart.getMeanMatrix()[0][0], 1e-12);
    }

    @Test
    public void testInverseGammaIntegratesToOne() {
        InverseGammaDistribution gamma = new InverseGammaDistribution(3.0, 2.0);
        double h = 1e-3;
        double integral = 0;
        for (double x = h / 2; x < 200; x += h) {
            integral += gamma.density(x) * h;
        }
        assertEquals(1.0, integral, 1e-4);
        assertEquals(Double.NEGATIVE_INFINITY, gamma.logDensity(-1.0));
        assertEquals(Double.POSITIVE_INFINITY, new InverseGammaDistribution(0.5, 1.0).mean());
    }

    @Test
    public void testBernoulliAndBeta() {
        BernoulliDistribution bernoulli = new BernoulliDistribution(0.25);
        assertEquals(0.25, bernoulli.density(1.0), 1e-12);
        assertEquals(0.75, bernoulli.density(0.0), 1e-12);
        assertEquals(0.0, bernoulli.density(2.0), 0.0);

        BetaDistribution beta = new BetaDistribution(2.0, 2.0);
        assertEquals(1.5, beta.density(0.5), 1e-12);
        assertEquals(0.5, beta.mean(), 1e-12);
        assertEquals(Double.NEGATIVE_INFINITY, beta.logDensity(1.5));
    }

    @Test
    public void testZeroCovariance() {
        MultivariateNormalDistribution normal = new MultivariateNormalDistribution(new double[]{0, 0}, new double[2][2]);
        assertEquals(0.0, normal.logDensity(new double[]{0, 0}), 0.0);
        InverseWishartDistribution wishart = new InverseWishartDistribution(3.0, new double[2][2]);
        assertEquals(Double.NEGATIVE_INFINITY, wishart.logDensity(new double[2][2]), 0.0);
    }
}
