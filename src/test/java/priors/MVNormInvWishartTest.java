package priors;

import data.Observations;
import distributions.Distribution;
import distributions.InverseWishartDistribution;
import distributions.MultivariateTDistribution;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MVNormInvWishartTest {

    private static final double[][] DATA = {
            {1.0, 2.0},
            {0.5, 1.1},
            {2.3, 2.9},
            {-0.4, 0.2},
            {1.7, 2.4},
            {0.9, 0.8},
            {1.4, 2.2}
    };

    private static double[][] rows(int from, int to) {
        double[][] rows = new double[to - from][];
        System.arraycopy(DATA, from, rows, 0, to - from);
        return rows;
    }

    private static void assertMatrixEquals(double[][] expected, double[][] actual, double delta) {
        assertEquals(expected.length, actual.length);
        for (int i = 0; i < expected.length; i++) {
            assertArrayEquals(expected[i], actual[i], delta);
        }
    }

    @Test
    public void testFirstBatch() {
        MVNormInvWishart prior = new MVNormInvWishart(Observations.of(DATA));
        int n = DATA.length;
        double[] mean = new double[2];
        for (double[] row : DATA) {
            mean[0] += row[0] / n;
            mean[1] += row[1] / n;
        }
        double[][] scatter = new double[2][2];
        for (double[] row : DATA) {
            for (int i = 0; i < 2; i++) {
                for (int j = 0; j < 2; j++) {
                    scatter[i][j] += (row[i] - mean[i]) * (row[j] - mean[j]);
                }
            }
        }
        assertArrayEquals(mean, prior.getMu0(), 1e-12);
        assertMatrixEquals(scatter, prior.getLambda(), 1e-12);
        assertEquals(n, prior.getN());
        assertEquals(n, prior.getNu(), 0.0);
        assertEquals(Integer.valueOf(2), prior.getDim());
    }

    @Test
    public void testAssociativity() {
        MVNormInvWishart batch = new MVNormInvWishart(Observations.of(DATA));
        for (int split = 1; split < DATA.length; split++) {
            MVNormInvWishart sequential = new MVNormInvWishart(Observations.of(rows(0, split)));
            sequential.update(rows(split, DATA.length));

            assertArrayEquals(batch.getMu0(), sequential.getMu0(), 1e-12);
            assertMatrixEquals(batch.getLambda(), sequential.getLambda(), 1e-10);
            assertEquals(batch.getNu(), sequential.getNu(), 0.0);
            assertEquals(batch.getN(), sequential.getN());
        }
    }

    @Test
    public void testSingleRowUpdates() {
        MVNormInvWishart sequential = new MVNormInvWishart();
        for (double[] row : DATA) {
            sequential.update(new double[][]{row});
        }
        MVNormInvWishart batch = new MVNormInvWishart(Observations.of(DATA));
        assertMatrixEquals(batch.getLambda(), sequential.getLambda(), 1e-10);
        assertArrayEquals(batch.getMu0(), sequential.getMu0(), 1e-12);
    }

    @Test
    public void testDimensionMismatch() {
        MVNormInvWishart prior = new MVNormInvWishart(Observations.of(rows(0, 3)));
        Map<String, Object> before = prior.toDict();
        assertThrows(DimensionMismatchException.class, () -> prior.update(new double[][]{{1, 2, 3}, {4, 5, 6}}));
        assertEquals(before, prior.toDict());
    }

    @Test
    public void testPosteriors() {
        MVNormInvWishart prior = new MVNormInvWishart(Observations.of(DATA));
        int n = prior.getN();
        double dof = prior.getNu() - 2 + 1;

        MultivariateTDistribution mu = (MultivariateTDistribution) prior.muPosterior(null, false, true).getDistribution();
        MultivariateTDistribution x = (MultivariateTDistribution) prior.posterior(null, false, true).getDistribution();
        assertEquals(Distribution.Family.MULTIVARIATE_T, x.getFamily());
        assertEquals(dof, mu.getDegreesOfFreedom(), 0.0);
        assertEquals(dof, x.getDegreesOfFreedom(), 0.0);
        assertArrayEquals(prior.getMu0(), x.getLocation(), 0.0);
        double[][] lambda = prior.getLambda();
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                assertEquals(lambda[i][j] / (n * dof), mu.getShape()[i][j], 1e-12);
                assertEquals(mu.getShape()[i][j] * (n + 1) / n, x.getShape()[i][j], 1e-12);
            }
        }

        double[] density = prior.posterior(new double[][]{prior.getMu0(), {5.0, -5.0}}, true);
        assertEquals(2, density.length);
        assertTrue(density[0] > density[1]);
        assertEquals(x.logDensity(new double[]{5.0, -5.0}), density[1], 1e-12);

        InverseWishartDistribution sigma = (InverseWishartDistribution) prior.sigmaPosterior(null, false, true).getDistribution();
        assertEquals(prior.getNu(), sigma.getDegreesOfFreedom(), 0.0);
        assertMatrixEquals(lambda, sigma.getScale(), 0.0);
        double[] sigmaDensity = prior.sigmaPosterior(new double[][]{{1.0, 0.5}, {0.5, 1.0}}, false, true).getDensities();
        assertEquals(sigma.logDensity(new double[][]{{1.0, 0.5}, {0.5, 1.0}}), sigmaDensity[0], 1e-12);
    }

    @Test
    public void testSingularShapeStillEvaluates() {
        // two points only span a line in the plane
        MVNormInvWishart prior = new MVNormInvWishart(Observations.of(new double[][]{{0, 0}, {1, 1}}));
        double[] density = prior.posterior(new double[][]{{0.5, 0.5}}, true);
        assertFalse(Double.isNaN(density[0]));
        assertFalse(Double.isInfinite(density[0]));
    }

    @Test
    public void testRoundTripAndCopy() {
        MVNormInvWishart prior = new MVNormInvWishart(Observations.of(DATA));
        MVNormInvWishart restored = MVNormInvWishart.fromDict(prior.toDict());
        assertEquals(prior.toDict(), restored.toDict());

        MVNormInvWishart empty = MVNormInvWishart.fromDict(new MVNormInvWishart().toDict());
        assertNull(empty.getMu0());
        assertNull(empty.getDim());

        Map<String, Object> before = prior.toDict();
        MVNormInvWishart copy = prior.copy();
        copy.update(new double[][]{{10, 10}});
        assertEquals(before, prior.toDict());
        assertEquals(DATA.length + 1, copy.getN());
    }
}
