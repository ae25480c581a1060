package priors;

import data.Observations;
import data.UniformTimeSeries;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ObservationPreprocessorTest {

    @Test
    public void testNullInput() {
        MVNormInvWishart prior = new MVNormInvWishart();
        assertNull(ObservationPreprocessor.process(prior, null));
        assertNull(prior.getDim());
        assertNull(prior.getT0());
    }

    @Test
    public void testScalarAnchorsWithUnitStep() {
        NormInvGamma prior = new NormInvGamma();
        AlignedBatch batch = ObservationPreprocessor.process(prior, Observations.scalar(4.2));
        assertEquals(0.0, prior.getT0(), 0.0);
        assertEquals(1.0, prior.getDt(), 0.0);
        assertArrayEquals(new double[]{0.0}, batch.getTimes(), 0.0);
        assertArrayEquals(new double[]{4.2}, batch.flatten(), 0.0);
    }

    @Test
    public void testBatchAnchorsWithBatchLength() {
        MVNormInvWishart prior = new MVNormInvWishart();
        prior.update(new double[][]{{1, 2}, {3, 4}, {5, 6}, {7, 8}});
        assertEquals(0.0, prior.getT0(), 0.0);
        assertEquals(4.0, prior.getDt(), 0.0);
        assertEquals(Integer.valueOf(2), prior.getDim());

        // later batches continue counting from n, in units of the first batch
        AlignedBatch next = ObservationPreprocessor.process(prior, Observations.of(new double[][]{{0, 0}, {1, 1}}));
        assertArrayEquals(new double[]{1.0, 1.25}, next.getTimes(), 1e-12);
        assertEquals(2, next.getValues()[0].length);
    }

    @Test
    public void testSequenceBecomesColumn() {
        MVNormInvWishart prior = new MVNormInvWishart();
        AlignedBatch batch = ObservationPreprocessor.process(prior, Observations.of(new double[]{1, 2, 3}));
        assertEquals(Integer.valueOf(1), prior.getDim());
        assertEquals(3, batch.size());
        assertEquals(1, batch.getValues()[0].length);
        assertArrayEquals(new double[]{0, 1.0 / 3, 2.0 / 3}, batch.getTimes(), 1e-12);
    }

    @Test
    public void testTimeSeriesAnchor() {
        UniformTimeSeries series = new UniformTimeSeries(new double[]{100, 110, 120, 130},
                new double[][]{{1, 0}, {2, 0}, {3, 1}, {4, 1}});
        MVNormInvWishart prior = new MVNormInvWishart();
        AlignedBatch batch = ObservationPreprocessor.process(prior, Observations.of(series));
        assertEquals(100.0, prior.getT0(), 0.0);
        assertEquals(30.0, prior.getDt(), 0.0);
        assertArrayEquals(new double[]{0, 1.0 / 3, 2.0 / 3, 1.0}, batch.getTimes(), 1e-12);
        assertArrayEquals(new double[]{3, 1}, batch.getValues()[2], 0.0);

        AlignedBatch later = ObservationPreprocessor.process(prior,
                Observations.of(new UniformTimeSeries(new double[]{160}, new double[][]{{5, 2}})));
        assertArrayEquals(new double[]{2.0}, later.getTimes(), 1e-12);
    }

    @Test
    public void testSingleTimestampFallsBackToUnitStep() {
        BayesianLinReg prior = new BayesianLinReg();
        ObservationPreprocessor.process(prior, Observations.of(new UniformTimeSeries(new double[]{50}, new double[]{1})));
        assertEquals(50.0, prior.getT0(), 0.0);
        assertEquals(1.0, prior.getDt(), 0.0);
    }

    @Test
    public void testMismatchLeavesAnchorUnset() {
        BetaBernoulli prior = new BetaBernoulli();
        assertThrows(DimensionMismatchException.class,
                () -> ObservationPreprocessor.process(prior, Observations.of(new double[][]{{1, 0}})));
        assertNull(prior.getT0());
        assertNull(prior.getDt());
        assertEquals(Integer.valueOf(1), prior.getDim());
    }

    @Test
    public void testRaggedBatch() {
        MVNormInvWishart prior = new MVNormInvWishart();
        assertThrows(DimensionMismatchException.class,
                () -> prior.update(new double[][]{{1, 2}, {3}}));
        assertNull(prior.getDim());
    }

    @Test
    public void testEmptyBatchIsIgnored() {
        NormInvGamma prior = new NormInvGamma();
        prior.update(new double[0]);
        assertEquals(0, prior.getN());
        assertNull(prior.getT0());
    }
}
