package priors;

import distributions.Distribution;

/**
 * Result of a posterior query: either one (log-)density per queried observation, or the posterior distribution
 * itself.
 */
public final class PosteriorResult {

    private final double[] densities;
    private final Distribution distribution;
    private final ConjugatePrior updated;

    private PosteriorResult(double[] densities, Distribution distribution, ConjugatePrior updated) {
        this.densities = densities;
        this.distribution = distribution;
        this.updated = updated;
    }

    public static PosteriorResult ofDensities(double[] densities) {
        return new PosteriorResult(densities, null, null);
    }

    public static PosteriorResult ofDistribution(Distribution distribution) {
        return new PosteriorResult(null, distribution, null);
    }

    public boolean isDistribution() {
        return distribution != null;
    }

    public double[] getDensities() {
        if (densities == null) {
            throw new IllegalStateException("Posterior query returned a " + distribution.getFamily() + " distribution, not densities");
        }
        return densities;
    }

    public Distribution getDistribution() {
        if (distribution == null) {
            throw new IllegalStateException("Posterior query returned densities, not a distribution");
        }
        return distribution;
    }

    public boolean hasUpdated() {
        return updated != null;
    }

    /**
     * A copy of the queried prior that has absorbed the queried observations.
     */
    public ConjugatePrior getUpdated() {
        if (updated == null) {
            throw new IllegalStateException("Posterior query was made without returnUpdated");
        }
        return updated;
    }

    PosteriorResult withUpdated(ConjugatePrior prior) {
        return new PosteriorResult(densities, distribution, prior);
    }

    /**
     * Evaluates {@code distribution} at each point, or returns the distribution itself when {@code points} is null or
     * {@code returnRv} is set.
     */
    static PosteriorResult evaluate(Distribution distribution, double[][] points, boolean returnRv, boolean log) {
        if (points == null || returnRv) {
            return ofDistribution(distribution);
        }
        double[] values = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            values[i] = log ? distribution.logDensity(points[i]) : distribution.density(points[i]);
        }
        return ofDensities(values);
    }

    static PosteriorResult evaluate(Distribution distribution, double[] points, boolean returnRv, boolean log) {
        if (points == null || returnRv) {
            return ofDistribution(distribution);
        }
        double[][] rows = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            rows[i] = new double[]{points[i]};
        }
        return evaluate(distribution, rows, false, log);
    }
}
