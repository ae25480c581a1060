package priors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import data.Observations;
import data.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.Util;

import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class of the Bayesian conjugate priors. A prior keeps the sufficient statistics of everything it has seen,
 * absorbs new observations with {@link #update(Observations)} and answers posterior queries with
 * {@link #posterior(Observations, boolean, boolean)}.
 * <p>
 * Updating is sequential: updating with one batch and then another gives the same statistics as a single update
 * with both batches concatenated. Instances are not thread safe; hand a {@link #copy()} to other consumers.
 */
public abstract class ConjugatePrior {
    private static final Logger logger = LoggerFactory.getLogger(ConjugatePrior.class);

    static final ObjectMapper MAPPER = new ObjectMapper();

    private static final List<String> COMMON_FIELDS = Arrays.asList("n", "dim", "t0", "dt");

    /**
     * Number of observations absorbed so far.
     */
    protected int n;
    /**
     * Dimension of the observations, fixed by the first one seen.
     */
    protected Integer dim;
    /**
     * Time origin and unit, fixed by the first observations seen.
     */
    protected Double t0;
    protected Double dt;

    protected ConjugatePrior() {
        this.n = 0;
    }

    protected ConjugatePrior(ConjugatePrior other) {
        this.n = other.n;
        this.dim = other.dim;
        this.t0 = other.t0;
        this.dt = other.dt;
    }

    public int getN() {
        return n;
    }

    public Integer getDim() {
        return dim;
    }

    public Double getT0() {
        return t0;
    }

    public Double getDt() {
        return dt;
    }

    public String getName() {
        return getClass().getSimpleName();
    }

    boolean isAnchored() {
        return t0 != null && dt != null;
    }

    void anchor(double t0, double dt) {
        this.t0 = t0;
        this.dt = dt;
    }

    void fixDimension(int columns) {
        if (dim == null) {
            dim = columns;
        }
    }

    /**
     * @return the normalized times and observation matrix of x, or null for a null x
     */
    protected AlignedBatch process(Observations x) {
        return ObservationPreprocessor.process(this, x);
    }

    /**
     * Updates the sufficient statistics with new observations.
     *
     * @throws org.apache.commons.math3.exception.DimensionMismatchException if the observations do not have the
     *                                                                        dimension of earlier ones
     */
    public void update(Observations x) {
        Objects.requireNonNull(x, "observations");
        AlignedBatch batch = process(x);
        if (batch.isEmpty()) {
            return;
        }
        absorb(batch);
        logger.debug("{} absorbed {} observation(s), n = {}", getName(), batch.size(), n);
    }

    public void update(double x) {
        update(Observations.scalar(x));
    }

    public void update(double[] x) {
        update(Observations.of(x));
    }

    public void update(double[][] x) {
        update(Observations.of(x));
    }

    public void update(TimeSeries x) {
        update(Observations.of(x));
    }

    /**
     * Updates the sufficient statistics with an already preprocessed, non-empty batch.
     */
    protected abstract void absorb(AlignedBatch batch);

    /**
     * Predictive posterior of new observations.
     *
     * @param x        observations to evaluate the posterior at; null asks for the distribution itself
     * @param returnRv whether to return the distribution instead of densities
     * @param log      whether to return log densities
     * @return one (log) density per observation, or the posterior distribution
     */
    public abstract PosteriorResult posterior(Observations x, boolean returnRv, boolean log);

    /**
     * Predictive posterior of new observations that can also hand back the prior updated on them, so a caller that
     * scores and then commits x does not pay for the update twice.
     *
     * @param returnUpdated whether to attach a copy of this prior updated on x, see {@link PosteriorResult#getUpdated()}
     */
    public PosteriorResult posterior(Observations x, boolean returnRv, boolean log, boolean returnUpdated) {
        PosteriorResult result = posterior(x, returnRv, log);
        if (!returnUpdated) {
            return result;
        }
        ConjugatePrior updated = copy();
        if (x != null) {
            updated.update(x);
        }
        return result.withUpdated(updated);
    }

    public double[] posterior(double x, boolean log) {
        return posterior(Observations.scalar(x), false, log).getDensities();
    }

    public double[] posterior(double[] x, boolean log) {
        return posterior(Observations.of(x), false, log).getDensities();
    }

    public double[] posterior(double[][] x, boolean log) {
        return posterior(Observations.of(x), false, log).getDensities();
    }

    public double[] posterior(TimeSeries x, boolean log) {
        return posterior(Observations.of(x), false, log).getDensities();
    }

    /**
     * An independent deep copy of this prior.
     */
    public abstract ConjugatePrior copy();

    /**
     * Every field of the prior, as numbers, lists of numbers and lists of rows.
     */
    public Map<String, Object> toDict() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("n", n);
        state.put("dim", dim);
        state.put("t0", t0);
        state.put("dt", dt);
        writeState(state);
        return state;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toDict());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Adds the sufficient statistics of the concrete prior to {@code state}.
     */
    protected abstract void writeState(Map<String, Object> state);

    /**
     * Names of the fields written by {@link #writeState(Map)}.
     */
    protected abstract List<String> stateFields();

    /**
     * Reads the sufficient statistics of the concrete prior, with every field known to be present.
     */
    protected abstract void readState(Map<String, ?> state);

    /**
     * Assigns every field of {@code state} to this prior.
     *
     * @throws IllegalArgumentException if a field is missing, unknown or malformed
     */
    protected void readDict(Map<String, ?> state) {
        Set<String> expected = new LinkedHashSet<>(COMMON_FIELDS);
        expected.addAll(stateFields());
        for (String key : state.keySet()) {
            if (!expected.contains(key)) {
                throw new IllegalArgumentException("Unknown field '" + key + "' for " + getName());
            }
        }
        for (String key : expected) {
            if (!state.containsKey(key)) {
                throw new IllegalArgumentException("Missing field '" + key + "' for " + getName());
            }
        }
        if (state.get("n") == null) {
            throw new IllegalArgumentException("Field 'n' of " + getName() + " cannot be null");
        }
        n = Util.toInteger(state.get("n"));
        dim = Util.toInteger(state.get("dim"));
        t0 = Util.toNullableDouble(state.get("t0"));
        dt = Util.toNullableDouble(state.get("dt"));
        readState(state);
    }
}
