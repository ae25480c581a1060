package priors;

import com.fasterxml.jackson.core.type.TypeReference;
import data.Observations;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Creates and restores conjugate priors by type name, the simple class name of the prior (e.g. "BetaBernoulli").
 */
public final class PriorState {

    private static final Map<String, Supplier<ConjugatePrior>> CONSTRUCTORS = new LinkedHashMap<>();
    private static final Map<String, Function<Map<String, ?>, ConjugatePrior>> RESTORERS = new LinkedHashMap<>();

    static {
        register("BetaBernoulli", BetaBernoulli::new, BetaBernoulli::fromDict);
        register("NormInvGamma", NormInvGamma::new, NormInvGamma::fromDict);
        register("MVNormInvWishart", MVNormInvWishart::new, MVNormInvWishart::fromDict);
        register("BayesianLinReg", BayesianLinReg::new, BayesianLinReg::fromDict);
        register("BayesianMVLinReg", BayesianMVLinReg::new, BayesianMVLinReg::fromDict);
    }

    private PriorState() {
    }

    private static void register(String name, Supplier<ConjugatePrior> constructor,
                                 Function<Map<String, ?>, ConjugatePrior> restorer) {
        CONSTRUCTORS.put(name, constructor);
        RESTORERS.put(name, restorer);
    }

    public static Set<String> getTypeNames() {
        return Collections.unmodifiableSet(CONSTRUCTORS.keySet());
    }

    /**
     * A fresh prior of the named type, updated with {@code sample} when it is not null.
     *
     * @throws IllegalArgumentException for an unknown type name
     */
    public static ConjugatePrior create(String type, Observations sample) {
        ConjugatePrior prior = lookup(CONSTRUCTORS, type).get();
        if (sample != null) {
            prior.update(sample);
        }
        return prior;
    }

    public static ConjugatePrior create(String type) {
        return create(type, null);
    }

    /**
     * @throws IllegalArgumentException for an unknown type name or a malformed state
     */
    public static ConjugatePrior fromDict(String type, Map<String, ?> state) {
        return lookup(RESTORERS, type).apply(state);
    }

    /**
     * Restores a prior from the output of {@link ConjugatePrior#toJson()}.
     */
    public static ConjugatePrior fromJson(String type, String json) {
        Map<String, Object> state;
        try {
            state = ConjugatePrior.MAPPER.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {
            });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return fromDict(type, state);
    }

    private static <T> T lookup(Map<String, T> registry, String type) {
        T entry = registry.get(type);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown conjugate prior '" + type + "', expected one of " + registry.keySet());
        }
        return entry;
    }
}
