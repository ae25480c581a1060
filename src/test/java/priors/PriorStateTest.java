package priors;

import data.Observations;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PriorStateTest {

    private static final double[][] DATA = {
            {1.0, 0.2},
            {0.0, 0.9},
            {1.0, 1.4},
            {1.0, 2.1},
            {0.0, 2.2}
    };

    private static ConjugatePrior seeded(String type) {
        if (type.startsWith("Beta") || type.equals("NormInvGamma") || type.equals("BayesianLinReg")) {
            double[] column = new double[DATA.length];
            for (int i = 0; i < DATA.length; i++) {
                column[i] = DATA[i][0];
            }
            return PriorState.create(type, Observations.of(column));
        }
        return PriorState.create(type, Observations.of(DATA));
    }

    @Test
    public void testCreateKnownTypes() {
        assertEquals(5, PriorState.getTypeNames().size());
        for (String type : PriorState.getTypeNames()) {
            ConjugatePrior prior = PriorState.create(type);
            assertEquals(type, prior.getName());
            assertEquals(0, prior.getN());
        }
    }

    @Test
    public void testUnknownType() {
        assertThrows(IllegalArgumentException.class, () -> PriorState.create("Dirichlet"));
    }

    @Test
    public void testJsonRoundTrip() {
        for (String type : PriorState.getTypeNames()) {
            ConjugatePrior prior = seeded(type);
            ConjugatePrior restored = PriorState.fromJson(type, prior.toJson());
            assertEquals(prior.toDict(), restored.toDict(), type);
            assertEquals(prior.getClass(), restored.getClass());
        }
    }

    @Test
    public void testJsonRoundTripOfEmptyPriors() {
        for (String type : PriorState.getTypeNames()) {
            ConjugatePrior prior = PriorState.create(type);
            ConjugatePrior restored = PriorState.fromJson(type, prior.toJson());
            assertEquals(prior.toDict(), restored.toDict(), type);
        }
    }

    @Test
    public void testRestoredPriorKeepsUpdating() {
        ConjugatePrior prior = seeded("NormInvGamma");
        ConjugatePrior restored = PriorState.fromJson("NormInvGamma", prior.toJson());
        prior.update(new double[]{3.0, 4.0});
        restored.update(new double[]{3.0, 4.0});
        assertEquals(prior.toDict(), restored.toDict());
    }

    @Test
    public void testUnknownFieldIsRejected() {
        Map<String, Object> state = new LinkedHashMap<>(new BetaBernoulli().toDict());
        state.put("gamma", 1.0);
        assertThrows(IllegalArgumentException.class, () -> BetaBernoulli.fromDict(state));
    }

    @Test
    public void testMissingFieldIsRejected() {
        Map<String, Object> state = new LinkedHashMap<>(new NormInvGamma().toDict());
        state.remove("mu_0");
        assertThrows(IllegalArgumentException.class, () -> NormInvGamma.fromDict(state));
    }

    @Test
    public void testMalformedFieldIsRejected() {
        Map<String, Object> state = new LinkedHashMap<>(new BayesianMVLinReg(Observations.of(DATA)).toDict());
        state.put("n", 2.5);
        assertThrows(IllegalArgumentException.class, () -> BayesianMVLinReg.fromDict(state));
    }
}
