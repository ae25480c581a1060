package priors;

/**
 * Conjugate prior for a scalar random variable: the dimension is 1 from the start.
 */
public abstract class ScalarConjugatePrior extends ConjugatePrior {

    protected ScalarConjugatePrior() {
        super();
        this.dim = 1;
    }

    protected ScalarConjugatePrior(ScalarConjugatePrior other) {
        super(other);
    }
}
