package distributions;

import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.FastMath;

/**
 * Location-scale Student-t distribution. The standardized density is evaluated in log space so that large degrees of
 * freedom do not overflow the gamma terms.
 */
public class StudentTDistribution extends ScalarDistribution {

    private final double location;
    private final double scale;
    private final double degreesOfFreedom;

    public StudentTDistribution(double location, double scale, double degreesOfFreedom) {
        this.location = location;
        this.scale = scale;
        this.degreesOfFreedom = degreesOfFreedom;
    }

    public double getLocation() {
        return location;
    }

    public double getScale() {
        return scale;
    }

    public double getDegreesOfFreedom() {
        return degreesOfFreedom;
    }

    @Override
    public Family getFamily() {
        return Family.STUDENT_T;
    }

    @Override
    public double logDensity(double x) {
        double nu = degreesOfFreedom;
        double z = (x - location) / scale;
        return Gamma.logGamma((nu + 1) / 2) - Gamma.logGamma(nu / 2)
                - 0.5 * FastMath.log(nu * FastMath.PI) - FastMath.log(scale)
                - (nu + 1) / 2 * FastMath.log1p(z * z / nu);
    }

    /**
     * Undefined (NaN) for degrees of freedom <= 1.
     */
    @Override
    public double mean() {
        return degreesOfFreedom > 1 ? location : Double.NaN;
    }
}
