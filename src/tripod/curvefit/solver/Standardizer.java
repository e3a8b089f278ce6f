package tripod.curvefit.solver;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Rescales x to zero mean and unit (population) variance. A constant x
 * has no spread, in which case the scale is taken as 1. Spread at the
 * level of the rounding error of the mean counts as none.
 */
class Standardizer {
    final double mean;
    final double scale;

    Standardizer (double[] x) {
        mean = StatUtils.mean(x);
        double sd = new StandardDeviation (false).evaluate(x);
        scale = sd > x.length * Math.ulp(mean) ? sd : 1.;
    }

    double[] apply (double[] x) {
        double[] z = new double[x.length];
        for (int i = 0; i < x.length; ++i)
            z[i] = (x[i] - mean) / scale;
        return z;
    }

    /**
     * Map y = b + w*z with z = (x - mean)/scale back to
     * y = intercept + slope*x.
     */
    LinearEstimate restore (SolverType solver, double b, double w, 
                            int iterations) {
        double slope = w / scale;
        return new LinearEstimate 
            (solver, b - slope * mean, slope, iterations);
    }
}
