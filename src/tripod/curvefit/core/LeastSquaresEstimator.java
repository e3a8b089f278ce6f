package tripod.curvefit.core;

import java.util.logging.Logger;
import java.util.logging.Level;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Ordinary least squares fits of every {@link ModelFamily}. The
 * exponential, power and logarithmic shapes are linearized with the
 * natural log, fit as a straight line and transformed back:
 *
 *    exponential   ln(y) = ln(a) + b*x
 *    power         ln(y) = ln(a) + b*ln(x)
 *    logarithmic       y = a + b*ln(x)
 *
 * The quadratic is fit directly on the design matrix [1, x, x^2].
 * A constant (transformed) x fits the flat line through the mean of
 * the (transformed) y.
 */
public class LeastSquaresEstimator implements Estimator {
    private static final Logger logger = Logger.getLogger
        (LeastSquaresEstimator.class.getName());

    // a quadratic has three parameters
    static final int QUADRATIC_MIN_SIZE = 3;

    public LeastSquaresEstimator () {
    }

    public FitResult estimate (ModelFamily family, Sample sample) {
        FitResult result;
        try {
            switch (family) {
            case LINEAR:
                result = linear (sample);
                break;
            case EXPONENTIAL:
                result = exponential (sample);
                break;
            case POWER:
                result = power (sample);
                break;
            case LOGARITHMIC:
                result = logarithmic (sample);
                break;
            case QUADRATIC:
                result = quadratic (sample);
                break;
            default:
                throw new IllegalArgumentException
                    ("Unknown model family: "+family);
            }
        }
        catch (NumericalFailureException ex) {
            logger.log(Level.FINE, sample+": "+family.getId()
                       +" failed; "+ex.getMessage());
            return FitResult.failed(family, ex.getMessage());
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(sample+": "+result);
        }
        return result;
    }

    protected FitResult linear (Sample sample) 
        throws NumericalFailureException {
        double[] line = line (sample.getX(), sample.getY());
        return fitted (ModelFamily.LINEAR, sample, null, line[0], line[1]);
    }

    protected FitResult exponential (Sample sample) 
        throws NumericalFailureException {
        if (!sample.isPositiveY()) {
            return FitResult.inapplicable
                (ModelFamily.EXPONENTIAL, "all y must be > 0");
        }

        double[] line = line (sample.getX(), log (sample.getY()));
        return fitted (ModelFamily.EXPONENTIAL, sample, null,
                       Math.exp(line[0]), line[1]);
    }

    protected FitResult power (Sample sample) 
        throws NumericalFailureException {
        if (!sample.isPositiveX() || !sample.isPositiveY()) {
            return FitResult.inapplicable
                (ModelFamily.POWER, "all x and y must be > 0");
        }

        double[] line = line (log (sample.getX()), log (sample.getY()));
        return fitted (ModelFamily.POWER, sample, null,
                       Math.exp(line[0]), line[1]);
    }

    protected FitResult logarithmic (Sample sample) 
        throws NumericalFailureException {
        if (!sample.isPositiveX()) {
            return FitResult.inapplicable
                (ModelFamily.LOGARITHMIC, "all x must be > 0");
        }

        double[] line = line (log (sample.getX()), sample.getY());
        return fitted (ModelFamily.LOGARITHMIC, sample, null, line[0], line[1]);
    }

    /**
     * A quadratic through two points isn't unique, so samples with
     * fewer than three pairs are inapplicable rather than fit to an
     * arbitrary parabola.
     */
    protected FitResult quadratic (Sample sample) 
        throws NumericalFailureException {
        if (sample.size() < QUADRATIC_MIN_SIZE) {
            return FitResult.inapplicable
                (ModelFamily.QUADRATIC, "requires at least "
                 +QUADRATIC_MIN_SIZE+" pairs; got "+sample.size());
        }

        RealMatrix X = MatrixSupport.vandermonde(sample.getX(), 2);
        double[] coefs = MatrixSupport.solveQR(X, sample.getY());
        return fitted (ModelFamily.QUADRATIC, sample, X, coefs);
    }

    /**
     * Least squares line v = intercept + slope*u as {intercept, slope}.
     * A constant u leaves the slope undetermined; the least squares
     * answer then is slope 0 through the mean of v.
     */
    static double[] line (double[] u, double[] v) {
        if (isConstant (u)) {
            return new double[]{StatUtils.mean(v), 0.};
        }

        SimpleRegression reg = new SimpleRegression ();
        for (int i = 0; i < u.length; ++i) {
            reg.addData(u[i], v[i]);
        }
        return new double[]{reg.getIntercept(), reg.getSlope()};
    }

    static boolean isConstant (double[] u) {
        for (int i = 1; i < u.length; ++i) {
            if (u[i] != u[0]) {
                return false;
            }
        }
        return true;
    }

    static double[] log (double[] values) {
        double[] ln = new double[values.length];
        for (int i = 0; i < values.length; ++i)
            ln[i] = Math.log(values[i]); // natural log
        return ln;
    }

    static FitResult fitted (ModelFamily family, Sample sample, 
                             Object modelObj, double... coefs) 
        throws NumericalFailureException {
        MatrixSupport.checkFinite(coefs);
        ParametricFitModel model = 
            new ParametricFitModel (family, coefs, sample, modelObj);
        if (!model.isFinite()) {
            throw new NumericalFailureException
                ("Non-finite predictions for "+model);
        }
        return FitResult.fitted(family, model);
    }
}
