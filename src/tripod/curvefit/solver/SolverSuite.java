package tripod.curvefit.solver;

import java.util.logging.Logger;
import java.util.logging.Level;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import tripod.curvefit.core.FitResult;
import tripod.curvefit.core.MatrixSupport;
import tripod.curvefit.core.ModelFamily;
import tripod.curvefit.core.NumericalFailureException;
import tripod.curvefit.core.ParametricFitModel;
import tripod.curvefit.core.Sample;

/**
 * Estimates intercept and slope of y = intercept + slope*x with any of
 * the {@link SolverType}s. The design matrix X always carries the bias
 * column, i.e., X = [1, x].
 */
public class SolverSuite {
    private static final Logger logger = 
        Logger.getLogger(SolverSuite.class.getName());

    // LU pivots below this fraction of the system's scale are singular
    static final double PIVOT_TOLERANCE = 1e-13;

    private final SolverConfig config;

    public SolverSuite () {
        this (new SolverConfig ());
    }

    public SolverSuite (SolverConfig config) {
        this.config = new SolverConfig (config);
    }

    public SolverConfig getConfig () { return new SolverConfig (config); }

    /**
     * Run the given solver and wrap its line in a fitted result with
     * predictions and metrics, or a failed result if the solver can't
     * produce a finite line.
     */
    public FitResult estimate (SolverType solver, Sample sample) {
        try {
            LinearEstimate est = solve (solver, sample);
            ParametricFitModel model = new ParametricFitModel
                (ModelFamily.LINEAR, est.coefficients(), sample, est);
            if (!model.isFinite()) {
                throw new NumericalFailureException
                    ("Non-finite predictions for "+est);
            }
            return FitResult.fitted(solver, model);
        }
        catch (NumericalFailureException ex) {
            logger.log(Level.FINE, sample+": "+solver.getId()
                       +" failed; "+ex.getMessage());
            return FitResult.failed(solver, ex.getMessage());
        }
    }

    public LinearEstimate solve (SolverType solver, Sample sample) 
        throws NumericalFailureException {
        LinearEstimate est;
        switch (solver) {
        case OLS: 
            est = ols (sample); 
            break;
        case NORMAL_EQUATION: 
            est = normalEquation (sample); 
            break;
        case SVD: 
            est = svd (sample); 
            break;
        case QR: 
            est = qr (sample); 
            break;
        case LU: 
            est = lu (sample); 
            break;
        case BATCH_GRADIENT_DESCENT:
            est = GradientDescent.batch(sample, config);
            break;
        case STOCHASTIC_GRADIENT_DESCENT:
            est = GradientDescent.stochastic(sample, config);
            break;
        case RIDGE: 
            est = ridge (sample); 
            break;
        case LASSO: 
            est = elasticNet (SolverType.LASSO, sample, 1.); 
            break;
        case ELASTIC_NET:
            est = elasticNet (SolverType.ELASTIC_NET, 
                              sample, config.getL1Ratio());
            break;
        default:
            throw new IllegalArgumentException ("Unknown solver: "+solver);
        }

        MatrixSupport.checkFinite(est.coefficients());
        return est;
    }

    protected LinearEstimate ols (Sample sample) {
        SimpleRegression reg = new SimpleRegression ();
        for (int i = 0; i < sample.size(); ++i) {
            reg.addData(sample.getX(i), sample.getY(i));
        }
        return new LinearEstimate 
            (SolverType.OLS, reg.getIntercept(), reg.getSlope());
    }

    /**
     * theta = pinv(Z'Z) * Z'y over the standardized design Z = [1, z].
     * Forming X'X from the raw x squares its condition number, which
     * for an offset x (e.g., years) leaves too few digits to recover
     * the line; Z'Z is close to n*I instead. A constant x gives a zero
     * z column, which the pseudo-inverse maps to a zero slope.
     */
    protected LinearEstimate normalEquation (Sample sample) {
        Standardizer std = new Standardizer (sample.getX());
        RealMatrix Z = MatrixSupport.vandermonde(std.apply(sample.getX()), 1);
        RealMatrix Zt = Z.transpose();
        double[] theta = MatrixSupport.pseudoInverse(Zt.multiply(Z))
            .operate(Zt.operate(sample.getY()));
        return std.restore(SolverType.NORMAL_EQUATION, theta[0], theta[1], 0);
    }

    /**
     * theta = V * diag(1/s) * U' * y
     */
    protected LinearEstimate svd (Sample sample) {
        RealMatrix X = MatrixSupport.vandermonde(sample.getX(), 1);
        double[] theta = MatrixSupport.pseudoInverse(X)
            .operate(sample.getY());
        return new LinearEstimate (SolverType.SVD, theta[0], theta[1]);
    }

    protected LinearEstimate qr (Sample sample) 
        throws NumericalFailureException {
        RealMatrix X = MatrixSupport.vandermonde(sample.getX(), 1);
        double[] theta = MatrixSupport.solveQR(X, sample.getY());
        return new LinearEstimate (SolverType.QR, theta[0], theta[1]);
    }

    /**
     * (X'X) * theta = X'y through an LU decomposition of X'X
     */
    protected LinearEstimate lu (Sample sample) 
        throws NumericalFailureException {
        RealMatrix X = MatrixSupport.vandermonde(sample.getX(), 1);
        RealMatrix Xt = X.transpose();
        RealMatrix A = Xt.multiply(X);
        DecompositionSolver solver = new LUDecomposition 
            (A, threshold (A.getNorm())).getSolver();
        if (!solver.isNonSingular()) {
            throw new NumericalFailureException 
                ("X'X is singular; x has no variance");
        }
        double[] theta = solver.solve
            (new ArrayRealVector (Xt.operate(sample.getY()), false)).toArray();
        return new LinearEstimate (SolverType.LU, theta[0], theta[1]);
    }

    /**
     * min ||yc - xc*w||^2 + alpha*w^2 over the centered sample, so the
     * intercept isn't penalized; solved as (xc'xc + alpha*I)w = xc'yc.
     */
    protected LinearEstimate ridge (Sample sample) 
        throws NumericalFailureException {
        double[] x = sample.getX(), y = sample.getY();
        double mx = StatUtils.mean(x), my = StatUtils.mean(y);

        double[][] xc = center (x, mx);
        double[] yc = new double[y.length];
        for (int i = 0; i < y.length; ++i)
            yc[i] = y[i] - my;

        RealMatrix Xc = MatrixUtils.createRealMatrix(xc);
        RealMatrix Xt = Xc.transpose();
        RealMatrix A = Xt.multiply(Xc).add
            (MatrixUtils.createRealIdentityMatrix(1)
             .scalarMultiply(config.getAlpha()));
        DecompositionSolver solver = new LUDecomposition 
            (A, threshold (StatUtils.sumSq(x))).getSolver();
        if (!solver.isNonSingular()) {
            throw new NumericalFailureException
                ("Ridge system is singular; x has no variance and alpha is "
                 +config.getAlpha());
        }
        double w = solver.solve
            (new ArrayRealVector (Xt.operate(yc), false)).getEntry(0);
        return new LinearEstimate (SolverType.RIDGE, my - w * mx, w);
    }

    protected LinearEstimate elasticNet (SolverType solver, Sample sample,
                                         double l1Ratio) 
        throws NumericalFailureException {
        double[] x = sample.getX(), y = sample.getY();
        double mx = StatUtils.mean(x), my = StatUtils.mean(y);

        double[] yc = new double[y.length];
        for (int i = 0; i < y.length; ++i)
            yc[i] = y[i] - my;

        double w = CoordinateDescent.solve
            (center (x, mx), yc, config.getAlpha(), l1Ratio)[0];
        return new LinearEstimate (solver, my - w * mx, w);
    }

    static double threshold (double scale) {
        return Math.max(PIVOT_TOLERANCE * scale, Double.MIN_NORMAL);
    }

    static double[][] center (double[] x, double mean) {
        double[][] xc = new double[x.length][1];
        for (int i = 0; i < x.length; ++i)
            xc[i][0] = x[i] - mean;
        return xc;
    }
}
