package tripod.curvefit.solver;

import java.util.Random;
import java.util.logging.Logger;
import java.util.logging.Level;

import tripod.curvefit.core.NumericalFailureException;
import tripod.curvefit.core.Sample;

/**
 * Iterative minimizers of the squared error of y = b + w*z over the
 * standardized x (z). Both run a budget fixed up front; the result is
 * mapped back to the original x scale.
 */
class GradientDescent {
    private static final Logger logger = 
        Logger.getLogger(GradientDescent.class.getName());

    // epoch loss above this multiple of the starting loss is divergence
    static final double DIVERGENCE_RATIO = 10.;

    private GradientDescent () {}

    /**
     * Full-batch descent on the mean squared error for exactly
     * config.getIterations() steps; there is no convergence test.
     */
    static LinearEstimate batch (Sample sample, SolverConfig config) 
        throws NumericalFailureException {
        Standardizer std = new Standardizer (sample.getX());
        double[] z = std.apply(sample.getX());
        double[] y = sample.getY();
        int n = y.length;
        double rate = config.getLearningRate();

        double w = 0., b = 0.;
        for (int it = 0; it < config.getIterations(); ++it) {
            double gw = 0., gb = 0.;
            for (int i = 0; i < n; ++i) {
                double err = b + w * z[i] - y[i];
                gw += err * z[i];
                gb += err;
            }
            w -= rate * 2. * gw / n;
            b -= rate * 2. * gb / n;

            if (!isFinite (w) || !isFinite (b)) {
                throw new NumericalFailureException
                    ("Batch gradient descent diverged at iteration "+it
                     +" with learning rate "+rate);
            }
        }

        return std.restore(SolverType.BATCH_GRADIENT_DESCENT, 
                           b, w, config.getIterations());
    }

    /**
     * Per-sample descent on the squared loss with a constant learning
     * rate. Samples are visited in an order shuffled every epoch by a
     * generator seeded from the config, so runs are reproducible. Stops
     * after config.getSgdMaxEpochs() epochs or once the epoch loss has
     * stayed within the tolerance of the best loss for
     * {@link SolverConfig#SGD_NO_CHANGE_EPOCHS} epochs in a row. A loss
     * that climbs past {@link #DIVERGENCE_RATIO} times the starting
     * loss is reported as divergence.
     */
    static LinearEstimate stochastic (Sample sample, SolverConfig config) 
        throws NumericalFailureException {
        Standardizer std = new Standardizer (sample.getX());
        double[] z = std.apply(sample.getX());
        double[] y = sample.getY();
        int n = y.length;
        double rate = config.getSgdLearningRate();
        double tol = config.getSgdTolerance();
        Random rand = new Random (config.getSgdSeed());

        int[] order = new int[n];
        for (int i = 0; i < n; ++i)
            order[i] = i;

        double w = 0., b = 0.;
        // loss of the starting point; a stable run never climbs back above it
        double start = loss (z, y, b, w);
        double best = start;
        int noChange = 0, epoch = 0;
        while (epoch < config.getSgdMaxEpochs()) {
            shuffle (order, rand);
            for (int k = 0; k < n; ++k) {
                int i = order[k];
                double err = b + w * z[i] - y[i];
                w -= rate * err * z[i];
                b -= rate * err;
            }
            ++epoch;

            double loss = loss (z, y, b, w);
            if (!isFinite (loss) || !isFinite (w) || !isFinite (b)
                || loss > DIVERGENCE_RATIO * start) {
                throw new NumericalFailureException
                    ("Stochastic gradient descent diverged at epoch "
                     +epoch+" with learning rate "+rate+"; loss="+loss);
            }

            if (loss < best - tol) {
                best = loss;
                noChange = 0;
            }
            else if (loss <= best + tol) {
                if (++noChange >= SolverConfig.SGD_NO_CHANGE_EPOCHS) {
                    break;
                }
            }
            else {
                noChange = 0; // worse than the best so far; keep going
            }
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("SGD stopped after "+epoch+" epoch(s); loss="+best);
        }
        return std.restore(SolverType.STOCHASTIC_GRADIENT_DESCENT, 
                           b, w, epoch);
    }

    // half the mean squared error
    static double loss (double[] z, double[] y, double b, double w) {
        double sum = 0.;
        for (int i = 0; i < y.length; ++i) {
            double err = b + w * z[i] - y[i];
            sum += err * err;
        }
        return sum / (2. * y.length);
    }

    static void shuffle (int[] order, Random rand) {
        for (int i = order.length - 1; i > 0; --i) {
            int j = rand.nextInt(i + 1);
            int t = order[i];
            order[i] = order[j];
            order[j] = t;
        }
    }

    static boolean isFinite (double v) {
        return !Double.isNaN(v) && !Double.isInfinite(v);
    }
}
