package tripod.curvefit.solver;

import tripod.curvefit.core.NumericalFailureException;

/**
 * Cyclic coordinate descent for the elastic net
 *
 *    min (1/2n)*||y - X*w||^2 + alpha*rho*||w||_1 
 *         + (alpha*(1-rho)/2)*||w||^2
 *
 * over centered X (n x p) and y, where rho is the L1 ratio. The lasso
 * is rho = 1. Each coordinate has the closed form update
 *
 *    w_j = S(x_j'r_j/n, alpha*rho) / (x_j'x_j/n + alpha*(1-rho))
 *
 * with S the soft threshold operator and r_j the residual without
 * feature j. A column without variance keeps a zero coefficient.
 */
class CoordinateDescent {
    static final int MAX_SWEEPS = 1000;
    static final double TOLERANCE = 1e-12;

    private CoordinateDescent () {}

    static double[] solve (double[][] X, double[] y, 
                           double alpha, double rho) 
        throws NumericalFailureException {
        int n = y.length, p = X[0].length;
        double[] w = new double[p];
        double[] r = (double[])y.clone(); // residual y - X*w

        double[] norms = new double[p];
        for (int j = 0; j < p; ++j) {
            for (int i = 0; i < n; ++i)
                norms[j] += X[i][j] * X[i][j];
            norms[j] /= n;
        }

        for (int sweep = 0; sweep < MAX_SWEEPS; ++sweep) {
            double maxDelta = 0., maxW = 0.;
            for (int j = 0; j < p; ++j) {
                double denom = norms[j] + alpha * (1. - rho);
                if (norms[j] == 0. || denom == 0.) {
                    continue;
                }

                double rho_j = 0.;
                for (int i = 0; i < n; ++i)
                    rho_j += X[i][j] * (r[i] + X[i][j] * w[j]);
                rho_j /= n;

                double wj = softThreshold (rho_j, alpha * rho) / denom;
                double delta = wj - w[j];
                if (delta != 0.) {
                    for (int i = 0; i < n; ++i)
                        r[i] -= X[i][j] * delta;
                    w[j] = wj;
                }
                maxDelta = Math.max(maxDelta, Math.abs(delta));
                maxW = Math.max(maxW, Math.abs(wj));
            }

            if (maxDelta <= TOLERANCE * Math.max(1., maxW)) {
                break;
            }
        }

        for (double v : w) {
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                throw new NumericalFailureException
                    ("Coordinate descent produced a non-finite coefficient");
            }
        }
        return w;
    }

    static double softThreshold (double v, double t) {
        if (v > t) return v - t;
        if (v < -t) return v + t;
        return 0.;
    }
}
