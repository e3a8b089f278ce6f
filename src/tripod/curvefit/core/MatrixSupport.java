package tripod.curvefit.core;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Least squares building blocks shared by the estimators and solvers.
 */
public class MatrixSupport {
    // |R_jj| below this fraction of the largest diagonal entry is singular
    static final double RANK_TOLERANCE = 1e-10;

    private MatrixSupport () {}

    /**
     * Design matrix with columns 1, x, x^2, ..., x^degree.
     */
    public static RealMatrix vandermonde (double[] x, int degree) {
        double[][] d = new double[x.length][degree+1];
        for (int i = 0; i < x.length; ++i) {
            double v = 1.;
            for (int j = 0; j <= degree; ++j) {
                d[i][j] = v;
                v *= x[i];
            }
        }
        return MatrixUtils.createRealMatrix(d);
    }

    /**
     * Solve X*theta = y in the least squares sense with a Householder
     * QR decomposition of X followed by back substitution of
     * R*theta = Q^T*y. X must have at least as many rows as columns.
     */
    public static double[] solveQR (RealMatrix X, double[] y) 
        throws NumericalFailureException {
        int m = X.getRowDimension(), n = X.getColumnDimension();
        if (m < n) {
            throw new NumericalFailureException
                ("Under-determined system: "+m+" rows for "+n+" unknowns");
        }

        QRDecomposition qr = new QRDecomposition (X);
        RealMatrix R = qr.getR();
        double[] qty = qr.getQT().operate(y);

        double max = 0.;
        for (int j = 0; j < n; ++j)
            max = Math.max(max, Math.abs(R.getEntry(j, j)));

        double[] theta = new double[n];
        for (int j = n - 1; j >= 0; --j) {
            double rjj = R.getEntry(j, j);
            if (!(Math.abs(rjj) > RANK_TOLERANCE * max)) {
                throw new NumericalFailureException
                    ("Rank deficient design matrix; R["+j+","+j+"]="+rjj);
            }
            double s = qty[j];
            for (int k = j + 1; k < n; ++k)
                s -= R.getEntry(j, k) * theta[k];
            theta[j] = s / rjj;
        }
        return checkFinite (theta);
    }

    /**
     * Moore-Penrose pseudo-inverse through the (one-sided Golub-Kahan)
     * singular value decomposition of A itself, so the conditioning of
     * A isn't squared. Singular values at or below
     * max(m,n) * s_max * ulp(1) are treated as zero.
     */
    public static RealMatrix pseudoInverse (RealMatrix A) {
        SingularValueDecomposition svd = new SingularValueDecomposition (A);
        double[] s = svd.getSingularValues();
        RealMatrix U = svd.getU();
        RealMatrix V = svd.getV();

        int m = A.getRowDimension(), n = A.getColumnDimension();
        double tol = cutoff (s, m, n);

        double[][] pinv = new double[n][m];
        for (int k = 0; k < s.length; ++k) {
            if (s[k] <= tol) 
                continue;
            double inv = 1. / s[k];
            for (int i = 0; i < n; ++i) {
                double vik = V.getEntry(i, k) * inv;
                for (int j = 0; j < m; ++j)
                    pinv[i][j] += vik * U.getEntry(j, k);
            }
        }
        return MatrixUtils.createRealMatrix(pinv);
    }

    static double cutoff (double[] s, int m, int n) {
        double max = 0.;
        for (double v : s)
            max = Math.max(max, v);
        return Math.max(m, n) * max * Math.ulp(1.);
    }

    public static double[] checkFinite (double[] values) 
        throws NumericalFailureException {
        for (int i = 0; i < values.length; ++i) {
            if (Double.isNaN(values[i]) || Double.isInfinite(values[i])) {
                throw new NumericalFailureException
                    ("Non-finite estimate at position "+i+": "+values[i]);
            }
        }
        return values;
    }
}
