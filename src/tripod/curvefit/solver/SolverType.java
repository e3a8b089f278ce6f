package tripod.curvefit.solver;

import tripod.curvefit.core.ModelId;

/**
 * Alternative ways of estimating intercept and slope of
 * y = intercept + slope*x. The exact methods agree to within floating
 * point error; the iterative ones converge to the same line and the
 * regularized ones coincide with it when alpha is 0.
 */
public enum SolverType implements ModelId {
    OLS ("ols", "Least squares (SimpleRegression)"),
    NORMAL_EQUATION ("normal_equation", "Normal equation"),
    SVD ("svd", "Singular value decomposition"),
    QR ("qr", "QR decomposition"),
    LU ("lu", "LU on normal equations"),
    BATCH_GRADIENT_DESCENT ("batch_gd", "Batch gradient descent"),
    STOCHASTIC_GRADIENT_DESCENT ("sgd", "Stochastic gradient descent"),
    RIDGE ("ridge", "Ridge"),
    LASSO ("lasso", "Lasso"),
    ELASTIC_NET ("elastic_net", "Elastic net");

    private final String id;
    private final String label;

    SolverType (String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String getId () { return id; }
    public String getLabel () { return label; }

    public boolean isRegularized () {
        return this == RIDGE || this == LASSO || this == ELASTIC_NET;
    }

    public boolean isIterative () {
        return this == BATCH_GRADIENT_DESCENT 
            || this == STOCHASTIC_GRADIENT_DESCENT;
    }
}
