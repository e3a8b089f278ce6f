package tripod.curvefit.core;

/**
 * Goodness-of-fit of a prediction against observed values.
 */
public class Metrics {
    public static final String R2 = "r2";
    public static final String MSE = "mse";
    public static final String RMSE = "rmse";

    private final double r2;
    private final double mse;
    private final double rmse;

    Metrics (double r2, double mse, double rmse) {
        this.r2 = r2;
        this.mse = mse;
        this.rmse = rmse;
    }

    public double getR2 () { return r2; }
    public double getMse () { return mse; }
    public double getRmse () { return rmse; }

    public boolean isFinite () {
        return !Double.isNaN(r2) && !Double.isInfinite(r2)
            && !Double.isNaN(mse) && !Double.isInfinite(mse);
    }

    public String toString () {
        return "Metrics{R^2="+String.format("%1$.5f", r2)
            +",MSE="+String.format("%1$.5f", mse)
            +",RMSE="+String.format("%1$.5f", rmse)+"}";
    }
}
