package tripod.curvefit.core;

import org.apache.commons.math3.stat.StatUtils;

public class MetricsEvaluator {
    private MetricsEvaluator () {}

    /**
     * Compute R^2, MSE and RMSE of yPred against yTrue:
     *
     *    MSE  = mean((yTrue - yPred)^2)
     *    RMSE = sqrt(MSE)
     *    R^2  = 1 - SS_res/SS_tot
     *
     * When yTrue is constant (SS_tot = 0) R^2 is defined as 0.
     */
    public static Metrics evaluate (double[] yTrue, double[] yPred) {
        if (yTrue == null || yPred == null) {
            throw new IllegalArgumentException ("No values to evaluate!");
        }
        if (yTrue.length != yPred.length) {
            throw new IllegalArgumentException
                ("Length mismatch: "+yTrue.length+" observed vs "
                 +yPred.length+" predicted!");
        }
        if (yTrue.length == 0) {
            throw new IllegalArgumentException ("No values to evaluate!");
        }

        double mean = StatUtils.mean(yTrue);
        double ssRes = 0., ssTot = 0.;
        for (int i = 0; i < yTrue.length; ++i) {
            double r = yTrue[i] - yPred[i];
            double d = yTrue[i] - mean;
            ssRes += r*r;
            ssTot += d*d;
        }

        double mse = ssRes / yTrue.length;
        double r2 = ssTot == 0. ? 0. : 1. - ssRes/ssTot;
        return new Metrics (r2, mse, Math.sqrt(mse));
    }
}
