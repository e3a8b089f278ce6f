package tripod.curvefit.core;

/**
 * Scores a model by the root mean square error of its predictions.
 */
public class RmseFitScore implements FitScore {
    public RmseFitScore () {
    }

    public double eval (FitModel model) {
        return model.getMetrics().getRmse();
    }
}
