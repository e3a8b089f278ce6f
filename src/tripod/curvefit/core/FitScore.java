package tripod.curvefit.core;

/**
 * An interface for scoring a FitModel; lower scores are better fits.
 */
public interface FitScore {
    double eval (FitModel model);
}
