package tripod.curvefit.core;

public interface Estimator {
    /**
     * Fit the given model family to the sample. The result is never
     * null: a sample outside the family's domain yields an inapplicable
     * result and a singular or non-finite fit a failed one.
     */
    FitResult estimate (ModelFamily family, Sample sample); 
}
