package tripod.curvefit.core;

/**
 * Outcome of fitting one model (or running one solver) over a sample:
 * either a fitted model, an inapplicable marker when the sample violates
 * the model's domain, or a numerical failure. The two non-fitted outcomes
 * keep the reason.
 */
public class FitResult {
    public enum Status {
        FITTED,
        INAPPLICABLE, // domain precondition violated; not an error
        FAILED // singular system or non-finite output
    }

    private final ModelId model;
    private final Status status;
    private final FitModel fit;
    private final String reason;

    FitResult (ModelId model, Status status, FitModel fit, String reason) {
        if (model == null) {
            throw new IllegalArgumentException ("No model id given!");
        }
        this.model = model;
        this.status = status;
        this.fit = fit;
        this.reason = reason;
    }

    public static FitResult fitted (ModelId model, FitModel fit) {
        if (fit == null) {
            throw new IllegalArgumentException
                ("A fitted result requires a model!");
        }
        return new FitResult (model, Status.FITTED, fit, null);
    }

    public static FitResult inapplicable (ModelId model, String reason) {
        return new FitResult (model, Status.INAPPLICABLE, null, reason);
    }

    public static FitResult failed (ModelId model, String reason) {
        return new FitResult (model, Status.FAILED, null, reason);
    }

    public ModelId getModelId () { return model; }
    public Status getStatus () { return status; }
    public boolean isFitted () { return status == Status.FITTED; }

    /**
     * the fitted model; null unless {@link #isFitted()}
     */
    public FitModel getFit () { return fit; }

    /**
     * why there's no fit; null for a fitted result
     */
    public String getReason () { return reason; }

    public String toString () {
        StringBuilder sb = new StringBuilder ("FitResult{");
        sb.append(model.getId()+","+status);
        if (fit != null) {
            sb.append(","+fit.getFormula()+","+fit.getMetrics());
        }
        else if (reason != null) {
            sb.append(",reason="+reason);
        }
        sb.append("}");
        return sb.toString();
    }
}
