package tripod.curvefit.core;

/**
 * A fit couldn't produce a finite answer: the system was singular or
 * ill-conditioned, or an iterative method diverged.
 */
public class NumericalFailureException extends Exception {
    private static final long serialVersionUID = 0x51a2c3e4d0f97b08l;

    public NumericalFailureException (String message) {
        super (message);
    }

    public NumericalFailureException (String message, Throwable cause) {
        super (message, cause);
    }
}
