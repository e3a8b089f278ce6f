package tripod.curvefit.core;

/**
 * Key of a {@link FitResult} within a {@link ResultSet}; implemented by
 * the model families and by the alternative linear solvers.
 */
public interface ModelId {
    String getId (); // stable machine name, e.g., "exponential"
    String getLabel (); // display name
}
