package tripod.curvefit.solver;

/**
 * Intercept and slope of a straight line as found by one solver.
 */
public class LinearEstimate {
    private final SolverType solver;
    private final double intercept;
    private final double slope;
    private final int iterations; // 0 for direct methods

    public LinearEstimate (SolverType solver, double intercept, double slope) {
        this (solver, intercept, slope, 0);
    }

    public LinearEstimate (SolverType solver, double intercept, 
                           double slope, int iterations) {
        this.solver = solver;
        this.intercept = intercept;
        this.slope = slope;
        this.iterations = iterations;
    }

    public SolverType getSolver () { return solver; }
    public double getIntercept () { return intercept; }
    public double getSlope () { return slope; }
    public int getIterations () { return iterations; }

    public double[] coefficients () {
        return new double[]{intercept, slope};
    }

    public String toString () {
        return "LinearEstimate{"+solver.getId()
            +",intercept="+String.format("%1$.6f", intercept)
            +",slope="+String.format("%1$.6f", slope)
            +(iterations > 0 ? ",iterations="+iterations : "")+"}";
    }
}
