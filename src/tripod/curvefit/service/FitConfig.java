package tripod.curvefit.service;

import tripod.curvefit.solver.SolverConfig;

/**
 * Options of {@link ResultAggregator#fitAll}. Solvers are only run when
 * requested (or with -Dcurvefit.solvers=true).
 */
public class FitConfig {
    static final boolean INCLUDE_SOLVERS = Boolean.getBoolean("curvefit.solvers");

    private boolean includeSolvers = INCLUDE_SOLVERS;
    private SolverConfig solverConfig = new SolverConfig ();

    public FitConfig () {
    }

    public static FitConfig withAlpha (double alpha) {
        FitConfig config = new FitConfig ();
        config.solverConfig.setAlpha(alpha);
        return config;
    }

    /**
     * @param alpha regularization strength as typed by a user; anything
     *  that isn't a valid strength falls back to
     *  {@link SolverConfig#DEFAULT_ALPHA}
     */
    public static FitConfig withAlpha (String alpha) {
        FitConfig config = new FitConfig ();
        config.solverConfig.setAlpha(alpha);
        return config;
    }

    public FitConfig setIncludeSolvers (boolean includeSolvers) {
        this.includeSolvers = includeSolvers;
        return this;
    }
    public boolean isIncludeSolvers () { return includeSolvers; }

    public FitConfig setSolverConfig (SolverConfig solverConfig) {
        if (solverConfig == null) {
            throw new IllegalArgumentException ("No solver config given!");
        }
        this.solverConfig = solverConfig;
        return this;
    }
    public SolverConfig getSolverConfig () { return solverConfig; }

    public double getAlpha () { return solverConfig.getAlpha(); }

    public String toString () {
        return "FitConfig{includeSolvers="+includeSolvers
            +","+solverConfig+"}";
    }
}
