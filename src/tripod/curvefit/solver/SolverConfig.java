package tripod.curvefit.solver;

import java.util.logging.Logger;

/**
 * Hyperparameters of the solver suite. Every default can be overridden
 * with a system property, e.g., -Dcurvefit.alpha=0.5
 */
public class SolverConfig {
    private static final Logger logger = 
        Logger.getLogger(SolverConfig.class.getName());

    public static final double DEFAULT_ALPHA = 1.0;

    static final double ALPHA = 
        alphaProperty ("curvefit.alpha", DEFAULT_ALPHA);
    static final double L1_RATIO = 
        doubleProperty ("curvefit.l1ratio", 0.5);
    static final double GD_LEARNING_RATE = 
        doubleProperty ("curvefit.gd.rate", 0.1);
    static final int GD_ITERATIONS = 
        Integer.getInteger("curvefit.gd.iterations", 1000);
    static final double SGD_LEARNING_RATE = 
        doubleProperty ("curvefit.sgd.rate", 0.01);
    static final int SGD_MAX_EPOCHS = 
        Integer.getInteger("curvefit.sgd.epochs", 1000);
    static final double SGD_TOLERANCE = 
        doubleProperty ("curvefit.sgd.tolerance", 1e-12);
    static final long SGD_SEED = Long.getLong("curvefit.sgd.seed", 42l);

    // epochs without improvement before SGD stops
    public static final int SGD_NO_CHANGE_EPOCHS = 5;

    private double alpha = ALPHA;
    private double l1Ratio = L1_RATIO;
    private double learningRate = GD_LEARNING_RATE;
    private int iterations = GD_ITERATIONS;
    private double sgdLearningRate = SGD_LEARNING_RATE;
    private int sgdMaxEpochs = SGD_MAX_EPOCHS;
    private double sgdTolerance = SGD_TOLERANCE;
    private long sgdSeed = SGD_SEED;

    public SolverConfig () {
    }

    public SolverConfig (SolverConfig config) {
        alpha = config.alpha;
        l1Ratio = config.l1Ratio;
        learningRate = config.learningRate;
        iterations = config.iterations;
        sgdLearningRate = config.sgdLearningRate;
        sgdMaxEpochs = config.sgdMaxEpochs;
        sgdTolerance = config.sgdTolerance;
        sgdSeed = config.sgdSeed;
    }

    /**
     * Parse a regularization strength. Anything that isn't a finite,
     * non-negative number falls back to {@link #DEFAULT_ALPHA} so that
     * a bad value never fails a whole batch of fits.
     */
    public static double parseAlpha (String text) {
        if (text == null || text.trim().length() == 0) {
            return DEFAULT_ALPHA;
        }

        try {
            return checkAlpha (Double.parseDouble(text.trim()));
        }
        catch (NumberFormatException ex) {
            logger.warning("Invalid alpha \""+text+"\"; using "
                           +DEFAULT_ALPHA);
            return DEFAULT_ALPHA;
        }
    }

    static double checkAlpha (double alpha) {
        if (Double.isNaN(alpha) || Double.isInfinite(alpha) || alpha < 0.) {
            logger.warning("Invalid alpha "+alpha+"; using "+DEFAULT_ALPHA);
            return DEFAULT_ALPHA;
        }
        return alpha;
    }

    public SolverConfig setAlpha (double alpha) {
        this.alpha = checkAlpha (alpha);
        return this;
    }
    public SolverConfig setAlpha (String alpha) {
        this.alpha = parseAlpha (alpha);
        return this;
    }
    public double getAlpha () { return alpha; }

    /**
     * elastic net mix: 1 is pure L1 (lasso), 0 pure L2 (ridge)
     */
    public SolverConfig setL1Ratio (double l1Ratio) {
        if (!(l1Ratio >= 0. && l1Ratio <= 1.)) {
            throw new IllegalArgumentException
                ("l1Ratio must be within [0,1]: "+l1Ratio);
        }
        this.l1Ratio = l1Ratio;
        return this;
    }
    public double getL1Ratio () { return l1Ratio; }

    public SolverConfig setLearningRate (double learningRate) {
        if (!(learningRate > 0.)) {
            throw new IllegalArgumentException
                ("Learning rate must be > 0: "+learningRate);
        }
        this.learningRate = learningRate;
        return this;
    }
    public double getLearningRate () { return learningRate; }

    public SolverConfig setIterations (int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException
                ("Iterations must be >= 1: "+iterations);
        }
        this.iterations = iterations;
        return this;
    }
    public int getIterations () { return iterations; }

    public SolverConfig setSgdLearningRate (double sgdLearningRate) {
        if (!(sgdLearningRate > 0.)) {
            throw new IllegalArgumentException
                ("Learning rate must be > 0: "+sgdLearningRate);
        }
        this.sgdLearningRate = sgdLearningRate;
        return this;
    }
    public double getSgdLearningRate () { return sgdLearningRate; }

    public SolverConfig setSgdMaxEpochs (int sgdMaxEpochs) {
        if (sgdMaxEpochs < 1) {
            throw new IllegalArgumentException
                ("Epochs must be >= 1: "+sgdMaxEpochs);
        }
        this.sgdMaxEpochs = sgdMaxEpochs;
        return this;
    }
    public int getSgdMaxEpochs () { return sgdMaxEpochs; }

    public SolverConfig setSgdTolerance (double sgdTolerance) {
        this.sgdTolerance = sgdTolerance;
        return this;
    }
    public double getSgdTolerance () { return sgdTolerance; }

    public SolverConfig setSgdSeed (long sgdSeed) {
        this.sgdSeed = sgdSeed;
        return this;
    }
    public long getSgdSeed () { return sgdSeed; }

    static double doubleProperty (String name, double def) {
        String value = System.getProperty(name);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            }
            catch (NumberFormatException ex) {
                logger.warning("Bogus "+name+": "+value+"; using "+def);
            }
        }
        return def;
    }

    static double alphaProperty (String name, double def) {
        String value = System.getProperty(name);
        return value != null ? parseAlpha (value) : def;
    }

    public String toString () {
        return "SolverConfig{alpha="+alpha+",l1Ratio="+l1Ratio
            +",learningRate="+learningRate+",iterations="+iterations
            +",sgdLearningRate="+sgdLearningRate+",sgdMaxEpochs="
            +sgdMaxEpochs+",sgdTolerance="+sgdTolerance
            +",sgdSeed="+sgdSeed+"}";
    }
}
