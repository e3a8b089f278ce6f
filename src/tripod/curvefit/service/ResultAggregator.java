package tripod.curvefit.service;

import java.io.*;
import java.util.List;
import java.util.logging.Logger;
import java.util.logging.Level;

import tripod.curvefit.core.*;
import tripod.curvefit.solver.SolverSuite;
import tripod.curvefit.solver.SolverType;

/**
 * Fits every model family (and optionally every linear solver) to a
 * sample and collects the outcomes in a new {@link ResultSet}. Models
 * whose domain the sample violates are tagged inapplicable and solvers
 * that break down are tagged failed; neither stops the batch. Nothing
 * is kept between calls.
 */
public class ResultAggregator {
    private static final Logger logger = 
        Logger.getLogger(ResultAggregator.class.getName());

    private final Estimator estimator;

    public ResultAggregator () {
        this (new LeastSquaresEstimator ());
    }

    public ResultAggregator (Estimator estimator) {
        if (estimator == null) {
            throw new IllegalArgumentException ("No estimator given!");
        }
        this.estimator = estimator;
    }

    /**
     * @throws IllegalArgumentException if x and y differ in length or
     *  have fewer than 2 values; no model is fit in that case
     */
    public ResultSet fitAll (double[] x, double[] y, FitConfig config) {
        return fitAll (new Sample (x, y), config);
    }

    public ResultSet fitAll (String xText, String yText, FitConfig config) 
        throws NumberParseException {
        return fitAll (Sample.parse(xText, yText), config);
    }

    public ResultSet fitAll (Sample sample, FitConfig config) {
        if (config == null) {
            config = new FitConfig ();
        }

        ResultSet.Builder builder = ResultSet.builder();
        for (ModelFamily family : ModelFamily.values()) {
            builder.add(estimator.estimate(family, sample));
        }

        if (config.isIncludeSolvers()) {
            SolverSuite suite = new SolverSuite (config.getSolverConfig());
            for (SolverType solver : SolverType.values()) {
                builder.add(suite.estimate(solver, sample));
            }
        }

        ResultSet results = builder.build();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(sample+": "+results.results(FitResult.Status.FITTED)
                        .size()+"/"+results.size()+" model(s) fitted");
        }
        return results;
    }

    public static void main (String[] argv) throws Exception {
        SampleReader reader;
        if (argv.length == 0) {
            logger.info("Reading from stdin...");
            reader = new SampleReader (System.in);
        }
        else {
            logger.info("Reading from \""+argv[0]+"\"...");
            reader = new SampleReader (new FileInputStream (argv[0]));
        }

        FitConfig config = new FitConfig ();
        if (argv.length > 1) {
            config = FitConfig.withAlpha(argv[1]).setIncludeSolvers(true);
        }

        ResultAggregator aggregator = new ResultAggregator ();
        ModelRanker ranker = new ModelRanker ();
        try {
            for (Sample sample; (sample = reader.read()) != null; ) {
                ResultSet results = aggregator.fitAll(sample, config);
                System.out.println(sample+": "+results);

                List<FitResult> ranked = ranker.rank(results);
                if (ranked.isEmpty()) {
                    System.out.println("No model could be fit!");
                }
                else {
                    FitResult best = ranked.get(0);
                    System.out.println("Best: "+best.getModelId().getLabel()
                                       +"  "+best.getFit().getFormula()
                                       +"  "+best.getFit().getMetrics());
                }
            }
        }
        finally {
            reader.close();
        }
    }
}
