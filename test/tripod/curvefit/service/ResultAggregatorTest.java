package tripod.curvefit.service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tripod.curvefit.core.*;
import tripod.curvefit.solver.SolverConfig;
import tripod.curvefit.solver.SolverType;

import static org.junit.jupiter.api.Assertions.*;

public class ResultAggregatorTest {
    static final double[] X = {1, 2, 3, 4, 5};

    final ResultAggregator aggregator = new ResultAggregator ();
    final ModelRanker ranker = new ModelRanker ();

    static double[] exponential (double a, double b) {
        double[] y = new double[X.length];
        for (int i = 0; i < X.length; ++i)
            y[i] = a * Math.exp(b * X[i]);
        return y;
    }

    @Nested
    @DisplayName("model families")
    class Families {
        @Test
        void everyFamilyHasAnEntry () {
            ResultSet results = aggregator.fitAll
                (X, new double[]{5, 8, 11, 14, 17}, new FitConfig ());
            assertEquals(ModelFamily.values().length, results.size());
            for (ModelFamily family : ModelFamily.values()) {
                assertNotNull(results.get(family), family.getId());
            }
            assertTrue(results.get(ModelFamily.LINEAR).isFitted());
        }

        @Test
        void nonPositiveYMarksExponentialInapplicable () {
            ResultSet results = aggregator.fitAll
                (X, new double[]{1, -2, 3, 4, 5}, new FitConfig ());
            assertEquals(FitResult.Status.INAPPLICABLE, 
                         results.get(ModelFamily.EXPONENTIAL).getStatus());
            assertEquals(FitResult.Status.INAPPLICABLE, 
                         results.get(ModelFamily.POWER).getStatus());
            assertTrue(results.get(ModelFamily.LOGARITHMIC).isFitted());
            assertTrue(results.get(ModelFamily.QUADRATIC).isFitted());
        }

        @Test
        void nonPositiveXMarksPowerAndLogarithmicInapplicable () {
            ResultSet results = aggregator.fitAll
                (new double[]{0, 1, 2, 3, 4}, new double[]{1, 2, 3, 4, 5}, 
                 new FitConfig ());
            assertEquals(FitResult.Status.INAPPLICABLE, 
                         results.get(ModelFamily.POWER).getStatus());
            assertEquals(FitResult.Status.INAPPLICABLE, 
                         results.get(ModelFamily.LOGARITHMIC).getStatus());
            assertTrue(results.get(ModelFamily.EXPONENTIAL).isFitted());
        }

        @Test
        void twoPairsStillFitEveryApplicableFamily () {
            ResultSet results = aggregator.fitAll
                (new double[]{1, 2}, new double[]{2, 4}, null);
            assertEquals(ModelFamily.values().length, results.size());
            assertTrue(results.get(ModelFamily.LINEAR).isFitted());
            assertTrue(results.get(ModelFamily.POWER).isFitted());
            assertEquals(FitResult.Status.INAPPLICABLE, 
                         results.get(ModelFamily.QUADRATIC).getStatus());
        }

        @Test
        void bestModelMatchesTheGeneratingCurve () {
            ResultSet results = aggregator.fitAll
                (X, exponential (2., 0.5), new FitConfig ());
            FitResult best = ranker.best(results);
            assertSame(ModelFamily.EXPONENTIAL, best.getModelId());
            assertEquals(2., best.getFit().getVariable("a").getValue(), 1e-9);
        }
    }

    @Nested
    @DisplayName("solver suite")
    class Solvers {
        @Test
        void everySolverHasAnEntryAfterTheFamilies () {
            ResultSet results = aggregator.fitAll
                (X, new double[]{2.1, 4.2, 6.1, 8.2, 10.0}, 
                 new FitConfig ().setIncludeSolvers(true));
            assertEquals(ModelFamily.values().length 
                         + SolverType.values().length, results.size());
            assertSame(ModelFamily.LINEAR, results.models().get(0));
            assertSame(SolverType.OLS, 
                       results.models().get(ModelFamily.values().length));
            for (SolverType solver : SolverType.values()) {
                assertTrue(results.get(solver).isFitted(), solver.getId());
            }
        }

        @Test
        void failedSolversDoNotAbortTheBatch () {
            ResultSet results = aggregator.fitAll
                (new double[]{2, 2, 2}, new double[]{1, 2, 3}, 
                 new FitConfig ().setIncludeSolvers(true));
            assertTrue(results.get(ModelFamily.LINEAR).isFitted());
            assertEquals(FitResult.Status.FAILED, 
                         results.get(SolverType.LU).getStatus());
            assertEquals(FitResult.Status.FAILED, 
                         results.get(SolverType.QR).getStatus());
            assertTrue(results.get(SolverType.BATCH_GRADIENT_DESCENT).isFitted());

            FitResult best = ranker.best(results);
            assertNotNull(best);
            assertTrue(best.isFitted());
        }

        @Test
        void invalidAlphaFallsBackToDefault () {
            FitConfig config = FitConfig.withAlpha("oops").setIncludeSolvers(true);
            assertEquals(SolverConfig.DEFAULT_ALPHA, config.getAlpha());

            ResultSet results = aggregator.fitAll
                (X, new double[]{5, 8, 11, 14, 17}, config);
            FitResult ridge = results.get(SolverType.RIDGE);
            assertTrue(ridge.isFitted());
            assertEquals(30./11, ridge.getFit().getVariable("slope").getValue(), 
                         1e-12);
        }

        @Test
        void ridgeWithoutPenaltyMatchesLinearFamily () {
            FitConfig config = FitConfig.withAlpha(0.).setIncludeSolvers(true);
            ResultSet results = aggregator.fitAll
                (X, new double[]{2.1, 4.2, 6.1, 8.2, 10.0}, config);
            FitResult linear = results.get(ModelFamily.LINEAR);
            FitResult ridge = results.get(SolverType.RIDGE);
            assertEquals(linear.getFit().getMetrics().getRmse(),
                         ridge.getFit().getMetrics().getRmse(), 1e-9);
        }
    }

    @Test
    void invalidSamplesAreRejectedUpFront () {
        assertThrows(IllegalArgumentException.class, () -> aggregator.fitAll
                     (new double[]{1, 2, 3}, new double[]{1, 2}, new FitConfig ()));
        assertThrows(IllegalArgumentException.class, () -> aggregator.fitAll
                     (new double[]{1}, new double[]{1}, new FitConfig ()));
        assertThrows(IllegalArgumentException.class, () -> aggregator.fitAll
                     (new double[]{1, 2, 3}, new double[]{1, Double.NaN, 3}, 
                      new FitConfig ().setIncludeSolvers(true)));
    }

    @Test
    void textInputIsParsedFirst () throws Exception {
        ResultSet results = aggregator.fitAll
            ("1, 2\n3 4 5", "5;8;11;14;17", new FitConfig ());
        FitModel linear = results.get(ModelFamily.LINEAR).getFit();
        assertEquals(3., linear.getVariable("slope").getValue(), 1e-9);

        NumberParseException ex = assertThrows
            (NumberParseException.class, 
             () -> aggregator.fitAll("1 2 3", "1 two 3", new FitConfig ()));
        assertEquals("two", ex.getToken());
    }

    @Test
    void eachCallBuildsAFreshResultSet () {
        double[] y = {5, 8, 11, 14, 17};
        ResultSet first = aggregator.fitAll(X, y, new FitConfig ());
        ResultSet second = aggregator.fitAll
            (X, new double[]{1, -2, 3, 4, 5}, new FitConfig ());
        assertNotSame(first, second);
        assertTrue(first.get(ModelFamily.EXPONENTIAL).isFitted());
        assertFalse(second.get(ModelFamily.EXPONENTIAL).isFitted());
        assertEquals(2., first.get(ModelFamily.LINEAR).getFit()
                     .getVariable("intercept").getValue(), 1e-9);
    }

    @Test
    void mainPrintsResultsAndBestModel () throws Exception {
        InputStream in = System.in;
        PrintStream out = System.out;
        ByteArrayOutputStream buf = new ByteArrayOutputStream ();
        try {
            System.setIn(new ByteArrayInputStream 
                         ("1 2 3 4 5\n5 8 11 14 17\n".getBytes("UTF-8")));
            System.setOut(new PrintStream (buf, true, "UTF-8"));
            ResultAggregator.main(new String[0]);
        }
        finally {
            System.setIn(in);
            System.setOut(out);
        }
        String printed = buf.toString("UTF-8");
        assertTrue(printed.contains("Best: "), printed);
        assertTrue(printed.contains("exponential"), printed);
    }
}
