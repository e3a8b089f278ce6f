package tripod.curvefit.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsEvaluatorTest {
    static final double EPS = 1e-12;

    @Test
    void perfectPrediction () {
        Metrics m = MetricsEvaluator.evaluate(new double[]{1, 2, 3}, 
                                              new double[]{1, 2, 3});
        assertEquals(1., m.getR2(), EPS);
        assertEquals(0., m.getMse(), EPS);
        assertEquals(0., m.getRmse(), EPS);
    }

    @Test
    void residualsAgainstMean () {
        Metrics m = MetricsEvaluator.evaluate(new double[]{1, 2, 3}, 
                                              new double[]{1, 2, 4});
        assertEquals(1./3, m.getMse(), EPS);
        assertEquals(Math.sqrt(1./3), m.getRmse(), EPS);
        assertEquals(0.5, m.getR2(), EPS); // 1 - 1/2
    }

    @Test
    void worseThanMeanGivesNegativeR2 () {
        Metrics m = MetricsEvaluator.evaluate(new double[]{1, 2, 3}, 
                                              new double[]{3, 2, 1});
        assertEquals(-3., m.getR2(), EPS); // 1 - 8/2
    }

    @Test
    void constantObservationsHaveZeroR2 () {
        Metrics m = MetricsEvaluator.evaluate(new double[]{4, 4, 4}, 
                                              new double[]{4, 4, 5});
        assertEquals(0., m.getR2());
        assertEquals(1./3, m.getMse(), EPS);

        Metrics exact = MetricsEvaluator.evaluate(new double[]{4, 4}, 
                                                  new double[]{4, 4});
        assertEquals(0., exact.getR2());
        assertFalse(Double.isNaN(exact.getR2()));
    }

    @Test
    void singleValueIsAllowed () {
        Metrics m = MetricsEvaluator.evaluate(new double[]{2}, 
                                              new double[]{5});
        assertEquals(9., m.getMse(), EPS);
        assertEquals(3., m.getRmse(), EPS);
        assertEquals(0., m.getR2());
    }

    @Test
    void invalidInput () {
        assertThrows(IllegalArgumentException.class, 
                     () -> MetricsEvaluator.evaluate(new double[]{1, 2}, 
                                                     new double[]{1}));
        assertThrows(IllegalArgumentException.class, 
                     () -> MetricsEvaluator.evaluate(new double[0], 
                                                     new double[0]));
        assertThrows(IllegalArgumentException.class, 
                     () -> MetricsEvaluator.evaluate(null, new double[]{1}));
    }
}
