package tripod.curvefit.solver;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CoordinateDescentTest {

    @Test
    void softThreshold () {
        assertEquals(2., CoordinateDescent.softThreshold(3., 1.));
        assertEquals(-2., CoordinateDescent.softThreshold(-3., 1.));
        assertEquals(0., CoordinateDescent.softThreshold(0.5, 1.));
        assertEquals(0., CoordinateDescent.softThreshold(-0.5, 1.));
    }

    @Test
    void zeroAlphaIsLeastSquares () throws Exception {
        // two centered, uncorrelated columns; y = 2*x1 - x2
        double[][] X = {{1, 1}, {-1, 1}, {1, -1}, {-1, -1}};
        double[] y = new double[4];
        for (int i = 0; i < 4; ++i)
            y[i] = 2 * X[i][0] - X[i][1];
        double[] w = CoordinateDescent.solve(X, y, 0., 1.);
        assertEquals(2., w[0], 1e-12);
        assertEquals(-1., w[1], 1e-12);
    }

    @Test
    void columnWithoutVarianceStaysZero () throws Exception {
        double[][] X = {{0}, {0}, {0}};
        double[] w = CoordinateDescent.solve(X, new double[]{1, -1, 0}, 0., 1.);
        assertEquals(0., w[0]);
    }
}
