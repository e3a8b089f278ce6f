package tripod.curvefit.core;

import java.util.Locale;

/**
 * Model shapes supported by {@link LeastSquaresEstimator}.
 */
public enum ModelFamily implements ModelId {
    LINEAR ("linear", "Linear: y = a + b*x", "intercept", "slope"),
    EXPONENTIAL ("exponential", "Exponential: y = a*e^(b*x)", "a", "b"),
    POWER ("power", "Power: y = a*x^b", "a", "b"),
    LOGARITHMIC ("logarithmic", "Logarithmic: y = a + b*ln(x)", "a", "b"),
    QUADRATIC ("quadratic", "Quadratic: y = a + b*x + c*x^2", "a", "b", "c");

    private final String id;
    private final String label;
    private final String[] params;

    ModelFamily (String id, String label, String... params) {
        this.id = id;
        this.label = label;
        this.params = params;
    }

    public String getId () { return id; }
    public String getLabel () { return label; }

    public int getNumParams () { return params.length; }
    public String getParamName (int n) { return params[n]; }

    /**
     * Evaluate this shape at x with the parameters in the order given
     * by {@link #getParamName(int)}.
     */
    public double evaluate (double[] p, double x) {
        switch (this) {
        case LINEAR: return p[0] + p[1] * x;
        case EXPONENTIAL: return p[0] * Math.exp(p[1] * x);
        case POWER: return p[0] * Math.pow(x, p[1]);
        case LOGARITHMIC: return p[0] + p[1] * Math.log(x);
        case QUADRATIC: return p[0] + p[1] * x + p[2] * x * x;
        }
        throw new IllegalStateException ("Unknown model family: "+this);
    }

    public String formula (double[] p) {
        switch (this) {
        case LINEAR:
            return "y = "+fmt (p[0])+term (p[1], "x");
        case EXPONENTIAL:
            return "y = "+fmt (p[0])+" * e^("+fmt (p[1])+"x)";
        case POWER:
            return "y = "+fmt (p[0])+" * x^"+fmt (p[1]);
        case LOGARITHMIC:
            return "y = "+fmt (p[0])+term (p[1], " ln(x)");
        case QUADRATIC:
            return "y = "+fmt (p[0])+term (p[1], "x")+term (p[2], "x^2");
        }
        throw new IllegalStateException ("Unknown model family: "+this);
    }

    static String term (double coef, String var) {
        return (coef < 0 ? " - " : " + ")+fmt (Math.abs(coef))+var;
    }

    static String fmt (double v) {
        return String.format(Locale.US, "%1$.4f", v);
    }
}
