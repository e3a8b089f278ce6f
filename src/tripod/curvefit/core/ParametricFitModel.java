package tripod.curvefit.core;

/**
 * A {@link FitModel} whose curve is one of the {@link ModelFamily}
 * shapes evaluated with a fixed parameter vector.
 */
public class ParametricFitModel implements FitModel {
    final ModelFamily family;
    final Object modelObj;
    final double[] coefs;
    final double[] predicted;
    final Metrics stats;
    final Variable[] params;
    final Variable[] metrics = new Variable[3];

    /**
     * @param family shape of the curve
     * @param coefs parameters in the order of the family's names
     * @param sample the fitted sample; used to predict and score
     * @param modelObj whatever produced the parameters (may be null)
     */
    public ParametricFitModel (ModelFamily family, double[] coefs, 
                               Sample sample, Object modelObj) {
        if (coefs.length != family.getNumParams()) {
            throw new IllegalArgumentException
                (family+" expects "+family.getNumParams()
                 +" parameters but got "+coefs.length);
        }
        this.family = family;
        this.modelObj = modelObj;
        this.coefs = (double[])coefs.clone();

        params = new Variable[coefs.length];
        for (int i = 0; i < coefs.length; ++i) {
            params[i] = new Variable (family.getParamName(i), coefs[i]);
        }

        predicted = new double[sample.size()];
        for (int i = 0; i < predicted.length; ++i) {
            predicted[i] = family.evaluate(this.coefs, sample.getX(i));
        }

        stats = MetricsEvaluator.evaluate(sample.getY(), predicted);
        metrics[0] = new Variable (Metrics.R2, stats.getR2());
        metrics[1] = new Variable (Metrics.MSE, stats.getMse());
        metrics[2] = new Variable (Metrics.RMSE, stats.getRmse());
    }

    public Variable getVariable (String name) {
        for (Variable v : params) {
            if (name.equals(v.name))
                return v;
        }
        for (Variable v : metrics) {
            if (name.equals(v.name))
                return v;
        }
        return null;
    }

    public Object getModelObj () { return modelObj; }
    public ModelFamily getFamily () { return family; }

    public int getNumParams () { return params.length; }
    public Variable getParam (int n) { return params[n]; }
    public Variable[] parameters () { return (Variable[])params.clone(); }

    public int getNumMetrics () { return metrics.length; }
    public Variable getMetric (int n) { return metrics[n]; }
    public Variable[] metrics () { return (Variable[])metrics.clone(); }
    public Metrics getMetrics () { return stats; }

    public double[] getPredicted () { return (double[])predicted.clone(); }
    public double predict (double x) { return family.evaluate(coefs, x); }
    public String getFormula () { return family.formula(coefs); }

    /**
     * true if every parameter and prediction is a finite number
     */
    public boolean isFinite () {
        for (double c : coefs) {
            if (Double.isNaN(c) || Double.isInfinite(c))
                return false;
        }
        for (double p : predicted) {
            if (Double.isNaN(p) || Double.isInfinite(p))
                return false;
        }
        return stats.isFinite();
    }

    public String toString () {
        StringBuilder sb = new StringBuilder (getClass().getSimpleName());
        sb.append("{"+family.getId());
        for (Variable v : params) {
            sb.append(","+v.name+"="+String.format("%1$.5f", v.value));
        }
        sb.append(",MSE="+String.format("%1$.5f", stats.getMse()));
        sb.append(",R^2="+String.format("%1$.3f", stats.getR2()));
        sb.append("}");
        return sb.toString();
    }
}
