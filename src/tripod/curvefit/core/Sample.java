package tripod.curvefit.core;

import java.io.Serializable;

/**
 * POJO (x, y) sample; both sequences have the same length of at
 * least 2 and hold finite values only. The arrays are copied in and out so a sample never changes
 * once it's built.
 */
public class Sample implements Serializable {
    private static final long serialVersionUID = 0xd7d0162de412cf16l;

    public static final int MIN_SIZE = 2;

    private String name; // sample name
    private final double[] x;
    private final double[] y;

    public Sample (double[] x, double[] y) {
        this (null, x, y);
    }

    public Sample (String name, double[] x, double[] y) {
        if (x == null || y == null) {
            throw new IllegalArgumentException ("Sample requires both x and y!");
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException
                ("Number of x values ("+x.length
                 +") doesn't match number of y values ("+y.length+")!");
        }
        if (x.length < MIN_SIZE) {
            throw new IllegalArgumentException
                ("Sample contains too few pairs ("+x.length
                 +"); at least "+MIN_SIZE+" are required!");
        }
        checkFinite ("x", x);
        checkFinite ("y", y);
        this.name = name;
        this.x = (double[])x.clone();
        this.y = (double[])y.clone();
    }

    static void checkFinite (String axis, double[] values) {
        for (int i = 0; i < values.length; ++i) {
            if (Double.isNaN(values[i]) || Double.isInfinite(values[i])) {
                throw new IllegalArgumentException
                    ("Sample "+axis+"["+i+"] is not a finite number: "
                     +values[i]+"!");
            }
        }
    }

    /**
     * Parse x and y from delimited text, see {@link NumberParser}.
     */
    public static Sample parse (String xText, String yText) 
        throws NumberParseException {
        return new Sample (NumberParser.parse(xText), 
                           NumberParser.parse(yText));
    }

    public Sample setName (String name) {
        this.name = name;
        return this;
    }
    public String getName () { return name; }

    public int size () { return x.length; }
    public double getX (int i) { return x[i]; }
    public double getY (int i) { return y[i]; }

    public double[] getX () { return (double[])x.clone(); }
    public double[] getY () { return (double[])y.clone(); }

    public boolean isPositiveX () { return allPositive (x); }
    public boolean isPositiveY () { return allPositive (y); }

    static boolean allPositive (double[] values) {
        for (double v : values) {
            if (!(v > 0.)) 
                return false;
        }
        return true;
    }

    public String toString () { 
        return name != null ? name : "Sample{n="+x.length+"}"; 
    }
}
