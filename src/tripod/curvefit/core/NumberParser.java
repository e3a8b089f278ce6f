package tripod.curvefit.core;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses free text of numbers separated by commas, semicolons,
 * whitespace or newlines in any combination, e.g.,
 *
 *    1, 2
 *    3 4;5
 *
 * yields {1, 2, 3, 4, 5}. Order and duplicates are preserved.
 */
public class NumberParser {
    // Unicode white space, so a no-break space pasted from a
    // spreadsheet separates like a plain one
    static final Pattern SEPARATORS = Pattern.compile("(?U)[,;\\s]+");
    // plain decimal notation only; no NaN, Infinity, hex or 1d/2f suffixes
    static final Pattern DECIMAL = Pattern.compile
        ("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private NumberParser () {}

    /**
     * @return the parsed values; empty if the text has no tokens
     * @throws NumberParseException for the first token that isn't a
     *  finite decimal number
     */
    public static double[] parse (String text) throws NumberParseException {
        List<Double> values = new ArrayList<Double>();
        if (text != null) {
            int index = 0;
            for (String token : SEPARATORS.split(text)) {
                if (token.length() == 0) {
                    continue; // leading separators or blank input
                }
                values.add(parseToken (token, index++));
            }
        }

        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; ++i)
            result[i] = values.get(i);
        return result;
    }

    static double parseToken (String token, int index) 
        throws NumberParseException {
        if (!DECIMAL.matcher(token).matches()) {
            throw new NumberParseException (token, index);
        }

        double value;
        try {
            value = Double.parseDouble(token);
        }
        catch (NumberFormatException ex) {
            throw new NumberParseException (token, index, ex);
        }

        if (Double.isInfinite(value)) { // e.g., 1e999
            throw new NumberParseException (token, index);
        }
        return value;
    }
}
