package tripod.curvefit.core;

/**
 * Raised when a token of a delimited number list is not a number. 
 * Parsing stops at the first bad token.
 */
public class NumberParseException extends Exception {
    private static final long serialVersionUID = 0x3c1f8e2a95d04b17l;

    private final String token;
    private final int index;

    public NumberParseException (String token, int index) {
        super ("Invalid value: "+token+" (token "+index+")");
        this.token = token;
        this.index = index;
    }

    public NumberParseException (String token, int index, Throwable cause) {
        this (token, index);
        initCause (cause);
    }

    /**
     * the offending token exactly as it appeared in the input
     */
    public String getToken () { return token; }

    /**
     * zero-based position of the token among all tokens
     */
    public int getIndex () { return index; }
}
