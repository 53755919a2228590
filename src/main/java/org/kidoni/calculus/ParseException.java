package org.kidoni.calculus;

/**
 * Malformed expression text. Carries the offending fragment and its zero-based position in the
 * text handed to the parser.
 */
public class ParseException extends ExpressionException {
    private final String fragment;
    private final int position;

    public ParseException(final String message, final String fragment, final int position) {
        super(describe(message, fragment, position));
        this.fragment = fragment;
        this.position = position;
    }

    public ParseException(final String message, final String fragment, final int position, final Throwable cause) {
        super(describe(message, fragment, position), cause);
        this.fragment = fragment;
        this.position = position;
    }

    public String getFragment() {
        return fragment;
    }

    public int getPosition() {
        return position;
    }

    private static String describe(final String message, final String fragment, final int position) {
        return message + " at position " + position + ": '" + fragment + "'";
    }
}
