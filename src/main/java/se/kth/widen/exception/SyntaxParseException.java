package se.kth.widen.exception;

/** Thrown when a configured parser fails to produce a syntax tree. */
public class SyntaxParseException extends WidenException {
    public SyntaxParseException(String s) {
        super(s);
    }

    public SyntaxParseException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
