package se.kth.widen.exception;

/**
 * Thrown when a parser cannot be configured for a language, either because no grammar is
 * registered for it or because the grammar was rejected by the parser.
 */
public class GrammarException extends WidenException {
    public GrammarException(String s) {
        super(s);
    }

    public GrammarException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
