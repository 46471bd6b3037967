package se.kth.widen.exception;

/**
 * Thrown when the line-based merge cannot produce a result.
 *
 * @author Simon Larsén
 */
public class MergeException extends WidenException {
    public MergeException(String s) {
        super(s);
    }

    public MergeException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
