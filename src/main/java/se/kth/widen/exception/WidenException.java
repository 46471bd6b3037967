package se.kth.widen.exception;

/**
 * Base exception for errors raised while widening conflicts.
 *
 * @author Simon Larsén
 */
public abstract class WidenException extends RuntimeException {
    public WidenException(String s) {
        super(s);
    }

    public WidenException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
