package se.kth.widen.util;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A wrapper around an SLF4J logger whose messages are only built when the level is enabled.
 *
 * @author Simon Larsén
 */
public class LazyLogger {
    private final Logger logger;

    public LazyLogger(Class<?> cls) {
        logger = LoggerFactory.getLogger(cls);
    }

    public void debug(Supplier<String> messageSupplier) {
        if (logger.isDebugEnabled()) {
            logger.debug(messageSupplier.get());
        }
    }

    public void info(Supplier<String> messageSupplier) {
        if (logger.isInfoEnabled()) {
            logger.info(messageSupplier.get());
        }
    }

    public void warn(Supplier<String> messageSupplier) {
        if (logger.isWarnEnabled()) {
            logger.warn(messageSupplier.get());
        }
    }

    public void warn(Supplier<String> messageSupplier, Throwable cause) {
        if (logger.isWarnEnabled()) {
            logger.warn(messageSupplier.get(), cause);
        }
    }

    public void error(Supplier<String> messageSupplier) {
        if (logger.isErrorEnabled()) {
            logger.error(messageSupplier.get());
        }
    }
}
